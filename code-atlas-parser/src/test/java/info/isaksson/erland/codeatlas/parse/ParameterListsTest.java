package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterListsTest {

    @Test
    void splitsOnlyAtTopLevelCommas() {
        assertEquals(List.of("self", "nums: List[int]", "target=dict(a=1, b=2)", "*args", "**kw"),
                ParameterLists.split("self, nums: List[int], target=dict(a=1, b=2), *args, **kw", Language.PYTHON));
        assertEquals(List.of("a: Map<string, number>", "b = ','"),
                ParameterLists.split("a: Map<string, number>, b = ','", Language.TYPESCRIPT));
    }

    @Test
    void dropsCommentsAndTrailingCommas() {
        assertEquals(List.of("a", "b"), ParameterLists.split("\n    a,  # first\n    b,\n", Language.PYTHON));
        assertEquals(List.of("x", "y"), ParameterLists.split("x /* left */, // right\n y", Language.JAVASCRIPT));
        assertTrue(ParameterLists.split("  ", Language.JAVASCRIPT).isEmpty());
    }

    @Test
    void arrowDefaultsDoNotCloseGenerics() {
        assertEquals(List.of("f = () => 1", "g"), ParameterLists.split("f = () => 1, g", Language.JAVASCRIPT));
        assertEquals("a, b", ParameterLists.stripParens("(a, b)"));
    }
}

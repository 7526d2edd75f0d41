package info.isaksson.erland.codeatlas.annotate;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SampleInputTest {

    @Test
    void splitsAtTopLevelCommasOnly() {
        SampleInput input = SampleInput.parse("nums = [2, 7, 11, 15], target = 9, label = 'a, b'");

        assertEquals(List.of("nums", "target", "label"), List.copyOf(input.assignments().keySet()));
        assertEquals("[2, 7, 11, 15]", input.valueOf("nums"));
        assertEquals("'a, b'", input.valueOf("label"));
        assertEquals("nums = [2, 7, 11, 15], target = 9, label = 'a, b'", input.toString());
    }

    @Test
    void valuesMayContainEqualsSigns() {
        SampleInput input = SampleInput.parse("flag = a == b");
        assertEquals("a == b", input.valueOf("flag"));
    }

    @Test
    void rejectsMalformedAssignments() {
        assertThrows(IllegalArgumentException.class, () -> SampleInput.parse("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> SampleInput.parse("x.y = 1"));
        assertThrows(IllegalArgumentException.class, () -> SampleInput.parse("x = "));
        assertThrows(IllegalArgumentException.class, () -> SampleInput.parse("x == 1"));
    }

    @Test
    void emptyTextMeansNoAssignments() {
        assertTrue(SampleInput.parse("").isEmpty());
        assertTrue(SampleInput.parse(null).isEmpty());
    }

    @Test
    void mapFactoryKeepsOrderAndEquality() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("b", "2");
        values.put("a", "1");
        SampleInput input = SampleInput.of(values);

        assertEquals("b = 2, a = 1", input.toString());
        assertEquals(SampleInput.parse("b = 2, a = 1"), input);
        assertEquals(SampleInput.parse("b = 2, a = 1").hashCode(), input.hashCode());
    }
}

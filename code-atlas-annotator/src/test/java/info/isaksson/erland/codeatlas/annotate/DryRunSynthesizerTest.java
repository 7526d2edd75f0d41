package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.DryRunTrace;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DryRunSynthesizerTest {

    private final DryRunSynthesizer synthesizer = new DryRunSynthesizer();

    @Test
    void twoSumReturnsIndicesOfMatchingPair() {
        ParsedFile pf = Fixtures.fixture("sample.py");
        FunctionDef twoSum = pf.functionNamed("Solution.twoSum").orElseThrow();

        DryRunTrace trace = synthesizer
                .synthesize(pf, twoSum, SampleInput.parse("nums = [2, 7, 11, 15], target = 9"))
                .orElseThrow();

        assertEquals("Solution.twoSum", trace.function);
        assertEquals("nums = [2, 7, 11, 15], target = 9", trace.input);
        assertFalse(trace.inputInferred);
        assertFalse(trace.truncated);
        assertEquals(List.of(
                "Call Solution.twoSum with nums = [2, 7, 11, 15], target = 9",
                "Line 8: d = {}",
                "Line 9: loop over enumerate(nums) (4 items)",
                "Line 9: iteration 1: i = 0, j = 2",
                "Line 10: k = 7 (from target-j)",
                "Line 11: condition (k in d) is False, take else branch",
                "Line 14: d[2] = 0 (from i)",
                "Line 9: iteration 2: i = 1, j = 7",
                "Line 10: k = 2 (from target-j)",
                "Line 11: condition (k in d) is True",
                "Line 12: return [0, 1] (from [d[k],i])"), trace.steps);
        assertTrue(trace.lastStep().contains("return [0, 1]"));
    }

    @Test
    void noTraceWithoutInputOrDefaults() {
        ParsedFile pf = Fixtures.fixture("sample.py");
        FunctionDef twoSum = pf.functionNamed("Solution.twoSum").orElseThrow();

        assertEquals(Optional.empty(), synthesizer.synthesize(pf, twoSum, null));
    }

    @Test
    void literalDefaultsAreUsedWhenNoInputIsGiven() {
        ParsedFile pf = Fixtures.parse("area.py", String.join("\n",
                "def area(width=3, height=4):",
                "    result = width * height",
                "    return result"));

        DryRunTrace trace = synthesizer.synthesize(pf, pf.functions.get(0), null).orElseThrow();

        assertTrue(trace.inputInferred);
        assertEquals("width = 3, height = 4", trace.input);
        assertEquals("Line 2: result = 12 (from width * height)", trace.steps.get(1));
        assertEquals("Line 3: return 12 (from result)", trace.lastStep());
    }

    @Test
    void endlessLoopIsTruncated() {
        ParsedFile pf = Fixtures.parse("spin.py", String.join("\n",
                "def spin(n=0):",
                "    while True:",
                "        n += 1",
                "    return n"));

        DryRunTrace trace = new DryRunSynthesizer(10).synthesize(pf, pf.functions.get(0), null).orElseThrow();

        assertTrue(trace.truncated);
        assertEquals(11, trace.steps.size());
        assertEquals(DryRunTrace.TRUNCATED_STEP, trace.lastStep());
    }

    @Test
    void unknownCallsBecomePlaceholderSteps() {
        ParsedFile pf = Fixtures.parse("fetch.py", String.join("\n",
                "def fetch(url='http://example.org'):",
                "    body = requests.get(url)",
                "    size = 0",
                "    return size"));

        DryRunTrace trace = synthesizer.synthesize(pf, pf.functions.get(0), null).orElseThrow();

        assertEquals("Line 2: body = requests.get(url)" + TraceWalker.PLACEHOLDER_SUFFIX, trace.steps.get(1));
        assertEquals("Line 4: return 0 (from size)", trace.lastStep());
    }

    @Test
    void functionWithoutReturnEndsAtLastLine() {
        ParsedFile pf = Fixtures.parse("show.py", String.join("\n",
                "def show(items=[1, 2]):",
                "    for item in items:",
                "        print(item)"));

        DryRunTrace trace = synthesizer.synthesize(pf, pf.functions.get(0), null).orElseThrow();

        assertEquals(List.of(
                "Call show with items = [1, 2]",
                "Line 2: loop over items (2 items)",
                "Line 2: iteration 1: item = 1",
                "Line 3: print -> 1",
                "Line 2: iteration 2: item = 2",
                "Line 3: print -> 2",
                "Line 2: loop finished after 2 iterations",
                "Line 3: end of function, returns None"), trace.steps);
    }

    @Test
    void scriptTwoSumWithMap() {
        ParsedFile pf = Fixtures.parse("two-sum.js", String.join("\n",
                "function twoSum(nums, target) {",
                "  const seen = new Map();",
                "  for (let i = 0; i < nums.length; i++) {",
                "    const need = target - nums[i];",
                "    if (seen.has(need)) {",
                "      return [seen.get(need), i];",
                "    }",
                "    seen.set(nums[i], i);",
                "  }",
                "  return [];",
                "}"));

        DryRunTrace trace = synthesizer
                .synthesize(pf, pf.functions.get(0), SampleInput.parse("nums = [3, 2, 4], target = 6"))
                .orElseThrow();

        assertFalse(trace.truncated);
        assertTrue(trace.lastStep().startsWith("Line 6: return [1, 2]"), trace.lastStep());
    }

    @Test
    void deeplyNestedFunctionsAreAboveTheCeiling() {
        ParsedFile pf = Fixtures.parse("deep.py", String.join("\n",
                "def deep(a=1):",
                "    if a:",
                "        if a:",
                "            if a:",
                "                if a:",
                "                    if a:",
                "                        return a",
                "    return 0"));

        assertTrue(synthesizer.synthesize(pf, pf.functions.get(0), null).isEmpty());
    }

    @Test
    void synthesizeAllSkipsFunctionsWithoutInput() {
        ParsedFile pf = Fixtures.parse("two.py", String.join("\n",
                "def first(x):",
                "    return x",
                "",
                "def second(y=2):",
                "    return y * 2"));

        List<DryRunTrace> traces = synthesizer.synthesizeAll(pf, Map.of());

        assertEquals(1, traces.size());
        assertEquals("second", traces.get(0).function);
        assertEquals("Line 5: return 4 (from y * 2)", traces.get(0).lastStep());
    }

    @Test
    void selfDoublingStringStopsAtTheStepBound() {
        ParsedFile pf = Fixtures.parse("grow.py", String.join("\n",
                "def f(s='ab'):",
                "    while True:",
                "        s = s + s"));

        DryRunTrace trace = new DryRunSynthesizer(200).synthesize(pf, pf.functions.get(0), null).orElseThrow();

        assertTrue(trace.truncated);
        assertEquals(DryRunTrace.TRUNCATED_STEP, trace.lastStep());
        assertTrue(trace.steps.stream().allMatch(step -> step.length() < 20_000));
    }

    @Test
    void rejectsNonPositiveStepBound() {
        assertThrows(IllegalArgumentException.class, () -> new DryRunSynthesizer(0));
    }
}

package info.isaksson.erland.codeatlas;

import info.isaksson.erland.codeatlas.annotate.SampleInput;
import info.isaksson.erland.codeatlas.core.CodeAtlasOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CliArgsTest {

    @Test
    void parsesEveryFlag() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "repo",
                "--output", "out/atlas.md",
                "--exclude", "tests/**",
                "--exclude=**/vendor/**",
                "--name", "demo",
                "--write-json", "out",
                "--threads", "3",
                "--max-trace-steps", "50",
                "--dry-run", "no",
                "--sample", "app/solution.py#Solution.twoSum=nums = [2, 7], target = 9",
                "--fail-on-degraded", "yes"
        });

        assertEquals("repo", a.source);
        assertEquals("out/atlas.md", a.output);
        assertEquals(List.of("tests/**", "**/vendor/**"), a.excludes);
        assertEquals("demo", a.name);
        assertEquals("out", a.writeJson);
        assertEquals(3, a.threads);
        assertEquals(50, a.maxTraceSteps);
        assertFalse(a.dryRun);
        assertTrue(a.failOnDegraded);
        assertEquals(1, a.samples.size());
        assertEquals("app/solution.py", a.samples.get(0).path);
        assertEquals("Solution.twoSum", a.samples.get(0).function);
        assertEquals("[2, 7]", a.samples.get(0).input.valueOf("nums"));
    }

    @Test
    void optionsMirrorTheFlags() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "--source", "repo", "--threads", "2", "--sample", "a.py#f=x = 1"
        });
        CodeAtlasOptions o = Main.toCoreOptions(a, "repo");

        assertEquals("repo", o.projectName);
        assertEquals(2, o.parallelism);
        assertTrue(o.includeDryRun);
        assertEquals(200, o.maxTraceSteps);
        assertEquals(SampleInput.parse("x = 1"), o.sampleInputs.get(CodeAtlasOptions.sampleKey("a.py", "f")));
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--max-trace-steps", "lots"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--sample", "#f=x = 1"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--sample", "a.py#=x = 1"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--sample", "a.py#f=x == 1"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a", "b"}));
    }
}

package info.isaksson.erland.codeatlas;

import info.isaksson.erland.codeatlas.ir.AtlasJson;
import info.isaksson.erland.codeatlas.ir.AtlasSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @Test
    void writesReportAndJsonForTheMiniSample(@TempDir Path tmp) throws Exception {
        Path outDir = tmp.resolve("out");

        int code = Main.run(new String[] {
                "--source", TestRepoPaths.resolveSamplesMini().toString(),
                "--output", outDir.toString(),
                "--write-json", outDir.toString(),
                "--threads", "2",
                "--sample", "app/solution.py#Solution.twoSum=nums = [2, 7, 11, 15], target = 9"
        });
        assertEquals(0, code);

        Path report = outDir.resolve("atlas.md");
        assertTrue(Files.exists(report), "report must be written: " + report);
        String md = Files.readString(report);
        assertTrue(md.startsWith("# mini code atlas\n"));
        assertTrue(md.contains("Line 12: return [0, 1] (from [d[k],i])"));

        Path json = outDir.resolve("atlas.json");
        AtlasSnapshot snapshot = AtlasJson.read(json);
        assertEquals("mini", snapshot.projectName);
        assertEquals(4, snapshot.files.size());
        assertEquals("app/helpers.py", snapshot.files.get(0).file.path);
    }

    @Test
    void reportFileNameCanBeGivenDirectly(@TempDir Path tmp) throws Exception {
        Path report = tmp.resolve("docs/atlas-of-mini.md");

        int code = Main.run(new String[] {
                TestRepoPaths.resolveSamplesMini().toString(),
                "--output", report.toString(),
                "--name", "Mini",
                "--dry-run", "false"
        });
        assertEquals(0, code);
        assertTrue(Files.readString(report).startsWith("# Mini code atlas\n"));
    }

    @Test
    void degradedParsesFailTheRunWhenRequested(@TempDir Path tmp) throws Exception {
        Path src = Files.createDirectories(tmp.resolve("src"));
        Files.writeString(src.resolve("App.tsx"), "export function App() {\n  return null;\n}\n");

        String[] base = {"--source", src.toString(), "--output", tmp.resolve("out").toString()};
        assertEquals(0, Main.run(base));
        assertEquals(3, Main.run(new String[] {
                "--source", src.toString(),
                "--output", tmp.resolve("out").toString(),
                "--fail-on-degraded", "true"
        }));
    }

    @Test
    void folderWithoutSourcesIsAnAnalysisFailure(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("README.md"), "# nothing\n");
        assertEquals(2, Main.run(new String[] {"--source", tmp.toString(), "--output", tmp.resolve("out").toString()}));
    }

    @Test
    void usageErrorsReturnOne(@TempDir Path tmp) {
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--bogus"}));
        assertEquals(1, Main.run(new String[] {"--source"}));
        assertEquals(1, Main.run(new String[] {"--source", tmp.resolve("missing").toString()}));
        assertEquals(1, Main.run(new String[] {"--source", tmp.toString(), "--threads", "0"}));
        assertEquals(1, Main.run(new String[] {"--source", tmp.toString(), "--sample", "no-function-here"}));
        assertEquals(1, Main.run(new String[] {"--source", tmp.toString(), "--dry-run", "maybe"}));
    }

    @Test
    void helpReturnsZero() {
        assertEquals(0, Main.run(new String[] {"--help"}));
    }
}

package info.isaksson.erland.codeatlas.report;

import info.isaksson.erland.codeatlas.annotate.SampleInput;
import info.isaksson.erland.codeatlas.core.CodeAtlasOptions;
import info.isaksson.erland.codeatlas.core.CodeAtlasResult;
import info.isaksson.erland.codeatlas.core.CodeAtlasService;
import info.isaksson.erland.codeatlas.ir.DryRunTrace;
import info.isaksson.erland.codeatlas.ir.SourceUnit;
import info.isaksson.erland.codeatlas.parse.ParserRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MarkdownReportWriterTest {

    private static final String AREA = """
            def area(w=3, h=4):
                \"\"\"Rectangle area.\"\"\"
                result = w * h
                return result


            def scale(shape, factor):
                return shape * factor
            """;

    private static final String CLIENT = """
            import { area } from './geometry';

            /** Thin wrapper. */
            export class Client extends Base {
              fetch(url) {
                return url || 'none';
              }
            }
            """;

    private static CodeAtlasResult analyze(CodeAtlasOptions options) {
        List<SourceUnit> units = List.of(
                SourceUnit.of("src/geometry.py", AREA),
                SourceUnit.of("web/client.js", CLIENT));
        return new CodeAtlasService(ParserRegistry.patternsOnly()).analyze(units, options);
    }

    @Test
    void documentHasEverySectionInOrder() {
        CodeAtlasOptions options = new CodeAtlasOptions();
        options.projectName = "demo";
        String md = MarkdownReportWriter.render(analyze(options));

        assertTrue(md.startsWith("# demo code atlas\n\n## Overview\n"));
        int previous = -1;
        for (String heading : List.of("## Overview", "## Architecture", "## Graph statistics", "## Folder structure",
                "## Workflows", "## Modules", "## Warnings")) {
            int at = md.indexOf("\n" + heading + "\n");
            if (heading.equals("## Overview")) at = md.indexOf(heading);
            assertTrue(at > previous, heading + " missing or out of order");
            previous = at;
        }
        assertTrue(md.contains("```mermaid\ngraph TD\n"));
        assertTrue(md.contains("| Functions | 3 |"));
        assertTrue(md.contains("- Files analysed: **2**\n  - python: **1**\n  - javascript: **1**\n"));
    }

    @Test
    void modulesListDeclarationsLinesAndDryRuns() {
        String md = MarkdownReportWriter.render(analyze(null));

        assertTrue(md.contains("### `src/geometry.py`"));
        assertTrue(md.contains("- Parse mode: fallback (UNSUPPORTED_DIALECT)"));
        assertTrue(md.contains("- `area(w=3, h=4)` lines 1-4\n  - Rectangle area.\n"));
        assertTrue(md.contains("- `Client` extends `Base` lines 4-8\n  - Methods: `fetch`\n  - Thin wrapper.\n"));
        assertTrue(md.contains("  - `./geometry` (area)\n"));
        assertTrue(md.contains("| 3 | Variable assignment | Variable assignment in function area: result = w * h |"));
        assertTrue(md.contains("`area` (input inferred from defaults)\n\n```text\nCall area with w = 3, h = 4\n"));
        assertTrue(md.contains("`scale`\n\n```text\n" + DryRunTrace.NO_TRACE_MESSAGE + "\n```\n"));
    }

    @Test
    void pipesInExplanationsAreEscaped() {
        String md = MarkdownReportWriter.render(analyze(null));
        assertTrue(md.contains("return url \\|\\| 'none'"));
    }

    @Test
    void folderStructureIsATree() {
        String md = MarkdownReportWriter.render(analyze(null));
        assertTrue(md.contains("## Folder structure\n\n```\nsrc/\n  geometry.py\nweb/\n  client.js\n```\n"));
    }

    @Test
    void warningsSectionListsFindings() {
        CodeAtlasOptions options = new CodeAtlasOptions()
                .withSample("src/geometry.py", "missing", SampleInput.parse("x = 1"));
        String md = MarkdownReportWriter.render(analyze(options));

        String warnings = md.substring(md.indexOf("## Warnings"));
        assertTrue(warnings.contains("- `PARSE_DEGRADED` Parsed with the fallback scanner (path=src/geometry.py;reason=UNSUPPORTED_DIALECT;)"));
        assertTrue(warnings.contains("- `TRACE_UNAVAILABLE` Sample input names no known function (sample=src/geometry.py#missing;)"));
    }

    @Test
    void writesTheSameBytesTwice(@TempDir Path dir) throws Exception {
        Path a = dir.resolve("out/a.md");
        Path b = dir.resolve("b.md");
        MarkdownReportWriter.write(analyze(null), a);
        MarkdownReportWriter.write(analyze(null), b);
        assertEquals(Files.readString(a, StandardCharsets.UTF_8), Files.readString(b, StandardCharsets.UTF_8));
    }
}

package info.isaksson.erland.codeatlas.core;

import info.isaksson.erland.codeatlas.annotate.DryRunSynthesizer;
import info.isaksson.erland.codeatlas.annotate.LineClassifier;
import info.isaksson.erland.codeatlas.annotate.SampleInput;
import info.isaksson.erland.codeatlas.ir.AnalysisWarning;
import info.isaksson.erland.codeatlas.ir.AtlasJson;
import info.isaksson.erland.codeatlas.ir.DegradationReason;
import info.isaksson.erland.codeatlas.ir.DryRunTrace;
import info.isaksson.erland.codeatlas.ir.FileAnalysis;
import info.isaksson.erland.codeatlas.ir.InvalidInputException;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.LineCategory;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import info.isaksson.erland.codeatlas.ir.SourceUnit;
import info.isaksson.erland.codeatlas.parse.ParserRegistry;
import info.isaksson.erland.codeatlas.parse.SourceParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CodeAtlasServiceTest {

    private static final String SOLUTION = "app/solution.py";

    private static List<SourceUnit> miniUnits() {
        List<SourceUnit> units = new ArrayList<>();
        for (String p : List.of("app/helpers.py", SOLUTION, "web/server.js", "web/shapes.ts")) {
            units.add(SourceUnit.of(p, SamplePaths.read(p)));
        }
        return units;
    }

    private static CodeAtlasService patternsOnly() {
        return new CodeAtlasService(ParserRegistry.patternsOnly());
    }

    private static List<String> codes(CodeAtlasResult result) {
        return result.warnings.stream().map(w -> w.code).collect(Collectors.toList());
    }

    @Test
    void suppliedSampleInputProducesTheTwoSumTrace() {
        CodeAtlasOptions options = new CodeAtlasOptions()
                .withSample(SOLUTION, "Solution.twoSum", SampleInput.parse("nums = [2, 7, 11, 15], target = 9"));

        CodeAtlasResult result = patternsOnly().analyze(List.of(SourceUnit.of(SOLUTION, SamplePaths.read(SOLUTION))), options);

        FileAnalysis solution = result.file(SOLUTION).orElseThrow();
        DryRunTrace trace = solution.traceFor("Solution.twoSum").orElseThrow();
        assertFalse(trace.inputInferred);
        assertFalse(trace.truncated);
        assertEquals("Call Solution.twoSum with nums = [2, 7, 11, 15], target = 9", trace.steps.get(0));
        assertEquals("Line 12: return [0, 1] (from [d[k],i])", trace.lastStep());
        assertFalse(codes(result).contains(AnalysisWarning.TRACE_UNAVAILABLE));
    }

    @Test
    void functionsWithoutInputShowTheApology() {
        CodeAtlasResult result = patternsOnly().analyze(List.of(SourceUnit.of(SOLUTION, SamplePaths.read(SOLUTION))), null);

        FileAnalysis solution = result.file(SOLUTION).orElseThrow();
        assertTrue(solution.traces.isEmpty());
        assertEquals(DryRunTrace.NO_TRACE_MESSAGE, solution.dryRunText("Solution.twoSum"));
        assertFalse(codes(result).contains(AnalysisWarning.TRACE_UNAVAILABLE));
    }

    @Test
    void truncatedTracesAndUnknownSamplesAreWarned() {
        CodeAtlasOptions options = new CodeAtlasOptions()
                .withSample(SOLUTION, "Solution.twoSum", SampleInput.parse("nums = [2, 7, 11, 15], target = 9"))
                .withSample(SOLUTION, "Solution.threeSum", SampleInput.parse("nums = [1]"));
        options.maxTraceSteps = 3;

        CodeAtlasResult result = patternsOnly().analyze(List.of(SourceUnit.of(SOLUTION, SamplePaths.read(SOLUTION))), options);

        DryRunTrace trace = result.file(SOLUTION).orElseThrow().traceFor("Solution.twoSum").orElseThrow();
        assertTrue(trace.truncated);
        assertEquals(DryRunTrace.TRUNCATED_STEP, trace.lastStep());

        AnalysisWarning truncated = result.warnings.stream()
                .filter(w -> w.code.equals(AnalysisWarning.TRACE_TRUNCATED)).findFirst().orElseThrow();
        assertEquals("Solution.twoSum", truncated.context.get("function"));
        AnalysisWarning unknown = result.warnings.stream()
                .filter(w -> w.code.equals(AnalysisWarning.TRACE_UNAVAILABLE)).findFirst().orElseThrow();
        assertEquals(SOLUTION + "#Solution.threeSum", unknown.context.get("sample"));
    }

    @Test
    void samplesThatAreNotLiteralsLeaveNoTrace() {
        CodeAtlasOptions options = new CodeAtlasOptions()
                .withSample(SOLUTION, "Solution.twoSum", SampleInput.parse("nums = load(), target = 9"));

        CodeAtlasResult result = patternsOnly().analyze(List.of(SourceUnit.of(SOLUTION, SamplePaths.read(SOLUTION))), options);

        assertTrue(result.file(SOLUTION).orElseThrow().traces.isEmpty());
        assertTrue(codes(result).contains(AnalysisWarning.TRACE_UNAVAILABLE));
    }

    @Test
    void dryRunCanBeSwitchedOff() {
        CodeAtlasOptions options = new CodeAtlasOptions()
                .withSample(SOLUTION, "Solution.twoSum", SampleInput.parse("nums = [3, 3], target = 6"));
        options.includeDryRun = false;

        CodeAtlasResult result = patternsOnly().analyze(miniUnits(), options);

        for (FileAnalysis f : result.files) assertTrue(f.traces.isEmpty(), f.file.path);
        assertFalse(codes(result).contains(AnalysisWarning.TRACE_UNAVAILABLE));
    }

    @Test
    void resultIsIndependentOfParallelismAndInputOrder() throws Exception {
        CodeAtlasOptions serial = new CodeAtlasOptions();
        serial.parallelism = 1;
        CodeAtlasOptions parallel = new CodeAtlasOptions();
        parallel.parallelism = 8;

        List<SourceUnit> shuffled = miniUnits();
        Collections.reverse(shuffled);

        CodeAtlasResult a = patternsOnly().analyze(miniUnits(), serial);
        CodeAtlasResult b = patternsOnly().analyze(shuffled, parallel);

        assertEquals(a.snapshot(), b.snapshot());
        assertEquals(a.architectureDiagram, b.architectureDiagram);
        assertEquals(a.workflows, b.workflows);
        assertEquals(AtlasJson.toJsonString(a.snapshot()), AtlasJson.toJsonString(b.snapshot()));
        assertEquals(List.of("app/helpers.py", SOLUTION, "web/server.js", "web/shapes.ts"),
                a.files.stream().map(f -> f.file.path).collect(Collectors.toList()));
    }

    @Test
    void buildsGraphAndDiagramsForTheMiniSample() {
        CodeAtlasResult result = patternsOnly().analyze(miniUnits(), null);

        assertEquals("project", result.projectName);
        assertEquals(4, result.stats.files);
        assertEquals(3, result.stats.classes);
        assertEquals(9, result.stats.functions);
        assertEquals(4, result.stats.modules);
        assertEquals(12, result.stats.definesEdges);
        assertEquals(4, result.stats.importsEdges);
        assertTrue(result.architectureDiagram.startsWith("graph TD\n"));
        assertEquals(List.of("app/helpers.py", SOLUTION, "web/server.js", "web/shapes.ts"), new ArrayList<>(result.workflows.keySet()));
        assertTrue(result.workflows.get(SOLUTION).startsWith("flowchart TD\n"));

        FileAnalysis server = result.file("web/server.js").orElseThrow();
        assertEquals(LineCategory.ASSIGNMENT, server.annotations.get(0).category);
    }

    @Test
    void fallbackParsesAreReportedAsDegraded() {
        CodeAtlasResult result = patternsOnly().analyze(miniUnits(), null);

        assertEquals(4, result.degradedFileCount());
        List<AnalysisWarning> degraded = result.warnings.stream()
                .filter(w -> w.code.equals(AnalysisWarning.PARSE_DEGRADED)).collect(Collectors.toList());
        assertEquals(4, degraded.size());
        assertEquals("app/helpers.py", degraded.get(0).context.get("path"));
    }

    @Test
    void failingParserDegradesOnlyThatFile() {
        SourceParser broken = new SourceParser() {
            @Override public Language language() {
                return Language.PYTHON;
            }

            @Override public ParsedFile parse(String path, String text) {
                throw new IllegalStateException("boom");
            }
        };
        CodeAtlasService service = new CodeAtlasService(ParserRegistry.patternsOnly().with(broken));

        CodeAtlasResult result = service.analyze(miniUnits(), null);

        ParsedFile solution = result.file(SOLUTION).orElseThrow().file;
        assertTrue(solution.degraded);
        assertEquals(DegradationReason.EXTRACTION_FAILURE, solution.degradationReason);
        assertTrue(solution.functions.isEmpty());
        assertFalse(solution.lines.isEmpty());
        assertFalse(result.file("web/shapes.ts").orElseThrow().file.functions.isEmpty());
        assertEquals(2, result.warnings.stream().filter(w -> w.code.equals(AnalysisWarning.WORKER_FAILED)).count());
        assertTrue(result.graph.containsNode("file:" + SOLUTION));
    }

    @Test
    void oversizedHexLiteralsDoNotAbortTheRun() {
        List<SourceUnit> units = List.of(
                SourceUnit.of("ok.py", "def add(a=1, b=2):\n    return a + b\n"),
                SourceUnit.of("big.py", "def mask():\n    m = 0xFFFFFFFFFFFFFFFFFF\n    return m\n"),
                SourceUnit.of("bare.py", "def empty():\n    x = 0x\n    return x\n"),
                SourceUnit.of("big.js", "function mask() {\n  const m = 0xFFFFFFFFFFFFFFFFFF;\n  return m;\n}\n"));

        CodeAtlasResult result = patternsOnly().analyze(units, null);

        assertEquals(4, result.files.size());
        assertTrue(result.file("ok.py").orElseThrow().traceFor("add").isPresent());
        for (String path : List.of("big.py", "bare.py", "big.js")) {
            FileAnalysis file = result.file(path).orElseThrow();
            assertEquals(1, file.file.functions.size(), path);
            assertFalse(file.annotations.isEmpty(), path);
        }
        assertFalse(codes(result).contains(AnalysisWarning.WORKER_FAILED));
    }

    @Test
    void failingClassifierDegradesOnlyThatFile() {
        CodeAtlasService service = new CodeAtlasService(ParserRegistry.patternsOnly(),
                pf -> {
                    if (pf.path.equals(SOLUTION)) throw new IllegalStateException("boom");
                    return new LineClassifier().classify(pf);
                },
                DryRunSynthesizer::synthesize);

        CodeAtlasResult result = service.analyze(miniUnits(), null);

        assertEquals(4, result.files.size());
        assertTrue(result.file(SOLUTION).orElseThrow().annotations.isEmpty());
        assertFalse(result.file(SOLUTION).orElseThrow().file.functions.isEmpty());
        assertFalse(result.file("app/helpers.py").orElseThrow().annotations.isEmpty());
        assertFalse(result.file("web/server.js").orElseThrow().annotations.isEmpty());
        List<AnalysisWarning> failed = result.warnings.stream()
                .filter(w -> w.code.equals(AnalysisWarning.WORKER_FAILED)).collect(Collectors.toList());
        assertEquals(1, failed.size());
        assertEquals(SOLUTION, failed.get(0).context.get("path"));
    }

    @Test
    void failingDryRunSkipsOnlyThatTrace() {
        List<SourceUnit> units = List.of(
                SourceUnit.of("calc.py", "def add(a=1, b=2):\n    return a + b\n\n\ndef sub(a=5, b=2):\n    return a - b\n"),
                SourceUnit.of("calc.js", "function mul(a = 2, b = 3) {\n  return a * b;\n}\n"));
        CodeAtlasService service = new CodeAtlasService(ParserRegistry.patternsOnly(),
                new LineClassifier()::classify,
                (synthesizer, pf, f, input) -> {
                    if (f.name.equals("sub")) throw new TraceFailure("too deep");
                    return synthesizer.synthesize(pf, f, input);
                });

        CodeAtlasResult result = service.analyze(units, null);

        assertEquals(2, result.files.size());
        FileAnalysis py = result.file("calc.py").orElseThrow();
        assertTrue(py.traceFor("add").isPresent());
        assertFalse(py.traceFor("sub").isPresent());
        assertFalse(py.annotations.isEmpty());
        assertTrue(result.file("calc.js").orElseThrow().traceFor("mul").isPresent());
        List<AnalysisWarning> failed = result.warnings.stream()
                .filter(w -> w.code.equals(AnalysisWarning.WORKER_FAILED)).collect(Collectors.toList());
        assertEquals(1, failed.size());
        assertEquals("calc.py", failed.get(0).context.get("path"));
        assertEquals("sub", failed.get(0).context.get("function"));
    }

    private static final class TraceFailure extends RuntimeException {
        TraceFailure(String message) {
            super(message);
        }
    }

    @Test
    void languageIsDerivedFromThePathWhenMissing() {
        CodeAtlasResult result = patternsOnly().analyze(List.of(new SourceUnit("x.py", null, "x = 1\n")), null);
        assertEquals(Language.PYTHON, result.files.get(0).file.language);
    }

    @Test
    void rejectsInvalidInput() {
        CodeAtlasService service = patternsOnly();
        assertThrows(InvalidInputException.class, () -> service.analyze(null, null));
        assertThrows(InvalidInputException.class, () -> service.analyze(List.of(), null));
        assertThrows(InvalidInputException.class, () -> service.analyze(Collections.singletonList(null), null));
        assertThrows(InvalidInputException.class, () -> service.analyze(List.of(new SourceUnit(" ", Language.PYTHON, "")), null));
        assertThrows(InvalidInputException.class, () -> service.analyze(
                List.of(SourceUnit.of("a.py", "x = 1"), SourceUnit.of("a.py", "y = 2")), null));
        assertThrows(InvalidInputException.class, () -> service.analyze(List.of(new SourceUnit("a.py", Language.JAVASCRIPT, "")), null));
        assertThrows(InvalidInputException.class, () -> service.analyze(List.of(new SourceUnit("README.md", null, "")), null));
    }

    @Test
    void analyzesADirectory() throws Exception {
        CodeAtlasResult result = new CodeAtlasService().analyzeDirectory(SamplePaths.mini(), List.of(), null);

        assertEquals(List.of("app/helpers.py", SOLUTION, "web/server.js", "web/shapes.ts"),
                result.files.stream().map(f -> f.file.path).collect(Collectors.toList()));
        assertEquals(9, result.stats.functions);
    }

    @Test
    void excludedDirectoriesAreSkipped() throws Exception {
        CodeAtlasResult result = patternsOnly().analyzeDirectory(SamplePaths.mini(), List.of("web/**"), null);
        assertEquals(List.of("app/helpers.py", SOLUTION),
                result.files.stream().map(f -> f.file.path).collect(Collectors.toList()));
    }

    @Test
    void directoryWithoutSourcesIsInvalidInput(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("notes.txt"), "nothing to see");
        assertThrows(InvalidInputException.class, () -> patternsOnly().analyzeDirectory(dir, List.of(), null));
    }
}

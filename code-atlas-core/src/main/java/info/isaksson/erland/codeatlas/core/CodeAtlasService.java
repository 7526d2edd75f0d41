package info.isaksson.erland.codeatlas.core;

import info.isaksson.erland.codeatlas.annotate.DryRunSynthesizer;
import info.isaksson.erland.codeatlas.annotate.LineClassifier;
import info.isaksson.erland.codeatlas.annotate.SampleInput;
import info.isaksson.erland.codeatlas.graph.GraphStats;
import info.isaksson.erland.codeatlas.graph.KnowledgeGraphBuilder;
import info.isaksson.erland.codeatlas.graph.MermaidWriter;
import info.isaksson.erland.codeatlas.graph.WorkflowDiagrams;
import info.isaksson.erland.codeatlas.io.SourceReader;
import info.isaksson.erland.codeatlas.io.SourceScanner;
import info.isaksson.erland.codeatlas.ir.AnalysisWarning;
import info.isaksson.erland.codeatlas.ir.AnalysisWarnings;
import info.isaksson.erland.codeatlas.ir.DryRunTrace;
import info.isaksson.erland.codeatlas.ir.FileAnalysis;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.InvalidInputException;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.LineAnnotation;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import info.isaksson.erland.codeatlas.ir.SourceUnit;
import info.isaksson.erland.codeatlas.parse.ParserRegistry;
import info.isaksson.erland.codeatlas.parse.SourceLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Core API for analysing a set of source files.
 *
 * <p>The per-file stage (parse, classify, dry-run) runs on a fixed thread pool with no shared
 * mutable state apart from the thread-safe warning collector. All results are joined before the
 * knowledge graph is built, and the graph builder sorts by path, so the output does not depend on
 * {@link CodeAtlasOptions#parallelism}.</p>
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class CodeAtlasService {

    private static final Logger log = LoggerFactory.getLogger(CodeAtlasService.class);

    /** Runs the dry-run synthesizer for one function. */
    interface TraceStep {
        Optional<DryRunTrace> trace(DryRunSynthesizer synthesizer, ParsedFile file, FunctionDef function, SampleInput input);
    }

    private final ParserRegistry parsers;
    private final Function<ParsedFile, List<LineAnnotation>> classifier;
    private final TraceStep traceStep;
    private final KnowledgeGraphBuilder graphBuilder = new KnowledgeGraphBuilder();

    public CodeAtlasService() {
        this(ParserRegistry.defaults());
    }

    public CodeAtlasService(ParserRegistry parsers) {
        this(parsers, new LineClassifier()::classify, DryRunSynthesizer::synthesize);
    }

    CodeAtlasService(ParserRegistry parsers, Function<ParsedFile, List<LineAnnotation>> classifier, TraceStep traceStep) {
        if (parsers == null) throw new IllegalArgumentException("parsers must not be null");
        this.parsers = parsers;
        this.classifier = classifier;
        this.traceStep = traceStep;
    }

    /** Scans {@code sourceRoot}, reads every supported file and analyses them. */
    public CodeAtlasResult analyzeDirectory(Path sourceRoot, List<String> excludeGlobs, CodeAtlasOptions options) throws IOException {
        if (sourceRoot == null) throw new IllegalArgumentException("sourceRoot must not be null");
        List<Path> files = SourceScanner.scan(sourceRoot, excludeGlobs == null ? List.of() : excludeGlobs);
        if (files.isEmpty()) {
            throw new InvalidInputException("No Python, JavaScript or TypeScript files found under " + sourceRoot);
        }
        log.info("Found {} source files under {}", files.size(), sourceRoot);
        return analyze(SourceReader.readAll(sourceRoot, files), options);
    }

    /**
     * Analyses already-read source units.
     *
     * @throws InvalidInputException when {@code units} is null or empty, or holds a null entry, a
     *                               blank or duplicate path, or a language that does not match the
     *                               path's extension
     */
    public CodeAtlasResult analyze(List<SourceUnit> units, CodeAtlasOptions options) {
        if (options == null) options = new CodeAtlasOptions();
        List<SourceUnit> checked = validate(units);
        MermaidWriter writer = new MermaidWriter(options.diagramDirection);
        AnalysisWarnings warnings = new AnalysisWarnings();
        DryRunSynthesizer synthesizer = new DryRunSynthesizer(Math.max(1, options.maxTraceSteps));

        List<FileAnalysis> analyses = runPerFileStage(checked, options, synthesizer, warnings);
        analyses.sort(Comparator.comparing(a -> a.file.path));
        reportUnusedSamples(analyses, options, warnings);

        List<ParsedFile> parsed = new ArrayList<>(analyses.size());
        for (FileAnalysis a : analyses) parsed.add(a.file);
        KnowledgeGraph graph = graphBuilder.build(parsed);
        GraphStats stats = GraphStats.of(graph);
        String architecture = writer.render(graph);
        Map<String, String> workflows = new WorkflowDiagrams(writer).forAllFiles(graph);

        List<AnalysisWarning> sortedWarnings = warnings.toDeterministicList();
        log.info("Analysed {} files ({}), {} warnings", analyses.size(), stats, sortedWarnings.size());
        return new CodeAtlasResult(options.projectName, analyses, graph, architecture, workflows, stats, sortedWarnings);
    }

    private static List<SourceUnit> validate(List<SourceUnit> units) {
        if (units == null || units.isEmpty()) throw new InvalidInputException("No source files to analyse");
        List<SourceUnit> out = new ArrayList<>(units.size());
        Set<String> paths = new HashSet<>();
        for (SourceUnit u : units) {
            if (u == null) throw new InvalidInputException("Source list contains a null entry");
            if (u.path == null || u.path.isBlank()) throw new InvalidInputException("Source path must not be blank");
            if (!paths.add(u.path)) throw new InvalidInputException("Duplicate source path: " + u.path);
            Optional<Language> byExtension = Language.fromPath(u.path);
            Language language = u.language;
            if (language == null) {
                language = byExtension.orElseThrow(() -> new InvalidInputException("Cannot tell the language of " + u.path));
            } else if (byExtension.isPresent() && byExtension.get() != language) {
                throw new InvalidInputException("Language " + language + " does not match the extension of " + u.path);
            }
            out.add(language == u.language ? u : new SourceUnit(u.path, language, u.text));
        }
        return out;
    }

    private List<FileAnalysis> runPerFileStage(List<SourceUnit> units, CodeAtlasOptions options,
                                               DryRunSynthesizer synthesizer, AnalysisWarnings warnings) {
        int threads = Math.max(1, Math.min(options.parallelism, units.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileAnalysis>> futures = new ArrayList<>(units.size());
            for (SourceUnit u : units) {
                futures.add(pool.submit(() -> analyzeFile(u, options, synthesizer, warnings)));
            }
            List<FileAnalysis> out = new ArrayList<>(units.size());
            for (Future<FileAnalysis> f : futures) {
                out.add(f.get());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis was interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Per-file analysis failed: " + e.getCause(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /** One file end to end. Never throws for file content; a failing step degrades the result. */
    FileAnalysis analyzeFile(SourceUnit unit, CodeAtlasOptions options, DryRunSynthesizer synthesizer, AnalysisWarnings warnings) {
        ParsedFile pf;
        try {
            pf = parsers.parse(unit);
        } catch (RuntimeException e) {
            log.warn("{}: parser failed unexpectedly: {}", unit.path, e.toString());
            warnings.warn(AnalysisWarning.WORKER_FAILED, "Parser failed unexpectedly: " + e, "path", unit.path);
            pf = ParsedFile.failed(unit.path, unit.language, SourceLines.split(SourceLines.normalize(unit.text)));
        }
        if (pf.degraded) {
            warnings.warn(AnalysisWarning.PARSE_DEGRADED, "Parsed with the fallback scanner",
                    "path", pf.path, "reason", String.valueOf(pf.degradationReason));
        }

        List<LineAnnotation> annotations;
        try {
            annotations = classifier.apply(pf);
        } catch (RuntimeException e) {
            log.warn("{}: line classification failed: {}", pf.path, e.toString());
            warnings.warn(AnalysisWarning.WORKER_FAILED, "Line classification failed: " + e, "path", pf.path);
            annotations = List.of();
        }

        List<DryRunTrace> traces = options.includeDryRun ? traces(pf, options, synthesizer, warnings) : List.of();
        return new FileAnalysis(pf, annotations, traces);
    }

    private List<DryRunTrace> traces(ParsedFile pf, CodeAtlasOptions options, DryRunSynthesizer synthesizer, AnalysisWarnings warnings) {
        List<DryRunTrace> out = new ArrayList<>();
        for (FunctionDef f : pf.functions) {
            String function = f.qualifiedName();
            SampleInput input = options.sampleInputs == null ? null
                    : options.sampleInputs.get(CodeAtlasOptions.sampleKey(pf.path, function));
            Optional<DryRunTrace> trace;
            try {
                trace = traceStep.trace(synthesizer, pf, f, input);
            } catch (RuntimeException e) {
                log.warn("{}: dry run of {} failed: {}", pf.path, function, e.toString());
                warnings.warn(AnalysisWarning.WORKER_FAILED, "Dry run failed: " + e, "path", pf.path, "function", function);
                continue;
            }
            if (trace.isPresent()) {
                out.add(trace.get());
                if (trace.get().truncated) {
                    warnings.warn(AnalysisWarning.TRACE_TRUNCATED, "Dry run stopped after " + synthesizer.maxSteps() + " steps",
                            "path", pf.path, "function", function);
                }
            } else if (input != null) {
                warnings.warn(AnalysisWarning.TRACE_UNAVAILABLE, "No dry run possible for the supplied sample input",
                        "path", pf.path, "function", function);
            }
        }
        return out;
    }

    private static void reportUnusedSamples(List<FileAnalysis> analyses, CodeAtlasOptions options, AnalysisWarnings warnings) {
        if (!options.includeDryRun || options.sampleInputs == null || options.sampleInputs.isEmpty()) return;
        Set<String> known = new HashSet<>();
        for (FileAnalysis a : analyses) {
            for (FunctionDef f : a.file.functions) known.add(CodeAtlasOptions.sampleKey(a.file.path, f.qualifiedName()));
        }
        for (String key : options.sampleInputs.keySet()) {
            if (!known.contains(key)) {
                warnings.warn(AnalysisWarning.TRACE_UNAVAILABLE, "Sample input names no known function", "sample", key);
            }
        }
    }
}

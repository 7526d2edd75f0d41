package info.isaksson.erland.codeatlas.core;

import info.isaksson.erland.codeatlas.annotate.DryRunSynthesizer;
import info.isaksson.erland.codeatlas.annotate.SampleInput;
import info.isaksson.erland.codeatlas.graph.MermaidWriter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for one analysis run.
 *
 * <p>This intentionally mirrors the CLI flags but in a structured form.</p>
 */
public final class CodeAtlasOptions {
    public String projectName = "project";

    /** Worker threads for the per-file stage. */
    public int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

    public boolean includeDryRun = true;
    public int maxTraceSteps = DryRunSynthesizer.DEFAULT_MAX_STEPS;

    /** Caller-supplied dry-run inputs keyed by {@link #sampleKey(String, String)}. */
    public Map<String, SampleInput> sampleInputs = new LinkedHashMap<>();

    public String diagramDirection = MermaidWriter.DEFAULT_DIRECTION;

    /** Key of {@link #sampleInputs}: {@code <path>#<qualifiedFunction>}. */
    public static String sampleKey(String path, String qualifiedFunction) {
        return path + "#" + qualifiedFunction;
    }

    public CodeAtlasOptions withSample(String path, String qualifiedFunction, SampleInput input) {
        sampleInputs.put(sampleKey(path, qualifiedFunction), input);
        return this;
    }
}

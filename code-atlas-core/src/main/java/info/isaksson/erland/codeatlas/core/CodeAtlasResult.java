package info.isaksson.erland.codeatlas.core;

import info.isaksson.erland.codeatlas.graph.GraphStats;
import info.isaksson.erland.codeatlas.ir.AnalysisWarning;
import info.isaksson.erland.codeatlas.ir.AtlasSnapshot;
import info.isaksson.erland.codeatlas.ir.FileAnalysis;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Result container for programmatic usage. */
public final class CodeAtlasResult {
    public final String projectName;

    /** Per-file analyses sorted by path. */
    public final List<FileAnalysis> files;

    public final KnowledgeGraph graph;

    /** Mermaid text of the whole graph. */
    public final String architectureDiagram;

    /** Mermaid {@code flowchart} per file path, in path order. */
    public final Map<String, String> workflows;

    public final GraphStats stats;

    /** Sorted by (code, message, context). */
    public final List<AnalysisWarning> warnings;

    CodeAtlasResult(
            String projectName,
            List<FileAnalysis> files,
            KnowledgeGraph graph,
            String architectureDiagram,
            Map<String, String> workflows,
            GraphStats stats,
            List<AnalysisWarning> warnings
    ) {
        this.projectName = projectName;
        this.files = List.copyOf(files);
        this.graph = graph;
        this.architectureDiagram = architectureDiagram;
        this.workflows = Collections.unmodifiableMap(new LinkedHashMap<>(workflows));
        this.stats = stats;
        this.warnings = List.copyOf(warnings);
    }

    public Optional<FileAnalysis> file(String path) {
        for (FileAnalysis f : files) {
            if (f.file.path.equals(path)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public int degradedFileCount() {
        int n = 0;
        for (FileAnalysis f : files) {
            if (f.file.degraded) n++;
        }
        return n;
    }

    /** The serializable part of the result (see {@code AtlasJson}). */
    public AtlasSnapshot snapshot() {
        return new AtlasSnapshot(projectName, files, graph, warnings);
    }
}

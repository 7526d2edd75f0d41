package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Everything an external consumer needs from one run: per-file analyses (path order), the knowledge
 * graph and the warnings.
 */
@JsonPropertyOrder({"schemaVersion","projectName","files","graph","warnings"})
public final class AtlasSnapshot {

    public static final String SCHEMA_VERSION = "1";

    public final String schemaVersion;
    public final String projectName;
    public final List<FileAnalysis> files;
    public final KnowledgeGraph graph;
    public final List<AnalysisWarning> warnings;

    @JsonCreator
    public AtlasSnapshot(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("projectName") String projectName,
            @JsonProperty("files") List<FileAnalysis> files,
            @JsonProperty("graph") KnowledgeGraph graph,
            @JsonProperty("warnings") List<AnalysisWarning> warnings
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.projectName = projectName == null ? "project" : projectName;
        List<FileAnalysis> sorted = new ArrayList<>(files == null ? List.of() : files);
        sorted.sort(Comparator.comparing(f -> f.file.path));
        this.files = List.copyOf(sorted);
        this.graph = graph == null ? KnowledgeGraph.empty() : graph;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public AtlasSnapshot(String projectName, List<FileAnalysis> files, KnowledgeGraph graph, List<AnalysisWarning> warnings) {
        this(SCHEMA_VERSION, projectName, files, graph, warnings);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AtlasSnapshot)) return false;
        AtlasSnapshot that = (AtlasSnapshot) o;
        return Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(projectName, that.projectName) &&
                Objects.equals(files, that.files) &&
                Objects.equals(graph, that.graph) &&
                Objects.equals(warnings, that.warnings);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, projectName, files, graph, warnings);
    }
}

package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-file output of the parallel stage: the parsed file plus its line annotations and the
 * dry-run traces that could be synthesized (in function declaration order).
 */
@JsonPropertyOrder({"file","annotations","traces"})
public final class FileAnalysis {
    public final ParsedFile file;
    public final List<LineAnnotation> annotations;
    public final List<DryRunTrace> traces;

    @JsonCreator
    public FileAnalysis(
            @JsonProperty("file") ParsedFile file,
            @JsonProperty("annotations") List<LineAnnotation> annotations,
            @JsonProperty("traces") List<DryRunTrace> traces
    ) {
        this.file = Objects.requireNonNull(file, "file");
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
        this.traces = traces == null ? List.of() : List.copyOf(traces);
    }

    public Optional<DryRunTrace> traceFor(String qualifiedFunction) {
        for (DryRunTrace t : traces) {
            if (t.function.equals(qualifiedFunction)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** The trace text, or the static apology when none could be synthesized. */
    public String dryRunText(String qualifiedFunction) {
        return traceFor(qualifiedFunction).map(DryRunTrace::asText).orElse(DryRunTrace.NO_TRACE_MESSAGE);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileAnalysis)) return false;
        FileAnalysis that = (FileAnalysis) o;
        return Objects.equals(file, that.file) &&
                Objects.equals(annotations, that.annotations) &&
                Objects.equals(traces, that.traces);
    }

    @Override public int hashCode() {
        return Objects.hash(file, annotations, traces);
    }
}

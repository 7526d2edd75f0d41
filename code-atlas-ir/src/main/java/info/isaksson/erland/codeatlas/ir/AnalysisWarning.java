package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** A non-fatal, deterministic finding produced during analysis. */
@JsonPropertyOrder({"code","message","context"})
public final class AnalysisWarning {

    public static final String PARSE_DEGRADED = "PARSE_DEGRADED";
    public static final String TRACE_TRUNCATED = "TRACE_TRUNCATED";
    public static final String TRACE_UNAVAILABLE = "TRACE_UNAVAILABLE";
    public static final String WORKER_FAILED = "WORKER_FAILED";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Structured context, key-sorted. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> context;

    @JsonCreator
    public AnalysisWarning(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("context") Map<String, String> context
    ) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new TreeMap<>(context));
        }
    }

    /** {@code k=v;} pairs in key order, used as the final sort key. */
    public String contextString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : context.entrySet()) {
            sb.append(e.getKey()).append('=').append(e.getValue()).append(';');
        }
        return sb.toString();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisWarning)) return false;
        AnalysisWarning that = (AnalysisWarning) o;
        return code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, context);
    }

    @Override public String toString() {
        return context.isEmpty() ? code + ": " + message : code + ": " + message + " " + context;
    }
}

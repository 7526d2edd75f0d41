package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A bounded, step-by-step narration of one function run on a literal sample input.
 */
@JsonPropertyOrder({"function","input","inputInferred","truncated","steps"})
public final class DryRunTrace {

    /** What callers show when no trace could be synthesized for a function. */
    public static final String NO_TRACE_MESSAGE =
            "Dry run execution trace would depend on specific inputs and application state.";

    /** Step appended when the walk hits its step bound. */
    public static final String TRUNCATED_STEP = "trace truncated";

    /** Qualified function name ({@code Owner.name} for methods). */
    public final String function;

    /** Rendered input bindings, e.g. {@code nums = [2, 7, 11, 15], target = 9}. */
    public final String input;

    /** True when the input came from literal parameter defaults rather than the caller. */
    public final boolean inputInferred;

    public final boolean truncated;
    public final List<String> steps;

    @JsonCreator
    public DryRunTrace(
            @JsonProperty("function") String function,
            @JsonProperty("input") String input,
            @JsonProperty("inputInferred") boolean inputInferred,
            @JsonProperty("truncated") boolean truncated,
            @JsonProperty("steps") List<String> steps
    ) {
        this.function = Objects.requireNonNull(function, "function");
        this.input = input == null ? "" : input;
        this.inputInferred = inputInferred;
        this.truncated = truncated;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
    }

    @JsonIgnore
    public String lastStep() {
        return steps.isEmpty() ? "" : steps.get(steps.size() - 1);
    }

    /** Steps joined by newlines, ready for a fenced block. */
    public String asText() {
        return String.join("\n", steps);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DryRunTrace)) return false;
        DryRunTrace that = (DryRunTrace) o;
        return inputInferred == that.inputInferred &&
                truncated == that.truncated &&
                Objects.equals(function, that.function) &&
                Objects.equals(input, that.input) &&
                Objects.equals(steps, that.steps);
    }

    @Override public int hashCode() {
        return Objects.hash(function, input, inputInferred, truncated, steps);
    }
}

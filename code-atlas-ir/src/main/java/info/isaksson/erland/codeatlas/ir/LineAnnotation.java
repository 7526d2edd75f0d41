package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"lineNumber","category","explanation"})
public final class LineAnnotation {
    public final int lineNumber;
    public final LineCategory category;
    public final String explanation;

    @JsonCreator
    public LineAnnotation(
            @JsonProperty("lineNumber") int lineNumber,
            @JsonProperty("category") LineCategory category,
            @JsonProperty("explanation") String explanation
    ) {
        if (lineNumber < 1) throw new IllegalArgumentException("lineNumber must be >= 1");
        this.lineNumber = lineNumber;
        this.category = category == null ? LineCategory.OTHER : category;
        this.explanation = explanation == null ? "" : explanation;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineAnnotation)) return false;
        LineAnnotation that = (LineAnnotation) o;
        return lineNumber == that.lineNumber &&
                category == that.category &&
                Objects.equals(explanation, that.explanation);
    }

    @Override public int hashCode() {
        return Objects.hash(lineNumber, category, explanation);
    }

    @Override public String toString() {
        return "Line " + lineNumber + " [" + category + "] " + explanation;
    }
}

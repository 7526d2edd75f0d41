package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"sourceId","targetId","kind"})
public final class GraphEdge {
    public final String sourceId;
    public final String targetId;
    public final EdgeKind kind;

    @JsonCreator
    public GraphEdge(
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("kind") EdgeKind kind
    ) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphEdge)) return false;
        GraphEdge that = (GraphEdge) o;
        return Objects.equals(sourceId, that.sourceId) &&
                Objects.equals(targetId, that.targetId) &&
                kind == that.kind;
    }

    @Override public int hashCode() {
        return Objects.hash(sourceId, targetId, kind);
    }

    @Override public String toString() {
        return sourceId + " -" + kind.label + "-> " + targetId;
    }
}

package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A knowledge-graph node. {@code path} is the defining file for file, class and function nodes and
 * is absent for module nodes.
 */
@JsonPropertyOrder({"id","kind","label","path"})
public final class GraphNode {
    public final String id;
    public final NodeKind kind;
    public final String label;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String path;

    @JsonCreator
    public GraphNode(
            @JsonProperty("id") String id,
            @JsonProperty("kind") NodeKind kind,
            @JsonProperty("label") String label,
            @JsonProperty("path") String path
    ) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("node id must not be blank");
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label == null ? id : label;
        this.path = path;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphNode)) return false;
        GraphNode that = (GraphNode) o;
        return Objects.equals(id, that.id) &&
                kind == that.kind &&
                Objects.equals(label, that.label) &&
                Objects.equals(path, that.path);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, label, path);
    }

    @Override public String toString() {
        return id;
    }
}

package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed multigraph of file, class, function and module nodes.
 *
 * <p>Nodes and edges keep insertion order, which is what serialization relies on for byte-stable
 * output. Every edge endpoint is a node of the same graph; the {@link Builder} refuses anything
 * else. Two edges between the same pair are allowed only when their kinds differ.</p>
 */
@JsonPropertyOrder({"nodes","edges"})
public final class KnowledgeGraph {
    public final List<GraphNode> nodes;
    public final List<GraphEdge> edges;

    private final Map<String, GraphNode> index;

    private KnowledgeGraph(Map<String, GraphNode> index, List<GraphEdge> edges) {
        this.index = Collections.unmodifiableMap(index);
        this.nodes = List.copyOf(index.values());
        this.edges = List.copyOf(edges);
    }

    /** Rebuilds (and re-validates) a graph from its serialized form. */
    @JsonCreator
    public static KnowledgeGraph of(
            @JsonProperty("nodes") List<GraphNode> nodes,
            @JsonProperty("edges") List<GraphEdge> edges
    ) {
        Builder b = builder();
        if (nodes != null) {
            for (GraphNode n : nodes) b.addNode(n);
        }
        if (edges != null) {
            for (GraphEdge e : edges) b.addEdge(e);
        }
        return b.build();
    }

    public static KnowledgeGraph empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(index.get(id));
    }

    public boolean containsNode(String id) {
        return index.containsKey(id);
    }

    public List<GraphNode> nodesOfKind(NodeKind kind) {
        List<GraphNode> out = new ArrayList<>();
        for (GraphNode n : nodes) {
            if (n.kind == kind) out.add(n);
        }
        return out;
    }

    public List<GraphEdge> edgesOfKind(EdgeKind kind) {
        List<GraphEdge> out = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.kind == kind) out.add(e);
        }
        return out;
    }

    public List<GraphEdge> outgoing(String sourceId) {
        List<GraphEdge> out = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.sourceId.equals(sourceId)) out.add(e);
        }
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KnowledgeGraph)) return false;
        KnowledgeGraph that = (KnowledgeGraph) o;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override public int hashCode() {
        return 31 * nodes.hashCode() + edges.hashCode();
    }

    @Override public String toString() {
        return "KnowledgeGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }

    /** Single-writer builder. Not thread-safe. */
    public static final class Builder {
        private final Map<String, GraphNode> index = new LinkedHashMap<>();
        private final Set<GraphEdge> edges = new LinkedHashSet<>();

        private Builder() {}

        public boolean containsNode(String id) {
            return index.containsKey(id);
        }

        /** Adds a node; a second node with an existing id is rejected. */
        public GraphNode addNode(GraphNode node) {
            GraphNode prev = index.putIfAbsent(node.id, node);
            if (prev != null) throw new IllegalArgumentException("Duplicate node id: " + node.id);
            return node;
        }

        /** Returns the node with {@code node.id} if present, otherwise adds {@code node}. */
        public GraphNode nodeOrAdd(GraphNode node) {
            GraphNode prev = index.putIfAbsent(node.id, node);
            return prev == null ? node : prev;
        }

        /**
         * Adds an edge between two existing nodes.
         *
         * @return false when an identical edge (same endpoints and kind) is already present
         */
        public boolean addEdge(GraphEdge edge) {
            if (!index.containsKey(edge.sourceId)) {
                throw new IllegalArgumentException("Edge source is not a node of this graph: " + edge);
            }
            if (!index.containsKey(edge.targetId)) {
                throw new IllegalArgumentException("Edge target is not a node of this graph: " + edge);
            }
            return edges.add(edge);
        }

        public boolean addEdge(String sourceId, String targetId, EdgeKind kind) {
            return addEdge(new GraphEdge(sourceId, targetId, kind));
        }

        public KnowledgeGraph build() {
            return new KnowledgeGraph(new LinkedHashMap<>(index), new ArrayList<>(edges));
        }
    }
}

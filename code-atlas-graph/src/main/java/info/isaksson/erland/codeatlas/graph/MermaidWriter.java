package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.EdgeKind;
import info.isaksson.erland.codeatlas.ir.GraphEdge;
import info.isaksson.erland.codeatlas.ir.GraphNode;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders a knowledge graph as Mermaid text.
 *
 * <p>Output is a pure function of the graph: nodes in insertion order, then edges in insertion
 * order, {@code \n} line endings and a trailing newline. Node ids are rewritten to
 * {@code [A-Za-z0-9_]}; when two ids collapse onto the same text the later one gets a
 * {@code _2}, {@code _3}... suffix. Labels are always quoted with reserved characters written as
 * entity codes.</p>
 */
public final class MermaidWriter {

    public static final String DEFAULT_DIRECTION = "TD";

    private static final Set<String> DIRECTIONS = Set.of("TD", "TB", "BT", "LR", "RL");

    private final String direction;

    public MermaidWriter() {
        this(DEFAULT_DIRECTION);
    }

    public MermaidWriter(String direction) {
        String d = direction == null ? DEFAULT_DIRECTION : direction.trim().toUpperCase(Locale.ROOT);
        if (!DIRECTIONS.contains(d)) {
            throw new IllegalArgumentException("Unsupported diagram direction: " + direction + " (expected one of TD, TB, BT, LR, RL)");
        }
        this.direction = d;
    }

    public String direction() {
        return direction;
    }

    /** Architecture diagram of the whole graph, headed {@code graph <direction>}. */
    public String render(KnowledgeGraph graph) {
        return render("graph", graph.nodes, graph.edges);
    }

    /** Renders a subset of a graph; every edge endpoint must be among {@code nodes}. */
    String render(String header, Collection<GraphNode> nodes, Collection<GraphEdge> edges) {
        Map<String, String> ids = sanitizedIds(nodes);
        StringBuilder sb = new StringBuilder();
        sb.append(header).append(' ').append(direction).append('\n');
        for (GraphNode n : nodes) {
            sb.append("    ").append(ids.get(n.id)).append(shape(n)).append('\n');
        }
        for (GraphEdge e : edges) {
            String from = ids.get(e.sourceId);
            String to = ids.get(e.targetId);
            if (from == null || to == null) {
                throw new IllegalArgumentException("Edge endpoint is not among the rendered nodes: " + e);
            }
            sb.append("    ").append(from).append(arrow(e.kind)).append(to).append('\n');
        }
        return sb.toString();
    }

    private static String shape(GraphNode n) {
        String label = "\"" + escapeLabel(n.label) + "\"";
        switch (n.kind) {
            case FILE: return "[" + label + "]";
            case CLASS: return "[[" + label + "]]";
            case FUNCTION: return "(" + label + ")";
            case MODULE: return "[/" + label + "/]";
            default: return "[" + label + "]";
        }
    }

    private static String arrow(EdgeKind kind) {
        return kind == EdgeKind.IMPORTS ? " -.->|" + kind.label + "| " : " -->|" + kind.label + "| ";
    }

    /** Assigns every node a distinct Mermaid-safe id, in node order. */
    static Map<String, String> sanitizedIds(Collection<GraphNode> nodes) {
        Map<String, String> out = new HashMap<>();
        Set<String> taken = new HashSet<>();
        for (GraphNode n : nodes) {
            String base = sanitizeId(n.id);
            String candidate = base;
            int suffix = 2;
            while (!taken.add(candidate)) {
                candidate = base + "_" + suffix++;
            }
            out.put(n.id, candidate);
        }
        return out;
    }

    /** Replaces every character outside {@code [A-Za-z0-9_]} with {@code _}. */
    public static String sanitizeId(String id) {
        StringBuilder sb = new StringBuilder(id.length());
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(ok ? c : '_');
        }
        return sb.toString();
    }

    /** Writes {@code # " < >} as Mermaid entity codes and flattens line breaks. */
    public static String escapeLabel(String label) {
        StringBuilder sb = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            switch (c) {
                case '#': sb.append("#35;"); break;
                case '"': sb.append("#quot;"); break;
                case '<': sb.append("#lt;"); break;
                case '>': sb.append("#gt;"); break;
                case '\n':
                case '\r':
                    sb.append(' ');
                    break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}

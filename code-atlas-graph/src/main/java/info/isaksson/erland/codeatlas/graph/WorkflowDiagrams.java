package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.EdgeKind;
import info.isaksson.erland.codeatlas.ir.GraphEdge;
import info.isaksson.erland.codeatlas.ir.GraphNode;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;
import info.isaksson.erland.codeatlas.ir.NodeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Per-file {@code flowchart} diagrams: one file node with the classes and functions it defines. */
public final class WorkflowDiagrams {

    private final MermaidWriter writer;

    public WorkflowDiagrams(MermaidWriter writer) {
        this.writer = writer;
    }

    /** Diagram for one file, or an empty string when the graph has no such file. */
    public String forFile(KnowledgeGraph graph, String path) {
        if (!graph.containsNode(NodeIds.file(path))) return "";
        List<GraphNode> nodes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (GraphNode n : graph.nodes) {
            if (n.kind != NodeKind.MODULE && path.equals(n.path)) {
                nodes.add(n);
                ids.add(n.id);
            }
        }
        List<GraphEdge> edges = new ArrayList<>();
        for (GraphEdge e : graph.edges) {
            if (e.kind == EdgeKind.DEFINES && ids.contains(e.sourceId) && ids.contains(e.targetId)) edges.add(e);
        }
        return writer.render("flowchart", nodes, edges);
    }

    /** Diagrams for every file of the graph, keyed by path in graph order. */
    public Map<String, String> forAllFiles(KnowledgeGraph graph) {
        Map<String, String> out = new LinkedHashMap<>();
        for (GraphNode n : graph.nodesOfKind(NodeKind.FILE)) {
            out.put(n.path, forFile(graph, n.path));
        }
        return out;
    }
}

package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.EdgeKind;
import info.isaksson.erland.codeatlas.ir.GraphEdge;
import info.isaksson.erland.codeatlas.ir.GraphNode;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;

/** Node and edge counts of a knowledge graph. */
public final class GraphStats {
    public final int files;
    public final int classes;
    public final int functions;
    public final int modules;
    public final int definesEdges;
    public final int importsEdges;

    private GraphStats(int files, int classes, int functions, int modules, int definesEdges, int importsEdges) {
        this.files = files;
        this.classes = classes;
        this.functions = functions;
        this.modules = modules;
        this.definesEdges = definesEdges;
        this.importsEdges = importsEdges;
    }

    public static GraphStats of(KnowledgeGraph graph) {
        int files = 0;
        int classes = 0;
        int functions = 0;
        int modules = 0;
        for (GraphNode n : graph.nodes) {
            switch (n.kind) {
                case FILE: files++; break;
                case CLASS: classes++; break;
                case FUNCTION: functions++; break;
                case MODULE: modules++; break;
                default: break;
            }
        }
        int defines = 0;
        int imports = 0;
        for (GraphEdge e : graph.edges) {
            if (e.kind == EdgeKind.DEFINES) defines++;
            else imports++;
        }
        return new GraphStats(files, classes, functions, modules, defines, imports);
    }

    public int nodes() {
        return files + classes + functions + modules;
    }

    public int edges() {
        return definesEdges + importsEdges;
    }

    @Override public String toString() {
        return "files=" + files +
                ", classes=" + classes +
                ", functions=" + functions +
                ", modules=" + modules +
                ", definesEdges=" + definesEdges +
                ", importsEdges=" + importsEdges;
    }
}

package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.ClassDef;
import info.isaksson.erland.codeatlas.ir.EdgeKind;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.GraphNode;
import info.isaksson.erland.codeatlas.ir.ImportRef;
import info.isaksson.erland.codeatlas.ir.InvalidInputException;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;
import info.isaksson.erland.codeatlas.ir.NodeKind;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds parsed files into one {@link KnowledgeGraph}.
 *
 * <p>Files are visited sorted by path, so node and edge order (and everything rendered from them)
 * does not depend on the order the files were parsed in. Per file: a file node, a class node per
 * class defined by the file, a function node per function defined by its class or the file, and
 * an {@code imports} edge to a shared module node per imported module.</p>
 *
 * <p>Cost is linear in the number of declarations; node lookups go through the builder's id
 * index.</p>
 */
public final class KnowledgeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphBuilder.class);

    /**
     * @throws InvalidInputException when {@code files} is null or empty, holds a null entry, or two
     *                               entries share a path
     */
    public KnowledgeGraph build(List<ParsedFile> files) {
        if (files == null || files.isEmpty()) {
            throw new InvalidInputException("No parsed files to build a graph from");
        }
        List<ParsedFile> sorted = new ArrayList<>(files.size());
        Set<String> paths = new HashSet<>();
        for (ParsedFile pf : files) {
            if (pf == null) throw new InvalidInputException("Parsed file list contains a null entry");
            if (!paths.add(pf.path)) throw new InvalidInputException("Duplicate path: " + pf.path);
            sorted.add(pf);
        }
        sorted.sort(Comparator.comparing(pf -> pf.path));

        KnowledgeGraph.Builder b = KnowledgeGraph.builder();
        for (ParsedFile pf : sorted) {
            addFile(b, pf);
        }
        KnowledgeGraph graph = b.build();
        log.debug("Knowledge graph built from {} files: {}", sorted.size(), GraphStats.of(graph));
        return graph;
    }

    private static void addFile(KnowledgeGraph.Builder b, ParsedFile pf) {
        String fileId = NodeIds.file(pf.path);
        b.addNode(new GraphNode(fileId, NodeKind.FILE, pf.path, pf.path));

        Map<String, String> classIds = new HashMap<>();
        for (ClassDef c : pf.classes) {
            String id = unique(b, NodeIds.classNode(pf.path, c), c.startLine);
            b.addNode(new GraphNode(id, NodeKind.CLASS, "class " + c.name, pf.path));
            b.addEdge(fileId, id, EdgeKind.DEFINES);
            classIds.putIfAbsent(c.name, id);
        }

        for (FunctionDef f : pf.functions) {
            String id = unique(b, NodeIds.function(pf.path, f), f.startLine);
            b.addNode(new GraphNode(id, NodeKind.FUNCTION, f.name + "()", pf.path));
            String owner = f.ownerClass == null ? null : classIds.get(f.ownerClass);
            b.addEdge(owner == null ? fileId : owner, id, EdgeKind.DEFINES);
        }

        for (ImportRef imp : pf.imports) {
            GraphNode module = b.nodeOrAdd(new GraphNode(NodeIds.module(imp.moduleOrPath), NodeKind.MODULE, imp.moduleOrPath, null));
            b.addEdge(fileId, module.id, EdgeKind.IMPORTS);
        }
    }

    /** A redefinition (same qualified name twice in one file) gets its start line as suffix. */
    private static String unique(KnowledgeGraph.Builder b, String id, int startLine) {
        if (!b.containsNode(id)) return id;
        String candidate = NodeIds.disambiguated(id, startLine);
        int n = 2;
        while (b.containsNode(candidate)) {
            candidate = NodeIds.disambiguated(id, startLine) + "#" + n++;
        }
        return candidate;
    }
}

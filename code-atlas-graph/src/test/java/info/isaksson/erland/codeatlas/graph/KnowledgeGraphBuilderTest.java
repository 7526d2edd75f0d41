package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.EdgeKind;
import info.isaksson.erland.codeatlas.ir.GraphEdge;
import info.isaksson.erland.codeatlas.ir.GraphNode;
import info.isaksson.erland.codeatlas.ir.InvalidInputException;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;
import info.isaksson.erland.codeatlas.ir.NodeKind;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class KnowledgeGraphBuilderTest {

    private final KnowledgeGraphBuilder builder = new KnowledgeGraphBuilder();

    @Test
    void classOwnsItsMethod() {
        KnowledgeGraph g = builder.build(List.of(Fixtures.fixture("sample.py", "sample.py")));

        GraphNode solution = g.node("class:sample.py::Solution").orElseThrow();
        assertEquals(NodeKind.CLASS, solution.kind);
        assertEquals("class Solution", solution.label);
        GraphNode twoSum = g.node("function:sample.py::Solution.twoSum").orElseThrow();
        assertEquals("twoSum()", twoSum.label);
        assertTrue(g.edges.contains(new GraphEdge(solution.id, twoSum.id, EdgeKind.DEFINES)));
        assertTrue(g.edges.contains(new GraphEdge("file:sample.py", solution.id, EdgeKind.DEFINES)));
        assertFalse(g.edges.contains(new GraphEdge("file:sample.py", twoSum.id, EdgeKind.DEFINES)));
    }

    @Test
    void oneImportStatementIsOneImportsEdge() {
        KnowledgeGraph g = builder.build(List.of(Fixtures.fixture("helpers.py", "helpers.py")));
        GraphStats stats = GraphStats.of(g);

        assertEquals(1, stats.files);
        assertEquals(2, stats.functions);
        assertEquals(0, stats.classes);
        assertEquals(1, stats.modules);
        assertEquals(1, stats.importsEdges);
        assertEquals(2, stats.definesEdges);
        assertEquals("collections", g.nodesOfKind(NodeKind.MODULE).get(0).label);
        for (GraphEdge e : g.edgesOfKind(EdgeKind.DEFINES)) {
            assertEquals("file:helpers.py", e.sourceId);
        }
    }

    @Test
    void runtimeModuleLoadsAreNotImports() {
        ParsedFile pf = Fixtures.fixture("index.js", "index.js");
        assertTrue(pf.imports.isEmpty());

        KnowledgeGraph g = builder.build(List.of(pf));
        assertTrue(g.nodesOfKind(NodeKind.MODULE).isEmpty());
        assertTrue(g.edgesOfKind(EdgeKind.IMPORTS).isEmpty());
    }

    @Test
    void inputOrderDoesNotMatter() {
        List<ParsedFile> files = new ArrayList<>(List.of(
                Fixtures.fixture("sample.py", "pkg/sample.py"),
                Fixtures.fixture("helpers.py", "pkg/helpers.py"),
                Fixtures.fixture("index.js", "web/index.js")));
        KnowledgeGraph forward = builder.build(files);
        Collections.reverse(files);
        KnowledgeGraph backward = builder.build(files);

        assertEquals(forward, backward);
        assertEquals("file:pkg/helpers.py", forward.nodes.get(0).id);
    }

    @Test
    void modulesAreSharedBetweenFiles() {
        KnowledgeGraph g = builder.build(List.of(
                Fixtures.parse("a.py", "import os\n"),
                Fixtures.parse("b.py", "from os import path\nimport os\n")));

        assertEquals(1, g.nodesOfKind(NodeKind.MODULE).size());
        assertEquals(List.of(
                new GraphEdge("file:a.py", "module:os", EdgeKind.IMPORTS),
                new GraphEdge("file:b.py", "module:os", EdgeKind.IMPORTS)), g.edgesOfKind(EdgeKind.IMPORTS));
    }

    @Test
    void everyEdgeEndpointIsANodeAndIdsAreUnique() {
        KnowledgeGraph g = builder.build(List.of(
                Fixtures.fixture("sample.py", "sample.py"),
                Fixtures.fixture("helpers.py", "helpers.py"),
                Fixtures.parse("twice.py", "def f():\n    return 1\n\ndef f():\n    return 2\n")));

        Set<String> ids = new HashSet<>();
        for (GraphNode n : g.nodes) assertTrue(ids.add(n.id), "duplicate id " + n.id);
        for (GraphEdge e : g.edges) {
            assertTrue(g.containsNode(e.sourceId), e.toString());
            assertTrue(g.containsNode(e.targetId), e.toString());
        }
        assertTrue(g.containsNode("function:twice.py::f"));
        assertTrue(g.containsNode("function:twice.py::f@L4"));
    }

    @Test
    void emptyOrDuplicateInputIsRejected() {
        assertThrows(InvalidInputException.class, () -> builder.build(List.of()));
        assertThrows(InvalidInputException.class, () -> builder.build(null));
        ParsedFile pf = Fixtures.parse("a.py", "x = 1\n");
        assertThrows(InvalidInputException.class, () -> builder.build(List.of(pf, pf)));
    }
}

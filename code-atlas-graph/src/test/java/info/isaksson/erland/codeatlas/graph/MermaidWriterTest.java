package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.EdgeKind;
import info.isaksson.erland.codeatlas.ir.GraphNode;
import info.isaksson.erland.codeatlas.ir.KnowledgeGraph;
import info.isaksson.erland.codeatlas.ir.NodeKind;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class MermaidWriterTest {

    @Test
    void rendersNodesThenEdges() {
        KnowledgeGraph.Builder b = KnowledgeGraph.builder();
        b.addNode(new GraphNode("file:a.py", NodeKind.FILE, "a.py", "a.py"));
        b.addNode(new GraphNode("class:a.py::A", NodeKind.CLASS, "class A", "a.py"));
        b.addNode(new GraphNode("function:a.py::A.run", NodeKind.FUNCTION, "run()", "a.py"));
        b.addNode(new GraphNode("module:os", NodeKind.MODULE, "os", null));
        b.addEdge("file:a.py", "class:a.py::A", EdgeKind.DEFINES);
        b.addEdge("class:a.py::A", "function:a.py::A.run", EdgeKind.DEFINES);
        b.addEdge("file:a.py", "module:os", EdgeKind.IMPORTS);

        String expected = String.join("\n",
                "graph TD",
                "    file_a_py[\"a.py\"]",
                "    class_a_py__A[[\"class A\"]]",
                "    function_a_py__A_run(\"run()\")",
                "    module_os[/\"os\"/]",
                "    file_a_py -->|defines| class_a_py__A",
                "    class_a_py__A -->|defines| function_a_py__A_run",
                "    file_a_py -.->|imports| module_os") + "\n";
        assertEquals(expected, new MermaidWriter().render(b.build()));
    }

    @Test
    void sanitizedIdsNeverCollide() {
        KnowledgeGraph.Builder b = KnowledgeGraph.builder();
        b.addNode(new GraphNode("module:a-b", NodeKind.MODULE, "a-b", null));
        b.addNode(new GraphNode("module:a.b", NodeKind.MODULE, "a.b", null));
        b.addNode(new GraphNode("module:a_b_2", NodeKind.MODULE, "a_b_2", null));

        String out = new MermaidWriter("LR").render(b.build());

        assertTrue(out.startsWith("graph LR\n"));
        assertTrue(out.contains("    module_a_b[/\"a-b\"/]\n"));
        assertTrue(out.contains("    module_a_b_2[/\"a.b\"/]\n"));
        assertTrue(out.contains("    module_a_b_2_2[/\"a_b_2\"/]\n"));
    }

    @Test
    void reservedLabelCharactersAreEscaped() {
        assertEquals("Map#lt;K, V#gt; #quot;x#quot; #35;1", MermaidWriter.escapeLabel("Map<K, V> \"x\" #1"));
        assertEquals("file_src_app_ts", MermaidWriter.sanitizeId("file:src/app.ts"));
    }

    @Test
    void unknownDirectionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MermaidWriter("up"));
        assertEquals("LR", new MermaidWriter("lr").direction());
    }

    @Test
    void renderingIsByteStableAcrossInputOrders() {
        List<ParsedFile> files = new ArrayList<>(List.of(
                Fixtures.fixture("sample.py", "a/sample.py"),
                Fixtures.fixture("helpers.py", "b/helpers.py"),
                Fixtures.fixture("index.js", "c/index.js"),
                Fixtures.parse("d/util.ts", "import { x } from './x';\nexport function f(a: number): number {\n  return a;\n}\n")));
        KnowledgeGraphBuilder builder = new KnowledgeGraphBuilder();
        MermaidWriter writer = new MermaidWriter();
        String first = writer.render(builder.build(files));

        Random random = new Random(42);
        for (int i = 0; i < 5; i++) {
            Collections.shuffle(files, random);
            assertEquals(first, writer.render(builder.build(files)));
        }
    }
}

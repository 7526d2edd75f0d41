package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AtlasJsonDeterminismTest {

    private static AtlasSnapshot sample() {
        List<String> lines = List.of(
                "from os import path, sep",
                "class Solution(object):",
                "    def twoSum(self, nums, target):",
                "        return []"
        );
        ParsedFile pf = new ParsedFile("sample.py", Language.PYTHON,
                List.of(new ImportRef("os", List.of("sep", "path"))),
                List.of(new FunctionDef("twoSum", List.of("self", "nums", "target"), null, 3, 4, "Solution")),
                List.of(new ClassDef("Solution", List.of("object"), List.of("twoSum"), null, 2, 4)),
                lines, null);
        FileAnalysis fa = new FileAnalysis(pf,
                List.of(new LineAnnotation(1, LineCategory.IMPORT, "Import module: from os import path, sep")),
                List.of(new DryRunTrace("Solution.twoSum", "nums = []", false, false, List.of("Return []"))));

        KnowledgeGraph.Builder b = KnowledgeGraph.builder();
        b.addNode(new GraphNode("file:sample.py", NodeKind.FILE, "sample.py", "sample.py"));
        b.addNode(new GraphNode("module:os", NodeKind.MODULE, "os", null));
        b.addEdge("file:sample.py", "module:os", EdgeKind.IMPORTS);

        AnalysisWarnings w = new AnalysisWarnings();
        w.warn(AnalysisWarning.TRACE_UNAVAILABLE, "no input", Map.of("z", "1", "a", "2"));
        return new AtlasSnapshot("mini", List.of(fa), b.build(), w.toDeterministicList());
    }

    @Test
    void roundTripPreservesModel() throws Exception {
        AtlasSnapshot snapshot = sample();
        String json = AtlasJson.toJsonString(snapshot);
        assertTrue(json.endsWith("}\n"));

        AtlasSnapshot back = AtlasJson.readFromString(json);
        assertEquals(snapshot, back);
        assertEquals(json, AtlasJson.toJsonString(back));
    }

    @Test
    void writingTwiceIsByteIdentical() throws Exception {
        AtlasSnapshot snapshot = sample();
        Path dir = Files.createTempDirectory("atlasjson-");
        Path a = dir.resolve("a.json");
        Path b = dir.resolve("nested/b.json");
        AtlasJson.write(snapshot, a);
        AtlasJson.write(AtlasJson.read(a), b);
        assertEquals(Files.readString(a, StandardCharsets.UTF_8), Files.readString(b, StandardCharsets.UTF_8));

        JsonNode tree = new ObjectMapper().readTree(Files.readString(a, StandardCharsets.UTF_8));
        assertEquals("a", tree.at("/warnings/0/context").fieldNames().next(), "context keys are sorted");
        assertFalse(tree.at("/files/0/file").has("degradationReason"));
    }
}

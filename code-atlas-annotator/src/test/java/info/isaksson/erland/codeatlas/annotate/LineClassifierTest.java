package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.LineAnnotation;
import info.isaksson.erland.codeatlas.ir.LineCategory;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static info.isaksson.erland.codeatlas.ir.LineCategory.*;
import static org.junit.jupiter.api.Assertions.*;

public class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier();

    @Test
    void classifiesTwoSumMethodInOrder() {
        List<LineAnnotation> annotations = classifier.classify(Fixtures.fixture("sample.py"));

        assertEquals(List.of(1, 2, 8, 9, 10, 11, 12, 14), lineNumbers(annotations));
        assertEquals(List.of(DEFINITION, DEFINITION, ASSIGNMENT, LOOP, ASSIGNMENT, CONDITIONAL, RETURN, ASSIGNMENT),
                categories(annotations));
        assertEquals("Define class Solution", annotations.get(0).explanation);
        assertEquals("Define method twoSum of class Solution", annotations.get(1).explanation);
        assertEquals("Variable assignment in method Solution.twoSum: d={}", annotations.get(2).explanation);
        assertEquals("Conditional check in method Solution.twoSum: if k in d:", annotations.get(5).explanation);
        assertEquals("Return statement in method Solution.twoSum: return [d[k],i]", annotations.get(6).explanation);
    }

    @Test
    void requireIsAnAssignmentNotAnImport() {
        List<LineAnnotation> annotations = classifier.classify(Fixtures.fixture("index.js"));

        assertEquals(List.of(1, 2, 3, 6, 8, 9, 11, 15, 16), lineNumbers(annotations));
        assertEquals(List.of(ASSIGNMENT, ASSIGNMENT, ASSIGNMENT, ASSIGNMENT, ASSIGNMENT, CALL, CALL, CALL, CALL),
                categories(annotations));
        assertTrue(annotations.get(0).explanation.startsWith("Variable assignment: const http = require('node:http');"));
        assertTrue(annotations.get(0).explanation.endsWith("(loads module 'node:http' at runtime)"));
        assertFalse(annotations.get(1).explanation.contains("loads module"));
    }

    @Test
    void commentsBlankLinesAndStructuralLinesAreOmitted() {
        String src = String.join("\n",
                "# leading comment",
                "",
                "import os",
                "",
                "def walk(root):",
                "    try:",
                "        total = 0",
                "    finally:",
                "        print(root)",
                "    return total");
        List<LineAnnotation> annotations = classifier.classify(Fixtures.parse("walk.py", src));

        assertEquals(List.of(3, 5, 7, 9, 10), lineNumbers(annotations));
        assertEquals(List.of(IMPORT, DEFINITION, ASSIGNMENT, CALL, RETURN), categories(annotations));
        assertEquals("Import module: import os", annotations.get(0).explanation);
        assertEquals("Function call in function walk: print(root)", annotations.get(3).explanation);
    }

    @Test
    void comparisonsAndAugmentedAssignmentsAreToldApart() {
        String src = String.join("\n",
                "def f(a, b):",
                "    a == b",
                "    a += b",
                "    a <= b",
                "    a <<= 1",
                "    while a > 0:",
                "        a -= 1",
                "    elif_count = 2");
        List<LineCategory> categories = categories(classifier.classify(Fixtures.parse("f.py", src)));

        assertEquals(List.of(DEFINITION, OTHER, ASSIGNMENT, OTHER, ASSIGNMENT, LOOP, ASSIGNMENT, ASSIGNMENT), categories);
    }

    @Test
    void scriptBranchesLoopsAndDeclarations() {
        String src = String.join("\n",
                "import { readFile } from 'fs';",
                "/*",
                " * block comment",
                " */",
                "export function pick(items, limit) {",
                "  let count = 0;",
                "  for (const item of items) {",
                "    if (count === limit) {",
                "      break;",
                "    } else if (item) {",
                "      count++;",
                "    } else {",
                "      log(item);",
                "    }",
                "  }",
                "  return count;",
                "}");
        List<LineAnnotation> annotations = classifier.classify(Fixtures.parse("pick.js", src));

        assertEquals(List.of(1, 5, 6, 7, 8, 9, 10, 11, 13, 16), lineNumbers(annotations));
        assertEquals(List.of(IMPORT, DEFINITION, ASSIGNMENT, LOOP, CONDITIONAL, OTHER, CONDITIONAL, ASSIGNMENT, CALL, RETURN),
                categories(annotations));
        assertEquals("Define function pick", annotations.get(1).explanation);
        assertEquals("Loop iteration in function pick: for (const item of items) {", annotations.get(3).explanation);
    }

    @Test
    void typeScriptTypeDeclarationsAreDefinitions() {
        String src = String.join("\n",
                "export interface Shape {",
                "  area(): number;",
                "}",
                "type Id = string;",
                "export class Square implements Shape {",
                "  constructor(private side: number) {}",
                "  area(): number {",
                "    return this.side * this.side;",
                "  }",
                "}");
        List<LineAnnotation> annotations = classifier.classify(Fixtures.parse("shape.ts", src));

        assertEquals("Define interface Shape", annotations.get(0).explanation);
        LineAnnotation type = annotations.stream().filter(a -> a.lineNumber == 4).findFirst().orElseThrow();
        assertEquals("Define type Id", type.explanation);
        LineAnnotation square = annotations.stream().filter(a -> a.lineNumber == 5).findFirst().orElseThrow();
        assertEquals("Define class Square", square.explanation);
        LineAnnotation area = annotations.stream().filter(a -> a.lineNumber == 7).findFirst().orElseThrow();
        assertEquals("Define method area of class Square", area.explanation);
        LineAnnotation ret = annotations.stream().filter(a -> a.lineNumber == 8).findFirst().orElseThrow();
        assertEquals(RETURN, ret.category);
        assertTrue(ret.explanation.startsWith("Return statement in method Square.area: "));
    }

    @Test
    void longLinesAreCut() {
        String longCall = "notify(" + "x".repeat(80) + ")";
        List<LineAnnotation> annotations = classifier.classify(Fixtures.parse("n.py", longCall));

        assertEquals(1, annotations.size());
        assertEquals("Function call: " + longCall.substring(0, LineClassifier.MAX_CODE_WIDTH) + "...",
                annotations.get(0).explanation);
    }

    @Test
    void sameInputGivesSameAnnotations() {
        ParsedFile pf = Fixtures.fixture("sample.py");
        assertEquals(classifier.classify(pf), new LineClassifier().classify(pf));
    }

    private static List<Integer> lineNumbers(List<LineAnnotation> annotations) {
        return annotations.stream().map(a -> a.lineNumber).collect(Collectors.toList());
    }

    private static List<LineCategory> categories(List<LineAnnotation> annotations) {
        return annotations.stream().map(a -> a.category).collect(Collectors.toList());
    }
}

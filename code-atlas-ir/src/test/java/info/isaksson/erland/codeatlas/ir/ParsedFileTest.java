package info.isaksson.erland.codeatlas.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParsedFileTest {

    private static final List<String> LINES = List.of(
            "class A:",
            "    def f(self):",
            "        return 1",
            "def g():",
            "    pass"
    );

    @Test
    void acceptsConsistentModel() {
        ClassDef a = new ClassDef("A", List.of(), List.of("f"), null, 1, 3);
        FunctionDef f = new FunctionDef("f", List.of("self"), null, 2, 3, "A");
        FunctionDef g = new FunctionDef("g", List.of(), "", 4, 5, null);
        ParsedFile pf = new ParsedFile("m.py", Language.PYTHON, null, List.of(f, g), List.of(a), LINES, null);

        assertFalse(pf.degraded);
        assertNull(pf.degradationReason);
        assertEquals(5, pf.lineCount());
        assertEquals(List.of(f), pf.methodsOf("A"));
        assertEquals(List.of(g), pf.topLevelFunctions());
        assertEquals("A.f", pf.functionNamed("A.f").orElseThrow().qualifiedName());
        assertNull(g.docComment, "blank doc comments are normalized to absent");
        assertEquals("", pf.line(99));
    }

    @Test
    void rejectsUnknownOwnerClass() {
        FunctionDef f = new FunctionDef("f", List.of(), null, 2, 3, "Missing");
        assertThrows(IllegalArgumentException.class,
                () -> new ParsedFile("m.py", Language.PYTHON, null, List.of(f), null, LINES, null));
    }

    @Test
    void rejectsSpanOutsideFile() {
        FunctionDef f = new FunctionDef("f", List.of(), null, 4, 6, null);
        assertThrows(IllegalArgumentException.class,
                () -> new ParsedFile("m.py", Language.PYTHON, null, List.of(f), null, LINES, null));
        assertThrows(IllegalArgumentException.class, () -> new FunctionDef("f", List.of(), null, 3, 2, null));
        assertThrows(IllegalArgumentException.class, () -> new ClassDef("C", null, null, null, 0, 1));
    }

    @Test
    void reasonImpliesDegraded() {
        ParsedFile failed = ParsedFile.failed("x.js", Language.JAVASCRIPT, List.of("function ("));
        assertTrue(failed.degraded);
        assertEquals(DegradationReason.EXTRACTION_FAILURE, failed.degradationReason);
        assertTrue(failed.functions.isEmpty());
        assertEquals(1, failed.lineCount());
    }

    @Test
    void importSymbolsAreASet() {
        ImportRef a = new ImportRef("os.path", List.of("join", "exists", "join"));
        ImportRef b = new ImportRef(" os.path ", List.of("exists", "join"));
        assertEquals(a, b);
        assertEquals(List.of("exists", "join"), a.importedSymbols);
        assertThrows(IllegalArgumentException.class, () -> new ImportRef(" "));
    }

    @Test
    void languageFromExtension() {
        assertEquals(Language.PYTHON, Language.fromPath("pkg/a.py").orElseThrow());
        assertEquals(Language.TYPESCRIPT, Language.fromPath("web/App.TSX").orElseThrow());
        assertEquals(Language.JAVASCRIPT, Language.fromPath("server.cjs").orElseThrow());
        assertTrue(Language.fromPath("Main.java").isEmpty());
        assertEquals(Language.TYPESCRIPT, Language.parse("ts"));
        assertThrows(InvalidInputException.class, () -> SourceUnit.of("README.md", "# hi"));
    }
}

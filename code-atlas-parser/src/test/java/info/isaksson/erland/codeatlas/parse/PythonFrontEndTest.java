package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.ClassDef;
import info.isaksson.erland.codeatlas.ir.DegradationReason;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.ImportRef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class PythonFrontEndTest {

    private static final SourceParser GRAMMAR = LanguageFrontEnd.python();
    private static final SourceParser PATTERNS = LanguageFrontEnd.patternsOnly(Language.PYTHON);

    @Test
    void extractsClassAndMethodWithGrammar() {
        assumeTrue(TreeSitterGrammars.isAvailable(Language.PYTHON), "python grammar not loadable here");
        ParsedFile pf = GRAMMAR.parse("sample.py", Fixtures.read("sample.py"));
        assertFalse(pf.degraded);
        assertNull(pf.degradationReason);
        assertSolutionShape(pf);
    }

    @Test
    void extractsClassAndMethodWithPatterns() {
        ParsedFile pf = PATTERNS.parse("sample.py", Fixtures.read("sample.py"));
        assertTrue(pf.degraded);
        assertEquals(DegradationReason.UNSUPPORTED_DIALECT, pf.degradationReason);
        assertSolutionShape(pf);
    }

    private static void assertSolutionShape(ParsedFile pf) {
        assertEquals(Language.PYTHON, pf.language);
        assertEquals(1, pf.classes.size());
        ClassDef solution = pf.classes.get(0);
        assertEquals("Solution", solution.name);
        assertEquals(List.of("object"), solution.baseNames);
        assertEquals(List.of("twoSum"), solution.methodNames);
        assertEquals(1, solution.startLine);
        assertEquals(14, solution.endLine);

        FunctionDef twoSum = pf.functionNamed("Solution.twoSum").orElseThrow();
        assertEquals(List.of("self", "nums", "target"), twoSum.parameters);
        assertEquals("Solution", twoSum.ownerClass);
        assertEquals(2, twoSum.startLine);
        assertEquals(14, twoSum.endLine);
        assertEquals(":type nums: List[int]\n:type target: int\n:rtype: List[int]", twoSum.docComment);
        assertTrue(pf.imports.isEmpty());
        assertTrue(pf.topLevelFunctions().isEmpty());
    }

    @Test
    void collectsTopLevelFunctionsAndOneImport() {
        for (SourceParser parser : parsers()) {
            ParsedFile pf = parser.parse("helpers.py", Fixtures.read("helpers.py"));
            assertEquals(List.of("tally", "group"), names(pf.functions), parser.toString());
            assertEquals(List.of(new ImportRef("collections", List.of("OrderedDict", "defaultdict", "Counter"))),
                    pf.imports, parser.toString());
            FunctionDef tally = pf.functionNamed("tally").orElseThrow();
            assertEquals("Count how often each word occurs.", tally.docComment);
            assertEquals(4, tally.startLine);
            assertEquals(7, tally.endLine);
            assertEquals(10, pf.functionNamed("group").orElseThrow().startLine);
        }
    }

    @Test
    void decoratorsDoNotMoveTheDeclarationLine() {
        String src = "import functools\n"
                + "\n"
                + "@functools.lru_cache(maxsize=None)\n"
                + "def fib(n):\n"
                + "    return n if n < 2 else fib(n - 1) + fib(n - 2)\n";
        for (SourceParser parser : parsers()) {
            ParsedFile pf = parser.parse("fib.py", src);
            FunctionDef fib = pf.functionNamed("fib").orElseThrow();
            assertEquals(4, fib.startLine, parser.toString());
            assertEquals(5, fib.endLine, parser.toString());
            assertEquals(List.of(new ImportRef("functools")), pf.imports, parser.toString());
        }
    }

    @Test
    void nestedFunctionsAreNotDeclarations() {
        String src = "def outer(x):\n"
                + "    def inner(y):\n"
                + "        return y\n"
                + "    return inner(x)\n";
        for (SourceParser parser : parsers()) {
            ParsedFile pf = parser.parse("nested.py", src);
            assertEquals(List.of("outer"), names(pf.functions), parser.toString());
            assertEquals(4, pf.functions.get(0).endLine, parser.toString());
        }
    }

    @Test
    void malformedSourceDegradesInsteadOfFailing() {
        String src = "def broken(:\n    pass\n\nclass Ok:\n    pass\n";
        ParsedFile pf = GRAMMAR.parse("broken.py", src);
        assertTrue(pf.degraded);
        assertNotNull(pf.degradationReason);
        assertEquals(5, pf.lineCount());
        if (TreeSitterGrammars.isAvailable(Language.PYTHON)) {
            assertEquals(DegradationReason.MALFORMED_SPAN, pf.degradationReason);
        }
    }

    @Test
    void errorOutsideAnyFunctionStillDegradesTheWholeFile() {
        String src = "def ok(a=1):\n    return a\n\nx = (1,\n";
        ParsedFile pf = GRAMMAR.parse("tail.py", src);
        assertTrue(pf.degraded);
        assertEquals(List.of("ok"), names(pf.functions));
        if (TreeSitterGrammars.isAvailable(Language.PYTHON)) {
            assertEquals(DegradationReason.MALFORMED_SPAN, pf.degradationReason);
        }
    }

    @Test
    void emptyFileParsesToNothing() {
        for (SourceParser parser : parsers()) {
            ParsedFile pf = parser.parse("empty.py", "");
            assertEquals(0, pf.lineCount());
            assertTrue(pf.functions.isEmpty());
            assertTrue(pf.classes.isEmpty());
        }
    }

    @Test
    void crlfAndBomAreNormalized() {
        String src = "\uFEFFdef f(a, b):\r\n    return a + b\r\n";
        for (SourceParser parser : parsers()) {
            ParsedFile pf = parser.parse("crlf.py", src);
            assertEquals(List.of("def f(a, b):", "    return a + b"), pf.lines);
            assertEquals(List.of("a", "b"), pf.functionNamed("f").orElseThrow().parameters);
        }
    }

    static List<SourceParser> parsers() {
        return TreeSitterGrammars.isAvailable(Language.PYTHON) ? List.of(GRAMMAR, PATTERNS) : List.of(PATTERNS);
    }

    static List<String> names(List<FunctionDef> functions) {
        return functions.stream().map(f -> f.name).collect(Collectors.toList());
    }
}

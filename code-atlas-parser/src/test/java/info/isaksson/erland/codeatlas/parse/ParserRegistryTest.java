package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.DegradationReason;
import info.isaksson.erland.codeatlas.ir.InvalidInputException;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import info.isaksson.erland.codeatlas.ir.SourceUnit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class ParserRegistryTest {

    @Test
    void dispatchesOnLanguage() {
        ParserRegistry registry = ParserRegistry.defaults();
        for (Language l : Language.values()) {
            assertEquals(l, registry.forLanguage(l).language());
        }
        ParsedFile pf = registry.parse(SourceUnit.of("pkg/helpers.py", Fixtures.read("helpers.py")));
        assertEquals("pkg/helpers.py", pf.path);
        assertEquals(Language.PYTHON, pf.language);
    }

    @Test
    void blankPathIsInvalidInput() {
        SourceParser parser = ParserRegistry.patternsOnly().forLanguage(Language.PYTHON);
        assertThrows(InvalidInputException.class, () -> parser.parse(" ", "x = 1\n"));
    }

    @Test
    void scannerFailureStillYieldsAFile() {
        SourceParser exploding = new LanguageFrontEnd(Language.JAVASCRIPT,
                (path, text, lines) -> ParseOutcome.degraded(DegradationReason.UNSUPPORTED_DIALECT),
                lines -> { throw new IllegalStateException("boom"); });
        ParsedFile pf = ParserRegistry.defaults().with(exploding).parse(SourceUnit.of("a.js", "let a = 1;\n"));
        assertTrue(pf.degraded);
        assertEquals(DegradationReason.EXTRACTION_FAILURE, pf.degradationReason);
        assertEquals(List.of("let a = 1;"), pf.lines);
    }

    @Test
    void parsesConcurrentlyWithIdenticalResults() throws Exception {
        ParserRegistry registry = ParserRegistry.defaults();
        List<SourceUnit> units = List.of(
                SourceUnit.of("sample.py", Fixtures.read("sample.py")),
                SourceUnit.of("helpers.py", Fixtures.read("helpers.py")),
                SourceUnit.of("index.js", Fixtures.read("index.js")),
                SourceUnit.of("shapes.ts", Fixtures.read("shapes.ts")));
        List<ParsedFile> expected = new ArrayList<>();
        for (SourceUnit u : units) expected.add(registry.parse(u));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<ParsedFile>> futures = new ArrayList<>();
            for (int round = 0; round < 8; round++) {
                for (SourceUnit u : units) futures.add(pool.submit(() -> registry.parse(u)));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i % units.size()), futures.get(i).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}

package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import info.isaksson.erland.codeatlas.parse.ParserRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads fixtures from the test classpath and parses inline sources. */
final class Fixtures {

    private Fixtures() {}

    static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalStateException("fixture must exist in test resources: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Parses with the pattern scanner so results do not depend on native grammars. */
    static ParsedFile parse(String path, String text) {
        Language language = Language.fromPath(path).orElseThrow();
        return ParserRegistry.patternsOnly().forLanguage(language).parse(path, text);
    }

    static ParsedFile fixture(String name) {
        return parse(name, read(name));
    }
}

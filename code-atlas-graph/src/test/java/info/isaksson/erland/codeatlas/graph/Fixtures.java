package info.isaksson.erland.codeatlas.graph;

import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import info.isaksson.erland.codeatlas.parse.ParserRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

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

    static ParsedFile parse(String path, String text) {
        Language language = Language.fromPath(path).orElseThrow();
        return ParserRegistry.patternsOnly().forLanguage(language).parse(path, text);
    }

    /** Parses fixture {@code name} as if it lived at {@code path}. */
    static ParsedFile fixture(String name, String path) {
        return parse(path, read(name));
    }
}

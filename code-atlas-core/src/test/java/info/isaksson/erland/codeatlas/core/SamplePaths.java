package info.isaksson.erland.codeatlas.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Locates the shared {@code samples/} tree from a module or the repository root. */
final class SamplePaths {

    private SamplePaths() {}

    static Path mini() {
        // Tests run per-module in Maven, so the working directory may be the module base dir.
        Path[] candidates = new Path[] {
                Paths.get("samples", "mini"),
                Paths.get("..", "samples", "mini"),
                Paths.get("..", "..", "samples", "mini")
        };
        for (Path p : candidates) {
            Path abs = p.toAbsolutePath().normalize();
            if (Files.isDirectory(abs)) return abs;
        }
        throw new IllegalStateException("Could not locate samples/mini (tried: samples, ../samples, ../../samples) from " + Paths.get("").toAbsolutePath());
    }

    static String read(String relative) {
        try {
            return Files.readString(mini().resolve(relative), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package info.isaksson.erland.codeatlas.io;

import info.isaksson.erland.codeatlas.ir.Language;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of supported source files with exclude rules.
 *
 * The scanner returns a stable list sorted by '/'-separated relative path.
 */
public final class SourceScanner {

    /** Directory names never descended into. */
    public static final Set<String> DEFAULT_EXCLUDED_DIRS = Set.of(
            ".git", "__pycache__", ".mypy_cache", ".ruff_cache", ".pytest_cache", ".tox",
            "node_modules", "venv", ".venv", "build", "dist", "target", "out", ".idea", ".gradle");

    private SourceScanner() {}

    /**
     * Scan for Python, JavaScript and TypeScript files under {@code sourceRoot}.
     *
     * @param sourceRoot root folder to scan
     * @param excludeGlobs glob patterns matched against the path relative to sourceRoot, using '/' separators
     */
    public static List<Path> scan(Path sourceRoot, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");

        final List<Predicate<Path>> excludeMatchers = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(sourceRoot)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> Language.fromPath(p.getFileName().toString()).isPresent())
                .filter(p -> !isInExcludedDir(sourceRoot, p))
                .filter(p -> !matchesAny(sourceRoot, p, excludeMatchers))
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> relativePath(sourceRoot, p)));
            return out;
        }
    }

    /** Repository-relative path with '/' separators. */
    public static String relativePath(Path root, Path file) {
        return normalizePathString(root.relativize(file));
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim().replace("\\", "/");
            if (pattern.isEmpty()) continue;

            // A bare directory name means "everything under it".
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")) {
                pattern = pattern + "/**";
            }

            final PathMatcher matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
        }
        return out;
    }

    private static boolean isInExcludedDir(Path root, Path absolutePath) {
        Path rel = root.relativize(absolutePath);
        for (int i = 0; i < rel.getNameCount() - 1; i++) {
            if (DEFAULT_EXCLUDED_DIRS.contains(rel.getName(i).toString())) return true;
        }
        return false;
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}

package info.isaksson.erland.codeatlas.ir;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported source languages. Each constant is one front end; selection is by file extension.
 */
public enum Language {
    PYTHON("python", List.of(".py", ".pyi")),
    JAVASCRIPT("javascript", List.of(".js", ".jsx", ".mjs", ".cjs")),
    TYPESCRIPT("typescript", List.of(".ts", ".tsx", ".mts", ".cts"));

    /** Lower-case display id, stable across versions. */
    public final String id;
    public final List<String> extensions;

    Language(String id, List<String> extensions) {
        this.id = id;
        this.extensions = extensions;
    }

    public boolean matches(String path) {
        if (path == null) return false;
        String p = path.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (p.endsWith(ext)) return true;
        }
        return false;
    }

    /** Resolve the language from a file name or path; empty when the extension is not supported. */
    public static Optional<Language> fromPath(String path) {
        if (path == null || path.isBlank()) return Optional.empty();
        for (Language l : values()) {
            if (l.matches(path)) return Optional.of(l);
        }
        return Optional.empty();
    }

    /** Lenient parse of {@link #id} or constant name (used by CLI flags and JSON fixtures). */
    public static Language parse(String value) {
        if (value == null) throw new IllegalArgumentException("language is null");
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Language l : values()) {
            if (l.id.equals(v) || l.name().toLowerCase(Locale.ROOT).equals(v)) return l;
        }
        switch (v) {
            case "py":
                return PYTHON;
            case "js":
                return JAVASCRIPT;
            case "ts":
                return TYPESCRIPT;
            default:
                throw new IllegalArgumentException("Unsupported language: " + value);
        }
    }
}

package info.isaksson.erland.codeatlas.ir;

import java.util.Objects;

/**
 * One input file as handed over by repository traversal: repo-relative path, language and text.
 *
 * <p>Paths are normalized to '/' separators. No validation beyond that happens here; the pipeline
 * rejects blank or duplicate paths as invalid input.</p>
 */
public final class SourceUnit {
    public final String path;
    public final Language language;
    public final String text;

    public SourceUnit(String path, Language language, String text) {
        this.path = path == null ? null : path.replace('\\', '/');
        this.language = language;
        this.text = text == null ? "" : text;
    }

    /** Convenience for callers that derive the language from the extension. */
    public static SourceUnit of(String path, String text) {
        Language lang = Language.fromPath(path)
                .orElseThrow(() -> new InvalidInputException("Unsupported file type: " + path));
        return new SourceUnit(path, lang, text);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceUnit)) return false;
        SourceUnit that = (SourceUnit) o;
        return Objects.equals(path, that.path) &&
                language == that.language &&
                Objects.equals(text, that.text);
    }

    @Override public int hashCode() {
        return Objects.hash(path, language, text);
    }

    @Override public String toString() {
        return "SourceUnit{" + path + ", " + language + ", " + text.length() + " chars}";
    }
}

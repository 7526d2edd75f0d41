package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lazily loaded tree-sitter grammars.
 *
 * <p>Each grammar ships as a native library. Loading happens once per language on first use; a
 * platform without the native library simply reports the grammar as unavailable and every file of
 * that language goes through the pattern scanner.</p>
 */
public final class TreeSitterGrammars {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterGrammars.class);

    private static final Map<Language, Optional<TSLanguage>> LOADED = new EnumMap<>(Language.class);

    private TreeSitterGrammars() {}

    public static Optional<TSLanguage> forLanguage(Language language) {
        synchronized (LOADED) {
            return LOADED.computeIfAbsent(language, TreeSitterGrammars::load);
        }
    }

    public static boolean isAvailable(Language language) {
        return forLanguage(language).isPresent();
    }

    /** False for dialects without a bundled grammar ({@code .tsx}). */
    public static boolean supportsDialect(Language language, String path) {
        if (language != Language.TYPESCRIPT || path == null) return true;
        return !path.toLowerCase(Locale.ROOT).endsWith(".tsx");
    }

    private static Optional<TSLanguage> load(Language language) {
        try {
            TSLanguage grammar;
            switch (language) {
                case PYTHON:
                    grammar = new TreeSitterPython();
                    break;
                case JAVASCRIPT:
                    grammar = new TreeSitterJavascript();
                    break;
                case TYPESCRIPT:
                    grammar = new TreeSitterTypescript();
                    break;
                default:
                    return Optional.empty();
            }
            log.debug("Loaded tree-sitter grammar for {}", language.id);
            return Optional.of(grammar);
        } catch (RuntimeException | LinkageError e) {
            log.warn("tree-sitter grammar for {} unavailable, using pattern scanner: {}", language.id, e.toString());
            return Optional.empty();
        }
    }
}

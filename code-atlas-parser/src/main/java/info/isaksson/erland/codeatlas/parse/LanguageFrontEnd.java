package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.DegradationReason;
import info.isaksson.erland.codeatlas.ir.InvalidInputException;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One supported language: a grammar path plus the pattern scanner it falls back to.
 *
 * <p>The grammar outcome is a confidence flag, not an exception path. When it is not confident the
 * scanner runs and the result is marked degraded with the grammar's reason. Should the scanner
 * itself fail, the file is returned with empty declaration lists.</p>
 */
public final class LanguageFrontEnd implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(LanguageFrontEnd.class);

    private final Language language;
    private final GrammarExtractor grammar;
    private final PatternScanner scanner;

    public LanguageFrontEnd(Language language, GrammarExtractor grammar, PatternScanner scanner) {
        this.language = Objects.requireNonNull(language, "language");
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    public static LanguageFrontEnd python() {
        return new LanguageFrontEnd(Language.PYTHON, new TreeSitterPythonExtractor(), new PythonPatternScanner());
    }

    public static LanguageFrontEnd javascript() {
        return new LanguageFrontEnd(Language.JAVASCRIPT,
                new TreeSitterScriptExtractor(Language.JAVASCRIPT), new ScriptPatternScanner(Language.JAVASCRIPT));
    }

    public static LanguageFrontEnd typescript() {
        return new LanguageFrontEnd(Language.TYPESCRIPT,
                new TreeSitterScriptExtractor(Language.TYPESCRIPT), new ScriptPatternScanner(Language.TYPESCRIPT));
    }

    /** Fallback-only front end for the given language (no grammar attempt). */
    public static LanguageFrontEnd patternsOnly(Language language) {
        PatternScanner scanner = language == Language.PYTHON
                ? new PythonPatternScanner()
                : new ScriptPatternScanner(language);
        return new LanguageFrontEnd(language,
                (path, text, lines) -> ParseOutcome.degraded(DegradationReason.UNSUPPORTED_DIALECT), scanner);
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public ParsedFile parse(String path, String text) {
        if (path == null || path.isBlank()) throw new InvalidInputException("path must not be blank");
        String normalized = SourceLines.normalize(text);
        List<String> lines = SourceLines.split(normalized);

        ParseOutcome outcome;
        try {
            outcome = grammar.extract(path, normalized, lines);
        } catch (RuntimeException | LinkageError e) {
            log.debug("Grammar extraction failed for {}: {}", path, e.toString());
            outcome = ParseOutcome.degraded(DegradationReason.MALFORMED_SPAN);
        }
        if (outcome.isConfident()) {
            try {
                return ParsedFileAssembler.assemble(path, language, lines, outcome.extraction, null);
            } catch (RuntimeException e) {
                log.debug("Grammar result rejected for {}: {}", path, e.toString());
                outcome = ParseOutcome.degraded(DegradationReason.MALFORMED_SPAN);
            }
        }

        log.debug("Falling back to pattern scanner for {} ({})", path, outcome.reason);
        try {
            Extraction fallback = scanner.scan(lines);
            return ParsedFileAssembler.assemble(path, language, lines, fallback, outcome.reason);
        } catch (RuntimeException e) {
            log.debug("Pattern scanner failed for {}: {}", path, e.toString());
            return ParsedFile.failed(path, language, lines);
        }
    }

    @Override
    public String toString() {
        return "LanguageFrontEnd{" + language.id + "}";
    }
}

package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.InvalidInputException;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import info.isaksson.erland.codeatlas.ir.SourceUnit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Closed set of front ends, one per {@link Language}. Adding a language means adding a constant and
 * a registration here.
 */
public final class ParserRegistry {

    private final Map<Language, SourceParser> parsers;

    private ParserRegistry(Map<Language, SourceParser> parsers) {
        this.parsers = Collections.unmodifiableMap(parsers);
    }

    public static ParserRegistry defaults() {
        Map<Language, SourceParser> m = new EnumMap<>(Language.class);
        m.put(Language.PYTHON, LanguageFrontEnd.python());
        m.put(Language.JAVASCRIPT, LanguageFrontEnd.javascript());
        m.put(Language.TYPESCRIPT, LanguageFrontEnd.typescript());
        return new ParserRegistry(m);
    }

    /** Registry that never attempts a grammar parse. */
    public static ParserRegistry patternsOnly() {
        Map<Language, SourceParser> m = new EnumMap<>(Language.class);
        for (Language l : Language.values()) m.put(l, LanguageFrontEnd.patternsOnly(l));
        return new ParserRegistry(m);
    }

    /** Copy with one front end replaced. */
    public ParserRegistry with(SourceParser parser) {
        Map<Language, SourceParser> m = new EnumMap<>(Language.class);
        m.putAll(parsers);
        m.put(parser.language(), parser);
        return new ParserRegistry(m);
    }

    public SourceParser forLanguage(Language language) {
        SourceParser p = parsers.get(language);
        if (p == null) throw new InvalidInputException("No front end registered for " + language);
        return p;
    }

    public ParsedFile parse(SourceUnit unit) {
        if (unit == null) throw new InvalidInputException("source unit is null");
        if (unit.language == null) throw new InvalidInputException("language is missing for " + unit.path);
        return forLanguage(unit.language).parse(unit.path, unit.text);
    }
}

package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.ImportRef;
import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text of one declarative import statement into {@link ImportRef}s.
 *
 * <p>Only canonical declarative forms are understood. Runtime loading calls such as
 * {@code require(...)}, {@code import(...)} or {@code importlib.import_module(...)} are not import
 * statements and never reach this class: callers select statements by their leading keyword.</p>
 */
public final class ImportStatements {

    private static final Pattern PY_FROM = Pattern.compile("^from\\s+(\\S+)\\s+import\\s+(.*)$", Pattern.DOTALL);
    private static final Pattern PY_IMPORT = Pattern.compile("^import\\s+(.*)$", Pattern.DOTALL);

    private static final Pattern JS_SIDE_EFFECT = Pattern.compile("^import\\s*(['\"])(.*?)\\1");
    private static final Pattern JS_FROM = Pattern.compile("\\bfrom\\s*(['\"])(.*?)\\1\\s*(?:(?:assert|with)\\s*\\{.*\\})?\\s*;?\\s*$", Pattern.DOTALL);
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_$][\\w$]*");

    private ImportStatements() {}

    /** True when a (masked or raw) statement begins with a Python import keyword. */
    public static boolean isPythonImport(String statement) {
        String t = statement.stripLeading();
        return t.startsWith("import ") || t.startsWith("import\t") || t.startsWith("from ") || t.startsWith("from\t");
    }

    /** True when a statement begins a JavaScript/TypeScript import or re-export declaration. */
    public static boolean isScriptImport(String statement) {
        String t = statement.stripLeading();
        if (t.startsWith("import")) {
            if (t.length() == 6) return false;
            char next = t.charAt(6);
            return Character.isWhitespace(next) || next == '{' || next == '*' || next == '\'' || next == '"';
        }
        if (t.startsWith("export")) {
            String rest = t.substring(6).stripLeading();
            if (rest.startsWith("type ")) rest = rest.substring(5).stripLeading();
            return rest.startsWith("*") || rest.startsWith("{");
        }
        return false;
    }

    public static List<ImportRef> parse(String statement, Language language) {
        return language == Language.PYTHON ? python(statement) : script(statement);
    }

    public static List<ImportRef> python(String statement) {
        List<ImportRef> out = new ArrayList<>();
        if (statement == null) return out;
        String t = SourceLines.squash(stripPythonComments(statement).replace("\\\n", " "));
        if (t.endsWith(";")) t = t.substring(0, t.length() - 1).trim();

        Matcher from = PY_FROM.matcher(t);
        if (from.matches()) {
            String module = from.group(1);
            String names = from.group(2).replace("(", " ").replace(")", " ");
            List<String> symbols = new ArrayList<>();
            for (String item : names.split(",")) {
                String name = firstWord(item);
                if (!name.isEmpty()) symbols.add(name);
            }
            out.add(new ImportRef(module, symbols));
            return out;
        }
        Matcher imp = PY_IMPORT.matcher(t);
        if (imp.matches()) {
            for (String item : imp.group(1).split(",")) {
                String module = firstWord(item);
                if (!module.isEmpty()) out.add(new ImportRef(module));
            }
        }
        return out;
    }

    public static List<ImportRef> script(String statement) {
        List<ImportRef> out = new ArrayList<>();
        if (statement == null) return out;
        String t = SourceLines.squash(BaseNames.stripComments(statement));

        Matcher side = JS_SIDE_EFFECT.matcher(t);
        if (side.find()) {
            if (!side.group(2).isBlank()) out.add(new ImportRef(side.group(2)));
            return out;
        }
        Matcher from = JS_FROM.matcher(t);
        if (!from.find() || from.group(2).isBlank()) return out;
        String module = from.group(2);
        String clause = t.substring(0, from.start()).trim();

        if (clause.startsWith("import")) clause = clause.substring(6).trim();
        else if (clause.startsWith("export")) clause = clause.substring(6).trim();
        if (clause.startsWith("type ") || clause.startsWith("type{")) clause = clause.substring(4).trim();

        out.add(new ImportRef(module, clauseSymbols(clause)));
        return out;
    }

    private static List<String> clauseSymbols(String clause) {
        List<String> symbols = new ArrayList<>();
        String rest = clause;
        int brace = rest.indexOf('{');
        if (brace >= 0) {
            int close = rest.indexOf('}', brace);
            String inner = close < 0 ? rest.substring(brace + 1) : rest.substring(brace + 1, close);
            for (String spec : inner.split(",")) {
                String s = spec.trim();
                if (s.startsWith("type ")) s = s.substring(5).trim();
                String name = firstWord(s);
                if (!name.isEmpty()) symbols.add(name);
            }
            rest = (rest.substring(0, brace) + (close < 0 ? "" : rest.substring(close + 1))).trim();
        }
        for (String part : rest.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            if (p.startsWith("*")) {
                symbols.add("*");
                continue;
            }
            Matcher m = IDENT.matcher(p);
            if (m.lookingAt()) symbols.add(m.group());
        }
        return symbols;
    }

    private static String firstWord(String item) {
        String s = item.trim();
        if (s.startsWith("*")) return "*";
        int sp = 0;
        while (sp < s.length() && !Character.isWhitespace(s.charAt(sp))) sp++;
        return s.substring(0, sp);
    }

    private static String stripPythonComments(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int end = ParameterLists.skipString(text, i, true);
                sb.append(text, i, end);
                i = end - 1;
                continue;
            }
            if (c == '#') {
                while (i < text.length() && text.charAt(i) != '\n') i++;
                sb.append('\n');
                continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }
}

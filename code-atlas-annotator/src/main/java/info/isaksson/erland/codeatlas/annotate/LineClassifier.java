package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.ClassDef;
import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.LineAnnotation;
import info.isaksson.erland.codeatlas.ir.LineCategory;
import info.isaksson.erland.codeatlas.ir.ParsedFile;
import info.isaksson.erland.codeatlas.parse.ImportStatements;
import info.isaksson.erland.codeatlas.parse.PythonSource;
import info.isaksson.erland.codeatlas.parse.ScriptSource;
import info.isaksson.erland.codeatlas.parse.SourceLines;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns a {@link LineCategory} and a one-line explanation to every line of a parsed file that
 * holds code.
 *
 * <p>Rules are tried in {@link LineCategory} declaration order and the first match wins. Blank
 * lines, comment-only lines, docstrings and purely structural lines ({@code else:}, {@code try:},
 * lone braces, {@code } else {}) get no annotation. The only state carried between lines is the
 * lexical state needed to see comments and strings, and the enclosing declaration used to name the
 * context.</p>
 *
 * <p>{@link #classify} takes a {@link ParsedFile} rather than raw lines because the enclosing
 * function or class named in each explanation comes from the parsed definitions and their spans.</p>
 *
 * <p>Stateless; one instance can classify any number of files concurrently.</p>
 */
public final class LineClassifier {

    static final int MAX_CODE_WIDTH = 60;

    private static final Pattern PY_DEF = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)");
    private static final Pattern PY_CLASS = Pattern.compile("^class\\s+([A-Za-z_]\\w*)");
    private static final Pattern PY_CONDITIONAL = Pattern.compile("^(?:if|elif|else|except|match|case)\\b");
    private static final Pattern PY_LOOP = Pattern.compile("^(?:async\\s+)?(?:for|while)\\b");
    private static final Pattern PY_RETURN = Pattern.compile("^return\\b");
    private static final Pattern PY_STRUCTURAL = Pattern.compile("^(?:else|try|finally)\\s*:\\s*$");

    private static final Pattern JS_FUNCTION =
            Pattern.compile("^(?:export\\s+)?(?:default\\s+)?(?:declare\\s+)?(?:async\\s+)?function\\b\\s*\\*?\\s*([A-Za-z_$][\\w$]*)?");
    private static final Pattern JS_CLASS =
            Pattern.compile("^(?:export\\s+)?(?:default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?class\\b\\s*([A-Za-z_$][\\w$]*)?");
    private static final Pattern TS_TYPE =
            Pattern.compile("^(?:export\\s+)?(?:declare\\s+)?(interface|type|enum|namespace)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern JS_CONDITIONAL =
            Pattern.compile("^(?:if\\s*\\(|else\\b|switch\\s*\\(|case\\b|default\\s*:|catch\\b)");
    private static final Pattern JS_LOOP = Pattern.compile("^(?:for|while|do)\\b");
    private static final Pattern JS_RETURN = Pattern.compile("^return\\b");
    private static final Pattern JS_DECLARATION = Pattern.compile("^(?:export\\s+)?(?:declare\\s+)?(?:const|let|var)\\s");
    private static final Pattern JS_STRUCTURAL = Pattern.compile("^[\\s{}()\\[\\];,]*(?:(?:else|try|finally)\\s*\\{?\\s*)?$");
    private static final Pattern JS_UPDATE = Pattern.compile("^(?:\\+\\+|--)\\s*[A-Za-z_$]|^[A-Za-z_$][\\w$.\\[\\]]*\\s*(?:\\+\\+|--)\\s*;?\\s*$");

    private static final Pattern CALL = Pattern.compile(
            "^(?:await\\s+)?(?:new\\s+)?[A-Za-z_$][\\w$]*(?:\\s*(?:\\?\\.|\\.)\\s*[A-Za-z_$#][\\w$]*|\\[[^\\]]*\\])*\\s*(?:<[^>()]*>)?\\s*(?:\\?\\.)?\\(");
    private static final Pattern REQUIRE = Pattern.compile("\\brequire\\s*\\(\\s*(['\"`])([^'\"`]*)\\1\\s*\\)");

    /** Classifies every code line of {@code file}, in line order. */
    public List<LineAnnotation> classify(ParsedFile file) {
        Contexts contexts = new Contexts(file);
        return file.language == Language.PYTHON ? python(file, contexts) : script(file, contexts);
    }

    private List<LineAnnotation> python(ParsedFile file, Contexts contexts) {
        PythonSource source = PythonSource.of(file.lines);
        List<PythonSource.LogicalLine> logical = source.logicalLines();
        List<LineAnnotation> out = new ArrayList<>();
        for (int n = 1; n <= file.lines.size(); n++) {
            String raw = file.lines.get(n - 1);
            if (SourceLines.isBlank(raw) || source.isCommentOnly(n)) continue;
            int index = source.logicalIndexAt(n);
            if (index < 0) continue;
            PythonSource.LogicalLine statement = logical.get(index);
            if (statement.isStringOnly()) continue;
            if (n != statement.startLine) {
                if (raw.strip().startsWith("#")) continue;
                out.add(annotation(n, LineCategory.OTHER, contexts.at(n), raw, ""));
                continue;
            }
            String head = statement.head();
            int[] first = PythonSource.statementRanges(head).get(0);
            String code = head.substring(first[0], first[1]).strip();
            if (PY_STRUCTURAL.matcher(code).matches()) continue;
            out.add(pythonLine(n, code, raw, file, contexts));
        }
        return out;
    }

    private LineAnnotation pythonLine(int n, String code, String raw, ParsedFile file, Contexts contexts) {
        String context = contexts.at(n);
        Matcher def = PY_DEF.matcher(code);
        if (def.find()) return definition(n, contexts, def.group(1), "function");
        Matcher cls = PY_CLASS.matcher(code);
        if (cls.find()) return definition(n, contexts, cls.group(1), "class");
        if (ImportStatements.isPythonImport(code)) return annotation(n, LineCategory.IMPORT, context, raw, "");
        if (PY_CONDITIONAL.matcher(code).find()) return annotation(n, LineCategory.CONDITIONAL, context, raw, "");
        if (PY_LOOP.matcher(code).find()) return annotation(n, LineCategory.LOOP, context, raw, "");
        if (PY_RETURN.matcher(code).find()) return annotation(n, LineCategory.RETURN, context, raw, "");
        if (hasAssignment(code, false)) return annotation(n, LineCategory.ASSIGNMENT, context, raw, "");
        if (CALL.matcher(code).find()) return annotation(n, LineCategory.CALL, context, raw, "");
        return annotation(n, LineCategory.OTHER, context, raw, "");
    }

    private List<LineAnnotation> script(ParsedFile file, Contexts contexts) {
        ScriptSource source = ScriptSource.of(file.lines);
        boolean typescript = file.language == Language.TYPESCRIPT;
        List<LineAnnotation> out = new ArrayList<>();
        for (int n = 1; n <= file.lines.size(); n++) {
            String raw = file.lines.get(n - 1);
            if (SourceLines.isBlank(raw) || source.isCommentOnly(n)) continue;
            if (source.startsInsideLiteral(n)) {
                out.add(annotation(n, LineCategory.OTHER, contexts.at(n), raw, ""));
                continue;
            }
            String masked = source.masked(n).strip();
            if (masked.isEmpty() || JS_STRUCTURAL.matcher(masked).matches()) continue;
            String code = stripClosers(masked);
            out.add(scriptLine(n, code, raw, typescript, contexts));
        }
        return out;
    }

    private LineAnnotation scriptLine(int n, String code, String raw, boolean typescript, Contexts contexts) {
        String context = contexts.at(n);
        LineAnnotation declared = contexts.declarationAt(n);
        if (declared != null) return declared;
        Matcher function = JS_FUNCTION.matcher(code);
        if (function.find()) {
            String name = function.group(1) == null ? "(anonymous)" : function.group(1);
            return definition(n, contexts, name, "function");
        }
        Matcher cls = JS_CLASS.matcher(code);
        if (cls.find() && (cls.group(1) != null || code.startsWith("class"))) {
            return definition(n, contexts, cls.group(1) == null ? "(anonymous)" : cls.group(1), "class");
        }
        if (typescript) {
            Matcher type = TS_TYPE.matcher(code);
            if (type.find()) {
                return new LineAnnotation(n, LineCategory.DEFINITION, "Define " + type.group(1) + " " + type.group(2));
            }
        }
        if (ImportStatements.isScriptImport(code)) return annotation(n, LineCategory.IMPORT, context, raw, "");
        if (JS_CONDITIONAL.matcher(code).find()) return annotation(n, LineCategory.CONDITIONAL, context, raw, "");
        if (JS_LOOP.matcher(code).find()) return annotation(n, LineCategory.LOOP, context, raw, "");
        if (JS_RETURN.matcher(code).find()) return annotation(n, LineCategory.RETURN, context, raw, "");
        String note = requireNote(raw);
        if (JS_DECLARATION.matcher(code).find() || JS_UPDATE.matcher(code).find() || hasAssignment(code, true)) {
            return annotation(n, LineCategory.ASSIGNMENT, context, raw, note);
        }
        if (CALL.matcher(code).find()) return annotation(n, LineCategory.CALL, context, raw, note);
        return annotation(n, LineCategory.OTHER, context, raw, "");
    }

    /** Drops closing brackets a line starts with, so {@code "} else if (x) {"} reads as {@code else if}. */
    private static String stripClosers(String code) {
        int i = 0;
        while (i < code.length() && (code.charAt(i) == '}' || code.charAt(i) == ')' || code.charAt(i) == ']'
                || Character.isWhitespace(code.charAt(i)))) {
            i++;
        }
        return code.substring(i);
    }

    private static String requireNote(String raw) {
        Matcher m = REQUIRE.matcher(raw);
        return m.find() ? " (loads module '" + m.group(2) + "' at runtime)" : "";
    }

    /**
     * True when masked {@code code} assigns at bracket depth zero: a plain or augmented {@code =}
     * that is not part of a comparison or (for scripts) an arrow.
     */
    static boolean hasAssignment(String code, boolean script) {
        int from = 0;
        while (true) {
            int eq = PythonSource.indexAtDepthZero(code, '=', from);
            if (eq < 0) return false;
            char next = eq + 1 < code.length() ? code.charAt(eq + 1) : ' ';
            char prev = eq > 0 ? code.charAt(eq - 1) : ' ';
            char prev2 = eq > 1 ? code.charAt(eq - 2) : ' ';
            if (next == '=' || (script && next == '>')) {
                from = eq + 2;
                while (from < code.length() && code.charAt(from) == '=') from++;
                continue;
            }
            if (prev == '!' || prev == '=' || prev == ':') {
                from = eq + 1;
                continue;
            }
            if ((prev == '<' || prev == '>') && prev2 != prev) {
                from = eq + 1;
                continue;
            }
            return true;
        }
    }

    private static LineAnnotation definition(int n, Contexts contexts, String name, String kind) {
        LineAnnotation declared = contexts.declarationAt(n);
        if (declared != null) return declared;
        return new LineAnnotation(n, LineCategory.DEFINITION, "Define " + kind + " " + name);
    }

    private static LineAnnotation annotation(int n, LineCategory category, String context, String raw, String note) {
        StringBuilder sb = new StringBuilder(category.label);
        if (context != null) sb.append(" in ").append(context);
        sb.append(": ").append(snippet(raw)).append(note);
        return new LineAnnotation(n, category, sb.toString());
    }

    static String snippet(String raw) {
        String code = raw.strip();
        return code.length() <= MAX_CODE_WIDTH ? code : code.substring(0, MAX_CODE_WIDTH) + "...";
    }

    /** Enclosing declaration of each line, taken from the parsed structure. */
    private static final class Contexts {
        private final String[] byLine;
        private final Map<Integer, LineAnnotation> declarations = new HashMap<>();

        Contexts(ParsedFile file) {
            int count = file.lines.size();
            byLine = new String[count + 1];
            int[] start = new int[count + 1];
            for (ClassDef c : file.classes) {
                mark(c.startLine, c.endLine, "class " + c.name, start, true);
                declarations.putIfAbsent(c.startLine, new LineAnnotation(c.startLine, LineCategory.DEFINITION, "Define class " + c.name));
            }
            for (FunctionDef f : file.functions) {
                String context = f.isMethod() ? "method " + f.qualifiedName() : "function " + f.name;
                mark(f.startLine, f.endLine, context, start, false);
                String text = f.isMethod() ? "Define method " + f.name + " of class " + f.ownerClass : "Define function " + f.name;
                declarations.putIfAbsent(f.startLine, new LineAnnotation(f.startLine, LineCategory.DEFINITION, text));
            }
        }

        /** Functions override the class they sit in; the innermost (latest starting) one wins. */
        private void mark(int from, int to, String context, int[] start, boolean isClass) {
            for (int line = Math.max(1, from + 1); line <= Math.min(to, byLine.length - 1); line++) {
                if (byLine[line] == null || (!isClass && from >= start[line]) || (isClass && from > start[line])) {
                    byLine[line] = context;
                    start[line] = from;
                }
            }
        }

        String at(int line) {
            return line < byLine.length ? byLine[line] : null;
        }

        LineAnnotation declarationAt(int line) {
            return declarations.get(line);
        }
    }
}

package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JavaScript / TypeScript fallback. Works on masked lines at bracket depth zero (depth one for class
 * members); bodies end at the matching brace.
 */
final class ScriptPatternScanner implements PatternScanner {

    private static final String IDENT = "[A-Za-z_$][\\w$]*";

    private static final Pattern FUNCTION = Pattern.compile(
            "^(?:export\\s+(?:default\\s+)?)?(?:async\\s+)?function\\b\\s*\\*?\\s*(" + IDENT + ")");
    private static final Pattern CLASS = Pattern.compile(
            "^(?:export\\s+(?:default\\s+)?)?(?:abstract\\s+)?class\\s+(" + IDENT + ")");
    private static final Pattern VARIABLE = Pattern.compile(
            "^(?:export\\s+)?(?:const|let|var)\\s+(" + IDENT + ")\\s*(?::[^=]*)?=(?![=>])\\s*(?:async\\b\\s*)?");
    private static final Pattern FUNCTION_KEYWORD = Pattern.compile("^function\\b\\s*\\*?\\s*(?:" + IDENT + ")?\\s*");
    private static final Pattern SINGLE_PARAM_ARROW = Pattern.compile("^(" + IDENT + ")\\s*=>");
    private static final Pattern ARROW_AFTER_PARAMS = Pattern.compile("^\\s*(?::[^=;{]*)?=>");
    private static final Pattern METHOD = Pattern.compile(
            "^(?:(?:static|async|get|set|public|private|protected|readonly|override|accessor)\\s+)*\\*?\\s*(#?" + IDENT + ")\\s*\\??\\s*(?:<[^(]*>)?\\s*\\(");
    private static final Pattern LEADING_DECORATORS = Pattern.compile("^(?:@[\\w$.]+(?:\\([^)]*\\))?\\s*)+");
    private static final Pattern FROM_DONE = Pattern.compile("\\bfrom\\s*(['\"])[^'\"\\n]*\\1");
    private static final Pattern SIDE_EFFECT_DONE = Pattern.compile("^\\s*import\\s*(['\"])[^'\"\\n]*\\1");

    private static final Set<String> NOT_METHODS = Set.of(
            "if", "for", "while", "switch", "catch", "function", "return", "with", "super", "new", "await", "typeof");

    private final Language language;

    ScriptPatternScanner(Language language) {
        this.language = language;
    }

    @Override
    public Extraction scan(List<String> lines) {
        ScriptSource src = ScriptSource.of(lines);
        Extraction out = new Extraction();
        int n = src.lineCount();
        for (int ln = 1; ln <= n; ln++) {
            if (src.depthAtStart(ln) != 0 || src.startsInsideLiteral(ln)) continue;
            String code = src.masked(ln);
            String head = code.stripLeading();
            if (head.isEmpty()) continue;
            int offset = code.length() - head.length();

            if (ImportStatements.isScriptImport(head)) {
                ln = importStatement(src, ln, out);
                continue;
            }
            if (head.startsWith("declare ")) continue;

            Matcher m = FUNCTION.matcher(head);
            if (m.find()) {
                function(src, ln, offset + m.end(), m.group(1), null, out);
                continue;
            }
            m = CLASS.matcher(head);
            if (m.find()) {
                classDef(src, ln, offset + m.end(), m.group(1), out);
                continue;
            }
            m = VARIABLE.matcher(head);
            if (m.find()) {
                variable(src, ln, offset + m.end(), m.group(1), out);
            }
        }
        return out;
    }

    private int importStatement(ScriptSource src, int ln, Extraction out) {
        int n = src.lineCount();
        StringBuilder masked = new StringBuilder();
        StringBuilder raw = new StringBuilder();
        int k = ln;
        for (; k <= n && k < ln + 50; k++) {
            if (k > ln) {
                masked.append('\n');
                raw.append('\n');
            }
            masked.append(src.masked(k));
            raw.append(src.lines().get(k - 1));
            String joined = masked.toString();
            if (FROM_DONE.matcher(joined).find() || SIDE_EFFECT_DONE.matcher(joined).find()) break;
            if (src.masked(k).indexOf(';') >= 0) break;
            boolean closed = k == n || src.depthAtStart(k + 1) == 0;
            if (closed && (k == n || !src.masked(k + 1).stripLeading().startsWith("from"))) break;
        }
        out.addImports(ImportStatements.script(raw.toString()));
        return Math.min(k, n);
    }

    private void classDef(ScriptSource src, int ln, int afterName, String name, Extraction out) {
        int[] brace = src.findAtDepthZero(ln, afterName, "{;", 20);
        if (brace == null || src.masked(brace[0]).charAt(brace[1]) != '{') return;
        int[] close = src.findClose(brace[0], brace[1]);
        if (close == null) return;
        List<String> bases = BaseNames.script(src.rawBetween(ln, afterName, brace[0], brace[1]));
        out.addClass(new Extraction.ClassDraft(name, bases, DocComments.jsDocAbove(src.lines(), ln), ln, close[0]));

        int memberDepth = src.depthAtStart(ln) + 1;
        for (int k = brace[0] + 1; k <= close[0]; k++) {
            if (src.depthAtStart(k) != memberDepth || src.startsInsideLiteral(k)) continue;
            String code = src.masked(k);
            String head = code.stripLeading();
            Matcher deco = LEADING_DECORATORS.matcher(head);
            if (deco.lookingAt()) head = head.substring(deco.end());
            int offset = code.length() - head.length();
            Matcher m = METHOD.matcher(head);
            if (!m.find() || NOT_METHODS.contains(m.group(1))) continue;
            function(src, k, offset + m.end() - 1, m.group(1), name, out);
        }
    }

    /**
     * Adds a function whose parameter list opens at or after ({@code ln}, {@code from}) and whose
     * body is the next brace block. Signatures without a body are ignored.
     */
    private void function(ScriptSource src, int ln, int from, String name, String owner, Extraction out) {
        int[] open = src.findAtDepthZero(ln, from, "(", 5);
        if (open == null) return;
        int[] close = src.findClose(open[0], open[1]);
        if (close == null) return;
        int[] body = src.findAtDepthZero(close[0], close[1] + 1, "{;=", 10);
        if (body == null || src.masked(body[0]).charAt(body[1]) != '{') return;
        int[] end = src.findClose(body[0], body[1]);
        if (end == null) return;
        List<String> params = ParameterLists.split(src.rawBetween(open[0], open[1] + 1, close[0], close[1]), language);
        out.addFunction(new Extraction.FunctionDraft(name, params, DocComments.jsDocAbove(src.lines(), ln), ln, end[0], owner));
    }

    private void variable(ScriptSource src, int ln, int valueColumn, String name, Extraction out) {
        String code = src.masked(ln);
        String value = code.substring(Math.min(valueColumn, code.length()));
        List<String> params;
        int[] arrowEnd;

        Matcher fn = FUNCTION_KEYWORD.matcher(value);
        if (fn.lookingAt()) {
            function(src, ln, valueColumn + fn.end(), name, null, out);
            return;
        }
        Matcher single = SINGLE_PARAM_ARROW.matcher(value);
        if (single.lookingAt()) {
            params = List.of(single.group(1));
            arrowEnd = new int[]{ln, valueColumn + single.end()};
        } else {
            int paren = value.indexOf('(');
            if (paren < 0 || !(paren == 0 || value.charAt(0) == '<')) return;
            int[] close = src.findClose(ln, valueColumn + paren);
            if (close == null) return;
            String after = src.masked(close[0]).substring(close[1] + 1);
            Matcher arrow = ARROW_AFTER_PARAMS.matcher(after);
            if (!arrow.lookingAt()) return;
            params = ParameterLists.split(src.rawBetween(ln, valueColumn + paren + 1, close[0], close[1]), language);
            arrowEnd = new int[]{close[0], close[1] + 1 + arrow.end()};
        }
        int end = arrowBodyEnd(src, arrowEnd[0], arrowEnd[1]);
        out.addFunction(new Extraction.FunctionDraft(name, params, DocComments.jsDocAbove(src.lines(), ln), ln, end, null));
    }

    /** Last line of an arrow function body starting right after {@code =>}. */
    private static int arrowBodyEnd(ScriptSource src, int ln, int column) {
        int n = src.lineCount();
        String rest = src.masked(ln).substring(Math.min(column, src.masked(ln).length()));
        int k = ln;
        int col = column;
        while (rest.isBlank() && k < n) {
            k++;
            rest = src.masked(k);
            col = 0;
        }
        int lead = rest.length() - rest.stripLeading().length();
        if (rest.stripLeading().startsWith("{")) {
            int[] close = src.findClose(k, col + lead);
            return close == null ? k : close[0];
        }
        // expression body: runs to ';' or ',' at depth zero, or to a line break that ends the statement
        int depth = 0;
        for (int line = k; line <= n; line++) {
            String m = src.masked(line);
            for (int c = line == k ? col : 0; c < m.length(); c++) {
                char ch = m.charAt(c);
                if (ch == '(' || ch == '[' || ch == '{') depth++;
                else if (ch == ')' || ch == ']' || ch == '}') {
                    depth--;
                    if (depth < 0) return line;
                } else if (depth == 0 && (ch == ';' || ch == ',')) {
                    return line;
                }
            }
            if (depth == 0 && !continuesOnNextLine(src, line)) return line;
        }
        return n;
    }

    private static boolean continuesOnNextLine(ScriptSource src, int line) {
        String tail = src.masked(line).stripTrailing();
        if (!tail.isEmpty() && "=+-*/%&|^!?:,.(<>".indexOf(tail.charAt(tail.length() - 1)) >= 0) return true;
        for (int k = line + 1; k <= src.lineCount(); k++) {
            String head = src.masked(k).stripLeading();
            if (head.isEmpty()) continue;
            return head.startsWith(".") || head.startsWith("?") || head.startsWith(":")
                    || head.startsWith("+") || head.startsWith("-") || head.startsWith("*")
                    || head.startsWith("&&") || head.startsWith("||");
        }
        return false;
    }

}

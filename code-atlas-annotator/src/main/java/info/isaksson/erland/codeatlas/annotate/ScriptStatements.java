package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.parse.ParameterLists;
import info.isaksson.erland.codeatlas.parse.ScriptSource;
import info.isaksson.erland.codeatlas.parse.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the statement tree of a JavaScript/TypeScript function by walking its masked source text.
 * Statements end at {@code ;}, at a closing brace, or at a line break where automatic semicolon
 * insertion would apply.
 */
final class ScriptStatements {

    private static final Pattern FOR_IN_OF =
            Pattern.compile("^\\s*(?:(?:const|let|var)\\s+)?(.+?)\\s+(of|in)\\s+(.+?)\\s*$", Pattern.DOTALL);
    private static final Pattern INCREMENT =
            Pattern.compile("^(?:(\\+\\+|--)\\s*([\\w$.\\[\\]]+)|([\\w$.\\[\\]]+)\\s*(\\+\\+|--))$");
    private static final Pattern NAMED = Pattern.compile("^(?:async\\s+)?(function\\*?|class)\\s*([\\w$]*)");
    private static final String[] AUGMENTED = {
            ">>>=", "**=", ">>=", "<<=", "&&=", "||=", "??=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^="
    };

    private final Language language;
    private final String code;
    private final String raw;
    private final int[] lineStarts;
    private final int firstLine;
    private int pos;
    private int nesting;

    private ScriptStatements(Language language, String code, String raw, int[] lineStarts, int firstLine) {
        this.language = language;
        this.code = code;
        this.raw = raw;
        this.lineStarts = lineStarts;
        this.firstLine = firstLine;
    }

    static Optional<FunctionBody> build(List<String> lines, FunctionDef fn, Language language) {
        ScriptSource source = ScriptSource.of(lines);
        StringBuilder code = new StringBuilder();
        StringBuilder raw = new StringBuilder();
        int count = fn.endLine - fn.startLine + 1;
        int[] starts = new int[count];
        for (int i = 0; i < count; i++) {
            int ln = fn.startLine + i;
            if (i > 0) {
                code.append('\n');
                raw.append('\n');
            }
            starts[i] = code.length();
            code.append(source.masked(ln));
            raw.append(source.lines().get(ln - 1));
        }
        ScriptStatements builder = new ScriptStatements(language, code.toString(), raw.toString(), starts, fn.startLine);
        try {
            return builder.function(fn);
        } catch (UnresolvedException e) {
            return Optional.empty();
        }
    }

    private Optional<FunctionBody> function(FunctionDef fn) {
        int lines = Math.max(0, fn.endLine - fn.startLine);
        int paren = code.indexOf('(');
        int arrow = code.indexOf("=>");
        int after;
        if (arrow >= 0 && (paren < 0 || arrow < paren)) {
            after = arrow + 2;
        } else {
            if (paren < 0) return Optional.empty();
            int close = matchClose(paren);
            if (close < 0) return Optional.empty();
            int brace = code.indexOf('{', close);
            int arrowAfter = code.indexOf("=>", close);
            if (arrowAfter >= 0 && (brace < 0 || arrowAfter < brace)) {
                after = arrowAfter + 2;
            } else if (brace >= 0) {
                int end = matchClose(brace);
                if (end < 0) return Optional.empty();
                pos = brace + 1;
                List<Stmt> body = statements(end - 1, 0);
                return Optional.of(new FunctionBody(body, nesting, lines));
            } else {
                return Optional.empty();
            }
        }
        pos = after;
        skipSpace(code.length());
        if (pos < code.length() && code.charAt(pos) == '{') {
            int end = matchClose(pos);
            if (end < 0) return Optional.empty();
            pos++;
            return Optional.of(new FunctionBody(statements(end - 1, 0), nesting, lines));
        }
        int start = pos;
        int stop = statementEnd(code.length());
        String value = raw.substring(start, stop).trim();
        List<Stmt> body = List.of(new Stmt.Return(lineOf(start), squash(value), expr(value), squash(value)));
        return Optional.of(new FunctionBody(body, 0, lines));
    }

    /** Offset just past the bracket matching the opener at {@code open}, or -1. */
    private int matchClose(int open) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) return i + 1;
            }
        }
        return -1;
    }

    private int lineOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) lo = mid;
            else hi = mid - 1;
        }
        return firstLine + lo;
    }

    private void skipSpace(int end) {
        while (pos < end && Character.isWhitespace(code.charAt(pos))) pos++;
    }

    private void skipSpaceAndSemicolons(int end) {
        while (pos < end && (Character.isWhitespace(code.charAt(pos)) || code.charAt(pos) == ';')) pos++;
    }

    private String wordAt(int at) {
        int e = at;
        while (e < code.length() && (Character.isJavaIdentifierPart(code.charAt(e)))) e++;
        return code.substring(at, e);
    }

    private boolean acceptWord(String word, int end) {
        skipSpace(end);
        if (pos < end && wordAt(pos).equals(word)) {
            pos += word.length();
            return true;
        }
        return false;
    }

    private List<Stmt> statements(int end, int depth) {
        nesting = Math.max(nesting, depth);
        List<Stmt> out = new ArrayList<>();
        while (true) {
            skipSpaceAndSemicolons(end);
            if (pos >= end) break;
            int before = pos;
            statement(end, depth, out);
            if (pos == before) pos++;
        }
        pos = Math.max(pos, end + 1);
        return out;
    }

    /** Statement or braced block after a control header. */
    private List<Stmt> body(int end, int depth) {
        skipSpace(end);
        if (pos < end && code.charAt(pos) == '{') {
            int close = matchClose(pos);
            if (close < 0 || close > end + 1) throw new UnresolvedException("unbalanced block");
            pos++;
            return statements(close - 1, depth);
        }
        nesting = Math.max(nesting, depth);
        List<Stmt> out = new ArrayList<>();
        statement(end, depth, out);
        return out;
    }

    /** Text inside the parentheses that follow, advancing past them. Offsets are {start, end}. */
    private int[] parenthesized(int end) {
        skipSpace(end);
        if (pos >= end || code.charAt(pos) != '(') throw new UnresolvedException("expected '('");
        int close = matchClose(pos);
        if (close < 0) throw new UnresolvedException("unbalanced parentheses");
        int[] range = {pos + 1, close - 1};
        pos = close;
        return range;
    }

    private void statement(int end, int depth, List<Stmt> out) {
        int start = pos;
        int line = lineOf(start);
        char c = code.charAt(pos);
        if (c == '{') {
            out.addAll(body(end, depth));
            return;
        }
        String word = wordAt(pos);
        switch (word) {
            case "if":
                pos += 2;
                out.add(ifChain(start, end, depth));
                return;
            case "for":
                pos += 3;
                acceptWord("await", end);
                out.add(forLoop(start, end, depth));
                return;
            case "while": {
                pos += 5;
                int[] test = parenthesized(end);
                String testText = raw.substring(test[0], test[1]);
                List<Stmt> loopBody = body(end, depth + 1);
                out.add(new Stmt.While(line, squash(raw.substring(start, test[1] + 1)), expr(testText), squash(testText), loopBody, null, false));
                return;
            }
            case "do": {
                pos += 2;
                List<Stmt> loopBody = body(end, depth + 1);
                if (!acceptWord("while", end)) throw new UnresolvedException("do without while");
                int[] test = parenthesized(end);
                String testText = raw.substring(test[0], test[1]);
                out.add(new Stmt.While(lineOf(test[0]), "do ... while (" + squash(testText) + ")", expr(testText), squash(testText), loopBody, null, true));
                return;
            }
            case "return": {
                pos += 6;
                int stop = statementEnd(end);
                String value = raw.substring(start + 6, stop).trim();
                String text = squash(raw.substring(start, stop));
                out.add(value.isEmpty() ? new Stmt.Return(line, text, null, null)
                        : new Stmt.Return(line, text, expr(value), squash(value)));
                return;
            }
            case "break":
            case "continue": {
                int stop = statementEnd(end);
                String text = squash(raw.substring(start, stop));
                out.add(word.equals("break") ? new Stmt.Break(line, text) : new Stmt.Continue(line, text));
                return;
            }
            case "throw": {
                int stop = statementEnd(end);
                out.add(new Stmt.Raise(line, squash(raw.substring(start, stop))));
                return;
            }
            case "const":
            case "let":
            case "var": {
                pos += word.length();
                int stop = statementEnd(end);
                declarations(line, raw.substring(start + word.length(), stop), squash(raw.substring(start, stop)), out);
                return;
            }
            case "try":
                pos += 3;
                out.add(tryStatement(start, end, depth));
                return;
            case "switch": {
                pos += 6;
                int[] subject = parenthesized(end);
                skipSpace(end);
                if (pos < end && code.charAt(pos) == '{') {
                    int close = matchClose(pos);
                    pos = close < 0 ? end : close;
                }
                out.add(new Stmt.Placeholder(line, "switch (" + squash(raw.substring(subject[0], subject[1])) + ")", null, null));
                return;
            }
            case "function":
            case "class":
            case "async":
                if (nestedDeclaration(start, end, out)) return;
                break;
            default:
                break;
        }
        int stop = statementEnd(end);
        out.add(simple(line, code.substring(start, stop), raw.substring(start, stop)));
    }

    private Stmt ifChain(int start, int end, int depth) {
        List<Stmt.Branch> branches = new ArrayList<>();
        List<Stmt> orElse = null;
        int elseLine = 0;
        int branchLine = lineOf(start);
        while (true) {
            int[] test = parenthesized(end);
            String testText = raw.substring(test[0], test[1]);
            branches.add(new Stmt.Branch(branchLine, expr(testText), squash(testText), body(end, depth + 1)));
            int save = pos;
            skipSpaceAndSemicolonsBeforeElse(end);
            if (!acceptWord("else", end)) {
                pos = save;
                break;
            }
            int elseAt = pos - 4;
            skipSpace(end);
            if (pos < end && wordAt(pos).equals("if")) {
                branchLine = lineOf(elseAt);
                pos += 2;
                continue;
            }
            elseLine = lineOf(elseAt);
            orElse = body(end, depth + 1);
            break;
        }
        return new Stmt.If(lineOf(start), squash(raw.substring(start, Math.min(raw.length(), lineEnd(start)))), branches, orElse, elseLine);
    }

    /** An unbraced branch may leave its {@code ;} behind before {@code else}. */
    private void skipSpaceAndSemicolonsBeforeElse(int end) {
        int p = pos;
        while (p < end && (Character.isWhitespace(code.charAt(p)) || code.charAt(p) == ';')) p++;
        if (p < end && wordAt(p).equals("else")) pos = p;
    }

    private int lineEnd(int offset) {
        int nl = raw.indexOf('\n', offset);
        return nl < 0 ? raw.length() : nl;
    }

    private Stmt forLoop(int start, int end, int depth) {
        int line = lineOf(start);
        int[] header = parenthesized(end);
        String maskedHeader = code.substring(header[0], header[1]);
        String rawHeader = raw.substring(header[0], header[1]);
        String text = "for (" + squash(rawHeader) + ")";
        List<Integer> semis = new ArrayList<>();
        int d = 0;
        for (int i = 0; i < maskedHeader.length(); i++) {
            char c = maskedHeader.charAt(i);
            if (c == '(' || c == '[' || c == '{') d++;
            else if (c == ')' || c == ']' || c == '}') d--;
            else if (c == ';' && d == 0) semis.add(i);
        }
        List<Stmt> loopBody;
        if (semis.size() == 2) {
            String init = rawHeader.substring(0, semis.get(0)).trim();
            String test = rawHeader.substring(semis.get(0) + 1, semis.get(1)).trim();
            String update = rawHeader.substring(semis.get(1) + 1).trim();
            String maskedInit = maskedHeader.substring(0, semis.get(0)).trim();
            String maskedUpdate = maskedHeader.substring(semis.get(1) + 1).trim();
            loopBody = body(end, depth + 1);
            Stmt initStmt = null;
            if (!init.isEmpty()) {
                String keyword = wordOf(maskedInit);
                if (keyword.equals("let") || keyword.equals("var") || keyword.equals("const")) {
                    List<Stmt> decls = new ArrayList<>();
                    declarations(line, init.substring(keyword.length()), squash(init), decls);
                    initStmt = decls.size() == 1 ? decls.get(0) : new Stmt.Placeholder(line, squash(init), null, null);
                } else {
                    initStmt = simple(line, maskedInit, init);
                }
            }
            Stmt updateStmt = update.isEmpty() ? null : simple(line, maskedUpdate, update);
            return new Stmt.ForClassic(line, text, initStmt, test.isEmpty() ? null : expr(test), squash(test), updateStmt, loopBody);
        }
        Matcher m = FOR_IN_OF.matcher(maskedHeader);
        loopBody = body(end, depth + 1);
        if (!m.matches()) return new Stmt.Placeholder(line, text, null, null);
        String target = stripAnnotation(maskedHeader.substring(m.start(1), m.end(1)), rawHeader.substring(m.start(1), m.end(1)));
        String iterable = rawHeader.substring(m.start(3), m.end(3));
        boolean keys = m.group(2).equals("in");
        return new Stmt.ForEach(line, text, expr(target), expr(iterable), squash(iterable), keys, loopBody, null);
    }

    private static String wordOf(String text) {
        int e = 0;
        while (e < text.length() && Character.isJavaIdentifierPart(text.charAt(e))) e++;
        return text.substring(0, e);
    }

    private Stmt tryStatement(int start, int end, int depth) {
        List<Stmt> block = body(end, depth + 1);
        List<Stmt> cleanup = null;
        if (acceptWord("catch", end)) {
            skipSpace(end);
            if (pos < end && code.charAt(pos) == '(') parenthesized(end);
            body(end, depth + 1);
        }
        if (acceptWord("finally", end)) {
            cleanup = body(end, depth + 1);
        }
        return new Stmt.Try(lineOf(start), "try", block, cleanup);
    }

    private boolean nestedDeclaration(int start, int end, List<Stmt> out) {
        Matcher m = NAMED.matcher(code.substring(start, Math.min(end, lineEnd(start))));
        if (!m.find()) return false;
        int brace;
        if (m.group(1).equals("class")) {
            brace = code.indexOf('{', start);
        } else {
            int paren = code.indexOf('(', start);
            if (paren < 0 || paren > end) return false;
            int close = matchClose(paren);
            brace = close < 0 ? -1 : code.indexOf('{', close);
        }
        if (brace < 0 || brace > end) return false;
        int close = matchClose(brace);
        pos = close < 0 ? end : close;
        String what = m.group(1).equals("class") ? "class" : "function";
        String name = m.group(2);
        String text = squash(raw.substring(start, lineEnd(start)));
        out.add(new Stmt.Placeholder(lineOf(start), text,
                name.isEmpty() ? null : "define nested " + what + " " + name,
                name.isEmpty() ? null : List.of(name)));
        return true;
    }

    /** End offset (exclusive) of the simple statement at {@code pos}; advances past a terminating {@code ;}. */
    private int statementEnd(int end) {
        int depth = 0;
        boolean template = false;
        int start = pos;
        int i = pos;
        while (i < end) {
            char c = code.charAt(i);
            if (c == '`') template = !template;
            if (template) {
                i++;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) break;
                depth--;
            } else if (depth == 0 && c == ';') {
                pos = i + 1;
                return i;
            } else if (depth == 0 && c == '\n' && endsAtNewline(start, i, end)) {
                pos = i;
                return i;
            }
            i++;
        }
        pos = i;
        return i;
    }

    private boolean endsAtNewline(int start, int newline, int end) {
        String before = code.substring(start, newline).stripTrailing();
        if (before.isEmpty()) return false;
        if (before.endsWith("++") || before.endsWith("--")) return true;
        char last = before.charAt(before.length() - 1);
        if ("+-*/%&|^!=<>?:,.(".indexOf(last) >= 0) return false;
        int n = newline + 1;
        while (n < end && Character.isWhitespace(code.charAt(n))) n++;
        if (n >= end) return true;
        if (code.startsWith("++", n) || code.startsWith("--", n)) return true;
        return ".?:+-*/%&|^=<>,)]".indexOf(code.charAt(n)) < 0;
    }

    private void declarations(int line, String rawList, String text, List<Stmt> out) {
        for (String piece : ParameterLists.split(rawList, language)) {
            int eq = topLevelAssign(piece);
            if (eq < 0) {
                String target = stripAnnotation(piece, piece);
                out.add(new Stmt.Assign(line, text, List.of(expr(target)), new Expr.Literal(Nothing.UNDEFINED), "undefined"));
                continue;
            }
            String target = stripAnnotation(piece.substring(0, eq), piece.substring(0, eq));
            String value = piece.substring(eq + 1).trim();
            out.add(new Stmt.Assign(line, text, List.of(expr(target)), expr(value), squash(value)));
        }
    }

    /** First plain {@code =} outside brackets and string literals, or -1. */
    private static int topLevelAssign(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                int close = text.indexOf(c, i + 1);
                if (close < 0) return -1;
                i = close;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == '=' && depth == 0 && isPlainAssign(text, i)) return i;
        }
        return -1;
    }

    private static boolean isPlainAssign(String text, int i) {
        char prev = i > 0 ? text.charAt(i - 1) : ' ';
        char next = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
        return next != '=' && next != '>' && "=!<>+-*/%&|^?".indexOf(prev) < 0;
    }

    /** {@code x: number} becomes {@code x}; destructuring patterns keep their braces. */
    private static String stripAnnotation(String masked, String rawText) {
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == ':' && depth == 0) {
                String head = rawText.substring(0, i).trim();
                return head.endsWith("!") || head.endsWith("?") ? head.substring(0, head.length() - 1) : head;
            }
        }
        return rawText.trim();
    }

    private Stmt simple(int line, String masked, String rawText) {
        int lead = 0;
        while (lead < masked.length() && Character.isWhitespace(masked.charAt(lead))) lead++;
        int trail = masked.length();
        while (trail > lead && (Character.isWhitespace(masked.charAt(trail - 1)) || masked.charAt(trail - 1) == ';')) trail--;
        String code = masked.substring(lead, trail);
        String text = rawText.substring(lead, trail);
        String shown = squash(text);
        Matcher inc = INCREMENT.matcher(code);
        if (inc.matches()) {
            boolean prefix = inc.group(1) != null;
            String op = prefix ? inc.group(1) : inc.group(4);
            int targetStart = prefix ? inc.start(2) : inc.start(3);
            int targetEnd = prefix ? inc.end(2) : inc.end(3);
            return new Stmt.AugAssign(line, shown, expr(text.substring(targetStart, targetEnd)),
                    op.equals("++") ? "+" : "-", new Expr.Literal(1L), "1");
        }
        int depth = 0;
        List<Integer> equals = new ArrayList<>();
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
                continue;
            }
            if (c == ')' || c == ']' || c == '}') {
                depth--;
                continue;
            }
            if (depth != 0) continue;
            if (code.startsWith("=>", i)) break;
            if (equals.isEmpty()) {
                for (String op : AUGMENTED) {
                    if (code.startsWith(op, i)) {
                        String bare = op.substring(0, op.length() - 1);
                        if (bare.equals("&&") || bare.equals("||") || bare.equals("??") || bare.equals(">>>")) {
                            return new Stmt.Placeholder(line, shown, null, names(text.substring(0, i)));
                        }
                        String value = text.substring(i + op.length()).trim();
                        return new Stmt.AugAssign(line, shown, expr(text.substring(0, i)), bare, expr(value), squash(value));
                    }
                }
            }
            if (c == '=' && isPlainAssign(code, i)) equals.add(i);
            else if (c == '=' && i + 2 < code.length() && code.charAt(i + 1) == '=') i += code.charAt(i + 2) == '=' ? 2 : 1;
        }
        if (equals.isEmpty()) return new Stmt.ExprStmt(line, shown, expr(text));
        List<Expr> targets = new ArrayList<>();
        int from = 0;
        for (int eq : equals) {
            targets.add(expr(text.substring(from, eq)));
            from = eq + 1;
        }
        String value = text.substring(from).trim();
        return new Stmt.Assign(line, shown, targets, expr(value), squash(value));
    }

    private List<String> names(String target) {
        List<String> out = new ArrayList<>();
        expr(target).collectNames(out);
        return out;
    }

    private Expr expr(String text) {
        try {
            return ExpressionParser.parse(text.trim(), language);
        } catch (UnresolvedException e) {
            return new Expr.Unsupported(squash(text));
        }
    }

    private static String squash(String text) {
        return SourceLines.squash(text);
    }
}

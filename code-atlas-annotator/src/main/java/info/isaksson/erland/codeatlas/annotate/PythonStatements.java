package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.FunctionDef;
import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.parse.PythonSource;
import info.isaksson.erland.codeatlas.parse.PythonSource.LogicalLine;
import info.isaksson.erland.codeatlas.parse.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the statement tree of a Python function from its logical lines. Blocks follow
 * indentation; statements the walker does not model become {@link Stmt.Placeholder}s.
 */
final class PythonStatements {

    private static final Pattern DEF_HEADER = Pattern.compile("^(?:async\\s+)?def\\s+[A-Za-z_]\\w*\\s*\\(");
    private static final Pattern KEYWORD = Pattern.compile("^([A-Za-z_]\\w*)");
    private static final Pattern IN_WORD = Pattern.compile("\\bin\\b");
    private static final Pattern LAMBDA = Pattern.compile("\\blambda\\b");
    private static final Pattern AS_NAME = Pattern.compile("\\bas\\s+([A-Za-z_]\\w*)");
    private static final Pattern NESTED_DEF = Pattern.compile("^(?:async\\s+)?(def|class)\\s+([A-Za-z_]\\w*)");
    private static final String[] AUGMENTED = {
            "**=", "//=", ">>=", "<<=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@="
    };

    private final PythonSource source;
    private final List<LogicalLine> logical;
    private int nesting;

    private PythonStatements(PythonSource source) {
        this.source = source;
        this.logical = source.logicalLines();
    }

    /** Statement tree of {@code fn}, or empty when its header cannot be located. */
    static Optional<FunctionBody> build(List<String> lines, FunctionDef fn) {
        PythonSource source = PythonSource.of(lines);
        return new PythonStatements(source).function(fn);
    }

    private Optional<FunctionBody> function(FunctionDef fn) {
        int header = -1;
        for (int k = 0; k < logical.size(); k++) {
            LogicalLine ll = logical.get(k);
            if (ll.startLine < fn.startLine) continue;
            if (ll.startLine > fn.endLine) break;
            if (DEF_HEADER.matcher(ll.head()).find()) {
                header = k;
                break;
            }
        }
        if (header < 0) return Optional.empty();
        LogicalLine ll = logical.get(header);
        int colon = headerColon(ll.code);
        if (colon < 0) return Optional.empty();
        List<Stmt> body;
        if (!ll.code.substring(colon + 1).isBlank()) {
            body = new ArrayList<>();
            simpleStatements(ll, colon + 1, body);
        } else {
            body = block(header + 1, source.blockEndIndex(header), 0);
        }
        return Optional.of(new FunctionBody(body, nesting, Math.max(0, fn.endLine - ll.startLine)));
    }

    /** Colon ending a compound-statement header: the first one at bracket depth zero after any parameter list. */
    private static int headerColon(String code) {
        int from = 0;
        Matcher def = DEF_HEADER.matcher(code.stripLeading());
        if (def.find()) {
            int open = code.indexOf('(');
            int close = PythonSource.matchClose(code, open);
            if (close < 0) return -1;
            from = close;
        }
        return PythonSource.indexAtDepthZero(code, ':', from);
    }

    private List<Stmt> block(int from, int to, int depth) {
        nesting = Math.max(nesting, depth);
        List<Stmt> out = new ArrayList<>();
        int k = from;
        while (k <= to) {
            LogicalLine ll = logical.get(k);
            if (ll.isStringOnly()) {
                k++;
                continue;
            }
            String keyword = keyword(ll.head());
            switch (keyword) {
                case "if":
                    k = ifChain(k, to, depth, out);
                    break;
                case "for":
                case "while":
                    k = loop(k, to, depth, keyword, out);
                    break;
                case "try":
                    k = tryStatement(k, to, depth, out);
                    break;
                case "with":
                    k = withStatement(k, depth, out);
                    break;
                case "def":
                case "class":
                case "async":
                case "match":
                case "elif":
                case "else":
                case "except":
                case "finally":
                    k = skipped(k, out);
                    break;
                default:
                    simpleStatements(ll, 0, out);
                    k++;
                    break;
            }
        }
        return out;
    }

    private static String keyword(String head) {
        Matcher m = KEYWORD.matcher(head);
        return m.find() ? m.group(1) : "";
    }

    private int suiteEnd(int header, int to) {
        return Math.min(source.blockEndIndex(header), to);
    }

    /** Body of the compound statement at {@code header}; also returns where the next sibling starts via {@code next[0]}. */
    private List<Stmt> suite(int header, int to, int depth, int[] next) {
        LogicalLine ll = logical.get(header);
        int colon = headerColon(ll.code);
        int end = suiteEnd(header, to);
        next[0] = end + 1;
        if (colon >= 0 && !ll.code.substring(colon + 1).isBlank()) {
            nesting = Math.max(nesting, depth + 1);
            List<Stmt> inline = new ArrayList<>();
            simpleStatements(ll, colon + 1, inline);
            return inline;
        }
        return block(header + 1, end, depth + 1);
    }

    /** Raw text between the keyword and the header colon. */
    private static String headerPart(LogicalLine ll, String keyword) {
        int start = ll.code.indexOf(keyword) + keyword.length();
        int colon = headerColon(ll.code);
        return ll.raw.substring(start, colon < 0 ? ll.raw.length() : colon);
    }

    private boolean continues(int k, int to, int indent, String keyword) {
        if (k > to || k >= logical.size()) return false;
        LogicalLine ll = logical.get(k);
        return ll.indent == indent && keyword(ll.head()).equals(keyword);
    }

    private int ifChain(int k, int to, int depth, List<Stmt> out) {
        LogicalLine first = logical.get(k);
        List<Stmt.Branch> branches = new ArrayList<>();
        List<Stmt> orElse = null;
        int elseLine = 0;
        int[] next = new int[1];
        String keyword = "if";
        while (true) {
            LogicalLine ll = logical.get(k);
            String test = headerPart(ll, keyword);
            branches.add(new Stmt.Branch(ll.startLine, expr(test), squash(test), suite(k, to, depth, next)));
            k = next[0];
            if (continues(k, to, first.indent, "elif")) {
                keyword = "elif";
                continue;
            }
            if (continues(k, to, first.indent, "else")) {
                elseLine = logical.get(k).startLine;
                orElse = suite(k, to, depth, next);
                k = next[0];
            }
            break;
        }
        out.add(new Stmt.If(first.startLine, squash(first.raw), branches, orElse, elseLine));
        return k;
    }

    private int loop(int k, int to, int depth, String keyword, List<Stmt> out) {
        LogicalLine ll = logical.get(k);
        int[] next = new int[1];
        String header = headerPart(ll, keyword);
        String maskedHeader = ll.code.substring(ll.code.indexOf(keyword) + keyword.length(),
                ll.code.indexOf(keyword) + keyword.length() + header.length());
        List<Stmt> body = suite(k, to, depth, next);
        k = next[0];
        List<Stmt> orElse = null;
        if (continues(k, to, ll.indent, "else")) {
            orElse = suite(k, to, depth, next);
            k = next[0];
        }
        if (keyword.equals("while")) {
            out.add(new Stmt.While(ll.startLine, squash(ll.raw), expr(header), squash(header), body, orElse, false));
            return k;
        }
        int in = inAtDepthZero(maskedHeader);
        if (in < 0) {
            out.add(new Stmt.Placeholder(ll.startLine, squash(ll.raw), null, null));
            return k;
        }
        String target = header.substring(0, in);
        String iterable = header.substring(in + 2);
        out.add(new Stmt.ForEach(ll.startLine, squash(ll.raw), expr(target), expr(iterable), squash(iterable), false, body, orElse));
        return k;
    }

    private static int inAtDepthZero(String masked) {
        Matcher m = IN_WORD.matcher(masked);
        while (m.find()) {
            if (depthAt(masked, m.start()) == 0) return m.start();
        }
        return -1;
    }

    private static int depthAt(String code, int offset) {
        int depth = 0;
        for (int i = 0; i < offset; i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
        }
        return depth;
    }

    private int tryStatement(int k, int to, int depth, List<Stmt> out) {
        LogicalLine ll = logical.get(k);
        int[] next = new int[1];
        List<Stmt> body = new ArrayList<>(suite(k, to, depth, next));
        k = next[0];
        List<Stmt> cleanup = null;
        while (k <= to && k < logical.size() && logical.get(k).indent == ll.indent) {
            String kw = keyword(logical.get(k).head());
            if (kw.equals("except")) {
                suite(k, to, depth, next);
            } else if (kw.equals("else")) {
                body.addAll(suite(k, to, depth, next));
            } else if (kw.equals("finally")) {
                cleanup = suite(k, to, depth, next);
            } else {
                break;
            }
            k = next[0];
        }
        out.add(new Stmt.Try(ll.startLine, squash(ll.raw), body, cleanup));
        return k;
    }

    private int withStatement(int k, int depth, List<Stmt> out) {
        LogicalLine ll = logical.get(k);
        List<String> names = new ArrayList<>();
        Matcher m = AS_NAME.matcher(ll.code);
        while (m.find()) names.add(m.group(1));
        out.add(new Stmt.Placeholder(ll.startLine, squash(headerText(ll)), null, names));
        int[] next = new int[1];
        out.addAll(suite(k, Integer.MAX_VALUE, depth, next));
        return next[0];
    }

    private int skipped(int k, List<Stmt> out) {
        LogicalLine ll = logical.get(k);
        Matcher m = NESTED_DEF.matcher(ll.head());
        if (m.find()) {
            String what = m.group(1).equals("def") ? "function" : "class";
            out.add(new Stmt.Placeholder(ll.startLine, squash(headerText(ll)), "define nested " + what + " " + m.group(2), List.of(m.group(2))));
        } else {
            out.add(new Stmt.Placeholder(ll.startLine, squash(headerText(ll)), null, null));
        }
        return source.blockEndIndex(k) + 1;
    }

    private static String headerText(LogicalLine ll) {
        int colon = headerColon(ll.code);
        return colon < 0 ? ll.raw : ll.raw.substring(0, colon + 1);
    }

    /** Simple statements of a logical line starting at {@code from}, split at {@code ;}. */
    private void simpleStatements(LogicalLine ll, int from, List<Stmt> out) {
        String code = ll.code.substring(from);
        for (int[] range : PythonSource.statementRanges(code)) {
            int s = range[0];
            int e = range[1];
            while (s < e && Character.isWhitespace(code.charAt(s))) s++;
            while (e > s && Character.isWhitespace(code.charAt(e - 1))) e--;
            if (s >= e) continue;
            int line = ll.startLine + newlines(ll.code, from + s);
            out.add(simple(line, code.substring(s, e), ll.raw.substring(from + s, from + e)));
        }
    }

    private static int newlines(String text, int upTo) {
        int n = 0;
        for (int i = 0; i < upTo; i++) if (text.charAt(i) == '\n') n++;
        return n;
    }

    private Stmt simple(int line, String code, String raw) {
        String text = squash(raw);
        String keyword = keyword(code);
        switch (keyword) {
            case "pass":
            case "global":
            case "nonlocal":
                return new Stmt.Pass(line, text);
            case "break":
                return new Stmt.Break(line, text);
            case "continue":
                return new Stmt.Continue(line, text);
            case "return": {
                String value = raw.substring("return".length()).trim();
                return value.isEmpty() ? new Stmt.Return(line, text, null, null)
                        : new Stmt.Return(line, text, expr(value), squash(value));
            }
            case "raise":
                return new Stmt.Raise(line, text);
            case "del":
            case "assert":
            case "import":
            case "from":
            case "yield":
                return new Stmt.Placeholder(line, text, null, null);
            default:
                break;
        }
        int aug = augmentedAt(code);
        if (aug >= 0) {
            String op = augmentedOperator(code, aug);
            String value = raw.substring(aug + op.length() + 1).trim();
            return new Stmt.AugAssign(line, text, expr(raw.substring(0, aug)), op, expr(value), squash(value));
        }
        List<Integer> equals = assignmentPositions(code);
        if (equals.isEmpty()) {
            if (isBareAnnotation(code)) return new Stmt.Pass(line, text);
            return new Stmt.ExprStmt(line, text, expr(raw));
        }
        List<Expr> targets = new ArrayList<>();
        int start = 0;
        for (int eq : equals) {
            targets.add(expr(stripAnnotation(code.substring(start, eq), raw.substring(start, eq))));
            start = eq + 1;
        }
        String value = raw.substring(start).trim();
        return new Stmt.Assign(line, text, targets, expr(value), squash(value));
    }

    private static int augmentedAt(String code) {
        int depth = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (depth == 0 && augmentedOperator(code, i) != null) return i;
        }
        return -1;
    }

    /** Operator (without {@code =}) of an augmented assignment at {@code i}, or null. */
    private static String augmentedOperator(String code, int i) {
        for (String op : AUGMENTED) {
            if (code.startsWith(op, i)) return op.substring(0, op.length() - 1);
        }
        return null;
    }

    private static List<Integer> assignmentPositions(String code) {
        List<Integer> out = new ArrayList<>();
        Matcher lambda = LAMBDA.matcher(code);
        int limit = lambda.find() ? lambda.start() : code.length();
        int depth = 0;
        for (int i = 0; i < limit; i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == '=' && depth == 0) {
                char prev = i > 0 ? code.charAt(i - 1) : ' ';
                char next = i + 1 < code.length() ? code.charAt(i + 1) : ' ';
                if (next == '=') {
                    i++;
                    continue;
                }
                if ("=!<>:".indexOf(prev) >= 0) continue;
                out.add(i);
            }
        }
        return out;
    }

    private static boolean isBareAnnotation(String code) {
        int colon = PythonSource.indexAtDepthZero(code, ':', 0);
        return colon > 0 && code.substring(0, colon).trim().matches("[A-Za-z_][\\w.]*");
    }

    /** {@code x: int} becomes {@code x}. */
    private static String stripAnnotation(String code, String raw) {
        int colon = PythonSource.indexAtDepthZero(code, ':', 0);
        return colon < 0 ? raw : raw.substring(0, colon);
    }

    private static Expr expr(String raw) {
        try {
            return ExpressionParser.parse(raw.trim(), Language.PYTHON);
        } catch (UnresolvedException e) {
            return new Expr.Unsupported(squash(raw));
        }
    }

    private static String squash(String raw) {
        return SourceLines.squash(raw);
    }
}

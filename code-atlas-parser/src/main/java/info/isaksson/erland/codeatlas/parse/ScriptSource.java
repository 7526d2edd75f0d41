package info.isaksson.erland.codeatlas.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lexical view of JavaScript/TypeScript source. Comments and the contents of string, template and
 * regular-expression literals are blanked out; template substitutions ({@code ${...}}) stay visible
 * as code but their delimiters are blanked so braces balance.
 *
 * <p>Masked lines keep the raw line lengths. Bracket depth is tracked over {@code ( [ {} only.</p>
 */
public final class ScriptSource {

    private static final Set<String> REGEX_PREFIX_WORDS = Set.of(
            "return", "typeof", "instanceof", "in", "of", "new", "delete", "void", "throw",
            "case", "do", "else", "yield", "await");

    private static final int CODE = 0;
    private static final int BLOCK_COMMENT = 1;
    private static final int TEMPLATE = 2;

    private final List<String> lines;
    private final List<String> masked;
    private final int[] depthAtStart;
    private final boolean[] commentOnly;
    private final boolean[] insideLiteral;

    private ScriptSource(List<String> lines, List<String> masked, int[] depthAtStart, boolean[] commentOnly, boolean[] insideLiteral) {
        this.lines = lines;
        this.masked = masked;
        this.depthAtStart = depthAtStart;
        this.commentOnly = commentOnly;
        this.insideLiteral = insideLiteral;
    }

    public static ScriptSource of(List<String> lines) {
        List<String> raw = List.copyOf(lines);
        int n = raw.size();
        List<String> masked = new ArrayList<>(n);
        int[] depthAtStart = new int[n];
        boolean[] commentOnly = new boolean[n];
        boolean[] insideLiteral = new boolean[n];

        int mode = CODE;
        int depth = 0;
        // brace depth inside each open template substitution
        Deque<int[]> substitutions = new ArrayDeque<>();
        char prev = 0;
        String prevWord = "";

        for (int i = 0; i < n; i++) {
            String line = raw.get(i);
            int len = line.length();
            depthAtStart[i] = depth;
            insideLiteral[i] = mode == TEMPLATE;
            boolean hadComment = mode == BLOCK_COMMENT;
            StringBuilder m = new StringBuilder(len);
            int j = 0;
            while (j < len) {
                char c = line.charAt(j);
                if (mode == BLOCK_COMMENT) {
                    if (c == '*' && j + 1 < len && line.charAt(j + 1) == '/') {
                        m.append("  ");
                        j += 2;
                        mode = CODE;
                    } else {
                        m.append(blank(c));
                        j++;
                    }
                    continue;
                }
                if (mode == TEMPLATE) {
                    if (c == '\\') {
                        m.append(' ');
                        if (j + 1 < len) m.append(' ');
                        j += 2;
                    } else if (c == '`') {
                        m.append('`');
                        j++;
                        mode = CODE;
                        prev = '`';
                    } else if (c == '$' && j + 1 < len && line.charAt(j + 1) == '{') {
                        m.append("  ");
                        j += 2;
                        substitutions.push(new int[]{0});
                        mode = CODE;
                        prev = '(';
                    } else {
                        m.append(blank(c));
                        j++;
                    }
                    continue;
                }
                // CODE
                if (c == '/' && j + 1 < len && line.charAt(j + 1) == '/') {
                    hadComment = true;
                    while (m.length() < len) m.append(' ');
                    break;
                }
                if (c == '/' && j + 1 < len && line.charAt(j + 1) == '*') {
                    hadComment = true;
                    mode = BLOCK_COMMENT;
                    m.append("  ");
                    j += 2;
                    continue;
                }
                if (c == '\'' || c == '"') {
                    m.append(c);
                    j++;
                    while (j < len) {
                        char s = line.charAt(j);
                        if (s == '\\') {
                            m.append(' ');
                            if (j + 1 < len) m.append(' ');
                            j += 2;
                            continue;
                        }
                        if (s == c) break;
                        m.append(blank(s));
                        j++;
                    }
                    if (j < len) {
                        m.append(c);
                        j++;
                    }
                    prev = c;
                    prevWord = "";
                    continue;
                }
                if (c == '`') {
                    m.append('`');
                    j++;
                    mode = TEMPLATE;
                    continue;
                }
                if (c == '/' && startsRegex(prev, prevWord)) {
                    int end = regexEnd(line, j);
                    if (end > 0) {
                        m.append('/');
                        for (int k = j + 1; k < end - 1; k++) m.append(' ');
                        m.append('/');
                        j = end;
                        prev = '/';
                        prevWord = "";
                        continue;
                    }
                }
                if (c == '{') {
                    if (!substitutions.isEmpty()) substitutions.peek()[0]++;
                    depth++;
                } else if (c == '}') {
                    if (!substitutions.isEmpty() && substitutions.peek()[0] == 0) {
                        substitutions.pop();
                        m.append(' ');
                        j++;
                        mode = TEMPLATE;
                        continue;
                    }
                    if (!substitutions.isEmpty()) substitutions.peek()[0]--;
                    depth = Math.max(0, depth - 1);
                } else if (c == '(' || c == '[') {
                    depth++;
                } else if (c == ')' || c == ']') {
                    depth = Math.max(0, depth - 1);
                }
                if (Character.isJavaIdentifierPart(c)) {
                    int k = j;
                    while (k < len && Character.isJavaIdentifierPart(line.charAt(k))) k++;
                    prevWord = line.substring(j, k);
                    m.append(prevWord);
                    prev = line.charAt(k - 1);
                    j = k;
                    continue;
                }
                if (!Character.isWhitespace(c)) {
                    prev = c;
                    prevWord = "";
                }
                m.append(c);
                j++;
            }
            String ml = m.toString();
            masked.add(ml);
            commentOnly[i] = hadComment && ml.isBlank();
        }
        return new ScriptSource(raw, List.copyOf(masked), depthAtStart, commentOnly, insideLiteral);
    }

    private static char blank(char c) {
        return c == '\t' ? '\t' : ' ';
    }

    private static boolean startsRegex(char prev, String prevWord) {
        if (!prevWord.isEmpty()) return REGEX_PREFIX_WORDS.contains(prevWord);
        if (prev == 0) return true;
        return "(,=:[!&|?{};+-*%<>~^".indexOf(prev) >= 0;
    }

    /** End offset (exclusive, flags skipped) of a regex literal starting at {@code start}, or -1. */
    private static int regexEnd(String line, int start) {
        boolean inClass = false;
        for (int k = start + 1; k < line.length(); k++) {
            char c = line.charAt(k);
            if (c == '\\') {
                k++;
                continue;
            }
            if (c == '[') inClass = true;
            else if (c == ']') inClass = false;
            else if (c == '/' && !inClass) {
                int e = k + 1;
                while (e < line.length() && Character.isLetter(line.charAt(e))) e++;
                return e == k + 1 ? k + 1 : e;
            }
        }
        return -1;
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /** Masked text of a 1-based line. */
    public String masked(int lineNumber) {
        return masked.get(lineNumber - 1);
    }

    /** Bracket depth before the first character of a 1-based line. */
    public int depthAtStart(int lineNumber) {
        return depthAtStart[lineNumber - 1];
    }

    public boolean isCommentOnly(int lineNumber) {
        return commentOnly[lineNumber - 1];
    }

    /** True when the line starts inside a multi-line template literal. */
    public boolean startsInsideLiteral(int lineNumber) {
        return insideLiteral[lineNumber - 1];
    }

    /**
     * Finds the bracket closing the opener at ({@code lineNumber}, {@code column}).
     *
     * @return {line, column} of the closer (1-based line), or null when unbalanced
     */
    public int[] findClose(int lineNumber, int column) {
        int depth = 0;
        for (int ln = lineNumber; ln <= masked.size(); ln++) {
            String m = masked.get(ln - 1);
            for (int c = ln == lineNumber ? column : 0; c < m.length(); c++) {
                char ch = m.charAt(c);
                if (ch == '(' || ch == '[' || ch == '{') depth++;
                else if (ch == ')' || ch == ']' || ch == '}') {
                    depth--;
                    if (depth == 0) return new int[]{ln, c};
                }
            }
        }
        return null;
    }

    /**
     * Finds the first occurrence of any character in {@code targets} at relative bracket depth zero,
     * starting at ({@code lineNumber}, {@code column}) and stopping after {@code maxLines} lines.
     *
     * @return {line, column} or null
     */
    public int[] findAtDepthZero(int lineNumber, int column, String targets, int maxLines) {
        int depth = 0;
        int last = Math.min(masked.size(), lineNumber + maxLines);
        for (int ln = lineNumber; ln <= last; ln++) {
            String m = masked.get(ln - 1);
            for (int c = ln == lineNumber ? column : 0; c < m.length(); c++) {
                char ch = m.charAt(c);
                if (depth == 0 && targets.indexOf(ch) >= 0) return new int[]{ln, c};
                if (ch == '(' || ch == '[' || ch == '{') depth++;
                else if (ch == ')' || ch == ']' || ch == '}') {
                    depth--;
                    if (depth < 0) return null;
                }
            }
        }
        return null;
    }

    /** Raw text between two positions (end exclusive), lines joined with {@code \n}. */
    public String rawBetween(int fromLine, int fromColumn, int toLine, int toColumn) {
        StringBuilder sb = new StringBuilder();
        for (int ln = fromLine; ln <= toLine; ln++) {
            String raw = lines.get(ln - 1);
            int s = ln == fromLine ? Math.min(fromColumn, raw.length()) : 0;
            int e = ln == toLine ? Math.min(toColumn, raw.length()) : raw.length();
            if (ln > fromLine) sb.append('\n');
            if (e > s) sb.append(raw, s, e);
        }
        return sb.toString();
    }
}

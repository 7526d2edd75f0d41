package info.isaksson.erland.codeatlas.parse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lexical view of Python source: string contents and comments are blanked out ("masked") so that
 * keyword, bracket and colon searches never hit text inside literals, and physical lines are grouped
 * into logical lines (bracket, triple-quote and backslash continuations).
 *
 * <p>Every masked line has exactly the length of its raw line, so offsets found in
 * {@link LogicalLine#code} are valid in {@link LogicalLine#raw}.</p>
 */
public final class PythonSource {

    private static final Pattern STRING_ONLY =
            Pattern.compile("^\\s*(?:[rRbBuUfF]{0,2}(?:\"\"\"[\\s]*\"\"\"|'''[\\s]*'''|\"[\\s]*\"|'[\\s]*')\\s*)+$");

    /** One logical line: a statement or compound-statement header, possibly spanning several physical lines. */
    public static final class LogicalLine {
        public final int startLine;
        public final int endLine;
        public final int indent;
        /** Masked text, physical lines joined with {@code \n}. */
        public final String code;
        /** Raw text, physical lines joined with {@code \n}. */
        public final String raw;

        LogicalLine(int startLine, int endLine, int indent, String code, String raw) {
            this.startLine = startLine;
            this.endLine = endLine;
            this.indent = indent;
            this.code = code;
            this.raw = raw;
        }

        /** True when the statement is nothing but string literals (docstrings and the like). */
        public boolean isStringOnly() {
            return STRING_ONLY.matcher(code).matches();
        }

        /** Code with leading indentation removed. */
        public String head() {
            return code.stripLeading();
        }

        @Override public String toString() {
            return startLine + "-" + endLine + "@" + indent + ": " + raw.strip();
        }
    }

    private final List<String> lines;
    private final List<String> masked;
    private final boolean[] commentOnly;
    private final int[] logicalIndex;
    private final List<LogicalLine> logical;

    private PythonSource(List<String> lines, List<String> masked, boolean[] commentOnly, int[] logicalIndex, List<LogicalLine> logical) {
        this.lines = lines;
        this.masked = masked;
        this.commentOnly = commentOnly;
        this.logicalIndex = logicalIndex;
        this.logical = logical;
    }

    public static PythonSource of(List<String> lines) {
        List<String> raw = List.copyOf(lines);
        int n = raw.size();
        List<String> masked = new ArrayList<>(n);
        boolean[] continues = new boolean[n];
        boolean[] comment = new boolean[n];

        char quote = 0;
        boolean triple = false;
        int depth = 0;
        for (int i = 0; i < n; i++) {
            String line = raw.get(i);
            int len = line.length();
            StringBuilder m = new StringBuilder(len);
            boolean escapedEol = false;
            boolean hadComment = false;
            for (int j = 0; j < len; j++) {
                char c = line.charAt(j);
                if (quote != 0) {
                    if (c == '\\') {
                        m.append(' ');
                        if (j + 1 < len) {
                            m.append(' ');
                            j++;
                        } else {
                            escapedEol = true;
                        }
                        continue;
                    }
                    if (triple && c == quote && line.startsWith(repeat(quote), j)) {
                        m.append(quote).append(quote).append(quote);
                        j += 2;
                        quote = 0;
                        continue;
                    }
                    if (!triple && c == quote) {
                        m.append(c);
                        quote = 0;
                        continue;
                    }
                    m.append(c == '\t' ? '\t' : ' ');
                    continue;
                }
                if (c == '#') {
                    hadComment = true;
                    while (m.length() < len) m.append(' ');
                    break;
                }
                if (c == '"' || c == '\'') {
                    quote = c;
                    triple = line.startsWith(repeat(c), j);
                    if (triple) {
                        m.append(c).append(c).append(c);
                        j += 2;
                    } else {
                        m.append(c);
                    }
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') depth++;
                else if (c == ')' || c == ']' || c == '}') depth = Math.max(0, depth - 1);
                m.append(c);
            }
            if (quote != 0 && !triple && !escapedEol) {
                // unterminated single-line string ends at the line break
                quote = 0;
            }
            String ml = m.toString();
            masked.add(ml);
            boolean backslash = quote == 0 && ml.stripTrailing().endsWith("\\");
            continues[i] = quote != 0 || depth > 0 || backslash;
            comment[i] = hadComment && ml.isBlank();
        }

        int[] index = new int[n];
        Arrays.fill(index, -1);
        List<LogicalLine> logical = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < n; i++) {
            if (start < 0) {
                if (masked.get(i).isBlank()) continue;
                start = i;
            }
            index[i] = logical.size();
            if (!continues[i] || i == n - 1) {
                logical.add(build(raw, masked, start, i));
                start = -1;
            }
        }
        boolean[] commentOnly = new boolean[n];
        for (int i = 0; i < n; i++) {
            commentOnly[i] = index[i] < 0 && comment[i];
        }
        return new PythonSource(raw, List.copyOf(masked), commentOnly, index, List.copyOf(logical));
    }

    private static LogicalLine build(List<String> raw, List<String> masked, int from, int to) {
        StringBuilder code = new StringBuilder();
        StringBuilder text = new StringBuilder();
        for (int k = from; k <= to; k++) {
            if (k > from) {
                code.append('\n');
                text.append('\n');
            }
            code.append(masked.get(k));
            text.append(raw.get(k));
        }
        return new LogicalLine(from + 1, to + 1, SourceLines.indentWidth(raw.get(from)), code.toString(), text.toString());
    }

    private static String repeat(char c) {
        return new String(new char[]{c, c, c});
    }

    public List<String> lines() {
        return lines;
    }

    public List<LogicalLine> logicalLines() {
        return logical;
    }

    /** Masked text of a 1-based physical line. */
    public String masked(int lineNumber) {
        return masked.get(lineNumber - 1);
    }

    /** True for a line holding only a comment (not inside any statement). */
    public boolean isCommentOnly(int lineNumber) {
        return commentOnly[lineNumber - 1];
    }

    /** Index into {@link #logicalLines()} of the statement covering a 1-based line, or -1. */
    public int logicalIndexAt(int lineNumber) {
        return logicalIndex[lineNumber - 1];
    }

    /**
     * Index of the last logical line in the indented block that follows {@code headerIndex}, or
     * {@code headerIndex} itself when the suite is inline.
     */
    public int blockEndIndex(int headerIndex) {
        int indent = logical.get(headerIndex).indent;
        int last = headerIndex;
        for (int k = headerIndex + 1; k < logical.size(); k++) {
            if (logical.get(k).indent <= indent) break;
            last = k;
        }
        return last;
    }

    /**
     * Offset just past the closing bracket matching the opener at {@code open} in masked code, or -1
     * when the bracket is never closed.
     */
    public static int matchClose(String code, int open) {
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

    /** Offset of the first {@code ch} at bracket depth zero at or after {@code from}, or -1. */
    public static int indexAtDepthZero(String code, char ch, int from) {
        int depth = 0;
        for (int i = Math.max(0, from); i < code.length(); i++) {
            char c = code.charAt(i);
            if (depth == 0 && c == ch) return i;
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth = Math.max(0, depth - 1);
        }
        return -1;
    }

    /** Start offsets of the {@code ;}-separated simple statements of a logical line. */
    public static List<int[]> statementRanges(String code) {
        List<int[]> out = new ArrayList<>();
        int from = 0;
        while (true) {
            int semi = indexAtDepthZero(code, ';', from);
            if (semi < 0) {
                out.add(new int[]{from, code.length()});
                return out;
            }
            out.add(new int[]{from, semi});
            from = semi + 1;
        }
    }

    /** True when the masked text is only string literals. */
    public static boolean isStringOnly(String code) {
        return STRING_ONLY.matcher(code).matches();
    }
}

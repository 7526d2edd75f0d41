package info.isaksson.erland.codeatlas.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Physical-line helpers shared by both parse paths and by the annotator.
 */
public final class SourceLines {

    private static final int TAB_WIDTH = 8;

    private SourceLines() {}

    /** Converts {@code \r\n} and lone {@code \r} to {@code \n} and drops a leading BOM. */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String t = text;
        if (t.charAt(0) == '\uFEFF') t = t.substring(1);
        if (t.indexOf('\r') < 0) return t;
        return t.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Splits normalized text into physical lines. A trailing newline does not produce an extra
     * empty line, so {@code "a\nb\n"} has two lines and {@code ""} has none.
     */
    public static List<String> split(String normalized) {
        List<String> out = new ArrayList<>();
        if (normalized == null || normalized.isEmpty()) return out;
        int start = 0;
        for (int i = 0; i < normalized.length(); i++) {
            if (normalized.charAt(i) == '\n') {
                out.add(normalized.substring(start, i));
                start = i + 1;
            }
        }
        if (start < normalized.length()) out.add(normalized.substring(start));
        return out;
    }

    /** Leading-whitespace width with tabs advancing to the next multiple of eight. */
    public static int indentWidth(String line) {
        int w = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') w++;
            else if (c == '\t') w = (w / TAB_WIDTH + 1) * TAB_WIDTH;
            else if (c == '\f') w = 0;
            else break;
        }
        return w;
    }

    public static boolean isBlank(String line) {
        return line == null || line.isBlank();
    }

    /** Clamps a 1-based line number into {@code [1, max(1, lineCount)]}. */
    public static int clamp(int line, int lineCount) {
        if (line < 1) return 1;
        int max = Math.max(1, lineCount);
        return Math.min(line, max);
    }

    /** Collapses whitespace runs (including newlines) to one space and trims. */
    public static String squash(String s) {
        if (s == null) return "";
        return s.trim().replaceAll("\\s+", " ");
    }
}

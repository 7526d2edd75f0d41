package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits parameter and argument lists at top-level commas.
 *
 * <p>Both parse paths feed raw source text through here, so a declaration yields the same
 * parameter strings whichever path extracted it. Comments are dropped, whitespace runs collapse to
 * one space, empty pieces (trailing commas) are skipped.</p>
 */
public final class ParameterLists {

    private ParameterLists() {}

    /** Removes one pair of surrounding parentheses, if present. */
    public static String stripParens(String text) {
        if (text == null) return "";
        String t = text.trim();
        if (t.startsWith("(") && t.endsWith(")") && t.length() >= 2) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }

    public static List<String> split(String inner, Language language) {
        List<String> out = new ArrayList<>();
        if (inner == null || inner.isBlank()) return out;
        boolean python = language == Language.PYTHON;
        StringBuilder cur = new StringBuilder();
        int depth = 0;
        int angle = 0;
        int len = inner.length();
        for (int i = 0; i < len; i++) {
            char c = inner.charAt(i);
            if (c == '"' || c == '\'' || (c == '`' && !python)) {
                int end = skipString(inner, i, python);
                cur.append(inner, i, end);
                i = end - 1;
                continue;
            }
            if (python && c == '#') {
                while (i < len && inner.charAt(i) != '\n') i++;
                cur.append(' ');
                continue;
            }
            if (!python && c == '/' && i + 1 < len && inner.charAt(i + 1) == '/') {
                while (i < len && inner.charAt(i) != '\n') i++;
                cur.append(' ');
                continue;
            }
            if (!python && c == '/' && i + 1 < len && inner.charAt(i + 1) == '*') {
                int close = inner.indexOf("*/", i + 2);
                i = close < 0 ? len : close + 1;
                cur.append(' ');
                continue;
            }
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth = Math.max(0, depth - 1);
            else if (!python && c == '<') angle++;
            else if (!python && c == '>' && angle > 0 && (i == 0 || inner.charAt(i - 1) != '=')) angle--;
            if (c == ',' && depth == 0 && angle == 0) {
                add(out, cur);
                cur.setLength(0);
                continue;
            }
            cur.append(c);
        }
        add(out, cur);
        return out;
    }

    private static void add(List<String> out, StringBuilder piece) {
        String s = SourceLines.squash(piece.toString());
        if (!s.isEmpty()) out.add(s);
    }

    /** Offset just past the string literal starting at {@code start}. */
    static int skipString(String text, int start, boolean python) {
        char q = text.charAt(start);
        int len = text.length();
        boolean triple = python && text.startsWith(new String(new char[]{q, q, q}), start);
        int i = start + (triple ? 3 : 1);
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == q) {
                if (!triple) return i + 1;
                if (text.startsWith(new String(new char[]{q, q, q}), i)) return i + 3;
            }
            if (c == '\n' && !triple && q != '`') return i;
            i++;
        }
        return len;
    }
}

package info.isaksson.erland.codeatlas.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Doc comment cleaning. Python docstrings are cleaned like {@code inspect.cleandoc}; JSDoc blocks
 * lose their delimiters and leading asterisks.
 */
public final class DocComments {

    private DocComments() {}

    /**
     * @param literal source text of the docstring statement, prefixes and quotes included
     * @return cleaned text, or null when empty
     */
    public static String pythonDocstring(String literal) {
        if (literal == null) return null;
        String t = literal.trim();
        int i = 0;
        while (i < t.length() && "rRbBuUfF".indexOf(t.charAt(i)) >= 0) i++;
        t = t.substring(i);
        String quote;
        if (t.startsWith("\"\"\"") || t.startsWith("'''")) quote = t.substring(0, 3);
        else if (t.startsWith("\"") || t.startsWith("'")) quote = t.substring(0, 1);
        else return null;
        t = t.substring(quote.length());
        int close = t.lastIndexOf(quote);
        if (close >= 0) t = t.substring(0, close);
        return cleandoc(t);
    }

    /**
     * Returns the JSDoc block ending on the line directly above {@code declarationLine}, cleaned, or
     * null when there is none.
     */
    public static String jsDocAbove(List<String> lines, int declarationLine) {
        int end = declarationLine - 2;
        if (end < 0 || end >= lines.size()) return null;
        if (!lines.get(end).trim().endsWith("*/")) return null;
        int start = end;
        while (start >= 0 && !lines.get(start).contains("/*")) start--;
        if (start < 0) return null;
        String opener = lines.get(start);
        int at = opener.lastIndexOf("/*");
        if (!opener.substring(0, at).isBlank()) return null;
        if (!opener.startsWith("/**", at) || opener.startsWith("/**/", at)) return null;

        StringBuilder sb = new StringBuilder();
        for (int k = start; k <= end; k++) {
            if (k > start) sb.append('\n');
            sb.append(k == start ? opener.substring(at) : lines.get(k));
        }
        return jsDoc(sb.toString());
    }

    /** Cleans a {@code /** ... *&#47;} block. */
    public static String jsDoc(String block) {
        if (block == null) return null;
        String t = block.trim();
        if (t.startsWith("/**")) t = t.substring(3);
        int close = t.lastIndexOf("*/");
        if (close >= 0) t = t.substring(0, close);
        List<String> out = new ArrayList<>();
        for (String line : t.split("\n", -1)) {
            String l = line.trim();
            if (l.startsWith("*")) l = l.substring(1).trim();
            out.add(l);
        }
        return emptyToNull(trimBlankLines(out));
    }

    private static String cleandoc(String text) {
        String[] lines = text.split("\n", -1);
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].isBlank()) continue;
            margin = Math.min(margin, SourceLines.indentWidth(lines[i]));
        }
        List<String> out = new ArrayList<>();
        out.add(lines[0].strip());
        for (int i = 1; i < lines.length; i++) {
            String l = lines[i].replace("\t", "        ");
            out.add(margin == Integer.MAX_VALUE || l.length() < margin ? l.strip() : l.substring(margin).stripTrailing());
        }
        return emptyToNull(trimBlankLines(out));
    }

    private static String trimBlankLines(List<String> lines) {
        int s = 0;
        int e = lines.size();
        while (s < e && lines.get(s).isBlank()) s++;
        while (e > s && lines.get(e - 1).isBlank()) e--;
        return String.join("\n", lines.subList(s, e));
    }

    private static String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}

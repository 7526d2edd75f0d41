package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Superclass / interface name extraction shared by both parse paths. */
public final class BaseNames {

    private static final Pattern KEYWORD_ARG = Pattern.compile("^[A-Za-z_]\\w*\\s*=(?!=).*", Pattern.DOTALL);
    private static final Pattern HERITAGE_START = Pattern.compile("\\b(extends|implements)\\b");

    private BaseNames() {}

    /** Python: the text inside a class header's parentheses. Keyword and star arguments are dropped. */
    public static List<String> python(String inner) {
        List<String> out = new ArrayList<>();
        for (String arg : ParameterLists.split(inner, Language.PYTHON)) {
            if (arg.startsWith("*")) continue;
            if (KEYWORD_ARG.matcher(arg).matches()) continue;
            out.add(arg);
        }
        return out;
    }

    /**
     * JavaScript/TypeScript: the heritage text of a class header, e.g.
     * {@code extends Base<T> implements A, B}. Anything before the first heritage keyword (type
     * parameters) is ignored.
     */
    public static List<String> script(String heritage) {
        List<String> out = new ArrayList<>();
        if (heritage == null) return out;
        String text = SourceLines.squash(stripComments(heritage));
        Matcher m = HERITAGE_START.matcher(text);
        if (!m.find()) return out;
        text = text.substring(m.start());

        String extendsPart = null;
        String implementsPart = null;
        if (text.startsWith("extends")) {
            String rest = text.substring("extends".length());
            int impl = topLevelKeyword(rest, "implements");
            if (impl >= 0) {
                extendsPart = rest.substring(0, impl);
                implementsPart = rest.substring(impl + "implements".length());
            } else {
                extendsPart = rest;
            }
        } else {
            implementsPart = text.substring("implements".length());
        }
        if (extendsPart != null) {
            // interfaces may extend several types; classes only one
            out.addAll(ParameterLists.split(extendsPart, Language.TYPESCRIPT));
        }
        if (implementsPart != null) {
            out.addAll(ParameterLists.split(implementsPart, Language.TYPESCRIPT));
        }
        return out;
    }

    private static int topLevelKeyword(String text, String keyword) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') depth++;
            else if (c == ')' || c == ']' || c == '}' || c == '>') depth = Math.max(0, depth - 1);
            else if (depth == 0 && text.startsWith(keyword, i)
                    && (i == 0 || !Character.isJavaIdentifierPart(text.charAt(i - 1)))
                    && (i + keyword.length() == text.length() || !Character.isJavaIdentifierPart(text.charAt(i + keyword.length())))) {
                return i;
            }
        }
        return -1;
    }

    static String stripComments(String text) {
        return text.replaceAll("(?s)/\\*.*?\\*/", " ").replaceAll("//[^\n]*", " ");
    }
}

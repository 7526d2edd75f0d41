package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for single Python or JavaScript/TypeScript expressions.
 */
final class ExprLexer {

    enum Kind { NUMBER, STRING, TEMPLATE, NAME, OP, END }

    static final class Token {
        final Kind kind;
        final String text;
        /** Parsed literal for NUMBER and STRING tokens. */
        final Object value;

        Token(Kind kind, String text, Object value) {
            this.kind = kind;
            this.text = text;
            this.value = value;
        }

        boolean is(String op) {
            return (kind == Kind.OP || kind == Kind.NAME) && text.equals(op);
        }

        @Override public String toString() {
            return kind + ":" + text;
        }
    }

    private static final String[] OPERATORS = {
            "===", "!==", "**=", "//=", ">>=", "<<=", "...",
            "**", "//", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "=>", "+=", "-=", "*=", "/=", "%=",
            "++", "--", "->", ":=", "<<", ">>",
            "+", "-", "*", "/", "%", "<", ">", "=", "!", "(", ")", "[", "]", "{", "}", ",", ".", ":", ";",
            "?", "~", "&", "|", "^", "@"
    };

    private ExprLexer() {}

    static List<Token> tokenize(String text, Language language) {
        boolean python = language == Language.PYTHON;
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || (python && c == '\\' && i + 1 < n && text.charAt(i + 1) == '\n')) {
                i++;
                continue;
            }
            if (python && c == '#') {
                while (i < n && text.charAt(i) != '\n') i++;
                continue;
            }
            if (!python && c == '/' && i + 1 < n && (text.charAt(i + 1) == '/' || text.charAt(i + 1) == '*')) {
                if (text.charAt(i + 1) == '/') {
                    while (i < n && text.charAt(i) != '\n') i++;
                } else {
                    int close = text.indexOf("*/", i + 2);
                    i = close < 0 ? n : close + 2;
                }
                continue;
            }
            if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(text.charAt(i + 1)))) {
                i = number(text, i, out);
                continue;
            }
            if (isIdentStart(c)) {
                int start = i;
                while (i < n && isIdentPart(text.charAt(i))) i++;
                String word = text.substring(start, i);
                if (python && i < n && (text.charAt(i) == '\'' || text.charAt(i) == '"') && isStringPrefix(word)) {
                    i = string(text, i, word.toLowerCase().contains("f"), word.toLowerCase().contains("r"), true, out);
                    continue;
                }
                out.add(new Token(Kind.NAME, word, null));
                continue;
            }
            if (c == '\'' || c == '"') {
                i = string(text, i, false, false, python, out);
                continue;
            }
            if (c == '`' && !python) {
                i = template(text, i, out);
                continue;
            }
            String op = operatorAt(text, i);
            if (op == null) throw new UnresolvedException("unexpected character '" + c + "'");
            out.add(new Token(Kind.OP, op, null));
            i += op.length();
        }
        out.add(new Token(Kind.END, "", null));
        return out;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isStringPrefix(String word) {
        String w = word.toLowerCase();
        return w.length() <= 2 && w.chars().allMatch(ch -> "rbuf".indexOf(ch) >= 0);
    }

    private static String operatorAt(String text, int i) {
        for (String op : OPERATORS) {
            if (text.startsWith(op, i)) return op;
        }
        return null;
    }

    private static int number(String text, int i, List<Token> out) {
        int start = i;
        int n = text.length();
        if (text.startsWith("0x", i) || text.startsWith("0X", i)) {
            i += 2;
            while (i < n && (Character.digit(text.charAt(i), 16) >= 0 || text.charAt(i) == '_')) i++;
            String literal = text.substring(start, i);
            String digits = text.substring(start + 2, i).replace("_", "");
            long value;
            try {
                value = Long.parseLong(digits, 16);
            } catch (NumberFormatException e) {
                throw new UnresolvedException("hex literal out of range: " + literal);
            }
            out.add(new Token(Kind.NUMBER, literal, value));
            return i;
        }
        boolean floating = false;
        while (i < n && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
        if (i < n && text.charAt(i) == '.' && (i + 1 >= n || Character.isDigit(text.charAt(i + 1)) || !isIdentStart(text.charAt(i + 1)))) {
            floating = true;
            i++;
            while (i < n && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
        }
        if (i < n && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int save = i;
            i++;
            if (i < n && (text.charAt(i) == '+' || text.charAt(i) == '-')) i++;
            if (i < n && Character.isDigit(text.charAt(i))) {
                floating = true;
                while (i < n && Character.isDigit(text.charAt(i))) i++;
            } else {
                i = save;
            }
        }
        String literal = text.substring(start, i);
        String digits = literal.replace("_", "");
        Object value;
        if (floating) {
            value = Double.parseDouble(digits);
        } else {
            try {
                value = Long.parseLong(digits);
            } catch (NumberFormatException e) {
                throw new UnresolvedException("integer literal out of range: " + literal);
            }
        }
        // BigInt suffix
        if (i < n && text.charAt(i) == 'n') i++;
        out.add(new Token(Kind.NUMBER, literal, value));
        return i;
    }

    private static int string(String text, int i, boolean formatted, boolean rawString, boolean python, List<Token> out) {
        char q = text.charAt(i);
        int n = text.length();
        boolean triple = python && text.startsWith(String.valueOf(new char[]{q, q, q}), i);
        int start = i;
        i += triple ? 3 : 1;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (i >= n) throw new UnresolvedException("unterminated string");
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < n) {
                if (rawString) {
                    sb.append(c).append(text.charAt(i + 1));
                } else {
                    sb.append(escape(text.charAt(i + 1)));
                }
                i += 2;
                continue;
            }
            if (triple && text.startsWith(String.valueOf(new char[]{q, q, q}), i)) {
                i += 3;
                break;
            }
            if (!triple && c == q) {
                i++;
                break;
            }
            sb.append(c);
            i++;
        }
        String value = sb.toString();
        if (formatted && value.indexOf('{') >= 0) {
            out.add(new Token(Kind.TEMPLATE, text.substring(start, i), null));
        } else {
            out.add(new Token(Kind.STRING, text.substring(start, i), value));
        }
        return i;
    }

    private static int template(String text, int i, List<Token> out) {
        int n = text.length();
        int start = i;
        i++;
        StringBuilder sb = new StringBuilder();
        boolean substitution = false;
        int depth = 0;
        while (true) {
            if (i >= n) throw new UnresolvedException("unterminated template literal");
            char c = text.charAt(i);
            if (depth == 0 && c == '\\' && i + 1 < n) {
                sb.append(escape(text.charAt(i + 1)));
                i += 2;
                continue;
            }
            if (depth == 0 && c == '`') {
                i++;
                break;
            }
            if (c == '$' && i + 1 < n && text.charAt(i + 1) == '{') {
                substitution = true;
                depth++;
                i += 2;
                continue;
            }
            if (depth > 0 && c == '}') depth--;
            else if (depth > 0 && c == '{') depth++;
            if (depth == 0) sb.append(c);
            i++;
        }
        if (substitution) {
            out.add(new Token(Kind.TEMPLATE, text.substring(start, i), null));
        } else {
            out.add(new Token(Kind.STRING, text.substring(start, i), sb.toString()));
        }
        return i;
    }

    private static char escape(char c) {
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            default: return c;
        }
    }
}

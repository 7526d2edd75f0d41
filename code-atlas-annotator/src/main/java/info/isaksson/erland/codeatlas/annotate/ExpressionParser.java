package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.annotate.ExprLexer.Kind;
import info.isaksson.erland.codeatlas.annotate.ExprLexer.Token;
import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Precedence-climbing parser for one Python or JavaScript/TypeScript expression.
 *
 * <p>Constructs the evaluator does not model (lambdas, arrow functions, comprehensions, function
 * expressions) parse to {@link Expr.Unsupported}; malformed input raises
 * {@link UnresolvedException}.</p>
 */
final class ExpressionParser {

    private static final int TERNARY = 1;
    private static final int OR = 2;
    private static final int AND = 3;
    private static final int NOT = 4;
    private static final int COMPARE = 5;
    private static final int UNARY = 12;
    private static final int POWER = 13;

    private final List<Token> tokens;
    private final Language language;
    private final boolean python;
    private int pos;

    private ExpressionParser(List<Token> tokens, Language language) {
        this.tokens = tokens;
        this.language = language;
        this.python = language == Language.PYTHON;
    }

    /** Parses a full expression; a top-level Python comma list becomes a tuple. */
    static Expr parse(String text, Language language) {
        List<Token> tokens = ExprLexer.tokenize(text, language);
        if (tokens.size() == 1) throw new UnresolvedException("empty expression");
        String unsupported = unsupportedConstruct(tokens, language);
        if (unsupported != null) return new Expr.Unsupported(unsupported);
        ExpressionParser parser = new ExpressionParser(tokens, language);
        Expr e = parser.expressionList();
        if (parser.peek().kind != Kind.END) {
            throw new UnresolvedException("unexpected '" + parser.peek().text + "'");
        }
        return e;
    }

    private static String unsupportedConstruct(List<Token> tokens, Language language) {
        for (Token t : tokens) {
            if (t.is("=>")) return "arrow function";
            if (t.is(":=")) return "assignment expression";
            if (t.kind != Kind.NAME) continue;
            switch (t.text) {
                case "lambda":
                    if (language == Language.PYTHON) return "lambda expression";
                    break;
                case "for":
                    if (language == Language.PYTHON) return "comprehension";
                    break;
                case "yield":
                    return "yield expression";
                case "function":
                    if (language != Language.PYTHON) return "function expression";
                    break;
                case "class":
                    if (language != Language.PYTHON) return "class expression";
                    break;
                default:
                    break;
            }
        }
        return null;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind != Kind.END) pos++;
        return t;
    }

    private boolean accept(String op) {
        if (peek().is(op)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(String op) {
        if (!accept(op)) {
            Token t = peek();
            throw new UnresolvedException("expected '" + op + "' but found '" + (t.kind == Kind.END ? "end" : t.text) + "'");
        }
    }

    private Expr expressionList() {
        Expr first = starredOrTernary();
        if (!python || !peek().is(",")) {
            if (first instanceof Expr.Spread) throw new UnresolvedException("starred expression outside a list");
            if (!python && peek().is(",")) throw new UnresolvedException("comma operator");
            return first;
        }
        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (accept(",")) {
            if (atListEnd()) break;
            items.add(starredOrTernary());
        }
        return new Expr.Sequence(items, true);
    }

    private boolean atListEnd() {
        Token t = peek();
        return t.kind == Kind.END || t.is(")") || t.is("]") || t.is("}") || t.is("=") || t.is(":");
    }

    private Expr starredOrTernary() {
        if ((python && peek().is("*")) || (!python && peek().is("..."))) {
            next();
            return new Expr.Spread(binary(OR));
        }
        return ternary();
    }

    private Expr ternary() {
        Expr e = binary(OR);
        if (python && peek().is("if") && peek().kind == Kind.NAME) {
            next();
            Expr test = binary(OR);
            expect("else");
            Expr otherwise = ternary();
            return new Expr.Conditional(test, e, otherwise);
        }
        if (!python && accept("?")) {
            Expr then = ternary();
            expect(":");
            Expr otherwise = ternary();
            return new Expr.Conditional(e, then, otherwise);
        }
        return e;
    }

    private Expr binary(int minPower) {
        Expr left = prefix();
        while (true) {
            Token t = peek();
            if (!python && t.kind == Kind.NAME && (t.text.equals("as") || t.text.equals("satisfies"))) {
                next();
                skipType();
                continue;
            }
            String op = infixOperator();
            if (op == null) break;
            int power = power(op);
            if (power < minPower) break;
            consumeOperator(op);
            if (power == OR || power == AND) {
                left = new Expr.Logical(op, left, binary(power + 1));
            } else if (power == COMPARE) {
                Expr right = binary(COMPARE + 1);
                Expr.Compare chain;
                if (python && left instanceof Expr.Compare && !((Expr.Compare) left).grouped) {
                    chain = (Expr.Compare) left;
                } else {
                    chain = new Expr.Compare(left);
                }
                chain.ops.add(op);
                chain.operands.add(right);
                left = chain;
            } else if (power == POWER) {
                left = new Expr.Binary(op, left, binary(POWER));
            } else {
                left = new Expr.Binary(op, left, binary(power + 1));
            }
        }
        return left;
    }

    /** Canonical operator at the cursor, or null when the next token does not continue a binary expression. */
    private String infixOperator() {
        Token t = peek();
        if (t.kind == Kind.NAME) {
            if (python) {
                switch (t.text) {
                    case "or":
                    case "and":
                    case "in":
                        return t.text;
                    case "is":
                        return peekAt(1).is("not") ? "is not" : "is";
                    case "not":
                        return peekAt(1).is("in") ? "not in" : null;
                    default:
                        return null;
                }
            }
            return t.text.equals("in") || t.text.equals("instanceof") ? t.text : null;
        }
        if (t.kind != Kind.OP) return null;
        return power(t.text) > 0 ? t.text : null;
    }

    private void consumeOperator(String op) {
        next();
        if (op.equals("is not") || op.equals("not in")) next();
    }

    private int power(String op) {
        switch (op) {
            case "or":
            case "||":
            case "??":
                return OR;
            case "and":
            case "&&":
                return AND;
            case "in":
            case "not in":
            case "is":
            case "is not":
            case "instanceof":
            case "==":
            case "!=":
            case "===":
            case "!==":
            case "<":
            case "<=":
            case ">":
            case ">=":
                return COMPARE;
            case "|": return 6;
            case "^": return 7;
            case "&": return 8;
            case "<<":
            case ">>":
                return 9;
            case "+":
            case "-":
                return 10;
            case "*":
            case "/":
            case "//":
            case "%":
            case "@":
                return 11;
            case "**":
                return POWER;
            default:
                return 0;
        }
    }

    private Expr prefix() {
        Token t = peek();
        if (python && t.is("not") && t.kind == Kind.NAME) {
            next();
            return new Expr.Unary("not", binary(NOT));
        }
        if (t.kind == Kind.OP && (t.text.equals("-") || t.text.equals("+") || t.text.equals("~") || t.text.equals("!"))) {
            next();
            Expr operand = binary(UNARY);
            if (t.text.equals("-") && operand instanceof Expr.Literal && Values.isNumber(((Expr.Literal) operand).value)) {
                return new Expr.Literal(Operators.unary("-", ((Expr.Literal) operand).value, language));
            }
            return new Expr.Unary(t.text, operand);
        }
        if (t.kind == Kind.NAME && t.text.equals("await")) {
            next();
            return binary(UNARY);
        }
        if (!python && t.kind == Kind.NAME && (t.text.equals("typeof") || t.text.equals("void"))) {
            next();
            Expr operand = binary(UNARY);
            if (t.text.equals("void")) return new Expr.Literal(Nothing.UNDEFINED);
            return new Expr.Unary("typeof", operand);
        }
        if (!python && t.kind == Kind.NAME && t.text.equals("new")) {
            next();
            return postfix(construction());
        }
        return postfix(primary());
    }

    private Expr construction() {
        Token name = next();
        if (name.kind != Kind.NAME) throw new UnresolvedException("expected a type after 'new'");
        StringBuilder type = new StringBuilder(name.text);
        while (peek().is(".") && peekAt(1).kind == Kind.NAME) {
            next();
            type.append('.').append(next().text);
        }
        if (peek().is("<")) skipBalanced("<", ">");
        List<Expr> args = new ArrayList<>();
        if (accept("(")) {
            Map<String, Expr> ignored = new LinkedHashMap<>();
            arguments(args, ignored);
        }
        return new Expr.New(type.toString(), args);
    }

    private Expr primary() {
        Token t = next();
        switch (t.kind) {
            case NUMBER:
                return new Expr.Literal(t.value);
            case STRING: {
                StringBuilder sb = new StringBuilder((String) t.value);
                boolean formatted = false;
                while (python && (peek().kind == Kind.STRING || peek().kind == Kind.TEMPLATE)) {
                    Token more = next();
                    if (more.kind == Kind.TEMPLATE) formatted = true;
                    else sb.append((String) more.value);
                }
                return formatted ? new Expr.Unsupported("interpolated string") : new Expr.Literal(sb.toString());
            }
            case TEMPLATE:
                while (python && (peek().kind == Kind.STRING || peek().kind == Kind.TEMPLATE)) next();
                return new Expr.Unsupported("interpolated string");
            case NAME:
                return name(t.text);
            case OP:
                if (t.is("(")) return parenthesized();
                if (t.is("[")) return listDisplay();
                if (t.is("{")) return python ? dictOrSet() : objectDisplay();
                break;
            default:
                break;
        }
        throw new UnresolvedException(t.kind == Kind.END ? "unexpected end of expression" : "unexpected '" + t.text + "'");
    }

    private Expr name(String id) {
        if (python) {
            switch (id) {
                case "True": return new Expr.Literal(Boolean.TRUE);
                case "False": return new Expr.Literal(Boolean.FALSE);
                case "None": return new Expr.Literal(Nothing.NONE);
                default: return new Expr.Name(id);
            }
        }
        switch (id) {
            case "true": return new Expr.Literal(Boolean.TRUE);
            case "false": return new Expr.Literal(Boolean.FALSE);
            case "null": return new Expr.Literal(Nothing.NONE);
            case "undefined": return new Expr.Literal(Nothing.UNDEFINED);
            default: return new Expr.Name(id);
        }
    }

    private Expr parenthesized() {
        if (accept(")")) return new Expr.Sequence(List.of(), true);
        Expr e = expressionList();
        expect(")");
        if (e instanceof Expr.Compare) ((Expr.Compare) e).grouped = true;
        return e;
    }

    private Expr listDisplay() {
        List<Expr> items = new ArrayList<>();
        while (!accept("]")) {
            items.add(starredOrTernary());
            if (!accept(",")) {
                expect("]");
                break;
            }
        }
        return new Expr.Sequence(items, false);
    }

    private Expr dictOrSet() {
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        if (accept("}")) return new Expr.DictDisplay(keys, values);
        Boolean dict = null;
        List<Expr> setItems = new ArrayList<>();
        while (true) {
            if (accept("**")) {
                if (Boolean.FALSE.equals(dict)) throw new UnresolvedException("mapping unpack in a set");
                dict = true;
                keys.add(null);
                values.add(binary(OR));
            } else {
                Expr k = ternary();
                if (dict == null) dict = peek().is(":");
                if (dict) {
                    expect(":");
                    keys.add(k);
                    values.add(ternary());
                } else {
                    setItems.add(k);
                }
            }
            if (!accept(",")) {
                expect("}");
                break;
            }
            if (accept("}")) break;
        }
        return dict ? new Expr.DictDisplay(keys, values) : new Expr.SetDisplay(setItems);
    }

    private Expr objectDisplay() {
        List<String> keys = new ArrayList<>();
        List<Expr> computed = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        while (!accept("}")) {
            if (accept("...")) {
                keys.add(null);
                computed.add(null);
                values.add(ternary());
            } else if (accept("[")) {
                Expr k = ternary();
                expect("]");
                expect(":");
                keys.add(null);
                computed.add(k);
                values.add(ternary());
            } else {
                Token k = next();
                String key;
                if (k.kind == Kind.NAME) key = k.text;
                else if (k.kind == Kind.STRING) key = (String) k.value;
                else if (k.kind == Kind.NUMBER) key = Values.propertyKey(k.value);
                else throw new UnresolvedException("unexpected '" + k.text + "' in object literal");
                if (peek().is("(")) throw new UnresolvedException("method in object literal");
                keys.add(key);
                computed.add(null);
                if (accept(":")) {
                    values.add(ternary());
                } else if (k.kind == Kind.NAME) {
                    values.add(new Expr.Name(key));
                } else {
                    throw new UnresolvedException("expected ':' after key " + key);
                }
            }
            if (!accept(",")) {
                expect("}");
                break;
            }
        }
        return new Expr.ObjectDisplay(keys, computed, values);
    }

    private Expr postfix(Expr e) {
        while (true) {
            if (accept("(")) {
                List<Expr> args = new ArrayList<>();
                Map<String, Expr> keywords = new LinkedHashMap<>();
                arguments(args, keywords);
                e = new Expr.Call(e, args, keywords);
            } else if (accept("[")) {
                e = subscript(e);
            } else if (accept(".")) {
                Token name = next();
                if (name.kind != Kind.NAME) throw new UnresolvedException("expected a name after '.'");
                e = new Expr.Attribute(e, name.text, false);
            } else if (!python && accept("?.")) {
                Token name = next();
                if (name.kind != Kind.NAME) throw new UnresolvedException("optional call or index");
                e = new Expr.Attribute(e, name.text, true);
            } else if (!python && peek().is("!") && isAssertionPosition()) {
                next();
            } else {
                return e;
            }
        }
    }

    /** TypeScript non-null assertion {@code x!}: a {@code !} that cannot start an operand. */
    private boolean isAssertionPosition() {
        Token after = peekAt(1);
        return after.kind == Kind.END || after.kind == Kind.OP && !after.is("(") && !after.is("[") && !after.is("!")
                && !after.is("-") && !after.is("+");
    }

    private Expr subscript(Expr target) {
        if (python && peek().is(":")) {
            next();
            Expr upper = peek().is("]") ? null : ternary();
            expect("]");
            return new Expr.Slice(target, null, upper);
        }
        Expr index = python ? expressionList() : ternary();
        if (python && accept(":")) {
            Expr upper = peek().is("]") ? null : ternary();
            if (peek().is(":")) throw new UnresolvedException("extended slice");
            expect("]");
            return new Expr.Slice(target, index, upper);
        }
        expect("]");
        return new Expr.Subscript(target, index);
    }

    private void arguments(List<Expr> args, Map<String, Expr> keywords) {
        while (!accept(")")) {
            if (python && peek().is("**")) throw new UnresolvedException("keyword unpacking in a call");
            if (python && peek().kind == Kind.NAME && peekAt(1).is("=")) {
                String key = next().text;
                next();
                keywords.put(key, ternary());
            } else {
                args.add(starredOrTernary());
            }
            if (!accept(",")) {
                expect(")");
                break;
            }
        }
    }

    private void skipType() {
        if (peek().is("(") || peek().is("[") || peek().is("{")) {
            String open = peek().text;
            skipBalanced(open, open.equals("(") ? ")" : open.equals("[") ? "]" : "}");
        } else {
            next();
        }
        while (true) {
            if (peek().is(".") && peekAt(1).kind == Kind.NAME) {
                next();
                next();
            } else if (peek().is("<")) {
                skipBalanced("<", ">");
            } else if (peek().is("[") && peekAt(1).is("]")) {
                next();
                next();
            } else {
                return;
            }
        }
    }

    private void skipBalanced(String open, String close) {
        int depth = 0;
        while (peek().kind != Kind.END) {
            Token t = next();
            if (t.is(open)) depth++;
            else if (t.is(close) || (close.equals(">") && t.is(">>"))) {
                depth -= t.is(">>") ? 2 : 1;
                if (depth <= 0) return;
            }
        }
        throw new UnresolvedException("unbalanced '" + open + "'");
    }
}

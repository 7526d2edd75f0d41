package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.List;

/** Arithmetic, bitwise and comparison operators over dry-run values. */
final class Operators {

    private Operators() {}

    static Object unary(String op, Object v, Language language) {
        Values.known(v, "operand");
        switch (op) {
            case "-":
                if (v instanceof Long) return negate((Long) v);
                if (v instanceof Double) return -(Double) v;
                break;
            case "+":
                if (Values.isNumber(v)) return v;
                break;
            case "~":
                if (v instanceof Long) return ~(Long) v;
                break;
            default:
                break;
        }
        if (v instanceof Boolean && !"~".equals(op)) return unary(op, ((Boolean) v) ? 1L : 0L, language);
        throw new UnresolvedException("unary " + op + " on " + Values.typeName(v));
    }

    private static Object negate(long v) {
        if (v == Long.MIN_VALUE) throw new UnresolvedException("integer overflow");
        return -v;
    }

    static Object binary(String op, Object a, Object b, Language language) {
        Values.known(a, "operand");
        Values.known(b, "operand");
        boolean python = language == Language.PYTHON;
        if (a instanceof Boolean && Values.isNumber(b)) a = ((Boolean) a) ? 1L : 0L;
        if (b instanceof Boolean && Values.isNumber(a)) b = ((Boolean) b) ? 1L : 0L;

        if ("+".equals(op)) {
            if (!python && (a instanceof String || b instanceof String)) {
                return bounded(Values.str(a, language) + Values.str(b, language));
            }
            if (a instanceof String && b instanceof String) return bounded((String) a + b);
            if (python && a instanceof List && b instanceof List) {
                checkSize((long) ((List<?>) a).size() + ((List<?>) b).size());
                List<Object> out = new ArrayList<>((List<?>) a);
                out.addAll((List<?>) b);
                return out;
            }
            if (a instanceof Tuple && b instanceof Tuple) {
                checkSize((long) ((Tuple) a).items.size() + ((Tuple) b).items.size());
                List<Object> out = new ArrayList<>(((Tuple) a).items);
                out.addAll(((Tuple) b).items);
                return new Tuple(out);
            }
        }
        if ("*".equals(op) && python) {
            if (a instanceof String && b instanceof Long) {
                long times = Math.max(0, Math.min((Long) b, Builtins.MAX_COLLECTION + 1L));
                checkSize(times * ((String) a).length());
                return ((String) a).repeat((int) times);
            }
            if (a instanceof List && b instanceof Long) return repeat((List<?>) a, (Long) b);
        }
        if (!Values.isNumber(a) || !Values.isNumber(b)) {
            throw new UnresolvedException("operator " + op + " on " + Values.typeName(a) + " and " + Values.typeName(b));
        }
        return arithmetic(op, a, b, python);
    }

    /** Values larger than {@link Builtins#MAX_COLLECTION} elements or characters are not traced. */
    private static void checkSize(long size) {
        if (size > Builtins.MAX_COLLECTION) throw new UnresolvedException("value too large (" + size + ")");
    }

    private static String bounded(String s) {
        checkSize(s.length());
        return s;
    }

    private static List<Object> repeat(List<?> items, long times) {
        if (times > Builtins.MAX_COLLECTION) throw new UnresolvedException("list too large");
        checkSize(times * items.size());
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < times; i++) out.addAll(items);
        return out;
    }

    private static Object arithmetic(String op, Object a, Object b, boolean python) {
        boolean ints = a instanceof Long && b instanceof Long;
        try {
            if (ints) {
                long x = (Long) a;
                long y = (Long) b;
                switch (op) {
                    case "+": return Math.addExact(x, y);
                    case "-": return Math.subtractExact(x, y);
                    case "*": return Math.multiplyExact(x, y);
                    case "//":
                        if (y == 0) throw new UnresolvedException("division by zero");
                        return Math.floorDiv(x, y);
                    case "%":
                        if (y == 0) {
                            if (python) throw new UnresolvedException("modulo by zero");
                            return Double.NaN;
                        }
                        return python ? Math.floorMod(x, y) : x % y;
                    case "**":
                        if (y >= 0) return power(x, y);
                        break;
                    case "&": return x & y;
                    case "|": return x | y;
                    case "^": return x ^ y;
                    case "<<": return x << y;
                    case ">>": return x >> y;
                    default:
                        break;
                }
            }
        } catch (ArithmeticException e) {
            throw new UnresolvedException("integer overflow in " + op);
        }
        double x = Values.toDouble(a);
        double y = Values.toDouble(b);
        double r;
        switch (op) {
            case "+": r = x + y; break;
            case "-": r = x - y; break;
            case "*": r = x * y; break;
            case "/":
                if (y == 0 && python) throw new UnresolvedException("division by zero");
                r = x / y;
                return python ? (Object) r : Values.normalizeNumber(r);
            case "//":
                if (y == 0) throw new UnresolvedException("division by zero");
                r = Math.floor(x / y);
                break;
            case "%":
                if (y == 0 && python) throw new UnresolvedException("modulo by zero");
                r = python ? x - Math.floor(x / y) * y : x % y;
                break;
            case "**": r = Math.pow(x, y); break;
            default:
                throw new UnresolvedException("operator " + op + " on numbers");
        }
        return python ? (Object) r : Values.normalizeNumber(r);
    }

    private static long power(long base, long exp) {
        if (base == 0 || base == 1) return exp == 0 ? 1 : base;
        if (base == -1) return exp % 2 == 0 ? 1 : -1;
        if (exp > 64) throw new ArithmeticException("overflow");
        long result = 1;
        for (long i = 0; i < exp; i++) result = Math.multiplyExact(result, base);
        return result;
    }

    static boolean compare(String op, Object a, Object b, Language language) {
        switch (op) {
            case "==":
                if (language != Language.PYTHON && a instanceof Nothing && b instanceof Nothing) return true;
                return Values.same(a, b);
            case "===":
            case "is":
                return Values.same(a, b);
            case "!=":
                if (language != Language.PYTHON && a instanceof Nothing && b instanceof Nothing) return false;
                return !Values.same(a, b);
            case "!==":
            case "is not":
                return !Values.same(a, b);
            case "<": return Values.compare(a, b) < 0;
            case "<=": return Values.compare(a, b) <= 0;
            case ">": return Values.compare(a, b) > 0;
            case ">=": return Values.compare(a, b) >= 0;
            case "in": return Values.contains(b, a, language);
            case "not in": return !Values.contains(b, a, language);
            default:
                throw new UnresolvedException("comparison " + op);
        }
    }
}

package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operations on the runtime values of a dry run.
 *
 * <p>Values are plain Java objects: {@link Long}, {@link Double}, {@link String}, {@link Boolean},
 * {@link Nothing}, {@link ArrayList} (list / array), {@link Tuple}, {@link LinkedHashMap}
 * (Python dict, JavaScript {@code Map}), {@link LinkedHashSet}, {@link ObjectLiteral},
 * {@link Opaque} and {@link Unknown}.</p>
 */
final class Values {

    private Values() {}

    static Object none(Language language) {
        return language == Language.PYTHON ? Nothing.NONE : Nothing.UNDEFINED;
    }

    /** Fails when the value is {@link Unknown}. */
    static Object known(Object value, String what) {
        if (value == Unknown.VALUE) throw new UnresolvedException(what + " is not known");
        return value;
    }

    static boolean truthy(Object v, Language language) {
        known(v, "condition");
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Nothing) return false;
        if (v instanceof Long) return (Long) v != 0L;
        if (v instanceof Double) {
            double d = (Double) v;
            return d != 0.0 && !Double.isNaN(d);
        }
        if (v instanceof String) return !((String) v).isEmpty();
        if (language != Language.PYTHON) return true;
        if (v instanceof Collection) return !((Collection<?>) v).isEmpty();
        if (v instanceof Map) return !((Map<?, ?>) v).isEmpty();
        if (v instanceof Tuple) return !((Tuple) v).items.isEmpty();
        return true;
    }

    static boolean isNumber(Object v) {
        return v instanceof Long || v instanceof Double;
    }

    static double toDouble(Object v) {
        return ((Number) v).doubleValue();
    }

    /** Integral doubles become longs so that numeric map keys and repr stay stable. */
    static Object normalizeNumber(double d) {
        if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 9.0e15) {
            return (long) d;
        }
        return d;
    }

    /** Value equality as {@code ==} (Python) or {@code ===} (JavaScript) sees it for literals. */
    static boolean same(Object a, Object b) {
        known(a, "operand");
        known(b, "operand");
        if (isNumber(a) && isNumber(b)) return toDouble(a) == toDouble(b);
        if (a instanceof Boolean && isNumber(b)) return (((Boolean) a) ? 1.0 : 0.0) == toDouble(b);
        if (b instanceof Boolean && isNumber(a)) return (((Boolean) b) ? 1.0 : 0.0) == toDouble(a);
        if (a instanceof List && b instanceof List) return sameItems((List<?>) a, (List<?>) b);
        if (a instanceof Tuple && b instanceof Tuple) return sameItems(((Tuple) a).items, ((Tuple) b).items);
        if (a instanceof ObjectLiteral || b instanceof ObjectLiteral || a instanceof Opaque || b instanceof Opaque) {
            return a == b;
        }
        return a.equals(b);
    }

    private static boolean sameItems(List<?> a, List<?> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (!same(a.get(i), b.get(i))) return false;
        }
        return true;
    }

    /** Key used for Python dicts, sets and JavaScript Maps. */
    static Object key(Object v) {
        known(v, "key");
        if (v instanceof Double) return normalizeNumber((Double) v);
        if (v instanceof List) throw new UnresolvedException("unhashable list key");
        return v;
    }

    /** JavaScript property key: everything is converted to a string. */
    static String propertyKey(Object v) {
        return str(v, Language.JAVASCRIPT);
    }

    static int compare(Object a, Object b) {
        known(a, "operand");
        known(b, "operand");
        if (isNumber(a) && isNumber(b)) return Double.compare(toDouble(a), toDouble(b));
        if (a instanceof String && b instanceof String) return ((String) a).compareTo((String) b);
        if (a instanceof Boolean && b instanceof Boolean) return Boolean.compare((Boolean) a, (Boolean) b);
        if (a instanceof List && b instanceof List) return compareItems((List<?>) a, (List<?>) b);
        if (a instanceof Tuple && b instanceof Tuple) return compareItems(((Tuple) a).items, ((Tuple) b).items);
        throw new UnresolvedException("cannot order " + typeName(a) + " and " + typeName(b));
    }

    private static int compareItems(List<?> a, List<?> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    static boolean contains(Object container, Object item, Language language) {
        known(container, "container");
        known(item, "item");
        if (container instanceof Map) return ((Map<?, ?>) container).containsKey(key(item));
        if (container instanceof Set) return ((Set<?>) container).contains(key(item));
        if (container instanceof ObjectLiteral) return ((ObjectLiteral) container).fields.containsKey(propertyKey(item));
        if (container instanceof String) {
            if (!(item instanceof String)) throw new UnresolvedException("'in <string>' needs a string");
            return ((String) container).contains((String) item);
        }
        if (language == Language.PYTHON) {
            for (Object o : iterate(container, language)) {
                if (same(o, item)) return true;
            }
            return false;
        }
        if (container instanceof List) {
            long index = asLong(item);
            return index >= 0 && index < ((List<?>) container).size();
        }
        throw new UnresolvedException("cannot test membership in " + typeName(container));
    }

    /** Items a {@code for} loop walks over. Dicts and Maps yield keys (Python) or entries (JavaScript Map). */
    static List<Object> iterate(Object v, Language language) {
        known(v, "iterable");
        if (v instanceof List) return new ArrayList<>((List<?>) v);
        if (v instanceof Tuple) return new ArrayList<>(((Tuple) v).items);
        if (v instanceof Set) return new ArrayList<>((Set<?>) v);
        if (v instanceof Map) {
            Map<?, ?> m = (Map<?, ?>) v;
            if (language == Language.PYTHON) return new ArrayList<>(m.keySet());
            List<Object> entries = new ArrayList<>();
            for (Map.Entry<?, ?> e : m.entrySet()) entries.add(new ArrayList<>(List.of(e.getKey(), e.getValue())));
            return entries;
        }
        if (v instanceof String) {
            List<Object> chars = new ArrayList<>();
            String s = (String) v;
            for (int i = 0; i < s.length(); i++) chars.add(String.valueOf(s.charAt(i)));
            return chars;
        }
        throw new UnresolvedException(typeName(v) + " is not iterable");
    }

    static long asLong(Object v) {
        known(v, "number");
        if (v instanceof Long) return (Long) v;
        if (v instanceof Double && ((Double) v) == Math.rint((Double) v)) return (long) (double) (Double) v;
        if (v instanceof Boolean) return ((Boolean) v) ? 1 : 0;
        throw new UnresolvedException("expected an integer, got " + typeName(v));
    }

    static int length(Object v) {
        known(v, "value");
        if (v instanceof String) return ((String) v).length();
        if (v instanceof Collection) return ((Collection<?>) v).size();
        if (v instanceof Map) return ((Map<?, ?>) v).size();
        if (v instanceof Tuple) return ((Tuple) v).items.size();
        throw new UnresolvedException(typeName(v) + " has no length");
    }

    static String typeName(Object v) {
        if (v == null) return "nothing";
        if (v instanceof Long) return "int";
        if (v instanceof Double) return "float";
        if (v instanceof String) return "str";
        if (v instanceof Boolean) return "bool";
        if (v instanceof Nothing) return "none";
        if (v instanceof List) return "list";
        if (v instanceof Tuple) return "tuple";
        if (v instanceof Map) return "dict";
        if (v instanceof Set) return "set";
        if (v instanceof ObjectLiteral) return "object";
        if (v instanceof Opaque) return ((Opaque) v).name;
        return "unknown";
    }

    /** {@code str(v)} / {@code String(v)}: strings print without quotes. */
    static String str(Object v, Language language) {
        if (v instanceof String) return (String) v;
        return repr(v, language);
    }

    static String repr(Object v, Language language) {
        boolean py = language == Language.PYTHON;
        if (v == Unknown.VALUE) return "?";
        if (v == Nothing.NONE) return py ? "None" : "null";
        if (v == Nothing.UNDEFINED) return py ? "None" : "undefined";
        if (v instanceof Boolean) {
            boolean b = (Boolean) v;
            return py ? (b ? "True" : "False") : (b ? "true" : "false");
        }
        if (v instanceof Long) return v.toString();
        if (v instanceof Double) return doubleRepr((Double) v, py);
        if (v instanceof String) return quote((String) v);
        if (v instanceof List) return "[" + joinRepr((List<?>) v, language) + "]";
        if (v instanceof Tuple) {
            List<Object> items = ((Tuple) v).items;
            return items.size() == 1 ? "(" + repr(items.get(0), language) + ",)" : "(" + joinRepr(items, language) + ")";
        }
        if (v instanceof Map) {
            Map<?, ?> m = (Map<?, ?>) v;
            StringBuilder sb = new StringBuilder();
            Iterator<? extends Map.Entry<?, ?>> it = m.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> e = it.next();
                sb.append(repr(e.getKey(), language)).append(py ? ": " : " => ").append(repr(e.getValue(), language));
                if (it.hasNext()) sb.append(", ");
            }
            return py ? "{" + sb + "}" : "Map(" + m.size() + ") {" + sb + "}";
        }
        if (v instanceof Set) {
            Set<?> s = (Set<?>) v;
            if (py) return s.isEmpty() ? "set()" : "{" + joinRepr(new ArrayList<>(s), language) + "}";
            return "Set(" + s.size() + ") {" + joinRepr(new ArrayList<>(s), language) + "}";
        }
        if (v instanceof ObjectLiteral) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<Map.Entry<String, Object>> it = ((ObjectLiteral) v).fields.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Object> e = it.next();
                sb.append(e.getKey()).append(": ").append(repr(e.getValue(), language));
                if (it.hasNext()) sb.append(", ");
            }
            return sb.append("}").toString();
        }
        if (v instanceof Opaque) return ((Opaque) v).name;
        return String.valueOf(v);
    }

    private static String joinRepr(List<?> items, Language language) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(repr(items.get(i), language));
        }
        return sb.toString();
    }

    private static String doubleRepr(double d, boolean python) {
        if (Double.isNaN(d)) return python ? "nan" : "NaN";
        if (Double.isInfinite(d)) {
            if (python) return d > 0 ? "inf" : "-inf";
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (!python && d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return Double.toString(d);
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder("'");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\'': sb.append("\\'"); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}

package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The small library a dry run understands: Python builtins, JavaScript globals ({@code Math},
 * {@code console}, {@code Object}, {@code Array}) and the common list, dict, Map, Set and string
 * methods. Everything else is unresolved.
 */
final class Builtins {

    /** Upper bound for materialized ranges and repeated sequences. */
    static final int MAX_COLLECTION = 10_000;

    /** A callable global such as {@code len} or {@code parseInt}. */
    static final class Function {
        final String name;

        Function(String name) {
            this.name = name;
        }
    }

    /** A JavaScript namespace object such as {@code Math}. */
    static final class Namespace {
        final String name;

        Namespace(String name) {
            this.name = name;
        }
    }

    private static final Set<String> PYTHON_FUNCTIONS = Set.of(
            "len", "range", "enumerate", "abs", "min", "max", "sum", "sorted", "reversed", "str", "int",
            "float", "bool", "list", "dict", "set", "tuple", "zip", "print");
    private static final Set<String> SCRIPT_FUNCTIONS = Set.of("parseInt", "parseFloat", "String", "Number", "Boolean");
    private static final Set<String> SCRIPT_NAMESPACES = Set.of("Math", "console", "Object", "Array", "Number");

    private Builtins() {}

    static Optional<Object> global(String name, Language language) {
        if (language == Language.PYTHON) {
            return PYTHON_FUNCTIONS.contains(name) ? Optional.of(new Function(name)) : Optional.empty();
        }
        if ("Infinity".equals(name)) return Optional.of(Double.POSITIVE_INFINITY);
        if ("NaN".equals(name)) return Optional.of(Double.NaN);
        if (SCRIPT_FUNCTIONS.contains(name)) return Optional.of(new Function(name));
        if (SCRIPT_NAMESPACES.contains(name)) return Optional.of(new Namespace(name));
        return Optional.empty();
    }

    static Object call(String name, List<Object> args, Map<String, Object> keywords, Env env) {
        Language lang = env.language;
        for (Object a : args) Values.known(a, "argument");
        switch (name) {
            case "print":
                env.print(joinStr(args, " ", lang));
                return Nothing.NONE;
            case "len":
                return (long) Values.length(arg(args, 0));
            case "range":
                return range(args);
            case "enumerate": {
                List<Object> out = new ArrayList<>();
                long i = args.size() > 1 ? Values.asLong(args.get(1)) : 0;
                for (Object o : Values.iterate(arg(args, 0), lang)) out.add(new Tuple(List.of(i++, o)));
                return out;
            }
            case "zip": {
                List<List<Object>> columns = new ArrayList<>();
                for (Object a : args) columns.add(Values.iterate(a, lang));
                List<Object> out = new ArrayList<>();
                int n = columns.stream().mapToInt(List::size).min().orElse(0);
                for (int i = 0; i < n; i++) {
                    List<Object> row = new ArrayList<>();
                    for (List<Object> c : columns) row.add(c.get(i));
                    out.add(new Tuple(row));
                }
                return out;
            }
            case "abs":
                return Operators.unary(Values.toDouble(number(arg(args, 0))) < 0 ? "-" : "+", arg(args, 0), lang);
            case "min":
            case "max":
                return extreme(name, args, keywords, lang);
            case "sum": {
                Object total = args.size() > 1 ? args.get(1) : 0L;
                for (Object o : Values.iterate(arg(args, 0), lang)) total = Operators.binary("+", total, o, lang);
                return total;
            }
            case "sorted": {
                if (keywords.containsKey("key")) throw new UnresolvedException("sorted with a key function");
                List<Object> out = Values.iterate(arg(args, 0), lang);
                out.sort(Values::compare);
                if (Values.truthy(keywords.getOrDefault("reverse", false), lang)) Collections.reverse(out);
                return out;
            }
            case "reversed": {
                List<Object> out = Values.iterate(arg(args, 0), lang);
                Collections.reverse(out);
                return out;
            }
            case "str":
            case "String":
                return args.isEmpty() ? "" : Values.str(args.get(0), lang);
            case "int":
            case "parseInt":
                return toInt(arg(args, 0));
            case "float":
            case "parseFloat":
            case "Number":
                return toFloat(arg(args, 0), lang);
            case "bool":
            case "Boolean":
                return !args.isEmpty() && Values.truthy(args.get(0), lang);
            case "list":
                return args.isEmpty() ? new ArrayList<>() : Values.iterate(args.get(0), lang);
            case "tuple":
                return new Tuple(args.isEmpty() ? List.of() : Values.iterate(args.get(0), lang));
            case "set": {
                Set<Object> out = new LinkedHashSet<>();
                if (!args.isEmpty()) for (Object o : Values.iterate(args.get(0), lang)) out.add(Values.key(o));
                return out;
            }
            case "dict": {
                Map<Object, Object> out = new LinkedHashMap<>();
                if (!args.isEmpty()) {
                    Object src = args.get(0);
                    if (!(src instanceof Map)) throw new UnresolvedException("dict() from " + Values.typeName(src));
                    out.putAll((Map<?, ?>) src);
                }
                for (Map.Entry<String, Object> e : keywords.entrySet()) out.put(e.getKey(), e.getValue());
                return out;
            }
            default:
                throw new UnresolvedException("call of " + name);
        }
    }

    static Object construct(String type, List<Object> args, Env env) {
        switch (type) {
            case "Map": {
                Map<Object, Object> out = new LinkedHashMap<>();
                if (!args.isEmpty()) {
                    for (Object entry : Values.iterate(args.get(0), env.language)) {
                        List<Object> kv = Values.iterate(entry, env.language);
                        if (kv.size() < 2) throw new UnresolvedException("Map entry needs a key and a value");
                        out.put(Values.key(kv.get(0)), kv.get(1));
                    }
                }
                return out;
            }
            case "Set": {
                Set<Object> out = new LinkedHashSet<>();
                if (!args.isEmpty()) for (Object o : Values.iterate(args.get(0), env.language)) out.add(Values.key(o));
                return out;
            }
            case "Array": {
                long n = args.isEmpty() ? 0 : Values.asLong(args.get(0));
                if (n < 0 || n > MAX_COLLECTION) throw new UnresolvedException("array size " + n);
                List<Object> out = new ArrayList<>();
                for (long i = 0; i < n; i++) out.add(Nothing.UNDEFINED);
                return out;
            }
            case "Object":
                return new ObjectLiteral();
            default:
                throw new UnresolvedException("construction of " + type);
        }
    }

    static Object attribute(Object target, String name, Env env) {
        if (target instanceof Opaque) {
            Object v = ((Opaque) target).attributes.get(name);
            if (v == null) throw new UnresolvedException(((Opaque) target).name + "." + name + " is not known");
            return v;
        }
        if (target instanceof ObjectLiteral) {
            Object v = ((ObjectLiteral) target).fields.get(name);
            return v == null ? Nothing.UNDEFINED : v;
        }
        if (target instanceof Namespace) {
            String ns = ((Namespace) target).name;
            if ("Math".equals(ns) && "PI".equals(name)) return Math.PI;
            if ("Math".equals(ns) && "E".equals(name)) return Math.E;
            if ("Number".equals(ns) && "MAX_SAFE_INTEGER".equals(name)) return 9007199254740991L;
            if ("Number".equals(ns) && "MIN_SAFE_INTEGER".equals(name)) return -9007199254740991L;
            throw new UnresolvedException(ns + "." + name + " is not known");
        }
        if (env.language != Language.PYTHON) {
            if ("length".equals(name) && (target instanceof List || target instanceof String)) {
                return (long) Values.length(target);
            }
            if ("size".equals(name) && (target instanceof Map || target instanceof Set)) {
                return (long) Values.length(target);
            }
        }
        throw new UnresolvedException("attribute " + name + " of " + Values.typeName(target));
    }

    static Object subscript(Object target, Object index, Env env) {
        Values.known(target, "subscripted value");
        Values.known(index, "index");
        boolean python = env.language == Language.PYTHON;
        if (target instanceof Map && python) {
            Object v = ((Map<?, ?>) target).get(Values.key(index));
            if (v == null) throw new UnresolvedException("key " + env.repr(index) + " is missing");
            return v;
        }
        if (target instanceof ObjectLiteral) {
            Object v = ((ObjectLiteral) target).fields.get(Values.propertyKey(index));
            return v == null ? Nothing.UNDEFINED : v;
        }
        List<?> seq = null;
        if (target instanceof List) seq = (List<?>) target;
        else if (target instanceof Tuple) seq = ((Tuple) target).items;
        if (seq != null || target instanceof String) {
            int size = Values.length(target);
            long i = Values.asLong(index);
            if (python && i < 0) i += size;
            if (i < 0 || i >= size) {
                if (python) throw new UnresolvedException("index " + i + " out of range");
                return Nothing.UNDEFINED;
            }
            return seq != null ? seq.get((int) i) : String.valueOf(((String) target).charAt((int) i));
        }
        throw new UnresolvedException("subscript of " + Values.typeName(target));
    }

    @SuppressWarnings("unchecked")
    static void store(Object target, Object index, Object value, Env env) {
        Values.known(target, "subscripted value");
        Values.known(index, "index");
        if (target instanceof Map && env.language == Language.PYTHON) {
            ((Map<Object, Object>) target).put(Values.key(index), value);
            return;
        }
        if (target instanceof ObjectLiteral) {
            ((ObjectLiteral) target).fields.put(Values.propertyKey(index), value);
            return;
        }
        if (target instanceof List) {
            List<Object> list = (List<Object>) target;
            long i = Values.asLong(index);
            if (env.language == Language.PYTHON && i < 0) i += list.size();
            if (i >= 0 && i < list.size()) {
                list.set((int) i, value);
                return;
            }
            if (env.language != Language.PYTHON && i >= list.size() && i < MAX_COLLECTION) {
                while (list.size() < i) list.add(Nothing.UNDEFINED);
                list.add(value);
                return;
            }
            throw new UnresolvedException("index " + i + " out of range");
        }
        throw new UnresolvedException("item assignment on " + Values.typeName(target));
    }

    static Object slice(Object target, Object lower, Object upper, Language language) {
        int size = Values.length(target);
        int lo = lower instanceof Nothing ? 0 : clampIndex(Values.asLong(lower), size);
        int hi = upper instanceof Nothing ? size : clampIndex(Values.asLong(upper), size);
        if (hi < lo) hi = lo;
        if (target instanceof String) return ((String) target).substring(lo, hi);
        if (target instanceof Tuple) return new Tuple(((Tuple) target).items.subList(lo, hi));
        if (target instanceof List) return new ArrayList<>(((List<?>) target).subList(lo, hi));
        throw new UnresolvedException("slice of " + Values.typeName(target));
    }

    private static int clampIndex(long i, int size) {
        if (i < 0) i += size;
        return (int) Math.max(0, Math.min(size, i));
    }

    @SuppressWarnings("unchecked")
    static Object method(Object receiver, String name, List<Object> args, Map<String, Object> keywords, Env env) {
        Language lang = env.language;
        for (Object a : args) Values.known(a, "argument");
        if (receiver instanceof Namespace) return namespaceCall(((Namespace) receiver).name, name, args, env);
        if (receiver instanceof List) return listMethod((List<Object>) receiver, name, args, lang);
        if (receiver instanceof Map) return mapMethod((Map<Object, Object>) receiver, name, args, lang);
        if (receiver instanceof Set) return setMethod((Set<Object>) receiver, name, args, lang);
        if (receiver instanceof String) return stringMethod((String) receiver, name, args, lang);
        if (receiver instanceof ObjectLiteral && "hasOwnProperty".equals(name)) {
            return ((ObjectLiteral) receiver).fields.containsKey(Values.propertyKey(arg(args, 0)));
        }
        throw new UnresolvedException(Values.typeName(receiver) + "." + name + "() has unknown effect");
    }

    private static Object listMethod(List<Object> list, String name, List<Object> args, Language lang) {
        boolean python = lang == Language.PYTHON;
        switch (name) {
            case "append":
                list.add(arg(args, 0));
                return Nothing.NONE;
            case "push":
                list.addAll(args);
                return (long) list.size();
            case "extend":
                list.addAll(Values.iterate(arg(args, 0), lang));
                return Nothing.NONE;
            case "insert": {
                int i = clampIndex(Values.asLong(arg(args, 0)), list.size());
                list.add(i, arg(args, 1));
                return Nothing.NONE;
            }
            case "unshift":
                list.addAll(0, args);
                return (long) list.size();
            case "pop": {
                if (list.isEmpty()) {
                    if (python) throw new UnresolvedException("pop from empty list");
                    return Nothing.UNDEFINED;
                }
                int i = args.isEmpty() ? list.size() - 1 : clampIndex(Values.asLong(args.get(0)), list.size());
                return list.remove(i);
            }
            case "shift":
                return list.isEmpty() ? Nothing.UNDEFINED : list.remove(0);
            case "includes":
                for (Object o : list) if (Values.same(o, arg(args, 0))) return true;
                return false;
            case "index":
            case "indexOf":
                for (int i = 0; i < list.size(); i++) if (Values.same(list.get(i), arg(args, 0))) return (long) i;
                if (python) throw new UnresolvedException("value not in list");
                return -1L;
            case "count": {
                long c = 0;
                for (Object o : list) if (Values.same(o, arg(args, 0))) c++;
                return c;
            }
            case "reverse":
                Collections.reverse(list);
                return python ? Nothing.NONE : list;
            case "sort": {
                if (!args.isEmpty()) throw new UnresolvedException("sort with a comparator");
                if (python) list.sort(Values::compare);
                else list.sort(Comparator.comparing((Object o) -> Values.str(o, lang)));
                return python ? Nothing.NONE : list;
            }
            case "copy":
            case "slice":
                if ("slice".equals(name)) {
                    return slice(list, args.isEmpty() ? Nothing.NONE : args.get(0),
                            args.size() > 1 ? args.get(1) : Nothing.NONE, lang);
                }
                return new ArrayList<>(list);
            case "concat": {
                List<Object> out = new ArrayList<>(list);
                for (Object a : args) {
                    if (a instanceof List) out.addAll((List<?>) a);
                    else out.add(a);
                }
                return out;
            }
            case "join":
                return joinStr(list, args.isEmpty() ? "," : Values.str(args.get(0), lang), lang);
            case "fill": {
                for (int i = 0; i < list.size(); i++) list.set(i, arg(args, 0));
                return list;
            }
            case "entries": {
                List<Object> out = new ArrayList<>();
                for (int i = 0; i < list.size(); i++) out.add(new ArrayList<>(List.of((long) i, list.get(i))));
                return out;
            }
            case "keys": {
                List<Object> out = new ArrayList<>();
                for (int i = 0; i < list.size(); i++) out.add((long) i);
                return out;
            }
            case "at": {
                long i = Values.asLong(arg(args, 0));
                if (i < 0) i += list.size();
                return i >= 0 && i < list.size() ? list.get((int) i) : Nothing.UNDEFINED;
            }
            default:
                throw new UnresolvedException("list." + name + "() has unknown effect");
        }
    }

    private static Object mapMethod(Map<Object, Object> map, String name, List<Object> args, Language lang) {
        boolean python = lang == Language.PYTHON;
        switch (name) {
            case "get": {
                Object v = map.get(Values.key(arg(args, 0)));
                if (v != null) return v;
                return args.size() > 1 ? args.get(1) : Values.none(lang);
            }
            case "set":
                map.put(Values.key(arg(args, 0)), arg(args, 1));
                return map;
            case "has":
                return map.containsKey(Values.key(arg(args, 0)));
            case "delete":
                return map.remove(Values.key(arg(args, 0))) != null;
            case "keys":
                return new ArrayList<>(map.keySet());
            case "values":
                return new ArrayList<>(map.values());
            case "items":
            case "entries": {
                List<Object> out = new ArrayList<>();
                for (Map.Entry<Object, Object> e : map.entrySet()) {
                    List<Object> pair = List.of(e.getKey(), e.getValue());
                    out.add(python ? new Tuple(pair) : new ArrayList<>(pair));
                }
                return out;
            }
            case "pop": {
                Object v = map.remove(Values.key(arg(args, 0)));
                if (v != null) return v;
                if (args.size() > 1) return args.get(1);
                throw new UnresolvedException("key " + Values.repr(args.get(0), lang) + " is missing");
            }
            case "setdefault": {
                Object k = Values.key(arg(args, 0));
                if (!map.containsKey(k)) map.put(k, args.size() > 1 ? args.get(1) : Nothing.NONE);
                return map.get(k);
            }
            case "update": {
                Object src = arg(args, 0);
                if (!(src instanceof Map)) throw new UnresolvedException("update from " + Values.typeName(src));
                map.putAll((Map<?, ?>) src);
                return Nothing.NONE;
            }
            case "copy":
                return new LinkedHashMap<>(map);
            case "clear":
                map.clear();
                return Values.none(lang);
            default:
                throw new UnresolvedException("dict." + name + "() has unknown effect");
        }
    }

    private static Object setMethod(Set<Object> set, String name, List<Object> args, Language lang) {
        switch (name) {
            case "add":
                set.add(Values.key(arg(args, 0)));
                return lang == Language.PYTHON ? Nothing.NONE : set;
            case "has":
                return set.contains(Values.key(arg(args, 0)));
            case "remove":
                if (!set.remove(Values.key(arg(args, 0)))) throw new UnresolvedException("value not in set");
                return Nothing.NONE;
            case "discard":
            case "delete":
                boolean removed = set.remove(Values.key(arg(args, 0)));
                return lang == Language.PYTHON ? Nothing.NONE : removed;
            default:
                throw new UnresolvedException("set." + name + "() has unknown effect");
        }
    }

    private static Object stringMethod(String s, String name, List<Object> args, Language lang) {
        switch (name) {
            case "upper":
            case "toUpperCase":
                return s.toUpperCase();
            case "lower":
            case "toLowerCase":
                return s.toLowerCase();
            case "strip":
            case "trim":
                return s.strip();
            case "startswith":
            case "startsWith":
                return s.startsWith(Values.str(arg(args, 0), lang));
            case "endswith":
            case "endsWith":
                return s.endsWith(Values.str(arg(args, 0), lang));
            case "includes":
                return s.contains(Values.str(arg(args, 0), lang));
            case "find":
            case "indexOf":
                return (long) s.indexOf(Values.str(arg(args, 0), lang));
            case "replace":
                if (lang == Language.PYTHON) return s.replace(Values.str(arg(args, 0), lang), Values.str(arg(args, 1), lang));
                return s.replaceFirst(java.util.regex.Pattern.quote(Values.str(arg(args, 0), lang)),
                        java.util.regex.Matcher.quoteReplacement(Values.str(arg(args, 1), lang)));
            case "split": {
                List<Object> out = new ArrayList<>();
                if (args.isEmpty() || args.get(0) instanceof Nothing) {
                    if (lang != Language.PYTHON) {
                        out.add(s);
                        return out;
                    }
                    for (String part : s.strip().split("\\s+")) if (!part.isEmpty()) out.add(part);
                    return out;
                }
                String sep = Values.str(args.get(0), lang);
                if (sep.isEmpty()) {
                    if (lang == Language.PYTHON) throw new UnresolvedException("empty separator");
                    return Values.iterate(s, lang);
                }
                for (String part : s.split(java.util.regex.Pattern.quote(sep), -1)) out.add(part);
                return out;
            }
            case "join":
                return joinStr(Values.iterate(arg(args, 0), lang), s, lang);
            case "charAt": {
                long i = Values.asLong(arg(args, 0));
                return i >= 0 && i < s.length() ? String.valueOf(s.charAt((int) i)) : "";
            }
            case "slice":
                return slice(s, args.isEmpty() ? Nothing.NONE : args.get(0), args.size() > 1 ? args.get(1) : Nothing.NONE, lang);
            default:
                throw new UnresolvedException("str." + name + "() has unknown effect");
        }
    }

    private static Object namespaceCall(String ns, String name, List<Object> args, Env env) {
        Language lang = env.language;
        if ("console".equals(ns)) {
            env.print(joinStr(args, " ", lang));
            return Nothing.UNDEFINED;
        }
        if ("Math".equals(ns)) {
            switch (name) {
                case "max":
                case "min":
                    return extreme(name, List.of(new ArrayList<>(args)), Map.of(), lang);
                case "abs":
                    return call("abs", args, Map.of(), env);
                case "floor":
                    return Values.normalizeNumber(Math.floor(Values.toDouble(number(arg(args, 0)))));
                case "ceil":
                    return Values.normalizeNumber(Math.ceil(Values.toDouble(number(arg(args, 0)))));
                case "round":
                    return Values.normalizeNumber(Math.floor(Values.toDouble(number(arg(args, 0))) + 0.5));
                case "trunc":
                    return Values.normalizeNumber((double) (long) Values.toDouble(number(arg(args, 0))));
                case "sqrt":
                    return Values.normalizeNumber(Math.sqrt(Values.toDouble(number(arg(args, 0)))));
                case "pow":
                    return Operators.binary("**", number(arg(args, 0)), number(arg(args, 1)), lang);
                default:
                    break;
            }
        }
        if ("Object".equals(ns)) {
            Object o = arg(args, 0);
            if (!(o instanceof ObjectLiteral)) throw new UnresolvedException("Object." + name + " of " + Values.typeName(o));
            Map<String, Object> fields = ((ObjectLiteral) o).fields;
            List<Object> out = new ArrayList<>();
            switch (name) {
                case "keys":
                    out.addAll(fields.keySet());
                    return out;
                case "values":
                    out.addAll(fields.values());
                    return out;
                case "entries":
                    for (Map.Entry<String, Object> e : fields.entrySet()) out.add(new ArrayList<>(List.of(e.getKey(), e.getValue())));
                    return out;
                default:
                    break;
            }
        }
        if ("Array".equals(ns)) {
            if ("isArray".equals(name)) return arg(args, 0) instanceof List;
            if ("from".equals(name)) return Values.iterate(arg(args, 0), lang);
        }
        if ("Number".equals(ns) && "isInteger".equals(name)) {
            Object v = arg(args, 0);
            return v instanceof Long || (v instanceof Double && ((Double) v) == Math.rint((Double) v));
        }
        throw new UnresolvedException(ns + "." + name + "() has unknown effect");
    }

    static String typeOf(Object v) {
        Values.known(v, "operand");
        if (Values.isNumber(v)) return "number";
        if (v instanceof String) return "string";
        if (v instanceof Boolean) return "boolean";
        if (v == Nothing.UNDEFINED) return "undefined";
        if (v instanceof Function) return "function";
        return "object";
    }

    private static Object extreme(String name, List<Object> args, Map<String, Object> keywords, Language lang) {
        if (keywords.containsKey("key")) throw new UnresolvedException(name + " with a key function");
        List<Object> items = args.size() == 1 ? Values.iterate(args.get(0), lang) : new ArrayList<>(args);
        if (items.isEmpty()) {
            if (keywords.containsKey("default")) return keywords.get("default");
            if (lang != Language.PYTHON) return "max".equals(name) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            throw new UnresolvedException(name + "() of an empty sequence");
        }
        Object best = items.get(0);
        for (Object o : items) {
            int c = Values.compare(o, best);
            if ("max".equals(name) ? c > 0 : c < 0) best = o;
        }
        return best;
    }

    private static List<Object> range(List<Object> args) {
        long start = 0;
        long stop;
        long step = 1;
        if (args.size() == 1) {
            stop = Values.asLong(args.get(0));
        } else if (args.size() >= 2) {
            start = Values.asLong(args.get(0));
            stop = Values.asLong(args.get(1));
            if (args.size() > 2) step = Values.asLong(args.get(2));
        } else {
            throw new UnresolvedException("range() needs arguments");
        }
        if (step == 0) throw new UnresolvedException("range() step is zero");
        List<Object> out = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            if (out.size() >= MAX_COLLECTION) throw new UnresolvedException("range too large");
            out.add(i);
        }
        return out;
    }

    private static Object toInt(Object v) {
        if (v instanceof Long) return v;
        if (v instanceof Double) return (long) (double) (Double) v;
        if (v instanceof Boolean) return ((Boolean) v) ? 1L : 0L;
        if (v instanceof String) {
            try {
                return Long.parseLong(((String) v).strip());
            } catch (NumberFormatException e) {
                throw new UnresolvedException("not an integer literal: " + v);
            }
        }
        throw new UnresolvedException("int() of " + Values.typeName(v));
    }

    private static Object toFloat(Object v, Language lang) {
        double d;
        if (Values.isNumber(v)) d = Values.toDouble(v);
        else if (v instanceof Boolean) d = ((Boolean) v) ? 1 : 0;
        else if (v instanceof String) {
            try {
                d = Double.parseDouble(((String) v).strip());
            } catch (NumberFormatException e) {
                if (lang == Language.PYTHON) throw new UnresolvedException("not a number literal: " + v);
                d = Double.NaN;
            }
        } else {
            throw new UnresolvedException("float() of " + Values.typeName(v));
        }
        return lang == Language.PYTHON ? (Object) d : Values.normalizeNumber(d);
    }

    private static Object number(Object v) {
        if (!Values.isNumber(v)) throw new UnresolvedException("expected a number, got " + Values.typeName(v));
        return v;
    }

    private static Object arg(List<Object> args, int i) {
        if (i >= args.size()) throw new UnresolvedException("missing argument " + (i + 1));
        return args.get(i);
    }

    private static String joinStr(List<?> items, String sep, Language lang) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(sep);
            sb.append(Values.str(items.get(i), lang));
        }
        return sb.toString();
    }
}

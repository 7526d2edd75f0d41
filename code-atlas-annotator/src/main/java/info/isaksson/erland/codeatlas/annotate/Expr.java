package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expression tree evaluated by the dry run. Nodes are immutable; every evaluation of a container
 * display builds a fresh container.
 */
abstract class Expr {

    abstract Object eval(Env env);

    /** Stores a value into this expression used as an assignment target. */
    void assign(Object value, Env env) {
        throw new UnresolvedException("cannot assign to this target");
    }

    /** The target as it should read in a step, with subscripts evaluated. */
    String describe(Env env) {
        throw new UnresolvedException("not an assignable target");
    }

    /** Names bound by assigning to this target, in source order. */
    void collectNames(List<String> out) {
    }

    static final class Literal extends Expr {
        final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override Object eval(Env env) {
            return value;
        }
    }

    /** Something the evaluator does not model (lambdas, comprehensions, interpolated strings). */
    static final class Unsupported extends Expr {
        final String what;

        Unsupported(String what) {
            this.what = what;
        }

        @Override Object eval(Env env) {
            throw new UnresolvedException(what + " is not evaluated");
        }
    }

    static final class Name extends Expr {
        final String id;

        Name(String id) {
            this.id = id;
        }

        @Override Object eval(Env env) {
            return env.lookup(id);
        }

        @Override void assign(Object value, Env env) {
            env.bind(id, value);
        }

        @Override String describe(Env env) {
            return id;
        }

        @Override void collectNames(List<String> out) {
            out.add(id);
        }
    }

    static final class Attribute extends Expr {
        final Expr target;
        final String name;
        final boolean optional;

        Attribute(Expr target, String name, boolean optional) {
            this.target = target;
            this.name = name;
            this.optional = optional;
        }

        @Override Object eval(Env env) {
            Object t = Values.known(target.eval(env), "receiver");
            if (optional && t instanceof Nothing) return Nothing.UNDEFINED;
            return Builtins.attribute(t, name, env);
        }

        @Override void assign(Object value, Env env) {
            Object t = Values.known(target.eval(env), "receiver");
            if (t instanceof Opaque) {
                ((Opaque) t).attributes.put(name, value);
            } else if (t instanceof ObjectLiteral) {
                ((ObjectLiteral) t).fields.put(name, value);
            } else {
                throw new UnresolvedException("cannot set attribute '" + name + "' on " + Values.typeName(t));
            }
        }

        @Override String describe(Env env) {
            return target.describe(env) + "." + name;
        }
    }

    static final class Subscript extends Expr {
        final Expr target;
        final Expr index;

        Subscript(Expr target, Expr index) {
            this.target = target;
            this.index = index;
        }

        @Override Object eval(Env env) {
            return Builtins.subscript(target.eval(env), index.eval(env), env);
        }

        @Override void assign(Object value, Env env) {
            Builtins.store(target.eval(env), index.eval(env), value, env);
        }

        @Override String describe(Env env) {
            return target.describe(env) + "[" + env.repr(index.eval(env)) + "]";
        }
    }

    static final class Slice extends Expr {
        final Expr target;
        final Expr lower;
        final Expr upper;

        Slice(Expr target, Expr lower, Expr upper) {
            this.target = target;
            this.lower = lower;
            this.upper = upper;
        }

        @Override Object eval(Env env) {
            Object t = Values.known(target.eval(env), "sequence");
            Object lo = lower == null ? Nothing.NONE : lower.eval(env);
            Object hi = upper == null ? Nothing.NONE : upper.eval(env);
            return Builtins.slice(t, lo, hi, env.language);
        }
    }

    static final class Call extends Expr {
        final Expr callee;
        final List<Expr> args;
        final Map<String, Expr> keywords;

        Call(Expr callee, List<Expr> args, Map<String, Expr> keywords) {
            this.callee = callee;
            this.args = List.copyOf(args);
            this.keywords = keywords;
        }

        @Override Object eval(Env env) {
            if (callee instanceof Attribute) {
                Attribute a = (Attribute) callee;
                Object receiver = Values.known(a.target.eval(env), "receiver");
                if (a.optional && receiver instanceof Nothing) return Nothing.UNDEFINED;
                return Builtins.method(receiver, a.name, evalArgs(env), evalKeywords(env), env);
            }
            Object fn = callee.eval(env);
            if (fn instanceof Builtins.Function) {
                return Builtins.call(((Builtins.Function) fn).name, evalArgs(env), evalKeywords(env), env);
            }
            throw new UnresolvedException("call of " + Values.typeName(fn) + " has unknown effect");
        }

        /** Variable the call mutates in place ({@code xs.append(..)} mutates {@code xs}), or null. */
        String receiverName() {
            if (callee instanceof Attribute && ((Attribute) callee).target instanceof Name) {
                return ((Name) ((Attribute) callee).target).id;
            }
            return null;
        }

        boolean isPrint() {
            if (callee instanceof Name) return "print".equals(((Name) callee).id);
            if (callee instanceof Attribute && ((Attribute) callee).target instanceof Name) {
                return "console".equals(((Name) ((Attribute) callee).target).id);
            }
            return false;
        }

        private List<Object> evalArgs(Env env) {
            List<Object> out = new ArrayList<>();
            for (Expr a : args) {
                if (a instanceof Spread) {
                    out.addAll(Values.iterate(((Spread) a).inner.eval(env), env.language));
                } else {
                    out.add(a.eval(env));
                }
            }
            return out;
        }

        private Map<String, Object> evalKeywords(Env env) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Expr> e : keywords.entrySet()) out.put(e.getKey(), e.getValue().eval(env));
            return out;
        }
    }

    static final class New extends Expr {
        final String type;
        final List<Expr> args;

        New(String type, List<Expr> args) {
            this.type = type;
            this.args = List.copyOf(args);
        }

        @Override Object eval(Env env) {
            List<Object> values = new ArrayList<>();
            for (Expr a : args) values.add(a.eval(env));
            return Builtins.construct(type, values, env);
        }
    }

    static final class Spread extends Expr {
        final Expr inner;

        Spread(Expr inner) {
            this.inner = inner;
        }

        @Override Object eval(Env env) {
            throw new UnresolvedException("spread outside a display");
        }
    }

    /** List / array display; also a destructuring target. */
    static final class Sequence extends Expr {
        final List<Expr> items;
        final boolean tuple;

        Sequence(List<Expr> items, boolean tuple) {
            this.items = List.copyOf(items);
            this.tuple = tuple;
        }

        @Override Object eval(Env env) {
            List<Object> out = new ArrayList<>();
            for (Expr e : items) {
                if (e instanceof Spread) {
                    out.addAll(Values.iterate(((Spread) e).inner.eval(env), env.language));
                } else {
                    out.add(e.eval(env));
                }
            }
            return tuple ? new Tuple(out) : out;
        }

        @Override void assign(Object value, Env env) {
            List<Object> parts = Values.iterate(value, env.language);
            int spread = -1;
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i) instanceof Spread) spread = i;
            }
            if (spread < 0) {
                if (parts.size() != items.size() && env.language == Language.PYTHON) {
                    throw new UnresolvedException("cannot unpack " + parts.size() + " values into " + items.size());
                }
                for (int i = 0; i < items.size(); i++) {
                    items.get(i).assign(i < parts.size() ? parts.get(i) : Nothing.UNDEFINED, env);
                }
                return;
            }
            int after = items.size() - spread - 1;
            if (parts.size() < spread + after) throw new UnresolvedException("not enough values to unpack");
            for (int i = 0; i < spread; i++) items.get(i).assign(parts.get(i), env);
            ((Spread) items.get(spread)).inner.assign(new ArrayList<>(parts.subList(spread, parts.size() - after)), env);
            for (int i = 0; i < after; i++) {
                items.get(spread + 1 + i).assign(parts.get(parts.size() - after + i), env);
            }
        }

        @Override String describe(Env env) {
            List<String> names = new ArrayList<>();
            collectNames(names);
            return String.join(", ", names);
        }

        @Override void collectNames(List<String> out) {
            for (Expr e : items) {
                if (e instanceof Spread) ((Spread) e).inner.collectNames(out);
                else e.collectNames(out);
            }
        }
    }

    static final class DictDisplay extends Expr {
        final List<Expr> keys;
        final List<Expr> values;

        /** A null key marks a {@code **mapping} entry. */
        DictDisplay(List<Expr> keys, List<Expr> values) {
            this.keys = new ArrayList<>(keys);
            this.values = List.copyOf(values);
        }

        @Override Object eval(Env env) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < values.size(); i++) {
                Expr k = keys.get(i);
                if (k == null) {
                    Object m = Values.known(values.get(i).eval(env), "mapping");
                    if (!(m instanceof Map)) throw new UnresolvedException("** needs a mapping");
                    out.putAll((Map<?, ?>) m);
                } else {
                    out.put(Values.key(k.eval(env)), values.get(i).eval(env));
                }
            }
            return out;
        }
    }

    static final class SetDisplay extends Expr {
        final List<Expr> items;

        SetDisplay(List<Expr> items) {
            this.items = List.copyOf(items);
        }

        @Override Object eval(Env env) {
            Set<Object> out = new LinkedHashSet<>();
            for (Expr e : items) out.add(Values.key(e.eval(env)));
            return out;
        }
    }

    /** JavaScript object literal; with shorthand keys it is also a destructuring target. */
    static final class ObjectDisplay extends Expr {
        final List<String> keys;
        final List<Expr> computedKeys;
        final List<Expr> values;

        /** For each entry either keys[i] or computedKeys[i] is set; a spread entry has both null. */
        ObjectDisplay(List<String> keys, List<Expr> computedKeys, List<Expr> values) {
            this.keys = new ArrayList<>(keys);
            this.computedKeys = new ArrayList<>(computedKeys);
            this.values = List.copyOf(values);
        }

        @Override Object eval(Env env) {
            ObjectLiteral out = new ObjectLiteral();
            for (int i = 0; i < values.size(); i++) {
                if (keys.get(i) == null && computedKeys.get(i) == null) {
                    Object src = Values.known(values.get(i).eval(env), "spread source");
                    if (!(src instanceof ObjectLiteral)) throw new UnresolvedException("object spread of " + Values.typeName(src));
                    out.fields.putAll(((ObjectLiteral) src).fields);
                    continue;
                }
                String key = keys.get(i) != null ? keys.get(i) : Values.propertyKey(computedKeys.get(i).eval(env));
                out.fields.put(key, values.get(i).eval(env));
            }
            return out;
        }

        @Override void assign(Object value, Env env) {
            Object src = Values.known(value, "destructured value");
            for (int i = 0; i < values.size(); i++) {
                String key = keys.get(i);
                if (key == null) throw new UnresolvedException("computed destructuring key");
                values.get(i).assign(Builtins.attribute(src, key, env), env);
            }
        }

        @Override String describe(Env env) {
            List<String> names = new ArrayList<>();
            collectNames(names);
            return String.join(", ", names);
        }

        @Override void collectNames(List<String> out) {
            for (Expr v : values) v.collectNames(out);
        }
    }

    static final class Unary extends Expr {
        final String op;
        final Expr operand;

        Unary(String op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override Object eval(Env env) {
            Object v = operand.eval(env);
            switch (op) {
                case "not":
                case "!":
                    return !Values.truthy(v, env.language);
                case "typeof":
                    return Builtins.typeOf(v);
                default:
                    return Operators.unary(op, v, env.language);
            }
        }
    }

    static final class Binary extends Expr {
        final String op;
        final Expr left;
        final Expr right;

        Binary(String op, Expr left, Expr right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override Object eval(Env env) {
            return Operators.binary(op, left.eval(env), right.eval(env), env.language);
        }
    }

    /** Short-circuit {@code and or && || ??}. */
    static final class Logical extends Expr {
        final String op;
        final Expr left;
        final Expr right;

        Logical(String op, Expr left, Expr right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override Object eval(Env env) {
            Object l = Values.known(left.eval(env), "operand");
            switch (op) {
                case "and":
                case "&&":
                    return Values.truthy(l, env.language) ? right.eval(env) : l;
                case "??":
                    return l instanceof Nothing ? right.eval(env) : l;
                default:
                    return Values.truthy(l, env.language) ? l : right.eval(env);
            }
        }
    }

    /** Comparison; Python chains ({@code a < b < c}) share operands. */
    static final class Compare extends Expr {
        final List<String> ops = new ArrayList<>();
        final List<Expr> operands = new ArrayList<>();
        boolean grouped;

        Compare(Expr first) {
            operands.add(first);
        }

        @Override Object eval(Env env) {
            Object left = operands.get(0).eval(env);
            for (int i = 0; i < ops.size(); i++) {
                Object right = operands.get(i + 1).eval(env);
                if (!Operators.compare(ops.get(i), left, right, env.language)) return false;
                left = right;
            }
            return true;
        }
    }

    static final class Conditional extends Expr {
        final Expr test;
        final Expr then;
        final Expr otherwise;

        Conditional(Expr test, Expr then, Expr otherwise) {
            this.test = test;
            this.then = then;
            this.otherwise = otherwise;
        }

        @Override Object eval(Env env) {
            return Values.truthy(test.eval(env), env.language) ? then.eval(env) : otherwise.eval(env);
        }
    }
}

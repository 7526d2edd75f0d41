package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.DryRunTrace;
import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a statement tree against an {@link Env} and narrates every state change as one step.
 *
 * <p>The walk ends at the first {@code return}, {@code raise}/{@code throw}, a condition or
 * iterable whose value is not known, or when {@code maxSteps} steps have been recorded; in the last
 * case {@link DryRunTrace#TRUNCATED_STEP} is appended.</p>
 */
final class TraceWalker {

    static final String PLACEHOLDER_SUFFIX = " (effect depends on runtime state)";

    private static final int MAX_SHOWN = 60;

    private enum Flow { NORMAL, BREAK, CONTINUE, RETURN, STOP }

    /** Raised internally once the step bound is reached. */
    private static final class StepLimitReached extends RuntimeException {
        StepLimitReached() {
            super(null, null, false, false);
        }
    }

    private final Env env;
    private final int maxSteps;
    private final List<String> steps = new ArrayList<>();
    private boolean truncated;

    TraceWalker(Env env, int maxSteps) {
        this.env = env;
        this.maxSteps = Math.max(1, maxSteps);
    }

    boolean truncated() {
        return truncated;
    }

    List<String> steps() {
        return List.copyOf(steps);
    }

    /** Records the opening step, runs the body and closes the trace at {@code endLine}. */
    void run(String opening, List<Stmt> body, int endLine) {
        try {
            step(opening);
            Flow flow = block(body);
            if (flow == Flow.NORMAL || flow == Flow.BREAK || flow == Flow.CONTINUE) {
                step("Line " + endLine + ": end of function, returns " + env.repr(Values.none(env.language)));
            }
        } catch (StepLimitReached e) {
            truncated = true;
            steps.add(DryRunTrace.TRUNCATED_STEP);
        }
    }

    private void step(String text) {
        if (steps.size() >= maxSteps) throw new StepLimitReached();
        steps.add(text);
    }

    private void step(int line, String text) {
        step("Line " + line + ": " + text);
    }

    private Flow block(List<Stmt> body) {
        for (Stmt s : body) {
            Flow flow = statement(s);
            if (flow != Flow.NORMAL) return flow;
        }
        return Flow.NORMAL;
    }

    private Flow statement(Stmt s) {
        if (s instanceof Stmt.Assign) return assign((Stmt.Assign) s);
        if (s instanceof Stmt.AugAssign) return augAssign((Stmt.AugAssign) s);
        if (s instanceof Stmt.ExprStmt) return expression((Stmt.ExprStmt) s);
        if (s instanceof Stmt.If) return ifChain((Stmt.If) s);
        if (s instanceof Stmt.ForEach) return forEach((Stmt.ForEach) s);
        if (s instanceof Stmt.ForClassic) return forClassic((Stmt.ForClassic) s);
        if (s instanceof Stmt.While) return whileLoop((Stmt.While) s);
        if (s instanceof Stmt.Try) return tryBlock((Stmt.Try) s);
        if (s instanceof Stmt.Return) return returnStatement((Stmt.Return) s);
        if (s instanceof Stmt.Raise) {
            step(s.line, shorten(s.text) + ", execution stops with an error");
            return Flow.STOP;
        }
        if (s instanceof Stmt.Break) {
            step(s.line, "break out of loop");
            return Flow.BREAK;
        }
        if (s instanceof Stmt.Continue) {
            step(s.line, "continue with next iteration");
            return Flow.CONTINUE;
        }
        if (s instanceof Stmt.Placeholder) {
            Stmt.Placeholder p = (Stmt.Placeholder) s;
            for (String name : p.boundNames) env.bind(name, Unknown.VALUE);
            step(s.line, p.narration != null ? p.narration : shorten(s.text) + PLACEHOLDER_SUFFIX);
            return Flow.NORMAL;
        }
        return Flow.NORMAL;
    }

    private Flow assign(Stmt.Assign s) {
        Object value;
        try {
            value = s.value.eval(env);
        } catch (UnresolvedException e) {
            return unresolvedAssignment(s, s.targets);
        }
        List<String> parts = new ArrayList<>();
        try {
            for (Expr target : s.targets) {
                String shown = target.describe(env);
                target.assign(value, env);
                parts.add(shown + " = " + shownValue(target, value));
            }
        } catch (UnresolvedException e) {
            return unresolvedAssignment(s, s.targets);
        }
        step(s.line, String.join(", ", parts) + from(s.valueText, value));
        return Flow.NORMAL;
    }

    private String shownValue(Expr target, Object value) {
        if (target instanceof Expr.Sequence || target instanceof Expr.ObjectDisplay) {
            List<String> names = new ArrayList<>();
            target.collectNames(names);
            List<String> values = new ArrayList<>();
            for (String n : names) values.add(env.repr(env.lookup(n)));
            return String.join(", ", values);
        }
        return env.repr(value);
    }

    private Flow unresolvedAssignment(Stmt s, List<Expr> targets) {
        List<String> names = new ArrayList<>();
        for (Expr t : targets) t.collectNames(names);
        for (String n : names) env.bind(n, Unknown.VALUE);
        step(s.line, shorten(s.text) + PLACEHOLDER_SUFFIX);
        return Flow.NORMAL;
    }

    private Flow augAssign(Stmt.AugAssign s) {
        try {
            Object current = s.target.eval(env);
            Object value = Operators.binary(s.op, current, s.value.eval(env), env.language);
            String shown = s.target.describe(env);
            s.target.assign(value, env);
            step(s.line, shown + " = " + env.repr(value) + " (from " + shown + " " + s.op + " " + s.valueText + ")");
        } catch (UnresolvedException e) {
            return unresolvedAssignment(s, List.of(s.target));
        }
        return Flow.NORMAL;
    }

    private Flow expression(Stmt.ExprStmt s) {
        Object result;
        try {
            result = s.expr.eval(env);
        } catch (UnresolvedException e) {
            env.drainPrinted();
            if (s.expr instanceof Expr.Call) {
                String receiver = ((Expr.Call) s.expr).receiverName();
                if (receiver != null && env.isBound(receiver)) env.bind(receiver, Unknown.VALUE);
            }
            step(s.line, shorten(s.text) + PLACEHOLDER_SUFFIX);
            return Flow.NORMAL;
        }
        if (s.expr instanceof Expr.Call) {
            Expr.Call call = (Expr.Call) s.expr;
            if (call.isPrint()) {
                String label = env.language == Language.PYTHON ? "print" : "console." + ((Expr.Attribute) call.callee).name;
                step(s.line, label + " -> " + String.join("\n", env.drainPrinted()));
                return Flow.NORMAL;
            }
            String receiver = call.receiverName();
            if (receiver != null && env.isBound(receiver)) {
                step(s.line, receiver + " = " + env.repr(env.lookup(receiver)) + " (after " + shorten(s.text) + ")");
                return Flow.NORMAL;
            }
        }
        if (result instanceof Nothing) {
            step(s.line, shorten(s.text));
        } else {
            step(s.line, shorten(s.text) + " -> " + env.repr(result));
        }
        return Flow.NORMAL;
    }

    /** Evaluates a condition; null when it cannot be decided. */
    private Boolean test(Expr test) {
        try {
            return Values.truthy(test.eval(env), env.language);
        } catch (UnresolvedException e) {
            return null;
        }
    }

    private Flow undecided(int line, String testText) {
        step(line, "condition (" + shorten(testText) + ") depends on runtime state, trace stops here");
        return Flow.STOP;
    }

    private Flow ifChain(Stmt.If s) {
        for (int i = 0; i < s.branches.size(); i++) {
            Stmt.Branch b = s.branches.get(i);
            Boolean taken = test(b.test);
            if (taken == null) return undecided(b.line, b.testText);
            if (taken) {
                step(b.line, "condition (" + shorten(b.testText) + ") is " + bool(true));
                return block(b.body);
            }
            boolean last = i == s.branches.size() - 1;
            String tail = !last ? "" : s.orElse != null ? ", take else branch" : ", skip branch";
            step(b.line, "condition (" + shorten(b.testText) + ") is " + bool(false) + tail);
        }
        return s.orElse == null ? Flow.NORMAL : block(s.orElse);
    }

    private String bool(boolean b) {
        return env.repr(b);
    }

    private Flow forEach(Stmt.ForEach s) {
        List<Object> items;
        try {
            Object iterable = s.iterable.eval(env);
            items = s.keys ? keysOf(iterable) : Values.iterate(iterable, env.language);
        } catch (UnresolvedException e) {
            step(s.line, "loop over " + shorten(s.iterableText) + " depends on runtime state, trace stops here");
            return Flow.STOP;
        }
        step(s.line, "loop over " + shorten(s.iterableText) + " (" + items.size() + (items.size() == 1 ? " item)" : " items)"));
        List<String> names = new ArrayList<>();
        s.target.collectNames(names);
        int iteration = 0;
        for (Object item : items) {
            iteration++;
            try {
                s.target.assign(item, env);
            } catch (UnresolvedException e) {
                step(s.line, "iteration " + iteration + ": loop variables depend on runtime state, trace stops here");
                return Flow.STOP;
            }
            step(s.line, "iteration " + iteration + ": " + bindings(names));
            Flow flow = block(s.body);
            if (flow == Flow.BREAK) return Flow.NORMAL;
            if (flow == Flow.RETURN || flow == Flow.STOP) return flow;
        }
        step(s.line, "loop finished after " + plural(iteration, "iteration"));
        return block(s.orElse);
    }

    private List<Object> keysOf(Object iterable) {
        Values.known(iterable, "iterable");
        if (iterable instanceof ObjectLiteral) return new ArrayList<>(((ObjectLiteral) iterable).fields.keySet());
        if (iterable instanceof List || iterable instanceof String) {
            List<Object> out = new ArrayList<>();
            for (int i = 0; i < Values.length(iterable); i++) out.add(String.valueOf(i));
            return out;
        }
        throw new UnresolvedException("for..in over " + Values.typeName(iterable));
    }

    private Flow forClassic(Stmt.ForClassic s) {
        if (s.init != null) {
            Flow flow = statement(s.init);
            if (flow != Flow.NORMAL) return flow;
        }
        List<String> names = s.loopNames();
        int iteration = 0;
        while (true) {
            if (s.test != null) {
                Boolean go = test(s.test);
                if (go == null) return undecided(s.line, s.testText);
                if (!go) {
                    step(s.line, "condition (" + shorten(s.testText) + ") is " + bool(false) + ", loop finished after "
                            + plural(iteration, "iteration"));
                    return Flow.NORMAL;
                }
            }
            iteration++;
            step(s.line, "iteration " + iteration + (names.isEmpty() ? "" : ": " + bindings(names)));
            Flow flow = block(s.body);
            if (flow == Flow.BREAK) return Flow.NORMAL;
            if (flow == Flow.RETURN || flow == Flow.STOP) return flow;
            if (s.update != null) silently(s.update);
        }
    }

    /** Runs a loop update without narrating it; an undecidable update makes its targets unknown. */
    private void silently(Stmt update) {
        try {
            if (update instanceof Stmt.AugAssign) {
                Stmt.AugAssign a = (Stmt.AugAssign) update;
                a.target.assign(Operators.binary(a.op, a.target.eval(env), a.value.eval(env), env.language), env);
            } else if (update instanceof Stmt.Assign) {
                Stmt.Assign a = (Stmt.Assign) update;
                Object value = a.value.eval(env);
                for (Expr t : a.targets) t.assign(value, env);
            } else if (update instanceof Stmt.ExprStmt) {
                ((Stmt.ExprStmt) update).expr.eval(env);
            }
        } catch (UnresolvedException e) {
            List<String> names = new ArrayList<>();
            if (update instanceof Stmt.AugAssign) ((Stmt.AugAssign) update).target.collectNames(names);
            if (update instanceof Stmt.Assign) for (Expr t : ((Stmt.Assign) update).targets) t.collectNames(names);
            for (String n : names) env.bind(n, Unknown.VALUE);
        }
    }

    private Flow whileLoop(Stmt.While s) {
        int iteration = 0;
        boolean first = true;
        while (true) {
            if (!(first && s.bodyFirst)) {
                Boolean go = test(s.test);
                if (go == null) return undecided(s.line, s.testText);
                if (!go) {
                    step(s.line, "condition (" + shorten(s.testText) + ") is " + bool(false) + ", loop finished after "
                            + plural(iteration, "iteration"));
                    return block(s.orElse);
                }
            }
            first = false;
            iteration++;
            step(s.line, (s.bodyFirst ? "do-while" : "while") + " iteration " + iteration);
            Flow flow = block(s.body);
            if (flow == Flow.BREAK) return Flow.NORMAL;
            if (flow == Flow.RETURN || flow == Flow.STOP) return flow;
        }
    }

    private Flow tryBlock(Stmt.Try s) {
        Flow flow = block(s.body);
        if (flow == Flow.STOP) return flow;
        Flow cleanup = block(s.cleanup);
        return cleanup != Flow.NORMAL ? cleanup : flow;
    }

    private Flow returnStatement(Stmt.Return s) {
        if (s.value == null) {
            step(s.line, "return " + env.repr(Values.none(env.language)));
            return Flow.RETURN;
        }
        try {
            Object value = s.value.eval(env);
            step(s.line, "return " + env.repr(value) + from(s.valueText, value));
        } catch (UnresolvedException e) {
            step(s.line, "return " + shorten(s.valueText) + " (value depends on runtime state)");
        }
        return Flow.RETURN;
    }

    private String bindings(List<String> names) {
        List<String> parts = new ArrayList<>();
        for (String n : names) {
            Object v = env.isBound(n) ? env.lookup(n) : Unknown.VALUE;
            parts.add(n + " = " + env.repr(v));
        }
        return String.join(", ", parts);
    }

    private String from(String sourceText, Object value) {
        String shown = env.repr(value);
        return sourceText == null || sourceText.equals(shown) ? "" : " (from " + shorten(sourceText) + ")";
    }

    private static String plural(int n, String word) {
        return n + " " + word + (n == 1 ? "" : "s");
    }

    static String shorten(String text) {
        return text.length() <= MAX_SHOWN ? text : text.substring(0, MAX_SHOWN) + "...";
    }
}

package info.isaksson.erland.codeatlas.annotate;

import java.util.ArrayList;
import java.util.List;

/**
 * Statement tree of one function body, shared by the Python and JavaScript/TypeScript builders.
 * {@link #line} is the 1-based physical line the statement starts on and {@link #text} its source
 * with whitespace squashed.
 */
abstract class Stmt {

    final int line;
    final String text;

    Stmt(int line, String text) {
        this.line = line;
        this.text = text;
    }

    /** Plain or chained assignment; {@code value} is evaluated once and stored into every target. */
    static final class Assign extends Stmt {
        final List<Expr> targets;
        final Expr value;
        final String valueText;

        Assign(int line, String text, List<Expr> targets, Expr value, String valueText) {
            super(line, text);
            this.targets = List.copyOf(targets);
            this.value = value;
            this.valueText = valueText;
        }
    }

    /** {@code x += 1}, {@code i++}. */
    static final class AugAssign extends Stmt {
        final Expr target;
        final String op;
        final Expr value;
        final String valueText;

        AugAssign(int line, String text, Expr target, String op, Expr value, String valueText) {
            super(line, text);
            this.target = target;
            this.op = op;
            this.value = value;
            this.valueText = valueText;
        }
    }

    static final class ExprStmt extends Stmt {
        final Expr expr;

        ExprStmt(int line, String text, Expr expr) {
            super(line, text);
            this.expr = expr;
        }
    }

    /** One {@code if} / {@code elif} / {@code else if} test with its body. */
    static final class Branch {
        final int line;
        final Expr test;
        final String testText;
        final List<Stmt> body;

        Branch(int line, Expr test, String testText, List<Stmt> body) {
            this.line = line;
            this.test = test;
            this.testText = testText;
            this.body = List.copyOf(body);
        }
    }

    static final class If extends Stmt {
        final List<Branch> branches;
        /** Null when there is no {@code else}. */
        final List<Stmt> orElse;
        final int elseLine;

        If(int line, String text, List<Branch> branches, List<Stmt> orElse, int elseLine) {
            super(line, text);
            this.branches = List.copyOf(branches);
            this.orElse = orElse == null ? null : List.copyOf(orElse);
            this.elseLine = elseLine;
        }
    }

    /** {@code for x in xs} / {@code for (const x of xs)}; Python loops may carry an {@code else}. */
    static final class ForEach extends Stmt {
        final Expr target;
        final Expr iterable;
        final String iterableText;
        /** JavaScript {@code for..in}: iterate keys / indexes instead of values. */
        final boolean keys;
        final List<Stmt> body;
        final List<Stmt> orElse;

        ForEach(int line, String text, Expr target, Expr iterable, String iterableText, boolean keys,
                List<Stmt> body, List<Stmt> orElse) {
            super(line, text);
            this.target = target;
            this.iterable = iterable;
            this.iterableText = iterableText;
            this.keys = keys;
            this.body = List.copyOf(body);
            this.orElse = orElse == null ? List.of() : List.copyOf(orElse);
        }
    }

    /** {@code for (init; test; update)}; any part may be null. */
    static final class ForClassic extends Stmt {
        final Stmt init;
        final Expr test;
        final String testText;
        final Stmt update;
        final List<Stmt> body;

        ForClassic(int line, String text, Stmt init, Expr test, String testText, Stmt update, List<Stmt> body) {
            super(line, text);
            this.init = init;
            this.test = test;
            this.testText = testText;
            this.update = update;
            this.body = List.copyOf(body);
        }

        /** Names the loop narrates on every iteration. */
        List<String> loopNames() {
            List<String> out = new ArrayList<>();
            if (init instanceof Assign) {
                for (Expr t : ((Assign) init).targets) t.collectNames(out);
            }
            return out;
        }
    }

    static final class While extends Stmt {
        final Expr test;
        final String testText;
        final List<Stmt> body;
        final List<Stmt> orElse;
        /** {@code do { } while (..)}: the body runs before the first test. */
        final boolean bodyFirst;

        While(int line, String text, Expr test, String testText, List<Stmt> body, List<Stmt> orElse, boolean bodyFirst) {
            super(line, text);
            this.test = test;
            this.testText = testText;
            this.body = List.copyOf(body);
            this.orElse = orElse == null ? List.of() : List.copyOf(orElse);
            this.bodyFirst = bodyFirst;
        }
    }

    /** {@code try}: the body and the cleanup block run, handlers are never entered. */
    static final class Try extends Stmt {
        final List<Stmt> body;
        final List<Stmt> cleanup;

        Try(int line, String text, List<Stmt> body, List<Stmt> cleanup) {
            super(line, text);
            this.body = List.copyOf(body);
            this.cleanup = cleanup == null ? List.of() : List.copyOf(cleanup);
        }
    }

    static final class Return extends Stmt {
        /** Null for a bare {@code return}. */
        final Expr value;
        final String valueText;

        Return(int line, String text, Expr value, String valueText) {
            super(line, text);
            this.value = value;
            this.valueText = valueText;
        }
    }

    /** {@code raise} / {@code throw}: the trace ends here. */
    static final class Raise extends Stmt {
        Raise(int line, String text) {
            super(line, text);
        }
    }

    static final class Break extends Stmt {
        Break(int line, String text) {
            super(line, text);
        }
    }

    static final class Continue extends Stmt {
        Continue(int line, String text) {
            super(line, text);
        }
    }

    /** A statement with no effect on the trace ({@code pass}, bare declarations). */
    static final class Pass extends Stmt {
        Pass(int line, String text) {
            super(line, text);
        }
    }

    /**
     * A statement the walker does not model. It is narrated as a placeholder; {@code boundNames}
     * become unknown and the nested body, if any, is skipped.
     */
    static final class Placeholder extends Stmt {
        final String narration;
        final List<String> boundNames;

        Placeholder(int line, String text, String narration, List<String> boundNames) {
            super(line, text);
            this.narration = narration;
            this.boundNames = boundNames == null ? List.of() : List.copyOf(boundNames);
        }
    }
}

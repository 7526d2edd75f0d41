package info.isaksson.erland.codeatlas.annotate;

import java.util.List;

/** Statements of one function together with the size figures the complexity ceiling looks at. */
final class FunctionBody {

    final List<Stmt> statements;
    /** Deepest block nesting below the function itself (a plain body is 0). */
    final int nesting;
    /** Physical lines after the declaration line. */
    final int lines;

    FunctionBody(List<Stmt> statements, int nesting, int lines) {
        this.statements = List.copyOf(statements);
        this.nesting = nesting;
        this.lines = lines;
    }
}

package info.isaksson.erland.codeatlas.ir;

/**
 * Semantic category of a source line. Declaration order is the classifier's rule priority.
 */
public enum LineCategory {
    DEFINITION("Define"),
    IMPORT("Import module"),
    CONDITIONAL("Conditional check"),
    LOOP("Loop iteration"),
    RETURN("Return statement"),
    ASSIGNMENT("Variable assignment"),
    CALL("Function call"),
    OTHER("Statement");

    public final String label;

    LineCategory(String label) {
        this.label = label;
    }
}

package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.DegradationReason;

import java.util.Objects;

/**
 * Result of the grammar path: either a confident extraction or the reason it could not produce one.
 * A non-confident outcome is not an error; it routes the file to the pattern scanner.
 */
public final class ParseOutcome {
    public final Extraction extraction;
    public final DegradationReason reason;

    private ParseOutcome(Extraction extraction, DegradationReason reason) {
        this.extraction = extraction;
        this.reason = reason;
    }

    public static ParseOutcome confident(Extraction extraction) {
        return new ParseOutcome(Objects.requireNonNull(extraction, "extraction"), null);
    }

    public static ParseOutcome degraded(DegradationReason reason) {
        return new ParseOutcome(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isConfident() {
        return extraction != null;
    }

    @Override public String toString() {
        return isConfident() ? "confident" : "degraded(" + reason + ")";
    }
}

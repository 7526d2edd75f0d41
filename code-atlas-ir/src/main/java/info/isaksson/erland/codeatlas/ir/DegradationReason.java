package info.isaksson.erland.codeatlas.ir;

/**
 * Why a {@link ParsedFile} was produced by the fallback scanner instead of the grammar.
 */
public enum DegradationReason {
    /** No grammar could be constructed for the language or dialect (e.g. native library missing, .tsx). */
    UNSUPPORTED_DIALECT,
    /** The grammar produced error or missing nodes, so declaration spans could not be trusted. */
    MALFORMED_SPAN,
    /** Both paths failed; declarations are empty but lines are kept. */
    EXTRACTION_FAILURE
}

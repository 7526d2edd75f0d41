package info.isaksson.erland.codeatlas.annotate;

/** Python {@code None}, JavaScript {@code null} and {@code undefined}. */
enum Nothing {
    NONE,
    UNDEFINED
}

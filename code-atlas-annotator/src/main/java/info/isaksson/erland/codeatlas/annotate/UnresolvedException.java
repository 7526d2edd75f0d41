package info.isaksson.erland.codeatlas.annotate;

/** Raised while evaluating when a value cannot be determined from literals alone. */
final class UnresolvedException extends RuntimeException {

    UnresolvedException(String message) {
        super(message, null, false, false);
    }
}

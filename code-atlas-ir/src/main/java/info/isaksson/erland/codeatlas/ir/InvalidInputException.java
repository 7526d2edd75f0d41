package info.isaksson.erland.codeatlas.ir;

/**
 * The only failure the analysis pipeline signals upward: the caller handed over an empty or
 * invalid input list (null entries, blank or duplicate paths, mismatched language).
 *
 * <p>Per-file problems never surface as exceptions; they degrade the affected {@link ParsedFile}.</p>
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}

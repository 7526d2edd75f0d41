package info.isaksson.erland.codeatlas.parse;

import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.ir.ParsedFile;

/**
 * Parser adapter contract: source text of a known language in, {@link ParsedFile} out.
 *
 * <p>Implementations never fail on file content. Anything short of a full grammar parse is
 * reported through {@link ParsedFile#degraded}. Implementations hold no mutable state and may be
 * called concurrently.</p>
 */
public interface SourceParser {

    Language language();

    /**
     * @throws info.isaksson.erland.codeatlas.ir.InvalidInputException when {@code path} is blank
     */
    ParsedFile parse(String path, String text);
}

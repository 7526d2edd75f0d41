package info.isaksson.erland.codeatlas.parse;

import java.util.List;

/** Primary, grammar-based extraction path. */
public interface GrammarExtractor {

    /**
     * @param path  file path; used only for dialect selection
     * @param text  normalized source text
     * @param lines physical lines of {@code text}
     */
    ParseOutcome extract(String path, String text, List<String> lines);
}

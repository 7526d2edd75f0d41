package info.isaksson.erland.codeatlas.parse;

import java.util.List;

/**
 * Fallback extraction path: line-oriented rules over lexically masked source. Recognizes canonical
 * declarative syntax only.
 */
public interface PatternScanner {

    Extraction scan(List<String> lines);
}

package info.isaksson.erland.codeatlas.annotate;

import java.util.LinkedHashMap;
import java.util.Map;

/** JavaScript plain object. Keys are always strings. */
final class ObjectLiteral {
    final Map<String, Object> fields = new LinkedHashMap<>();
}

package info.isaksson.erland.codeatlas.annotate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A receiver ({@code self}, {@code cls}, {@code this}) whose state is not known up front. Attributes
 * written during the walk can be read back; anything else is unresolved.
 */
final class Opaque {
    final String name;
    final Map<String, Object> attributes = new LinkedHashMap<>();

    Opaque(String name) {
        this.name = name;
    }
}

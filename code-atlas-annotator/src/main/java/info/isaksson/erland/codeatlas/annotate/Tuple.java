package info.isaksson.erland.codeatlas.annotate;

import java.util.List;

/** Immutable Python tuple. */
final class Tuple {
    final List<Object> items;

    Tuple(List<Object> items) {
        this.items = List.copyOf(items);
    }

    @Override public boolean equals(Object o) {
        return o instanceof Tuple && items.equals(((Tuple) o).items);
    }

    @Override public int hashCode() {
        return items.hashCode();
    }
}

package info.isaksson.erland.codeatlas.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A declarative import. Symbols form a set: they are stored sorted so that insertion order never
 * leaks into equality or serialized output.
 */
@JsonPropertyOrder({"moduleOrPath","importedSymbols"})
public final class ImportRef {
    public final String moduleOrPath;
    public final List<String> importedSymbols;

    @JsonCreator
    public ImportRef(
            @JsonProperty("moduleOrPath") String moduleOrPath,
            @JsonProperty("importedSymbols") Collection<String> importedSymbols
    ) {
        if (moduleOrPath == null || moduleOrPath.isBlank()) {
            throw new IllegalArgumentException("moduleOrPath must not be blank");
        }
        this.moduleOrPath = moduleOrPath.trim();
        TreeSet<String> sorted = new TreeSet<>();
        if (importedSymbols != null) {
            for (String s : importedSymbols) {
                if (s != null && !s.isBlank()) sorted.add(s.trim());
            }
        }
        this.importedSymbols = List.copyOf(sorted);
    }

    public ImportRef(String moduleOrPath) {
        this(moduleOrPath, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportRef)) return false;
        ImportRef that = (ImportRef) o;
        return Objects.equals(moduleOrPath, that.moduleOrPath) &&
                Objects.equals(importedSymbols, that.importedSymbols);
    }

    @Override public int hashCode() {
        return Objects.hash(moduleOrPath, importedSymbols);
    }

    @Override public String toString() {
        return importedSymbols.isEmpty() ? moduleOrPath : moduleOrPath + " " + importedSymbols;
    }
}

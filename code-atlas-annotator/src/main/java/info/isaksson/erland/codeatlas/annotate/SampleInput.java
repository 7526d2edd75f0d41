package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;
import info.isaksson.erland.codeatlas.parse.ParameterLists;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A literal sample input for a dry run: parameter names mapped to literal expression text, e.g.
 * {@code nums = [2, 7, 11, 15], target = 9}.
 */
public final class SampleInput {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final Map<String, String> assignments;

    private SampleInput(Map<String, String> assignments) {
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    /**
     * Parses comma-separated {@code name = literal} assignments. Commas inside brackets and strings
     * do not split.
     *
     * @throws IllegalArgumentException when a piece is not an assignment to a plain name
     */
    public static SampleInput parse(String text) {
        Map<String, String> out = new LinkedHashMap<>();
        if (text == null) return new SampleInput(out);
        for (String piece : ParameterLists.split(text, Language.PYTHON)) {
            int eq = assignmentIndex(piece);
            if (eq < 0) throw new IllegalArgumentException("Invalid sample assignment (expected name = value): " + piece);
            String name = piece.substring(0, eq).trim();
            String value = piece.substring(eq + 1).trim();
            if (!NAME.matcher(name).matches()) throw new IllegalArgumentException("Invalid parameter name in sample input: " + name);
            if (value.isEmpty()) throw new IllegalArgumentException("Missing value for sample parameter " + name);
            out.put(name, value);
        }
        return new SampleInput(out);
    }

    public static SampleInput of(Map<String, String> assignments) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (assignments != null) {
            for (Map.Entry<String, String> e : assignments.entrySet()) {
                copy.put(Objects.requireNonNull(e.getKey(), "name"), Objects.requireNonNull(e.getValue(), "value"));
            }
        }
        return new SampleInput(copy);
    }

    private static int assignmentIndex(String piece) {
        for (int i = 0; i < piece.length(); i++) {
            if (piece.charAt(i) != '=') continue;
            boolean doubled = i + 1 < piece.length() && piece.charAt(i + 1) == '=';
            return doubled ? -1 : i;
        }
        return -1;
    }

    /** Name to literal text, in the order given. */
    public Map<String, String> assignments() {
        return assignments;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public boolean has(String name) {
        return assignments.containsKey(name);
    }

    public String valueOf(String name) {
        return assignments.get(name);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SampleInput)) return false;
        return assignments.equals(((SampleInput) o).assignments);
    }

    @Override public int hashCode() {
        return assignments.hashCode();
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : assignments.entrySet()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(e.getKey()).append(" = ").append(e.getValue());
        }
        return sb.toString();
    }
}

package info.isaksson.erland.codeatlas.annotate;

import info.isaksson.erland.codeatlas.ir.Language;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Variable bindings and captured output of one dry run. */
final class Env {

    final Language language;
    private final Map<String, Object> vars = new LinkedHashMap<>();
    private final List<String> printed = new ArrayList<>();

    Env(Language language) {
        this.language = language;
    }

    boolean isBound(String name) {
        return vars.containsKey(name);
    }

    Object lookup(String name) {
        Object v = vars.get(name);
        if (v != null) return v;
        return Builtins.global(name, language)
                .orElseThrow(() -> new UnresolvedException("'" + name + "' is not bound"));
    }

    void bind(String name, Object value) {
        vars.put(name, value);
    }

    void print(String text) {
        printed.add(text);
    }

    /** Output printed since the last call, cleared on read. */
    List<String> drainPrinted() {
        List<String> out = List.copyOf(printed);
        printed.clear();
        return out;
    }

    String repr(Object value) {
        return Values.repr(value, language);
    }
}

package info.isaksson.erland.codeatlas.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings during an analysis run.
 *
 * <p>Collection is thread-safe so per-file workers may report directly. Output is deterministic:
 * sorted by (code, message, contextString) regardless of the order workers finished in.</p>
 */
public final class AnalysisWarnings {

    private final List<AnalysisWarning> warnings = new ArrayList<>();

    public void warn(String code, String message) {
        warn(code, message, null);
    }

    public void warn(String code, String message, Map<String, String> context) {
        AnalysisWarning w = new AnalysisWarning(code, message, context);
        synchronized (warnings) {
            warnings.add(w);
        }
    }

    public void warn(String code, String message, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        warn(code, message, ctx);
    }

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        ctx.put(k2, v2);
        warn(code, message, ctx);
    }

    public int size() {
        synchronized (warnings) {
            return warnings.size();
        }
    }

    public List<AnalysisWarning> toDeterministicList() {
        List<AnalysisWarning> out;
        synchronized (warnings) {
            out = new ArrayList<>(warnings);
        }
        out.sort(Comparator
                .comparing((AnalysisWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(AnalysisWarning::contextString));
        return Collections.unmodifiableList(out);
    }
}

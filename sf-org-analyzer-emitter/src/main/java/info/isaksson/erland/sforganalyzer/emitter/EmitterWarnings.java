package info.isaksson.erland.sforganalyzer.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects warnings during emission. The final list is sorted by code, message and context, so it does not
 * depend on emission order.
 */
public final class EmitterWarnings {

    private final List<EmitterWarning> warnings = new ArrayList<>();

    public void warn(String code, String message) {
        warn(code, message, (Map<String, String>) null);
    }

    public void warn(String code, String message, Map<String, String> context) {
        warnings.add(new EmitterWarning(code, message, context));
    }

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        ctx.put(k2, v2);
        warn(code, message, ctx);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public List<EmitterWarning> toDeterministicList() {
        List<EmitterWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((EmitterWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextString(Map<String, String> ctx) {
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(ctx).forEach((k, v) -> sb.append(k).append('=').append(v).append(';'));
        return sb.toString();
    }
}

package info.isaksson.erland.sforganalyzer.emitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal problem met while turning a graph into a diagram. */
public final class EmitterWarning {

    /** Stable code, e.g. {@code UNRESOLVED_TARGET}. */
    public final String code;

    public final String message;

    /** Node ids and similar, keyed by role. */
    public final Map<String, String> context;

    public EmitterWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}

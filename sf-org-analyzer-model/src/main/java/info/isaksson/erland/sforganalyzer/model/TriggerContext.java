package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Trigger events supported by the platform. {@code before undelete} does not exist. */
public enum TriggerContext {
    BEFORE_INSERT("before insert", "beforeInsert"),
    BEFORE_UPDATE("before update", "beforeUpdate"),
    BEFORE_DELETE("before delete", "beforeDelete"),
    AFTER_INSERT("after insert", "afterInsert"),
    AFTER_UPDATE("after update", "afterUpdate"),
    AFTER_DELETE("after delete", "afterDelete"),
    AFTER_UNDELETE("after undelete", "afterUndelete");

    private final String label;
    private final String idSuffix;

    TriggerContext(String label, String idSuffix) {
        this.label = label;
        this.idSuffix = idSuffix;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Camel-cased form used inside node identifiers. */
    public String idSuffix() {
        return idSuffix;
    }

    public boolean isBefore() {
        return name().startsWith("BEFORE_");
    }

    /**
     * Accepts {@code "before insert"}, {@code "Before  Insert"}, {@code "BEFORE_INSERT"} and {@code "beforeInsert"}.
     */
    public static Optional<TriggerContext> parse(String text) {
        if (text == null) return Optional.empty();
        String norm = text.trim().replace('_', ' ').replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        for (TriggerContext c : values()) {
            if (c.label.equals(norm) || c.idSuffix.equalsIgnoreCase(text.trim())) return Optional.of(c);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static TriggerContext fromJson(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Unknown trigger context: " + text));
    }
}

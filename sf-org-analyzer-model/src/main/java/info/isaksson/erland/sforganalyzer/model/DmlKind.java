package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Apex DML verbs. The same verbs are reachable through {@code Database.<verb>(...)}. */
public enum DmlKind {
    INSERT,
    UPDATE,
    UPSERT,
    DELETE,
    UNDELETE,
    MERGE;

    @JsonValue
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** @return the verb, or {@code null} if {@code word} is not a DML keyword */
    @JsonCreator
    public static DmlKind fromKeyword(String word) {
        if (word == null) return null;
        for (DmlKind k : values()) {
            if (k.keyword().equalsIgnoreCase(word)) return k;
        }
        return null;
    }
}

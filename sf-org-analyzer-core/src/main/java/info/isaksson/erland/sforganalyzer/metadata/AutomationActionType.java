package info.isaksson.erland.sforganalyzer.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Action types understood in decoded declarative metadata. Unknown types read as {@link #NOTE}. */
public enum AutomationActionType {
    APEX("apex"),
    FLOW("flow"),
    PROCESS_BUILDER("process_builder"),
    WORKFLOW("workflow"),
    DML("dml"),
    FIELD_UPDATE("field_update"),
    SOQL("soql"),
    NOTE("note");

    private final String key;

    AutomationActionType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static AutomationActionType fromKey(String text) {
        if (text == null) return NOTE;
        String wanted = text.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (AutomationActionType t : values()) {
            if (t.key.replace("_", "").equals(wanted)) return t;
        }
        return switch (wanted) {
            case "invocableapex", "apexaction", "apexmethod" -> APEX;
            case "subflow" -> FLOW;
            case "recordcreate", "recordupdate", "recorddelete" -> DML;
            case "recordlookup", "query" -> SOQL;
            default -> NOTE;
        };
    }
}

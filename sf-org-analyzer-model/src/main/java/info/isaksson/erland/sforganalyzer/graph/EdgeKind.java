package info.isaksson.erland.sforganalyzer.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeKind {
    INVOKES("invokes"),
    FIRES("fires"),
    PERFORMS_DML("performs-dml"),
    PERFORMS_SOQL("performs-soql");

    private final String label;

    EdgeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Edge kind for an edge ending at a node of the given kind. */
    public static EdgeKind toward(AutomationKind target) {
        return switch (target) {
            case APEX_METHOD -> INVOKES;
            case DML_OPERATION -> PERFORMS_DML;
            case SOQL_QUERY -> PERFORMS_SOQL;
            case TRIGGER, FLOW, PROCESS_BUILDER, WORKFLOW_RULE -> FIRES;
        };
    }

    /** Edge kind implied by an action whose target could not be resolved. */
    public static EdgeKind forAction(ActionKind action) {
        return switch (action) {
            case INVOKE -> INVOKES;
            case DML -> PERFORMS_DML;
            case SOQL -> PERFORMS_SOQL;
            case FIRE, NOTE -> FIRES;
        };
    }

    @JsonCreator
    public static EdgeKind fromLabel(String label) {
        for (EdgeKind k : values()) {
            if (k.label.equalsIgnoreCase(label) || k.name().equalsIgnoreCase(label)) return k;
        }
        throw new IllegalArgumentException("Unknown edge kind: " + label);
    }
}

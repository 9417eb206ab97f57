package info.isaksson.erland.sforganalyzer.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of automation node variants.
 *
 * <p>Code that behaves differently per variant switches over this enum exhaustively, so adding a variant
 * fails compilation wherever a case is missing.</p>
 */
public enum AutomationKind {
    TRIGGER("trigger"),
    FLOW("flow"),
    PROCESS_BUILDER("process_builder"),
    WORKFLOW_RULE("workflow"),
    APEX_METHOD("apex"),
    DML_OPERATION("dml"),
    SOQL_QUERY("soql");

    private final String idPrefix;

    AutomationKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    /** First segment of node identifiers of this kind; also used as diagram style class. */
    @JsonValue
    public String idPrefix() {
        return idPrefix;
    }

    /** DML and SOQL nodes are terminal. */
    public boolean isLeaf() {
        return switch (this) {
            case DML_OPERATION, SOQL_QUERY -> true;
            case TRIGGER, FLOW, PROCESS_BUILDER, WORKFLOW_RULE, APEX_METHOD -> false;
        };
    }

    @JsonCreator
    public static AutomationKind fromIdPrefix(String prefix) {
        for (AutomationKind k : values()) {
            if (k.idPrefix.equalsIgnoreCase(prefix) || k.name().equalsIgnoreCase(prefix)) return k;
        }
        throw new IllegalArgumentException("Unknown automation kind: " + prefix);
    }
}

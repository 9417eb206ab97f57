package info.isaksson.erland.sforganalyzer.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One action of a Flow, process or workflow rule.
 *
 * <p>{@code target} names the referenced automation: {@code Class.method} (or an invocable class name) for
 * Apex, the API name for flows, processes and rules. {@code operation} and {@code object} describe DML,
 * field updates and record lookups.</p>
 */
@JsonPropertyOrder({"type","target","operation","object","description"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AutomationAction {
    public final AutomationActionType type;
    public final String target;
    public final String operation;
    public final String object;
    public final String description;

    @JsonCreator
    public AutomationAction(
            @JsonProperty("type") AutomationActionType type,
            @JsonProperty("target") String target,
            @JsonProperty("operation") String operation,
            @JsonProperty("object") String object,
            @JsonProperty("description") String description
    ) {
        this.type = type == null ? AutomationActionType.NOTE : type;
        this.target = blankToNull(target);
        this.operation = blankToNull(operation);
        this.object = blankToNull(object);
        this.description = blankToNull(description);
    }

    public static AutomationAction of(AutomationActionType type, String target) {
        return new AutomationAction(type, target, null, null, null);
    }

    public static AutomationAction dml(String operation, String object) {
        return new AutomationAction(AutomationActionType.DML, null, operation, object, null);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AutomationAction)) return false;
        AutomationAction that = (AutomationAction) o;
        return type == that.type &&
                Objects.equals(target, that.target) &&
                Objects.equals(operation, that.operation) &&
                Objects.equals(object, that.object) &&
                Objects.equals(description, that.description);
    }

    @Override public int hashCode() {
        return Objects.hash(type, target, operation, object, description);
    }

    @Override public String toString() {
        return type.key() + (target == null ? "" : " " + target) + (object == null ? "" : " on " + object);
    }
}

package info.isaksson.erland.sforganalyzer.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One declared action of an automation node.
 *
 * <p>The target is referenced by node identifier only and is resolved against the graph's node table;
 * nodes never hold each other by value.</p>
 */
@JsonPropertyOrder({"kind","targetId","description"})
public final class ActionRef {
    public final ActionKind kind;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String targetId;

    public final String description;

    @JsonCreator
    public ActionRef(
            @JsonProperty("kind") ActionKind kind,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("description") String description
    ) {
        this.kind = kind == null ? ActionKind.NOTE : kind;
        this.targetId = targetId == null || targetId.isBlank() ? null : targetId;
        this.description = description == null ? "" : description;
    }

    public static ActionRef fire(String targetId, String description) {
        return new ActionRef(ActionKind.FIRE, targetId, description);
    }

    public static ActionRef invoke(String targetId, String description) {
        return new ActionRef(ActionKind.INVOKE, targetId, description);
    }

    public static ActionRef dml(String targetId, String description) {
        return new ActionRef(ActionKind.DML, targetId, description);
    }

    public static ActionRef soql(String targetId, String description) {
        return new ActionRef(ActionKind.SOQL, targetId, description);
    }

    public static ActionRef note(String description) {
        return new ActionRef(ActionKind.NOTE, null, description);
    }

    public boolean hasTarget() {
        return targetId != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionRef)) return false;
        ActionRef that = (ActionRef) o;
        return kind == that.kind && Objects.equals(targetId, that.targetId) && Objects.equals(description, that.description);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, targetId, description);
    }

    @Override public String toString() {
        return kind + (targetId == null ? "" : "->" + targetId) + (description.isEmpty() ? "" : " (" + description + ")");
    }
}

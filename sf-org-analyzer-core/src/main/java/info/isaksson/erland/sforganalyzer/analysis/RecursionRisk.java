package info.isaksson.erland.sforganalyzer.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A path that may re-enter automation: either it closed on a cycle, or it performs DML on the object whose
 * automation started it.
 */
@JsonPropertyOrder({"kind","entryId","nodeIds","object","message"})
public final class RecursionRisk {

    public enum Kind { CYCLE, SELF_DML }

    public final Kind kind;
    public final String entryId;
    public final List<String> nodeIds;
    public final String object;
    public final String message;

    @JsonCreator
    public RecursionRisk(
            @JsonProperty("kind") Kind kind,
            @JsonProperty("entryId") String entryId,
            @JsonProperty("nodeIds") List<String> nodeIds,
            @JsonProperty("object") String object,
            @JsonProperty("message") String message
    ) {
        this.kind = kind;
        this.entryId = entryId;
        this.nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
        this.object = object;
        this.message = message;
    }

    static RecursionRisk cycle(String entryId, List<String> nodeIds, String object) {
        return new RecursionRisk(Kind.CYCLE, entryId, nodeIds, object,
                "Potential recursion cycle detected: " + String.join(" -> ", nodeIds));
    }

    static RecursionRisk selfDml(String entryId, List<String> nodeIds, String object, String operation) {
        return new RecursionRisk(Kind.SELF_DML, entryId, nodeIds, object,
                operation + " on " + object + " may re-fire automation on " + object);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecursionRisk)) return false;
        RecursionRisk that = (RecursionRisk) o;
        return kind == that.kind &&
                Objects.equals(entryId, that.entryId) &&
                Objects.equals(nodeIds, that.nodeIds) &&
                Objects.equals(object, that.object) &&
                Objects.equals(message, that.message);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, entryId, nodeIds, object, message);
    }

    @Override public String toString() {
        return message;
    }
}

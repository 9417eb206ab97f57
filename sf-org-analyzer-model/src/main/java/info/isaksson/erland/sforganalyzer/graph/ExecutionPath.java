package info.isaksson.erland.sforganalyzer.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered edges from an entry point to a leaf, a cycle closure or a bound.
 *
 * <p>{@code depth} is the number of edges. A path that ends on a cycle carries {@code recursion = true};
 * one that ends on a bound carries {@code truncated = true}. Neither is an error.</p>
 */
@JsonPropertyOrder({"entryId","edges","depth","recursion","truncated","stopReason"})
public final class ExecutionPath {
    public final String entryId;
    public final List<GraphEdge> edges;
    public final boolean recursion;
    public final boolean truncated;
    public final StopReason stopReason;

    @JsonCreator
    public ExecutionPath(
            @JsonProperty("entryId") String entryId,
            @JsonProperty("edges") List<GraphEdge> edges,
            @JsonProperty("recursion") boolean recursion,
            @JsonProperty("truncated") boolean truncated,
            @JsonProperty("stopReason") StopReason stopReason
    ) {
        this.entryId = Objects.requireNonNull(entryId, "entryId");
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.recursion = recursion;
        this.truncated = truncated;
        this.stopReason = stopReason == null ? StopReason.LEAF : stopReason;
    }

    @JsonProperty("depth")
    public int depth() {
        return edges.size();
    }

    /** Entry id followed by the target of every edge. */
    @JsonIgnore
    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>(edges.size() + 1);
        ids.add(entryId);
        for (GraphEdge e : edges) ids.add(e.to);
        return ids;
    }

    @JsonIgnore
    public String lastNodeId() {
        return edges.isEmpty() ? entryId : edges.get(edges.size() - 1).to;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionPath)) return false;
        ExecutionPath that = (ExecutionPath) o;
        return recursion == that.recursion &&
                truncated == that.truncated &&
                Objects.equals(entryId, that.entryId) &&
                Objects.equals(edges, that.edges) &&
                stopReason == that.stopReason;
    }

    @Override public int hashCode() {
        return Objects.hash(entryId, edges, recursion, truncated, stopReason);
    }

    @Override public String toString() {
        return String.join(" -> ", nodeIds()) + (recursion ? " [recursion]" : "") + (truncated ? " [truncated]" : "");
    }
}

package info.isaksson.erland.sforganalyzer.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"from","to","kind","label"})
public final class GraphEdge {
    public final String from;
    public final String to;
    public final EdgeKind kind;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String label;

    @JsonCreator
    public GraphEdge(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("kind") EdgeKind kind,
            @JsonProperty("label") String label
    ) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label == null || label.isBlank() ? null : label;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphEdge)) return false;
        GraphEdge that = (GraphEdge) o;
        return Objects.equals(from, that.from) &&
                Objects.equals(to, that.to) &&
                kind == that.kind &&
                Objects.equals(label, that.label);
    }

    @Override public int hashCode() {
        return Objects.hash(from, to, kind, label);
    }

    @Override public String toString() {
        return from + " -" + kind.label() + "-> " + to;
    }
}

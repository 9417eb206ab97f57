package info.isaksson.erland.sforganalyzer.diagram;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"from","to","label"})
public final class DiagramEdge {
    public final String from;
    public final String to;

    /** Trigger context, DML operation or condition text; null when the edge is unlabeled. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String label;

    @JsonCreator
    public DiagramEdge(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("label") String label
    ) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.label = label == null || label.isBlank() ? null : label;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagramEdge)) return false;
        DiagramEdge that = (DiagramEdge) o;
        return from.equals(that.from) && to.equals(that.to) && Objects.equals(label, that.label);
    }

    @Override public int hashCode() {
        return Objects.hash(from, to, label);
    }

    @Override public String toString() {
        return from + " -> " + to + (label == null ? "" : " [" + label + "]");
    }
}

package info.isaksson.erland.sforganalyzer.diagram;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A node declaration for a diagram renderer. {@code id} is the execution graph node id. */
@JsonPropertyOrder({"id","label","styleClass"})
public final class DiagramNode {
    public final String id;
    public final String label;
    public final String styleClass;

    @JsonCreator
    public DiagramNode(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("styleClass") String styleClass
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = label == null ? id : label;
        this.styleClass = styleClass == null ? "" : styleClass;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagramNode)) return false;
        DiagramNode that = (DiagramNode) o;
        return id.equals(that.id) && label.equals(that.label) && styleClass.equals(that.styleClass);
    }

    @Override public int hashCode() {
        return Objects.hash(id, label, styleClass);
    }

    @Override public String toString() {
        return id + "[" + label + "]";
    }
}

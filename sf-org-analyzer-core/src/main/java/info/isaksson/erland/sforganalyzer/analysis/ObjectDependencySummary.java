package info.isaksson.erland.sforganalyzer.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** For one object with entry points: the other objects its automation touches, transitively, sorted. */
@JsonPropertyOrder({"object","entryPoints","touchedObjects"})
public final class ObjectDependencySummary {
    public final String object;
    public final List<String> entryPoints;
    public final List<String> touchedObjects;

    @JsonCreator
    public ObjectDependencySummary(
            @JsonProperty("object") String object,
            @JsonProperty("entryPoints") List<String> entryPoints,
            @JsonProperty("touchedObjects") List<String> touchedObjects
    ) {
        this.object = object;
        this.entryPoints = entryPoints == null ? List.of() : List.copyOf(entryPoints);
        this.touchedObjects = touchedObjects == null ? List.of() : List.copyOf(touchedObjects);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectDependencySummary)) return false;
        ObjectDependencySummary that = (ObjectDependencySummary) o;
        return Objects.equals(object, that.object) &&
                Objects.equals(entryPoints, that.entryPoints) &&
                Objects.equals(touchedObjects, that.touchedObjects);
    }

    @Override public int hashCode() {
        return Objects.hash(object, entryPoints, touchedObjects);
    }
}

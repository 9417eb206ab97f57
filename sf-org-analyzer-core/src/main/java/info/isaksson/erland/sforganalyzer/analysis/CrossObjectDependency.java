package info.isaksson.erland.sforganalyzer.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.sforganalyzer.graph.EdgeKind;

import java.util.Objects;

/** Automation starting on {@code sourceObject} reads or writes {@code targetObject} through {@code viaNodeId}. */
@JsonPropertyOrder({"entryId","sourceObject","targetObject","viaNodeId","kind"})
public final class CrossObjectDependency {
    public final String entryId;
    public final String sourceObject;
    public final String targetObject;
    public final String viaNodeId;
    public final EdgeKind kind;

    @JsonCreator
    public CrossObjectDependency(
            @JsonProperty("entryId") String entryId,
            @JsonProperty("sourceObject") String sourceObject,
            @JsonProperty("targetObject") String targetObject,
            @JsonProperty("viaNodeId") String viaNodeId,
            @JsonProperty("kind") EdgeKind kind
    ) {
        this.entryId = entryId;
        this.sourceObject = sourceObject;
        this.targetObject = targetObject;
        this.viaNodeId = viaNodeId;
        this.kind = kind;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CrossObjectDependency)) return false;
        CrossObjectDependency that = (CrossObjectDependency) o;
        return Objects.equals(entryId, that.entryId) &&
                Objects.equals(sourceObject, that.sourceObject) &&
                Objects.equals(targetObject, that.targetObject) &&
                Objects.equals(viaNodeId, that.viaNodeId) &&
                kind == that.kind;
    }

    @Override public int hashCode() {
        return Objects.hash(entryId, sourceObject, targetObject, viaNodeId, kind);
    }

    @Override public String toString() {
        return sourceObject + " -> " + targetObject + " via " + viaNodeId;
    }
}

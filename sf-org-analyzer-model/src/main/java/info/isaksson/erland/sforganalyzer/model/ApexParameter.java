package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"name","type","collectionKind","elementType"})
public final class ApexParameter {
    public final String name;
    public final String type;
    public final CollectionKind collectionKind;
    public final String elementType;

    @JsonCreator
    public ApexParameter(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("collectionKind") CollectionKind collectionKind,
            @JsonProperty("elementType") String elementType
    ) {
        this.name = name == null ? "" : name;
        this.type = type == null ? "" : type;
        this.collectionKind = collectionKind == null ? CollectionTypes.kindOf(this.type) : collectionKind;
        this.elementType = elementType == null ? CollectionTypes.elementType(this.type) : elementType;
    }

    /** Derive collection kind and element type from the declared type. */
    public static ApexParameter of(String name, String type) {
        return new ApexParameter(name, type, null, null);
    }

    public boolean isCollection() {
        return collectionKind.isCollection();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApexParameter)) return false;
        ApexParameter that = (ApexParameter) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                collectionKind == that.collectionKind &&
                Objects.equals(elementType, that.elementType);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, collectionKind, elementType);
    }

    @Override public String toString() {
        return type + " " + name;
    }
}

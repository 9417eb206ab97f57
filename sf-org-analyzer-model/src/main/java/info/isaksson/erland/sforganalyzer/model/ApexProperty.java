package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A field or an accessor property of an Apex class.
 *
 * <p>{@code accessor} is true for {@code { get; set; }} style declarations; plain fields have neither
 * getter nor setter.</p>
 */
@JsonPropertyOrder({"name","type","modifiers","annotations","accessor","hasGetter","hasSetter","line"})
public final class ApexProperty {
    public final String name;
    public final String type;
    public final List<String> modifiers;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<ApexAnnotation> annotations;

    public final boolean accessor;
    public final boolean hasGetter;
    public final boolean hasSetter;
    public final int line;

    @JsonCreator
    public ApexProperty(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("modifiers") List<String> modifiers,
            @JsonProperty("annotations") List<ApexAnnotation> annotations,
            @JsonProperty("accessor") boolean accessor,
            @JsonProperty("hasGetter") boolean hasGetter,
            @JsonProperty("hasSetter") boolean hasSetter,
            @JsonProperty("line") int line
    ) {
        this.name = name == null ? "" : name;
        this.type = type == null ? "" : type;
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
        this.accessor = accessor;
        this.hasGetter = hasGetter;
        this.hasSetter = hasSetter;
        this.line = line;
    }

    public boolean isStatic() {
        return modifiers.stream().anyMatch(m -> m.toLowerCase(Locale.ROOT).equals("static"));
    }

    public ApexVisibility visibility() {
        return ApexVisibility.fromModifiers(modifiers);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApexProperty)) return false;
        ApexProperty that = (ApexProperty) o;
        return accessor == that.accessor &&
                hasGetter == that.hasGetter &&
                hasSetter == that.hasSetter &&
                line == that.line &&
                Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                Objects.equals(modifiers, that.modifiers) &&
                Objects.equals(annotations, that.annotations);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, modifiers, annotations, accessor, hasGetter, hasSetter, line);
    }
}

package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An Apex annotation such as {@code @AuraEnabled(cacheable=true)}.
 *
 * <p>Parameters keep source order. Lookups by key are case-insensitive, as is Apex.</p>
 */
@JsonPropertyOrder({"name","parameters"})
public final class ApexAnnotation {
    public final String name;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<AnnotationParameter> parameters;

    @JsonCreator
    public ApexAnnotation(
            @JsonProperty("name") String name,
            @JsonProperty("parameters") List<AnnotationParameter> parameters
    ) {
        this.name = name == null ? "" : name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static ApexAnnotation marker(String name) {
        return new ApexAnnotation(name, List.of());
    }

    public boolean isNamed(String other) {
        return other != null && name.equalsIgnoreCase(other);
    }

    public Optional<String> parameter(String key) {
        for (AnnotationParameter p : parameters) {
            if (p.key.equalsIgnoreCase(key)) return Optional.of(p.value);
        }
        return Optional.empty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApexAnnotation)) return false;
        ApexAnnotation that = (ApexAnnotation) o;
        return Objects.equals(name, that.name) && Objects.equals(parameters, that.parameters);
    }

    @Override public int hashCode() {
        return Objects.hash(name, parameters);
    }
}

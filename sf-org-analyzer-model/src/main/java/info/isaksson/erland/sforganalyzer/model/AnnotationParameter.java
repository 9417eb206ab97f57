package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A single key/value annotation argument. A bare positional argument uses the key {@code value}. */
@JsonPropertyOrder({"key","value"})
public final class AnnotationParameter {
    public final String key;
    public final String value;

    @JsonCreator
    public AnnotationParameter(
            @JsonProperty("key") String key,
            @JsonProperty("value") String value
    ) {
        this.key = key == null || key.isBlank() ? "value" : key;
        this.value = value == null ? "" : value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnnotationParameter)) return false;
        AnnotationParameter that = (AnnotationParameter) o;
        return Objects.equals(key, that.key) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override public String toString() {
        return key + "=" + value;
    }
}

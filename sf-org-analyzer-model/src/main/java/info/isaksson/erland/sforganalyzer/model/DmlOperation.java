package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A DML statement found in a method body.
 *
 * <p>{@code targetObject} is the SObject type inferred from the operand's declared type, or
 * {@value #UNKNOWN_OBJECT} when no declaration was visible. {@code bulk} is true when the operand is a
 * collection.</p>
 */
@JsonPropertyOrder({"kind","targetObject","operand","bulk","viaDatabaseClass","line","column"})
public final class DmlOperation {
    public static final String UNKNOWN_OBJECT = "Unknown";

    public final DmlKind kind;
    public final String targetObject;
    public final String operand;
    public final boolean bulk;
    public final boolean viaDatabaseClass;
    public final int line;

    /** 1-based column of the DML keyword or of {@code Database}; 0 when unknown. */
    public final int column;

    @JsonCreator
    public DmlOperation(
            @JsonProperty("kind") DmlKind kind,
            @JsonProperty("targetObject") String targetObject,
            @JsonProperty("operand") String operand,
            @JsonProperty("bulk") boolean bulk,
            @JsonProperty("viaDatabaseClass") boolean viaDatabaseClass,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column
    ) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.targetObject = targetObject == null || targetObject.isBlank() ? UNKNOWN_OBJECT : targetObject;
        this.operand = operand == null ? "" : operand;
        this.bulk = bulk;
        this.viaDatabaseClass = viaDatabaseClass;
        this.line = line;
        this.column = column;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DmlOperation)) return false;
        DmlOperation that = (DmlOperation) o;
        return bulk == that.bulk &&
                viaDatabaseClass == that.viaDatabaseClass &&
                line == that.line &&
                column == that.column &&
                kind == that.kind &&
                Objects.equals(targetObject, that.targetObject) &&
                Objects.equals(operand, that.operand);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, targetObject, operand, bulk, viaDatabaseClass, line, column);
    }

    @Override public String toString() {
        return kind.keyword() + " " + targetObject + (bulk ? " (bulk)" : "") + " @" + line;
    }
}

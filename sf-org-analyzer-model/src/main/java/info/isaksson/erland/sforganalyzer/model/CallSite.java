package info.isaksson.erland.sforganalyzer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A method call found in a body.
 *
 * <p>{@code qualifier} is the raw text before the dot ({@code svc} in {@code svc.run()}), empty for
 * unqualified calls. {@code resolvedClass} is set when the parser could tie the call to a declared type.</p>
 */
@JsonPropertyOrder({"calleeName","qualifier","resolvedClass","line","column"})
public final class CallSite {
    public final String calleeName;
    public final String qualifier;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String resolvedClass;

    public final int line;

    /** 1-based column of the callee name; 0 when unknown. */
    public final int column;

    @JsonCreator
    public CallSite(
            @JsonProperty("calleeName") String calleeName,
            @JsonProperty("qualifier") String qualifier,
            @JsonProperty("resolvedClass") String resolvedClass,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column
    ) {
        this.calleeName = calleeName == null ? "" : calleeName;
        this.qualifier = qualifier == null ? "" : qualifier;
        this.resolvedClass = resolvedClass == null || resolvedClass.isBlank() ? null : resolvedClass;
        this.line = line;
        this.column = column;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallSite)) return false;
        CallSite that = (CallSite) o;
        return line == that.line &&
                column == that.column &&
                Objects.equals(calleeName, that.calleeName) &&
                Objects.equals(qualifier, that.qualifier) &&
                Objects.equals(resolvedClass, that.resolvedClass);
    }

    @Override public int hashCode() {
        return Objects.hash(calleeName, qualifier, resolvedClass, line, column);
    }

    @Override public String toString() {
        String target = resolvedClass != null ? resolvedClass + "." : (qualifier.isEmpty() ? "" : qualifier + ".");
        return target + calleeName + "() @" + line;
    }
}

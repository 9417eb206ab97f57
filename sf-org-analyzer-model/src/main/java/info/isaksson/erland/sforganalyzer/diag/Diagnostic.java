package info.isaksson.erland.sforganalyzer.diag;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/** A non-fatal issue found while parsing or normalizing. Line 0 means "no specific line". */
@JsonPropertyOrder({"kind","file","line","message"})
public final class Diagnostic {

    /** File, then line, then kind, then message. */
    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing((Diagnostic d) -> d.file)
            .thenComparingInt(d -> d.line)
            .thenComparing(d -> d.kind)
            .thenComparing(d -> d.message);

    public final DiagnosticKind kind;
    public final String file;
    public final int line;
    public final String message;

    @JsonCreator
    public Diagnostic(
            @JsonProperty("kind") DiagnosticKind kind,
            @JsonProperty("file") String file,
            @JsonProperty("line") int line,
            @JsonProperty("message") String message
    ) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.file = file == null ? "" : file;
        this.line = Math.max(0, line);
        this.message = message == null ? "" : message;
    }

    public static Diagnostic parseError(String file, int line, String message) {
        return new Diagnostic(DiagnosticKind.PARSE_ERROR, file, line, message);
    }

    public static Diagnostic unresolved(String file, int line, String message) {
        return new Diagnostic(DiagnosticKind.UNRESOLVED_REFERENCE, file, line, message);
    }

    public static Diagnostic duplicate(String file, int line, String message) {
        return new Diagnostic(DiagnosticKind.DUPLICATE_DEFINITION, file, line, message);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return line == that.line &&
                kind == that.kind &&
                Objects.equals(file, that.file) &&
                Objects.equals(message, that.message);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, file, line, message);
    }

    @Override public String toString() {
        String where = file.isEmpty() ? "" : file + (line > 0 ? ":" + line : "") + ": ";
        return where + kind + " " + message;
    }
}

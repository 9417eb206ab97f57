package info.isaksson.erland.sforganalyzer.apex;

/**
 * Raised inside the parser for malformed input. Always caught at a type or member boundary and turned
 * into a diagnostic; it never leaves {@link ApexParser}.
 */
public class ApexSyntaxException extends RuntimeException {
    private final int line;

    public ApexSyntaxException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}

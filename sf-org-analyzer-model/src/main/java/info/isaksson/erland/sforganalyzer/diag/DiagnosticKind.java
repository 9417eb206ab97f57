package info.isaksson.erland.sforganalyzer.diag;

public enum DiagnosticKind {
    /** Malformed or unsupported Apex construct; the file still yields a partial model. */
    PARSE_ERROR,
    /** A trigger handler or automation action names something that is not in the model. */
    UNRESOLVED_REFERENCE,
    /** Two declarations claim the same name or node identifier; the first one wins. */
    DUPLICATE_DEFINITION
}

package info.isaksson.erland.sforganalyzer.graph;

/** What an {@link ActionRef} points at. */
public enum ActionKind {
    /** Another automation (flow, process, workflow rule). */
    FIRE,
    /** An Apex method. */
    INVOKE,
    DML,
    SOQL,
    /** Description only, no target; e.g. a field update or an email alert. */
    NOTE
}

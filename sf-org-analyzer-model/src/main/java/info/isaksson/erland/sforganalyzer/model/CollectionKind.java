package info.isaksson.erland.sforganalyzer.model;

/**
 * Collection shape of a declared type.
 *
 * <p>This is a naming heuristic, not type inference: only the spelling of the declared type is inspected.</p>
 */
public enum CollectionKind {
    NONE,
    LIST,
    SET,
    MAP,
    ARRAY;

    public boolean isCollection() {
        return this != NONE;
    }
}

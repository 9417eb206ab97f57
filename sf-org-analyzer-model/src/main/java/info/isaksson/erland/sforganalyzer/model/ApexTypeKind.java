package info.isaksson.erland.sforganalyzer.model;

/** Declaration kinds recognized by the Apex parser. */
public enum ApexTypeKind {
    CLASS,
    INTERFACE,
    ENUM
}

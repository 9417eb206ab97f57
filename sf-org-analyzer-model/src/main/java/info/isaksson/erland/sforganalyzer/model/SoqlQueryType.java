package info.isaksson.erland.sforganalyzer.model;

public enum SoqlQueryType {
    SIMPLE,
    RELATIONSHIP,
    AGGREGATE
}

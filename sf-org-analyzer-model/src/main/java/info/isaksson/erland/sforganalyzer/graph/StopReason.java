package info.isaksson.erland.sforganalyzer.graph;

/** Why traversal along a path stopped. Only {@code LEAF} is a natural end. */
public enum StopReason {
    LEAF,
    CYCLE,
    MAX_DEPTH,
    MAX_ITERATIONS
}

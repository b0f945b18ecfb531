package io.taskgraph.graph;

public enum ErrorKind {
    NOT_FOUND,
    SELF_DEPENDENCY,
    CIRCULAR_DEPENDENCY,
    MALFORMED_RANGE,
    MALFORMED_REFERENCE
}

package io.taskgraph.graph;

/**
 * Rejection of a dependency operation. The {@link ErrorKind} tells callers how to render it.
 */
public final class DependencyException extends RuntimeException {
    private final ErrorKind kind;

    public DependencyException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static DependencyException notFound(String message) {
        return new DependencyException(ErrorKind.NOT_FOUND, message);
    }

    public static DependencyException malformedRange(String message) {
        return new DependencyException(ErrorKind.MALFORMED_RANGE, message);
    }

    public static DependencyException malformedReference(String message) {
        return new DependencyException(ErrorKind.MALFORMED_REFERENCE, message);
    }
}

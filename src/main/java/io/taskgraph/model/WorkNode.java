package io.taskgraph.model;

import java.util.List;

/**
 * Anything that owns a dependency list: a top-level {@link Item} or a {@link Subitem}.
 */
public interface WorkNode {
    Reference ref();

    String title();

    ItemStatus status();

    List<Reference> dependencies();

    WorkNode withDependencies(List<Reference> dependencies);
}

package io.taskgraph.model;

import java.util.List;

public record Subitem(
        int parentId,
        int id,
        String title,
        ItemStatus status,
        List<Reference> dependencies
) implements WorkNode {
    public Subitem {
        title = title == null ? "" : title;
        status = status == null ? ItemStatus.PENDING : status;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    @Override
    public Reference ref() {
        return Reference.subtask(parentId, id);
    }

    @Override
    public Subitem withDependencies(List<Reference> dependencies) {
        return new Subitem(parentId, id, title, status, dependencies);
    }
}

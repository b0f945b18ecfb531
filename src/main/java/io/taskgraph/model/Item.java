package io.taskgraph.model;

import java.util.ArrayList;
import java.util.List;

public record Item(
        int id,
        String title,
        ItemStatus status,
        Priority priority,
        List<Reference> dependencies,
        List<Subitem> subtasks
) implements WorkNode {
    public Item {
        title = title == null ? "" : title;
        status = status == null ? ItemStatus.PENDING : status;
        priority = priority == null ? Priority.MEDIUM : priority;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
        for (Subitem subtask : subtasks) {
            if (subtask.parentId() != id) {
                throw new IllegalArgumentException("Subtask " + subtask.ref() + " does not belong to task " + id);
            }
        }
    }

    @Override
    public Reference ref() {
        return Reference.task(id);
    }

    @Override
    public Item withDependencies(List<Reference> dependencies) {
        return new Item(id, title, status, priority, dependencies, subtasks);
    }

    public Item withSubtask(Subitem replacement) {
        List<Subitem> next = new ArrayList<>(subtasks.size());
        for (Subitem subtask : subtasks) {
            next.add(subtask.id() == replacement.id() ? replacement : subtask);
        }
        return new Item(id, title, status, priority, dependencies, next);
    }
}

package io.taskgraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of every item and subitem fetched from a task store. Lookups by reference
 * go through an index built once at construction; when ids repeat, the first one wins.
 */
public final class Snapshot {
    private final List<Item> items;
    private final Map<Reference, WorkNode> index;

    public Snapshot(List<Item> items) {
        this.items = items == null ? List.of() : List.copyOf(items);
        Map<Reference, WorkNode> byRef = new HashMap<>();
        for (Item item : this.items) {
            byRef.putIfAbsent(item.ref(), item);
            for (Subitem subtask : item.subtasks()) {
                byRef.putIfAbsent(subtask.ref(), subtask);
            }
        }
        this.index = byRef;
    }

    public List<Item> items() {
        return items;
    }

    public static Snapshot empty() {
        return new Snapshot(List.of());
    }

    public Optional<Item> findItem(int id) {
        return Optional.ofNullable((Item) index.get(Reference.task(id)));
    }

    public Optional<Subitem> findSubitem(int parentId, int subId) {
        if (parentId <= 0 || subId <= 0) {
            return Optional.empty();
        }
        return Optional.ofNullable((Subitem) index.get(Reference.subtask(parentId, subId)));
    }

    public Optional<WorkNode> resolve(Reference ref) {
        if (ref == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(index.get(ref));
    }

    /** Items followed by their subtasks, in the order they appear. */
    public List<WorkNode> nodes() {
        List<WorkNode> out = new ArrayList<>();
        for (Item item : items) {
            out.add(item);
            out.addAll(item.subtasks());
        }
        return out;
    }

    public Set<Reference> canonicalIds() {
        Set<Reference> ids = new LinkedHashSet<>();
        for (WorkNode node : nodes()) {
            ids.add(node.ref());
        }
        return Collections.unmodifiableSet(ids);
    }

    public Snapshot withDependencies(Reference owner, List<Reference> dependencies) {
        List<Item> next = new ArrayList<>(items.size());
        boolean found = false;
        for (Item item : items) {
            if (item.id() != owner.taskId()) {
                next.add(item);
                continue;
            }
            if (!owner.isSubtask()) {
                next.add(item.withDependencies(dependencies));
                found = true;
                continue;
            }
            Optional<Subitem> subtask = item.subtasks().stream()
                    .filter(s -> s.id() == owner.subtaskId())
                    .findFirst();
            if (subtask.isPresent()) {
                next.add(item.withSubtask(subtask.get().withDependencies(dependencies)));
                found = true;
            } else {
                next.add(item);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Unknown owner: " + owner);
        }
        return new Snapshot(next);
    }

    public int taskCount() {
        return items.size();
    }

    public int subtaskCount() {
        int count = 0;
        for (Item item : items) {
            count += item.subtasks().size();
        }
        return count;
    }

    public int dependencyCount() {
        int count = 0;
        for (WorkNode node : nodes()) {
            count += node.dependencies().size();
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Snapshot)) {
            return false;
        }
        return items.equals(((Snapshot) o).items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items);
    }

    @Override
    public String toString() {
        return "Snapshot[items=" + items + "]";
    }
}

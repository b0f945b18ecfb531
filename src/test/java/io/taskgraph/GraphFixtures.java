package io.taskgraph;

import io.taskgraph.graph.References;
import io.taskgraph.model.Item;
import io.taskgraph.model.ItemStatus;
import io.taskgraph.model.Priority;
import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;
import io.taskgraph.model.Subitem;

import java.util.ArrayList;
import java.util.List;

/**
 * Short-hand builders for snapshots used across tests. Dependency ids are given in their
 * canonical string form ("3", "3.1").
 */
public final class GraphFixtures {
    private GraphFixtures() {
    }

    public static Reference ref(String id) {
        return References.parseId(id);
    }

    public static List<Reference> refs(String... ids) {
        List<Reference> out = new ArrayList<>(ids.length);
        for (String id : ids) {
            out.add(ref(id));
        }
        return out;
    }

    public static Item item(int id, String... dependencies) {
        return item(id, ItemStatus.PENDING, Priority.MEDIUM, List.of(), dependencies);
    }

    public static Item item(int id, ItemStatus status, String... dependencies) {
        return item(id, status, Priority.MEDIUM, List.of(), dependencies);
    }

    public static Item item(int id, ItemStatus status, Priority priority, String... dependencies) {
        return item(id, status, priority, List.of(), dependencies);
    }

    public static Item item(int id, ItemStatus status, Priority priority, List<Subitem> subtasks, String... dependencies) {
        return new Item(id, "Task " + id, status, priority, refs(dependencies), subtasks);
    }

    public static Item parent(int id, Subitem... subtasks) {
        return new Item(id, "Task " + id, ItemStatus.PENDING, Priority.MEDIUM, List.of(), List.of(subtasks));
    }

    public static Subitem sub(int parentId, int id, String... dependencies) {
        return sub(parentId, id, ItemStatus.PENDING, dependencies);
    }

    public static Subitem sub(int parentId, int id, ItemStatus status, String... dependencies) {
        return new Subitem(parentId, id, "Subtask " + parentId + "." + id, status, refs(dependencies));
    }

    public static Snapshot snapshot(Item... items) {
        return new Snapshot(List.of(items));
    }

    public static List<Reference> dependenciesOf(Snapshot snapshot, String id) {
        return snapshot.resolve(ref(id)).orElseThrow().dependencies();
    }
}

package io.taskgraph.graph;

import io.taskgraph.model.Item;
import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;
import io.taskgraph.model.WorkNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the next top-level item to work on: pending or in progress, every dependency
 * complete, then highest priority, fewest dependencies, lowest id.
 */
public final class ReadinessScheduler {
    private static final Comparator<Item> NEXT_ORDER = Comparator
            .comparingInt((Item item) -> item.priority().rank()).reversed()
            .thenComparingInt(item -> item.dependencies().size())
            .thenComparingInt(Item::id);

    private ReadinessScheduler() {
    }

    public static Optional<Item> findNext(Snapshot snapshot) {
        List<Item> ready = readyItems(snapshot);
        return ready.isEmpty() ? Optional.empty() : Optional.of(ready.get(0));
    }

    public static List<Item> readyItems(Snapshot snapshot) {
        Set<Reference> completed = completedIds(snapshot);
        List<Item> eligible = new ArrayList<>();
        for (Item item : snapshot.items()) {
            if (item.status().isActionable() && completed.containsAll(item.dependencies())) {
                eligible.add(item);
            }
        }
        eligible.sort(NEXT_ORDER);
        return eligible;
    }

    public static Set<Reference> completedIds(Snapshot snapshot) {
        Set<Reference> completed = new HashSet<>();
        for (WorkNode node : snapshot.nodes()) {
            if (node.status().isComplete()) {
                completed.add(node.ref());
            }
        }
        return completed;
    }
}

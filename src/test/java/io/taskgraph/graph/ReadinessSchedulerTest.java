package io.taskgraph.graph;

import io.taskgraph.model.Item;
import io.taskgraph.model.ItemStatus;
import io.taskgraph.model.Priority;
import io.taskgraph.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.taskgraph.GraphFixtures.item;
import static io.taskgraph.GraphFixtures.ref;
import static io.taskgraph.GraphFixtures.snapshot;
import static io.taskgraph.GraphFixtures.sub;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadinessSchedulerTest {
    @Test
    void picksFirstItemWhoseDependenciesAreDone() {
        Snapshot snapshot = snapshot(
                item(1, ItemStatus.DONE),
                item(2, ItemStatus.PENDING, "1"),
                item(3, ItemStatus.PENDING, "2"));

        assertEquals(2, ReadinessScheduler.findNext(snapshot).orElseThrow().id());
    }

    @Test
    void higherPriorityWinsThenFewerDependenciesThenLowerId() {
        Snapshot snapshot = snapshot(
                item(1, ItemStatus.COMPLETED),
                item(2, ItemStatus.PENDING, Priority.LOW),
                item(3, ItemStatus.PENDING, Priority.HIGH, "1"),
                item(4, ItemStatus.IN_PROGRESS, Priority.MEDIUM, "1"),
                item(5, ItemStatus.PENDING, Priority.MEDIUM),
                item(6, ItemStatus.PENDING, Priority.MEDIUM));

        List<Integer> order = ReadinessScheduler.readyItems(snapshot).stream().map(Item::id).toList();

        assertEquals(List.of(3, 5, 6, 4, 2), order);
    }

    @Test
    void completedSubtasksSatisfyDependencies() {
        Snapshot snapshot = snapshot(
                item(1, ItemStatus.PENDING, Priority.MEDIUM, List.of(sub(1, 1, ItemStatus.DONE), sub(1, 2))),
                item(2, ItemStatus.PENDING, Priority.HIGH, "1.1"),
                item(3, ItemStatus.PENDING, Priority.HIGH, "1.2"));

        List<Integer> order = ReadinessScheduler.readyItems(snapshot).stream().map(Item::id).toList();

        assertEquals(List.of(2, 1), order);
        assertTrue(ReadinessScheduler.completedIds(snapshot).contains(ref("1.1")));
    }

    @Test
    void onlyPendingOrInProgressItemsAreEligible() {
        Snapshot snapshot = snapshot(
                item(1, ItemStatus.DONE),
                item(2, ItemStatus.BLOCKED),
                item(3, ItemStatus.DEFERRED),
                item(4, ItemStatus.REVIEW),
                item(5, ItemStatus.CANCELLED));

        assertTrue(ReadinessScheduler.findNext(snapshot).isEmpty());
        assertTrue(ReadinessScheduler.findNext(Snapshot.empty()).isEmpty());
    }

    @Test
    void sameSnapshotGivesSameAnswer() {
        Snapshot snapshot = snapshot(
                item(7, ItemStatus.PENDING, Priority.MEDIUM),
                item(3, ItemStatus.PENDING, Priority.MEDIUM),
                item(5, ItemStatus.PENDING, Priority.MEDIUM));

        assertEquals(3, ReadinessScheduler.findNext(snapshot).orElseThrow().id());
        assertEquals(ReadinessScheduler.readyItems(snapshot), ReadinessScheduler.readyItems(snapshot));
    }
}

package io.taskgraph.graph;

import io.taskgraph.model.Snapshot;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static io.taskgraph.GraphFixtures.dependenciesOf;
import static io.taskgraph.GraphFixtures.item;
import static io.taskgraph.GraphFixtures.parent;
import static io.taskgraph.GraphFixtures.ref;
import static io.taskgraph.GraphFixtures.refs;
import static io.taskgraph.GraphFixtures.snapshot;
import static io.taskgraph.GraphFixtures.sub;

final class DependencyMutatorTest {

    @Test
    void rejectsEdgeThatClosesATransitiveCycle() {
        Snapshot snapshot = snapshot(item(1), item(2, "4"), item(3), item(4, "3"));

        DependencyException e = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.add(snapshot, ref("3"), ref("2")));

        Assertions.assertEquals(ErrorKind.CIRCULAR_DEPENDENCY, e.kind());
    }

    @Test
    void appendsAndSortsTheNewDependency() {
        Snapshot snapshot = snapshot(parent(1, sub(1, 1)), item(2), item(3), item(4, "3", "1.1"));

        DependencyMutator.MutationResult result = DependencyMutator.add(snapshot, ref("4"), ref("2"));

        Assertions.assertEquals(DependencyMutator.Outcome.APPLIED, result.outcome());
        Assertions.assertEquals(refs("2", "3", "1.1"), result.dependencies());
        Assertions.assertEquals(refs("2", "3", "1.1"), dependenciesOf(result.applyTo(snapshot), "4"));
        Assertions.assertEquals(refs("3", "1.1"), dependenciesOf(snapshot, "4"));
    }

    @Test
    void existingDependencyIsANoOp() {
        Snapshot snapshot = snapshot(item(1), item(2, "1"));

        DependencyMutator.MutationResult result = DependencyMutator.add(snapshot, ref("2"), ref("1"));

        Assertions.assertEquals(DependencyMutator.Outcome.ALREADY_PRESENT, result.outcome());
        Assertions.assertFalse(result.outcome().changed());
        Assertions.assertSame(snapshot, result.applyTo(snapshot));
    }

    @Test
    void rejectsSelfDependency() {
        Snapshot snapshot = snapshot(parent(1, sub(1, 1), sub(1, 2)));

        DependencyException task = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.add(snapshot, ref("1"), ref("1")));
        DependencyException subtask = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.add(snapshot, ref("1.2"), ref("1.2")));

        Assertions.assertEquals(ErrorKind.SELF_DEPENDENCY, task.kind());
        Assertions.assertEquals(ErrorKind.SELF_DEPENDENCY, subtask.kind());
    }

    @Test
    void unknownOwnerOrTargetIsNotFound() {
        Snapshot snapshot = snapshot(item(1), parent(2, sub(2, 1)));

        DependencyException owner = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.add(snapshot, ref("7"), ref("1")));
        DependencyException parentMissing = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.add(snapshot, ref("7.1"), ref("1")));
        DependencyException target = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.add(snapshot, ref("2.1"), ref("2.5")));

        Assertions.assertEquals(ErrorKind.NOT_FOUND, owner.kind());
        Assertions.assertEquals(ErrorKind.NOT_FOUND, parentMissing.kind());
        Assertions.assertTrue(parentMissing.getMessage().contains("Parent task 7"));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, target.kind());
    }

    @Test
    void subtaskMayDependOnTaskOutsideItsParent() {
        Snapshot snapshot = snapshot(item(1), parent(2, sub(2, 1), sub(2, 2, "2.1")));

        DependencyMutator.MutationResult result = DependencyMutator.add(snapshot, ref("2.2"), ref("1"));

        Assertions.assertEquals(refs("1", "2.1"), result.dependencies());
    }

    @Test
    void removeDropsOnlyTheNamedDependency() {
        Snapshot snapshot = snapshot(item(1), item(2), item(3, "1", "2"));

        DependencyMutator.MutationResult removed = DependencyMutator.remove(snapshot, ref("3"), ref("1"));
        DependencyMutator.MutationResult absent = DependencyMutator.remove(removed.applyTo(snapshot), ref("3"), ref("1"));

        Assertions.assertEquals(DependencyMutator.Outcome.APPLIED, removed.outcome());
        Assertions.assertEquals(refs("2"), removed.dependencies());
        Assertions.assertEquals(DependencyMutator.Outcome.NOT_PRESENT, absent.outcome());
        Assertions.assertEquals(refs("2"), absent.dependencies());
    }

    @Test
    void removeFromUnknownOwnerIsNotFound() {
        Snapshot snapshot = snapshot(item(1));

        DependencyException e = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.remove(snapshot, ref("4"), ref("1")));

        Assertions.assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void messagesNameSubtaskOwnersAsSubtasks() {
        Snapshot snapshot = snapshot(parent(2, sub(2, 1), sub(2, 2), sub(2, 3, "2.1")));

        Assertions.assertEquals("Subtask 2.1 now depends on 2.2",
                DependencyMutator.add(snapshot, ref("2.1"), ref("2.2")).message());
        Assertions.assertEquals("Subtask 2.3 no longer depends on 2.1",
                DependencyMutator.remove(snapshot, ref("2.3"), ref("2.1")).message());
        DependencyException self = Assertions.assertThrows(DependencyException.class,
                () -> DependencyMutator.add(snapshot, ref("2.1"), ref("2.1")));
        Assertions.assertEquals("Subtask 2.1 cannot depend on itself", self.getMessage());
    }
}

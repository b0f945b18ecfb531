package io.taskgraph.graph;

import io.taskgraph.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.taskgraph.GraphFixtures.dependenciesOf;
import static io.taskgraph.GraphFixtures.item;
import static io.taskgraph.GraphFixtures.ref;
import static io.taskgraph.GraphFixtures.refs;
import static io.taskgraph.GraphFixtures.snapshot;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulkRangeOperatorTest {
    @Test
    void missingDependencyFailsEveryPairWithoutAbortingTheBatch() {
        Snapshot snapshot = snapshot(item(1), item(2), item(3));

        BulkRangeOperator.BulkResult result = BulkRangeOperator.add(snapshot, "1,2", "9", false);

        assertEquals(2, result.summary().errors());
        assertEquals(0, result.summary().operationsPerformed());
        assertEquals(0, result.summary().validOperations());
        assertEquals(2, result.operations().size());
        for (BulkRangeOperator.PairResult pair : result.operations()) {
            assertEquals(BulkRangeOperator.PairOutcome.ERROR, pair.outcome());
            assertEquals(ErrorKind.NOT_FOUND, pair.errorKind());
        }
        assertTrue(result.updatedDependencies().isEmpty());
    }

    @Test
    void appliesCrossProductInOrder() {
        Snapshot snapshot = snapshot(item(1), item(2), item(3), item(4), item(5, "2"));

        BulkRangeOperator.BulkResult result = BulkRangeOperator.add(snapshot, "4-5", "1-2", false);

        assertEquals(
                List.of(ref("4"), ref("4"), ref("5"), ref("5")),
                result.operations().stream().map(BulkRangeOperator.PairResult::task).toList());
        assertEquals(3, result.summary().validOperations());
        assertEquals(3, result.summary().operationsPerformed());
        assertEquals(1, result.summary().skipped());
        assertEquals(List.of(ref("4"), ref("5")), List.copyOf(result.updatedDependencies().keySet()));
        assertEquals(refs("1", "2"), result.updatedDependencies().get(ref("4")));
        assertEquals(refs("1", "2"), dependenciesOf(result.result(), "5"));
    }

    @Test
    void dryRunClassifiesWithoutCountingPerformedOperations() {
        Snapshot snapshot = snapshot(item(1), item(2), item(3));

        BulkRangeOperator.BulkResult result = BulkRangeOperator.add(snapshot, "2-3", "1", true);

        assertTrue(result.dryRun());
        assertEquals(2, result.summary().validOperations());
        assertEquals(0, result.summary().operationsPerformed());
        assertTrue(dependenciesOf(snapshot, "2").isEmpty());
    }

    @Test
    void batchCannotBuildACycleOutOfIndividuallyValidPairs() {
        Snapshot snapshot = snapshot(item(1), item(2));

        BulkRangeOperator.BulkResult result = BulkRangeOperator.add(snapshot, "1,2", "2,1", false);

        List<BulkRangeOperator.PairResult> ops = result.operations();
        assertEquals(BulkRangeOperator.PairOutcome.APPLIED, ops.get(0).outcome());
        assertEquals(ErrorKind.SELF_DEPENDENCY, ops.get(1).errorKind());
        assertEquals(ErrorKind.SELF_DEPENDENCY, ops.get(2).errorKind());
        assertEquals(ErrorKind.CIRCULAR_DEPENDENCY, ops.get(3).errorKind());
        assertEquals(1, result.summary().validOperations());
        assertEquals(3, result.summary().errors());
        assertTrue(GraphValidator.validate(result.result()).valid());
    }

    @Test
    void removeRangeSkipsAbsentPairs() {
        Snapshot snapshot = snapshot(item(1), item(2), item(3, "1", "2"), item(4, "2"));

        BulkRangeOperator.BulkResult result = BulkRangeOperator.remove(snapshot, "3-4", "1-2", false);

        assertEquals(3, result.summary().validOperations());
        assertEquals(1, result.summary().skipped());
        assertEquals(0, result.summary().errors());
        assertTrue(result.updatedDependencies().get(ref("3")).isEmpty());
        assertTrue(dependenciesOf(result.result(), "4").isEmpty());
    }

    @Test
    void malformedRangeRejectsTheWholeBatch() {
        Snapshot snapshot = snapshot(item(1), item(2));

        DependencyException e = assertThrows(DependencyException.class,
                () -> BulkRangeOperator.add(snapshot, "2-1", "1", false));

        assertEquals(ErrorKind.MALFORMED_RANGE, e.kind());
    }
}

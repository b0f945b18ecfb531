package io.taskgraph.graph;

import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the cross product of two range expressions through {@link DependencyMutator}.
 * Every pair is attempted; a rejected pair is recorded and the batch continues.
 */
public final class BulkRangeOperator {
    private BulkRangeOperator() {
    }

    public static BulkResult add(Snapshot snapshot, String taskSpec, String dependencySpec, boolean dryRun) {
        return run(Mode.ADD, snapshot, taskSpec, dependencySpec, dryRun);
    }

    public static BulkResult remove(Snapshot snapshot, String taskSpec, String dependencySpec, boolean dryRun) {
        return run(Mode.REMOVE, snapshot, taskSpec, dependencySpec, dryRun);
    }

    public static BulkResult run(Mode mode, Snapshot snapshot, String taskSpec, String dependencySpec, boolean dryRun) {
        List<Reference> taskIds = RangeSpec.parse(taskSpec);
        List<Reference> dependencyIds = RangeSpec.parse(dependencySpec);

        Snapshot working = snapshot;
        List<PairResult> operations = new ArrayList<>(taskIds.size() * dependencyIds.size());
        Map<Reference, List<Reference>> updated = new LinkedHashMap<>();
        int applied = 0;
        int skipped = 0;
        int errors = 0;
        for (Reference task : taskIds) {
            for (Reference dependency : dependencyIds) {
                try {
                    DependencyMutator.MutationResult result = mode == Mode.ADD
                            ? DependencyMutator.add(working, task, dependency)
                            : DependencyMutator.remove(working, task, dependency);
                    if (result.outcome().changed()) {
                        working = result.applyTo(working);
                        updated.put(task, result.dependencies());
                        applied++;
                        operations.add(new PairResult(task, dependency, PairOutcome.APPLIED, null, result.message()));
                    } else {
                        skipped++;
                        operations.add(new PairResult(task, dependency, PairOutcome.SKIPPED_NO_OP, null, result.message()));
                    }
                } catch (DependencyException e) {
                    errors++;
                    operations.add(new PairResult(task, dependency, PairOutcome.ERROR, e.kind(), e.getMessage()));
                }
            }
        }
        Summary summary = new Summary(applied, dryRun ? 0 : applied, skipped, errors);
        return new BulkResult(mode, dryRun, summary, operations, updated, working);
    }

    public enum Mode {
        ADD,
        REMOVE
    }

    public enum PairOutcome {
        APPLIED,
        SKIPPED_NO_OP,
        ERROR
    }

    public record PairResult(
            Reference task,
            Reference dependency,
            PairOutcome outcome,
            ErrorKind errorKind,
            String message
    ) {
    }

    /**
     * @param validOperations     pairs that pass every check
     * @param operationsPerformed pairs whose change is meant to be persisted; zero for a dry run
     */
    public record Summary(int validOperations, int operationsPerformed, int skipped, int errors) {
    }

    /**
     * @param updatedDependencies final dependency list of every owner the batch changed,
     *                            in the order the owners were first changed
     * @param result              snapshot with every applied pair
     */
    public record BulkResult(
            Mode mode,
            boolean dryRun,
            Summary summary,
            List<PairResult> operations,
            Map<Reference, List<Reference>> updatedDependencies,
            Snapshot result
    ) {
        public BulkResult {
            operations = List.copyOf(operations);
            updatedDependencies = Collections.unmodifiableMap(new LinkedHashMap<>(updatedDependencies));
        }
    }
}

package io.taskgraph.graph;

import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;
import io.taskgraph.model.WorkNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Existence, self-dependency and cycle checks over a snapshot.
 */
public final class GraphValidator {
    private GraphValidator() {
    }

    public static boolean exists(Snapshot snapshot, Reference ref) {
        return snapshot.resolve(ref).isPresent();
    }

    public static boolean exists(Set<Reference> canonicalIds, Reference ref) {
        return ref != null && canonicalIds.contains(ref);
    }

    public static boolean isSelfDependency(Reference owner, Reference ref) {
        return References.sameTarget(owner, ref);
    }

    public static boolean detectCycle(Snapshot snapshot, Reference start) {
        return detectCycle(snapshot, start, List.of());
    }

    /**
     * Walks dependency edges depth-first from {@code start}. Returns true as soon as the walk
     * reaches an id already on the current chain. Seeding {@code extraChain} with the source
     * of a prospective edge answers whether adding that edge would close a cycle.
     */
    public static boolean detectCycle(Snapshot snapshot, Reference start, List<Reference> extraChain) {
        List<Reference> chain = extraChain == null ? List.of() : List.copyOf(extraChain);
        return walk(snapshot, start, chain, new HashSet<>());
    }

    private static boolean walk(Snapshot snapshot, Reference current, List<Reference> chain, Set<Reference> cleared) {
        if (chain.contains(current)) {
            return true;
        }
        if (cleared.contains(current)) {
            return false;
        }
        Optional<WorkNode> node = snapshot.resolve(current);
        if (node.isEmpty() || node.get().dependencies().isEmpty()) {
            cleared.add(current);
            return false;
        }
        List<Reference> nextChain = new ArrayList<>(chain.size() + 1);
        nextChain.addAll(chain);
        nextChain.add(current);
        for (Reference dependency : node.get().dependencies()) {
            // self-loops are reported by the self check
            if (dependency.equals(current)) {
                continue;
            }
            if (walk(snapshot, dependency, nextChain, cleared)) {
                return true;
            }
        }
        cleared.add(current);
        return false;
    }

    public static List<Issue> validateAll(Snapshot snapshot) {
        Set<Reference> ids = snapshot.canonicalIds();
        List<Issue> issues = new ArrayList<>();
        for (WorkNode node : snapshot.nodes()) {
            Reference owner = node.ref();
            String label = owner.isSubtask() ? "Subtask " + owner : "Task " + owner;
            for (Reference dependency : node.dependencies()) {
                if (isSelfDependency(owner, dependency)) {
                    issues.add(new Issue(IssueType.SELF, owner, dependency, label + " depends on itself"));
                } else if (!exists(ids, dependency)) {
                    issues.add(new Issue(IssueType.MISSING, owner, dependency,
                            label + " depends on non-existent " + (dependency.isSubtask() ? "subtask " : "task ") + dependency));
                }
            }
            if (!node.dependencies().isEmpty() && detectCycle(snapshot, owner)) {
                issues.add(new Issue(IssueType.CIRCULAR, owner, null, label + " is part of a circular dependency chain"));
            }
        }
        return issues;
    }

    public static ValidationReport validate(Snapshot snapshot) {
        List<Issue> issues = validateAll(snapshot);
        return new ValidationReport(
                issues.isEmpty(),
                issues,
                snapshot.taskCount(),
                snapshot.subtaskCount(),
                snapshot.dependencyCount()
        );
    }

    public enum IssueType {
        SELF,
        MISSING,
        CIRCULAR
    }

    /**
     * @param dependency offending reference, {@code null} for {@link IssueType#CIRCULAR}
     */
    public record Issue(IssueType type, Reference owner, Reference dependency, String message) {
    }

    public record ValidationReport(
            boolean valid,
            List<Issue> issues,
            int tasksChecked,
            int subtasksChecked,
            int dependenciesVerified
    ) {
    }
}

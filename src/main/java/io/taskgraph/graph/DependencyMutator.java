package io.taskgraph.graph;

import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;
import io.taskgraph.model.WorkNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Single dependency add/remove with precondition checks. Returns the owner's new dependency
 * list; persisting it is the caller's job.
 */
public final class DependencyMutator {
    private DependencyMutator() {
    }

    public static MutationResult add(Snapshot snapshot, Reference owner, Reference target) {
        WorkNode node = resolveOwner(snapshot, owner);
        if (!GraphValidator.exists(snapshot, target)) {
            throw DependencyException.notFound("Dependency target " + target + " does not exist");
        }
        List<Reference> current = node.dependencies();
        if (current.contains(target)) {
            return new MutationResult(owner, target, Outcome.ALREADY_PRESENT, current,
                    "Dependency " + target + " already exists in " + label(owner).toLowerCase(Locale.ROOT));
        }
        if (GraphValidator.isSelfDependency(owner, target)) {
            throw new DependencyException(ErrorKind.SELF_DEPENDENCY, label(owner) + " cannot depend on itself");
        }
        if (GraphValidator.detectCycle(snapshot, target, List.of(owner))) {
            throw new DependencyException(ErrorKind.CIRCULAR_DEPENDENCY,
                    "Cannot add dependency " + target + " to " + label(owner).toLowerCase(Locale.ROOT) + " as it would create a circular dependency");
        }
        List<Reference> next = new ArrayList<>(current);
        next.add(target);
        return new MutationResult(owner, target, Outcome.APPLIED, References.sorted(next),
                label(owner) + " now depends on " + target);
    }

    public static MutationResult remove(Snapshot snapshot, Reference owner, Reference target) {
        WorkNode node = resolveOwner(snapshot, owner);
        List<Reference> next = new ArrayList<>(node.dependencies());
        if (!next.remove(target)) {
            String message = next.isEmpty()
                    ? label(owner) + " has no dependencies"
                    : label(owner) + " does not depend on " + target;
            return new MutationResult(owner, target, Outcome.NOT_PRESENT, node.dependencies(), message);
        }
        return new MutationResult(owner, target, Outcome.APPLIED, List.copyOf(next),
                label(owner) + " no longer depends on " + target);
    }

    private static WorkNode resolveOwner(Snapshot snapshot, Reference owner) {
        Optional<WorkNode> node = snapshot.resolve(owner);
        if (node.isPresent()) {
            return node.get();
        }
        if (owner.isSubtask() && snapshot.findItem(owner.taskId()).isEmpty()) {
            throw DependencyException.notFound("Parent task " + owner.taskId() + " not found");
        }
        throw DependencyException.notFound(label(owner) + " not found");
    }

    private static String label(Reference ref) {
        return (ref.isSubtask() ? "Subtask " : "Task ") + ref;
    }

    public enum Outcome {
        APPLIED,
        ALREADY_PRESENT,
        NOT_PRESENT;

        public boolean changed() {
            return this == APPLIED;
        }
    }

    public record MutationResult(
            Reference owner,
            Reference target,
            Outcome outcome,
            List<Reference> dependencies,
            String message
    ) {
        public MutationResult {
            dependencies = List.copyOf(dependencies);
        }

        public Snapshot applyTo(Snapshot snapshot) {
            return outcome.changed() ? snapshot.withDependencies(owner, dependencies) : snapshot;
        }
    }
}

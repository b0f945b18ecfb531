package io.taskgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * Canonical address of a dependency target or owner.
 *
 * <p>A task reference has {@code subtaskId == 0} and renders as {@code "7"}; a subtask
 * reference renders as {@code "7.2"}. Two references denote the same target exactly when
 * they are equal.
 */
public record Reference(int taskId, int subtaskId) implements Comparable<Reference> {
    private static final Comparator<Reference> ORDER = Comparator
            .comparing(Reference::isSubtask)
            .thenComparingInt(Reference::taskId)
            .thenComparingInt(Reference::subtaskId);

    public Reference {
        if (subtaskId < 0) {
            throw new IllegalArgumentException("Subtask id cannot be negative: " + subtaskId);
        }
    }

    public static Reference task(int taskId) {
        return new Reference(taskId, 0);
    }

    public static Reference subtask(int parentId, int subtaskId) {
        if (subtaskId <= 0) {
            throw new IllegalArgumentException("Subtask id must be positive: " + parentId + "." + subtaskId);
        }
        return new Reference(parentId, subtaskId);
    }

    public boolean isSubtask() {
        return subtaskId != 0;
    }

    /** Parent task of a subtask reference, or the task itself. */
    public Reference parent() {
        return isSubtask() ? task(taskId) : this;
    }

    @Override
    public int compareTo(Reference other) {
        return ORDER.compare(this, other);
    }

    @JsonValue
    @Override
    public String toString() {
        return isSubtask() ? taskId + "." + subtaskId : Integer.toString(taskId);
    }
}

package io.taskgraph.graph;

import io.taskgraph.model.Reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsing and normalisation of work item addresses.
 *
 * <p>Stored dependency lists may contain bare task ids, dotted {@code "parent.sub"} strings,
 * or, inside a subtask's own list, a small bare number naming a sibling subtask. Only JSON
 * numbers follow the sibling convention; a quoted {@code "3"} always names task 3.
 * {@link #normalize(Object, int)} resolves all three to a {@link Reference} once, when data
 * enters the process.
 */
public final class References {
    /** Bare numbers below this value inside a subtask's list name sibling subtasks. */
    public static final int SIBLING_REFERENCE_LIMIT = 100;

    private References() {
    }

    public static Reference parseId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw DependencyException.malformedReference("Empty task id");
        }
        String value = raw.trim();
        int dot = value.indexOf('.');
        if (dot < 0) {
            return Reference.task(parsePart(value, raw));
        }
        int parentId = parsePart(value.substring(0, dot), raw);
        int subId = parsePart(value.substring(dot + 1), raw);
        if (parentId <= 0 || subId <= 0) {
            throw DependencyException.malformedReference("Invalid subtask id: " + raw);
        }
        return Reference.subtask(parentId, subId);
    }

    /**
     * @param contextParentId id of the parent task when {@code raw} comes from a subtask's
     *                        dependency list, {@code 0} for a top-level task's list
     */
    public static Reference normalize(Object raw, int contextParentId) {
        if (raw instanceof Reference) {
            return (Reference) raw;
        }
        if (raw instanceof Number) {
            return fromNumber(((Number) raw).longValue(), contextParentId, raw);
        }
        if (raw instanceof String) {
            // quoted ids are explicit task or subtask addresses, never sibling shorthand
            return parseId((String) raw);
        }
        throw DependencyException.malformedReference("Unsupported dependency value: " + raw);
    }

    public static boolean sameTarget(Reference a, Reference b) {
        return a != null && a.equals(b);
    }

    /** Task ids ascending, then subtask ids ascending by parent and sub id. */
    public static List<Reference> sorted(List<Reference> references) {
        List<Reference> out = new ArrayList<>(references);
        Collections.sort(out);
        return out;
    }

    /**
     * Value written to tasks.json: the dotted string for subtasks, an integer for tasks. Inside
     * a subtask's list a task id below {@link #SIBLING_REFERENCE_LIMIT} is written as a string
     * so that it is not read back as a sibling.
     */
    public static Object toStorageValue(Reference ref, int contextParentId) {
        if (ref.isSubtask()) {
            return ref.toString();
        }
        if (contextParentId > 0 && ref.taskId() > 0 && ref.taskId() < SIBLING_REFERENCE_LIMIT) {
            return ref.toString();
        }
        return Integer.valueOf(ref.taskId());
    }

    private static Reference fromNumber(long value, int contextParentId, Object raw) {
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw DependencyException.malformedReference("Task id out of range: " + raw);
        }
        int id = (int) value;
        if (contextParentId > 0 && id > 0 && id < SIBLING_REFERENCE_LIMIT) {
            return Reference.subtask(contextParentId, id);
        }
        return Reference.task(id);
    }

    private static int parsePart(String part, Object raw) {
        try {
            return Integer.parseInt(part.trim());
        } catch (NumberFormatException e) {
            throw DependencyException.malformedReference("Invalid task id: " + raw);
        }
    }
}

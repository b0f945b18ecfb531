package io.taskgraph.graph;

import io.taskgraph.model.Reference;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Id range expressions such as {@code "7-10"}, {@code "1,3-5"} or {@code "4.1-4.3"}.
 */
public final class RangeSpec {
    static final int MAX_EXPANSION = 10_000;

    private RangeSpec() {
    }

    /**
     * Expands a range expression into an ordered, duplicate-free list of references.
     *
     * @throws DependencyException with {@link ErrorKind#MALFORMED_RANGE} when the
     *                             expression does not follow {@code term (',' term)*}
     */
    public static List<Reference> parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw DependencyException.malformedRange("Empty range specification");
        }
        Set<Reference> out = new LinkedHashSet<>();
        for (String rawTerm : spec.split(",", -1)) {
            String term = rawTerm.trim();
            if (term.isEmpty()) {
                throw DependencyException.malformedRange("Empty term in range specification: " + spec);
            }
            expandTerm(term, spec, out);
            if (out.size() > MAX_EXPANSION) {
                throw DependencyException.malformedRange("Range specification expands to more than " + MAX_EXPANSION + " ids: " + spec);
            }
        }
        return List.copyOf(out);
    }

    private static void expandTerm(String term, String spec, Set<Reference> out) {
        int dash = term.indexOf('-', 1);
        if (dash < 0) {
            out.add(parseBound(term, spec));
            return;
        }
        Reference from = parseBound(term.substring(0, dash), spec);
        Reference to = parseBound(term.substring(dash + 1), spec);
        if (from.isSubtask() != to.isSubtask()) {
            throw DependencyException.malformedRange("Cannot mix task and subtask ids in range: " + term);
        }
        if (from.isSubtask() && from.taskId() != to.taskId()) {
            throw DependencyException.malformedRange("Subtask range must stay within one parent: " + term);
        }
        int start = from.isSubtask() ? from.subtaskId() : from.taskId();
        int end = to.isSubtask() ? to.subtaskId() : to.taskId();
        if (end < start) {
            throw DependencyException.malformedRange("Descending range: " + term);
        }
        if ((long) end - start >= MAX_EXPANSION) {
            throw DependencyException.malformedRange("Range too large: " + term);
        }
        for (long i = start; i <= end; i++) {
            int id = (int) i;
            out.add(from.isSubtask() ? Reference.subtask(from.taskId(), id) : Reference.task(id));
        }
    }

    private static Reference parseBound(String raw, String spec) {
        String value = raw.trim();
        if (value.isEmpty()) {
            throw DependencyException.malformedRange("Missing range bound in: " + spec);
        }
        Reference ref;
        try {
            ref = References.parseId(value);
        } catch (DependencyException e) {
            throw DependencyException.malformedRange("Invalid id '" + value + "' in range specification: " + spec);
        }
        if (ref.taskId() <= 0) {
            throw DependencyException.malformedRange("Ids must be positive in range specification: " + spec);
        }
        return ref;
    }
}

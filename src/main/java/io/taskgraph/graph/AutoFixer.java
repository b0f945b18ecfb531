package io.taskgraph.graph;

import io.taskgraph.model.Item;
import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;
import io.taskgraph.model.Subitem;
import io.taskgraph.model.WorkNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repairs a snapshot so that it satisfies the dependency invariants, as far as that can be
 * done by removing references.
 *
 * <p>Phases run in a fixed order, each on the output of the previous one:
 * <ol>
 *   <li>drop repeated references, keeping the first;</li>
 *   <li>drop references to items that do not exist;</li>
 *   <li>drop references of an owner to itself;</li>
 *   <li>drop the back-edges of cycles among subtasks;</li>
 *   <li>clear the first subtask of any task whose subtasks all have dependencies.</li>
 * </ol>
 * Cycles between top-level tasks are not broken; they are returned in
 * {@link FixResult#remainingIssues()}.
 */
public final class AutoFixer {
    private AutoFixer() {
    }

    public static FixResult fix(Snapshot original) {
        Map<Reference, List<Reference>> working = new LinkedHashMap<>();
        for (WorkNode node : original.nodes()) {
            working.put(node.ref(), new ArrayList<>(node.dependencies()));
        }
        List<Repair> repairs = new ArrayList<>();

        removeDuplicates(working, repairs);
        removeMissing(working, original.canonicalIds(), repairs);
        removeSelfReferences(working, repairs);
        breakSubtaskCycles(working, repairs);
        restoreIndependentSubtasks(original, working, repairs);

        Snapshot fixed = original;
        List<Reference> changed = new ArrayList<>();
        for (WorkNode node : original.nodes()) {
            List<Reference> next = working.get(node.ref());
            if (!node.dependencies().equals(next)) {
                changed.add(node.ref());
                fixed = fixed.withDependencies(node.ref(), next);
            }
        }
        FixStats stats = FixStats.from(repairs, changed);
        return new FixResult(fixed, stats, changed, repairs, GraphValidator.validateAll(fixed));
    }

    static void removeDuplicates(Map<Reference, List<Reference>> working, List<Repair> repairs) {
        for (Map.Entry<Reference, List<Reference>> entry : working.entrySet()) {
            Set<Reference> seen = new HashSet<>();
            Iterator<Reference> it = entry.getValue().iterator();
            while (it.hasNext()) {
                Reference dependency = it.next();
                if (!seen.add(dependency)) {
                    it.remove();
                    repairs.add(new Repair(RepairType.DUPLICATE, entry.getKey(), dependency));
                }
            }
        }
    }

    static void removeMissing(Map<Reference, List<Reference>> working, Set<Reference> canonicalIds, List<Repair> repairs) {
        for (Map.Entry<Reference, List<Reference>> entry : working.entrySet()) {
            Iterator<Reference> it = entry.getValue().iterator();
            while (it.hasNext()) {
                Reference dependency = it.next();
                if (!GraphValidator.exists(canonicalIds, dependency)) {
                    it.remove();
                    repairs.add(new Repair(RepairType.MISSING, entry.getKey(), dependency));
                }
            }
        }
    }

    static void removeSelfReferences(Map<Reference, List<Reference>> working, List<Repair> repairs) {
        for (Map.Entry<Reference, List<Reference>> entry : working.entrySet()) {
            Iterator<Reference> it = entry.getValue().iterator();
            while (it.hasNext()) {
                Reference dependency = it.next();
                if (GraphValidator.isSelfDependency(entry.getKey(), dependency)) {
                    it.remove();
                    repairs.add(new Repair(RepairType.SELF, entry.getKey(), dependency));
                }
            }
        }
    }

    static void breakSubtaskCycles(Map<Reference, List<Reference>> working, List<Repair> repairs) {
        Map<Reference, List<Reference>> subtaskGraph = new LinkedHashMap<>();
        for (Map.Entry<Reference, List<Reference>> entry : working.entrySet()) {
            if (entry.getKey().isSubtask()) {
                subtaskGraph.put(entry.getKey(), entry.getValue());
            }
        }
        for (Reference start : subtaskGraph.keySet()) {
            List<Edge> backEdges = new ArrayList<>();
            findBackEdges(start, subtaskGraph, new HashSet<>(), new LinkedHashSet<>(), backEdges);
            for (Edge edge : backEdges) {
                if (subtaskGraph.get(edge.from()).remove(edge.to())) {
                    repairs.add(new Repair(RepairType.CIRCULAR, edge.from(), edge.to()));
                }
            }
        }
    }

    private static void findBackEdges(
            Reference node,
            Map<Reference, List<Reference>> graph,
            Set<Reference> visited,
            Set<Reference> stack,
            List<Edge> out
    ) {
        visited.add(node);
        stack.add(node);
        for (Reference dependency : List.copyOf(graph.getOrDefault(node, List.of()))) {
            if (!visited.contains(dependency)) {
                findBackEdges(dependency, graph, visited, stack, out);
            } else if (stack.contains(dependency)) {
                out.add(new Edge(node, dependency));
            }
        }
        stack.remove(node);
    }

    static void restoreIndependentSubtasks(Snapshot original, Map<Reference, List<Reference>> working, List<Repair> repairs) {
        for (Item item : original.items()) {
            if (item.subtasks().isEmpty()) {
                continue;
            }
            boolean hasIndependent = false;
            for (Subitem subtask : item.subtasks()) {
                if (working.get(subtask.ref()).isEmpty()) {
                    hasIndependent = true;
                    break;
                }
            }
            if (!hasIndependent) {
                Reference first = item.subtasks().get(0).ref();
                List<Reference> cleared = working.get(first);
                for (Reference dependency : cleared) {
                    repairs.add(new Repair(RepairType.INDEPENDENT_SUBTASK, first, dependency));
                }
                cleared.clear();
            }
        }
    }

    private record Edge(Reference from, Reference to) {
    }

    public enum RepairType {
        DUPLICATE,
        MISSING,
        SELF,
        CIRCULAR,
        INDEPENDENT_SUBTASK
    }

    /** One reference removed from one owner's dependency list. */
    public record Repair(RepairType type, Reference owner, Reference dependency) {
    }

    public record FixStats(
            int duplicatesRemoved,
            int missingRemoved,
            int selfRemoved,
            int cyclesBroken,
            int independentSubtasksRestored,
            int itemsFixed,
            int subitemsFixed
    ) {
        static FixStats from(List<Repair> repairs, List<Reference> changed) {
            int[] counts = new int[RepairType.values().length];
            Set<Reference> restored = new HashSet<>();
            for (Repair repair : repairs) {
                counts[repair.type().ordinal()]++;
                if (repair.type() == RepairType.INDEPENDENT_SUBTASK) {
                    restored.add(repair.owner());
                }
            }
            int items = 0;
            int subitems = 0;
            for (Reference ref : changed) {
                if (ref.isSubtask()) {
                    subitems++;
                } else {
                    items++;
                }
            }
            return new FixStats(
                    counts[RepairType.DUPLICATE.ordinal()],
                    counts[RepairType.MISSING.ordinal()],
                    counts[RepairType.SELF.ordinal()],
                    counts[RepairType.CIRCULAR.ordinal()],
                    restored.size(),
                    items,
                    subitems
            );
        }

        public int total() {
            return duplicatesRemoved + missingRemoved + selfRemoved + cyclesBroken + independentSubtasksRestored;
        }
    }

    /**
     * @param changed         owners whose dependency list differs from the input, in traversal order
     * @param remainingIssues problems the fixer does not repair, such as cycles between top-level tasks
     */
    public record FixResult(
            Snapshot fixed,
            FixStats stats,
            List<Reference> changed,
            List<Repair> repairs,
            List<GraphValidator.Issue> remainingIssues
    ) {
        public FixResult {
            changed = List.copyOf(changed);
            repairs = List.copyOf(repairs);
            remainingIssues = List.copyOf(remainingIssues);
        }

        public boolean hasChanges() {
            return !changed.isEmpty();
        }
    }
}

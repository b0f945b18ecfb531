package io.taskgraph.service;

import io.taskgraph.graph.AutoFixer;
import io.taskgraph.graph.BulkRangeOperator;
import io.taskgraph.graph.DependencyMutator;
import io.taskgraph.graph.GraphValidator;
import io.taskgraph.graph.ReadinessScheduler;
import io.taskgraph.graph.References;
import io.taskgraph.model.Item;
import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;
import io.taskgraph.model.WorkNode;
import io.taskgraph.observability.AuditLogger;
import io.taskgraph.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one dependency operation against a {@link TaskStore}: fetch a snapshot, compute the
 * change with the pure graph functions, write back only what changed, refresh derived
 * artifacts and record the change in the audit log.
 *
 * <p>Rejected operations surface as {@link io.taskgraph.graph.DependencyException}. A store
 * that cannot perform a write is not an error: the outcome reports
 * {@link Persistence#UNSUPPORTED} and a warning is logged.
 */
public final class DependencyService {
    private static final Logger log = LoggerFactory.getLogger(DependencyService.class);
    private static final String DEFAULT_ACTOR = "cli";

    private final TaskStore store;
    private final AuditLogger auditLogger;
    private final String actor;

    public DependencyService(TaskStore store, AuditLogger auditLogger) {
        this(store, auditLogger, DEFAULT_ACTOR);
    }

    public DependencyService(TaskStore store, AuditLogger auditLogger, String actor) {
        this.store = store;
        this.auditLogger = auditLogger;
        this.actor = actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor;
    }

    public TaskStore store() {
        return store;
    }

    public GraphValidator.ValidationReport validate() {
        Snapshot snapshot = store.fetchAll();
        GraphValidator.ValidationReport report = GraphValidator.validate(snapshot);
        if (!report.valid()) {
            log.info("Found {} dependency issues in {} store", report.issues().size(), store.name());
        }
        return report;
    }

    public MutationOutcome addDependency(String ownerId, String targetId) {
        return mutate(BulkRangeOperator.Mode.ADD, ownerId, targetId);
    }

    public MutationOutcome removeDependency(String ownerId, String targetId) {
        return mutate(BulkRangeOperator.Mode.REMOVE, ownerId, targetId);
    }

    private MutationOutcome mutate(BulkRangeOperator.Mode mode, String ownerId, String targetId) {
        Reference owner = References.parseId(ownerId);
        Reference target = References.parseId(targetId);
        Snapshot snapshot = store.fetchAll();
        DependencyMutator.MutationResult result = mode == BulkRangeOperator.Mode.ADD
                ? DependencyMutator.add(snapshot, owner, target)
                : DependencyMutator.remove(snapshot, owner, target);

        Persistence persistence = Persistence.NOT_NEEDED;
        if (result.outcome().changed()) {
            persistence = persistPartial(owner, result.dependencies());
            if (persistence == Persistence.PERSISTED) {
                regenerateArtifacts();
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("target", target);
                details.put("dependencies", result.dependencies());
                audit(mode == BulkRangeOperator.Mode.ADD ? "dependency.add" : "dependency.remove",
                        owner, "applied", details);
            }
        } else {
            log.info(result.message());
        }
        return new MutationOutcome(store.name(), owner, target, result.outcome(), result.dependencies(),
                persistence, result.message());
    }

    public BulkOutcome addRange(String taskSpec, String dependencySpec, boolean dryRun) {
        return runRange(BulkRangeOperator.Mode.ADD, taskSpec, dependencySpec, dryRun);
    }

    public BulkOutcome removeRange(String taskSpec, String dependencySpec, boolean dryRun) {
        return runRange(BulkRangeOperator.Mode.REMOVE, taskSpec, dependencySpec, dryRun);
    }

    private BulkOutcome runRange(BulkRangeOperator.Mode mode, String taskSpec, String dependencySpec, boolean dryRun) {
        Snapshot snapshot = store.fetchAll();
        BulkRangeOperator.BulkResult result = BulkRangeOperator.run(mode, snapshot, taskSpec, dependencySpec, dryRun);
        BulkRangeOperator.Summary summary = result.summary();
        log.info("{} range {} x {}: valid={}, skipped={}, errors={}{}",
                mode == BulkRangeOperator.Mode.ADD ? "Add" : "Remove",
                taskSpec, dependencySpec, summary.validOperations(), summary.skipped(), summary.errors(),
                dryRun ? " (dry run)" : "");

        Persistence persistence;
        if (dryRun) {
            persistence = Persistence.DRY_RUN;
        } else if (result.updatedDependencies().isEmpty()) {
            persistence = Persistence.NOT_NEEDED;
        } else {
            List<Reference> written = new ArrayList<>();
            for (Map.Entry<Reference, List<Reference>> entry : result.updatedDependencies().entrySet()) {
                if (persistPartial(entry.getKey(), entry.getValue()) == Persistence.PERSISTED) {
                    written.add(entry.getKey());
                }
            }
            int performed = 0;
            for (BulkRangeOperator.PairResult pair : result.operations()) {
                if (pair.outcome() == BulkRangeOperator.PairOutcome.APPLIED && written.contains(pair.task())) {
                    performed++;
                }
            }
            summary = new BulkRangeOperator.Summary(summary.validOperations(), performed, summary.skipped(), summary.errors());
            persistence = written.size() == result.updatedDependencies().size()
                    ? Persistence.PERSISTED
                    : Persistence.UNSUPPORTED;
            if (!written.isEmpty()) {
                regenerateArtifacts();
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("tasks", taskSpec);
                details.put("dependsOn", dependencySpec);
                details.put("owners", written);
                details.put("operationsPerformed", performed);
                details.put("errors", summary.errors());
                audit(mode == BulkRangeOperator.Mode.ADD ? "dependency.add-range" : "dependency.remove-range",
                        null, "applied", details);
            }
        }
        return new BulkOutcome(store.name(), mode, dryRun, summary, result.operations(), persistence);
    }

    /**
     * Repairs the stored graph. One changed owner is written as a partial update; several
     * changed owners need a bulk rewrite and are left unwritten when the store has none.
     */
    public FixOutcome fix() {
        Snapshot snapshot = store.fetchAll();
        AutoFixer.FixResult result = AutoFixer.fix(snapshot);
        AutoFixer.FixStats stats = result.stats();
        for (AutoFixer.Repair repair : result.repairs()) {
            log.debug("Removed {} reference {} from {}", repair.type(), repair.dependency(), repair.owner());
        }

        Persistence persistence;
        if (!result.hasChanges()) {
            persistence = Persistence.NOT_NEEDED;
            log.info("No dependency issues to fix in {} store", store.name());
        } else if (result.changed().size() == 1) {
            Reference owner = result.changed().get(0);
            List<Reference> dependencies = result.fixed().resolve(owner)
                    .map(WorkNode::dependencies)
                    .orElseThrow(() -> new IllegalStateException("Fixed snapshot lost " + owner));
            persistence = persistPartial(owner, dependencies);
        } else if (!store.supportsBulkRewrite()) {
            persistence = Persistence.UNSUPPORTED;
            log.warn("Store {} cannot rewrite {} changed work items at once; fixes were not saved",
                    store.name(), result.changed().size());
        } else {
            persistence = persistBulk(result.fixed());
        }

        if (persistence == Persistence.PERSISTED) {
            regenerateArtifacts();
            log.info("Fixed {} issues: {} duplicates, {} missing, {} self, {} cycles, {} subtasks made independent",
                    stats.total(), stats.duplicatesRemoved(), stats.missingRemoved(), stats.selfRemoved(),
                    stats.cyclesBroken(), stats.independentSubtasksRestored());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("changed", result.changed());
            details.put("itemsFixed", stats.itemsFixed());
            details.put("subitemsFixed", stats.subitemsFixed());
            details.put("total", stats.total());
            audit("dependency.fix", null, "applied", details);
        }
        if (!result.remainingIssues().isEmpty()) {
            log.warn("{} dependency issues remain after fixing", result.remainingIssues().size());
        }
        return new FixOutcome(store.name(), stats, result.changed(), result.repairs(), result.remainingIssues(), persistence);
    }

    public Optional<Item> next() {
        return ReadinessScheduler.findNext(store.fetchAll());
    }

    public List<Item> readyItems() {
        return ReadinessScheduler.readyItems(store.fetchAll());
    }

    private Persistence persistPartial(Reference owner, List<Reference> dependencies) {
        try {
            store.applyPartialUpdate(owner, dependencies);
            return Persistence.PERSISTED;
        } catch (UnsupportedOperationException e) {
            log.warn("Store {} does not support updating {}: {}", store.name(), owner, e.getMessage());
            return Persistence.UNSUPPORTED;
        }
    }

    private Persistence persistBulk(Snapshot fixed) {
        try {
            store.bulkRewrite(fixed);
            return Persistence.PERSISTED;
        } catch (UnsupportedOperationException e) {
            log.warn("Store {} does not support bulk rewrites: {}", store.name(), e.getMessage());
            return Persistence.UNSUPPORTED;
        }
    }

    private void regenerateArtifacts() {
        try {
            store.regenerateDerivedArtifacts();
        } catch (RuntimeException e) {
            log.warn("Dependencies were saved but derived files could not be regenerated", e);
        }
    }

    private void audit(String action, Reference owner, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        String resource = owner == null ? "store/" + store.name() : "item/" + owner;
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, details));
    }

    public enum Persistence {
        PERSISTED,
        NOT_NEEDED,
        DRY_RUN,
        UNSUPPORTED
    }

    public record MutationOutcome(
            String store,
            Reference owner,
            Reference target,
            DependencyMutator.Outcome outcome,
            List<Reference> dependencies,
            Persistence persistence,
            String message
    ) {
    }

    public record BulkOutcome(
            String store,
            BulkRangeOperator.Mode mode,
            boolean dryRun,
            BulkRangeOperator.Summary summary,
            List<BulkRangeOperator.PairResult> operations,
            Persistence persistence
    ) {
    }

    public record FixOutcome(
            String store,
            AutoFixer.FixStats stats,
            List<Reference> changed,
            List<AutoFixer.Repair> repairs,
            List<GraphValidator.Issue> remainingIssues,
            Persistence persistence
    ) {
    }
}

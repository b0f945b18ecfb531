package io.taskgraph.store;

import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;

import java.util.List;

/**
 * Backing store for work items. The dependency core only reads whole snapshots and writes
 * dependency lists back through this interface.
 *
 * <p>Implementations are not expected to guard read-modify-write cycles: two callers that
 * fetch, change and persist against the same store concurrently get last-writer-wins.
 * Callers that need more must serialise their own cycles.
 *
 * <p>A store that cannot perform a write shape throws {@link UnsupportedOperationException};
 * callers treat that as a skipped write, not a failure.
 */
public interface TaskStore {
    String name();

    Snapshot fetchAll();

    /**
     * Replaces the dependency list of exactly one item or subitem.
     */
    void applyPartialUpdate(Reference ref, List<Reference> dependencies);

    /**
     * Replaces the stored dependency lists with those of {@code snapshot}, in one write.
     */
    void bulkRewrite(Snapshot snapshot);

    default boolean supportsBulkRewrite() {
        return true;
    }

    /**
     * Refreshes anything derived from the stored items. Called after each successful write.
     */
    void regenerateDerivedArtifacts();
}

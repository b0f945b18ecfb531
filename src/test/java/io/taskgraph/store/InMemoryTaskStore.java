package io.taskgraph.store;

import io.taskgraph.graph.DependencyException;
import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Task store backed by a field, with switchable write capabilities and write counters.
 */
public final class InMemoryTaskStore implements TaskStore {
    private Snapshot snapshot;
    private boolean partialUpdates = true;
    private boolean bulkRewrites = true;
    private final Set<Reference> readOnly = new HashSet<>();
    private boolean failRegeneration;
    private int partialWrites;
    private int bulkWrites;
    private int regenerations;

    public InMemoryTaskStore(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public InMemoryTaskStore withoutPartialUpdates() {
        this.partialUpdates = false;
        return this;
    }

    public InMemoryTaskStore withReadOnly(Reference ref) {
        this.readOnly.add(ref);
        return this;
    }

    public InMemoryTaskStore withoutBulkRewrites() {
        this.bulkRewrites = false;
        return this;
    }

    public InMemoryTaskStore failingRegeneration() {
        this.failRegeneration = true;
        return this;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Snapshot fetchAll() {
        return snapshot;
    }

    @Override
    public void applyPartialUpdate(Reference ref, List<Reference> dependencies) {
        if (!partialUpdates) {
            throw new UnsupportedOperationException("partial updates disabled");
        }
        if (readOnly.contains(ref)) {
            throw new UnsupportedOperationException(ref + " is read-only");
        }
        if (snapshot.resolve(ref).isEmpty()) {
            throw DependencyException.notFound("Unknown owner " + ref);
        }
        snapshot = snapshot.withDependencies(ref, dependencies);
        partialWrites++;
    }

    @Override
    public void bulkRewrite(Snapshot replacement) {
        if (!bulkRewrites) {
            throw new UnsupportedOperationException("bulk rewrites disabled");
        }
        snapshot = replacement;
        bulkWrites++;
    }

    @Override
    public boolean supportsBulkRewrite() {
        return bulkRewrites;
    }

    @Override
    public void regenerateDerivedArtifacts() {
        regenerations++;
        if (failRegeneration) {
            throw new IllegalStateException("artifact directory is read-only");
        }
    }

    public int partialWrites() {
        return partialWrites;
    }

    public int bulkWrites() {
        return bulkWrites;
    }

    public int regenerations() {
        return regenerations;
    }
}

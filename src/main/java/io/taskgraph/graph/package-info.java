/**
 * Dependency graph operations.
 *
 * <p>Every function here takes a {@link io.taskgraph.model.Snapshot} and returns a new value;
 * nothing reads or writes a store. {@link io.taskgraph.graph.References} is the only place
 * that knows how raw stored values map to {@link io.taskgraph.model.Reference}s.
 */
package io.taskgraph.graph;

/**
 * TaskGraph source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskgraph.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskgraph.cli.TaskGraphCommand} maps commands to service calls.</li>
 *   <li>{@code io.taskgraph.service.DependencyService} fetches, changes and persists dependency lists.</li>
 *   <li>{@code io.taskgraph.graph} holds the pure validation, mutation, repair and scheduling functions.</li>
 *   <li>{@code io.taskgraph.store.TaskStore} is the seam to the task list on disk.</li>
 * </ul>
 */
package io.taskgraph;

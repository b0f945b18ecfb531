package io.taskgraph.cli;

import io.taskgraph.config.TaskGraphConfig;
import io.taskgraph.graph.DependencyException;
import io.taskgraph.graph.GraphValidator;
import io.taskgraph.model.Item;
import io.taskgraph.model.Snapshot;
import io.taskgraph.observability.AuditLogger;
import io.taskgraph.service.DependencyService;
import io.taskgraph.store.Database;
import io.taskgraph.store.JsonFileTaskStore;
import io.taskgraph.store.SqliteTaskStore;
import io.taskgraph.store.TaskStore;
import io.taskgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(
        name = "taskgraph",
        mixinStandardHelpOptions = true,
        description = "Dependency graph maintenance for task lists",
        subcommands = {
                TaskGraphCommand.ValidateCommand.class,
                TaskGraphCommand.FixCommand.class,
                TaskGraphCommand.AddDependencyCommand.class,
                TaskGraphCommand.RemoveDependencyCommand.class,
                TaskGraphCommand.AddRangeCommand.class,
                TaskGraphCommand.RemoveRangeCommand.class,
                TaskGraphCommand.NextCommand.class,
                TaskGraphCommand.ImportCommand.class,
                TaskGraphCommand.AuditVerifyCommand.class
        }
)
public final class TaskGraphCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(TaskGraphCommand.class);
    static final String STORE_ERROR = "STORE_ERROR";

    @Option(names = {"--root"}, description = "Project root directory", defaultValue = TaskGraphConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--tasks-file"}, description = "tasks.json path, relative to the root")
    String tasksFile;

    @Option(names = {"--store"}, description = "Task store: json|sqlite", defaultValue = "json")
    String store;

    @Override
    public void run() {
        System.out.println("Use subcommands: validate | fix | add-dependency | remove-dependency | add-range | remove-range | next | import | audit-verify");
    }

    TaskGraphConfig config() {
        return TaskGraphConfig.fromRoot(root, tasksFile);
    }

    TaskStore openStore() {
        TaskGraphConfig config = config();
        String kind = store == null ? "json" : store.trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "json" -> new JsonFileTaskStore(config.tasksFile(), config.tasksDir());
            case "sqlite" -> {
                Database database = new Database(config);
                database.init();
                yield new SqliteTaskStore(database);
            }
            default -> throw new IllegalArgumentException("Unknown store: " + store + " (expected json|sqlite)");
        };
    }

    DependencyService service() {
        return new DependencyService(openStore(), new AuditLogger(config().auditFile()));
    }

    /**
     * Runs a subcommand body, printing a {@link Rejection} instead of a stack trace when it
     * fails.
     */
    int guarded(Supplier<Integer> body) {
        try {
            return body.get();
        } catch (DependencyException e) {
            return reject(e.kind().name(), e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Command failed", e);
            return reject(STORE_ERROR, e.getMessage());
        }
    }

    static int reject(String error, String message) {
        System.out.println(Jsons.toJson(new Rejection(false, error, message)));
        return 1;
    }

    /**
     * @param error an {@link io.taskgraph.graph.ErrorKind} name, or {@code STORE_ERROR} when the
     *              store or its files could not be read or written
     */
    public record Rejection(boolean ok, String error, String message) {
    }

    @Command(name = "validate", description = "Report self, missing and circular dependencies")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                GraphValidator.ValidationReport report = parent.service().validate();
                System.out.println(Jsons.toJson(report));
                return report.valid() ? 0 : 1;
            });
        }
    }

    @Command(name = "fix", description = "Remove duplicate, missing, self and circular subtask dependencies")
    static final class FixCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                DependencyService.FixOutcome out = parent.service().fix();
                System.out.println(Jsons.toJson(out));
                return out.remainingIssues().isEmpty() ? 0 : 1;
            });
        }
    }

    @Command(name = "add-dependency", description = "Make one task or subtask depend on another")
    static final class AddDependencyCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Option(names = {"--id"}, required = true, description = "Owner id, e.g. 7 or 7.2")
        String id;

        @Option(names = {"--depends-on"}, required = true, description = "Dependency id, e.g. 3 or 3.1")
        String dependsOn;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                DependencyService.MutationOutcome out = parent.service().addDependency(id, dependsOn);
                System.out.println(Jsons.toJson(out));
                return 0;
            });
        }
    }

    @Command(name = "remove-dependency", description = "Remove one dependency from a task or subtask")
    static final class RemoveDependencyCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Option(names = {"--id"}, required = true, description = "Owner id, e.g. 7 or 7.2")
        String id;

        @Option(names = {"--depends-on"}, required = true, description = "Dependency id to remove")
        String dependsOn;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                DependencyService.MutationOutcome out = parent.service().removeDependency(id, dependsOn);
                System.out.println(Jsons.toJson(out));
                return 0;
            });
        }
    }

    @Command(name = "add-range", description = "Add every dependency in a range to every task in a range")
    static final class AddRangeCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Option(names = {"--tasks"}, required = true, description = "Owner range, e.g. 4-6,9 or 3.1-3.4")
        String tasks;

        @Option(names = {"--depends-on"}, required = true, description = "Dependency range")
        String dependsOn;

        @Option(names = {"--dry-run"}, description = "Classify every pair without saving")
        boolean dryRun;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                DependencyService.BulkOutcome out = parent.service().addRange(tasks, dependsOn, dryRun);
                System.out.println(Jsons.toJson(out));
                return out.summary().errors() == 0 ? 0 : 1;
            });
        }
    }

    @Command(name = "remove-range", description = "Remove every dependency in a range from every task in a range")
    static final class RemoveRangeCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Option(names = {"--tasks"}, required = true, description = "Owner range, e.g. 4-6,9 or 3.1-3.4")
        String tasks;

        @Option(names = {"--depends-on"}, required = true, description = "Dependency range")
        String dependsOn;

        @Option(names = {"--dry-run"}, description = "Classify every pair without saving")
        boolean dryRun;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                DependencyService.BulkOutcome out = parent.service().removeRange(tasks, dependsOn, dryRun);
                System.out.println(Jsons.toJson(out));
                return out.summary().errors() == 0 ? 0 : 1;
            });
        }
    }

    @Command(name = "next", description = "Show the next task whose dependencies are all complete")
    static final class NextCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Option(names = {"--all"}, description = "List every ready task in scheduling order")
        boolean all;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                DependencyService service = parent.service();
                if (all) {
                    List<Item> ready = service.readyItems();
                    System.out.println(Jsons.toJson(ready));
                    return 0;
                }
                Optional<Item> next = service.next();
                System.out.println(Jsons.toJson(new NextOutcome(next.isPresent(), next.orElse(null))));
                return 0;
            });
        }
    }

    public record NextOutcome(boolean found, Item item) {
    }

    @Command(name = "import", description = "Seed the SQLite store from a tasks.json file")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Option(names = {"--from"}, required = true, description = "Source tasks.json path")
        String from;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                Snapshot snapshot = new JsonFileTaskStore(Path.of(from)).fetchAll();
                Database database = new Database(parent.config());
                database.init();
                new SqliteTaskStore(database).importSnapshot(snapshot);
                System.out.println(Jsons.toJson(new ImportOutcome(
                        database.dbFile().toString(), snapshot.taskCount(), snapshot.subtaskCount(), snapshot.dependencyCount())));
                return 0;
            });
        }
    }

    public record ImportOutcome(String dbFile, int tasks, int subtasks, int dependencies) {
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TaskGraphCommand parent;

        @Override
        public Integer call() {
            return parent.guarded(() -> {
                AuditLogger.VerifyOutcome out = new AuditLogger(parent.config().auditFile()).verify();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            });
        }
    }
}

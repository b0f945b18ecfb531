package io.taskgraph.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TaskGraphConfig {
    public static final String DEFAULT_ROOT = ".";
    public static final String DEFAULT_TASKS_FILE = "tasks/tasks.json";
    public static final String STATE_DIR = ".taskgraph";

    private final Path rootDir;
    private final Path tasksFile;

    public TaskGraphConfig(Path rootDir, Path tasksFile) {
        this.rootDir = rootDir;
        this.tasksFile = tasksFile;
    }

    public static TaskGraphConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    /**
     * @param tasksFile tasks.json location; relative paths resolve against the root,
     *                  blank means {@value #DEFAULT_TASKS_FILE}
     */
    public static TaskGraphConfig fromRoot(String root, String tasksFile) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Path file = tasksFile == null || tasksFile.isBlank()
                ? base.resolve(DEFAULT_TASKS_FILE)
                : base.resolve(tasksFile).normalize();
        return new TaskGraphConfig(base, file);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path tasksFile() {
        return tasksFile;
    }

    /** Directory that receives the per-task text files regenerated after each write. */
    public Path tasksDir() {
        Path parent = tasksFile.getParent();
        return parent == null ? rootDir : parent;
    }

    public Path stateDir() {
        return rootDir.resolve(STATE_DIR);
    }

    public Path dbFile() {
        return stateDir().resolve("taskgraph.db");
    }

    public Path auditRoot() {
        return stateDir().resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}

package io.taskgraph.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskgraph.graph.DependencyException;
import io.taskgraph.graph.References;
import io.taskgraph.model.Item;
import io.taskgraph.model.ItemStatus;
import io.taskgraph.model.Priority;
import io.taskgraph.model.Reference;
import io.taskgraph.model.Snapshot;
import io.taskgraph.model.Subitem;
import io.taskgraph.model.WorkNode;
import io.taskgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Local {@code tasks.json} store.
 *
 * <p>Reads the whole file on every call and writes back only the {@code dependencies} arrays
 * that changed, so fields this store does not model (descriptions, details, test strategy)
 * are preserved as they are.
 */
public final class JsonFileTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskStore.class);
    private static final String TASK_FILE_PREFIX = "task_";
    private static final String TASK_FILE_SUFFIX = ".txt";

    private final Path tasksFile;
    private final Path artifactsDir;

    public JsonFileTaskStore(Path tasksFile) {
        this(tasksFile, tasksFile.toAbsolutePath().getParent());
    }

    public JsonFileTaskStore(Path tasksFile, Path artifactsDir) {
        this.tasksFile = tasksFile;
        this.artifactsDir = artifactsDir;
    }

    @Override
    public String name() {
        return "json-file";
    }

    public Path tasksFile() {
        return tasksFile;
    }

    @Override
    public Snapshot fetchAll() {
        ArrayNode tasks = tasksArray(readRoot());
        List<Item> items = new ArrayList<>(tasks.size());
        for (JsonNode taskNode : tasks) {
            items.add(toItem(taskNode));
        }
        log.debug("Loaded {} tasks from {}", items.size(), tasksFile);
        return new Snapshot(items);
    }

    @Override
    public void applyPartialUpdate(Reference ref, List<Reference> dependencies) {
        ObjectNode root = readRoot();
        if (patchDependencies(root, ref, dependencies)) {
            writeRoot(root);
            log.debug("Updated dependencies of {} in {}", ref, tasksFile);
        }
    }

    @Override
    public void bulkRewrite(Snapshot snapshot) {
        ObjectNode root = readRoot();
        int patched = 0;
        for (WorkNode node : snapshot.nodes()) {
            if (patchDependencies(root, node.ref(), node.dependencies())) {
                patched++;
            }
        }
        if (patched > 0) {
            writeRoot(root);
        }
        log.debug("Rewrote dependencies of {} work items in {}", patched, tasksFile);
    }

    /**
     * Writes one {@code task_NNN.txt} per task and removes files for tasks that no longer exist.
     */
    @Override
    public void regenerateDerivedArtifacts() {
        ArrayNode tasks = tasksArray(readRoot());
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(artifactsDir);
            for (JsonNode taskNode : tasks) {
                Item item = toItem(taskNode);
                Path file = artifactsDir.resolve(taskFileName(item.id()));
                Files.writeString(file, renderTaskFile(item, taskNode), StandardCharsets.UTF_8);
                written.add(file);
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(artifactsDir, TASK_FILE_PREFIX + "*" + TASK_FILE_SUFFIX)) {
                for (Path existing : stream) {
                    if (!written.contains(existing)) {
                        Files.deleteIfExists(existing);
                    }
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to regenerate task files in " + artifactsDir, e);
        }
        log.debug("Regenerated {} task files in {}", written.size(), artifactsDir);
    }

    static String taskFileName(int id) {
        return String.format(Locale.ROOT, "%s%03d%s", TASK_FILE_PREFIX, id, TASK_FILE_SUFFIX);
    }

    private ObjectNode readRoot() {
        if (!Files.exists(tasksFile)) {
            throw new IllegalStateException("Tasks file not found: " + tasksFile);
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(tasksFile.toFile());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read tasks file: " + tasksFile, e);
        }
        if (root == null || !root.isObject() || !root.path("tasks").isArray()) {
            throw new IllegalStateException("Tasks file has no tasks array: " + tasksFile);
        }
        return (ObjectNode) root;
    }

    private void writeRoot(ObjectNode root) {
        Path parent = tasksFile.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, ".tasks-", ".json.tmp");
            Files.writeString(tmp, Jsons.mapper().writeValueAsString(root) + System.lineSeparator(), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, tasksFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, tasksFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write tasks file: " + tasksFile, e);
        }
    }

    private static ArrayNode tasksArray(ObjectNode root) {
        return (ArrayNode) root.get("tasks");
    }

    /**
     * @return true when the stored list differed and was replaced
     */
    private static boolean patchDependencies(ObjectNode root, Reference ref, List<Reference> dependencies) {
        ObjectNode owner = findOwnerNode(tasksArray(root), ref);
        int contextParentId = ref.isSubtask() ? ref.taskId() : 0;
        if (readDependencies(owner.path("dependencies"), contextParentId).equals(dependencies)) {
            return false;
        }
        ArrayNode array = owner.putArray("dependencies");
        for (Reference dependency : dependencies) {
            Object value = References.toStorageValue(dependency, contextParentId);
            if (value instanceof Integer) {
                array.add((Integer) value);
            } else {
                array.add(value.toString());
            }
        }
        return true;
    }

    private static ObjectNode findOwnerNode(ArrayNode tasks, Reference ref) {
        for (JsonNode taskNode : tasks) {
            if (readId(taskNode) != ref.taskId()) {
                continue;
            }
            if (!ref.isSubtask()) {
                return (ObjectNode) taskNode;
            }
            for (JsonNode subNode : taskNode.path("subtasks")) {
                if (readId(subNode) == ref.subtaskId()) {
                    return (ObjectNode) subNode;
                }
            }
        }
        throw DependencyException.notFound((ref.isSubtask() ? "Subtask " : "Task ") + ref + " not found");
    }

    private static Item toItem(JsonNode taskNode) {
        int id = readId(taskNode);
        List<Subitem> subtasks = new ArrayList<>();
        for (JsonNode subNode : taskNode.path("subtasks")) {
            subtasks.add(new Subitem(
                    id,
                    readId(subNode),
                    subNode.path("title").asText(""),
                    ItemStatus.fromString(subNode.path("status").asText("")),
                    readDependencies(subNode.path("dependencies"), id)
            ));
        }
        return new Item(
                id,
                taskNode.path("title").asText(""),
                ItemStatus.fromString(taskNode.path("status").asText("")),
                Priority.fromString(taskNode.path("priority").asText("")),
                readDependencies(taskNode.path("dependencies"), 0),
                subtasks
        );
    }

    private static int readId(JsonNode node) {
        JsonNode id = node.path("id");
        if (id.isIntegralNumber()) {
            return id.intValue();
        }
        if (id.isTextual()) {
            try {
                return Integer.parseInt(id.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid id in tasks file: " + id.asText(), e);
            }
        }
        throw new IllegalStateException("Missing id in tasks file entry: " + node);
    }

    private static List<Reference> readDependencies(JsonNode array, int contextParentId) {
        List<Reference> out = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return out;
        }
        for (JsonNode value : array) {
            if (value.isIntegralNumber()) {
                out.add(References.normalize(value.longValue(), contextParentId));
            } else if (value.isTextual()) {
                out.add(References.normalize(value.asText(), contextParentId));
            } else {
                throw DependencyException.malformedReference("Unsupported dependency value: " + value);
            }
        }
        return out;
    }

    private static String renderTaskFile(Item item, JsonNode taskNode) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Task ID: ").append(item.id()).append('\n');
        sb.append("# Title: ").append(item.title()).append('\n');
        sb.append("# Status: ").append(item.status().wireName()).append('\n');
        sb.append("# Dependencies: ").append(joinReferences(item.dependencies())).append('\n');
        sb.append("# Priority: ").append(item.priority().wireName()).append('\n');
        sb.append("# Description: ").append(taskNode.path("description").asText("")).append('\n');
        sb.append("# Details:\n").append(taskNode.path("details").asText("")).append("\n\n");
        sb.append("# Test Strategy:\n").append(taskNode.path("testStrategy").asText("")).append('\n');
        if (!item.subtasks().isEmpty()) {
            sb.append("\n# Subtasks:\n");
            for (Subitem subtask : item.subtasks()) {
                sb.append("## ").append(subtask.id()).append(". ").append(subtask.title())
                        .append(" [").append(subtask.status().wireName()).append("]\n");
                sb.append("### Dependencies: ").append(joinReferences(subtask.dependencies())).append('\n');
            }
        }
        return sb.toString();
    }

    private static String joinReferences(List<Reference> references) {
        if (references.isEmpty()) {
            return "None";
        }
        StringBuilder sb = new StringBuilder();
        for (Reference ref : references) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(ref);
        }
        return sb.toString();
    }
}

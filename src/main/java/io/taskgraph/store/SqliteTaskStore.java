package io.taskgraph.store;

import com.fasterxml.jackson.core.type.TypeReference;
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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Work items kept in a SQLite table, one row per item or subitem.
 */
public final class SqliteTaskStore implements TaskStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteTaskStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Database database;

    public SqliteTaskStore(Database database) {
        this.database = database;
    }

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    public Snapshot fetchAll() {
        String sql = """
                SELECT parent_id,item_id,title,status,priority,dependencies
                FROM work_items
                ORDER BY parent_id ASC, position ASC
                """;
        Map<Integer, Row> tasks = new LinkedHashMap<>();
        Map<Integer, List<Subitem>> subtasksByParent = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                int parentId = rs.getInt("parent_id");
                int itemId = rs.getInt("item_id");
                List<Reference> dependencies = decodeDependencies(rs.getString("dependencies"));
                if (parentId == 0) {
                    tasks.put(itemId, new Row(
                            itemId,
                            rs.getString("title"),
                            ItemStatus.fromString(rs.getString("status")),
                            Priority.fromString(rs.getString("priority")),
                            dependencies
                    ));
                } else {
                    subtasksByParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(new Subitem(
                            parentId,
                            itemId,
                            rs.getString("title"),
                            ItemStatus.fromString(rs.getString("status")),
                            dependencies
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load work items", e);
        }
        List<Item> items = new ArrayList<>(tasks.size());
        for (Row row : tasks.values()) {
            items.add(new Item(row.id(), row.title(), row.status(), row.priority(), row.dependencies(),
                    subtasksByParent.getOrDefault(row.id(), List.of())));
        }
        for (Integer orphanParent : subtasksByParent.keySet()) {
            if (!tasks.containsKey(orphanParent)) {
                log.warn("Ignoring subtasks of missing parent task {}", orphanParent);
            }
        }
        return new Snapshot(items);
    }

    @Override
    public void applyPartialUpdate(Reference ref, List<Reference> dependencies) {
        String sql = "UPDATE work_items SET dependencies=?,updated_at_ms=? WHERE parent_id=? AND item_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, encodeDependencies(dependencies));
            ps.setLong(2, Instant.now().toEpochMilli());
            ps.setInt(3, ref.isSubtask() ? ref.taskId() : 0);
            ps.setInt(4, ref.isSubtask() ? ref.subtaskId() : ref.taskId());
            if (ps.executeUpdate() == 0) {
                throw DependencyException.notFound((ref.isSubtask() ? "Subtask " : "Task ") + ref + " not found");
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update dependencies of " + ref, e);
        }
    }

    /**
     * Updates the dependency column of every node in {@code snapshot} in one transaction.
     * Rows the snapshot does not mention are left alone.
     */
    @Override
    public void bulkRewrite(Snapshot snapshot) {
        String sql = "UPDATE work_items SET dependencies=?,updated_at_ms=? WHERE parent_id=? AND item_id=?";
        int patched = 0;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                long now = Instant.now().toEpochMilli();
                for (WorkNode node : snapshot.nodes()) {
                    Reference ref = node.ref();
                    ps.setString(1, encodeDependencies(node.dependencies()));
                    ps.setLong(2, now);
                    ps.setInt(3, ref.isSubtask() ? ref.taskId() : 0);
                    ps.setInt(4, ref.isSubtask() ? ref.subtaskId() : ref.taskId());
                    patched += ps.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to rewrite dependencies", e);
        }
        log.debug("Rewrote dependencies of {} work items in {}", patched, database.dbFile());
    }

    /**
     * Seeds the store from another store's snapshot, replacing whatever it held. Subitem rows
     * take their parent's priority.
     */
    public void importSnapshot(Snapshot snapshot) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (Statement clear = c.createStatement();
                 PreparedStatement insert = c.prepareStatement(
                         "INSERT INTO work_items(parent_id,item_id,position,title,status,priority,dependencies,updated_at_ms) VALUES(?,?,?,?,?,?,?,?)")) {
                clear.executeUpdate("DELETE FROM work_items");
                long now = Instant.now().toEpochMilli();
                int position = 0;
                for (Item item : snapshot.items()) {
                    bindRow(insert, 0, item.id(), position++, item, item.priority(), now);
                    insert.addBatch();
                    int subPosition = 0;
                    for (Subitem subtask : item.subtasks()) {
                        bindRow(insert, item.id(), subtask.id(), subPosition++, subtask, item.priority(), now);
                        insert.addBatch();
                    }
                }
                insert.executeBatch();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to import work items", e);
        }
        log.debug("Imported {} tasks and {} subtasks into {}", snapshot.taskCount(), snapshot.subtaskCount(), database.dbFile());
    }

    @Override
    public void regenerateDerivedArtifacts() {
        // rows are the only representation
    }

    private static void bindRow(PreparedStatement ps, int parentId, int itemId, int position, WorkNode node,
                                Priority priority, long now) throws SQLException {
        ps.setInt(1, parentId);
        ps.setInt(2, itemId);
        ps.setInt(3, position);
        ps.setString(4, node.title());
        ps.setString(5, node.status().wireName());
        ps.setString(6, priority.wireName());
        ps.setString(7, encodeDependencies(node.dependencies()));
        ps.setLong(8, now);
    }

    static String encodeDependencies(List<Reference> dependencies) {
        List<String> values = new ArrayList<>(dependencies.size());
        for (Reference dependency : dependencies) {
            values.add(dependency.toString());
        }
        return Jsons.toCompactJson(values);
    }

    static List<Reference> decodeDependencies(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> values;
        try {
            values = Jsons.mapper().readValue(raw, STRING_LIST);
        } catch (IOException e) {
            throw new RuntimeException("Failed to decode stored dependencies: " + raw, e);
        }
        List<Reference> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(References.parseId(value));
        }
        return out;
    }

    private record Row(int id, String title, ItemStatus status, Priority priority, List<Reference> dependencies) {
    }
}

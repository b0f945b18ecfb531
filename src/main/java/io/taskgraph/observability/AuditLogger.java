package io.taskgraph.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskgraph.util.Hashing;
import io.taskgraph.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines record of every dependency change written to a store. Each row
 * carries the hash of the previous row, so truncation or edits are detectable with
 * {@link #verify()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        this.previousHash = "";
        try {
            Files.createDirectories(auditFile.toAbsolutePath().getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the hash chain from the first row.
     */
    public synchronized VerifyOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            ObjectNode node;
            try {
                node = (ObjectNode) Jsons.mapper().readTree(line);
            } catch (IOException | ClassCastException e) {
                return new VerifyOutcome(false, checked, i + 1, "unparseable row");
            }
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return new VerifyOutcome(false, checked, i + 1, "prev_hash mismatch");
            }
            node.remove("hash");
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(node));
            if (!recomputed.equals(hash)) {
                return new VerifyOutcome(false, checked, i + 1, "hash mismatch");
            }
            expectedPrev = hash;
            checked++;
        }
        return new VerifyOutcome(true, checked, 0, "ok");
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(auditFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    /**
     * @param failedLine 1-based line of the first broken row, 0 when the chain is intact
     */
    public record VerifyOutcome(boolean ok, int checkedRows, int failedLine, String message) {
    }
}

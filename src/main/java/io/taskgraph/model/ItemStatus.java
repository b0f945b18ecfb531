package io.taskgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ItemStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    DONE("done"),
    COMPLETED("completed"),
    REVIEW("review"),
    BLOCKED("blocked"),
    DEFERRED("deferred"),
    CANCELLED("cancelled");

    private final String wireName;

    ItemStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isComplete() {
        return this == DONE || this == COMPLETED;
    }

    public boolean isActionable() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public static ItemStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ItemStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + raw);
    }
}

package io.taskgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String wireName;
    private final int rank;

    Priority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int rank() {
        return rank;
    }

    /** Unrecognised values rank as {@link #MEDIUM}. */
    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        String value = raw.trim();
        for (Priority priority : values()) {
            if (priority.name().equalsIgnoreCase(value) || priority.wireName.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        return MEDIUM;
    }
}

package io.maildigest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryStatus {
    NEW("new"),
    SURFACED("surfaced"),
    DEFERRED("deferred"),
    HANDLED("handled"),
    DISMISSED("dismissed");

    private final String wireName;

    EntryStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean terminal() {
        return this == HANDLED || this == DISMISSED;
    }

    /**
     * Surfaced and deferred entries are re-checked each cycle for an owner reply.
     */
    public boolean active() {
        return this == SURFACED || this == DEFERRED;
    }

    @JsonCreator
    public static EntryStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Status cannot be empty");
        }
        for (EntryStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + raw);
    }
}

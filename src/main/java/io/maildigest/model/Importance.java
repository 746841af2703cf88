package io.maildigest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Importance {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    Importance(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Worklist admission gate: only high and medium are tracked.
     */
    public boolean tracked() {
        return this != LOW;
    }

    @JsonCreator
    public static Importance fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Importance cannot be empty");
        }
        for (Importance value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown importance: " + raw);
    }
}

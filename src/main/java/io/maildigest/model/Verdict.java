package io.maildigest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Verdict(
        String id,
        Importance importance,
        String reason,
        @JsonProperty("notify") boolean notifyUser
) {
    public static Verdict failOpen(String id, String reason) {
        return new Verdict(id, Importance.HIGH, reason, true);
    }

    public boolean shouldPush() {
        return importance == Importance.HIGH && notifyUser;
    }
}

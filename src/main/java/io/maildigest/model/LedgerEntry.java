package io.maildigest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of the append-only message ledger.
 */
public record LedgerEntry(
        MessageRecord email,
        Importance importance,
        String reason,
        @JsonProperty("notify") boolean notifyUser,
        Instant timestamp
) {
    public static LedgerEntry of(MessageRecord email, Verdict verdict, Instant timestamp) {
        return new LedgerEntry(email, verdict.importance(), verdict.reason(), verdict.notifyUser(), timestamp);
    }

    public String messageId() {
        return email == null ? null : email.id();
    }
}

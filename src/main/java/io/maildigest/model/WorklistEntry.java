package io.maildigest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A tracked digest item. Instances are immutable; every lifecycle change
 * produces a copy through one of the {@code with*} methods.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorklistEntry(
        String id,
        String threadId,
        String account,
        String from,
        String subject,
        String date,
        String body,
        Importance importance,
        String reason,
        @JsonProperty("notify") boolean notifyUser,
        EntryStatus status,
        Instant firstSeenAt,
        Instant surfacedAt,
        Instant deferredUntil,
        Instant resolvedAt,
        String dismissReason
) {
    public static WorklistEntry fromVerdict(MessageRecord email, Verdict verdict, Instant now) {
        if (!verdict.importance().tracked()) {
            throw new IllegalArgumentException("Low importance messages never enter the worklist: " + email.id());
        }
        return new WorklistEntry(
                email.id(),
                email.threadId(),
                email.account(),
                email.from(),
                email.subject(),
                email.date(),
                email.body(),
                verdict.importance(),
                verdict.reason(),
                verdict.notifyUser(),
                EntryStatus.NEW,
                now,
                null,
                null,
                null,
                null
        );
    }

    public WorklistEntry withSurfaced(Instant at) {
        return new WorklistEntry(id, threadId, account, from, subject, date, body, importance, reason, notifyUser,
                EntryStatus.SURFACED, firstSeenAt, at, deferredUntil, resolvedAt, dismissReason);
    }

    public WorklistEntry withHandled(Instant at) {
        return new WorklistEntry(id, threadId, account, from, subject, date, body, importance, reason, notifyUser,
                EntryStatus.HANDLED, firstSeenAt, surfacedAt, deferredUntil, at, dismissReason);
    }

    public WorklistEntry withDeferred(Instant until) {
        return new WorklistEntry(id, threadId, account, from, subject, date, body, importance, reason, notifyUser,
                EntryStatus.DEFERRED, firstSeenAt, surfacedAt, until, resolvedAt, dismissReason);
    }

    public WorklistEntry withDismissed(Instant at, String why) {
        String kept = why == null || why.isBlank() ? dismissReason : why;
        return new WorklistEntry(id, threadId, account, from, subject, date, body, importance, reason, notifyUser,
                EntryStatus.DISMISSED, firstSeenAt, surfacedAt, deferredUntil, at, kept);
    }

    public WorklistEntry withExpiredDeferral() {
        return new WorklistEntry(id, threadId, account, from, subject, date, body, importance, reason, notifyUser,
                EntryStatus.NEW, firstSeenAt, surfacedAt, null, resolvedAt, dismissReason);
    }
}

package io.maildigest.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.maildigest.model.EntryStatus;
import io.maildigest.model.Importance;
import io.maildigest.model.WorklistEntry;
import io.maildigest.observability.AuditLogger;
import io.maildigest.storage.WorklistStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Consumer-facing operations on the digest. This is where illegal lifecycle
 * transitions are refused; the store below applies whatever it is told.
 */
public final class DigestActions {
    private static final Set<String> VIEWABLE_STATUSES = Set.of("new", "surfaced", "deferred", "all");

    private final WorklistStore worklist;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public DigestActions(WorklistStore worklist, AuditLogger auditLogger, Clock clock) {
        this.worklist = worklist;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * Returns the digest grouped by account and marks every returned
     * {@code new} entry as surfaced. The view reflects the state before
     * marking.
     *
     * @param status {@code new} (default), {@code surfaced}, {@code deferred} or {@code all}
     * @param account optional account filter
     */
    public DigestView getDigest(String status, String account) {
        String requested = status == null || status.isBlank() ? "new" : status.trim().toLowerCase(Locale.ROOT);
        if (!VIEWABLE_STATUSES.contains(requested)) {
            return new DigestView(false, "status must be one of: new, surfaced, deferred, all", Map.of());
        }
        EntryStatus filter = "all".equals(requested) ? null : EntryStatus.fromString(requested);
        List<String> toSurface = new ArrayList<>();
        Map<String, List<DigestItem>> view = worklist.update(store -> {
            Map<String, List<WorklistEntry>> grouped = store.getGroupedByAccount(filter);
            if (account != null && !account.isBlank()) {
                grouped = Map.of(account, grouped.getOrDefault(account, List.of()));
            }
            Instant now = clock.instant();
            Map<String, List<DigestItem>> items = new LinkedHashMap<>();
            grouped.forEach((acc, entries) -> {
                List<DigestItem> group = new ArrayList<>(entries.size());
                for (WorklistEntry entry : entries) {
                    group.add(DigestItem.of(entry, now));
                    if (entry.status() == EntryStatus.NEW) {
                        toSurface.add(entry.id());
                    }
                }
                items.put(acc, group);
            });
            toSurface.forEach(store::markSurfaced);
            return items;
        });
        auditLogger.log(AuditLogger.AuditEvent.of(
                "digest.read",
                "consumer",
                "digest",
                "ok",
                Map.of("status", requested, "surfaced", toSurface.size())
        ));
        return new DigestView(true, "ok", view);
    }

    public ActionOutcome defer(String messageId, long minutes) {
        if (messageId == null || messageId.isBlank()) {
            return ActionOutcome.rejected(messageId, "messageId must be a non-empty string");
        }
        if (minutes <= 0) {
            return ActionOutcome.rejected(messageId, "minutes must be a positive number");
        }
        if (minutes > WorklistStore.MAX_DEFER_MINUTES) {
            return ActionOutcome.rejected(messageId, "minutes must be at most " + WorklistStore.MAX_DEFER_MINUTES);
        }
        ActionOutcome outcome = worklist.update(store -> {
            Optional<WorklistEntry> entry = store.get(messageId);
            if (entry.isEmpty()) {
                return ActionOutcome.notFound(messageId);
            }
            EntryStatus current = entry.get().status();
            if (current.terminal() || current == EntryStatus.DEFERRED) {
                return ActionOutcome.rejected(messageId, "cannot defer: email is already " + current.wireName());
            }
            store.defer(messageId, minutes);
            return ActionOutcome.applied(messageId, EntryStatus.DEFERRED,
                    "Deferred \"" + entry.get().subject() + "\"; will re-surface in " + minutes + " minutes");
        });
        if (outcome.ok()) {
            audit("digest.defer", messageId, Map.of("minutes", minutes));
        }
        return outcome;
    }

    public ActionOutcome dismiss(String messageId, String reason) {
        ActionOutcome outcome = worklist.update(store -> {
            Optional<WorklistEntry> entry = store.get(messageId);
            if (entry.isEmpty()) {
                return ActionOutcome.notFound(messageId);
            }
            EntryStatus current = entry.get().status();
            if (current.terminal()) {
                return ActionOutcome.rejected(messageId, "cannot dismiss: email is already " + current.wireName());
            }
            store.dismiss(messageId, reason);
            return ActionOutcome.applied(messageId, EntryStatus.DISMISSED,
                    "Dismissed \"" + entry.get().subject() + "\" from " + entry.get().from() + "; it won't be flagged again");
        });
        if (outcome.ok()) {
            audit("digest.dismiss", messageId, reason == null || reason.isBlank() ? Map.of() : Map.of("reason", reason));
        }
        return outcome;
    }

    public ActionOutcome markHandled(String messageId) {
        ActionOutcome outcome = worklist.update(store -> {
            Optional<WorklistEntry> entry = store.get(messageId);
            if (entry.isEmpty()) {
                return ActionOutcome.notFound(messageId);
            }
            EntryStatus current = entry.get().status();
            if (current.terminal()) {
                return ActionOutcome.rejected(messageId, "cannot mark handled: email is already " + current.wireName());
            }
            store.markHandled(messageId);
            return ActionOutcome.applied(messageId, EntryStatus.HANDLED,
                    "Marked \"" + entry.get().subject() + "\" from " + entry.get().from() + " as handled");
        });
        if (outcome.ok()) {
            audit("digest.handled", messageId, Map.of());
        }
        return outcome;
    }

    private void audit(String action, String messageId, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, "consumer", "message/" + messageId, "ok", details));
    }

    public record DigestView(boolean ok, String message, Map<String, List<DigestItem>> accounts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DigestItem(
            String messageId,
            String from,
            String subject,
            Importance importance,
            String reason,
            EntryStatus status,
            String date,
            String age,
            String body,
            Instant deferredUntil
    ) {
        static DigestItem of(WorklistEntry entry, Instant now) {
            return new DigestItem(
                    entry.id(),
                    entry.from(),
                    entry.subject(),
                    entry.importance(),
                    entry.reason(),
                    entry.status(),
                    entry.date(),
                    DigestReport.formatAge(entry.firstSeenAt(), now),
                    entry.body(),
                    entry.deferredUntil()
            );
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ActionOutcome(boolean ok, String messageId, EntryStatus status, String message) {
        static ActionOutcome applied(String messageId, EntryStatus status, String message) {
            return new ActionOutcome(true, messageId, status, message);
        }

        static ActionOutcome notFound(String messageId) {
            return new ActionOutcome(false, messageId, null, "Email " + messageId + " not found in digest");
        }

        static ActionOutcome rejected(String messageId, String message) {
            return new ActionOutcome(false, messageId, null, message);
        }
    }
}

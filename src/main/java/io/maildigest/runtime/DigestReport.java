package io.maildigest.runtime;

import io.maildigest.model.EntryStatus;
import io.maildigest.model.Importance;
import io.maildigest.model.WorklistEntry;
import io.maildigest.storage.WorklistStore;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain-text status view of the digest, one block per account.
 */
public final class DigestReport {
    private DigestReport() {
    }

    public static String render(WorklistStore worklist, Instant now, ZoneId zone) {
        List<String> lines = new ArrayList<>();
        lines.add("Email Digest");
        lines.add("─".repeat(40));

        boolean hasContent = false;
        LocalDate today = LocalDate.ofInstant(now, zone);
        for (Map.Entry<String, List<WorklistEntry>> group : worklist.getGroupedByAccount(null).entrySet()) {
            List<WorklistEntry> entries = group.getValue();
            List<WorklistEntry> fresh = withStatus(entries, EntryStatus.NEW);
            List<WorklistEntry> active = new ArrayList<>(fresh);
            active.addAll(withStatus(entries, EntryStatus.SURFACED));
            int deferred = withStatus(entries, EntryStatus.DEFERRED).size();
            long handledToday = withStatus(entries, EntryStatus.HANDLED).stream()
                    .filter(entry -> entry.resolvedAt() != null
                            && LocalDate.ofInstant(entry.resolvedAt(), zone).equals(today))
                    .count();

            if (active.isEmpty() && deferred == 0) {
                lines.add("");
                lines.add(group.getKey() + " - nothing new");
                continue;
            }
            hasContent = true;
            lines.add("");
            lines.add(group.getKey() + " (" + fresh.size() + " new)");
            for (WorklistEntry entry : active) {
                String tag = entry.importance() == Importance.HIGH ? "[HIGH]" : "[MED] ";
                lines.add("  " + tag + " " + entry.subject() + " from " + entry.from()
                        + " - " + formatAge(entry.firstSeenAt(), now));
            }
            if (deferred > 0) {
                lines.add("  " + deferred + " deferred");
            }
            if (handledToday > 0) {
                lines.add("  " + handledToday + " handled today");
            }
        }
        if (!hasContent) {
            lines.add("");
            lines.add("No pending emails across all accounts.");
        }
        return String.join("\n", lines);
    }

    public static String formatAge(Instant since, Instant now) {
        if (since == null) {
            return "unknown";
        }
        long minutes = Math.max(0L, Duration.between(since, now).toMinutes());
        if (minutes < 60) {
            return minutes + "m ago";
        }
        long hours = minutes / 60;
        if (hours < 24) {
            return hours + "h ago";
        }
        return (hours / 24) + "d ago";
    }

    private static List<WorklistEntry> withStatus(List<WorklistEntry> entries, EntryStatus status) {
        return entries.stream().filter(entry -> entry.status() == status).toList();
    }
}

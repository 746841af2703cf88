package io.maildigest.model;

import io.maildigest.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

final class WorklistEntryTest {
    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final MessageRecord EMAIL = new MessageRecord("m1", "t1", "me@example.com", "ann@example.com",
            "me@example.com", "Quarterly numbers", "2026-10-19", "body", 2, true);

    @Test
    void lowImportanceNeverEntersWorklist() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WorklistEntry.fromVerdict(EMAIL, new Verdict("m1", Importance.LOW, "promo", false), NOW));
    }

    @Test
    void lifecycleCopiesKeepEarlierTimestamps() {
        WorklistEntry entry = WorklistEntry.fromVerdict(EMAIL, new Verdict("m1", Importance.HIGH, "board", true), NOW);
        Assertions.assertEquals(EntryStatus.NEW, entry.status());
        Assertions.assertEquals(NOW, entry.firstSeenAt());

        WorklistEntry surfaced = entry.withSurfaced(NOW.plus(Duration.ofMinutes(1)));
        WorklistEntry deferred = surfaced.withDeferred(NOW.plus(Duration.ofHours(1)));
        WorklistEntry back = deferred.withExpiredDeferral();
        WorklistEntry dismissed = back.withDismissed(NOW.plus(Duration.ofHours(2)), " ");

        Assertions.assertEquals(EntryStatus.NEW, back.status());
        Assertions.assertNull(back.deferredUntil());
        Assertions.assertEquals(surfaced.surfacedAt(), dismissed.surfacedAt());
        Assertions.assertEquals(NOW, dismissed.firstSeenAt());
        Assertions.assertNull(dismissed.dismissReason());
        Assertions.assertTrue(dismissed.status().terminal());
    }

    @Test
    void ledgerAndVerdictKeepNotifyWireName() throws Exception {
        Verdict verdict = new Verdict("m1", Importance.HIGH, "board", true);
        LedgerEntry entry = LedgerEntry.of(EMAIL, verdict, NOW);
        String line = Jsons.toCompactJson(entry);

        Assertions.assertTrue(line.contains("\"notify\":true"));
        Assertions.assertTrue(Jsons.compactMapper().readValue(line, LedgerEntry.class).notifyUser());
        Assertions.assertEquals(verdict,
                Jsons.compactMapper().readValue("{\"id\":\"m1\",\"importance\":\"high\",\"reason\":\"board\",\"notify\":true}",
                        Verdict.class));
    }

    @Test
    void wireNamesAreLowerCase() throws Exception {
        WorklistEntry entry = WorklistEntry.fromVerdict(EMAIL, new Verdict("m1", Importance.MEDIUM, "r", false), NOW);
        String json = Jsons.toCompactJson(entry);

        Assertions.assertTrue(json.contains("\"importance\":\"medium\""));
        Assertions.assertTrue(json.contains("\"status\":\"new\""));
        Assertions.assertTrue(json.contains("\"notify\":false"));
        Assertions.assertFalse(json.contains("notifyUser"));
        Assertions.assertTrue(json.contains("\"firstSeenAt\":\"2026-10-19T12:00:00Z\""));
        Assertions.assertEquals(entry, Jsons.compactMapper().readValue(json, WorklistEntry.class));
        Assertions.assertEquals(Importance.HIGH, Importance.fromString(" HIGH "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> EntryStatus.fromString("archived"));
    }
}

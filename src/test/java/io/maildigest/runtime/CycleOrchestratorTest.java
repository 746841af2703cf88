package io.maildigest.runtime;

import io.maildigest.judge.Classifier;
import io.maildigest.model.Checkpoint;
import io.maildigest.model.EntryStatus;
import io.maildigest.model.Importance;
import io.maildigest.model.LedgerEntry;
import io.maildigest.model.MessageRecord;
import io.maildigest.model.Verdict;
import io.maildigest.model.WorklistEntry;
import io.maildigest.notify.Notifier;
import io.maildigest.observability.AuditLogger;
import io.maildigest.source.MessageBatch;
import io.maildigest.source.RawMessage;
import io.maildigest.source.RawThread;
import io.maildigest.source.SourceSynchronizer;
import io.maildigest.storage.CheckpointStore;
import io.maildigest.storage.EventLedger;
import io.maildigest.storage.WorklistStore;
import io.maildigest.support.MutableClock;
import io.maildigest.support.ScriptedGateway;
import io.maildigest.support.TestDirs;
import io.maildigest.text.MarkupBodyCleaner;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class CycleOrchestratorTest {
    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final String ME = "me@example.com";
    private static final String WORK = "work@example.com";

    @Test
    void rejectedCursorRescanKeepsCursorAndTracksMediumMessage() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-rescan-");
        try {
            Harness h = new Harness(root, List.of(ME));
            h.seedCursor(ME, "H1");
            h.gateway.rejectCursor(ME)
                    .recent(ME, ScriptedGateway.batch(ScriptedGateway.message("m1", "t1", "ann@example.com")));
            h.verdicts.put("m1", new Verdict("m1", Importance.MEDIUM, "invoice", false));

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(1, outcome.newMessages());
            Assertions.assertEquals(1, outcome.addedToWorklist());
            Assertions.assertEquals(0, outcome.notified());
            Assertions.assertEquals(EntryStatus.NEW, h.reloadWorklist().get("m1").orElseThrow().status());
            Assertions.assertEquals(1, h.ledger.readAll().size());
            Assertions.assertTrue(h.pushes.isEmpty());
            Checkpoint checkpoint = h.reloadCheckpoints().get(ME).orElseThrow();
            Assertions.assertEquals("H1", checkpoint.cursor());
            Assertions.assertEquals(0, checkpoint.consecutiveFailures());
            Assertions.assertEquals(NOW, h.reloadCheckpoints().lastClassifierRunAt().orElseThrow());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void newCursorFromSourceIsAdopted() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-cursor-");
        try {
            Harness h = new Harness(root, List.of(ME));
            h.seedCursor(ME, "H1");
            h.gateway.changes(ME, new MessageBatch(List.of(), "H2"));

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(List.of(ME), outcome.accountsSynced());
            Assertions.assertEquals("H2", h.reloadCheckpoints().get(ME).orElseThrow().cursor());
            Assertions.assertTrue(h.classifiedBatches.isEmpty());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void ownerReplyDropsMessageBeforeClassification() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-reply-");
        try {
            Harness h = new Harness(root, List.of(ME));
            h.gateway.recent(ME, ScriptedGateway.batch(ScriptedGateway.message("m1", "t1", "ann@example.com")))
                    .thread(new RawThread("t1", List.of(
                            ScriptedGateway.message("m1", "t1", "ann@example.com"),
                            ScriptedGateway.message("r1", "t1", "Me <me@example.com>"))));

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(0, outcome.newMessages());
            Assertions.assertTrue(h.classifiedBatches.isEmpty());
            Assertions.assertTrue(h.ledger.readAll().isEmpty());
            Assertions.assertEquals(0, h.reloadWorklist().size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void repeatedFailuresAlertOnEveryCycleAtThreshold() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-alerts-");
        try {
            Harness h = new Harness(root, List.of(ME, WORK));
            h.seedCursor(ME, "H1");
            h.gateway.failAccount(ME)
                    .recent(WORK, ScriptedGateway.batch(ScriptedGateway.message("w1", "tw1", "boss@example.com")));
            CycleOrchestrator orchestrator = h.orchestrator();

            List<Integer> alertsPerCycle = new ArrayList<>();
            for (int cycle = 1; cycle <= 5; cycle++) {
                CycleOutcome outcome = orchestrator.runCycle();
                alertsPerCycle.add(outcome.alertsSent());
                Assertions.assertEquals(List.of(ME), outcome.accountsFailed());
                Assertions.assertEquals(List.of(WORK), outcome.accountsSynced());
            }

            Assertions.assertEquals(List.of(0, 0, 1, 1, 1), alertsPerCycle);
            Assertions.assertEquals(List.of(
                    CycleOrchestrator.failureAlert(ME, 3),
                    CycleOrchestrator.failureAlert(ME, 4),
                    CycleOrchestrator.failureAlert(ME, 5)
            ), h.pushes);
            Checkpoint checkpoint = h.reloadCheckpoints().get(ME).orElseThrow();
            Assertions.assertEquals("H1", checkpoint.cursor());
            Assertions.assertEquals(5, checkpoint.consecutiveFailures());
            Assertions.assertEquals(1, h.ledger.readAll().size());

            h.gateway.healAccount(ME);
            orchestrator.runCycle();
            Assertions.assertEquals(0, h.reloadCheckpoints().get(ME).orElseThrow().consecutiveFailures());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void alreadyRecordedIdsAreNeverReclassified() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-dedup-");
        try {
            Harness h = new Harness(root, List.of(ME, WORK));
            WorklistStore seeded = new WorklistStore(h.worklistFile, h.clock);
            seeded.add(WorklistEntry.fromVerdict(record("w0", WORK),
                    new Verdict("w0", Importance.HIGH, "seeded", false), NOW));
            seeded.save();
            RawMessage shared = ScriptedGateway.message("m1", "t1", "ann@example.com");
            h.gateway.recent(ME, ScriptedGateway.batch(shared))
                    .recent(WORK, ScriptedGateway.batch(shared, ScriptedGateway.message("w0", "tw0", "x@example.com")));
            h.verdicts.put("m1", new Verdict("m1", Importance.LOW, "promo", false));
            CycleOrchestrator orchestrator = h.orchestrator();

            CycleOutcome first = orchestrator.runCycle();
            CycleOutcome second = orchestrator.runCycle();

            Assertions.assertEquals(1, first.classified());
            Assertions.assertEquals(0, first.addedToWorklist());
            Assertions.assertEquals(0, second.newMessages());
            Assertions.assertEquals(1, h.classifiedBatches.size());
            Assertions.assertEquals(List.of("m1"), h.classifiedBatches.get(0));
            Assertions.assertEquals(List.of("m1"), h.ledger.readAll().stream().map(LedgerEntry::messageId).toList());
            Assertions.assertEquals("seeded", h.reloadWorklist().get("w0").orElseThrow().reason());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void quietCycleStillPersistsExpiryAndAutoResolve() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-quiet-");
        try {
            Harness h = new Harness(root, List.of(ME));
            WorklistStore seeded = new WorklistStore(h.worklistFile, h.clock);
            seeded.add(WorklistEntry.fromVerdict(record("d1", ME), new Verdict("d1", Importance.HIGH, "r", false), NOW));
            seeded.add(WorklistEntry.fromVerdict(record("s1", ME), new Verdict("s1", Importance.MEDIUM, "r", false), NOW));
            seeded.defer("d1", 30);
            seeded.markSurfaced("s1");
            seeded.save();
            h.gateway.thread(new RawThread("t-s1", List.of(ScriptedGateway.message("r1", "t-s1", ME))));
            h.clock.advance(Duration.ofMinutes(31));

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(1, outcome.expiredDeferrals());
            Assertions.assertEquals(1, outcome.autoResolved());
            Assertions.assertEquals(0, outcome.newMessages());
            WorklistStore reloaded = h.reloadWorklist();
            Assertions.assertEquals(EntryStatus.NEW, reloaded.get("d1").orElseThrow().status());
            Assertions.assertEquals(EntryStatus.HANDLED, reloaded.get("s1").orElseThrow().status());
            Assertions.assertTrue(h.reloadCheckpoints().lastClassifierRunAt().isEmpty());
            Assertions.assertTrue(h.reloadCheckpoints().get(ME).isPresent());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void consumerActionsSavedDuringCycleSurviveIt() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-concurrent-");
        try {
            Harness h = new Harness(root, List.of(ME));
            WorklistStore seeded = new WorklistStore(h.worklistFile, h.clock);
            seeded.add(WorklistEntry.fromVerdict(record("m0", ME), new Verdict("m0", Importance.MEDIUM, "r", false), NOW));
            seeded.add(WorklistEntry.fromVerdict(record("d1", ME), new Verdict("d1", Importance.HIGH, "r", false), NOW));
            seeded.defer("d1", 30);
            seeded.save();
            h.clock.advance(Duration.ofMinutes(31));
            h.gateway.recent(ME, ScriptedGateway.batch(ScriptedGateway.message("m1", "t1", "ann@example.com")));
            List<DigestActions.ActionOutcome> consumerOutcomes = new ArrayList<>();
            h.duringClassification = () -> {
                DigestActions other = new DigestActions(new WorklistStore(h.worklistFile, h.clock), h.audit, h.clock);
                consumerOutcomes.add(other.dismiss("m0", "not relevant"));
                consumerOutcomes.add(other.dismiss("d1", "seen elsewhere"));
            };

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(1, outcome.expiredDeferrals());
            Assertions.assertEquals(1, outcome.addedToWorklist());
            Assertions.assertTrue(consumerOutcomes.stream().allMatch(DigestActions.ActionOutcome::ok));
            WorklistStore reloaded = h.reloadWorklist();
            Assertions.assertEquals(EntryStatus.DISMISSED, reloaded.get("m0").orElseThrow().status());
            Assertions.assertEquals(EntryStatus.DISMISSED, reloaded.get("d1").orElseThrow().status());
            Assertions.assertEquals(EntryStatus.NEW, reloaded.get("m1").orElseThrow().status());
            Assertions.assertEquals(3, reloaded.size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void highImportanceWithNotifyIsPushed() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-push-");
        try {
            Harness h = new Harness(root, List.of(ME));
            h.gateway.recent(ME, ScriptedGateway.batch(
                    ScriptedGateway.message("m1", "t1", "ceo@example.com"),
                    ScriptedGateway.message("m2", "t2", "cfo@example.com")));
            h.verdicts.put("m1", new Verdict("m1", Importance.HIGH, "board meeting moved", true));
            h.verdicts.put("m2", new Verdict("m2", Importance.HIGH, "budget", false));

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(2, outcome.addedToWorklist());
            Assertions.assertEquals(1, outcome.notified());
            Assertions.assertEquals(1, h.pushes.size());
            String push = h.pushes.get(0);
            Assertions.assertTrue(push.startsWith("[MailDigest] New high-importance email:"));
            Assertions.assertTrue(push.contains("From: ceo@example.com"));
            Assertions.assertTrue(push.contains("Subject: Subject m1"));
            Assertions.assertTrue(push.contains("Account: " + ME));
            Assertions.assertTrue(push.contains("Reason: board meeting moved"));
            Assertions.assertTrue(push.contains("MessageID: m1"));
            Assertions.assertEquals(List.of("main"), h.pushTargets.stream().distinct().toList());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void notifierFailureDoesNotFailCycle() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-push-fail-");
        try {
            Harness h = new Harness(root, List.of(ME));
            h.notifierThrows = true;
            h.gateway.recent(ME, ScriptedGateway.batch(ScriptedGateway.message("m1", "t1", "ceo@example.com")));
            h.verdicts.put("m1", new Verdict("m1", Importance.HIGH, "urgent", true));

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(0, outcome.notified());
            Assertions.assertTrue(h.reloadWorklist().has("m1"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void largeBacklogIsClassifiedInBatches() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-batches-");
        try {
            Harness h = new Harness(root, List.of(ME));
            List<RawMessage> messages = new ArrayList<>();
            for (int i = 1; i <= 12; i++) {
                messages.add(ScriptedGateway.message("m" + i, "t" + i, "sender" + i + "@example.com"));
            }
            h.gateway.recent(ME, new MessageBatch(messages, null));

            CycleOutcome outcome = h.orchestrator().runCycle();

            Assertions.assertEquals(12, outcome.classified());
            Assertions.assertEquals(2, h.classifiedBatches.size());
            Assertions.assertEquals(10, h.classifiedBatches.get(0).size());
            Assertions.assertEquals(List.of("m11", "m12"), h.classifiedBatches.get(1));
            Assertions.assertEquals(12, h.ledger.readAll().size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void shortClassifierAnswerFailsOpenForMissingTail() throws Exception {
        Path root = Files.createTempDirectory("maildigest-cycle-short-");
        try {
            Harness h = new Harness(root, List.of(ME));
            h.gateway.recent(ME, ScriptedGateway.batch(
                    ScriptedGateway.message("m1", "t1", "a@example.com"),
                    ScriptedGateway.message("m2", "t2", "b@example.com")));
            h.dropLastVerdict = true;

            h.orchestrator().runCycle();

            WorklistEntry m2 = h.reloadWorklist().get("m2").orElseThrow();
            Assertions.assertEquals(Importance.HIGH, m2.importance());
            Assertions.assertTrue(m2.notifyUser());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void optionsRejectNonPositiveValues() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new CycleOrchestrator.Options(0, 3, 4, "main", 1_000L));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new CycleOrchestrator.Options(10, 0, 4, "main", 1_000L));
    }

    private static MessageRecord record(String id, String account) {
        return new MessageRecord(id, "t-" + id, account, "sender@example.com", account,
                "Subject " + id, "2026-10-19", "body", 1, false);
    }

    private static final class Harness {
        private final MutableClock clock = new MutableClock(NOW);
        private final ScriptedGateway gateway = new ScriptedGateway();
        private final Map<String, Verdict> verdicts = new HashMap<>();
        private final List<List<String>> classifiedBatches = new ArrayList<>();
        private final List<String> pushes = new ArrayList<>();
        private final List<String> pushTargets = new ArrayList<>();
        private final List<String> accounts;
        private final Path worklistFile;
        private final Path checkpointFile;
        private final EventLedger ledger;
        private final AuditLogger audit;
        private boolean notifierThrows;
        private boolean dropLastVerdict;
        private Runnable duringClassification = () -> { };

        private Harness(Path root, List<String> accounts) {
            this.accounts = accounts;
            this.worklistFile = root.resolve("digest.json");
            this.checkpointFile = root.resolve("state.json");
            this.ledger = new EventLedger(root.resolve("emails.jsonl"), clock);
            this.audit = new AuditLogger(root.resolve("audit/activity.log"), clock);
        }

        private void seedCursor(String account, String cursor) {
            CheckpointStore store = new CheckpointStore(checkpointFile, clock);
            store.recordSuccess(account, cursor);
            store.save();
        }

        private CycleOrchestrator orchestrator() {
            SourceSynchronizer syncer = new SourceSynchronizer(gateway, new MarkupBodyCleaner(), accounts,
                    7, 3000, clock, audit);
            Classifier classifier = batch -> {
                classifiedBatches.add(batch.stream().map(MessageRecord::id).toList());
                duringClassification.run();
                List<Verdict> out = new ArrayList<>();
                for (MessageRecord email : batch) {
                    out.add(verdicts.getOrDefault(email.id(),
                            new Verdict(email.id(), Importance.MEDIUM, "default", false)));
                }
                return dropLastVerdict ? out.subList(0, out.size() - 1) : out;
            };
            Notifier notifier = (target, message, timeoutMs) -> {
                if (notifierThrows) {
                    throw new IllegalStateException("notify channel down");
                }
                pushTargets.add(target);
                pushes.add(message);
                return true;
            };
            return new CycleOrchestrator(
                    accounts,
                    syncer,
                    classifier,
                    new WorklistStore(worklistFile, clock),
                    ledger,
                    new CheckpointStore(checkpointFile, clock),
                    notifier,
                    audit,
                    clock,
                    new CycleOrchestrator.Options(10, 3, 4, "main", 1_000L)
            );
        }

        private WorklistStore reloadWorklist() {
            WorklistStore store = new WorklistStore(worklistFile, clock);
            store.load();
            return store;
        }

        private CheckpointStore reloadCheckpoints() {
            CheckpointStore store = new CheckpointStore(checkpointFile, clock);
            store.load();
            return store;
        }
    }
}

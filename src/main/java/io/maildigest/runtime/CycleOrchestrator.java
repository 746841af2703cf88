package io.maildigest.runtime;

import io.maildigest.judge.Classifier;
import io.maildigest.model.Checkpoint;
import io.maildigest.model.LedgerEntry;
import io.maildigest.model.MessageRecord;
import io.maildigest.model.Verdict;
import io.maildigest.model.WorklistEntry;
import io.maildigest.notify.Notifier;
import io.maildigest.observability.AuditLogger;
import io.maildigest.source.AccountSyncer;
import io.maildigest.source.SourceException;
import io.maildigest.source.SyncResult;
import io.maildigest.storage.CheckpointStore;
import io.maildigest.storage.EventLedger;
import io.maildigest.storage.WorklistStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one poll cycle: expire deferrals, auto-resolve answered threads, sync
 * every account, classify what is new, fan verdicts out and persist.
 *
 * <p>Account fetches run concurrently; everything that touches the ledger,
 * worklist or checkpoints happens on the calling thread. A failing account
 * never stops the others, and classification never fails the cycle. Only a
 * persistence error propagates.
 *
 * <p>The worklist loaded at the start is only a working copy. The cycle's own
 * changes (expiries, auto-resolutions, new entries) are recorded and replayed
 * onto a fresh read of the file under the worklist write lock, so consumer
 * actions saved while the cycle ran survive it.
 */
public final class CycleOrchestrator {
    private final List<String> accounts;
    private final AccountSyncer syncer;
    private final Classifier classifier;
    private final WorklistStore worklist;
    private final EventLedger ledger;
    private final CheckpointStore checkpoints;
    private final Notifier notifier;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Options options;

    public CycleOrchestrator(
            List<String> accounts,
            AccountSyncer syncer,
            Classifier classifier,
            WorklistStore worklist,
            EventLedger ledger,
            CheckpointStore checkpoints,
            Notifier notifier,
            AuditLogger auditLogger,
            Clock clock,
            Options options
    ) {
        this.accounts = List.copyOf(accounts);
        this.syncer = syncer;
        this.classifier = classifier;
        this.worklist = worklist;
        this.ledger = ledger;
        this.checkpoints = checkpoints;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.options = options;
    }

    public CycleOutcome runCycle() {
        Instant startedAt = clock.instant();
        checkpoints.load();
        worklist.load();
        List<Consumer<WorklistStore>> changes = new ArrayList<>();

        List<WorklistEntry> expired = worklist.expireDeferrals();
        changes.add(WorklistStore::expireDeferrals);
        if (!expired.isEmpty()) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "digest.deferral.expired",
                    "cycle",
                    "digest",
                    "ok",
                    Map.of("count", expired.size(), "ids", expired.stream().map(WorklistEntry::id).toList())
            ));
        }
        int autoResolved = resolveActiveEntries(changes);

        Set<String> ledgerIds = ledger.knownIds();
        Map<String, AccountFetch> fetches = fetchAll(ledgerIds);

        List<MessageRecord> fresh = new ArrayList<>();
        Set<String> queued = new HashSet<>();
        List<String> synced = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int alertsSent = 0;
        for (String account : accounts) {
            AccountFetch fetch = fetches.get(account);
            if (fetch.error() == null) {
                SyncResult result = fetch.result();
                int before = fresh.size();
                for (MessageRecord message : result.messages()) {
                    if (!ledgerIds.contains(message.id()) && !worklist.has(message.id()) && queued.add(message.id())) {
                        fresh.add(message);
                    }
                }
                String prior = checkpoints.get(account).map(Checkpoint::cursor).orElse(null);
                checkpoints.recordSuccess(account, result.cursor() != null ? result.cursor() : prior);
                synced.add(account);
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "source.sync",
                        "cycle",
                        "account/" + account,
                        "ok",
                        Map.of(
                                "fetched", result.messages().size(),
                                "new", fresh.size() - before,
                                "rescanned", result.rescanned()
                        )
                ));
            } else {
                int failures = checkpoints.recordFailure(account);
                failed.add(account);
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "source.sync",
                        "cycle",
                        "account/" + account,
                        "failed",
                        Map.of("consecutive_failures", failures, "error", String.valueOf(fetch.error().getMessage()))
                ));
                if (failures >= options.alertThreshold()) {
                    push("source.alert", "account/" + account, failureAlert(account, failures));
                    alertsSent++;
                }
            }
        }

        if (fresh.isEmpty()) {
            persist(changes);
            return outcome(startedAt, expired.size(), autoResolved, synced, failed, 0, 0, 0, 0, alertsSent);
        }

        checkpoints.markClassifierRun();
        int classified = 0;
        int added = 0;
        int notified = 0;
        for (int i = 0; i < fresh.size(); i += options.batchSize()) {
            List<MessageRecord> batch = fresh.subList(i, Math.min(fresh.size(), i + options.batchSize()));
            List<Verdict> verdicts = classifier.classify(batch);
            for (int j = 0; j < batch.size(); j++) {
                MessageRecord email = batch.get(j);
                Verdict verdict = j < verdicts.size()
                        ? verdicts.get(j)
                        : Verdict.failOpen(email.id(), "missing from classifier response (fail open)");
                Instant now = clock.instant();
                ledger.append(LedgerEntry.of(email, verdict, now));
                classified++;
                if (!verdict.importance().tracked()) {
                    continue;
                }
                WorklistEntry entry = WorklistEntry.fromVerdict(email, verdict, now);
                worklist.add(entry);
                changes.add(store -> {
                    if (!store.has(entry.id())) {
                        store.add(entry);
                    }
                });
                added++;
                if (verdict.shouldPush()
                        && push("digest.push", "message/" + email.id(), pushMessage(email, verdict))) {
                    notified++;
                }
            }
        }

        persist(changes);
        return outcome(startedAt, expired.size(), autoResolved, synced, failed,
                fresh.size(), classified, added, notified, alertsSent);
    }

    private int resolveActiveEntries(List<Consumer<WorklistStore>> changes) {
        int resolved = 0;
        for (WorklistEntry entry : worklist.getActiveEntries()) {
            try {
                if (syncer.threadHasOwnerReply(entry.threadId(), entry.account())) {
                    worklist.markHandled(entry.id());
                    changes.add(store -> store.get(entry.id())
                            .filter(current -> current.status() != null && current.status().active())
                            .ifPresent(current -> store.markHandled(current.id())));
                    resolved++;
                    auditLogger.log(AuditLogger.AuditEvent.of(
                            "digest.auto_resolve",
                            "cycle",
                            "message/" + entry.id(),
                            "handled",
                            Map.of("account", entry.account(), "thread_id", String.valueOf(entry.threadId()))
                    ));
                }
            } catch (SourceException | RuntimeException e) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "digest.auto_resolve",
                        "cycle",
                        "message/" + entry.id(),
                        "skipped",
                        Map.of("error", String.valueOf(e.getMessage()))
                ));
            }
        }
        return resolved;
    }

    private Map<String, AccountFetch> fetchAll(Set<String> ledgerIds) {
        Map<String, AccountFetch> out = new LinkedHashMap<>();
        if (accounts.isEmpty()) {
            return out;
        }
        Map<String, String> cursors = new LinkedHashMap<>();
        for (String account : accounts) {
            cursors.put(account, checkpoints.get(account).map(Checkpoint::cursor).orElse(null));
        }
        Set<String> known = Set.copyOf(ledgerIds);
        int threads = Math.max(1, Math.min(options.syncParallelism(), accounts.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, syncThreadFactory());
        try {
            Map<String, Future<SyncResult>> futures = new LinkedHashMap<>();
            for (String account : accounts) {
                futures.put(account, pool.submit(() -> syncer.syncAccount(account, cursors.get(account), known)));
            }
            for (Map.Entry<String, Future<SyncResult>> future : futures.entrySet()) {
                out.put(future.getKey(), await(future.getValue()));
            }
        } finally {
            pool.shutdownNow();
        }
        return out;
    }

    private static AccountFetch await(Future<SyncResult> future) {
        try {
            return new AccountFetch(future.get(), null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return new AccountFetch(null, cause instanceof Exception ex ? ex : new RuntimeException(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new AccountFetch(null, e);
        }
    }

    private boolean push(String action, String resource, String message) {
        boolean delivered;
        String error = "";
        try {
            delivered = notifier.notify(options.notifyTarget(), message, options.notifyTimeoutMs());
        } catch (RuntimeException e) {
            delivered = false;
            error = String.valueOf(e.getMessage());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                "cycle",
                resource,
                delivered ? "delivered" : "failed",
                error.isEmpty() ? Map.of() : Map.of("error", error)
        ));
        return delivered;
    }

    private void persist(List<Consumer<WorklistStore>> changes) {
        worklist.update(store -> {
            changes.forEach(change -> change.accept(store));
            return null;
        });
        checkpoints.save();
    }

    private CycleOutcome outcome(
            Instant startedAt,
            int expired,
            int autoResolved,
            List<String> synced,
            List<String> failed,
            int fresh,
            int classified,
            int added,
            int notified,
            int alerts
    ) {
        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        return new CycleOutcome(startedAt, expired, autoResolved, List.copyOf(synced), List.copyOf(failed),
                fresh, classified, added, notified, alerts, durationMs);
    }

    static String pushMessage(MessageRecord email, Verdict verdict) {
        return String.join("\n",
                "[MailDigest] New high-importance email:",
                "From: " + email.from(),
                "Subject: " + email.subject(),
                "Account: " + email.account(),
                "Date: " + email.date(),
                "Reason: " + verdict.reason(),
                "MessageID: " + email.id(),
                "",
                "Use defer to postpone or handled when resolved."
        );
    }

    static String failureAlert(String account, int failures) {
        return "[MailDigest] Mail polling has failed " + failures + " times in a row for " + account
                + ". Likely auth token expiry; please re-authenticate the mail gateway.";
    }

    private static ThreadFactory syncThreadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "maildigest-sync-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record AccountFetch(SyncResult result, Exception error) {
    }

    public record Options(
            int batchSize,
            int alertThreshold,
            int syncParallelism,
            String notifyTarget,
            long notifyTimeoutMs
    ) {
        public Options {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            if (alertThreshold <= 0) {
                throw new IllegalArgumentException("alertThreshold must be positive");
            }
        }
    }
}

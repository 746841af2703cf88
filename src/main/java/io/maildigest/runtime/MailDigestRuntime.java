package io.maildigest.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.maildigest.config.DigestSettings;
import io.maildigest.config.MailDigestConfig;
import io.maildigest.judge.CommandJudgmentEngine;
import io.maildigest.judge.JudgmentBatcher;
import io.maildigest.judge.JudgmentEngine;
import io.maildigest.judge.JudgmentException;
import io.maildigest.model.Checkpoint;
import io.maildigest.notify.CommandNotifier;
import io.maildigest.notify.Notifier;
import io.maildigest.observability.AuditLogger;
import io.maildigest.source.GogGateway;
import io.maildigest.source.SourceGateway;
import io.maildigest.source.SourceSynchronizer;
import io.maildigest.storage.CheckpointStore;
import io.maildigest.storage.EventLedger;
import io.maildigest.storage.WorklistStore;
import io.maildigest.text.MarkupBodyCleaner;
import io.maildigest.util.CommandRunner;
import io.maildigest.util.ProcessCommandRunner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Composes the stores, collaborators and cycle for one data root. Each CLI
 * invocation builds its own instance; nothing here is process-global.
 */
public final class MailDigestRuntime {
    private final MailDigestConfig config;
    private final DigestSettings settings;
    private final Clock clock;
    private final AuditLogger auditLogger;
    private final EventLedger ledger;
    private final CheckpointStore checkpoints;
    private final WorklistStore worklist;
    private final CycleOrchestrator orchestrator;
    private final DigestActions actions;

    public MailDigestRuntime(MailDigestConfig config) {
        this(config, DigestSettings.load(config.settingsFile()), Clock.systemUTC(), new ProcessCommandRunner());
    }

    private MailDigestRuntime(MailDigestConfig config, DigestSettings settings, Clock clock, CommandRunner runner) {
        this(
                config,
                settings,
                new GogGateway(runner, settings.gatewayExecutable(), settings.gatewayTimeoutMs()),
                judgmentEngine(runner, settings.classifierCommand()),
                notifier(runner, settings.notifyCommand()),
                clock
        );
    }

    public MailDigestRuntime(
            MailDigestConfig config,
            DigestSettings settings,
            SourceGateway gateway,
            JudgmentEngine engine,
            Notifier notifier,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.ledger = new EventLedger(config.ledgerFile(), clock);
        this.checkpoints = new CheckpointStore(config.checkpointFile(), clock);
        this.worklist = new WorklistStore(config.worklistFile(), clock);
        SourceSynchronizer synchronizer = new SourceSynchronizer(
                gateway,
                new MarkupBodyCleaner(),
                settings.accounts(),
                settings.rescanDays(),
                settings.bodyMaxLength(),
                clock,
                auditLogger
        );
        this.orchestrator = new CycleOrchestrator(
                settings.accounts(),
                synchronizer,
                new JudgmentBatcher(engine, settings.classifierTimeoutMs(), auditLogger),
                worklist,
                ledger,
                checkpoints,
                notifier,
                auditLogger,
                clock,
                new CycleOrchestrator.Options(
                        settings.batchSize(),
                        settings.consecutiveFailuresBeforeAlert(),
                        settings.syncParallelism(),
                        settings.notifyTarget(),
                        settings.notifyTimeoutMs()
                )
        );
        // Consumer actions get their own store so a reload never swaps out the cycle's working copy.
        this.actions = new DigestActions(new WorklistStore(config.worklistFile(), clock), auditLogger, clock);
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize directories", e);
        }
        worklist.load();
        checkpoints.load();
    }

    public DigestSettings settings() {
        return settings;
    }

    public CycleOutcome pollOnce() {
        return orchestrator.runCycle();
    }

    /**
     * One clock tick: a full cycle, then ledger rotation while no cycle is
     * running.
     */
    void tick() {
        CycleOutcome outcome = orchestrator.runCycle();
        int removed = ledger.rotate(settings.ledgerMaxEntries());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "cycle.complete",
                "clock",
                "cycle",
                outcome.accountsFailed().isEmpty() ? "ok" : "partial",
                Map.of(
                        "new", outcome.newMessages(),
                        "added", outcome.addedToWorklist(),
                        "notified", outcome.notified(),
                        "failed_accounts", outcome.accountsFailed(),
                        "ledger_rotated", removed,
                        "duration_ms", outcome.durationMs()
                )
        ));
    }

    public AdaptiveClock newClock() {
        return new AdaptiveClock(
                new PollIntervals(settings.activeInterval(), settings.inactiveInterval()),
                new ActiveWindow(settings.activeStartHour(), settings.activeEndHour(), settings.zoneId()),
                clock,
                this::tick,
                error -> auditLogger.log(AuditLogger.AuditEvent.of(
                        "cycle.complete",
                        "clock",
                        "cycle",
                        "failed",
                        Map.of("error", String.valueOf(error.getMessage()))
                ))
        );
    }

    public int rotateLedger(int maxEntries) {
        int limit = maxEntries > 0 ? maxEntries : settings.ledgerMaxEntries();
        int removed = ledger.rotate(limit);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "ledger.rotate",
                "cli",
                "ledger",
                "ok",
                Map.of("max_entries", limit, "removed", removed)
        ));
        return removed;
    }

    public DigestActions actions() {
        return actions;
    }

    public String statusReport() {
        WorklistStore current = new WorklistStore(config.worklistFile(), clock);
        current.load();
        return DigestReport.render(current, clock.instant(), settings.zoneId());
    }

    public Map<String, Checkpoint> checkpoints() {
        return checkpoints.snapshot();
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    private static JudgmentEngine judgmentEngine(CommandRunner runner, List<String> command) {
        if (command == null || command.isEmpty()) {
            return (prompt, timeoutMs) -> {
                throw new JudgmentException("no classifierCommand configured");
            };
        }
        return new CommandJudgmentEngine(runner, command);
    }

    private static Notifier notifier(CommandRunner runner, List<String> command) {
        if (command == null || command.isEmpty()) {
            return (target, message, timeoutMs) -> false;
        }
        return new CommandNotifier(runner, command);
    }
}

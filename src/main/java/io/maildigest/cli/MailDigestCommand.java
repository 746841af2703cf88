package io.maildigest.cli;

import io.maildigest.config.MailDigestConfig;
import io.maildigest.runtime.AdaptiveClock;
import io.maildigest.runtime.CycleOutcome;
import io.maildigest.runtime.DigestActions;
import io.maildigest.runtime.MailDigestRuntime;
import io.maildigest.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "maildigest",
        mixinStandardHelpOptions = true,
        description = "Polls mail accounts and keeps a digest of important unresolved email",
        subcommands = {
                MailDigestCommand.InitCommand.class,
                MailDigestCommand.PollCommand.class,
                MailDigestCommand.RunCommand.class,
                MailDigestCommand.DigestCommand.class,
                MailDigestCommand.DeferCommand.class,
                MailDigestCommand.DismissCommand.class,
                MailDigestCommand.HandledCommand.class,
                MailDigestCommand.StatusCommand.class,
                MailDigestCommand.CheckpointsCommand.class,
                MailDigestCommand.LedgerRotateCommand.class,
                MailDigestCommand.AuditTailCommand.class
        }
)
public final class MailDigestCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = MailDigestConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | poll | run | digest | defer | dismiss | handled | status | checkpoints | ledger-rotate | audit-tail");
    }

    MailDigestRuntime runtime() {
        MailDigestRuntime runtime = new MailDigestRuntime(MailDigestConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static int exitCode(boolean ok) {
        return ok ? 0 : 1;
    }

    @Command(name = "init", description = "Create the data root")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Override
        public Integer call() {
            parent.runtime();
            System.out.println("Initialized MailDigest at: " + MailDigestConfig.fromRoot(parent.root).rootDir());
            return 0;
        }
    }

    @Command(name = "poll", description = "Run a single poll cycle across all accounts")
    static final class PollCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Override
        public Integer call() {
            CycleOutcome outcome = parent.runtime().pollOnce();
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "run", description = "Poll continuously on the adaptive schedule until stopped")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Override
        public Integer call() throws Exception {
            MailDigestRuntime runtime = parent.runtime();
            AdaptiveClock clock = runtime.newClock();
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!clock.stop()) {
                    System.err.println("MailDigest stopped while a poll cycle was still running");
                }
                stopped.countDown();
            }, "maildigest-shutdown-hook"));
            clock.start();
            System.out.println("MailDigest polling " + runtime.settings().accounts().size() + " account(s)");
            stopped.await();
            return 0;
        }
    }

    @Command(name = "digest", description = "Show digest entries and mark new ones as surfaced")
    static final class DigestCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Option(names = {"--status"}, defaultValue = "new", description = "new|surfaced|deferred|all")
        String status;

        @Option(names = {"--account"}, description = "Only this account")
        String account;

        @Override
        public Integer call() {
            DigestActions.DigestView view = parent.runtime().actions().getDigest(status, account);
            System.out.println(Jsons.toJson(view));
            return exitCode(view.ok());
        }
    }

    @Command(name = "defer", description = "Hide an entry until the given number of minutes has passed")
    static final class DeferCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Option(names = {"--minutes"}, required = true, description = "Minutes until the entry re-surfaces")
        long minutes;

        @Override
        public Integer call() {
            DigestActions.ActionOutcome outcome = parent.runtime().actions().defer(messageId, minutes);
            System.out.println(Jsons.toJson(outcome));
            return exitCode(outcome.ok());
        }
    }

    @Command(name = "dismiss", description = "Permanently dismiss an entry")
    static final class DismissCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Option(names = {"--reason"}, description = "Optional reason")
        String reason;

        @Override
        public Integer call() {
            DigestActions.ActionOutcome outcome = parent.runtime().actions().dismiss(messageId, reason);
            System.out.println(Jsons.toJson(outcome));
            return exitCode(outcome.ok());
        }
    }

    @Command(name = "handled", description = "Mark an entry as handled")
    static final class HandledCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Override
        public Integer call() {
            DigestActions.ActionOutcome outcome = parent.runtime().actions().markHandled(messageId);
            System.out.println(Jsons.toJson(outcome));
            return exitCode(outcome.ok());
        }
    }

    @Command(name = "status", description = "Print a human-readable digest summary")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Override
        public Integer call() {
            System.out.println(parent.runtime().statusReport());
            return 0;
        }
    }

    @Command(name = "checkpoints", description = "Show per-account sync checkpoints")
    static final class CheckpointsCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().checkpoints()));
            return 0;
        }
    }

    @Command(name = "ledger-rotate", description = "Trim the message ledger to recent entries")
    static final class LedgerRotateCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Option(names = {"--max-entries"}, defaultValue = "0", description = "Entries to keep; 0 uses the configured limit")
        int maxEntries;

        @Override
        public Integer call() {
            int removed = parent.runtime().rotateLedger(maxEntries);
            System.out.println(Jsons.toJson(Map.of("removed", removed)));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest activity log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        MailDigestCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Number of lines")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().auditTail(limit)));
            return 0;
        }
    }
}

package io.maildigest.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class MailDigestConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final int DEFAULT_ACTIVE_INTERVAL_MINUTES = 5;
    public static final int DEFAULT_INACTIVE_INTERVAL_MINUTES = 30;
    public static final int DEFAULT_ACTIVE_START_HOUR = 9;
    public static final int DEFAULT_ACTIVE_END_HOUR = 18;
    public static final String DEFAULT_TIMEZONE = "UTC";
    public static final long DEFAULT_GATEWAY_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_CLASSIFIER_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_NOTIFY_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_FAILURES_BEFORE_ALERT = 3;
    public static final int DEFAULT_RESCAN_DAYS = 7;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_BODY_MAX_LENGTH = 3_000;
    public static final int DEFAULT_LEDGER_MAX_ENTRIES = 10_000;
    public static final int DEFAULT_SYNC_PARALLELISM = 4;

    private final Path rootDir;

    public MailDigestConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static MailDigestConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new MailDigestConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path ledgerFile() {
        return rootDir.resolve("emails.jsonl");
    }

    public Path checkpointFile() {
        return rootDir.resolve("state.json");
    }

    public Path worklistFile() {
        return rootDir.resolve("digest.json");
    }

    public Path settingsFile() {
        return rootDir.resolve("maildigest-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("activity.log");
    }
}

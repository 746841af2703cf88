package io.maildigest.config;

import io.maildigest.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Effective settings, resolved from {@code maildigest-settings.json} over the
 * built-in defaults. Any field absent from the file keeps its default.
 */
public record DigestSettings(
        List<String> accounts,
        int activeIntervalMinutes,
        int inactiveIntervalMinutes,
        int activeStartHour,
        int activeEndHour,
        String timezone,
        String gatewayExecutable,
        long gatewayTimeoutMs,
        List<String> classifierCommand,
        long classifierTimeoutMs,
        List<String> notifyCommand,
        String notifyTarget,
        long notifyTimeoutMs,
        int consecutiveFailuresBeforeAlert,
        int rescanDays,
        int batchSize,
        int bodyMaxLength,
        int ledgerMaxEntries,
        int syncParallelism
) {
    public static DigestSettings defaults() {
        return new DigestSettings(
                List.of(),
                MailDigestConfig.DEFAULT_ACTIVE_INTERVAL_MINUTES,
                MailDigestConfig.DEFAULT_INACTIVE_INTERVAL_MINUTES,
                MailDigestConfig.DEFAULT_ACTIVE_START_HOUR,
                MailDigestConfig.DEFAULT_ACTIVE_END_HOUR,
                MailDigestConfig.DEFAULT_TIMEZONE,
                "gog",
                MailDigestConfig.DEFAULT_GATEWAY_TIMEOUT_MS,
                List.of(),
                MailDigestConfig.DEFAULT_CLASSIFIER_TIMEOUT_MS,
                List.of(),
                "main",
                MailDigestConfig.DEFAULT_NOTIFY_TIMEOUT_MS,
                MailDigestConfig.DEFAULT_FAILURES_BEFORE_ALERT,
                MailDigestConfig.DEFAULT_RESCAN_DAYS,
                MailDigestConfig.DEFAULT_BATCH_SIZE,
                MailDigestConfig.DEFAULT_BODY_MAX_LENGTH,
                MailDigestConfig.DEFAULT_LEDGER_MAX_ENTRIES,
                MailDigestConfig.DEFAULT_SYNC_PARALLELISM
        );
    }

    public static DigestSettings load(Path file) {
        DigestSettings defaults = defaults();
        if (!Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load settings: " + file, e);
        }
    }

    static DigestSettings fromFile(SettingsFile file, DigestSettings defaults) {
        if (file == null) {
            return defaults;
        }
        DigestSettings resolved = new DigestSettings(
                file.accounts() == null ? defaults.accounts() : List.copyOf(file.accounts()),
                positive(file.activeIntervalMinutes(), defaults.activeIntervalMinutes()),
                positive(file.inactiveIntervalMinutes(), defaults.inactiveIntervalMinutes()),
                hour(file.activeStartHour(), defaults.activeStartHour()),
                hour(file.activeEndHour(), defaults.activeEndHour()),
                text(file.timezone(), defaults.timezone()),
                text(file.gatewayExecutable(), defaults.gatewayExecutable()),
                positive(file.gatewayTimeoutMs(), defaults.gatewayTimeoutMs()),
                file.classifierCommand() == null ? defaults.classifierCommand() : List.copyOf(file.classifierCommand()),
                positive(file.classifierTimeoutMs(), defaults.classifierTimeoutMs()),
                file.notifyCommand() == null ? defaults.notifyCommand() : List.copyOf(file.notifyCommand()),
                text(file.notifyTarget(), defaults.notifyTarget()),
                positive(file.notifyTimeoutMs(), defaults.notifyTimeoutMs()),
                positive(file.consecutiveFailuresBeforeAlert(), defaults.consecutiveFailuresBeforeAlert()),
                positive(file.rescanDays(), defaults.rescanDays()),
                positive(file.batchSize(), defaults.batchSize()),
                positive(file.bodyMaxLength(), defaults.bodyMaxLength()),
                positive(file.ledgerMaxEntries(), defaults.ledgerMaxEntries()),
                positive(file.syncParallelism(), defaults.syncParallelism())
        );
        resolved.zoneId();
        return resolved;
    }

    public ZoneId zoneId() {
        try {
            return ZoneId.of(timezone);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid timezone in settings: " + timezone, e);
        }
    }

    public Duration activeInterval() {
        return Duration.ofMinutes(activeIntervalMinutes);
    }

    public Duration inactiveInterval() {
        return Duration.ofMinutes(inactiveIntervalMinutes);
    }

    private static int positive(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static long positive(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    private static int hour(Integer value, int fallback) {
        return value == null || value < 0 || value > 24 ? fallback : value;
    }

    private static String text(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    record SettingsFile(
            List<String> accounts,
            Integer activeIntervalMinutes,
            Integer inactiveIntervalMinutes,
            Integer activeStartHour,
            Integer activeEndHour,
            String timezone,
            String gatewayExecutable,
            Long gatewayTimeoutMs,
            List<String> classifierCommand,
            Long classifierTimeoutMs,
            List<String> notifyCommand,
            String notifyTarget,
            Long notifyTimeoutMs,
            Integer consecutiveFailuresBeforeAlert,
            Integer rescanDays,
            Integer batchSize,
            Integer bodyMaxLength,
            Integer ledgerMaxEntries,
            Integer syncParallelism
    ) {
    }
}

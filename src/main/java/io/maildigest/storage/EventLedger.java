package io.maildigest.storage;

import io.maildigest.model.LedgerEntry;
import io.maildigest.util.AtomicFiles;
import io.maildigest.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only, line-delimited record of every classified message, used for
 * deduplication across cycles and for audit.
 *
 * <p>{@link #rotate(int)} rewrites the file and must only run between cycles.
 */
public final class EventLedger {
    public static final Duration RETENTION = Duration.ofDays(30);

    private final Path file;
    private final Clock clock;

    public EventLedger(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public synchronized void append(LedgerEntry entry) {
        String line = Jsons.toCompactJson(entry) + "\n";
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append ledger entry: " + entry.messageId(), e);
        }
    }

    public synchronized List<LedgerEntry> readAll() {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger: " + file, e);
        }
        List<LedgerEntry> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                LedgerEntry entry = Jsons.compactMapper().readValue(line, LedgerEntry.class);
                if (entry.messageId() != null) {
                    out.add(entry);
                }
            } catch (IOException | IllegalArgumentException ignored) {
                // A torn or hand-edited line carries no usable id; skip it.
            }
        }
        return out;
    }

    public boolean existsById(String messageId) {
        if (messageId == null) {
            return false;
        }
        return readAll().stream().anyMatch(entry -> messageId.equals(entry.messageId()));
    }

    public Set<String> knownIds() {
        Set<String> ids = new HashSet<>();
        for (LedgerEntry entry : readAll()) {
            ids.add(entry.messageId());
        }
        return ids;
    }

    /**
     * Keeps at most {@code maxEntries} of the most recent entries that are
     * also inside the retention window.
     *
     * @return number of entries removed
     */
    public synchronized int rotate(int maxEntries) {
        List<LedgerEntry> entries = readAll();
        if (entries.size() <= maxEntries) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(RETENTION);
        List<LedgerEntry> fresh = entries.stream()
                .filter(entry -> entry.timestamp() != null && !entry.timestamp().isBefore(cutoff))
                .toList();
        List<LedgerEntry> kept = fresh.size() > maxEntries
                ? fresh.subList(fresh.size() - Math.max(0, maxEntries), fresh.size())
                : fresh;
        StringBuilder content = new StringBuilder();
        for (LedgerEntry entry : kept) {
            content.append(Jsons.toCompactJson(entry)).append('\n');
        }
        AtomicFiles.write(file, content.toString());
        return entries.size() - kept.size();
    }
}

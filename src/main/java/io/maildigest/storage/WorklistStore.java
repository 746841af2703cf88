package io.maildigest.storage;

import io.maildigest.model.EntryStatus;
import io.maildigest.model.WorklistEntry;
import io.maildigest.util.AtomicFiles;
import io.maildigest.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Owns the digest worklist: entries keyed by message id plus their lifecycle
 * transitions.
 *
 * <p>Transitions here are raw mutations. They apply to whatever state the
 * entry is in; rejecting illegal transitions is the job of the consumer-facing
 * layer. Unknown ids are ignored.
 *
 * <p>Writers are serialized twice: a fair in-process lock shared by every
 * store on the same file, then an exclusive {@link FileLock} on the sibling
 * {@code <file>.lock} so separate processes (the poll daemon and a CLI action)
 * queue behind each other. {@link #update(Function)} reloads, mutates and saves
 * while holding both, so a change made by another process is never overwritten
 * with a stale snapshot.
 */
public final class WorklistStore {
    /**
     * Upper bound for a deferral. Larger requests are clamped to it.
     */
    public static final long MAX_DEFER_MINUTES = Duration.ofDays(365).toMinutes();

    private static final Map<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path file;
    private final Clock clock;
    private final Map<String, WorklistEntry> entries = new LinkedHashMap<>();
    private final ReentrantLock writeLock;

    public WorklistStore(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
        this.writeLock = PROCESS_LOCKS.computeIfAbsent(lockFile(file), ignored -> new ReentrantLock(true));
    }

    public void load() {
        Map<String, WorklistEntry> loaded = new LinkedHashMap<>();
        if (Files.exists(file)) {
            try {
                DigestFile state = Jsons.mapper().readValue(file.toFile(), DigestFile.class);
                if (state.entries() != null) {
                    state.entries().forEach((id, entry) -> {
                        if (id != null && entry != null) {
                            loaded.put(id, entry);
                        }
                    });
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load worklist: " + file, e);
            }
        }
        synchronized (entries) {
            entries.clear();
            entries.putAll(loaded);
        }
    }

    public void save() {
        withWriteLock(() -> {
            writeSnapshot();
            return null;
        });
    }

    /**
     * Reloads the file, applies {@code change} and saves, all under the write
     * locks.
     */
    public <T> T update(Function<WorklistStore, T> change) {
        return withWriteLock(() -> {
            load();
            T result = change.apply(this);
            writeSnapshot();
            return result;
        });
    }

    private <T> T withWriteLock(Supplier<T> action) {
        writeLock.lock();
        try {
            Path lockPath = lockFile(file);
            Files.createDirectories(lockPath.getParent());
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to lock worklist: " + file, e);
        } finally {
            writeLock.unlock();
        }
    }

    private void writeSnapshot() {
        DigestFile snapshot;
        synchronized (entries) {
            snapshot = new DigestFile(new LinkedHashMap<>(entries));
        }
        AtomicFiles.write(file, Jsons.toJson(snapshot) + "\n");
    }

    private static Path lockFile(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        return absolute.resolveSibling(absolute.getFileName() + ".lock");
    }

    public void add(WorklistEntry entry) {
        synchronized (entries) {
            entries.put(entry.id(), entry);
        }
    }

    public Optional<WorklistEntry> get(String id) {
        synchronized (entries) {
            return Optional.ofNullable(entries.get(id));
        }
    }

    public boolean has(String id) {
        synchronized (entries) {
            return entries.containsKey(id);
        }
    }

    /**
     * @param status a status, or {@code null} for every entry
     */
    public List<WorklistEntry> getByStatus(EntryStatus status) {
        synchronized (entries) {
            if (status == null) {
                return List.copyOf(entries.values());
            }
            return entries.values().stream()
                    .filter(entry -> entry.status() == status)
                    .toList();
        }
    }

    public Map<String, List<WorklistEntry>> getGroupedByAccount(EntryStatus status) {
        Map<String, List<WorklistEntry>> grouped = new LinkedHashMap<>();
        for (WorklistEntry entry : getByStatus(status)) {
            grouped.computeIfAbsent(entry.account(), ignored -> new ArrayList<>()).add(entry);
        }
        return grouped;
    }

    public List<WorklistEntry> getActiveEntries() {
        synchronized (entries) {
            return entries.values().stream()
                    .filter(entry -> entry.status() != null && entry.status().active())
                    .toList();
        }
    }

    public void markSurfaced(String id) {
        Instant now = clock.instant();
        transition(id, entry -> entry.withSurfaced(now));
    }

    public void markHandled(String id) {
        Instant now = clock.instant();
        transition(id, entry -> entry.withHandled(now));
    }

    public void defer(String id, long minutes) {
        Instant until = clock.instant().plus(Duration.ofMinutes(Math.min(minutes, MAX_DEFER_MINUTES)));
        transition(id, entry -> entry.withDeferred(until));
    }

    public void dismiss(String id, String reason) {
        Instant now = clock.instant();
        transition(id, entry -> entry.withDismissed(now, reason));
    }

    /**
     * Returns every deferred entry whose deadline has passed to {@code new}.
     *
     * @return the entries as they are after the transition
     */
    public List<WorklistEntry> expireDeferrals() {
        Instant now = clock.instant();
        List<WorklistEntry> expired = new ArrayList<>();
        synchronized (entries) {
            for (Map.Entry<String, WorklistEntry> slot : entries.entrySet()) {
                WorklistEntry entry = slot.getValue();
                if (entry.status() == EntryStatus.DEFERRED
                        && entry.deferredUntil() != null
                        && !entry.deferredUntil().isAfter(now)) {
                    WorklistEntry reset = entry.withExpiredDeferral();
                    slot.setValue(reset);
                    expired.add(reset);
                }
            }
        }
        return expired;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private void transition(String id, UnaryOperator<WorklistEntry> change) {
        if (id == null) {
            return;
        }
        synchronized (entries) {
            entries.computeIfPresent(id, (ignored, entry) -> change.apply(entry));
        }
    }

    record DigestFile(Map<String, WorklistEntry> entries) {
    }
}

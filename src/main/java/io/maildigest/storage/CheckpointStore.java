package io.maildigest.storage;

import io.maildigest.model.Checkpoint;
import io.maildigest.util.AtomicFiles;
import io.maildigest.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class CheckpointStore {
    private final Path file;
    private final Clock clock;
    private final Map<String, Checkpoint> accounts = new LinkedHashMap<>();
    private Instant lastClassifierRunAt;

    public CheckpointStore(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public synchronized void load() {
        accounts.clear();
        lastClassifierRunAt = null;
        if (!Files.exists(file)) {
            return;
        }
        try {
            StateFile state = Jsons.mapper().readValue(file.toFile(), StateFile.class);
            if (state.accounts() != null) {
                state.accounts().forEach((account, checkpoint) -> {
                    if (account != null && checkpoint != null) {
                        accounts.put(account, checkpoint);
                    }
                });
            }
            lastClassifierRunAt = state.lastClassifierRunAt();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load checkpoints: " + file, e);
        }
    }

    public synchronized void save() {
        StateFile state = new StateFile(new LinkedHashMap<>(accounts), lastClassifierRunAt);
        AtomicFiles.write(file, Jsons.toJson(state) + "\n");
    }

    public synchronized Optional<Checkpoint> get(String account) {
        return Optional.ofNullable(accounts.get(account));
    }

    public synchronized void recordSuccess(String account, String cursor) {
        accounts.put(account, new Checkpoint(cursor, clock.instant(), 0));
    }

    /**
     * @return the account's consecutive failure count after this failure
     */
    public synchronized int recordFailure(String account) {
        Checkpoint existing = accounts.get(account);
        int failures = (existing == null ? 0 : existing.consecutiveFailures()) + 1;
        accounts.put(account, new Checkpoint(
                existing == null ? null : existing.cursor(),
                existing == null ? null : existing.lastPollAt(),
                failures
        ));
        return failures;
    }

    public synchronized void markClassifierRun() {
        lastClassifierRunAt = clock.instant();
    }

    public synchronized Optional<Instant> lastClassifierRunAt() {
        return Optional.ofNullable(lastClassifierRunAt);
    }

    public synchronized Map<String, Checkpoint> snapshot() {
        return Map.copyOf(accounts);
    }

    record StateFile(Map<String, Checkpoint> accounts, Instant lastClassifierRunAt) {
    }
}

package io.maildigest.model;

import java.time.Instant;

/**
 * Per-account sync position. {@code cursor} is null until the source has
 * handed out one.
 */
public record Checkpoint(
        String cursor,
        Instant lastPollAt,
        int consecutiveFailures
) {
    public boolean hasCursor() {
        return cursor != null && !cursor.isBlank();
    }
}

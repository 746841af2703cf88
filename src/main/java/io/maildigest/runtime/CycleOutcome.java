package io.maildigest.runtime;

import java.time.Instant;
import java.util.List;

public record CycleOutcome(
        Instant startedAt,
        int expiredDeferrals,
        int autoResolved,
        List<String> accountsSynced,
        List<String> accountsFailed,
        int newMessages,
        int classified,
        int addedToWorklist,
        int notified,
        int alertsSent,
        long durationMs
) {
}

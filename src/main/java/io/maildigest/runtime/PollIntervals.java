package io.maildigest.runtime;

import java.time.Duration;

public record PollIntervals(Duration active, Duration inactive) {
}

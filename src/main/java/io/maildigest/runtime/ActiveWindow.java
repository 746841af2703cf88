package io.maildigest.runtime;

import java.time.ZoneId;

/**
 * Hours of the day, in {@code zone}, during which polling runs at the faster
 * cadence. The range is half-open: {@code [startHour, endHour)}.
 */
public record ActiveWindow(int startHour, int endHour, ZoneId zone) {
}

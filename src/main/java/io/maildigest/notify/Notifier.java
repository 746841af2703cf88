package io.maildigest.notify;

/**
 * Outbound push to a human or downstream agent. Failures are reported through
 * the return value and are never fatal to a poll cycle.
 */
@FunctionalInterface
public interface Notifier {
    boolean notify(String target, String message, long timeoutMs);
}

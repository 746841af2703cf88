package io.maildigest.text;

/**
 * Reduces a raw message body to the text worth showing a classifier.
 * Implementations are pure and total: absent input yields an empty string.
 */
@FunctionalInterface
public interface BodyCleaner {
    String clean(String rawBody, int maxLength);
}

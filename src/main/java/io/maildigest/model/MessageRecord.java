package io.maildigest.model;

/**
 * A fetched message with its body already cleaned, ready for classification.
 */
public record MessageRecord(
        String id,
        String threadId,
        String account,
        String from,
        String to,
        String subject,
        String date,
        String body,
        int threadLength,
        boolean hasAttachments
) {
}

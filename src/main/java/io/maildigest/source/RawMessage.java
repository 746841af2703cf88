package io.maildigest.source;

import java.util.List;

/**
 * A message as the gateway reports it. Every field except {@code id} may be
 * missing.
 */
public record RawMessage(
        String id,
        String threadId,
        String subject,
        String from,
        String to,
        String date,
        String body,
        List<String> labelIds
) {
    public boolean hasLabel(String label) {
        return labelIds != null && labelIds.contains(label);
    }
}

package io.maildigest.source;

import java.util.List;

/**
 * One gateway listing. {@code cursor} is only set when the gateway reported a
 * new sync position alongside the messages.
 */
public record MessageBatch(List<RawMessage> messages, String cursor) {
    public static MessageBatch empty() {
        return new MessageBatch(List.of(), null);
    }
}

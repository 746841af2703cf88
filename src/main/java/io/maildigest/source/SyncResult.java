package io.maildigest.source;

import io.maildigest.model.MessageRecord;

import java.util.List;

/**
 * @param cursor new sync position reported by the source, or null when it
 *               reported none
 * @param rescanned whether the bounded rescan path produced the messages
 */
public record SyncResult(List<MessageRecord> messages, String cursor, boolean rescanned) {
}

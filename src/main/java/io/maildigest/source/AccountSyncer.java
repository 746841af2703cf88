package io.maildigest.source;

import java.util.Set;

/**
 * Source-side capabilities the poll cycle depends on.
 */
public interface AccountSyncer {
    /**
     * Fetches what is new for {@code account}, skipping ids in {@code knownIds}
     * and threads the owner already answered.
     *
     * @param cursor last good sync position, or null
     */
    SyncResult syncAccount(String account, String cursor, Set<String> knownIds) throws SourceException;

    boolean threadHasOwnerReply(String threadId, String account) throws SourceException;
}

package io.maildigest.source;

import java.util.Optional;

/**
 * Access to a mail provider for one owner account at a time.
 */
public interface SourceGateway {
    /**
     * Messages changed since {@code cursor}. Fails when the cursor is no longer
     * accepted.
     */
    MessageBatch changesSince(String account, String cursor) throws SourceException;

    MessageBatch searchRecent(String account, int days) throws SourceException;

    /**
     * @return the thread, or empty when the gateway answered with something
     *         that is not a thread
     */
    Optional<RawThread> thread(String account, String threadId) throws SourceException;
}

package io.maildigest.source;

/**
 * A gateway call for one account failed outright (non-zero exit, timeout,
 * spawn failure). Malformed output is not an error; it parses to "nothing".
 */
public class SourceException extends Exception {
    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

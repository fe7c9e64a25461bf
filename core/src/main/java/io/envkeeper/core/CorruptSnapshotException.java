package io.envkeeper.core;

/** Stored snapshot whose bytes no longer hash to its id, or whose manifest is unreadable. */
public class CorruptSnapshotException extends RuntimeException {

    public CorruptSnapshotException(String message) {
        super(message);
    }

    public CorruptSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}

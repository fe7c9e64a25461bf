// file: src/main/java/io/envkeeper/storage/Wal.java
package io.envkeeper.storage;

/**
 * Write-ahead log abstraction shared by the session journal and the event log.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated as
 *    absent during recovery (the reader stops at the first corrupt or truncated record).
 *  - append() fsyncs before returning, so a record acknowledged to a caller
 *    survives a process crash.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param framedRecord header+payload bytes, from {@link RecordCodec#frame(byte[])}
     */
    void append(byte[] framedRecord);

    /** Start a new segment when the current one reached its size threshold. */
    void rotateIfNeeded();

    /**
     * Start a fresh segment and delete every older one.
     * Callers must already have persisted what the old segments contain
     * (for example in a checkpoint).
     */
    void compact();

    /**
     * Open a sequential reader over all segments, oldest first.
     */
    WalReader openReader();

    @Override
    void close();

    /** Reader used during recovery. */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (header stripped), or null at the end of
         *         the log or at the first corrupt/truncated record.
         */
        byte[] next();

        @Override
        void close();
    }
}

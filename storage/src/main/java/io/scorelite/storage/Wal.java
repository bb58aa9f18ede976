// file: src/main/java/io/scorelite/storage/Wal.java
package io.scorelite.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - segments are named so that lexical order is write order.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes, typically from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the store after each write.
     */
    void rotateIfNeeded();

    /**
     * Close the current segment and start a new one unconditionally.
     *
     * @return name of the new (empty) segment
     */
    String rotate();

    /**
     * Open a sequential reader starting at segment {@code fromSegment}
     * (inclusive), or at the earliest segment when null. The reader walks the
     * remaining segments in order; within a segment it stops at the first
     * corrupt header or truncated payload and continues with the next segment.
     */
    WalReader openReader(String fromSegment);

    /** Delete every segment that sorts before {@code segment}. */
    void deleteSegmentsBefore(String segment);

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null at the end
         *         of the last segment.
         */
        byte[] next();

        /** True once a corrupt or truncated record has been skipped. */
        boolean torn();
    }
}

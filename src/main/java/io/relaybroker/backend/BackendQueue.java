package io.relaybroker.backend;

import java.io.IOException;

/**
 * Durable, ordered queue of opaque byte records used as a topic's overflow storage.
 * <p>
 * Records come back from {@link #poll()} in the order they were {@link #put(byte[]) appended}.
 * Each record is handed out once; the read side is not restartable. Implementations support one
 * writing thread and one reading thread at a time.
 * </p>
 */
public interface BackendQueue extends AutoCloseable {

    /**
     * Append a record.
     *
     * @throws IOException if the record could not be stored or the queue is closed
     */
    void put(byte[] data) throws IOException;

    /**
     * Take the next record without waiting.
     *
     * @return the oldest unread record, or {@code null} if none is available
     */
    byte[] poll() throws IOException;

    /**
     * Number of appended records not yet handed out by {@link #poll()}.
     */
    long depth();

    /**
     * Flush and release resources. Closing a queue twice is an error.
     */
    @Override
    void close() throws IOException;
}

package com.sema.chat.stream;

import com.sema.chat.model.StreamChunk;

import java.util.Iterator;

/**
 * Lazy, finite, non-restartable sequence of chunks for one assistant message.
 *
 * <p>A stream that ends normally yields exactly one chunk with {@code isFinal == true}
 * and empty content as its last element. A stream that aborts throws a
 * {@link com.sema.chat.exception.GenerationException} from {@link #hasNext()} or
 * {@link #next()} after delivering whatever chunks preceded the failure; no final chunk
 * is produced in that case.
 *
 * <p>{@link #close()} cancels the producer if it is still running and is idempotent.
 */
public interface ChatStream extends Iterator<StreamChunk>, AutoCloseable {

    String sessionId();

    String messageId();

    /**
     * True once the final chunk has been handed to the consumer.
     */
    boolean isCompleted();

    @Override
    void close();
}

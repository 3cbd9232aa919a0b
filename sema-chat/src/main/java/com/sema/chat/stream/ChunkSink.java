package com.sema.chat.stream;

/**
 * Producer side of a {@link ChunkChannel}. Chunk ids are assigned here, so producers
 * only hand over text fragments.
 */
public interface ChunkSink {

    /**
     * Publishes a fragment. Empty fragments are dropped. Blocks while the channel is
     * full and throws {@link java.util.concurrent.CancellationException} once the
     * consumer has closed the stream.
     */
    void emit(String content);

    int emittedCount();
}

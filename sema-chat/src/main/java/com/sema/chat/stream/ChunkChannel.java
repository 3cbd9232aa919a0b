package com.sema.chat.stream;

import com.sema.chat.exception.GenerationException;
import com.sema.chat.model.StreamChunk;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-producer bounded channel bridging a generation worker to a consumer thread.
 * The producer calls {@link #emit}, then exactly one of {@link #complete()} or
 * {@link #fail(RuntimeException)}; the consumer iterates.
 */
@Slf4j
public final class ChunkChannel implements ChatStream, ChunkSink {

    private static final long OFFER_POLL_MILLIS = 100;

    private final String sessionId;
    private final String messageId;
    private final BlockingQueue<Signal> queue;
    private final Duration pacing;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Runnable cancelHook = () -> { };

    // producer-owned
    private int nextChunkId = 0;
    private boolean producerFinished = false;

    // consumer-owned
    private StreamChunk pending;
    private boolean exhausted = false;
    private volatile boolean completed = false;

    public ChunkChannel(String sessionId, String messageId, int capacity, Duration pacing) {
        this.sessionId = sessionId;
        this.messageId = messageId;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.pacing = pacing == null ? Duration.ZERO : pacing;
    }

    /**
     * Registers the action that stops the producer when the consumer closes early.
     */
    public void onCancel(Runnable hook) {
        this.cancelHook = hook == null ? () -> { } : hook;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public String messageId() {
        return messageId;
    }

    @Override
    public boolean isCompleted() {
        return completed;
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ---------------------------------------------------------------- producer side

    @Override
    public void emit(String content) {
        if (content == null || content.isEmpty()) {
            return;
        }
        ensureOpenForProducer();
        offer(Signal.chunk(StreamChunk.content(sessionId, messageId, nextChunkId, content)));
        nextChunkId++;
        pace();
    }

    @Override
    public int emittedCount() {
        return nextChunkId;
    }

    /**
     * Terminates the stream normally with the final chunk.
     */
    public void complete() {
        ensureOpenForProducer();
        producerFinished = true;
        offer(Signal.chunk(StreamChunk.terminal(sessionId, messageId, nextChunkId)));
    }

    /**
     * Terminates the stream abnormally. Chunks already queued are still delivered first.
     */
    public void fail(RuntimeException error) {
        if (producerFinished || closed.get()) {
            log.debug("Dropping stream error for closed message {}: {}", messageId, error.getMessage());
            return;
        }
        producerFinished = true;
        try {
            offer(Signal.error(error));
        } catch (CancellationException e) {
            log.debug("Consumer closed stream {} before error delivery", messageId);
        }
    }

    private void ensureOpenForProducer() {
        if (producerFinished) {
            throw new IllegalStateException("Stream " + messageId + " already terminated");
        }
        if (closed.get()) {
            throw new CancellationException("Stream " + messageId + " closed by consumer");
        }
    }

    private void offer(Signal signal) {
        try {
            while (!queue.offer(signal, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (closed.get()) {
                    throw new CancellationException("Stream " + messageId + " closed by consumer");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Producer interrupted for stream " + messageId);
        }
    }

    private void pace() {
        if (pacing.isZero() || pacing.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pacing.toMillis(), pacing.toNanosPart() % 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Producer interrupted for stream " + messageId);
        }
    }

    // ---------------------------------------------------------------- consumer side

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        Signal signal;
        try {
            signal = queue.poll(OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS);
            while (signal == null) {
                if (closed.get()) {
                    exhausted = true;
                    return false;
                }
                signal = queue.poll(OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new GenerationException("Interrupted while waiting for stream " + messageId, e);
        }
        if (signal.error != null) {
            exhausted = true;
            close();
            throw signal.error;
        }
        pending = signal.chunk;
        return true;
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream " + messageId + " is exhausted");
        }
        StreamChunk chunk = pending;
        pending = null;
        if (chunk.isFinal()) {
            exhausted = true;
            completed = true;
            closed.set(true);
        }
        return chunk;
    }

    @Override
    public void close() {
        exhausted = true;
        if (closed.compareAndSet(false, true)) {
            cancelHook.run();
            queue.clear();
        }
    }

    private static final class Signal {
        final StreamChunk chunk;
        final RuntimeException error;

        private Signal(StreamChunk chunk, RuntimeException error) {
            this.chunk = chunk;
            this.error = error;
        }

        static Signal chunk(StreamChunk chunk) {
            return new Signal(chunk, null);
        }

        static Signal error(RuntimeException error) {
            return new Signal(null, error);
        }
    }
}

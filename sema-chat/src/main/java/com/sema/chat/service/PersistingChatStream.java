package com.sema.chat.service;

import com.sema.chat.metrics.ChatMetrics;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.MessageRole;
import com.sema.chat.model.StreamChunk;
import com.sema.chat.session.SessionStore;
import com.sema.chat.stream.ChatStream;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Passes chunks through unchanged and records the assistant turn once the final
 * chunk arrives. A stream that errors or is closed early records nothing. The
 * capacity slot is released exactly once on whichever exit happens first.
 */
@Slf4j
class PersistingChatStream implements ChatStream {

    private final ChatStream upstream;
    private final SessionStore sessionStore;
    private final ChatMetrics metrics;
    private final String modelName;
    private final Runnable releaseSlot;
    private final StringBuilder content = new StringBuilder();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private int chunkCount = 0;

    PersistingChatStream(ChatStream upstream, SessionStore sessionStore, ChatMetrics metrics,
                         String modelName, Runnable releaseSlot) {
        this.upstream = upstream;
        this.sessionStore = sessionStore;
        this.metrics = metrics;
        this.modelName = modelName;
        this.releaseSlot = releaseSlot;
    }

    @Override
    public String sessionId() {
        return upstream.sessionId();
    }

    @Override
    public String messageId() {
        return upstream.messageId();
    }

    @Override
    public boolean isCompleted() {
        return upstream.isCompleted();
    }

    @Override
    public boolean hasNext() {
        try {
            boolean more = upstream.hasNext();
            if (!more) {
                finish(upstream.isCompleted());
            }
            return more;
        } catch (RuntimeException e) {
            log.error("Stream {} for session {} aborted: {}", messageId(), sessionId(), e.getMessage());
            finish(false);
            throw e;
        }
    }

    @Override
    public StreamChunk next() {
        StreamChunk chunk;
        try {
            chunk = upstream.next();
        } catch (RuntimeException e) {
            finish(false);
            throw e;
        }
        if (!chunk.isFinal()) {
            content.append(chunk.content());
            chunkCount++;
            return chunk;
        }
        try {
            persistAssistantTurn();
        } finally {
            finish(true);
        }
        return chunk;
    }

    @Override
    public void close() {
        boolean completed = upstream.isCompleted();
        upstream.close();
        if (!completed && !finished.get()) {
            log.info("Stream {} for session {} closed before completion", messageId(), sessionId());
        }
        finish(completed);
    }

    private void persistAssistantTurn() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model_name", modelName);
        metadata.put("streamed", true);
        metadata.put("chunk_count", chunkCount);
        sessionStore.append(sessionId(),
                new ChatMessage(messageId(), MessageRole.ASSISTANT, content.toString(), null, metadata));
        log.info("Stream {} completed for session {} ({} chunks)", messageId(), sessionId(), chunkCount);
    }

    private void finish(boolean completed) {
        if (finished.compareAndSet(false, true)) {
            if (!completed) {
                metrics.recordStreamAborted();
            }
            releaseSlot.run();
        }
    }
}

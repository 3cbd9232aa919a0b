package com.sema.chat.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record StreamChunk(
        String content,
        String sessionId,
        String messageId,
        int chunkId,
        @JsonProperty("is_final") boolean isFinal,
        Instant timestamp
) {
    public static StreamChunk content(String sessionId, String messageId, int chunkId, String content) {
        return new StreamChunk(content, sessionId, messageId, chunkId, false, Instant.now());
    }

    public static StreamChunk terminal(String sessionId, String messageId, int chunkId) {
        return new StreamChunk("", sessionId, messageId, chunkId, true, Instant.now());
    }
}

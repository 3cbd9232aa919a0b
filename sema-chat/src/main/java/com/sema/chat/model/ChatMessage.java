package com.sema.chat.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A single conversation turn. Instances are immutable once stored.
 */
public record ChatMessage(
        String id,
        MessageRole role,
        String content,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public ChatMessage {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
        id = id == null ? UUID.randomUUID().toString() : id;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        metadata = metadata == null ? Map.of() : metadata.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(null, MessageRole.SYSTEM, content, null, null);
    }

    public static ChatMessage user(String content, Map<String, Object> metadata) {
        return new ChatMessage(null, MessageRole.USER, content, null, metadata);
    }

    public static ChatMessage user(String content) {
        return user(content, null);
    }

    public static ChatMessage assistant(String content, Map<String, Object> metadata) {
        return new ChatMessage(null, MessageRole.ASSISTANT, content, null, metadata);
    }

    @JsonIgnore
    public boolean isSystem() {
        return role == MessageRole.SYSTEM;
    }
}

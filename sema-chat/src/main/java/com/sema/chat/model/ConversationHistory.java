package com.sema.chat.model;

import java.time.Instant;
import java.util.List;

public record ConversationHistory(
        String sessionId,
        List<ChatMessage> messages,
        Instant createdAt,
        Instant updatedAt,
        int messageCount
) {
    public ConversationHistory {
        messages = messages == null ? List.of() : List.copyOf(messages);
        messageCount = messages.size();
    }
}

package com.sema.chat.model;

import java.time.Instant;

public record SessionInfo(
        String sessionId,
        Instant createdAt,
        Instant updatedAt,
        int messageCount,
        String modelName,
        boolean active
) {
    public static SessionInfo of(ConversationHistory history, String modelName) {
        return new SessionInfo(history.sessionId(), history.createdAt(), history.updatedAt(),
                history.messageCount(), modelName, true);
    }
}

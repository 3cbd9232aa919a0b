package com.sema.chat.dto;

import com.sema.chat.model.GenerationResult;

import java.time.Instant;

public record ChatResponse(
        String message,
        String sessionId,
        String messageId,
        String modelName,
        Instant timestamp,
        double generationTime,
        Integer tokenCount,
        String finishReason
) {
    public static ChatResponse from(GenerationResult result, String sessionId) {
        return new ChatResponse(
                result.text(),
                sessionId,
                result.messageId(),
                result.modelName(),
                Instant.now(),
                result.generationSeconds(),
                result.tokenCount(),
                result.finishReason());
    }
}

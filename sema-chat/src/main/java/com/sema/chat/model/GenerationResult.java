package com.sema.chat.model;

import java.time.Duration;

/**
 * @param tokenCount null when the backend cannot report usage
 */
public record GenerationResult(
        String messageId,
        String text,
        String modelName,
        Integer tokenCount,
        String finishReason,
        Duration generationTime
) {
    public GenerationResult withGenerationTime(Duration elapsed) {
        return new GenerationResult(messageId, text, modelName, tokenCount, finishReason, elapsed);
    }

    public double generationSeconds() {
        return generationTime == null ? 0.0 : generationTime.toNanos() / 1_000_000_000.0;
    }
}

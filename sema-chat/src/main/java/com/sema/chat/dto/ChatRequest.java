package com.sema.chat.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Inbound chat turn. Generation overrides are optional; absent values fall back to
 * configured defaults.
 */
public record ChatRequest(
        @NotBlank @Size(max = 4000) String message,
        String sessionId,
        @Size(max = 1000) String systemPrompt,
        String promptType,
        @DecimalMin("0.0") @DecimalMax("1.0") Double temperature,
        @Min(1) @Max(2048) Integer maxTokens,
        @DecimalMin("0.0") @DecimalMax("1.0") Double topP,
        @Min(1) Integer topK
) {
    public static ChatRequest of(String message, String sessionId) {
        return new ChatRequest(message, sessionId, null, null, null, null, null, null);
    }

    public ChatRequest withSessionId(String newSessionId) {
        return new ChatRequest(message, newSessionId, systemPrompt, promptType, temperature, maxTokens, topP, topK);
    }
}

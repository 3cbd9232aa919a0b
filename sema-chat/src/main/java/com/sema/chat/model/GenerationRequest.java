package com.sema.chat.model;

import java.util.List;

/**
 * Input to a single backend call. {@code sessionId} only correlates stream chunks
 * with their conversation; backends never read session state.
 */
public record GenerationRequest(
        String sessionId,
        List<ChatMessage> messages,
        GenerationParameters parameters
) {
    public GenerationRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        parameters = parameters == null ? GenerationParameters.defaults() : parameters;
    }

    public static GenerationRequest of(List<ChatMessage> messages, GenerationParameters parameters) {
        return new GenerationRequest("unknown", messages, parameters);
    }

    public GenerationRequest normalized() {
        return new GenerationRequest(sessionId, messages, parameters.normalized());
    }
}

package com.sema.chat.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.stream.ChunkSink;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * MiniMax chat completions. Reasoning content, when present, is surfaced inline
 * ahead of the answer.
 */
public class MiniMaxApiBackend extends OpenAiCompatibleBackend {

    public static final String TYPE = "minimax";
    public static final String DEFAULT_MODEL_VERSION = "MiniMax-M1";

    private final String apiKey;
    private final String apiUrl;
    private final String modelVersion;

    public MiniMaxApiBackend(BackendSettings settings, ObjectMapper objectMapper,
                             String apiKey, String apiUrl, String modelVersion) {
        super(settings, Set.of("chat", "streaming", "reasoning", "api_based"), objectMapper);
        this.apiKey = apiKey;
        this.apiUrl = isBlank(apiUrl) ? null : trimTrailingSlash(apiUrl);
        this.modelVersion = isBlank(modelVersion) ? DEFAULT_MODEL_VERSION : modelVersion;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected String providerName() {
        return "MiniMax";
    }

    @Override
    protected void validateConfiguration() {
        if (isBlank(apiKey)) {
            throw new ModelLoadException("MiniMax API key is required");
        }
        if (apiUrl == null) {
            throw new ModelLoadException("MiniMax API URL is required");
        }
    }

    @Override
    protected URI chatCompletionsUri() {
        return URI.create(apiUrl);
    }

    @Override
    protected Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected String requestModel() {
        return modelVersion;
    }

    @Override
    protected String extractText(JsonNode message) {
        String content = super.extractText(message);
        String reasoning = textOrNull(message.get("reasoning_content"));
        if (isBlank(reasoning)) {
            return content;
        }
        return "[Reasoning: " + reasoning + "]\n\n" + content;
    }

    @Override
    protected void emitDelta(JsonNode delta, ChunkSink sink) {
        String reasoning = textOrNull(delta.get("reasoning_content"));
        if (!isBlank(reasoning)) {
            sink.emit("[Thinking: " + reasoning + "]");
        }
        super.emitDelta(delta, sink);
    }

    @Override
    protected Integer tokenCount(JsonNode root, String text) {
        return approximateTokens(text);
    }

    @Override
    protected Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", "MiniMax");
        details.put("api_url", apiUrl);
        details.put("model_version", modelVersion);
        return details;
    }
}

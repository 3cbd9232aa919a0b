package com.sema.chat.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sema.chat.exception.GenerationException;
import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.GenerationParameters;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.stream.ChunkSink;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Anthropic Messages API. System turns are lifted into the top-level
 * {@code system} field; only user and assistant turns go in {@code messages}.
 * Endpoint: POST /v1/messages
 */
public class AnthropicApiBackend extends HttpModelBackend {

    public static final String TYPE = "anthropic";
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String DEFAULT_API_VERSION = "2023-06-01";

    private final String apiKey;
    private final String baseUrl;
    private final String apiVersion;

    public AnthropicApiBackend(BackendSettings settings, ObjectMapper objectMapper,
                               String apiKey, String baseUrl, String apiVersion) {
        super(settings, Set.of("chat", "streaming", "api_based", "long_context"), objectMapper);
        this.apiKey = apiKey;
        this.baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : trimTrailingSlash(baseUrl);
        this.apiVersion = isBlank(apiVersion) ? DEFAULT_API_VERSION : apiVersion;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected String providerName() {
        return "Anthropic";
    }

    @Override
    protected void validateConfiguration() {
        if (isBlank(apiKey)) {
            throw new ModelLoadException("Anthropic API key is required");
        }
    }

    @Override
    protected GenerationResult doGenerate(GenerationRequest request, String messageId) {
        JsonNode root = postJson(messagesUri(), headers(), buildBody(request, false));
        JsonNode content = root.path("content");
        if (!content.isArray() || content.isEmpty()) {
            throw new GenerationException("Anthropic response contained no content blocks");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText("text"))) {
                text.append(block.path("text").asText(""));
            }
        }
        JsonNode outputTokens = root.at("/usage/output_tokens");
        return new GenerationResult(
                messageId,
                text.toString(),
                modelName(),
                outputTokens.isNumber() ? outputTokens.asInt() : null,
                root.path("stop_reason").asText("end_turn"),
                null);
    }

    @Override
    protected void doStream(GenerationRequest request, ChunkSink sink) {
        streamLines(messagesUri(), headers(), buildBody(request, true), line -> {
            String data = sseData(line);
            if (data == null || data.isEmpty()) {
                return true;
            }
            JsonNode event = readJson(data);
            String eventType = event.path("type").asText();
            if ("content_block_delta".equals(eventType)) {
                String text = textOrNull(event.at("/delta/text"));
                if (text != null) {
                    sink.emit(text);
                }
            } else if ("error".equals(eventType)) {
                throw new GenerationException(
                        "Anthropic stream error: " + event.at("/error/message").asText("unknown"));
            }
            return !"message_stop".equals(eventType);
        });
    }

    ObjectNode buildBody(GenerationRequest request, boolean stream) {
        GenerationParameters params = request.parameters();
        List<String> systemParts = new ArrayList<>();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", modelName());
        body.put("max_tokens", params.maxTokens());
        body.put("temperature", params.temperature());
        body.put("top_p", params.topP());
        body.put("top_k", params.topK());
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            if (message.isSystem()) {
                systemParts.add(message.content());
            } else {
                messages.addObject()
                        .put("role", message.role().wireName())
                        .put("content", message.content());
            }
        }
        if (!systemParts.isEmpty()) {
            body.put("system", String.join("\n\n", systemParts));
        }
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    private URI messagesUri() {
        return URI.create(baseUrl + "/v1/messages");
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", apiKey);
        headers.put("anthropic-version", apiVersion);
        return headers;
    }

    @Override
    protected Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", "Anthropic");
        details.put("base_url", baseUrl);
        details.put("api_version", apiVersion);
        return details;
    }
}

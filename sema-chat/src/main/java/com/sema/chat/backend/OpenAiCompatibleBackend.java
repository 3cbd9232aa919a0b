package com.sema.chat.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sema.chat.exception.GenerationException;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.GenerationParameters;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.stream.ChunkSink;

import java.net.URI;
import java.util.Map;
import java.util.Set;

/**
 * Chat-completions framing shared by OpenAI, Hugging Face and MiniMax.
 * Endpoint: POST .../chat/completions
 */
public abstract class OpenAiCompatibleBackend extends HttpModelBackend {

    protected OpenAiCompatibleBackend(BackendSettings settings, Set<String> capabilities, ObjectMapper objectMapper) {
        super(settings, capabilities, objectMapper);
    }

    protected abstract URI chatCompletionsUri();

    protected abstract Map<String, String> authHeaders();

    /**
     * Value of the {@code model} field in the request body.
     */
    protected String requestModel() {
        return modelName();
    }

    @Override
    protected GenerationResult doGenerate(GenerationRequest request, String messageId) {
        JsonNode root = postJson(chatCompletionsUri(), authHeaders(), buildBody(request, false));
        JsonNode choice = root.at("/choices/0");
        if (choice.isMissingNode()) {
            throw new GenerationException(providerName() + " response contained no choices");
        }
        String text = extractText(choice.path("message"));
        String finishReason = choice.path("finish_reason").asText("stop");
        return new GenerationResult(messageId, text, modelName(), tokenCount(root, text), finishReason, null);
    }

    @Override
    protected void doStream(GenerationRequest request, ChunkSink sink) {
        streamLines(chatCompletionsUri(), authHeaders(), buildBody(request, true), line -> {
            String data = sseData(line);
            if (data == null) {
                return true;
            }
            if ("[DONE]".equals(data)) {
                return false;
            }
            JsonNode choice = readJson(data).at("/choices/0");
            if (choice.isMissingNode()) {
                return true;
            }
            emitDelta(choice.path("delta"), sink);
            return textOrNull(choice.get("finish_reason")) == null;
        });
    }

    protected ObjectNode buildBody(GenerationRequest request, boolean stream) {
        GenerationParameters params = request.parameters();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", requestModel());
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            messages.addObject()
                    .put("role", message.role().wireName())
                    .put("content", message.content());
        }
        body.put("max_tokens", params.maxTokens());
        body.put("temperature", params.temperature());
        body.put("top_p", params.topP());
        body.put("stream", stream);
        return body;
    }

    protected String extractText(JsonNode message) {
        String content = textOrNull(message.get("content"));
        return content == null ? "" : content;
    }

    protected void emitDelta(JsonNode delta, ChunkSink sink) {
        String content = textOrNull(delta.get("content"));
        if (content != null) {
            sink.emit(content);
        }
    }

    /**
     * Completion tokens from {@code usage}, null when the provider omits it.
     */
    protected Integer tokenCount(JsonNode root, String text) {
        JsonNode completionTokens = root.at("/usage/completion_tokens");
        return completionTokens.isNumber() ? completionTokens.asInt() : null;
    }
}

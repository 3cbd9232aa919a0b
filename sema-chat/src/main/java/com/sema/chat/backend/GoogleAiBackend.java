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
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Google Gemini generateContent. Assistant turns are sent with role {@code model};
 * system turns become {@code systemInstruction}.
 */
public class GoogleAiBackend extends HttpModelBackend {

    public static final String TYPE = "google";
    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private final String apiKey;
    private final String baseUrl;

    public GoogleAiBackend(BackendSettings settings, ObjectMapper objectMapper, String apiKey, String baseUrl) {
        super(settings, Set.of("chat", "streaming", "api_based"), objectMapper);
        this.apiKey = apiKey;
        this.baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : trimTrailingSlash(baseUrl);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected String providerName() {
        return "Google AI";
    }

    @Override
    protected void validateConfiguration() {
        if (isBlank(apiKey)) {
            throw new ModelLoadException("Google AI API key is required");
        }
    }

    @Override
    protected GenerationResult doGenerate(GenerationRequest request, String messageId) {
        JsonNode root = postJson(URI.create(baseUrl + "/models/" + modelName() + ":generateContent"),
                headers(), buildBody(request));
        JsonNode candidate = root.at("/candidates/0");
        if (candidate.isMissingNode()) {
            String blockReason = root.at("/promptFeedback/blockReason").asText("no candidates");
            throw new GenerationException("Google AI returned no candidates: " + blockReason);
        }
        String text = candidateText(candidate);
        return new GenerationResult(messageId, text, modelName(), approximateTokens(text),
                finishReason(candidate, "stop"), null);
    }

    @Override
    protected void doStream(GenerationRequest request, ChunkSink sink) {
        URI uri = URI.create(baseUrl + "/models/" + modelName() + ":streamGenerateContent?alt=sse");
        streamLines(uri, headers(), buildBody(request), line -> {
            String data = sseData(line);
            if (data == null || data.isEmpty()) {
                return true;
            }
            JsonNode candidate = readJson(data).at("/candidates/0");
            if (candidate.isMissingNode()) {
                return true;
            }
            sink.emit(candidateText(candidate));
            return finishReason(candidate, null) == null;
        });
    }

    /**
     * Gemini reports reasons in upper case ({@code STOP}, {@code MAX_TOKENS}).
     */
    private static String finishReason(JsonNode candidate, String fallback) {
        String reason = textOrNull(candidate.get("finishReason"));
        return reason == null ? fallback : reason.toLowerCase(Locale.ROOT);
    }

    ObjectNode buildBody(GenerationRequest request) {
        GenerationParameters params = request.parameters();
        ObjectNode body = objectMapper.createObjectNode();
        List<String> systemParts = new ArrayList<>();
        ArrayNode contents = body.putArray("contents");
        for (ChatMessage message : request.messages()) {
            switch (message.role()) {
                case SYSTEM -> systemParts.add(message.content());
                case USER -> addContent(contents, "user", message.content());
                case ASSISTANT -> addContent(contents, "model", message.content());
            }
        }
        if (!systemParts.isEmpty()) {
            body.putObject("systemInstruction")
                    .putArray("parts")
                    .addObject()
                    .put("text", String.join("\n\n", systemParts));
        }
        body.putObject("generationConfig")
                .put("maxOutputTokens", params.maxTokens())
                .put("temperature", params.temperature())
                .put("topP", params.topP())
                .put("topK", params.topK());
        return body;
    }

    private static void addContent(ArrayNode contents, String role, String text) {
        ObjectNode content = contents.addObject();
        content.put("role", role);
        content.putArray("parts").addObject().put("text", text);
    }

    private static String candidateText(JsonNode candidate) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.at("/content/parts")) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private Map<String, String> headers() {
        return Map.of("x-goog-api-key", apiKey);
    }

    @Override
    protected Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", "Google AI");
        details.put("base_url", baseUrl);
        return details;
    }
}

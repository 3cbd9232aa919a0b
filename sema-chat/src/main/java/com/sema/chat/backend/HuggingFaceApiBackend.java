package com.sema.chat.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.exception.ModelLoadException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Hugging Face Inference API through its OpenAI-compatible chat route.
 */
public class HuggingFaceApiBackend extends OpenAiCompatibleBackend {

    public static final String TYPE = "hf_api";
    public static final String DEFAULT_BASE_URL = "https://api-inference.huggingface.co/models/";

    private final String apiToken;
    private final String baseUrl;

    public HuggingFaceApiBackend(BackendSettings settings, ObjectMapper objectMapper, String apiToken, String baseUrl) {
        super(settings, Set.of("chat", "streaming", "api_based"), objectMapper);
        this.apiToken = apiToken;
        this.baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : trimTrailingSlash(baseUrl) + "/";
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected String providerName() {
        return "Hugging Face";
    }

    @Override
    protected void validateConfiguration() {
        if (isBlank(apiToken)) {
            throw new ModelLoadException("Hugging Face API token is required");
        }
    }

    @Override
    protected URI chatCompletionsUri() {
        return URI.create(baseUrl + modelName() + "/v1/chat/completions");
    }

    @Override
    protected Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + apiToken);
    }

    // the inference API does not always report usage
    @Override
    protected Integer tokenCount(JsonNode root, String text) {
        Integer reported = super.tokenCount(root, text);
        return reported != null ? reported : approximateTokens(text);
    }

    @Override
    protected Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", "Hugging Face");
        details.put("api_url", baseUrl + modelName());
        return details;
    }
}

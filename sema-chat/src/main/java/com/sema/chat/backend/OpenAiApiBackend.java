package com.sema.chat.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.exception.ModelLoadException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * OpenAI chat completions.
 */
public class OpenAiApiBackend extends OpenAiCompatibleBackend {

    public static final String TYPE = "openai";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";

    private final String apiKey;
    private final String baseUrl;
    private final String organization;

    public OpenAiApiBackend(BackendSettings settings, ObjectMapper objectMapper,
                            String apiKey, String baseUrl, String organization) {
        super(settings, Set.of("chat", "streaming", "api_based", "function_calling"), objectMapper);
        this.apiKey = apiKey;
        this.baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : trimTrailingSlash(baseUrl);
        this.organization = organization;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected String providerName() {
        return "OpenAI";
    }

    @Override
    protected void validateConfiguration() {
        if (isBlank(apiKey)) {
            throw new ModelLoadException("OpenAI API key is required");
        }
    }

    @Override
    protected URI chatCompletionsUri() {
        return URI.create(baseUrl + "/v1/chat/completions");
    }

    @Override
    protected Map<String, String> authHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + apiKey);
        if (!isBlank(organization)) {
            headers.put("OpenAI-Organization", organization);
        }
        return headers;
    }

    @Override
    protected Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", "OpenAI");
        details.put("base_url", baseUrl);
        details.put("organization", organization);
        return details;
    }
}

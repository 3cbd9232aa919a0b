package com.sema.chat.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sema.chat.exception.GenerationException;
import com.sema.chat.exception.ModelLoadException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Base for backends that talk JSON over HTTP. Streaming responses are read as
 * server-sent events, one {@code data:} line per fragment.
 */
public abstract class HttpModelBackend extends AbstractModelBackend {

    private static final int MAX_ERROR_BODY = 500;

    protected final ObjectMapper objectMapper;
    private volatile HttpClient httpClient;

    protected HttpModelBackend(BackendSettings settings, Set<String> capabilities, ObjectMapper objectMapper) {
        super(settings, capabilities);
        this.objectMapper = objectMapper;
    }

    /**
     * Display name used in error messages, e.g. {@code OpenAI}.
     */
    protected abstract String providerName();

    /**
     * Throws {@link ModelLoadException} when a required credential or URL is missing.
     */
    protected abstract void validateConfiguration();

    @Override
    protected void doLoad() {
        validateConfiguration();
        httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    protected void doUnload() {
        httpClient = null;
    }

    protected JsonNode postJson(URI uri, Map<String, String> headers, ObjectNode body) {
        HttpRequest request = buildRequest(uri, headers, body);
        HttpResponse<String> response;
        try {
            response = client().send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GenerationException(providerName() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(providerName() + " request interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw httpError(response.statusCode(), response.body());
        }
        return readJson(response.body());
    }

    /**
     * Posts {@code body} and hands every non-blank response line to {@code handler}
     * until the handler returns false on the provider's terminal event. A body that
     * ends before that event is a truncated reply and fails the stream.
     */
    protected void streamLines(URI uri, Map<String, String> headers, ObjectNode body, LineHandler handler) {
        HttpRequest request = buildRequest(uri, headers, body);
        HttpResponse<InputStream> response;
        try {
            response = client().send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new GenerationException(providerName() + " streaming request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(providerName() + " streaming request interrupted");
        }

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
            if (response.statusCode() / 100 != 2) {
                StringBuilder errorBody = new StringBuilder();
                String line;
                while ((line = reader.readLine()) != null && errorBody.length() < MAX_ERROR_BODY) {
                    errorBody.append(line);
                }
                throw httpError(response.statusCode(), errorBody.toString());
            }
            String line;
            while ((line = reader.readLine()) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException(providerName() + " stream cancelled");
                }
                if (line.isBlank()) {
                    continue;
                }
                if (!handler.onLine(line)) {
                    return;
                }
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(providerName() + " stream cancelled");
            }
            throw new GenerationException(providerName() + " stream ended before completion");
        } catch (IOException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(providerName() + " stream cancelled");
            }
            throw new GenerationException(providerName() + " stream interrupted: " + e.getMessage(), e);
        }
    }

    protected JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Malformed " + providerName() + " response: " + abbreviate(json), e);
        }
    }

    /**
     * Payload of an SSE {@code data:} line, or null for comments and other fields.
     */
    protected static String sseData(String line) {
        if (!line.startsWith("data:")) {
            return null;
        }
        return line.substring(5).trim();
    }

    protected static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    protected static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Whitespace-separated word count, used where the provider reports no usage.
     */
    protected static int approximateTokens(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private HttpRequest buildRequest(URI uri, Map<String, String> headers, ObjectNode body) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Failed to serialize " + providerName() + " request", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(settings.requestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        headers.forEach(builder::header);
        return builder.build();
    }

    private HttpClient client() {
        HttpClient client = httpClient;
        if (client == null) {
            throw new GenerationException(providerName() + " client is not initialized");
        }
        return client;
    }

    private GenerationException httpError(int status, String body) {
        log.warn("{} returned HTTP {}: {}", providerName(), status, abbreviate(body));
        return new GenerationException(providerName() + " HTTP " + status + ": " + abbreviate(body), status, null);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }

    @FunctionalInterface
    protected interface LineHandler {
        /**
         * @return false once the provider's terminal event has been seen
         */
        boolean onLine(String line) throws IOException;
    }
}

package com.sema.chat.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.exception.GenerationException;
import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.exception.ModelNotLoadedException;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.GenerationParameters;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.model.StreamChunk;
import com.sema.chat.stream.ChatStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiApiBackendTest {

    private static final String COMPLETION = """
            {"id":"chatcmpl-1","choices":[{"index":0,"message":{"role":"assistant","content":"Hi there!"},
            "finish_reason":"stop"}],"usage":{"prompt_tokens":12,"completion_tokens":3}}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService executor;
    private MockProviderServer provider;

    @BeforeEach
    void setUp() throws Exception {
        executor = Executors.newCachedThreadPool();
        provider = MockProviderServer.start();
    }

    @AfterEach
    void tearDown() {
        provider.close();
        executor.shutdownNow();
    }

    private OpenAiApiBackend backend(String apiKey) {
        return new OpenAiApiBackend(ScriptedBackend.settings("gpt-4o-mini", executor), objectMapper,
                apiKey, provider.baseUrl(), "org-42");
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should refuse to load without an API key")
        void shouldRefuseToLoadWithoutApiKey() {
            // Given
            OpenAiApiBackend backend = backend("");

            // When / Then
            assertThatThrownBy(backend::load)
                    .isInstanceOf(ModelLoadException.class)
                    .hasMessageContaining("API key is required");
            assertThat(backend.isLoaded()).isFalse();
            assertThat(provider.requests()).isEmpty();
        }

        @Test
        @DisplayName("Should check the provider is reachable while loading")
        void shouldProbeProviderWhileLoading() {
            // Given
            provider.json("/v1/chat/completions", 200, COMPLETION);
            OpenAiApiBackend backend = backend("sk-test");

            // When
            backend.load();

            // Then
            assertThat(backend.isLoaded()).isTrue();
            assertThat(provider.requests()).hasSize(1);
            assertThat(provider.lastRequest().header("Authorization")).isEqualTo("Bearer sk-test");
            assertThat(provider.lastRequest().header("OpenAI-Organization")).isEqualTo("org-42");
        }

        @Test
        @DisplayName("Should wrap an unreachable provider into a load error")
        void shouldWrapUnreachableProviderIntoLoadError() {
            // Given
            provider.json("/v1/chat/completions", 401, "{\"error\":{\"message\":\"bad key\"}}");
            OpenAiApiBackend backend = backend("sk-wrong");

            // When / Then
            assertThatThrownBy(backend::load)
                    .isInstanceOf(ModelLoadException.class)
                    .hasMessageContaining("401");
            assertThat(backend.isLoaded()).isFalse();
        }

        @Test
        @DisplayName("Should fail fast when generating before load")
        void shouldFailFastBeforeLoad() {
            OpenAiApiBackend backend = backend("sk-test");

            assertThatThrownBy(() -> backend.generate(GenerationRequest.of(
                    List.of(ChatMessage.user("hi")), GenerationParameters.defaults())))
                    .isInstanceOf(ModelNotLoadedException.class);
            assertThat(provider.requests()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Generation")
    class Generation {

        @Test
        @DisplayName("Should send clamped parameters and parse the completion")
        void shouldSendClampedParametersAndParseCompletion() throws Exception {
            // Given
            provider.json("/v1/chat/completions", 200, COMPLETION);
            OpenAiApiBackend backend = backend("sk-test");
            backend.load();

            // When
            GenerationResult result = backend.generate(new GenerationRequest("s1",
                    List.of(ChatMessage.system("Be brief."), ChatMessage.user("hi")),
                    new GenerationParameters(1.7, 9000, -0.5, 0)));

            // Then
            assertThat(result.text()).isEqualTo("Hi there!");
            assertThat(result.tokenCount()).isEqualTo(3);
            assertThat(result.finishReason()).isEqualTo("stop");
            assertThat(result.modelName()).isEqualTo("gpt-4o-mini");
            assertThat(result.generationTime()).isNotNull();

            JsonNode sent = objectMapper.readTree(provider.lastRequest().body());
            assertThat(sent.path("model").asText()).isEqualTo("gpt-4o-mini");
            assertThat(sent.path("temperature").asDouble()).isEqualTo(1.0);
            assertThat(sent.path("max_tokens").asInt()).isEqualTo(2048);
            assertThat(sent.path("top_p").asDouble()).isEqualTo(0.0);
            assertThat(sent.path("stream").asBoolean()).isFalse();
            assertThat(sent.at("/messages/0/role").asText()).isEqualTo("system");
            assertThat(sent.at("/messages/1/content").asText()).isEqualTo("hi");
        }

        @Test
        @DisplayName("Should surface upstream errors with their status")
        void shouldSurfaceUpstreamErrors() {
            // Given
            provider.json("/v1/chat/completions", 200, COMPLETION);
            OpenAiApiBackend backend = backend("sk-test");
            backend.load();
            provider.json("/v1/chat/completions", 500, "{\"error\":\"overloaded\"}");

            // When / Then
            assertThatThrownBy(() -> backend.generate(GenerationRequest.of(
                    List.of(ChatMessage.user("hi")), GenerationParameters.defaults())))
                    .isInstanceOfSatisfying(GenerationException.class,
                            e -> assertThat(e.getUpstreamStatus()).isEqualTo(500));
        }

        @Test
        @DisplayName("Should treat an empty completion as a generation error")
        void shouldTreatEmptyCompletionAsError() {
            // Given
            provider.json("/v1/chat/completions", 200, COMPLETION);
            OpenAiApiBackend backend = backend("sk-test");
            backend.load();
            provider.json("/v1/chat/completions", 200,
                    "{\"choices\":[{\"message\":{\"content\":\"\"},\"finish_reason\":\"stop\"}]}");

            // When / Then
            assertThatThrownBy(() -> backend.generate(GenerationRequest.of(
                    List.of(ChatMessage.user("hi")), GenerationParameters.defaults())))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("empty completion");
        }

        @Test
        @DisplayName("Should reject a malformed response body")
        void shouldRejectMalformedResponse() {
            provider.json("/v1/chat/completions", 200, COMPLETION);
            OpenAiApiBackend backend = backend("sk-test");
            backend.load();
            provider.json("/v1/chat/completions", 200, "not json");

            assertThatThrownBy(() -> backend.generate(GenerationRequest.of(
                    List.of(ChatMessage.user("hi")), GenerationParameters.defaults())))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("Malformed");
        }
    }

    @Nested
    @DisplayName("Streaming")
    class Streaming {

        @Test
        @DisplayName("Should emit deltas in order and finish with one final chunk")
        void shouldEmitDeltasInOrder() {
            // Given
            provider.jsonOrSse("/v1/chat/completions", COMPLETION, List.of(
                    "{\"choices\":[{\"delta\":{\"role\":\"assistant\"},\"finish_reason\":null}]}",
                    "{\"choices\":[{\"delta\":{\"content\":\"Hi\"},\"finish_reason\":null}]}",
                    "{\"choices\":[{\"delta\":{\"content\":\" there\"},\"finish_reason\":null}]}",
                    "{\"choices\":[{\"delta\":{\"content\":\"!\"},\"finish_reason\":\"stop\"}]}",
                    "[DONE]"));
            OpenAiApiBackend backend = backend("sk-test");
            backend.load();

            // When
            List<StreamChunk> chunks = new ArrayList<>();
            try (ChatStream stream = backend.generateStream(new GenerationRequest("s1",
                    List.of(ChatMessage.user("hi")), GenerationParameters.defaults()))) {
                stream.forEachRemaining(chunks::add);
            }

            // Then
            assertThat(chunks).extracting(StreamChunk::content).containsExactly("Hi", " there", "!", "");
            assertThat(chunks).extracting(StreamChunk::chunkId).containsExactly(0, 1, 2, 3);
            assertThat(chunks).filteredOn(StreamChunk::isFinal).hasSize(1);
            assertThat(chunks.get(3).isFinal()).isTrue();
            assertThat(chunks).extracting(StreamChunk::sessionId).containsOnly("s1");
        }

        @Test
        @DisplayName("Should fail a stream cut off before finish_reason or [DONE]")
        void shouldFailTruncatedStream() {
            // Given
            provider.jsonOrSse("/v1/chat/completions", COMPLETION, List.of(
                    "{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}"));
            OpenAiApiBackend backend = backend("sk-test");
            backend.load();

            // When
            List<StreamChunk> chunks = new ArrayList<>();
            ChatStream stream = backend.generateStream(GenerationRequest.of(
                    List.of(ChatMessage.user("hi")), GenerationParameters.defaults()));

            // Then
            assertThatThrownBy(() -> stream.forEachRemaining(chunks::add))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("stream ended before completion");
            assertThat(chunks).extracting(StreamChunk::content).containsExactly("Hel");
            assertThat(chunks).noneMatch(StreamChunk::isFinal);
            assertThat(stream.isCompleted()).isFalse();
        }

        @Test
        @DisplayName("Should abort without a final chunk when the provider rejects the stream")
        void shouldAbortWithoutFinalChunk() {
            // Given
            provider.json("/v1/chat/completions", 200, COMPLETION);
            OpenAiApiBackend backend = backend("sk-test");
            backend.load();
            provider.json("/v1/chat/completions", 429, "{\"error\":\"rate limited\"}");

            // When
            List<StreamChunk> chunks = new ArrayList<>();
            ChatStream stream = backend.generateStream(GenerationRequest.of(
                    List.of(ChatMessage.user("hi")), GenerationParameters.defaults()));

            // Then
            assertThatThrownBy(() -> stream.forEachRemaining(chunks::add))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("429");
            assertThat(chunks).isEmpty();
            assertThat(stream.isCompleted()).isFalse();
        }
    }
}

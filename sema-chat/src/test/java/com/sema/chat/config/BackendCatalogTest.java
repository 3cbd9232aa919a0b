package com.sema.chat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.backend.BackendRegistry;
import com.sema.chat.backend.BackendSettings;
import com.sema.chat.backend.ModelBackend;
import com.sema.chat.backend.OpenAiApiBackend;
import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.model.SupportedBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendCatalogTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final ChatProperties properties = new ChatProperties();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should register every built-in backend type")
    void shouldRegisterBuiltIns() {
        BackendRegistry registry = BackendCatalog.standard(properties, new ObjectMapper(), executor);

        assertThat(registry.supportedBackends()).extracting(SupportedBackend::type)
                .containsExactly("local", "hf_api", "openai", "anthropic", "minimax", "google");
    }

    @Test
    @DisplayName("Should report unconfigured API backends without building them")
    void shouldFlagMissingKeys() {
        BackendRegistry registry = BackendCatalog.standard(properties, new ObjectMapper(), executor);

        assertThat(registry.supportedBackends())
                .filteredOn(SupportedBackend::configured)
                .extracting(SupportedBackend::type)
                .containsExactly("local");
        assertThatThrownBy(() -> registry.create("minimax", "MiniMax-M1"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("sema.chat.minimax.api-key")
                .hasMessageContaining("sema.chat.minimax.api-url");
    }

    @Test
    @DisplayName("Should build an unloaded backend once its key is set")
    void shouldBuildConfiguredBackend() {
        properties.getOpenai().setApiKey("sk-test");
        BackendRegistry registry = BackendCatalog.standard(properties, new ObjectMapper(), executor);

        ModelBackend backend = registry.create("openai", "gpt-4o-mini");

        assertThat(backend).isInstanceOf(OpenAiApiBackend.class);
        assertThat(backend.modelName()).isEqualTo("gpt-4o-mini");
        assertThat(backend.isLoaded()).isFalse();
    }

    @Test
    @DisplayName("Should carry configured defaults and timeouts into backend settings")
    void shouldMapSettings() {
        properties.getGeneration().setTemperature(3.0);
        properties.getBackend().setRequestTimeout(Duration.ofSeconds(7));
        properties.getStreaming().setChannelCapacity(5);

        BackendSettings settings = BackendCatalog.settings(properties, "m", executor);

        assertThat(settings.modelName()).isEqualTo("m");
        assertThat(settings.defaults().temperature()).isEqualTo(1.0);
        assertThat(settings.requestTimeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(settings.channelCapacity()).isEqualTo(5);
        assertThat(settings.streamExecutor()).isSameAs(executor);
    }

    @Test
    @DisplayName("Should resolve each local model name to its own weights file")
    void shouldResolveLocalWeightsPerModel(@TempDir Path models) {
        properties.getLocal().setModelPath(models.toString());

        Path tinyLlama = BackendCatalog.localWeights(properties, "TinyLlama/TinyLlama-1.1B-Chat-v1.0");
        Path qwen = BackendCatalog.localWeights(properties, "Qwen/Qwen2.5-0.5B-Instruct");

        assertThat(tinyLlama).isEqualTo(models.resolve("TinyLlama-1.1B-Chat-v1.0.gguf"));
        assertThat(qwen).isEqualTo(models.resolve("Qwen2.5-0.5B-Instruct.gguf"));
        assertThat(tinyLlama).isNotEqualTo(qwen);
    }

    @Test
    @DisplayName("Should prefer an explicit weights mapping over the model directory")
    void shouldPreferMappedWeights(@TempDir Path models) {
        properties.getLocal().setModelPath(models.toString());
        properties.getLocal().getModels().put("Qwen/Qwen2.5-0.5B-Instruct", "/opt/weights/qwen-q4.gguf");

        assertThat(BackendCatalog.localWeights(properties, "Qwen/Qwen2.5-0.5B-Instruct"))
                .isEqualTo(Path.of("/opt/weights/qwen-q4.gguf"));
    }

    @Test
    @DisplayName("Should serve a single configured weights file only for the configured model")
    void shouldKeepSingleWeightsFileForConfiguredModel(@TempDir Path models) {
        Path configured = models.resolve("tinyllama-q4.gguf");
        properties.getLocal().setModelPath(configured.toString());
        properties.getBackend().setModelName("TinyLlama/TinyLlama-1.1B-Chat-v1.0");

        assertThat(BackendCatalog.localWeights(properties, "TinyLlama/TinyLlama-1.1B-Chat-v1.0"))
                .isEqualTo(configured);
        assertThat(BackendCatalog.localWeights(properties, "microsoft/Phi-3-mini-4k-instruct"))
                .isEqualTo(models.toAbsolutePath().resolve("Phi-3-mini-4k-instruct.gguf"));
    }

    @Test
    @DisplayName("Should fail to load a local model whose weights are absent")
    void shouldFailLoadForMissingLocalWeights(@TempDir Path models) {
        properties.getLocal().setModelPath(models.toString());
        BackendRegistry registry = BackendCatalog.standard(properties, new ObjectMapper(), executor);

        ModelBackend backend = registry.create("local", "Qwen/Qwen2.5-0.5B-Instruct");

        assertThat(backend.describe().details())
                .containsEntry("model_path", models.resolve("Qwen2.5-0.5B-Instruct.gguf").toString());
        assertThatThrownBy(backend::load)
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Qwen2.5-0.5B-Instruct.gguf");
        assertThat(backend.isLoaded()).isFalse();
    }
}

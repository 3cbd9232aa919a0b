package com.sema.chat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.backend.AnthropicApiBackend;
import com.sema.chat.backend.BackendRegistration;
import com.sema.chat.backend.BackendRegistry;
import com.sema.chat.backend.BackendSettings;
import com.sema.chat.backend.GoogleAiBackend;
import com.sema.chat.backend.HuggingFaceApiBackend;
import com.sema.chat.backend.LlamaCppInferenceEngine;
import com.sema.chat.backend.LocalModelBackend;
import com.sema.chat.backend.MiniMaxApiBackend;
import com.sema.chat.backend.OpenAiApiBackend;
import com.sema.chat.model.GenerationParameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * The built-in backend registrations, bound to {@link ChatProperties}.
 */
public final class BackendCatalog {

    private static final String GGUF_SUFFIX = ".gguf";

    private BackendCatalog() {
    }

    public static BackendRegistry standard(ChatProperties properties, ObjectMapper objectMapper,
                                           ExecutorService streamExecutor) {
        BackendRegistry registry = new BackendRegistry();

        registry.register(new BackendRegistration(
                LocalModelBackend.TYPE,
                "Local Model",
                "Run GGUF models locally through llama.cpp",
                List.of("sema.chat.local.model-path"),
                Set.of("chat", "streaming", "offline", "instruction_following"),
                List.of("TinyLlama/TinyLlama-1.1B-Chat-v1.0", "microsoft/Phi-3-mini-4k-instruct",
                        "Qwen/Qwen2.5-0.5B-Instruct"),
                () -> missing(properties.getLocal().getModelPath(), "sema.chat.local.model-path"),
                modelName -> {
                    ChatProperties.LocalConfig local = properties.getLocal();
                    return new LocalModelBackend(
                            settings(properties, modelName, streamExecutor),
                            new LlamaCppInferenceEngine(localWeights(properties, modelName), local.getDevice(),
                                    local.getGpuLayers()),
                            local.getMaxLength());
                }));

        registry.register(new BackendRegistration(
                HuggingFaceApiBackend.TYPE,
                "Hugging Face Inference API",
                "Use Hugging Face hosted models through the Inference API",
                List.of("sema.chat.huggingface.api-token"),
                Set.of("chat", "streaming", "api_based"),
                List.of("microsoft/DialoGPT-large", "HuggingFaceH4/zephyr-7b-beta",
                        "mistralai/Mistral-7B-Instruct-v0.2"),
                () -> missing(properties.getHuggingface().getApiToken(), "sema.chat.huggingface.api-token"),
                modelName -> new HuggingFaceApiBackend(
                        settings(properties, modelName, streamExecutor), objectMapper,
                        properties.getHuggingface().getApiToken(), properties.getHuggingface().getBaseUrl())));

        registry.register(new BackendRegistration(
                OpenAiApiBackend.TYPE,
                "OpenAI API",
                "Use OpenAI chat models",
                List.of("sema.chat.openai.api-key"),
                Set.of("chat", "streaming", "api_based", "function_calling"),
                List.of("gpt-3.5-turbo", "gpt-4", "gpt-4o-mini"),
                () -> missing(properties.getOpenai().getApiKey(), "sema.chat.openai.api-key"),
                modelName -> new OpenAiApiBackend(
                        settings(properties, modelName, streamExecutor), objectMapper,
                        properties.getOpenai().getApiKey(), properties.getOpenai().getBaseUrl(),
                        properties.getOpenai().getOrgId())));

        registry.register(new BackendRegistration(
                AnthropicApiBackend.TYPE,
                "Anthropic API",
                "Use Anthropic Claude models",
                List.of("sema.chat.anthropic.api-key"),
                Set.of("chat", "streaming", "api_based", "long_context"),
                List.of("claude-3-haiku-20240307", "claude-3-5-sonnet-20241022"),
                () -> missing(properties.getAnthropic().getApiKey(), "sema.chat.anthropic.api-key"),
                modelName -> new AnthropicApiBackend(
                        settings(properties, modelName, streamExecutor), objectMapper,
                        properties.getAnthropic().getApiKey(), properties.getAnthropic().getBaseUrl(),
                        properties.getAnthropic().getVersion())));

        registry.register(new BackendRegistration(
                MiniMaxApiBackend.TYPE,
                "MiniMax API",
                "Use MiniMax models with reasoning output",
                List.of("sema.chat.minimax.api-key", "sema.chat.minimax.api-url"),
                Set.of("chat", "streaming", "reasoning", "api_based"),
                List.of("MiniMax-M1"),
                () -> {
                    List<String> missing = new ArrayList<>();
                    missing.addAll(missing(properties.getMinimax().getApiKey(), "sema.chat.minimax.api-key"));
                    missing.addAll(missing(properties.getMinimax().getApiUrl(), "sema.chat.minimax.api-url"));
                    return missing;
                },
                modelName -> new MiniMaxApiBackend(
                        settings(properties, modelName, streamExecutor), objectMapper,
                        properties.getMinimax().getApiKey(), properties.getMinimax().getApiUrl(),
                        properties.getMinimax().getModelVersion())));

        registry.register(new BackendRegistration(
                GoogleAiBackend.TYPE,
                "Google AI Studio",
                "Use Google Gemini models",
                List.of("sema.chat.google.api-key"),
                Set.of("chat", "streaming", "api_based"),
                List.of("gemini-1.5-flash", "gemini-1.5-pro"),
                () -> missing(properties.getGoogle().getApiKey(), "sema.chat.google.api-key"),
                modelName -> new GoogleAiBackend(
                        settings(properties, modelName, streamExecutor), objectMapper,
                        properties.getGoogle().getApiKey(), properties.getGoogle().getBaseUrl())));

        return registry;
    }

    static BackendSettings settings(ChatProperties properties, String modelName, ExecutorService streamExecutor) {
        ChatProperties.GenerationConfig generation = properties.getGeneration();
        return new BackendSettings(
                modelName,
                new GenerationParameters(generation.getTemperature(), generation.getMaxNewTokens(),
                        generation.getTopP(), generation.getTopK()).normalized(),
                properties.getBackend().getRequestTimeout(),
                properties.getBackend().getHealthTimeout(),
                properties.getStreaming().getStreamDelay(),
                properties.getStreaming().getChannelCapacity(),
                streamExecutor);
    }

    /**
     * Weights file for a local model: an explicit {@code local.models} entry wins, otherwise
     * {@code <model-path>/<last name segment>.gguf}. When model-path names a single .gguf file
     * it serves only {@code backend.model-name}; other models are looked up beside it.
     */
    static Path localWeights(ChatProperties properties, String modelName) {
        ChatProperties.LocalConfig local = properties.getLocal();
        String mapped = local.getModels().get(modelName);
        if (mapped != null && !mapped.isBlank()) {
            return Path.of(mapped);
        }
        Path configured = Path.of(local.getModelPath());
        Path directory = configured;
        if (configured.getFileName() != null && configured.getFileName().toString().endsWith(GGUF_SUFFIX)) {
            if (modelName.equals(properties.getBackend().getModelName())) {
                return configured;
            }
            directory = configured.toAbsolutePath().getParent();
        }
        String fileName = modelName.substring(modelName.lastIndexOf('/') + 1);
        return directory.resolve(fileName + GGUF_SUFFIX);
    }

    private static List<String> missing(String value, String setting) {
        return value == null || value.isBlank() ? List.of(setting) : List.of();
    }
}

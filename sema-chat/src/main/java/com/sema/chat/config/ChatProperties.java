package com.sema.chat.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "sema.chat")
public class ChatProperties {

    private BackendConfig backend = new BackendConfig();
    private GenerationConfig generation = new GenerationConfig();
    private LocalConfig local = new LocalConfig();
    private HuggingFaceConfig huggingface = new HuggingFaceConfig();
    private OpenAiConfig openai = new OpenAiConfig();
    private AnthropicConfig anthropic = new AnthropicConfig();
    private MiniMaxConfig minimax = new MiniMaxConfig();
    private GoogleConfig google = new GoogleConfig();
    private SessionConfig session = new SessionConfig();
    private StreamingConfig streaming = new StreamingConfig();

    private String systemPrompt = "You are a helpful, harmless, and honest AI assistant. "
            + "Respond in a friendly and professional manner.";
    private String systemPromptChat = "You are a friendly chatbot. Keep your responses concise and helpful.";
    private String systemPromptCode = "You are a coding assistant. Provide clear, well-commented code examples.";
    private String systemPromptCreative = "You are a creative writing assistant. Be imaginative and engaging.";

    @Data
    public static class BackendConfig {
        private String type = "local";
        private String modelName = "TinyLlama/TinyLlama-1.1B-Chat-v1.0";
        private Duration healthTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class GenerationConfig {
        private double temperature = 0.7;
        private int maxNewTokens = 512;
        private double topP = 0.9;
        private int topK = 50;
        // 0 disables history trimming
        private int contextTokenBudget = 0;
    }

    @Data
    public static class LocalConfig {
        // directory of <model>.gguf files, or a single .gguf file for backend.model-name
        private String modelPath = "./models";
        // model name to weights file, overriding the model-path lookup
        private Map<String, String> models = new LinkedHashMap<>();
        private String device = "auto";
        private int gpuLayers = 0;
        private int maxLength = 2048;
    }

    @Data
    public static class HuggingFaceConfig {
        private String apiToken;
        private String baseUrl;
    }

    @Data
    public static class OpenAiConfig {
        private String apiKey;
        private String orgId;
        private String baseUrl;
    }

    @Data
    public static class AnthropicConfig {
        private String apiKey;
        private String baseUrl;
        private String version = "2023-06-01";
    }

    @Data
    public static class MiniMaxConfig {
        private String apiKey;
        private String apiUrl;
        private String modelVersion = "MiniMax-M1";
    }

    @Data
    public static class GoogleConfig {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class SessionConfig {
        private StorageType storage = StorageType.MEMORY;
        private Duration timeout = Duration.ofMinutes(30);
        private int maxMessagesPerSession = 100;
        private Duration sweepInterval = Duration.ofMinutes(5);
        private String keyPrefix = "session:";
    }

    @Data
    public static class StreamingConfig {
        private boolean enabled = true;
        private int maxConcurrentStreams = 10;
        private Duration streamDelay = Duration.ofMillis(10);
        private int channelCapacity = 64;
        private Duration emitterTimeout = Duration.ofMinutes(5);
    }

    public enum StorageType {
        MEMORY,
        REDIS
    }
}

package com.sema.chat.service;

import com.sema.chat.backend.ModelBackend;
import com.sema.chat.config.ChatProperties;
import com.sema.chat.dto.ChatRequest;
import com.sema.chat.exception.ChatValidationException;
import com.sema.chat.exception.SessionNotFoundException;
import com.sema.chat.exception.StreamCapacityException;
import com.sema.chat.metrics.ChatMetrics;
import com.sema.chat.model.BackendHealth;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.ConversationHistory;
import com.sema.chat.model.GenerationParameters;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.model.MessageRole;
import com.sema.chat.model.SessionInfo;
import com.sema.chat.session.SessionStore;
import com.sema.chat.stream.ChatStream;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for chat turns. Composes the session store and the active backend,
 * persists both sides of each exchange and bounds concurrent streams.
 */
@Slf4j
public class ChatManager {

    static final int MAX_MESSAGE_LENGTH = 4000;
    static final int MAX_SYSTEM_PROMPT_LENGTH = 1000;

    private final ModelManager modelManager;
    private final SessionStore sessionStore;
    private final ChatProperties properties;
    private final ChatMetrics metrics;
    private final PromptAssembler promptAssembler;
    private final GenerationParameters defaults;
    private final AtomicInteger activeStreams = new AtomicInteger();

    public ChatManager(ModelManager modelManager, SessionStore sessionStore, ChatProperties properties,
                       ChatMetrics metrics) {
        this.modelManager = modelManager;
        this.sessionStore = sessionStore;
        this.properties = properties;
        this.metrics = metrics;
        this.promptAssembler = new PromptAssembler(properties.getGeneration().getContextTokenBudget());
        ChatProperties.GenerationConfig generation = properties.getGeneration();
        this.defaults = new GenerationParameters(generation.getTemperature(), generation.getMaxNewTokens(),
                generation.getTopP(), generation.getTopK());
        metrics.bindActiveStreams(activeStreams);
    }

    /**
     * Complete-response path. The user turn is stored before generation starts, so it
     * survives a generation failure.
     */
    public GenerationResult process(ChatRequest request) {
        validate(request);
        String sessionId = request.sessionId();
        sessionStore.ensure(sessionId);
        sessionStore.append(sessionId, ChatMessage.user(request.message()));

        ModelBackend backend = modelManager.getBackend();
        GenerationResult result;
        try {
            result = backend.generate(buildGenerationRequest(request));
        } catch (RuntimeException e) {
            metrics.recordGenerationError();
            log.error("Generation failed for session {}: {}", sessionId, e.getMessage());
            throw e;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("model_name", result.modelName());
        metadata.put("token_count", result.tokenCount());
        metadata.put("finish_reason", result.finishReason());
        metadata.put("generation_time", result.generationSeconds());
        sessionStore.append(sessionId,
                new ChatMessage(result.messageId(), MessageRole.ASSISTANT, result.text(), null, metadata));
        metrics.recordMessageProcessed(result.generationTime());
        log.info("Processed message for session {} in {}s", sessionId, result.generationSeconds());
        return result;
    }

    /**
     * Streaming path. Fails immediately with {@link StreamCapacityException} when the
     * concurrent stream cap is reached. The caller must close the returned stream.
     */
    public ChatStream processStream(ChatRequest request) {
        validate(request);
        if (!properties.getStreaming().isEnabled()) {
            throw new ChatValidationException("stream", "Streaming is disabled");
        }
        acquireStreamSlot();
        try {
            String sessionId = request.sessionId();
            sessionStore.ensure(sessionId);
            sessionStore.append(sessionId, ChatMessage.user(request.message()));
            ModelBackend backend = modelManager.getBackend();
            ChatStream upstream = backend.generateStream(buildGenerationRequest(request));
            metrics.recordStreamStarted();
            log.debug("Started stream {} for session {} ({} active)", upstream.messageId(), sessionId,
                    activeStreams.get());
            return new PersistingChatStream(upstream, sessionStore, metrics, backend.modelName(),
                    this::releaseStreamSlot);
        } catch (RuntimeException e) {
            releaseStreamSlot();
            if (!(e instanceof ChatValidationException)) {
                metrics.recordGenerationError();
            }
            throw e;
        }
    }

    /**
     * @param limit newest messages only, or null for all
     * @throws SessionNotFoundException if the session does not exist
     */
    public ConversationHistory getHistory(String sessionId, Integer limit) {
        ConversationHistory history = sessionStore.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (limit == null) {
            return history;
        }
        return new ConversationHistory(history.sessionId(), SessionStore.newest(history.messages(), limit),
                history.createdAt(), history.updatedAt(), 0);
    }

    public boolean clear(String sessionId) {
        boolean removed = sessionStore.delete(sessionId);
        if (removed) {
            metrics.recordSessionCleared();
        }
        return removed;
    }

    public List<SessionInfo> listSessions() {
        String modelName = modelManager.getSelection() == null ? null : modelManager.getSelection().modelName();
        return sessionStore.listActive().stream()
                .map(history -> SessionInfo.of(history, modelName))
                .toList();
    }

    public HealthReport health() {
        boolean ready = modelManager.isReady();
        BackendHealth backendHealth = modelManager.health();
        boolean storageReachable = sessionStore.ping();
        String status;
        if (ready && backendHealth.isHealthy() && storageReachable) {
            status = "healthy";
        } else if (ready || storageReachable) {
            status = "degraded";
        } else {
            status = "unhealthy";
        }
        return new HealthReport(status, ready, backendHealth, sessionStore.storageType(), storageReachable,
                activeStreams.get(), properties.getStreaming().getMaxConcurrentStreams(), Instant.now());
    }

    public int activeStreams() {
        return activeStreams.get();
    }

    GenerationRequest buildGenerationRequest(ChatRequest request) {
        List<ChatMessage> history = sessionStore.read(request.sessionId(), null);
        List<ChatMessage> messages = promptAssembler.assemble(resolveSystemPrompt(request), history);
        GenerationParameters parameters = defaults.withOverrides(
                request.temperature(), request.maxTokens(), request.topP(), request.topK());
        return new GenerationRequest(request.sessionId(), messages, parameters);
    }

    String resolveSystemPrompt(ChatRequest request) {
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            return request.systemPrompt();
        }
        String promptType = request.promptType() == null ? "" : request.promptType().toLowerCase();
        return switch (promptType) {
            case "chat" -> properties.getSystemPromptChat();
            case "code" -> properties.getSystemPromptCode();
            case "creative" -> properties.getSystemPromptCreative();
            default -> properties.getSystemPrompt();
        };
    }

    private void validate(ChatRequest request) {
        if (request == null) {
            throw new ChatValidationException("request", "Request is required");
        }
        if (request.sessionId() == null || request.sessionId().isBlank()) {
            throw new ChatValidationException("session_id", "Session id is required");
        }
        if (request.message() == null || request.message().isBlank()) {
            throw new ChatValidationException("message", "Message must not be empty");
        }
        if (request.message().length() > MAX_MESSAGE_LENGTH) {
            throw new ChatValidationException("message",
                    "Message exceeds " + MAX_MESSAGE_LENGTH + " characters");
        }
        if (request.systemPrompt() != null && request.systemPrompt().length() > MAX_SYSTEM_PROMPT_LENGTH) {
            throw new ChatValidationException("system_prompt",
                    "System prompt exceeds " + MAX_SYSTEM_PROMPT_LENGTH + " characters");
        }
    }

    private void acquireStreamSlot() {
        int max = properties.getStreaming().getMaxConcurrentStreams();
        while (true) {
            int current = activeStreams.get();
            if (current >= max) {
                metrics.recordStreamRejected();
                log.warn("Rejected stream: {} of {} slots in use", current, max);
                throw new StreamCapacityException(max);
            }
            if (activeStreams.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }

    private void releaseStreamSlot() {
        activeStreams.decrementAndGet();
    }
}

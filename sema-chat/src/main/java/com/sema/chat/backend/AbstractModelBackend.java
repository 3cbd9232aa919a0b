package com.sema.chat.backend;

import com.sema.chat.exception.GenerationException;
import com.sema.chat.exception.ModelBackendException;
import com.sema.chat.exception.ModelLoadException;
import com.sema.chat.exception.ModelNotLoadedException;
import com.sema.chat.model.BackendDescriptor;
import com.sema.chat.model.BackendHealth;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.GenerationParameters;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.stream.ChatStream;
import com.sema.chat.stream.ChunkChannel;
import com.sema.chat.stream.ChunkSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared lifecycle, parameter normalization, error mapping and stream plumbing.
 * Subclasses implement the provider-specific {@code do*} hooks only.
 */
public abstract class AbstractModelBackend implements ModelBackend {

    private static final List<ChatMessage> PROBE_MESSAGES = List.of(ChatMessage.user("Hello"));

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final BackendSettings settings;
    private final Set<String> capabilities;
    private volatile boolean loaded;

    protected AbstractModelBackend(BackendSettings settings, Set<String> capabilities) {
        this.settings = settings;
        this.capabilities = Set.copyOf(capabilities);
    }

    protected abstract void doLoad();

    protected abstract void doUnload();

    protected abstract GenerationResult doGenerate(GenerationRequest request, String messageId);

    /**
     * Writes fragments into {@code sink} in generation order. Returning normally ends
     * the stream with the final chunk; throwing aborts it.
     */
    protected abstract void doStream(GenerationRequest request, ChunkSink sink);

    /**
     * Provider-specific fields for {@link #describe()}.
     */
    protected Map<String, Object> details() {
        return Map.of();
    }

    /**
     * Executor that runs streaming producers.
     */
    protected ExecutorService producerExecutor() {
        return settings.streamExecutor();
    }

    @Override
    public String modelName() {
        return settings.modelName();
    }

    @Override
    public boolean isLoaded() {
        return loaded;
    }

    @Override
    public final void load() {
        if (loaded) {
            return;
        }
        log.info("Loading {} backend for model {}", type(), modelName());
        try {
            doLoad();
            probe();
            loaded = true;
            log.info("{} backend ready for model {}", type(), modelName());
        } catch (ModelLoadException e) {
            log.error("Failed to load {} backend for {}: {}", type(), modelName(), e.getMessage());
            release();
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to load {} backend for {}", type(), modelName(), e);
            release();
            throw new ModelLoadException(
                    "Failed to initialize " + type() + " backend for " + modelName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public final boolean unload() {
        loaded = false;
        boolean released = release();
        if (released) {
            log.info("{} backend unloaded for model {}", type(), modelName());
        }
        return released;
    }

    @Override
    public final GenerationResult generate(GenerationRequest request) {
        ensureLoaded();
        GenerationRequest normalized = request.normalized();
        String messageId = UUID.randomUUID().toString();
        long started = System.nanoTime();
        GenerationResult result;
        try {
            result = doGenerate(normalized, messageId);
        } catch (ModelBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} generation failed for model {}", type(), modelName(), e);
            throw new GenerationException(
                    "Failed to generate response via " + type() + ": " + e.getMessage(), e);
        }
        if (result == null || result.text() == null || result.text().isBlank()) {
            throw new GenerationException(type() + " backend returned an empty completion");
        }
        return result.withGenerationTime(Duration.ofNanos(System.nanoTime() - started));
    }

    @Override
    public final ChatStream generateStream(GenerationRequest request) {
        ensureLoaded();
        GenerationRequest normalized = request.normalized();
        ChunkChannel channel = new ChunkChannel(normalized.sessionId(), UUID.randomUUID().toString(),
                settings.channelCapacity(), settings.streamDelay());
        Future<?> producer = producerExecutor().submit(() -> produce(normalized, channel));
        channel.onCancel(() -> producer.cancel(true));
        return channel;
    }

    @Override
    public BackendDescriptor describe() {
        GenerationParameters defaults = settings.defaults();
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("temperature", defaults.temperature());
        parameters.put("max_tokens", defaults.maxTokens());
        parameters.put("top_p", defaults.topP());
        parameters.put("top_k", defaults.topK());
        return new BackendDescriptor(modelName(), type(), loaded, capabilities, parameters, details());
    }

    @Override
    public BackendHealth health() {
        if (!loaded) {
            return BackendHealth.unhealthy(modelName(), "model_not_loaded");
        }
        long started = System.nanoTime();
        CompletableFuture<GenerationResult> trial = CompletableFuture.supplyAsync(
                () -> generate(GenerationRequest.of(PROBE_MESSAGES, new GenerationParameters(0.1, 10, 0.9, 50))),
                settings.streamExecutor());
        try {
            trial.get(settings.healthTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return BackendHealth.healthy(modelName(), Duration.ofNanos(System.nanoTime() - started));
        } catch (TimeoutException e) {
            trial.cancel(true);
            log.warn("{} health check timed out after {}", type(), settings.healthTimeout());
            return BackendHealth.timeout(modelName());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} health check failed: {}", type(), cause.getMessage());
            return BackendHealth.unhealthy(modelName(), "generation_error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BackendHealth.unhealthy(modelName(), "interrupted");
        }
    }

    protected GenerationParameters probeParameters() {
        return new GenerationParameters(0.1, 5, 0.9, 50);
    }

    /**
     * Lightweight connectivity check run by {@link #load()}.
     */
    protected void probe() {
        doGenerate(GenerationRequest.of(PROBE_MESSAGES, probeParameters()).normalized(), UUID.randomUUID().toString());
    }

    private void produce(GenerationRequest request, ChunkChannel channel) {
        try {
            doStream(request, channel);
            if (channel.emittedCount() == 0) {
                channel.fail(new GenerationException(type() + " backend returned an empty completion"));
                return;
            }
            channel.complete();
            log.debug("{} stream {} completed with {} chunks", type(), channel.messageId(), channel.emittedCount());
        } catch (CancellationException e) {
            log.debug("{} stream {} cancelled by consumer", type(), channel.messageId());
        } catch (ModelBackendException e) {
            log.error("{} streaming failed for model {}: {}", type(), modelName(), e.getMessage());
            channel.fail(e);
        } catch (RuntimeException e) {
            log.error("{} streaming failed for model {}", type(), modelName(), e);
            channel.fail(new GenerationException(
                    "Failed to generate streaming response via " + type() + ": " + e.getMessage(), e));
        }
    }

    private void ensureLoaded() {
        if (!loaded) {
            throw new ModelNotLoadedException(type() + " backend for " + modelName() + " is not loaded");
        }
    }

    private boolean release() {
        try {
            doUnload();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to release {} backend resources for {}", type(), modelName(), e);
            return false;
        }
    }
}

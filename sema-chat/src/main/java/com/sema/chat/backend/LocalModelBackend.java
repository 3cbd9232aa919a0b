package com.sema.chat.backend;

import com.sema.chat.exception.GenerationException;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.GenerationParameters;
import com.sema.chat.model.GenerationRequest;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.stream.ChunkSink;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a model in-process. All inference happens on one dedicated worker thread so
 * request threads never block on the engine and the engine never sees concurrent calls.
 */
public class LocalModelBackend extends AbstractModelBackend {

    public static final String TYPE = "local";
    static final int CHARS_PER_TOKEN = 4;

    private final LocalInferenceEngine engine;
    private final int maxLength;
    private volatile ExecutorService inferenceWorker;

    public LocalModelBackend(BackendSettings settings, LocalInferenceEngine engine, int maxLength) {
        super(settings, Set.of("chat", "streaming", "offline", "instruction_following"));
        this.engine = engine;
        this.maxLength = maxLength;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected void doLoad() {
        inferenceWorker = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("local-inference-"));
        engine.load();
    }

    @Override
    protected void doUnload() {
        ExecutorService worker = inferenceWorker;
        inferenceWorker = null;
        if (worker != null) {
            worker.shutdownNow();
            try {
                if (!worker.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Local inference worker did not stop within 30s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        engine.close();
    }

    @Override
    protected ExecutorService producerExecutor() {
        return worker();
    }

    @Override
    protected GenerationResult doGenerate(GenerationRequest request, String messageId) {
        String prompt = formatPrompt(request);
        Future<GenerationResult> pending = worker().submit(() -> {
            StringBuilder text = new StringBuilder();
            int tokens = engine.generate(prompt, request.parameters(), text::append);
            String finishReason = tokens >= request.parameters().maxTokens() ? "length" : "stop";
            return new GenerationResult(messageId, text.toString(), modelName(), tokens, finishReason, null);
        });
        try {
            return pending.get(settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new GenerationException("Local generation timed out after " + settings.requestTimeout(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationException("Local generation failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new GenerationException("Interrupted while waiting for local generation", e);
        }
    }

    @Override
    protected void doStream(GenerationRequest request, ChunkSink sink) {
        engine.generate(formatPrompt(request), request.parameters(), sink::emit);
    }

    /**
     * Plain transcript ending with an open assistant turn. The oldest text is cut
     * when the prompt would not leave room for {@code maxTokens} within the context.
     */
    String formatPrompt(GenerationRequest request) {
        StringBuilder prompt = new StringBuilder();
        for (ChatMessage message : request.messages()) {
            prompt.append(label(message)).append(": ").append(message.content()).append('\n');
        }
        prompt.append("Assistant: ");
        GenerationParameters params = request.parameters();
        int budgetChars = Math.max(1, maxLength - params.maxTokens()) * CHARS_PER_TOKEN;
        if (prompt.length() > budgetChars) {
            return prompt.substring(prompt.length() - budgetChars);
        }
        return prompt.toString();
    }

    private static String label(ChatMessage message) {
        return switch (message.role()) {
            case SYSTEM -> "System";
            case USER -> "User";
            case ASSISTANT -> "Assistant";
        };
    }

    private ExecutorService worker() {
        ExecutorService worker = inferenceWorker;
        if (worker == null) {
            throw new GenerationException("Local inference worker is not running");
        }
        return worker;
    }

    @Override
    protected Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>(engine.details());
        details.put("max_length", maxLength);
        return details;
    }
}

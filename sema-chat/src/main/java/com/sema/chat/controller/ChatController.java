package com.sema.chat.controller;

import com.sema.chat.config.ChatProperties;
import com.sema.chat.dto.ChatRequest;
import com.sema.chat.dto.ChatResponse;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.model.StreamChunk;
import com.sema.chat.service.ChatManager;
import com.sema.chat.stream.ChatStream;
import jakarta.annotation.PreDestroy;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Chat endpoints: complete responses and Server-Sent Events streaming.
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class ChatController {

    private final ChatManager chatManager;
    private final ChatProperties properties;
    private final ExecutorService streamPump =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("sse-stream-"));

    public ChatController(ChatManager chatManager, ChatProperties properties) {
        this.chatManager = chatManager;
        this.properties = properties;
    }

    /**
     * Send a message and receive the complete assistant reply.
     * A session id is generated when the request has none.
     */
    @PostMapping("/chat")
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        ChatRequest resolved = request.sessionId() == null || request.sessionId().isBlank()
                ? request.withSessionId(UUID.randomUUID().toString())
                : request;
        log.info("Chat request for session {}", resolved.sessionId());
        GenerationResult result = chatManager.process(resolved);
        return ChatResponse.from(result, resolved.sessionId());
    }

    /**
     * Stream the assistant reply as {@code chunk} events, then {@code done}; an
     * {@code error} event marks an aborted stream.
     *
     * Example: GET /api/v1/chat/stream?message=Hello&session_id=s1
     */
    @GetMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamChat(
            @RequestParam String message,
            @RequestParam("session_id") String sessionId,
            @RequestParam(value = "system_prompt", required = false) String systemPrompt,
            @RequestParam(value = "prompt_type", required = false) String promptType,
            @RequestParam(required = false) Double temperature,
            @RequestParam(value = "max_tokens", required = false) Integer maxTokens) {

        ChatRequest request = new ChatRequest(message, sessionId, systemPrompt, promptType,
                temperature, maxTokens, null, null);
        // capacity and readiness errors surface as HTTP errors before the event stream opens
        ChatStream stream = chatManager.processStream(request);

        SseEmitter emitter = new SseEmitter(properties.getStreaming().getEmitterTimeout().toMillis());
        emitter.onCompletion(stream::close);
        emitter.onTimeout(() -> {
            log.warn("Stream {} timed out", stream.messageId());
            stream.close();
            emitter.complete();
        });
        emitter.onError(e -> {
            log.warn("Stream {} error: {}", stream.messageId(), e.getMessage());
            stream.close();
        });

        streamPump.execute(() -> pump(stream, emitter));
        return emitter;
    }

    private void pump(ChatStream stream, SseEmitter emitter) {
        try (stream) {
            while (stream.hasNext()) {
                StreamChunk chunk = stream.next();
                sendEvent(emitter, "chunk", chunk);
                if (chunk.isFinal()) {
                    sendEvent(emitter, "done", Map.of("message", "Stream completed"));
                    break;
                }
            }
            emitter.complete();
        } catch (IOException e) {
            log.warn("Client disconnected from stream {}: {}", stream.messageId(), e.getMessage());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Streaming error for session {}: {}", stream.sessionId(), e.getMessage());
            try {
                sendEvent(emitter, "error", Map.of("error", String.valueOf(e.getMessage())));
                emitter.complete();
            } catch (IOException ioException) {
                log.warn("Error sending error event", ioException);
                emitter.completeWithError(ioException);
            }
        }
    }

    private void sendEvent(SseEmitter emitter, String eventType, Object data) throws IOException {
        emitter.send(SseEmitter.event()
                .name(eventType)
                .data(data, MediaType.APPLICATION_JSON));
    }

    @PreDestroy
    void shutdown() {
        streamPump.shutdownNow();
    }
}

package com.sema.chat.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.dto.ChatRequest;
import com.sema.chat.exception.GenerationException;
import com.sema.chat.exception.ModelNotLoadedException;
import com.sema.chat.exception.StreamCapacityException;
import com.sema.chat.model.GenerationResult;
import com.sema.chat.service.ChatManager;
import com.sema.chat.stream.ChunkChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ChatManager chatManager;

    private static GenerationResult result(String text) {
        return new GenerationResult("msg-1", text, "test-model", 3, "stop", Duration.ofMillis(250));
    }

    @Nested
    @DisplayName("POST /api/v1/chat")
    class CompleteChat {

        @Test
        @DisplayName("Should return the assistant reply in snake_case")
        void shouldReturnReply() throws Exception {
            when(chatManager.process(any())).thenReturn(result("Hello!"));

            mockMvc.perform(post("/api/v1/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(Map.of("message", "hi", "session_id", "s1"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Hello!"))
                    .andExpect(jsonPath("$.session_id").value("s1"))
                    .andExpect(jsonPath("$.message_id").value("msg-1"))
                    .andExpect(jsonPath("$.model_name").value("test-model"))
                    .andExpect(jsonPath("$.token_count").value(3))
                    .andExpect(jsonPath("$.finish_reason").value("stop"))
                    .andExpect(jsonPath("$.generation_time").value(0.25));
        }

        @Test
        @DisplayName("Should assign a session id when none is given")
        void shouldAssignSessionId() throws Exception {
            when(chatManager.process(any())).thenReturn(result("ok"));

            mockMvc.perform(post("/api/v1/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"hi\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.session_id").isNotEmpty());

            ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
            verify(chatManager).process(captor.capture());
            assertThat(captor.getValue().sessionId()).isNotBlank();
        }

        @Test
        @DisplayName("Should reject a blank message with 400")
        void shouldRejectBlankMessage() throws Exception {
            mockMvc.perform(post("/api/v1/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"  \",\"session_id\":\"s1\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("validation_error"))
                    .andExpect(jsonPath("$.details.message").exists());

            verify(chatManager, never()).process(any());
        }

        @Test
        @DisplayName("Should answer 503 when no backend is ready and echo the request id")
        void shouldMapNotLoaded() throws Exception {
            when(chatManager.process(any())).thenThrow(new ModelNotLoadedException("Model backend is not ready"));

            mockMvc.perform(post("/api/v1/chat")
                            .header("X-Request-ID", "req-42")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"hi\",\"session_id\":\"s1\"}"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(header().string("X-Request-ID", "req-42"))
                    .andExpect(jsonPath("$.error").value("model_not_available"))
                    .andExpect(jsonPath("$.request_id").value("req-42"));
        }

        @Test
        @DisplayName("Should answer 502 with the upstream status for backend faults")
        void shouldMapGenerationFailure() throws Exception {
            when(chatManager.process(any())).thenThrow(new GenerationException("upstream said no", 500, null));

            mockMvc.perform(post("/api/v1/chat")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"message\":\"hi\",\"session_id\":\"s1\"}"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.error").value("generation_failed"))
                    .andExpect(jsonPath("$.details.upstream_status").value(500));
        }
    }

    @Nested
    @DisplayName("GET /api/v1/chat/stream")
    class StreamChat {

        @Test
        @DisplayName("Should emit chunk events followed by done")
        void shouldStreamChunks() throws Exception {
            // Given
            ChunkChannel channel = new ChunkChannel("s1", "msg-1", 8, Duration.ZERO);
            channel.emit("Hel");
            channel.emit("lo");
            channel.complete();
            when(chatManager.processStream(any())).thenReturn(channel);

            // When
            MvcResult result = mockMvc.perform(get("/api/v1/chat/stream")
                            .param("message", "hi")
                            .param("session_id", "s1"))
                    .andExpect(request().asyncStarted())
                    .andReturn();
            result.getAsyncResult(5000);

            // Then
            String body = result.getResponse().getContentAsString();
            assertThat(body).contains("event:chunk").contains("\"content\":\"Hel\"").contains("\"is_final\":true");
            assertThat(body).contains("event:done").doesNotContain("event:error");
            assertThat(body.indexOf("\"Hel\"")).isLessThan(body.indexOf("\"lo\""));
        }

        @Test
        @DisplayName("Should emit an error event when the stream aborts")
        void shouldStreamError() throws Exception {
            ChunkChannel channel = new ChunkChannel("s1", "msg-1", 8, Duration.ZERO);
            channel.emit("partial");
            channel.fail(new GenerationException("upstream connection reset"));
            when(chatManager.processStream(any())).thenReturn(channel);

            MvcResult result = mockMvc.perform(get("/api/v1/chat/stream")
                            .param("message", "hi")
                            .param("session_id", "s1"))
                    .andExpect(request().asyncStarted())
                    .andReturn();
            result.getAsyncResult(5000);

            String body = result.getResponse().getContentAsString();
            assertThat(body).contains("partial").contains("event:error").contains("upstream connection reset");
            assertThat(body).doesNotContain("event:done");
        }

        @Test
        @DisplayName("Should answer 429 before opening the stream at capacity")
        void shouldRejectAtCapacity() throws Exception {
            when(chatManager.processStream(any())).thenThrow(new StreamCapacityException(10));

            mockMvc.perform(get("/api/v1/chat/stream")
                            .param("message", "hi")
                            .param("session_id", "s1"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(jsonPath("$.error").value("capacity_exceeded"))
                    .andExpect(jsonPath("$.details.max_concurrent_streams").value(10));
        }

        @Test
        @DisplayName("Should require a session id")
        void shouldRequireSessionId() throws Exception {
            mockMvc.perform(get("/api/v1/chat/stream").param("message", "hi"))
                    .andExpect(status().isBadRequest());
        }
    }
}

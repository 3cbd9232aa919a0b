package com.sema.chat.controller;

import com.sema.chat.service.ChatManager;
import com.sema.chat.service.HealthReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthController {

    private final ChatManager chatManager;

    /**
     * Composite health. Answers 503 only when neither the backend nor session
     * storage is usable.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = chatManager.health();
        HttpStatus status = "unhealthy".equals(report.status()) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of(
                "status", "ok",
                "service", "sema-chat",
                "active_streams", chatManager.activeStreams(),
                "timestamp", Instant.now().toString()
        );
    }
}

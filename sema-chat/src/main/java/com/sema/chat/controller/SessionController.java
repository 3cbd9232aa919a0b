package com.sema.chat.controller;

import com.sema.chat.exception.SessionNotFoundException;
import com.sema.chat.model.ConversationHistory;
import com.sema.chat.model.SessionInfo;
import com.sema.chat.service.ChatManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final ChatManager chatManager;

    @GetMapping("/{sessionId}")
    public ConversationHistory getSession(@PathVariable String sessionId,
                                          @RequestParam(required = false) Integer limit) {
        return chatManager.getHistory(sessionId, limit);
    }

    @DeleteMapping("/{sessionId}")
    public Map<String, String> clearSession(@PathVariable String sessionId) {
        if (!chatManager.clear(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Session {} cleared on request", sessionId);
        return Map.of("message", "Session cleared successfully");
    }

    @GetMapping
    public List<SessionInfo> listSessions() {
        return chatManager.listSessions();
    }
}

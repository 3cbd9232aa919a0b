package com.sema.chat.session;

import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.ChatSession;
import com.sema.chat.model.ConversationHistory;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Per-session atomicity comes from {@link ConcurrentHashMap#compute};
 * expiry relies on {@link SessionExpirySweeper}.
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final int maxMessagesPerSession;

    public InMemorySessionStore(Duration timeout, int maxMessagesPerSession) {
        this.timeout = timeout;
        this.maxMessagesPerSession = maxMessagesPerSession;
    }

    @Override
    public ConversationHistory ensure(String sessionId) {
        ChatSession session = sessions.computeIfAbsent(sessionId, id -> {
            log.info("Created new session: {}", id);
            return new ChatSession(id);
        });
        synchronized (session) {
            return session.snapshot();
        }
    }

    @Override
    public ConversationHistory append(String sessionId, ChatMessage message) {
        ConversationHistory[] result = new ConversationHistory[1];
        sessions.compute(sessionId, (id, existing) -> {
            ChatSession session = existing != null ? existing : new ChatSession(id);
            if (existing == null) {
                log.info("Created new session: {}", id);
            }
            synchronized (session) {
                int evicted = session.append(message, maxMessagesPerSession);
                if (evicted > 0) {
                    log.debug("Evicted {} messages from session {}", evicted, id);
                }
                result[0] = session.snapshot();
            }
            return session;
        });
        log.debug("Added {} message to session {}", message.role().wireName(), sessionId);
        return result[0];
    }

    @Override
    public List<ChatMessage> read(String sessionId, Integer limit) {
        return find(sessionId)
                .map(history -> SessionStore.newest(history.messages(), limit))
                .orElse(List.of());
    }

    @Override
    public Optional<ConversationHistory> find(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(session.snapshot());
        }
    }

    @Override
    public boolean delete(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.info("Deleted session: {}", sessionId);
        }
        return removed;
    }

    @Override
    public List<ConversationHistory> listActive() {
        return sessions.values().stream()
                .map(session -> {
                    synchronized (session) {
                        return session.snapshot();
                    }
                })
                .sorted(Comparator.comparing(ConversationHistory::updatedAt).reversed())
                .toList();
    }

    @Override
    public int purgeExpired(Instant now) {
        int removed = 0;
        for (String sessionId : sessions.keySet()) {
            // re-checked under the key's lock so a concurrent append wins
            boolean[] expired = new boolean[1];
            sessions.computeIfPresent(sessionId, (id, session) -> {
                synchronized (session) {
                    expired[0] = session.isExpired(now, timeout);
                }
                return expired[0] ? null : session;
            });
            if (expired[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} expired sessions", removed);
        }
        return removed;
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public String storageType() {
        return "memory";
    }
}

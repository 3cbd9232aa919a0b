package com.sema.chat.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.ChatSession;
import com.sema.chat.model.ConversationHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sessions as JSON documents under {@code <prefix><sessionId>}. Every write resets
 * the key's TTL, so Redis drops idle sessions on its own. Read-modify-write is
 * serialized per session through lock striping within this process.
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

    private static final int LOCK_STRIPES = 64;

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final int maxMessagesPerSession;
    private final String keyPrefix;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public RedisSessionStore(StringRedisTemplate redis, ObjectMapper objectMapper, Duration timeout,
                             int maxMessagesPerSession, String keyPrefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.maxMessagesPerSession = maxMessagesPerSession;
        this.keyPrefix = keyPrefix;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public ConversationHistory ensure(String sessionId) {
        String key = key(sessionId);
        ConversationHistory fresh = new ChatSession(sessionId).snapshot();
        if (Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, encode(fresh), timeout))) {
            log.info("Created new session: {}", sessionId);
            return fresh;
        }
        return find(sessionId).orElse(fresh);
    }

    @Override
    public ConversationHistory append(String sessionId, ChatMessage message) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            ChatSession session = find(sessionId)
                    .map(ChatSession::restore)
                    .orElseGet(() -> {
                        log.info("Created new session: {}", sessionId);
                        return new ChatSession(sessionId);
                    });
            int evicted = session.append(message, maxMessagesPerSession);
            if (evicted > 0) {
                log.debug("Evicted {} messages from session {}", evicted, sessionId);
            }
            ConversationHistory updated = session.snapshot();
            redis.opsForValue().set(key(sessionId), encode(updated), timeout);
            log.debug("Added {} message to session {}", message.role().wireName(), sessionId);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChatMessage> read(String sessionId, Integer limit) {
        return find(sessionId)
                .map(history -> SessionStore.newest(history.messages(), limit))
                .orElse(List.of());
    }

    @Override
    public Optional<ConversationHistory> find(String sessionId) {
        String json = redis.opsForValue().get(key(sessionId));
        return json == null ? Optional.empty() : Optional.of(decode(json));
    }

    @Override
    public boolean delete(String sessionId) {
        boolean removed = Boolean.TRUE.equals(redis.delete(key(sessionId)));
        if (removed) {
            log.info("Deleted session: {}", sessionId);
        }
        return removed;
    }

    @Override
    public List<ConversationHistory> listActive() {
        Set<String> keys = redis.keys(keyPrefix + "*");
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        List<String> documents = redis.opsForValue().multiGet(new ArrayList<>(keys));
        if (documents == null) {
            return List.of();
        }
        return documents.stream()
                .filter(Objects::nonNull)
                .map(this::decode)
                .sorted(Comparator.comparing(ConversationHistory::updatedAt).reversed())
                .toList();
    }

    @Override
    public int purgeExpired(Instant now) {
        return 0;
    }

    @Override
    public boolean ping() {
        try {
            String reply = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (RuntimeException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String storageType() {
        return "redis";
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }

    private ReentrantLock lockFor(String sessionId) {
        return locks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
    }

    private String encode(ConversationHistory history) {
        try {
            return objectMapper.writeValueAsString(history);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + history.sessionId(), e);
        }
    }

    private ConversationHistory decode(String json) {
        try {
            return objectMapper.readValue(json, ConversationHistory.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt session document in Redis", e);
        }
    }
}

package com.sema.chat.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Mutable conversation state owned by a session store. Callers outside the store
 * only ever see {@link ConversationHistory} snapshots.
 */
@Getter
public class ChatSession {
    private final String sessionId;
    private final List<ChatMessage> messages;
    private final Instant createdAt;
    private Instant updatedAt;

    public ChatSession(String sessionId) {
        this(sessionId, new ArrayList<>(), Instant.now(), null);
    }

    private ChatSession(String sessionId, List<ChatMessage> messages, Instant createdAt, Instant updatedAt) {
        this.sessionId = sessionId;
        this.messages = messages;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public static ChatSession restore(ConversationHistory history) {
        return new ChatSession(history.sessionId(), new ArrayList<>(history.messages()),
                history.createdAt(), history.updatedAt());
    }

    public int getMessageCount() {
        return messages.size();
    }

    /**
     * Appends a message and evicts the oldest evictable messages while the session
     * holds more than {@code maxMessages} of them. The first system message is
     * pinned and does not count against the cap.
     *
     * @param maxMessages cap on evictable messages; 0 or less disables eviction
     * @return number of messages evicted
     */
    public int append(ChatMessage message, int maxMessages) {
        messages.add(message);
        updatedAt = Instant.now();
        if (maxMessages <= 0) {
            return 0;
        }

        ChatMessage pinned = pinnedSystemMessage();
        int evictable = pinned == null ? messages.size() : messages.size() - 1;
        int toRemove = evictable - maxMessages;
        int removed = 0;
        Iterator<ChatMessage> it = messages.iterator();
        while (removed < toRemove && it.hasNext()) {
            if (it.next() != pinned) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return ttl != null && !ttl.isZero() && updatedAt.plus(ttl).isBefore(now);
    }

    public ConversationHistory snapshot() {
        return new ConversationHistory(sessionId, List.copyOf(messages), createdAt, updatedAt, messages.size());
    }

    private ChatMessage pinnedSystemMessage() {
        for (ChatMessage m : messages) {
            if (m.isSystem()) {
                return m;
            }
        }
        return null;
    }
}

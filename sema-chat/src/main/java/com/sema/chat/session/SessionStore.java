package com.sema.chat.session;

import com.sema.chat.model.ChatMessage;
import com.sema.chat.model.ConversationHistory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed conversation state with bounded history and idle expiry. Writes to one
 * session are serialized; different sessions never contend.
 */
public interface SessionStore {

    /**
     * Creates the session if absent. Concurrent calls for one id create it at most once.
     */
    ConversationHistory ensure(String sessionId);

    /**
     * Ensures the session, appends, applies eviction and refreshes {@code updatedAt}.
     *
     * @return the session after the append
     */
    ConversationHistory append(String sessionId, ChatMessage message);

    /**
     * Stored messages in insertion order, only the newest {@code limit} when given.
     * Empty for an unknown session.
     */
    List<ChatMessage> read(String sessionId, Integer limit);

    Optional<ConversationHistory> find(String sessionId);

    /**
     * @return false if the session did not exist
     */
    boolean delete(String sessionId);

    List<ConversationHistory> listActive();

    /**
     * Removes sessions idle longer than the configured timeout.
     *
     * @return number of sessions removed; 0 for stores that expire natively
     */
    int purgeExpired(Instant now);

    boolean ping();

    String storageType();

    static List<ChatMessage> newest(List<ChatMessage> messages, Integer limit) {
        if (limit == null || limit < 0 || limit >= messages.size()) {
            return messages;
        }
        return messages.subList(messages.size() - limit, messages.size());
    }
}

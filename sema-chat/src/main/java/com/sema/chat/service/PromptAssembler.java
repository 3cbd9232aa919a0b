package com.sema.chat.service;

import com.sema.chat.model.ChatMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds model input: optional system prompt, then session history in order. With a
 * positive token budget, older non-system turns are dropped until the estimate
 * fits; system turns and the newest turn are always kept.
 */
public class PromptAssembler {

    static final int CHARS_PER_TOKEN = 4;

    private final int tokenBudget;

    public PromptAssembler(int tokenBudget) {
        this.tokenBudget = tokenBudget;
    }

    public List<ChatMessage> assemble(String systemPrompt, List<ChatMessage> history) {
        List<ChatMessage> system = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            system.add(ChatMessage.system(systemPrompt));
        }
        if (tokenBudget <= 0) {
            List<ChatMessage> messages = new ArrayList<>(system);
            messages.addAll(history);
            return messages;
        }

        int used = 0;
        for (ChatMessage message : system) {
            used += estimateTokens(message);
        }
        for (ChatMessage message : history) {
            if (message.isSystem()) {
                used += estimateTokens(message);
            }
        }

        Deque<ChatMessage> kept = new ArrayDeque<>();
        boolean newest = true;
        boolean full = false;
        for (int i = history.size() - 1; i >= 0; i--) {
            ChatMessage message = history.get(i);
            if (message.isSystem()) {
                kept.addFirst(message);
                continue;
            }
            if (full) {
                continue;
            }
            int cost = estimateTokens(message);
            if (!newest && used + cost > tokenBudget) {
                // no gaps: everything older than this turn is dropped
                full = true;
                continue;
            }
            used += cost;
            newest = false;
            kept.addFirst(message);
        }

        List<ChatMessage> messages = new ArrayList<>(system);
        messages.addAll(kept);
        return messages;
    }

    static int estimateTokens(ChatMessage message) {
        return message.content().length() / CHARS_PER_TOKEN;
    }
}

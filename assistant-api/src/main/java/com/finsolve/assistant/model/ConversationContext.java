package com.finsolve.assistant.model;

import java.util.List;

/**
 * Read-only snapshot of a conversation's most recent turns, oldest first.
 */
public record ConversationContext(
        String conversationId,
        List<ConversationTurn> turns
) {

    public ConversationContext {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static ConversationContext empty(String conversationId) {
        return new ConversationContext(conversationId, List.of());
    }

    /**
     * Keeps at most {@code limit} turns, evicting the oldest first.
     */
    public static ConversationContext bounded(String conversationId, List<ConversationTurn> turns, int limit) {
        if (turns == null || turns.isEmpty() || limit <= 0) {
            return empty(conversationId);
        }
        int from = Math.max(0, turns.size() - limit);
        return new ConversationContext(conversationId, turns.subList(from, turns.size()));
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public int size() {
        return turns.size();
    }
}

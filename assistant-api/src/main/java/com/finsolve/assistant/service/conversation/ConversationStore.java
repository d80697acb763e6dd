package com.finsolve.assistant.service.conversation;

import com.finsolve.assistant.model.ConversationStats;
import com.finsolve.assistant.model.ConversationSummary;
import com.finsolve.assistant.model.ConversationTurn;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable conversation history. Calls block and must be kept off event-loop threads.
 */
public interface ConversationStore {

    Optional<ConversationSummary> findConversation(String conversationId);

    /**
     * The most recent {@code limit} turns, oldest first.
     */
    List<ConversationTurn> loadHistory(String conversationId, int limit);

    List<ConversationTurn> loadTurns(String conversationId);

    /**
     * Appends turns in order, creating the conversation first if it does not exist.
     */
    void appendTurns(ConversationSummary conversation, List<ConversationTurn> turns);

    List<ConversationSummary> listConversations(String userId);

    /**
     * Replaces the title and moves {@code updatedAt} to {@code at}. Empty when the
     * conversation does not exist.
     */
    Optional<ConversationSummary> renameConversation(String conversationId, String title, OffsetDateTime at);

    ConversationStats statsFor(String userId);

    boolean deleteConversation(String conversationId);
}

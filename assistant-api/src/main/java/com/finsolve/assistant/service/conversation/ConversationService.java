package com.finsolve.assistant.service.conversation;

import com.finsolve.assistant.exception.ConversationAccessDeniedException;
import com.finsolve.assistant.exception.ConversationNotFoundException;
import com.finsolve.assistant.exception.MessageValidationException;
import com.finsolve.assistant.model.ConversationStats;
import com.finsolve.assistant.model.ConversationSummary;
import com.finsolve.assistant.model.ConversationView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Caller-scoped access to stored conversations. Every lookup by id checks that
 * the conversation belongs to the caller.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);
    private static final int TITLE_LENGTH = 50;
    private static final int MAX_TITLE_LENGTH = 200;

    private final ConversationStore store;

    public ConversationService(ConversationStore store) {
        this.store = store;
    }

    /**
     * Returns the caller's existing conversation, or a new, not yet stored one
     * when {@code conversationId} is absent.
     */
    public ConversationSummary openConversation(String conversationId, String userId, String firstMessage) {
        if (conversationId == null || conversationId.isBlank()) {
            OffsetDateTime now = OffsetDateTime.now();
            return new ConversationSummary(UUID.randomUUID().toString(), userId, titleFor(firstMessage), now, now);
        }
        return requireOwned(conversationId, userId);
    }

    public ConversationSummary requireOwned(String conversationId, String userId) {
        ConversationSummary conversation = store.findConversation(conversationId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        if (!conversation.userId().equals(userId)) {
            log.warn("User {} attempted to access conversation {} owned by another user", userId, conversationId);
            throw new ConversationAccessDeniedException(conversationId);
        }
        return conversation;
    }

    public List<ConversationSummary> listConversations(String userId) {
        return store.listConversations(userId);
    }

    public ConversationView viewConversation(String conversationId, String userId) {
        ConversationSummary conversation = requireOwned(conversationId, userId);
        return new ConversationView(conversation, store.loadTurns(conversationId));
    }

    public void deleteConversation(String conversationId, String userId) {
        requireOwned(conversationId, userId);
        store.deleteConversation(conversationId);
        log.info("Deleted conversation {} for user {}", conversationId, userId);
    }

    /**
     * Renames one of the caller's conversations. The title is stripped and cut to
     * {@value #MAX_TITLE_LENGTH} characters.
     */
    public ConversationSummary renameConversation(String conversationId, String userId, String title) {
        requireOwned(conversationId, userId);
        String cleaned = title == null ? "" : title.strip();
        if (cleaned.isEmpty()) {
            throw new MessageValidationException("Title cannot be empty");
        }
        if (cleaned.length() > MAX_TITLE_LENGTH) {
            cleaned = cleaned.substring(0, MAX_TITLE_LENGTH);
        }
        ConversationSummary renamed = store.renameConversation(conversationId, cleaned, OffsetDateTime.now())
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        log.info("Renamed conversation {} for user {}", conversationId, userId);
        return renamed;
    }

    public ConversationStats statsFor(String userId) {
        return store.statsFor(userId);
    }

    static String titleFor(String message) {
        if (message == null || message.isBlank()) {
            return "New conversation";
        }
        String title = message.strip();
        if (title.length() > TITLE_LENGTH) {
            title = title.substring(0, TITLE_LENGTH - 3).strip() + "...";
        }
        return title.substring(0, 1).toUpperCase(Locale.ROOT) + title.substring(1);
    }
}

package com.finsolve.assistant.model;

/**
 * Message and conversation counts for one user.
 */
public record ConversationStats(
        long totalMessages,
        long userQuestions,
        long assistantResponses,
        long totalConversations,
        double averageMessagesPerConversation
) {

    public static ConversationStats of(long userQuestions, long assistantResponses, long totalConversations) {
        long totalMessages = userQuestions + assistantResponses;
        double average = totalConversations == 0
                ? 0.0
                : Math.round(totalMessages * 10.0 / totalConversations) / 10.0;
        return new ConversationStats(totalMessages, userQuestions, assistantResponses, totalConversations, average);
    }
}

package com.finsolve.assistant.model;

import java.time.OffsetDateTime;

public record ConversationSummary(
        String conversationId,
        String userId,
        String title,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}

package com.finsolve.assistant.model;

import jakarta.validation.constraints.NotNull;

import java.time.OffsetDateTime;

public record ConversationTurn(
        @NotNull ChatMessageRole role,
        String content,
        OffsetDateTime timestamp
) {

    public static ConversationTurn user(String content, OffsetDateTime timestamp) {
        return new ConversationTurn(ChatMessageRole.USER, content, timestamp);
    }

    public static ConversationTurn assistant(String content, OffsetDateTime timestamp) {
        return new ConversationTurn(ChatMessageRole.ASSISTANT, content, timestamp);
    }
}

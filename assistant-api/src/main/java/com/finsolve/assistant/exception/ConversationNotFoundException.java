package com.finsolve.assistant.exception;

import org.springframework.http.HttpStatus;

public class ConversationNotFoundException extends ChatException {

    public ConversationNotFoundException(String conversationId) {
        super(HttpStatus.NOT_FOUND, ErrorCode.CONVERSATION_NOT_FOUND, "Conversation " + conversationId + " not found");
    }
}

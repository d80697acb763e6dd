package com.finsolve.assistant.exception;

import org.springframework.http.HttpStatus;

public class ConversationAccessDeniedException extends ChatException {

    public ConversationAccessDeniedException(String conversationId) {
        super(HttpStatus.FORBIDDEN, ErrorCode.CONVERSATION_ACCESS_DENIED,
                "You don't have access to conversation " + conversationId);
    }
}

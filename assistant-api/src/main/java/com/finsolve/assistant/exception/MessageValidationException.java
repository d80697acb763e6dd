package com.finsolve.assistant.exception;

import org.springframework.http.HttpStatus;

public class MessageValidationException extends ChatException {

    public MessageValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_FAILED, message);
    }
}

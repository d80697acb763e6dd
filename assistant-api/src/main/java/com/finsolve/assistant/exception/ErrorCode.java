package com.finsolve.assistant.exception;

public enum ErrorCode {
    VALIDATION_FAILED,
    CONVERSATION_NOT_FOUND,
    CONVERSATION_ACCESS_DENIED,
    UNKNOWN_ROLE,
    GENERATION_UNAVAILABLE,
    GENERATION_FAILED,
    PROMPT_OVER_BUDGET
}

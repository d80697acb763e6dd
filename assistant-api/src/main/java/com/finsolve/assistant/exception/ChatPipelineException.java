package com.finsolve.assistant.exception;

import org.springframework.http.HttpStatus;

/**
 * Unrecoverable turn failure. The turn is not persisted.
 */
public class ChatPipelineException extends ChatException {

    public ChatPipelineException(HttpStatus status, ErrorCode code, String message, Throwable cause) {
        super(status, code, message, cause);
    }

    public static ChatPipelineException generationUnavailable(Throwable cause) {
        return new ChatPipelineException(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.GENERATION_UNAVAILABLE,
                "The answer service is temporarily unavailable. Please try again in a moment.", cause);
    }

    public static ChatPipelineException generationFailed(Throwable cause) {
        return new ChatPipelineException(HttpStatus.BAD_GATEWAY, ErrorCode.GENERATION_FAILED,
                "The answer service rejected the request.", cause);
    }

    public static ChatPipelineException promptOverBudget(int estimatedTokens, int budget) {
        return new ChatPipelineException(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.PROMPT_OVER_BUDGET,
                "Prompt needs " + estimatedTokens + " tokens after dropping all context, budget is " + budget, null);
    }
}

package com.finsolve.assistant.service.generation;

public class GenerationFatalException extends RuntimeException {

    public GenerationFatalException(String message) {
        super(message);
    }

    public GenerationFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}

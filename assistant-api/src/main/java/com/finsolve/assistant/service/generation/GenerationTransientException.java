package com.finsolve.assistant.service.generation;

public class GenerationTransientException extends RuntimeException {

    public GenerationTransientException(String message) {
        super(message);
    }

    public GenerationTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}

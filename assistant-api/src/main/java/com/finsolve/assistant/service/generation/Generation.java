package com.finsolve.assistant.service.generation;

/**
 * Raw generation output. {@code tokenCount} and {@code certainty} are null when
 * the backend does not report them; certainty lies in [0,1].
 */
public record Generation(String text, Integer tokenCount, Double certainty) {

    public static Generation of(String text) {
        return new Generation(text, null, null);
    }
}

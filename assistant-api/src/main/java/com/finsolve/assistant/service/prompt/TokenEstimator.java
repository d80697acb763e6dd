package com.finsolve.assistant.service.prompt;

/**
 * Character-based token estimate, roughly four characters per token.
 */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }
}

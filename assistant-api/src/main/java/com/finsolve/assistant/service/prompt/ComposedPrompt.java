package com.finsolve.assistant.service.prompt;

import com.finsolve.assistant.model.RankedResult;

/**
 * A rendered prompt together with the ranked chunks that made it in. The source
 * numbers in {@code text} are 1-based positions in {@code included}.
 */
public record ComposedPrompt(String text, RankedResult included, int estimatedTokens, boolean truncated) {
}

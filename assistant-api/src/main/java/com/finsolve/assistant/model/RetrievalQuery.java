package com.finsolve.assistant.model;

import java.util.List;

/**
 * Query variants for one turn. Variant 0 is always the standalone query.
 */
public record RetrievalQuery(
        String original,
        String standalone,
        List<String> variants
) {

    public RetrievalQuery {
        if (variants == null || variants.isEmpty()) {
            variants = List.of(standalone);
        } else {
            variants = List.copyOf(variants);
        }
        if (!variants.get(0).equals(standalone)) {
            throw new IllegalArgumentException("The first query variant must be the standalone query");
        }
    }
}

package com.finsolve.assistant.service.augmentation;

import reactor.core.publisher.Mono;

import java.util.List;

public interface QueryAugmenter {

    /**
     * Expands a standalone query into retrieval variants. The first variant is
     * always the query itself, and the returned Mono never errors.
     */
    Mono<Augmentation> augment(String standaloneQuery);

    /**
     * {@code fallback} is set when variant generation failed and only the
     * standalone query is searched.
     */
    record Augmentation(List<String> variants, boolean fallback) {

        public Augmentation {
            variants = List.copyOf(variants);
        }
    }
}

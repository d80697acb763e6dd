package com.finsolve.assistant.service.augmentation;

import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.service.generation.GenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Service
public class LlmQueryAugmenter implements QueryAugmenter {

    private static final Logger log = LoggerFactory.getLogger(LlmQueryAugmenter.class);

    private static final String AUGMENT_TEMPLATE = """
            You help search the internal documents of FinSolve Technologies.
            Write %d alternative ways to ask the question below. Each must keep the same intent \
            but use different wording or domain synonyms.
            Output one question per line, without explanations.

            Original question: %s
            Alternative questions:""";

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(\\d+[.)]?|[-*•])\\s*");

    private final GenerationService generationService;
    private final SynonymExpander synonymExpander;
    private final RagProperties properties;

    public LlmQueryAugmenter(GenerationService generationService,
                             SynonymExpander synonymExpander,
                             RagProperties properties) {
        this.generationService = generationService;
        this.synonymExpander = synonymExpander;
        this.properties = properties;
    }

    @Override
    public Mono<Augmentation> augment(String standaloneQuery) {
        int variantCount = properties.getAugmentationVariantCount();
        if (variantCount <= 1) {
            return Mono.just(new Augmentation(List.of(standaloneQuery), false));
        }
        int wanted = variantCount - 1;
        String prompt = AUGMENT_TEMPLATE.formatted(wanted, standaloneQuery);
        return generationService.generate(prompt, properties.getRewriteMaxTokens())
                .map(generation -> new Augmentation(assemble(standaloneQuery, generation.text(), wanted), false))
                .onErrorResume(error -> {
                    log.warn("Query augmentation failed, searching with the standalone query only: {}", error.getMessage());
                    return Mono.just(new Augmentation(List.of(standaloneQuery), true));
                });
    }

    private List<String> assemble(String standaloneQuery, String output, int wanted) {
        List<String> variants = new ArrayList<>();
        variants.add(standaloneQuery);
        for (String line : parse(output)) {
            if (variants.size() > wanted) {
                break;
            }
            addDistinct(variants, line);
        }
        if (variants.size() <= wanted) {
            int missing = wanted + 1 - variants.size();
            log.debug("Generation returned {} usable variants, topping up {} from synonyms", variants.size() - 1, missing);
            for (String expansion : synonymExpander.expand(standaloneQuery, wanted)) {
                if (variants.size() > wanted) {
                    break;
                }
                addDistinct(variants, expansion);
            }
        }
        return variants;
    }

    private List<String> parse(String output) {
        List<String> lines = new ArrayList<>();
        if (output == null) {
            return lines;
        }
        for (String raw : output.split("\\R")) {
            String line = LIST_MARKER.matcher(raw).replaceFirst("").strip();
            line = line.replaceAll("^\"|\"$", "").strip();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private void addDistinct(List<String> variants, String candidate) {
        for (String existing : variants) {
            if (existing.equalsIgnoreCase(candidate)) {
                return;
            }
        }
        variants.add(candidate);
    }
}

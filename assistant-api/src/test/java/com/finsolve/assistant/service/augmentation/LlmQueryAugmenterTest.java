package com.finsolve.assistant.service.augmentation;

import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.service.generation.Generation;
import com.finsolve.assistant.service.generation.GenerationFatalException;
import com.finsolve.assistant.service.generation.GenerationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LlmQueryAugmenterTest {

    private static final String QUERY = "What is the leave policy?";

    private final GenerationService generationService = mock(GenerationService.class);
    private final RagProperties properties = new RagProperties();

    private LlmQueryAugmenter augmenter;

    @BeforeEach
    void setUp() {
        augmenter = new LlmQueryAugmenter(generationService, new SynonymExpander(), properties);
    }

    @Test
    void parsesNumberedParaphrasesAfterTheOriginal() {
        when(generationService.generate(anyString(), anyInt())).thenReturn(Mono.just(Generation.of("""
                1. How much time off can I take?
                2) What are the vacation rules?
                - Explain the PTO guidelines
                • Where is the absence policy described?
                """)));

        StepVerifier.create(augmenter.augment(QUERY))
                .assertNext(augmentation -> {
                    assertThat(augmentation.fallback()).isFalse();
                    assertThat(augmentation.variants()).containsExactly(
                            QUERY,
                            "How much time off can I take?",
                            "What are the vacation rules?",
                            "Explain the PTO guidelines",
                            "Where is the absence policy described?");
                })
                .verifyComplete();
    }

    @Test
    void dropsDuplicatesAndCapsAtVariantCount() {
        properties.setAugmentationVariantCount(3);
        when(generationService.generate(anyString(), anyInt())).thenReturn(Mono.just(Generation.of("""
                what is the leave policy?
                How much time off can I take?
                HOW MUCH TIME OFF CAN I TAKE?
                What are the vacation rules?
                Explain the PTO guidelines
                """)));

        StepVerifier.create(augmenter.augment(QUERY))
                .assertNext(augmentation -> assertThat(augmentation.variants()).containsExactly(
                        QUERY,
                        "How much time off can I take?",
                        "What are the vacation rules?"))
                .verifyComplete();
    }

    @Test
    void topsUpShortAnswersFromSynonyms() {
        when(generationService.generate(anyString(), anyInt()))
                .thenReturn(Mono.just(Generation.of("How much time off can I take?")));

        StepVerifier.create(augmenter.augment(QUERY))
                .assertNext(augmentation -> {
                    assertThat(augmentation.fallback()).isFalse();
                    assertThat(augmentation.variants()).hasSize(5);
                    assertThat(augmentation.variants().get(0)).isEqualTo(QUERY);
                    assertThat(augmentation.variants().get(1)).isEqualTo("How much time off can I take?");
                    assertThat(augmentation.variants()).doesNotHaveDuplicates();
                })
                .verifyComplete();
    }

    @Test
    void failureYieldsOnlyTheStandaloneQuery() {
        when(generationService.generate(anyString(), anyInt()))
                .thenReturn(Mono.error(new GenerationFatalException("bad credentials")));

        StepVerifier.create(augmenter.augment(QUERY))
                .assertNext(augmentation -> {
                    assertThat(augmentation.fallback()).isTrue();
                    assertThat(augmentation.variants()).containsExactly(QUERY);
                })
                .verifyComplete();
    }

    @Test
    void singleVariantSkipsGeneration() {
        properties.setAugmentationVariantCount(1);

        StepVerifier.create(augmenter.augment(QUERY))
                .assertNext(augmentation -> assertThat(augmentation.variants()).containsExactly(QUERY))
                .verifyComplete();

        verifyNoInteractions(generationService);
    }
}

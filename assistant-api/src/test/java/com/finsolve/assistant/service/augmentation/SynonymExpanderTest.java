package com.finsolve.assistant.service.augmentation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SynonymExpanderTest {

    private final SynonymExpander expander = new SynonymExpander();

    @Test
    void swapsKnownTermsKeepingTheRestOfTheQuestion() {
        assertThat(expander.expand("How do I request leave?", 2))
                .containsExactly("How do I request time off?", "what's the process for request leave?");
    }

    @Test
    void restructuresWhatQuestions() {
        assertThat(expander.expand("What are the travel rules?", 4))
                .contains("Tell me about are the travel rules");
    }

    @Test
    void fillsWithDomainQualifiers() {
        assertThat(expander.expand("Budget numbers", 3))
                .containsExactly("Budget numbers for employee", "Budget numbers for company policy",
                        "Budget numbers for guidelines");
    }

    @Test
    void neverReturnsTheQueryItself() {
        assertThat(expander.expand("leave", 10))
                .isNotEmpty()
                .noneMatch(variant -> variant.equalsIgnoreCase("leave"))
                .doesNotHaveDuplicates();
    }
}

package com.finsolve.assistant.service.prompt;

import com.finsolve.assistant.access.AccessScope;
import com.finsolve.assistant.access.AccessScopeResolver;
import com.finsolve.assistant.access.DocumentCollection;
import com.finsolve.assistant.access.Role;
import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.exception.ChatPipelineException;
import com.finsolve.assistant.exception.ErrorCode;
import com.finsolve.assistant.model.ConversationContext;
import com.finsolve.assistant.model.ConversationTurn;
import com.finsolve.assistant.model.RankedChunk;
import com.finsolve.assistant.model.RankedResult;
import com.finsolve.assistant.model.RetrievedChunk;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptComposerTest {

    private final RagProperties properties = new RagProperties();
    private final PromptComposer composer = new PromptComposer(properties);
    private final AccessScope financeScope = new AccessScopeResolver().accessScope(Role.FINANCE);

    @Test
    void rendersNumberedSourcesHistoryAndInstructions() {
        ConversationContext history = new ConversationContext("conv-1", List.of(
                ConversationTurn.user("What was Q2 revenue?", OffsetDateTime.now()),
                ConversationTurn.assistant("Q2 revenue was $2.1M.", OffsetDateTime.now())));

        ComposedPrompt prompt = composer.compose("How did Q3 revenue compare to Q2?", ranked(
                chunk("q3-report", DocumentCollection.FINANCE, 0.91, "Q3 revenue reached $2.4M."),
                chunk("handbook", DocumentCollection.GENERAL, 0.80, "Reports are published quarterly.")),
                history, financeScope);

        assertThat(prompt.truncated()).isFalse();
        assertThat(prompt.included().size()).isEqualTo(2);
        assertThat(prompt.text())
                .contains("FinSolve Technologies")
                .contains("step by step")
                .contains("[Source 1] q3-report.pdf (Finance department)\nQ3 revenue reached $2.4M.")
                .contains("[Source 2] handbook.pdf (General department)")
                .contains("User: What was Q2 revenue?")
                .contains("Assistant: Q2 revenue was $2.1M.")
                .contains("Question: How did Q3 revenue compare to Q2?")
                .contains("do not have enough information")
                .contains("[Source n]");
        assertThat(prompt.text().indexOf("[Source 1]")).isLessThan(prompt.text().indexOf("[Source 2]"));
        assertThat(prompt.estimatedTokens()).isEqualTo(TokenEstimator.estimate(prompt.text()));
    }

    @Test
    void noContextPromptListsAccessibleDepartments() {
        ComposedPrompt prompt = composer.compose("What is the marketing budget?", RankedResult.empty(),
                ConversationContext.empty("conv-1"), financeScope);

        assertThat(prompt.included().isEmpty()).isTrue();
        assertThat(prompt.text())
                .contains("Finance, General")
                .contains("could not find")
                .contains("Final Answer:")
                .doesNotContain("[Source");
    }

    @Test
    void dropsWholeLowestRankedChunksToFitBudget() {
        String longText = "Revenue detail. ".repeat(100);
        RankedResult ranked = ranked(
                chunk("first", DocumentCollection.FINANCE, 0.95, longText),
                chunk("second", DocumentCollection.FINANCE, 0.90, longText),
                chunk("third", DocumentCollection.FINANCE, 0.85, longText));
        int withTwo = TokenEstimator.estimate(composer.compose("Q?", ranked.limit(2),
                ConversationContext.empty("c"), financeScope).text());
        properties.setPromptTokenBudget(withTwo);

        ComposedPrompt prompt = composer.compose("Q?", ranked, ConversationContext.empty("c"), financeScope);

        assertThat(prompt.truncated()).isTrue();
        assertThat(prompt.included().chunks()).extracting(chunk -> chunk.chunk().documentId())
                .containsExactly("first", "second");
        assertThat(prompt.text()).contains(longText.strip()).doesNotContain("third.pdf");
        assertThat(prompt.estimatedTokens()).isLessThanOrEqualTo(withTwo);
    }

    @Test
    void overBudgetWithoutAnyChunkIsFatal() {
        properties.setPromptTokenBudget(10);

        assertThatThrownBy(() -> composer.compose("What is the travel policy?", RankedResult.empty(),
                ConversationContext.empty("c"), financeScope))
                .isInstanceOf(ChatPipelineException.class)
                .satisfies(error -> assertThat(((ChatPipelineException) error).code()).isEqualTo(ErrorCode.PROMPT_OVER_BUDGET));
    }

    @Test
    void contextThatCannotFitEvenItsTopChunkIsFatalRatherThanNoContext() {
        properties.setPromptTokenBudget(1000);
        RankedResult ranked = ranked(chunk("annual-report", DocumentCollection.FINANCE, 0.95,
                "Quarterly revenue by region. ".repeat(1200)));

        assertThatThrownBy(() -> composer.compose("How did revenue develop?", ranked,
                ConversationContext.empty("c"), financeScope))
                .isInstanceOf(ChatPipelineException.class)
                .satisfies(error -> assertThat(((ChatPipelineException) error).code()).isEqualTo(ErrorCode.PROMPT_OVER_BUDGET));
    }

    private RankedResult ranked(RetrievedChunk... chunks) {
        return new RankedResult(Arrays.stream(chunks).map(chunk -> new RankedChunk(chunk, 1)).toList());
    }

    private RetrievedChunk chunk(String documentId, DocumentCollection collection, double score, String text) {
        return new RetrievedChunk(documentId, 0, collection, text, score, documentId + ".pdf", "Finance");
    }
}

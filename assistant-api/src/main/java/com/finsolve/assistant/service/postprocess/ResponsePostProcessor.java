package com.finsolve.assistant.service.postprocess;

import com.finsolve.assistant.model.Citation;
import com.finsolve.assistant.model.GeneratedAnswer;
import com.finsolve.assistant.model.RankedResult;
import com.finsolve.assistant.model.RetrievedChunk;
import com.finsolve.assistant.service.generation.Generation;
import com.finsolve.assistant.service.prompt.ComposedPrompt;
import com.finsolve.assistant.service.prompt.TokenEstimator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ResponsePostProcessor {

    private static final Pattern SOURCE_MARKER = Pattern.compile("\\[Source\\s*(\\d{1,4})\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern FINAL_ANSWER = Pattern.compile("final answer\\s*:", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_ARTIFACT = Pattern.compile("^(answer|response|assistant|ai)\\s*:\\s*", Pattern.CASE_INSENSITIVE);
    private static final int EXCERPT_LENGTH = 500;
    static final String EMPTY_ANSWER = "I'm sorry, I could not produce an answer to that question.";

    private final ConfidenceScorer confidenceScorer;

    public ResponsePostProcessor(ConfidenceScorer confidenceScorer) {
        this.confidenceScorer = confidenceScorer;
    }

    /**
     * Cleans the raw output, maps its [Source n] markers back to the prompt's
     * chunks and scores the answer. When no marker resolves, every included
     * chunk is attached uncited.
     */
    public GeneratedAnswer process(Generation generation, ComposedPrompt prompt) {
        String answer = clean(generation.text());
        RankedResult included = prompt.included();

        Set<Integer> cited = citedIndices(answer, included.size());
        List<Citation> citations = new ArrayList<>();
        if (cited.isEmpty()) {
            for (int i = 0; i < included.size(); i++) {
                citations.add(toCitation(i + 1, included.get(i).chunk(), false));
            }
        } else {
            for (Integer index : cited) {
                citations.add(toCitation(index, included.get(index - 1).chunk(), true));
            }
        }

        int tokens = generation.tokenCount() != null
                ? generation.tokenCount()
                : TokenEstimator.estimate(prompt.text()) + TokenEstimator.estimate(answer);
        double confidence = confidenceScorer.score(included, generation.certainty());
        return new GeneratedAnswer(answer, citations, confidence, tokens, Set.of());
    }

    String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY_ANSWER;
        }
        String text = raw.strip();
        Matcher marker = FINAL_ANSWER.matcher(text);
        int answerStart = -1;
        while (marker.find()) {
            answerStart = marker.end();
        }
        if (answerStart >= 0 && !text.substring(answerStart).isBlank()) {
            text = text.substring(answerStart).strip();
        }
        text = LEADING_ARTIFACT.matcher(text).replaceFirst("").strip();
        return text.isEmpty() ? EMPTY_ANSWER : text;
    }

    private Set<Integer> citedIndices(String answer, int available) {
        Set<Integer> indices = new TreeSet<>();
        Matcher matcher = SOURCE_MARKER.matcher(answer);
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            if (index >= 1 && index <= available) {
                indices.add(index);
            }
        }
        return indices;
    }

    private Citation toCitation(int index, RetrievedChunk chunk, boolean cited) {
        return new Citation(
                index,
                chunk.documentName() == null ? chunk.documentId() : chunk.documentName(),
                chunk.collection().department(),
                chunk.score(),
                excerpt(chunk.text()),
                cited
        );
    }

    private String excerpt(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").strip();
        return flat.length() <= EXCERPT_LENGTH ? flat : flat.substring(0, EXCERPT_LENGTH - 3) + "...";
    }
}

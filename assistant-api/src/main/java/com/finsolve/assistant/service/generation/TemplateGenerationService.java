package com.finsolve.assistant.service.generation;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline backend for local runs. Answers composed prompts by quoting the
 * numbered source blocks and echoes the question back for rewrite prompts.
 */
@Component
@Profile("template")
public class TemplateGenerationService implements GenerationService {

    private static final Pattern SOURCE_BLOCK = Pattern.compile("\\[Source (\\d+)\\][^\\n]*\\n([^\\n]+)");
    private static final Pattern QUESTION_LINE = Pattern.compile("(?im)^[^\\n]*question:[ \\t]*(\\S[^\\n]*)$");

    @Override
    public Mono<Generation> generate(String prompt, int maxTokens) {
        return Mono.fromSupplier(() -> Generation.of(synthesize(prompt == null ? "" : prompt)));
    }

    private String synthesize(String prompt) {
        if (prompt.contains("Final Answer:")) {
            return answer(prompt);
        }
        Matcher matcher = QUESTION_LINE.matcher(prompt);
        String question = null;
        while (matcher.find()) {
            question = matcher.group(1).trim();
        }
        return question == null ? prompt.trim() : question;
    }

    private String answer(String prompt) {
        Matcher matcher = SOURCE_BLOCK.matcher(prompt);
        StringBuilder builder = new StringBuilder("Final Answer: ");
        boolean found = false;
        while (matcher.find()) {
            if (!found) {
                builder.append("Based on the documents available to you:\n");
                found = true;
            }
            builder.append("- ")
                    .append(normalise(matcher.group(2)))
                    .append(" [Source ")
                    .append(matcher.group(1))
                    .append("]\n");
        }
        if (!found) {
            builder.append("I could not find information about this in the documents you have access to.");
        }
        return builder.toString().trim();
    }

    private String normalise(String text) {
        String trimmed = text.replaceAll("\\s+", " ").trim();
        if (trimmed.length() <= 240) {
            return trimmed;
        }
        return trimmed.substring(0, 237) + "...";
    }
}

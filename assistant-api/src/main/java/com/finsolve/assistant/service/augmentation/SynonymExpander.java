package com.finsolve.assistant.service.augmentation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-based paraphrasing over HR and policy vocabulary: one synonym swap per
 * known term, then question restructuring, then a domain qualifier suffix.
 */
@Component
public class SynonymExpander {

    private static final Map<String, List<String>> DOMAIN_SYNONYMS = new LinkedHashMap<>();
    private static final List<String> DOMAIN_TERMS = List.of("employee", "company policy", "guidelines", "procedure");

    static {
        DOMAIN_SYNONYMS.put("leave request", List.of("time off request", "vacation application"));
        DOMAIN_SYNONYMS.put("leave", List.of("time off", "vacation", "PTO", "days off", "absence request"));
        DOMAIN_SYNONYMS.put("vacation", List.of("leave", "time off", "days off", "paid leave"));
        DOMAIN_SYNONYMS.put("pto", List.of("paid time off", "leave", "vacation days"));
        DOMAIN_SYNONYMS.put("health insurance", List.of("medical plan", "health coverage", "insurance benefits"));
        DOMAIN_SYNONYMS.put("benefits", List.of("compensation package", "perks", "employee benefits", "entitlements"));
        DOMAIN_SYNONYMS.put("salary", List.of("compensation", "pay", "earnings", "remuneration"));
        DOMAIN_SYNONYMS.put("insurance", List.of("health coverage", "medical plan", "health insurance"));
        DOMAIN_SYNONYMS.put("policy", List.of("procedure", "guidelines", "rules", "standards", "process"));
        DOMAIN_SYNONYMS.put("process", List.of("procedure", "workflow", "steps", "instructions"));
        DOMAIN_SYNONYMS.put("guidelines", List.of("standards", "rules", "policy", "procedures"));
        DOMAIN_SYNONYMS.put("onboarding", List.of("employee setup", "induction", "orientation", "getting started"));
        DOMAIN_SYNONYMS.put("hiring", List.of("recruitment", "employment", "staff acquisition"));
        DOMAIN_SYNONYMS.put("new employee", List.of("onboarding", "new hire", "employee setup"));
        DOMAIN_SYNONYMS.put("how do i", List.of("what's the process for", "steps to", "guide for"));
        DOMAIN_SYNONYMS.put("can i", List.of("am i able to", "is it possible to", "what's the process for"));
        DOMAIN_SYNONYMS.put("what is", List.of("explain", "tell me about", "describe"));
    }

    /**
     * Returns up to {@code limit} rewrites of {@code query}, none equal to it.
     */
    public List<String> expand(String query, int limit) {
        List<String> expansions = new ArrayList<>();
        if (query == null || query.isBlank() || limit <= 0) {
            return expansions;
        }
        String lower = query.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> entry : DOMAIN_SYNONYMS.entrySet()) {
            if (expansions.size() >= limit) {
                break;
            }
            int at = lower.indexOf(entry.getKey());
            if (at < 0) {
                continue;
            }
            for (String synonym : entry.getValue()) {
                String rewritten = query.substring(0, at) + synonym + query.substring(at + entry.getKey().length());
                if (add(expansions, query, rewritten)) {
                    break;
                }
            }
        }

        if (expansions.size() < limit) {
            if (query.startsWith("How ")) {
                add(expansions, query, stripQuestionMark(query.substring(4)) + " procedure and guidelines");
            } else if (query.startsWith("What ")) {
                add(expansions, query, "Tell me about " + stripQuestionMark(query.substring(5)));
            }
        }

        for (String term : DOMAIN_TERMS) {
            if (expansions.size() >= limit) {
                break;
            }
            if (!lower.contains(term)) {
                add(expansions, query, stripQuestionMark(query) + " for " + term);
            }
        }
        return expansions.size() > limit ? new ArrayList<>(expansions.subList(0, limit)) : expansions;
    }

    private boolean add(List<String> expansions, String query, String candidate) {
        if (candidate.isBlank() || candidate.equalsIgnoreCase(query)) {
            return false;
        }
        for (String existing : expansions) {
            if (existing.equalsIgnoreCase(candidate)) {
                return false;
            }
        }
        expansions.add(candidate);
        return true;
    }

    private String stripQuestionMark(String text) {
        String trimmed = text.strip();
        while (trimmed.endsWith("?")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        return trimmed;
    }
}

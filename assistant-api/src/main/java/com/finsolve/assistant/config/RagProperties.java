package com.finsolve.assistant.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "chat.rag")
public class RagProperties {

    /**
     * Maximum number of ranked chunks handed to the prompt composer, and the
     * per-call candidate limit of each similarity search.
     */
    @Min(1)
    private int topK = 5;

    /**
     * Minimum similarity a chunk needs to be considered at all.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.7;

    /**
     * Number of most recent turns kept as conversational context.
     */
    @Min(0)
    private int chunkHistoryLimit = 10;

    /**
     * Number of query variants, the original standalone query included.
     */
    @Min(1)
    private int augmentationVariantCount = 5;

    @Min(1)
    private long retrievalTimeoutMs = 3000;

    @Min(1)
    private int promptTokenBudget = 6000;

    /**
     * Upper bound of concurrently outstanding similarity searches per turn.
     */
    @Min(1)
    private int retrievalConcurrency = 8;

    @Min(1)
    private int maxMessageLength = 2000;

    @Min(16)
    private int answerMaxTokens = 1024;

    @Min(16)
    private int rewriteMaxTokens = 256;

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public int getChunkHistoryLimit() {
        return chunkHistoryLimit;
    }

    public void setChunkHistoryLimit(int chunkHistoryLimit) {
        this.chunkHistoryLimit = chunkHistoryLimit;
    }

    public int getAugmentationVariantCount() {
        return augmentationVariantCount;
    }

    public void setAugmentationVariantCount(int augmentationVariantCount) {
        this.augmentationVariantCount = augmentationVariantCount;
    }

    public long getRetrievalTimeoutMs() {
        return retrievalTimeoutMs;
    }

    public void setRetrievalTimeoutMs(long retrievalTimeoutMs) {
        this.retrievalTimeoutMs = retrievalTimeoutMs;
    }

    public Duration retrievalTimeout() {
        return Duration.ofMillis(retrievalTimeoutMs);
    }

    public int getPromptTokenBudget() {
        return promptTokenBudget;
    }

    public void setPromptTokenBudget(int promptTokenBudget) {
        this.promptTokenBudget = promptTokenBudget;
    }

    public int getRetrievalConcurrency() {
        return retrievalConcurrency;
    }

    public void setRetrievalConcurrency(int retrievalConcurrency) {
        this.retrievalConcurrency = retrievalConcurrency;
    }

    public int getMaxMessageLength() {
        return maxMessageLength;
    }

    public void setMaxMessageLength(int maxMessageLength) {
        this.maxMessageLength = maxMessageLength;
    }

    public int getAnswerMaxTokens() {
        return answerMaxTokens;
    }

    public void setAnswerMaxTokens(int answerMaxTokens) {
        this.answerMaxTokens = answerMaxTokens;
    }

    public int getRewriteMaxTokens() {
        return rewriteMaxTokens;
    }

    public void setRewriteMaxTokens(int rewriteMaxTokens) {
        this.rewriteMaxTokens = rewriteMaxTokens;
    }
}

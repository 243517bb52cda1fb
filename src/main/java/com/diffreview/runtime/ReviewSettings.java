package com.diffreview.runtime;

import java.time.Duration;

/**
 * Settings of one review run, fixed once resolved.
 */
public record ReviewSettings(
        int maxTokens,
        int fileTokenLimit,
        int batchTokenBudget,
        Duration batchDelay,
        boolean showSkippedFilesComment,
        String estimator,
        String encoding,
        ReviewStyle style,
        String commentPrefix,
        String generationEndpoint,
        String model,
        Duration generationTimeout,
        String suggestionPrompt,
        String structuredPrompt,
        String githubApiUrl,
        Duration githubTimeout) {

    public String systemPrompt() {
        return style == ReviewStyle.STRUCTURED ? structuredPrompt : suggestionPrompt;
    }
}

package com.diffreview.runtime;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.generation.PromptTemplates;

/**
 * Folds the YAML configuration and environment overrides into one {@link ReviewSettings}.
 */
public class ReviewSettingsResolver {
    private static final Logger log = LoggerFactory.getLogger(ReviewSettingsResolver.class);
    static final int MAX_TOKENS_UPPER_BOUND = 128_000;

    private final Map<String, String> environment;

    public ReviewSettingsResolver() {
        this(System.getenv());
    }

    public ReviewSettingsResolver(Map<String, String> environment) {
        this.environment = environment;
    }

    public ReviewSettings resolve(AppConfig config) {
        AppConfig.ReviewConfig review = config.getReview();
        AppConfig.GenerationConfig generation = config.getGeneration();
        AppConfig.GitHubConfig github = config.getGithub();

        int maxTokens = intOverride("MAX_TOKENS", review.getMaxTokens());
        if (maxTokens < 1 || maxTokens > MAX_TOKENS_UPPER_BOUND) {
            throw new IllegalArgumentException("Invalid maxTokens value: " + maxTokens
                    + ". Must be between 1 and " + MAX_TOKENS_UPPER_BOUND);
        }
        int halfBudget = Math.max(1, maxTokens / 2);
        int fileTokenLimit = review.getFileTokenLimit() > 0 ? review.getFileTokenLimit() : halfBudget;
        int batchTokenBudget = review.getBatchTokenBudget() > 0 ? review.getBatchTokenBudget() : halfBudget;
        if (fileTokenLimit > batchTokenBudget) {
            log.warn("config.file_limit_above_batch_budget fileTokenLimit={} batchTokenBudget={}; clamping",
                    fileTokenLimit, batchTokenBudget);
            fileTokenLimit = batchTokenBudget;
        }
        if (review.getBatchDelayMs() < 0) {
            throw new IllegalArgumentException("batchDelayMs must not be negative");
        }

        boolean showSkipped = review.isShowSkippedFilesComment()
                && !"false".equalsIgnoreCase(env("SHOW_SKIPPED_FILES_COMMENT"));

        String model = firstNonBlank(env("OPENAI_MODEL"), generation.getModel(), "gpt-3.5-turbo");
        String endpoint = firstNonBlank(env("OPENAI_BASE_URL"), generation.getEndpoint(), "https://api.openai.com/v1");

        return new ReviewSettings(
                maxTokens,
                fileTokenLimit,
                batchTokenBudget,
                Duration.ofMillis(review.getBatchDelayMs()),
                showSkipped,
                firstNonBlank(review.getEstimator(), "bpe").toLowerCase(Locale.ROOT),
                firstNonBlank(review.getEncoding(), "r50k_base"),
                ReviewStyle.parse(review.getStyle()),
                review.getCommentPrefix() == null ? "" : review.getCommentPrefix(),
                endpoint,
                model,
                Duration.ofMillis(Math.max(1, generation.getTimeoutMs())),
                firstNonBlank(env("CUSTOM_PROMPT"), generation.getSuggestionPrompt(), PromptTemplates.DEFAULT_SUGGESTION_PROMPT),
                firstNonBlank(env("CUSTOM_STRUCTURED_PROMPT"), generation.getStructuredPrompt(), PromptTemplates.DEFAULT_STRUCTURED_PROMPT),
                firstNonBlank(github.getApiUrl(), "https://api.github.com"),
                Duration.ofMillis(Math.max(1, github.getTimeoutMs())));
    }

    private int intOverride(String key, int fallback) {
        String value = env(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("config.invalid_env key={} value={}; using {}", key, value, fallback);
            return fallback;
        }
    }

    private String env(String key) {
        return environment.get(key);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}

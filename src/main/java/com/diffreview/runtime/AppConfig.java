package com.diffreview.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ReviewConfig review = new ReviewConfig();
    private GenerationConfig generation = new GenerationConfig();
    private GitHubConfig github = new GitHubConfig();

    public ReviewConfig getReview() {
        return review;
    }

    public void setReview(ReviewConfig review) {
        this.review = review == null ? new ReviewConfig() : review;
    }

    public GenerationConfig getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationConfig generation) {
        this.generation = generation == null ? new GenerationConfig() : generation;
    }

    public GitHubConfig getGithub() {
        return github;
    }

    public void setGithub(GitHubConfig github) {
        this.github = github == null ? new GitHubConfig() : github;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReviewConfig {
        private int maxTokens = 4096;
        private int fileTokenLimit = 0;
        private int batchTokenBudget = 0;
        private long batchDelayMs = 20000;
        private boolean showSkippedFilesComment = true;
        private String estimator = "bpe";
        private String encoding = "r50k_base";
        private String style = "structured";
        private String commentPrefix = "[diff-review]";

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getFileTokenLimit() {
            return fileTokenLimit;
        }

        public void setFileTokenLimit(int fileTokenLimit) {
            this.fileTokenLimit = fileTokenLimit;
        }

        public int getBatchTokenBudget() {
            return batchTokenBudget;
        }

        public void setBatchTokenBudget(int batchTokenBudget) {
            this.batchTokenBudget = batchTokenBudget;
        }

        public long getBatchDelayMs() {
            return batchDelayMs;
        }

        public void setBatchDelayMs(long batchDelayMs) {
            this.batchDelayMs = batchDelayMs;
        }

        public boolean isShowSkippedFilesComment() {
            return showSkippedFilesComment;
        }

        public void setShowSkippedFilesComment(boolean showSkippedFilesComment) {
            this.showSkippedFilesComment = showSkippedFilesComment;
        }

        public String getEstimator() {
            return estimator;
        }

        public void setEstimator(String estimator) {
            this.estimator = estimator;
        }

        public String getEncoding() {
            return encoding;
        }

        public void setEncoding(String encoding) {
            this.encoding = encoding;
        }

        public String getStyle() {
            return style;
        }

        public void setStyle(String style) {
            this.style = style;
        }

        public String getCommentPrefix() {
            return commentPrefix;
        }

        public void setCommentPrefix(String commentPrefix) {
            this.commentPrefix = commentPrefix;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerationConfig {
        private String endpoint = "https://api.openai.com/v1";
        private String model = "gpt-3.5-turbo";
        private int timeoutMs = 120000;
        private String suggestionPrompt;
        private String structuredPrompt;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getSuggestionPrompt() {
            return suggestionPrompt;
        }

        public void setSuggestionPrompt(String suggestionPrompt) {
            this.suggestionPrompt = suggestionPrompt;
        }

        public String getStructuredPrompt() {
            return structuredPrompt;
        }

        public void setStructuredPrompt(String structuredPrompt) {
            this.structuredPrompt = structuredPrompt;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitHubConfig {
        private String apiUrl = "https://api.github.com";
        private int timeoutMs = 30000;

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}

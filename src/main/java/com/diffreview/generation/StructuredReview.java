package com.diffreview.generation;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StructuredReview(
        @JsonProperty("overall_review") OverallReview overallReview,
        @JsonProperty("file_reviews") List<FileReview> fileReviews) {

    public StructuredReview {
        fileReviews = fileReviews == null ? List.of() : List.copyOf(fileReviews);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OverallReview(
            @JsonProperty("summary") String summary,
            @JsonProperty("recommendation") String recommendation,
            @JsonProperty("issues_count") int issuesCount,
            @JsonProperty("quality_score") int qualityScore) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FileReview(
            @JsonProperty("filename") String filename,
            @JsonProperty("line_comments") List<LineComment> lineComments,
            @JsonProperty("file_summary") String fileSummary) {

        public FileReview {
            lineComments = lineComments == null ? List.of() : List.copyOf(lineComments);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LineComment(
            @JsonProperty("line_number") int lineNumber,
            @JsonProperty("comment") String comment,
            @JsonProperty("severity") String severity,
            @JsonProperty("category") String category) {
    }
}

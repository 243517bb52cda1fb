package com.diffreview.generation;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads the backend's JSON review. Anything that does not parse becomes a single low-confidence note carrying the
 * raw text, so a bad response never aborts the run.
 */
public class StructuredReviewParser {
    private static final Logger log = LoggerFactory.getLogger(StructuredReviewParser.class);
    static final String FALLBACK_FILENAME = "unknown";

    private final ObjectMapper mapper = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public StructuredReview parse(String raw) {
        String json = stripCodeFence(raw == null ? "" : raw);
        StructuredReview review;
        try {
            review = mapper.readValue(json, StructuredReview.class);
        } catch (JsonProcessingException e) {
            log.warn("generation.structured.parse_failed reason={} chars={}", e.getOriginalMessage(), json.length());
            return fallback(raw);
        }
        if (review == null) {
            return fallback(raw);
        }
        if (review.overallReview() == null) {
            log.warn("generation.structured.missing_overall_review; using default");
            review = new StructuredReview(
                    new StructuredReview.OverallReview("Review completed", "COMMENT", review.fileReviews().size(), 7),
                    review.fileReviews());
        }
        log.debug("generation.structured.parsed recommendation={} files={}",
                review.overallReview().recommendation(), review.fileReviews().size());
        return review;
    }

    static StructuredReview fallback(String raw) {
        String note = raw == null || raw.isBlank() ? "No response received" : raw;
        return new StructuredReview(
                new StructuredReview.OverallReview(
                        "Failed to parse structured response, falling back to basic review", "COMMENT", 0, 5),
                List.of(new StructuredReview.FileReview(
                        FALLBACK_FILENAME,
                        List.of(new StructuredReview.LineComment(1, note, "suggestion", "maintainability")),
                        "Unable to parse structured review")));
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            trimmed = trimmed.replaceFirst("^```(?:json)?\\s*", "");
            if (trimmed.endsWith("```")) {
                trimmed = trimmed.substring(0, trimmed.length() - 3).trim();
            }
        }
        return trimmed;
    }
}

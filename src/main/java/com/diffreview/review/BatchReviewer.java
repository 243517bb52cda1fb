package com.diffreview.review;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.batch.Batch;
import com.diffreview.batch.FilePatch;
import com.diffreview.batch.PatchConcatenator;
import com.diffreview.diff.FileDiff;
import com.diffreview.diff.PatchParser;
import com.diffreview.generation.GenerationClient;
import com.diffreview.generation.StructuredReview;
import com.diffreview.generation.StructuredReview.FileReview;
import com.diffreview.generation.StructuredReview.LineComment;
import com.diffreview.generation.StructuredReviewParser;
import com.diffreview.generation.Suggestion;
import com.diffreview.generation.SuggestionParser;
import com.diffreview.placement.CommentPoster;
import com.diffreview.placement.PlacementCandidate;
import com.diffreview.placement.PlacementExecutor;
import com.diffreview.placement.PlacementOutcome;
import com.diffreview.placement.PlacementResolver;
import com.diffreview.runtime.ReviewSettings;
import com.diffreview.runtime.ReviewStyle;

/**
 * One request/response/placement cycle for a batch. A failure while placing one file is logged and the rest of
 * the batch continues; a failed backend call propagates to the dispatch queue.
 */
public class BatchReviewer implements BatchHandler {
    private static final Logger log = LoggerFactory.getLogger(BatchReviewer.class);

    private final GenerationClient generationClient;
    private final CommentPoster poster;
    private final ReviewSettings settings;
    private final PatchParser patchParser;
    private final PlacementResolver resolver;
    private final PlacementExecutor executor;
    private final SuggestionParser suggestionParser;
    private final StructuredReviewParser structuredParser;

    public BatchReviewer(GenerationClient generationClient, CommentPoster poster, ReviewSettings settings) {
        this.generationClient = generationClient;
        this.poster = poster;
        this.settings = settings;
        this.patchParser = new PatchParser();
        this.resolver = new PlacementResolver();
        this.executor = new PlacementExecutor(poster);
        this.suggestionParser = new SuggestionParser();
        this.structuredParser = new StructuredReviewParser();
    }

    @Override
    public List<PlacementOutcome> handle(Batch batch) throws IOException {
        boolean structured = settings.style() == ReviewStyle.STRUCTURED;
        String response = generationClient.complete(
                settings.systemPrompt(),
                PatchConcatenator.concatenate(batch),
                structured);
        return structured ? placeStructured(batch, response) : placeSuggestions(batch, response);
    }

    List<PlacementOutcome> placeSuggestions(Batch batch, String response) {
        Map<String, Suggestion> byFile = new LinkedHashMap<>();
        for (Suggestion suggestion : suggestionParser.parse(response)) {
            byFile.put(suggestion.filename(), suggestion);
        }
        List<PlacementOutcome> outcomes = new ArrayList<>();
        for (FilePatch file : batch.files()) {
            Suggestion suggestion = byFile.remove(file.filename());
            if (suggestion == null) {
                log.debug("review.file.no_suggestion file={}", file.filename());
                continue;
            }
            try {
                FileDiff diff = patchParser.parseFile(file.filename(), file.rawPatch());
                outcomes.add(executor.place(file.filename(), resolver.resolve(diff), suggestion.suggestionText()));
            } catch (RuntimeException e) {
                log.error("review.file.failed file={} reason={}", file.filename(), e.getMessage(), e);
            }
        }
        if (!byFile.isEmpty()) {
            log.warn("review.suggestions.unmatched files={}", byFile.keySet());
        }
        return outcomes;
    }

    List<PlacementOutcome> placeStructured(Batch batch, String response) {
        StructuredReview review = structuredParser.parse(response);
        Map<String, FileReview> byFile = new LinkedHashMap<>();
        for (FileReview fileReview : review.fileReviews()) {
            if (fileReview.filename() != null) {
                byFile.merge(fileReview.filename(), fileReview, BatchReviewer::mergeReviews);
            }
        }

        List<PlacementOutcome> outcomes = new ArrayList<>();
        Set<String> reviewed = new HashSet<>();
        for (FilePatch file : batch.files()) {
            FileReview fileReview = byFile.get(file.filename());
            if (fileReview == null) {
                continue;
            }
            reviewed.add(file.filename());
            try {
                FileDiff diff = patchParser.parseFile(file.filename(), file.rawPatch());
                for (LineComment comment : fileReview.lineComments()) {
                    outcomes.add(executor.place(file.filename(), candidates(diff, comment), commentBody(comment)));
                }
            } catch (RuntimeException e) {
                log.error("review.file.failed file={} reason={}", file.filename(), e.getMessage(), e);
            }
        }

        List<FileReview> unmatched = byFile.values().stream()
                .filter(fileReview -> !reviewed.contains(fileReview.filename()))
                .toList();
        if (!unmatched.isEmpty()) {
            log.warn("review.structured.unmatched files={}",
                    unmatched.stream().map(FileReview::filename).toList());
        }
        postSummary(review, batch, unmatched);
        return outcomes;
    }

    private List<PlacementCandidate> candidates(FileDiff diff, LineComment comment) {
        if (diff.records().isEmpty()) {
            return resolver.resolve(diff);
        }
        return resolver.resolve(diff.records(), comment.lineNumber());
    }

    private void postSummary(StructuredReview review, Batch batch, List<FileReview> unmatched) {
        String body = summaryBody(review, batch, unmatched);
        try {
            poster.postPullRequestComment(body);
            log.info("review.summary.posted files={} recommendation={}",
                    batch.files().size(), review.overallReview().recommendation());
        } catch (IOException | RuntimeException e) {
            log.warn("review.summary.rejected reason={}", e.getMessage());
        }
    }

    static String summaryBody(StructuredReview review, Batch batch, List<FileReview> unmatched) {
        StructuredReview.OverallReview overall = review.overallReview();
        StringBuilder builder = new StringBuilder();
        builder.append("Review summary (").append(batch.files().size()).append(" files)\n");
        builder.append("Recommendation: ").append(overall.recommendation()).append('\n');
        builder.append("Quality score: ").append(overall.qualityScore()).append("/10\n");
        builder.append("Issues: ").append(overall.issuesCount()).append('\n');
        if (overall.summary() != null && !overall.summary().isBlank()) {
            builder.append('\n').append(overall.summary().strip()).append('\n');
        }
        for (FileReview fileReview : review.fileReviews()) {
            if (fileReview.fileSummary() != null && !fileReview.fileSummary().isBlank()) {
                builder.append('\n').append(fileReview.filename()).append(": ").append(fileReview.fileSummary().strip());
            }
        }
        for (FileReview fileReview : unmatched) {
            for (LineComment comment : fileReview.lineComments()) {
                builder.append('\n').append(fileReview.filename()).append(':').append(comment.lineNumber())
                        .append(' ').append(commentBody(comment));
            }
        }
        return builder.toString().stripTrailing();
    }

    static String commentBody(LineComment comment) {
        String severity = comment.severity() == null ? "suggestion" : comment.severity();
        String text = comment.comment() == null ? "" : comment.comment().strip();
        if (comment.category() == null || comment.category().isBlank()) {
            return severity + ": " + text;
        }
        return severity + " (" + comment.category() + "): " + text;
    }

    private static FileReview mergeReviews(FileReview first, FileReview second) {
        List<LineComment> comments = new ArrayList<>(first.lineComments());
        comments.addAll(second.lineComments());
        String summary = first.fileSummary() == null ? second.fileSummary() : first.fileSummary();
        return new FileReview(first.filename(), comments, summary);
    }
}

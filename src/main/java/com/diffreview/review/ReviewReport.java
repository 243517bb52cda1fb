package com.diffreview.review;

import java.util.List;

import com.diffreview.placement.PlacementOutcome;

public record ReviewReport(
        int totalFiles,
        List<String> rejected,
        int batches,
        int failedBatches,
        List<PlacementOutcome> outcomes) {

    public ReviewReport {
        rejected = List.copyOf(rejected);
        outcomes = List.copyOf(outcomes);
    }

    public long lineComments() {
        return outcomes.stream().filter(PlacementOutcome::lineAnchored).count();
    }

    public long pullRequestComments() {
        return outcomes.stream().filter(outcome -> outcome.placed() && !outcome.lineAnchored()).count();
    }

    public long failedPlacements() {
        return outcomes.stream().filter(outcome -> !outcome.placed()).count();
    }

    public boolean succeeded() {
        return failedBatches == 0;
    }
}

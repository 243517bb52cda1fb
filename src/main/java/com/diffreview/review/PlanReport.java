package com.diffreview.review;

import java.util.List;

import com.diffreview.diff.PatchSummary;
import com.diffreview.placement.PlacementCandidate;

/**
 * Offline view of a run: what would be sent, and where each file's comment would be tried.
 */
public record PlanReport(
        int totalFiles,
        List<String> rejected,
        List<BatchView> batches,
        List<FileView> files) {

    public record BatchView(int index, int totalUnits, List<String> files) {
    }

    public record FileView(
            String filename,
            int unitsUsed,
            int malformedHeaders,
            PatchSummary summary,
            List<PlacementCandidate> candidates) {
    }
}

package com.diffreview.review;

import java.util.List;

import com.diffreview.placement.PlacementOutcome;

public record DispatchSummary(int dispatched, int failed, List<PlacementOutcome> outcomes) {

    public DispatchSummary {
        outcomes = List.copyOf(outcomes);
    }
}

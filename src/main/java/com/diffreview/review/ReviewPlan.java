package com.diffreview.review;

import java.util.List;

import com.diffreview.batch.Batch;
import com.diffreview.batch.GateResult;

public record ReviewPlan(int totalFiles, GateResult gate, List<Batch> batches) {

    public ReviewPlan {
        batches = List.copyOf(batches);
    }

    public List<String> rejected() {
        return gate.rejected();
    }
}

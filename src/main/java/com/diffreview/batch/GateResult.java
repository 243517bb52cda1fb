package com.diffreview.batch;

import java.util.List;

public record GateResult(List<FilePatch> eligible, List<String> rejected) {

    public GateResult {
        eligible = List.copyOf(eligible);
        rejected = List.copyOf(rejected);
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }
}

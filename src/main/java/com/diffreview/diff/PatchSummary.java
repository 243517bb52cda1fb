package com.diffreview.diff;

import java.util.List;

public record PatchSummary(int firstChangedLine, boolean hasChanges, List<Integer> addedLines, List<Integer> modifiedLines) {

    public PatchSummary {
        addedLines = List.copyOf(addedLines);
        modifiedLines = List.copyOf(modifiedLines);
    }
}

package com.diffreview.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

public record FileDiff(String filename, List<Hunk> hunks, List<LineRecord> records, int malformedHeaders) {

    public FileDiff {
        hunks = List.copyOf(hunks);
        records = List.copyOf(records);
    }

    public static FileDiff empty(String filename) {
        return new FileDiff(filename, List.of(), List.of(), 0);
    }

    /**
     * Anchor used when a hunk has no classified body: the first hunk's new-side start line.
     */
    public OptionalInt defaultTarget() {
        return hunks.stream()
                .mapToInt(Hunk::newStart)
                .filter(start -> start >= 1)
                .findFirst();
    }

    public PatchSummary summary() {
        List<Integer> added = new ArrayList<>();
        List<Integer> modified = new ArrayList<>();
        Integer firstChanged = null;
        for (LineRecord record : records) {
            if (record.kind() == LineKind.CONTEXT) {
                continue;
            }
            if (firstChanged == null) {
                firstChanged = record.lineNumber();
            }
            if (record.kind() == LineKind.ADDED) {
                added.add(record.lineNumber());
            } else {
                modified.add(record.lineNumber());
            }
        }
        boolean hasChanges = firstChanged != null;
        int firstChangedLine = hasChanges ? firstChanged : defaultTarget().orElse(1);
        return new PatchSummary(firstChangedLine, hasChanges, added, modified);
    }
}

package com.diffreview.placement;

import java.util.function.Predicate;

import com.diffreview.diff.LineKind;
import com.diffreview.diff.LineRecord;

public enum PlacementTier {
    REQUESTED(0, record -> false),
    ADDED(1, record -> record.kind() == LineKind.ADDED),
    MODIFIED(2, record -> record.kind() == LineKind.MODIFIED),
    CONTEXT(3, record -> record.kind() == LineKind.CONTEXT),
    PULL_REQUEST(4, record -> false);

    private final int rank;
    private final Predicate<LineRecord> selects;

    PlacementTier(int rank, Predicate<LineRecord> selects) {
        this.rank = rank;
        this.selects = selects;
    }

    public int rank() {
        return rank;
    }

    boolean selects(LineRecord record) {
        return selects.test(record);
    }
}

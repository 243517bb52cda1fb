package com.diffreview.placement;

import java.util.Objects;

import com.diffreview.diff.LineKind;
import com.diffreview.diff.LineRecord;

/**
 * A line to try, or, for {@link PlacementTier#PULL_REQUEST}, the instruction to fall back to a whole-PR comment
 * ({@code lineNumber} 0, {@code kind} null).
 */
public record PlacementCandidate(int lineNumber, LineKind kind, PlacementTier tier) {
    private static final PlacementCandidate PULL_REQUEST = new PlacementCandidate(0, null, PlacementTier.PULL_REQUEST);

    public PlacementCandidate {
        Objects.requireNonNull(tier, "tier");
        if (tier != PlacementTier.PULL_REQUEST && lineNumber < 1) {
            throw new IllegalArgumentException("Line-anchored candidates need a line >= 1");
        }
    }

    public static PlacementCandidate of(LineRecord record, PlacementTier tier) {
        return new PlacementCandidate(record.lineNumber(), record.kind(), tier);
    }

    public static PlacementCandidate pullRequest() {
        return PULL_REQUEST;
    }

    public boolean isLineAnchored() {
        return tier != PlacementTier.PULL_REQUEST;
    }
}

package com.diffreview.placement;

public record PlacementOutcome(String filename, PlacementCandidate placedAt, int attempts) {

    public static PlacementOutcome failed(String filename, int attempts) {
        return new PlacementOutcome(filename, null, attempts);
    }

    public boolean placed() {
        return placedAt != null;
    }

    public boolean lineAnchored() {
        return placed() && placedAt.isLineAnchored();
    }
}

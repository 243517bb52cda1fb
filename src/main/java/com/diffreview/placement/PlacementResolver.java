package com.diffreview.placement;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;

import com.diffreview.diff.FileDiff;
import com.diffreview.diff.LineKind;
import com.diffreview.diff.LineRecord;

/**
 * Ranks every recorded line of a file as a comment anchor. Tiers are enumerated in order (added, modified,
 * context) and the list always ends with the whole-PR sentinel. Whether a candidate is accepted is decided by
 * the caller.
 */
public class PlacementResolver {
    private static final List<PlacementTier> LINE_TIERS = List.of(
            PlacementTier.ADDED,
            PlacementTier.MODIFIED,
            PlacementTier.CONTEXT);

    public List<PlacementCandidate> resolve(List<LineRecord> records) {
        return stream(records).toList();
    }

    /**
     * Same as {@link #resolve(List)}; a file with hunks but no classified lines gets its first hunk's start line
     * as a context candidate.
     */
    public List<PlacementCandidate> resolve(FileDiff diff) {
        OptionalInt fallback = diff.defaultTarget();
        if (diff.records().isEmpty() && fallback.isPresent()) {
            return List.of(
                    new PlacementCandidate(fallback.getAsInt(), LineKind.CONTEXT, PlacementTier.CONTEXT),
                    PlacementCandidate.pullRequest());
        }
        return resolve(diff.records());
    }

    /**
     * Puts {@code requestedLine} first when it is one of the recorded lines; it is not repeated in its own tier.
     */
    public List<PlacementCandidate> resolve(List<LineRecord> records, int requestedLine) {
        LineRecord requested = records.stream()
                .filter(record -> record.lineNumber() == requestedLine)
                .findFirst()
                .orElse(null);
        if (requested == null) {
            return resolve(records);
        }
        return Stream.concat(
                        Stream.of(PlacementCandidate.of(requested, PlacementTier.REQUESTED)),
                        stream(records).filter(candidate -> candidate.lineNumber() != requestedLine
                                || !candidate.isLineAnchored()))
                .toList();
    }

    public Stream<PlacementCandidate> stream(List<LineRecord> records) {
        Stream<PlacementCandidate> lines = LINE_TIERS.stream()
                .flatMap(tier -> records.stream()
                        .filter(tier::selects)
                        .sorted(Comparator.comparingInt(LineRecord::lineNumber))
                        .map(record -> PlacementCandidate.of(record, tier)));
        return Stream.concat(lines, Stream.of(PlacementCandidate.pullRequest()));
    }
}

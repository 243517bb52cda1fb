package com.diffreview.placement;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.diffreview.diff.LineKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlacementExecutorTest {

    @Test
    void shouldStopAtFirstAcceptedCandidate() {
        RecordingPoster poster = new RecordingPoster(Set.of(3));
        PlacementExecutor executor = new PlacementExecutor(poster);

        PlacementOutcome outcome = executor.place("f.txt", List.of(
                new PlacementCandidate(3, LineKind.ADDED, PlacementTier.ADDED),
                new PlacementCandidate(5, LineKind.MODIFIED, PlacementTier.MODIFIED),
                new PlacementCandidate(7, LineKind.CONTEXT, PlacementTier.CONTEXT),
                PlacementCandidate.pullRequest()), "body");

        assertTrue(outcome.lineAnchored());
        assertEquals(5, outcome.placedAt().lineNumber());
        assertEquals(2, outcome.attempts());
        assertEquals(List.of("f.txt:3", "f.txt:5"), poster.attempts);
    }

    @Test
    void shouldFallThroughToPullRequestComment() {
        RecordingPoster poster = new RecordingPoster(Set.of(1, 2));
        PlacementExecutor executor = new PlacementExecutor(poster);

        PlacementOutcome outcome = executor.place("f.txt", List.of(
                new PlacementCandidate(1, LineKind.ADDED, PlacementTier.ADDED),
                new PlacementCandidate(2, LineKind.CONTEXT, PlacementTier.CONTEXT),
                PlacementCandidate.pullRequest()), "body");

        assertTrue(outcome.placed());
        assertFalse(outcome.lineAnchored());
        assertEquals(3, outcome.attempts());
        assertEquals(List.of("f.txt\n\nbody"), poster.pullRequestComments);
    }

    @Test
    void shouldReportFailureWhenEveryCandidateIsRejected() {
        RecordingPoster poster = new RecordingPoster(Set.of(1));
        poster.rejectPullRequestComments = true;
        PlacementExecutor executor = new PlacementExecutor(poster);

        PlacementOutcome outcome = executor.place("f.txt", List.of(
                new PlacementCandidate(1, LineKind.ADDED, PlacementTier.ADDED),
                PlacementCandidate.pullRequest()), "body");

        assertFalse(outcome.placed());
        assertEquals(2, outcome.attempts());
    }

    private static class RecordingPoster implements CommentPoster {
        private final Set<Integer> rejectedLines;
        private final List<String> attempts = new ArrayList<>();
        private final List<String> pullRequestComments = new ArrayList<>();
        private boolean rejectPullRequestComments;

        private RecordingPoster(Set<Integer> rejectedLines) {
            this.rejectedLines = rejectedLines;
        }

        @Override
        public void postLineComment(String filename, int lineNumber, String body) throws IOException {
            attempts.add(filename + ":" + lineNumber);
            if (rejectedLines.contains(lineNumber)) {
                throw new IOException("line " + lineNumber + " is not part of the diff");
            }
        }

        @Override
        public void postPullRequestComment(String body) {
            if (rejectPullRequestComments) {
                throw new IllegalStateException("comments disabled");
            }
            pullRequestComments.add(body);
        }
    }
}

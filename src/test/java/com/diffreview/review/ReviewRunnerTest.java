package com.diffreview.review;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.diffreview.batch.ChangedFile;
import com.diffreview.batch.CharacterRatioTokenEstimator;
import com.diffreview.generation.GenerationClient;
import com.diffreview.github.PullRequest;
import com.diffreview.github.SourceControlClient;
import com.diffreview.placement.PlacementTier;
import com.diffreview.runtime.AppConfig;
import com.diffreview.runtime.ReviewSettings;
import com.diffreview.runtime.ReviewSettingsResolver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviewRunnerTest {
    private static final String SMALL_PATCH = "@@ -1,2 +1,3 @@\n a\n+b\n c";
    private static final String HUGE_PATCH = "@@ -1 +1 @@\n+" + "x".repeat(1000);

    @Test
    void shouldAnchorSuggestionOnAddedLineAndReportSkippedFiles() throws Exception {
        FakeSourceControl github = new FakeSourceControl(List.of(
                new ChangedFile("src/A.java", "modified", SMALL_PATCH),
                new ChangedFile("big/Generated.java", "added", HUGE_PATCH)));
        FakeGeneration generation = new FakeGeneration("@@src/A.java@@ Use a constant.");

        ReviewReport report = runner(github, generation, "suggestions", true).run(7, null, null);

        assertEquals(List.of("src/A.java:2:[diff-review]\nUse a constant."), github.lineComments);
        assertEquals(1, github.issueComments.size());
        assertTrue(github.issueComments.get(0).contains("big/Generated.java"));
        assertEquals(List.of("big/Generated.java"), report.rejected());
        assertEquals(1, report.batches());
        assertEquals(1, report.lineComments());
        assertTrue(report.succeeded());
        assertTrue(generation.requests.get(0).startsWith("src/A.java\n@@ -1,2 +1,3 @@"));
        assertFalse(generation.structuredRequests.get(0));
    }

    @Test
    void shouldSkipNoticeWhenDisabled() throws Exception {
        FakeSourceControl github = new FakeSourceControl(List.of(
                new ChangedFile("big/Generated.java", "added", HUGE_PATCH)));
        FakeGeneration generation = new FakeGeneration("unused");

        ReviewReport report = runner(github, generation, "suggestions", false).run(7, null, null);

        assertTrue(github.issueComments.isEmpty());
        assertTrue(generation.requests.isEmpty());
        assertEquals(0, report.batches());
    }

    @Test
    void shouldPlaceStructuredCommentOnRequestedLineAndPostSummary() throws Exception {
        FakeSourceControl github = new FakeSourceControl(List.of(
                new ChangedFile("src/A.java", "modified", SMALL_PATCH)));
        FakeGeneration generation = new FakeGeneration("""
                {"overall_review":{"summary":"Fine","recommendation":"COMMENT","issues_count":1,"quality_score":8},
                 "file_reviews":[{"filename":"src/A.java","file_summary":"ok",
                   "line_comments":[{"line_number":3,"comment":"Trailing call","severity":"warning","category":"style"}]}]}
                """);

        ReviewReport report = runner(github, generation, "structured", true).run(7, "main", "dev");

        assertEquals(List.of("src/A.java:3:[diff-review]\nwarning (style): Trailing call"), github.lineComments);
        assertEquals(PlacementTier.REQUESTED, report.outcomes().get(0).placedAt().tier());
        assertEquals(1, github.issueComments.size());
        assertTrue(github.issueComments.get(0).contains("Recommendation: COMMENT"));
        assertEquals(List.of("main...dev"), github.comparisons);
        assertTrue(generation.structuredRequests.get(0));
    }

    @Test
    void shouldFallThroughRejectedLinesToNextTier() throws Exception {
        FakeSourceControl github = new FakeSourceControl(List.of(
                new ChangedFile("src/A.java", "modified", SMALL_PATCH)));
        github.rejectedLines.add(2);
        FakeGeneration generation = new FakeGeneration("@@src/A.java@@ Hmm.");

        ReviewReport report = runner(github, generation, "suggestions", true).run(7, null, null);

        assertEquals(List.of("src/A.java:1:[diff-review]\nHmm."), github.lineComments);
        assertEquals(PlacementTier.CONTEXT, report.outcomes().get(0).placedAt().tier());
        assertEquals(2, report.outcomes().get(0).attempts());
    }

    @Test
    void shouldSurfaceUnparseableStructuredResponseInSummary() throws Exception {
        FakeSourceControl github = new FakeSourceControl(List.of(
                new ChangedFile("src/A.java", "modified", SMALL_PATCH)));
        FakeGeneration generation = new FakeGeneration("Sorry, I cannot produce JSON.");

        ReviewReport report = runner(github, generation, "structured", true).run(7, null, null);

        assertTrue(github.lineComments.isEmpty());
        assertTrue(report.outcomes().isEmpty());
        assertTrue(github.issueComments.get(0).contains("Sorry, I cannot produce JSON."));
    }

    @Test
    void shouldCountFailedBatchAndKeepGoing() throws Exception {
        FakeSourceControl github = new FakeSourceControl(List.of(
                new ChangedFile("src/A.java", "modified", SMALL_PATCH)));
        FakeGeneration generation = new FakeGeneration(null);

        ReviewReport report = runner(github, generation, "suggestions", true).run(7, null, null);

        assertEquals(1, report.failedBatches());
        assertFalse(report.succeeded());
        assertTrue(github.lineComments.isEmpty());
    }

    @Test
    void shouldKeepPostingOtherFilesWhenEveryPlacementForOneFileFails() throws Exception {
        FakeSourceControl github = new FakeSourceControl(List.of(
                new ChangedFile("src/A.java", "modified", SMALL_PATCH),
                new ChangedFile("src/B.java", "modified", SMALL_PATCH)));
        github.failingPath = "src/A.java";
        FakeGeneration generation = new FakeGeneration("@@src/A.java@@ first\n@@src/B.java@@ second");

        ReviewReport report = runner(github, generation, "suggestions", true).run(7, null, null);

        assertEquals(1, report.batches());
        assertEquals(List.of("src/B.java:2:[diff-review]\nsecond"), github.lineComments);
        assertTrue(github.issueComments.isEmpty());
        assertEquals(1, report.failedPlacements());
        assertEquals(1, report.lineComments());
        assertTrue(report.succeeded());
    }

    @Test
    void shouldRefuseToRunWithoutChangedFiles() {
        FakeSourceControl github = new FakeSourceControl(List.of());

        assertThrows(ReviewPreconditionException.class,
                () -> runner(github, new FakeGeneration("x"), "suggestions", true).run(7, null, null));
    }

    private static ReviewRunner runner(
            FakeSourceControl github, FakeGeneration generation, String style, boolean showSkipped) {
        AppConfig config = new AppConfig();
        config.getReview().setMaxTokens(200);
        config.getReview().setBatchDelayMs(0);
        config.getReview().setEstimator("chars");
        config.getReview().setStyle(style);
        config.getReview().setShowSkippedFilesComment(showSkipped);
        ReviewSettings settings = new ReviewSettingsResolver(Map.of()).resolve(config);
        return new ReviewRunner(github, generation, new CharacterRatioTokenEstimator(), settings);
    }

    private static class FakeSourceControl implements SourceControlClient {
        private final List<ChangedFile> files;
        private final Set<Integer> rejectedLines = new HashSet<>();
        private final List<String> lineComments = new ArrayList<>();
        private final List<String> issueComments = new ArrayList<>();
        private final List<String> comparisons = new ArrayList<>();
        private String failingPath;

        private FakeSourceControl(List<ChangedFile> files) {
            this.files = files;
        }

        @Override
        public PullRequest pullRequest(int number) {
            return new PullRequest("octo", "widgets", number, "base-branch", "head-branch", "abc123");
        }

        @Override
        public List<ChangedFile> compare(String baseRef, String headRef) {
            comparisons.add(baseRef + "..." + headRef);
            return files;
        }

        @Override
        public void createReviewComment(PullRequest pullRequest, String path, int line, String body) throws IOException {
            if (path.equals(failingPath)) {
                throw new IOException("Path not in diff " + path);
            }
            if (rejectedLines.contains(line)) {
                throw new IOException("Unprocessable line " + line);
            }
            lineComments.add(path + ":" + line + ":" + body);
        }

        @Override
        public void createIssueComment(PullRequest pullRequest, String body) throws IOException {
            if (failingPath != null && body.contains(failingPath)) {
                throw new IOException("Comment rejected for " + failingPath);
            }
            issueComments.add(body);
        }
    }

    private static class FakeGeneration implements GenerationClient {
        private final String response;
        private final List<String> requests = new ArrayList<>();
        private final List<Boolean> structuredRequests = new ArrayList<>();

        private FakeGeneration(String response) {
            this.response = response;
        }

        @Override
        public String complete(String systemPrompt, String userContent, boolean structured) throws IOException {
            requests.add(userContent);
            structuredRequests.add(structured);
            if (response == null) {
                throw new IOException("Generation backend error 500");
            }
            return response;
        }
    }
}

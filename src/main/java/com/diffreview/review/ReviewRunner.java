package com.diffreview.review;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.batch.ChangedFile;
import com.diffreview.batch.TokenEstimator;
import com.diffreview.generation.GenerationClient;
import com.diffreview.github.PullRequest;
import com.diffreview.github.SourceControlClient;
import com.diffreview.placement.CommentPoster;
import com.diffreview.runtime.ReviewSettings;

public class ReviewRunner {
    private static final Logger log = LoggerFactory.getLogger(ReviewRunner.class);

    private final SourceControlClient sourceControl;
    private final GenerationClient generationClient;
    private final ReviewSettings settings;
    private final ReviewPlanner planner;
    private final BatchDispatchQueue queue;

    public ReviewRunner(
            SourceControlClient sourceControl,
            GenerationClient generationClient,
            TokenEstimator estimator,
            ReviewSettings settings) {
        this(sourceControl, generationClient, settings, new ReviewPlanner(estimator, settings),
                new BatchDispatchQueue(settings.batchDelay()));
    }

    ReviewRunner(
            SourceControlClient sourceControl,
            GenerationClient generationClient,
            ReviewSettings settings,
            ReviewPlanner planner,
            BatchDispatchQueue queue) {
        this.sourceControl = sourceControl;
        this.generationClient = generationClient;
        this.settings = settings;
        this.planner = planner;
        this.queue = queue;
    }

    /**
     * Reviews pull request {@code number}; {@code baseRef} and {@code headRef} override the refs reported by the
     * pull request when non-null.
     */
    public ReviewReport run(int number, String baseRef, String headRef) throws IOException, InterruptedException {
        PullRequest pullRequest = sourceControl.pullRequest(number);
        String base = baseRef == null ? pullRequest.baseRef() : baseRef;
        String head = headRef == null ? pullRequest.headRef() : headRef;
        log.info("review.started pr={} base={} head={} style={} model={}",
                pullRequest.slug(), base, head, settings.style(), settings.model());

        List<ChangedFile> files = sourceControl.compare(base, head);
        ReviewPlan plan = planner.plan(files);
        CommentPoster poster = new GitHubCommentPoster(sourceControl, pullRequest, settings.commentPrefix());

        if (plan.gate().hasRejections()) {
            postSkippedFiles(poster, plan);
        }
        if (plan.batches().isEmpty()) {
            log.info("review.nothing_to_send pr={} rejected={}", pullRequest.slug(), plan.rejected().size());
            return new ReviewReport(plan.totalFiles(), plan.rejected(), 0, 0, List.of());
        }

        DispatchSummary summary = queue.drain(plan.batches(), new BatchReviewer(generationClient, poster, settings));
        ReviewReport report = new ReviewReport(
                plan.totalFiles(), plan.rejected(), summary.dispatched(), summary.failed(), summary.outcomes());
        log.info("review.completed pr={} batches={} failedBatches={} lineComments={} prComments={} failedPlacements={}",
                pullRequest.slug(),
                report.batches(),
                report.failedBatches(),
                report.lineComments(),
                report.pullRequestComments(),
                report.failedPlacements());
        return report;
    }

    private void postSkippedFiles(CommentPoster poster, ReviewPlan plan) {
        if (!settings.showSkippedFilesComment()) {
            log.info("review.skipped_files count={} notice=disabled", plan.rejected().size());
            return;
        }
        try {
            poster.postPullRequestComment(SkippedFilesNotice.render(plan.rejected(), settings.fileTokenLimit()));
            log.info("review.skipped_files count={} notice=posted", plan.rejected().size());
        } catch (IOException e) {
            log.warn("review.skipped_files.notice_failed reason={}", e.getMessage());
        }
    }
}

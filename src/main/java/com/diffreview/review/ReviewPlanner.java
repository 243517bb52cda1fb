package com.diffreview.review;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.batch.Batch;
import com.diffreview.batch.BatchScheduler;
import com.diffreview.batch.BudgetGate;
import com.diffreview.batch.ChangedFile;
import com.diffreview.batch.GateResult;
import com.diffreview.batch.TokenEstimator;
import com.diffreview.runtime.ReviewSettings;

/**
 * Gate and pack changed files. Pure: no I/O beyond logging.
 */
public class ReviewPlanner {
    private static final Logger log = LoggerFactory.getLogger(ReviewPlanner.class);

    private final BudgetGate gate;
    private final BatchScheduler scheduler;
    private final int fileTokenLimit;
    private final int batchTokenBudget;

    public ReviewPlanner(TokenEstimator estimator, ReviewSettings settings) {
        this(new BudgetGate(estimator), new BatchScheduler(), settings.fileTokenLimit(), settings.batchTokenBudget());
    }

    ReviewPlanner(BudgetGate gate, BatchScheduler scheduler, int fileTokenLimit, int batchTokenBudget) {
        this.gate = gate;
        this.scheduler = scheduler;
        this.fileTokenLimit = fileTokenLimit;
        this.batchTokenBudget = batchTokenBudget;
    }

    public ReviewPlan plan(List<ChangedFile> files) {
        if (files == null || files.isEmpty()) {
            throw new ReviewPreconditionException("No changed files in the comparison; nothing to review");
        }
        GateResult gateResult = gate.filter(files, fileTokenLimit);
        List<Batch> batches = scheduler.schedule(gateResult.eligible(), batchTokenBudget);
        log.info("review.plan files={} eligible={} rejected={} batches={} fileTokenLimit={} batchTokenBudget={}",
                files.size(),
                gateResult.eligible().size(),
                gateResult.rejected().size(),
                batches.size(),
                fileTokenLimit,
                batchTokenBudget);
        return new ReviewPlan(files.size(), gateResult, batches);
    }
}

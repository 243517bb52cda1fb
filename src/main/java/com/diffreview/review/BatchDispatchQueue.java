package com.diffreview.review;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diffreview.batch.Batch;
import com.diffreview.placement.PlacementOutcome;

/**
 * Dispatches batches one at a time. The next batch starts only after the previous one has finished (or failed),
 * and never sooner than {@code minimumDelay} after it.
 */
public class BatchDispatchQueue {
    private static final Logger log = LoggerFactory.getLogger(BatchDispatchQueue.class);

    private final Duration minimumDelay;
    private final Sleeper sleeper;

    public BatchDispatchQueue(Duration minimumDelay) {
        this(minimumDelay, duration -> Thread.sleep(duration.toMillis()));
    }

    BatchDispatchQueue(Duration minimumDelay, Sleeper sleeper) {
        if (minimumDelay.isNegative()) {
            throw new IllegalArgumentException("minimumDelay must not be negative");
        }
        this.minimumDelay = minimumDelay;
        this.sleeper = sleeper;
    }

    public DispatchSummary drain(List<Batch> batches, BatchHandler handler) throws InterruptedException {
        List<PlacementOutcome> outcomes = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < batches.size(); i++) {
            if (i > 0 && !minimumDelay.isZero()) {
                log.debug("review.batch.waiting delayMs={}", minimumDelay.toMillis());
                sleeper.sleep(minimumDelay);
            }
            Batch batch = batches.get(i);
            log.info("review.batch.dispatched batch={}/{} files={} units={}",
                    i + 1, batches.size(), batch.files().size(), batch.totalUnits());
            try {
                List<PlacementOutcome> batchOutcomes = handler.handle(batch);
                outcomes.addAll(batchOutcomes);
                log.info("review.batch.completed batch={}/{} placements={}", i + 1, batches.size(), batchOutcomes.size());
            } catch (IOException | RuntimeException e) {
                failed++;
                log.error("review.batch.failed batch={}/{} files={} reason={}",
                        i + 1, batches.size(), batch.filenames(), e.getMessage(), e);
            }
        }
        return new DispatchSummary(batches.size(), failed, outcomes);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}

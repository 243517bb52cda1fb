package com.diffreview.batch;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy, order-preserving packing. Files are never split and never reordered.
 */
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    public List<Batch> schedule(List<FilePatch> eligible, int budget) {
        if (budget < 1) {
            throw new IllegalArgumentException("budget must be >= 1 but was " + budget);
        }
        List<Batch> batches = new ArrayList<>();
        List<FilePatch> current = new ArrayList<>();
        int currentUnits = 0;
        for (FilePatch file : eligible) {
            if (!current.isEmpty() && currentUnits + file.unitsUsed() > budget) {
                batches.add(new Batch(current, currentUnits));
                current = new ArrayList<>();
                currentUnits = 0;
            }
            if (file.unitsUsed() > budget) {
                log.warn("batch.oversized_file file={} units={} budget={}", file.filename(), file.unitsUsed(), budget);
            }
            current.add(file);
            currentUnits += file.unitsUsed();
        }
        if (!current.isEmpty()) {
            batches.add(new Batch(current, currentUnits));
        }
        log.debug("batch.scheduled files={} batches={} budget={}", eligible.size(), batches.size(), budget);
        return batches;
    }
}

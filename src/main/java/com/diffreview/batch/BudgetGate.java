package com.diffreview.batch;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BudgetGate {
    private static final Logger log = LoggerFactory.getLogger(BudgetGate.class);
    static final String UNKNOWN_FILE = "unknown file";

    private final TokenEstimator estimator;

    public BudgetGate(TokenEstimator estimator) {
        this.estimator = estimator;
    }

    /**
     * Files without patch text are dropped silently; files whose estimate exceeds {@code ceiling} are rejected by
     * name and never estimated into a batch.
     */
    public GateResult filter(List<ChangedFile> files, int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("ceiling must be >= 1 but was " + ceiling);
        }
        List<FilePatch> eligible = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (ChangedFile file : files) {
            String filename = file.filename() == null || file.filename().isBlank() ? UNKNOWN_FILE : file.filename();
            if (!file.hasPatch()) {
                log.debug("gate.skipped file={} reason=no_patch status={}", filename, file.status());
                continue;
            }
            int units = estimator.estimate(file.patch());
            if (units > ceiling) {
                log.info("gate.rejected file={} units={} ceiling={}", filename, units, ceiling);
                rejected.add(filename);
                continue;
            }
            log.debug("gate.accepted file={} units={} ceiling={} patchChars={}",
                    filename, units, ceiling, file.patch().length());
            eligible.add(new FilePatch(filename, file.patch(), units));
        }
        return new GateResult(eligible, rejected);
    }
}

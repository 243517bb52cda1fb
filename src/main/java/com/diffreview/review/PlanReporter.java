package com.diffreview.review;

import java.util.ArrayList;
import java.util.List;

import com.diffreview.batch.Batch;
import com.diffreview.batch.FilePatch;
import com.diffreview.diff.FileDiff;
import com.diffreview.diff.PatchParser;
import com.diffreview.placement.PlacementResolver;

public class PlanReporter {
    private final PatchParser patchParser;
    private final PlacementResolver resolver;

    public PlanReporter() {
        this(new PatchParser(), new PlacementResolver());
    }

    PlanReporter(PatchParser patchParser, PlacementResolver resolver) {
        this.patchParser = patchParser;
        this.resolver = resolver;
    }

    public PlanReport report(ReviewPlan plan) {
        List<PlanReport.BatchView> batches = new ArrayList<>();
        List<PlanReport.FileView> files = new ArrayList<>();
        for (int i = 0; i < plan.batches().size(); i++) {
            Batch batch = plan.batches().get(i);
            batches.add(new PlanReport.BatchView(i + 1, batch.totalUnits(), batch.filenames()));
            for (FilePatch file : batch.files()) {
                FileDiff diff = patchParser.parseFile(file.filename(), file.rawPatch());
                files.add(new PlanReport.FileView(
                        file.filename(),
                        file.unitsUsed(),
                        diff.malformedHeaders(),
                        diff.summary(),
                        resolver.resolve(diff)));
            }
        }
        return new PlanReport(plan.totalFiles(), plan.rejected(), batches, files);
    }
}

package com.diffreview.review;

import java.io.IOException;
import java.util.List;

import com.diffreview.batch.Batch;
import com.diffreview.placement.PlacementOutcome;

@FunctionalInterface
public interface BatchHandler {
    List<PlacementOutcome> handle(Batch batch) throws IOException;
}

package com.diffreview.batch;

import java.util.List;

public record Batch(List<FilePatch> files, int totalUnits) {

    public Batch {
        files = List.copyOf(files);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("A batch must contain at least one file");
        }
    }

    public static Batch of(List<FilePatch> files) {
        return new Batch(files, files.stream().mapToInt(FilePatch::unitsUsed).sum());
    }

    public List<String> filenames() {
        return files.stream().map(FilePatch::filename).toList();
    }
}

package com.diffreview.batch;

import java.util.Objects;

public record FilePatch(String filename, String rawPatch, int unitsUsed) {

    public FilePatch {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(rawPatch, "rawPatch");
        if (unitsUsed < 0) {
            throw new IllegalArgumentException("unitsUsed must not be negative");
        }
    }
}

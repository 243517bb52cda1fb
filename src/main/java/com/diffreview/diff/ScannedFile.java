package com.diffreview.diff;

import java.util.List;

public record ScannedFile(String filename, List<Hunk> hunks, int malformedHeaders) {

    public ScannedFile {
        hunks = List.copyOf(hunks);
    }
}

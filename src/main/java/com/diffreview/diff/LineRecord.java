package com.diffreview.diff;

import java.util.Objects;

public record LineRecord(int lineNumber, LineKind kind, String content) {

    public LineRecord {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1 but was " + lineNumber);
        }
        Objects.requireNonNull(kind, "kind");
        content = content == null ? "" : content;
    }
}

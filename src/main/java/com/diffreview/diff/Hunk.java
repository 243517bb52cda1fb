package com.diffreview.diff;

import java.util.List;
import java.util.Objects;

public record Hunk(HunkHeader header, int headerIndex, List<String> body) {

    public Hunk {
        Objects.requireNonNull(header, "header");
        body = List.copyOf(body);
    }

    public int newStart() {
        return header.newStart();
    }
}

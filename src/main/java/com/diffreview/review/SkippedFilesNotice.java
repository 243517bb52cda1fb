package com.diffreview.review;

import java.util.List;

final class SkippedFilesNotice {
    private SkippedFilesNotice() {
    }

    static String render(List<String> rejected, int fileTokenLimit) {
        StringBuilder builder = new StringBuilder();
        builder.append("Files skipped from review because their patch exceeds the per-file limit of ")
                .append(fileTokenLimit)
                .append(" tokens:\n");
        for (String filename : rejected) {
            builder.append("- ").append(filename).append('\n');
        }
        return builder.toString().stripTrailing();
    }
}

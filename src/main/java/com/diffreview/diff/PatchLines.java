package com.diffreview.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Line splitting for diff text. Only {@code \n} ends a line; one trailing {@code \r} is dropped from each line.
 * Other characters (form feed, vertical tab, U+2028) are line content.
 */
public final class PatchLines {
    private PatchLines() {
    }

    public static List<String> split(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = 0;
        while (start <= text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                if (start < text.length()) {
                    lines.add(stripCarriageReturn(text.substring(start)));
                }
                break;
            }
            lines.add(stripCarriageReturn(text.substring(start, end)));
            start = end + 1;
        }
        return lines;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}

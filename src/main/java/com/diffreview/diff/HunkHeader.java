package com.diffreview.diff;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric part of a {@code @@ -oldStart,oldCount +newStart,newCount @@} line. An omitted count means 1.
 */
public record HunkHeader(int oldStart, int oldCount, int newStart, int newCount) {
    private static final Pattern PATTERN =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*$", Pattern.DOTALL);

    public HunkHeader {
        if (oldStart < 0 || oldCount < 0 || newStart < 0 || newCount < 0) {
            throw new IllegalArgumentException("Hunk header values must not be negative");
        }
    }

    public static boolean looksLikeHeader(String line) {
        return line.startsWith("@@");
    }

    public static Optional<HunkHeader> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            HunkHeader header = new HunkHeader(
                    Integer.parseInt(matcher.group(1)),
                    count(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    count(matcher.group(4)));
            return header.inRange() ? Optional.of(header) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** A {@code +0,0} range: the file no longer exists on the new side. */
    public boolean deletesFile() {
        return newStart == 0 && newCount == 0;
    }

    private boolean inRange() {
        return (long) oldStart + oldCount <= Integer.MAX_VALUE && (long) newStart + newCount <= Integer.MAX_VALUE;
    }

    private static int count(String group) {
        return group == null ? 1 : Integer.parseInt(group);
    }
}

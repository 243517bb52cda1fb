package com.diffreview.batch;

/**
 * Renders a batch as one buffer: each file is a bare path line followed by its patch. The path line is what
 * {@code HunkScanner} treats as a file boundary.
 */
public final class PatchConcatenator {
    private PatchConcatenator() {
    }

    public static String concatenate(Batch batch) {
        StringBuilder builder = new StringBuilder();
        for (FilePatch file : batch.files()) {
            builder.append(file.filename()).append('\n');
            builder.append(file.rawPatch());
            if (!file.rawPatch().endsWith("\n")) {
                builder.append('\n');
            }
        }
        return builder.toString();
    }
}

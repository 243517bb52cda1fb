package com.diffreview.diff;

import java.util.ArrayList;
import java.util.List;

public class PatchParser {
    private final HunkScanner scanner;
    private final LineClassifier classifier;

    public PatchParser() {
        this(new HunkScanner(), new LineClassifier());
    }

    public PatchParser(HunkScanner scanner, LineClassifier classifier) {
        this.scanner = scanner;
        this.classifier = classifier;
    }

    /**
     * Parses a buffer that may hold several files, each introduced by a bare path line.
     */
    public List<FileDiff> parse(String patchText) {
        List<FileDiff> diffs = new ArrayList<>();
        for (ScannedFile file : scanner.scan(patchText)) {
            diffs.add(toFileDiff(file.filename(), file.hunks(), file.malformedHeaders()));
        }
        return diffs;
    }

    /**
     * Parses the patch of a single known file. Every hunk found belongs to {@code filename}.
     */
    public FileDiff parseFile(String filename, String patch) {
        List<Hunk> hunks = new ArrayList<>();
        int malformed = 0;
        for (ScannedFile file : scanner.scan(patch)) {
            hunks.addAll(file.hunks());
            malformed += file.malformedHeaders();
        }
        return toFileDiff(filename, hunks, malformed);
    }

    private FileDiff toFileDiff(String filename, List<Hunk> hunks, int malformedHeaders) {
        List<LineRecord> records = new ArrayList<>();
        for (Hunk hunk : hunks) {
            records.addAll(classifier.classify(hunk));
        }
        return new FileDiff(filename, hunks, records, malformedHeaders);
    }
}

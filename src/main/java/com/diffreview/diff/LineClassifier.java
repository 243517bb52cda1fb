package com.diffreview.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies one hunk body into new-file line records. A removal directly followed by an addition becomes a single
 * {@link LineKind#MODIFIED} record at the position the addition occupies; the addition is not reported again.
 */
public class LineClassifier {

    public List<LineRecord> classify(Hunk hunk) {
        List<String> body = hunk.body();
        List<LineRecord> records = new ArrayList<>();
        if (hunk.newStart() < 1) {
            return records;
        }
        int currentLine = hunk.newStart();
        int index = 0;
        // A body longer than its header's count can run past Integer.MAX_VALUE; stop once the counter wraps.
        while (index < body.size() && currentLine > 0) {
            String line = body.get(index);
            if (isFileHeader(line)) {
                index++;
                continue;
            }
            if (line.startsWith("+")) {
                records.add(new LineRecord(currentLine, LineKind.ADDED, line.substring(1)));
                currentLine++;
            } else if (line.startsWith("-")) {
                if (index + 1 < body.size() && isAddition(body.get(index + 1))) {
                    records.add(new LineRecord(currentLine, LineKind.MODIFIED, body.get(index + 1).substring(1)));
                    currentLine++;
                    index++;
                }
            } else if (line.isEmpty() || line.startsWith(" ")) {
                records.add(new LineRecord(currentLine, LineKind.CONTEXT, line.isEmpty() ? "" : line.substring(1)));
                currentLine++;
            }
            index++;
        }
        return records;
    }

    private static boolean isFileHeader(String line) {
        return line.startsWith("---") || line.startsWith("+++");
    }

    private static boolean isAddition(String line) {
        return line.startsWith("+") && !line.startsWith("+++");
    }
}

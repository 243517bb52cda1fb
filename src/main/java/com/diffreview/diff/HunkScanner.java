package com.diffreview.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits patch text into file segments and hunks in two passes: markers first, then hunk bodies sliced between
 * consecutive markers. A bare path line marks the start of another file inside a concatenated buffer.
 */
public class HunkScanner {
    private static final Logger log = LoggerFactory.getLogger(HunkScanner.class);
    // No whitespace and no leading diff marker (@@, +, -, space, backslash).
    private static final Pattern FILE_PATH = Pattern.compile("^(?!@@)[^+\\-\\\\\\s]\\S*$");

    public List<ScannedFile> scan(String patch) {
        if (patch == null || patch.isEmpty()) {
            return List.of();
        }
        String[] lines = PatchLines.split(patch).toArray(String[]::new);
        List<PatchMarker> markers = findMarkers(lines);

        List<ScannedFile> files = new ArrayList<>();
        String filename = null;
        List<Hunk> hunks = new ArrayList<>();
        int malformed = 0;

        for (int m = 0; m < markers.size(); m++) {
            PatchMarker marker = markers.get(m);
            int bodyEnd = m + 1 < markers.size() ? markers.get(m + 1).lineIndex() : lines.length;
            switch (marker.type()) {
                case FILE_BOUNDARY -> {
                    if (filename != null || !hunks.isEmpty() || malformed > 0) {
                        files.add(new ScannedFile(filename, hunks, malformed));
                    }
                    filename = marker.text();
                    hunks = new ArrayList<>();
                    malformed = 0;
                }
                case HUNK_HEADER -> {
                    List<String> body = Arrays.asList(lines).subList(marker.lineIndex() + 1, bodyEnd);
                    Hunk hunk = new Hunk(marker.header(), marker.lineIndex(), body);
                    if (!hunks.isEmpty() && hunk.newStart() < hunks.get(hunks.size() - 1).newStart()) {
                        log.debug("diff.hunk.out_of_order file={} line={} newStart={}",
                                filename, marker.lineIndex() + 1, hunk.newStart());
                    }
                    hunks.add(hunk);
                }
                case MALFORMED_HEADER -> {
                    malformed++;
                    log.debug("diff.hunk.malformed_header file={} line={} header=\"{}\"",
                            filename, marker.lineIndex() + 1, marker.text());
                }
                default -> throw new IllegalStateException("Unexpected marker " + marker.type());
            }
        }
        if (filename != null || !hunks.isEmpty() || malformed > 0) {
            files.add(new ScannedFile(filename, hunks, malformed));
        }
        return files;
    }

    List<PatchMarker> findMarkers(String[] lines) {
        List<PatchMarker> markers = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (HunkHeader.looksLikeHeader(line)) {
                Optional<HunkHeader> header = HunkHeader.parse(line);
                markers.add(header.isPresent()
                        ? PatchMarker.hunk(i, line, header.get())
                        : PatchMarker.malformed(i, line));
            } else if (isFilePath(line)) {
                markers.add(PatchMarker.fileBoundary(i, line));
            }
        }
        return List.copyOf(markers);
    }

    static boolean isFilePath(String line) {
        return FILE_PATH.matcher(line).matches();
    }
}

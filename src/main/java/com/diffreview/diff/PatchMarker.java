package com.diffreview.diff;

/**
 * Structural line found by the first scanning pass. Hunk bodies are the lines between one marker and the next.
 */
record PatchMarker(Type type, int lineIndex, String text, HunkHeader header) {

    enum Type {
        HUNK_HEADER,
        MALFORMED_HEADER,
        FILE_BOUNDARY
    }

    static PatchMarker hunk(int lineIndex, String text, HunkHeader header) {
        return new PatchMarker(Type.HUNK_HEADER, lineIndex, text, header);
    }

    static PatchMarker malformed(int lineIndex, String text) {
        return new PatchMarker(Type.MALFORMED_HEADER, lineIndex, text, null);
    }

    static PatchMarker fileBoundary(int lineIndex, String path) {
        return new PatchMarker(Type.FILE_BOUNDARY, lineIndex, path, null);
    }
}

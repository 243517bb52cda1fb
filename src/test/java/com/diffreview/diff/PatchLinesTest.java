package com.diffreview.diff;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatchLinesTest {

    @Test
    void shouldSplitOnNewlineOnly() {
        assertEquals(List.of("a\fb", "c\u000Bd", "e\u0085f g h"),
                PatchLines.split("a\fb\nc\u000Bd\ne\u0085f g h"));
    }

    @Test
    void shouldDropOneTrailingCarriageReturnPerLine() {
        assertEquals(List.of("a", "b\r", "c"), PatchLines.split("a\r\nb\r\r\nc"));
    }

    @Test
    void shouldKeepInnerEmptyLinesButNotTheFinalTerminator() {
        assertEquals(List.of("a", "", "b"), PatchLines.split("a\n\nb\n"));
        assertEquals(List.of(""), PatchLines.split("\n"));
        assertTrue(PatchLines.split("").isEmpty());
    }
}

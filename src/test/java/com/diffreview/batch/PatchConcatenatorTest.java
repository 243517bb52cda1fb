package com.diffreview.batch;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PatchConcatenatorTest {

    @Test
    void shouldIntroduceEachPatchWithItsPathLine() {
        Batch batch = Batch.of(List.of(
                new FilePatch("src/A.java", "@@ -1 +1 @@\n-a\n+b", 3),
                new FilePatch("src/B.java", "@@ -2 +2 @@\n+c\n", 2)));

        assertEquals("src/A.java\n@@ -1 +1 @@\n-a\n+b\nsrc/B.java\n@@ -2 +2 @@\n+c\n",
                PatchConcatenator.concatenate(batch));
        assertEquals(5, batch.totalUnits());
    }
}

package com.diffreview.batch;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetGateTest {
    private final BudgetGate gate = new BudgetGate(new CharacterRatioTokenEstimator(1));

    @Test
    void shouldRejectFileAboveCeilingAndKeepItOutOfEveryBatch() {
        List<ChangedFile> files = List.of(
                new ChangedFile("small.txt", "modified", "+abc"),
                new ChangedFile("huge.txt", "modified", "+" + "x".repeat(50)),
                new ChangedFile("other.txt", "added", "+de"));

        GateResult result = gate.filter(files, 10);
        List<Batch> batches = new BatchScheduler().schedule(result.eligible(), 10);

        assertEquals(List.of("huge.txt"), result.rejected());
        assertTrue(result.hasRejections());
        assertTrue(batches.stream().flatMap(batch -> batch.filenames().stream()).noneMatch("huge.txt"::equals));
        assertEquals(List.of("small.txt", "other.txt"),
                result.eligible().stream().map(FilePatch::filename).toList());
    }

    @Test
    void shouldAcceptFileExactlyAtCeiling() {
        GateResult result = gate.filter(List.of(new ChangedFile("edge.txt", "modified", "x".repeat(10))), 10);

        assertEquals(1, result.eligible().size());
        assertEquals(10, result.eligible().get(0).unitsUsed());
    }

    @Test
    void shouldDropFilesWithoutPatchSilently() {
        GateResult result = gate.filter(List.of(
                new ChangedFile("image.png", "added", null),
                new ChangedFile("blank.txt", "modified", "")), 10);

        assertTrue(result.eligible().isEmpty());
        assertTrue(result.rejected().isEmpty());
    }

    @Test
    void shouldNameUnnamedRejectedFile() {
        GateResult result = gate.filter(List.of(new ChangedFile(null, "modified", "x".repeat(20))), 10);

        assertEquals(List.of(BudgetGate.UNKNOWN_FILE), result.rejected());
    }

    @Test
    void shouldRejectNonPositiveCeiling() {
        assertThrows(IllegalArgumentException.class, () -> gate.filter(List.of(), 0));
    }
}

package com.ryuqq.wordbatch.core.outcome;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome sealed 계층 테스트.
 *
 * @author WordBatch Team
 * @since 1.0.0
 */
class OutcomeTest {

    @Test
    void ok_TypeChecks() {
        Outcome outcome = new Ok(1, List.of("final_output_20250101_120000.json"), "done");

        assertTrue(outcome.isOk());
        assertFalse(outcome.isRetry());
        assertFalse(outcome.isFail());
    }

    @Test
    void ok_Skipped_HasAttemptZeroAndNoArtifacts() {
        Ok ok = Ok.skipped("existing output is valid");

        assertTrue(ok.wasSkipped());
        assertEquals(0, ok.attempt());
        assertTrue(ok.artifacts().isEmpty());
    }

    @Test
    void ok_ArtifactsAreCopied() {
        List<String> artifacts = new java.util.ArrayList<>(List.of("a.json"));
        Ok ok = new Ok(2, artifacts, "done");

        artifacts.add("b.json");

        assertEquals(List.of("a.json"), ok.artifacts());
        assertFalse(ok.wasSkipped());
    }

    @Test
    void ok_NegativeAttempt_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new Ok(-1, List.of(), "done"));
    }

    @Test
    void retry_TypeChecks() {
        Outcome outcome = new Retry("enrichment failed", 1, 5000);

        assertTrue(outcome.isRetry());
        assertFalse(outcome.isOk());
    }

    @Test
    void retry_InvalidArguments_Throw() {
        assertThrows(IllegalArgumentException.class, () -> new Retry("", 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Retry("x", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Retry("x", 1, -1));
    }

    @Test
    void fail_Factories() {
        Fail withCause = Fail.of("RETRY-EXHAUSTED", "3 attempts failed", "SystemicFailureException");
        Fail withoutCause = Fail.of("CHECKPOINT-CORRUPT", "unreadable");

        assertTrue(withCause.isFail());
        assertEquals("SystemicFailureException", withCause.cause());
        assertNull(withoutCause.cause());
    }

    @Test
    void fail_BlankErrorCode_Throws() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(" ", "message"));
    }
}

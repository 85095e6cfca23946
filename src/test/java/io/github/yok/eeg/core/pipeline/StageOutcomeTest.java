package io.github.yok.eeg.core.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StageOutcomeTest {

    private static final StageFailure FAILURE = new StageFailure(PipelineStage.LOAD_DIPOLE,
            FailureKind.PRECONDITION, "no dipole", null);

    @Test
    void successCarriesValueThroughMapAndFlatMap() {
        StageOutcome<Integer> out = StageOutcome.success("abc").map(String::length)
                .flatMap(n -> StageOutcome.success(n * 2));

        assertTrue(out.isSuccess());
        assertEquals(6, out.getValue());
        assertThrows(IllegalStateException.class, out::getFailure);
    }

    @Test
    void failureShortCircuits() {
        StageOutcome<String> failed = StageOutcome.failure(FAILURE);

        StageOutcome<Integer> out = failed.map(s -> {
            throw new AssertionError("must not be called");
        });
        StageOutcome<Integer> propagated = failed.propagate();

        assertFalse(out.isSuccess());
        assertSame(FAILURE, out.getFailure());
        assertSame(FAILURE, propagated.getFailure());
        assertThrows(IllegalStateException.class, out::getValue);
    }

    @Test
    void exitCodesAreDistinctPerKind() {
        assertEquals(2, FailureKind.CONFIGURATION.exitCode());
        assertEquals(3, FailureKind.PRECONDITION.exitCode());
        assertEquals(4, FailureKind.COLLABORATOR.exitCode());
        assertEquals(5, FailureKind.IO.exitCode());
        assertTrue(FAILURE.toString().contains("LOAD_DIPOLE"));
    }
}

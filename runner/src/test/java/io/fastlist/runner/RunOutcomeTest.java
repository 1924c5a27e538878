// file: runner/src/test/java/io/fastlist/runner/RunOutcomeTest.java
package io.fastlist.runner;

import io.fastlist.core.Direction;
import io.fastlist.core.RunState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunOutcomeTest {

    @Test
    void fatal_failure_wins_over_everything() {
        RunState s = new RunState(1);
        s.rangeSkipped();
        s.cancel();
        s.markFatal(Direction.LEFT, "denied");

        assertEquals(RunOutcome.FAILED, RunOutcome.of(s));
    }

    @Test
    void cancelled_beats_partial() {
        RunState s = new RunState(1);
        s.rangeSkipped();
        s.cancel();

        assertEquals(RunOutcome.CANCELLED, RunOutcome.of(s));
    }

    @Test
    void skipped_ranges_are_partial_and_exit_zero() {
        RunState s = new RunState(1);
        s.rangeSkipped();

        assertEquals(RunOutcome.PARTIAL, RunOutcome.of(s));
        assertEquals(0, RunOutcome.PARTIAL.exitCode());
        assertEquals(RunOutcome.COMPLETE, RunOutcome.of(new RunState(1)));
    }

    @Test
    void output_failure_fails_the_run_even_though_it_also_cancelled() {
        RunState s = new RunState(1);
        s.markOutputFailed("data map failed: disk full");
        s.cancel();

        assertEquals(RunOutcome.FAILED, RunOutcome.of(s));
        assertEquals(1, RunOutcome.of(s).exitCode());
    }
}

// file: runner/src/main/java/io/fastlist/runner/RunOutcome.java
package io.fastlist.runner;

import io.fastlist.core.RunState;
import io.fastlist.core.RunStats;

/**
 * How a run ended, and the process exit code that goes with it.
 */
public enum RunOutcome {
    /** Every range listed. */
    COMPLETE(0),
    /** Finished, but some ranges were skipped after exhausting retries. */
    PARTIAL(0),
    /** A bucket side failed on configuration or access, or results could not be written. */
    FAILED(1),
    /** Stopped by an operator interrupt. */
    CANCELLED(130);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public static RunOutcome of(RunState state) {
        if (state.hasFatalFailure() || state.outputFailure() != null) {
            return FAILED;
        }
        RunStats stats = state.snapshot();
        if (stats.cancelled()) {
            return CANCELLED;
        }
        if (stats.skippedRanges() > 0) {
            return PARTIAL;
        }
        return COMPLETE;
    }
}

// file: core/src/main/java/io/fastlist/core/RunStats.java
package io.fastlist.core;

/**
 * Point-in-time, read-only copy of the {@link RunState} counters.
 *
 * @param objectsListed   objects returned by the provider inside their range (before filtering).
 * @param objectsEmitted  objects sent to the aggregation task (after filtering).
 * @param objectsConsumed objects received by the aggregation task.
 * @param objectsMatched  objects the aggregation task kept after its own filter pass.
 * @param listRequests    provider list calls issued, including retried ones.
 * @param retries         list calls retried after a transient failure.
 * @param skippedRanges   work units given up on after exhausting retries.
 * @param tasksRemaining  value of the outstanding-task counter.
 * @param cancelled       whether cancellation was requested.
 */
public record RunStats(
        long objectsListed,
        long objectsEmitted,
        long objectsConsumed,
        long objectsMatched,
        long listRequests,
        long retries,
        long skippedRanges,
        int tasksRemaining,
        boolean cancelled
) {
}

// file: core/src/main/java/io/fastlist/core/RunState.java
package io.fastlist.core;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide state shared by every task of one run.
 * <p>
 * Contents:
 *  - cancellation flag: set at most once, polled by every task loop.
 *  - outstanding-task counter: starts at the number of launched tasks, each
 *    task decrements it exactly once on its way out.
 *  - monotonically increasing counters (thread-safe via AtomicLong).
 *  - fatal failures per direction, and a result output failure, for the final outcome.
 * <p>
 * All updates are lock-free; nothing here is ever held across I/O.
 */
public final class RunState {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger tasksRemaining;
    private final int tasksLaunched;

    private final AtomicLong objectsListed   = new AtomicLong();
    private final AtomicLong objectsEmitted  = new AtomicLong();
    private final AtomicLong objectsConsumed = new AtomicLong();
    private final AtomicLong objectsMatched  = new AtomicLong();
    private final AtomicLong listRequests    = new AtomicLong();
    private final AtomicLong retries         = new AtomicLong();
    private final AtomicLong skippedRanges   = new AtomicLong();

    private final Map<Direction, String> fatalFailures = new ConcurrentHashMap<>();
    private final AtomicReference<String> outputFailure = new AtomicReference<>();

    public RunState(int tasksLaunched) {
        if (tasksLaunched <= 0) {
            throw new IllegalArgumentException("tasksLaunched must be > 0");
        }
        this.tasksLaunched = tasksLaunched;
        this.tasksRemaining = new AtomicInteger(tasksLaunched);
    }

    // ---------- cancellation ----------

    /**
     * Request cooperative shutdown.
     *
     * @return true for the call that actually flipped the flag; repeated calls are no-ops.
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // ---------- task lifecycle ----------

    /** Called exactly once by each task when it exits, whatever the exit path. */
    public int taskFinished() {
        int left = tasksRemaining.decrementAndGet();
        if (left < 0) {
            throw new IllegalStateException("more tasks finished than were launched (" + tasksLaunched + ")");
        }
        return left;
    }

    public int tasksRemaining() {
        return tasksRemaining.get();
    }

    public int tasksLaunched() {
        return tasksLaunched;
    }

    // ---------- counters ----------

    public void addListed(long n)   { objectsListed.addAndGet(n); }
    public void addEmitted(long n)  { objectsEmitted.addAndGet(n); }
    public void addConsumed(long n) { objectsConsumed.addAndGet(n); }
    public void addMatched(long n)  { objectsMatched.addAndGet(n); }
    public void listRequestIssued() { listRequests.incrementAndGet(); }
    public void retried()           { retries.incrementAndGet(); }
    public void rangeSkipped()      { skippedRanges.incrementAndGet(); }

    // ---------- failures ----------

    /** Record a fatal (configuration / auth) failure for one side. The first message wins. */
    public void markFatal(Direction direction, String message) {
        fatalFailures.putIfAbsent(direction, message);
    }

    public boolean hasFatalFailure() {
        return !fatalFailures.isEmpty();
    }

    public Map<Direction, String> fatalFailures() {
        return Map.copyOf(fatalFailures);
    }

    /** Record that results could not be written. The first message wins. */
    public void markOutputFailed(String message) {
        outputFailure.compareAndSet(null, message);
    }

    /** @return the output failure message, or null if results were written. */
    public String outputFailure() {
        return outputFailure.get();
    }

    public List<Direction> incompleteSides() {
        return fatalFailures.keySet().stream().sorted().toList();
    }

    public RunStats snapshot() {
        return new RunStats(
                objectsListed.get(),
                objectsEmitted.get(),
                objectsConsumed.get(),
                objectsMatched.get(),
                listRequests.get(),
                retries.get(),
                skippedRanges.get(),
                tasksRemaining.get(),
                cancelled.get()
        );
    }
}

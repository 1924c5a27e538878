// file: runner/src/main/java/io/fastlist/runner/monitor/MonitorTask.java
package io.fastlist.runner.monitor;

import io.fastlist.core.RunState;
import io.fastlist.core.RunStats;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Periodic progress reporter.
 * <p>
 * Ticks on a single daemon thread at a fixed rate and logs one line per tick.
 * It stops once it is the last outstanding task, or as soon as cancellation
 * is requested, then logs a final report and releases its own task slot.
 */
public final class MonitorTask implements Runnable {

    private static final Logger log = Logger.getLogger(MonitorTask.class.getName());

    private final RunState state;
    private final Duration interval;
    private final CountDownLatch done = new CountDownLatch(1);
    private final AtomicLong ticks = new AtomicLong();

    private long lastListed = 0;
    private long lastTickNanos;
    private final long startNanos = System.nanoTime();

    public MonitorTask(RunState state, Duration interval) {
        this.state = Objects.requireNonNull(state, "state");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.lastTickNanos = startNanos;
    }

    @Override
    public void run() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fastlist-monitor");
            t.setDaemon(true);
            return t;
        });
        try {
            scheduler.scheduleAtFixedRate(
                    this::tickSafe,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            scheduler.shutdownNow();
            finalReport();
            state.taskFinished();
        }
    }

    public long ticks() {
        return ticks.get();
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.warning("[mon] tick failed: " + e);
        }
    }

    private void tick() {
        ticks.incrementAndGet();
        RunStats s = state.snapshot();

        long now = System.nanoTime();
        double seconds = Math.max((now - lastTickNanos) / 1e9, 1e-3);
        long rate = Math.round((s.objectsListed() - lastListed) / seconds);
        lastListed = s.objectsListed();
        lastTickNanos = now;

        log.info(String.format(
                "[mon] listed=%d emitted=%d matched=%d rate=%d/s requests=%d retries=%d skipped=%d tasks=%d",
                s.objectsListed(), s.objectsEmitted(), s.objectsMatched(), rate,
                s.listRequests(), s.retries(), s.skippedRanges(), s.tasksRemaining()));

        // The monitor's own slot is the last one left.
        if (s.tasksRemaining() <= 1 || s.cancelled()) {
            done.countDown();
        }
    }

    private void finalReport() {
        RunStats s = state.snapshot();
        double seconds = Math.max((System.nanoTime() - startNanos) / 1e9, 1e-3);
        log.info(String.format(
                "[mon] final: listed=%d emitted=%d consumed=%d matched=%d requests=%d retries=%d skipped=%d "
                        + "elapsed=%.1fs avg=%d/s%s",
                s.objectsListed(), s.objectsEmitted(), s.objectsConsumed(), s.objectsMatched(),
                s.listRequests(), s.retries(), s.skippedRanges(), seconds,
                Math.round(s.objectsListed() / seconds), s.cancelled() ? " (cancelled)" : ""));
    }
}

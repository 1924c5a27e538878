// file: runner/src/main/java/io/fastlist/runner/listing/ListingTask.java
package io.fastlist.runner.listing;

import io.fastlist.core.KeyRange;
import io.fastlist.core.KeySpaceHints;
import io.fastlist.core.ObjectRecord;
import io.fastlist.core.RunState;
import io.fastlist.runner.EngineSettings;
import io.fastlist.storage.FatalListingException;
import io.fastlist.storage.ListPage;
import io.fastlist.storage.ListRequest;
import io.fastlist.storage.ObjectLister;
import io.fastlist.storage.ObjectListerFactory;
import io.fastlist.storage.TransientListingException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lists one bucket side with bounded concurrency.
 * <p>
 * Work model:
 *  - the queue is seeded with one {@link ListUnit} per key-space hint range,
 *  - a fixed pool of 'concurrency' workers takes units off the queue and
 *    pages through them,
 *  - every common prefix a page returns inside the unit's range becomes a
 *    new unit with the range narrowed to that prefix,
 *  - 'pending' counts queued plus in-flight units; children are added before
 *    their parent is released, so pending == 0 means the side is exhausted.
 * <p>
 * Failure handling:
 *  - transient errors are retried per page with {@link RetryPolicy}; a page
 *    that exhausts its attempts skips the rest of its unit,
 *  - a fatal error is recorded in {@link RunState} and stops every worker.
 * <p>
 * Whatever the exit path, the channel sender is closed and the run's
 * outstanding-task counter is decremented exactly once.
 */
public final class ListingTask implements Runnable {

    private static final Logger log = Logger.getLogger(ListingTask.class.getName());
    private static final long POLL_MILLIS = 100;

    /**
     * What one listing task did.
     *
     * @param unitsListed    units paged to the end (or to their range bound).
     * @param unitsSkipped   units abandoned after exhausting retries.
     * @param objectsListed  in-range objects returned by the provider.
     * @param objectsEmitted objects that passed the filter and were sent.
     * @param elapsed        wall-clock time of the task.
     */
    public record ListingSummary(
            long unitsListed,
            long unitsSkipped,
            long objectsListed,
            long objectsEmitted,
            Duration elapsed
    ) {
    }

    private final TaskContext ctx;
    private final ObjectListerFactory listerFactory;
    private final String startPrefix;
    private final KeySpaceHints hints;
    private final int concurrency;
    private final int pageSize;
    private final String delimiter;
    private final RetryPolicy retry;

    private final LinkedBlockingQueue<ListUnit> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private volatile boolean aborted = false;

    private final AtomicLong unitsListed = new AtomicLong();
    private final AtomicLong unitsSkipped = new AtomicLong();
    private final AtomicLong objectsListed = new AtomicLong();
    private final AtomicLong objectsEmitted = new AtomicLong();
    private volatile ListingSummary summary;

    public ListingTask(
            TaskContext ctx,
            ObjectListerFactory listerFactory,
            String startPrefix,
            KeySpaceHints hints,
            int concurrency,
            EngineSettings settings
    ) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.listerFactory = Objects.requireNonNull(listerFactory, "listerFactory");
        this.startPrefix = Objects.requireNonNull(startPrefix, "startPrefix");
        this.hints = Objects.requireNonNull(hints, "hints");
        if (concurrency <= 0) throw new IllegalArgumentException("concurrency must be > 0");
        this.concurrency = concurrency;
        this.pageSize = settings.pageSize();
        this.delimiter = settings.delimiter();
        this.retry = settings.retryPolicy();
    }

    @Override
    public void run() {
        long startNanos = System.nanoTime();
        String side = ctx.direction().label();
        ObjectLister lister = null;
        ExecutorService workers = null;
        try {
            lister = listerFactory.open(ctx.target());
            seed();
            log.info(String.format("[list-%s] %s: %d initial units, concurrency %d",
                    side, ctx.target().describe(), pending.get(), concurrency));

            if (pending.get() > 0) {
                workers = Executors.newFixedThreadPool(concurrency, namedDaemon("list-" + side));
                final ObjectLister l = lister;
                for (int i = 0; i < concurrency; i++) {
                    workers.execute(() -> workerLoop(l));
                }
                workers.shutdown();
                while (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                    if (aborted) {
                        workers.shutdownNow();
                    }
                }
            }
        } catch (FatalListingException e) {
            fail(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("[list-" + side + "] interrupted");
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "[list-" + side + "] unexpected failure", e);
            ctx.state().markFatal(ctx.direction(), "unexpected failure: " + e);
        } finally {
            if (workers != null) {
                workers.shutdownNow();
            }
            if (lister != null) {
                closeQuietly(lister);
            }
            summary = new ListingSummary(
                    unitsListed.get(),
                    unitsSkipped.get(),
                    objectsListed.get(),
                    objectsEmitted.get(),
                    Duration.ofNanos(System.nanoTime() - startNanos)
            );
            log.info(String.format("[list-%s] done: units=%d skipped=%d listed=%d emitted=%d in %dms",
                    side, summary.unitsListed(), summary.unitsSkipped(), summary.objectsListed(),
                    summary.objectsEmitted(), summary.elapsed().toMillis()));
            ctx.sender().close();
            ctx.state().taskFinished();
        }
    }

    /** Available once {@link #run()} has returned. */
    public ListingSummary summary() {
        return summary;
    }

    // ---------- internals ----------

    private void seed() {
        for (KeyRange range : hints.ranges()) {
            if (range.intersectsPrefix(startPrefix)) {
                submit(new ListUnit(startPrefix, range.narrowTo(startPrefix)));
            }
        }
    }

    private void submit(ListUnit unit) {
        pending.incrementAndGet();
        queue.add(unit);
    }

    private boolean stopRequested() {
        return aborted || ctx.state().isCancelled();
    }

    private void workerLoop(ObjectLister lister) {
        while (!stopRequested()) {
            if (pending.get() == 0) {
                return;
            }
            ListUnit unit;
            try {
                unit = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (unit == null) {
                continue;
            }
            try {
                listUnit(lister, unit);
            } catch (FatalListingException e) {
                fail(e);
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, "[list-" + ctx.direction().label() + "] unit " + unit + " failed", e);
                ctx.state().markFatal(ctx.direction(), "unexpected failure: " + e);
                aborted = true;
            } finally {
                pending.decrementAndGet();
            }
        }
    }

    private void listUnit(ObjectLister lister, ListUnit unit) {
        KeyRange range = unit.range();
        ListRequest request = new ListRequest(
                ctx.target().bucket(),
                unit.prefix(),
                delimiter,
                range.startAfter(),
                null,
                pageSize
        );

        while (true) {
            if (stopRequested()) {
                return;
            }
            ListPage page = fetchWithRetry(lister, request, unit);
            if (page == null) {
                return;
            }

            // Objects and prefixes are sorted separately; each list can cross the bound on its own.
            boolean pastEnd = emitObjects(page, range);
            pastEnd |= submitPrefixes(page, range);

            if (pastEnd || !page.hasMore()) {
                unitsListed.incrementAndGet();
                return;
            }
            request = request.nextPage(page.nextToken());
        }
    }

    /** @return true once an object past the range's upper bound was seen. */
    private boolean emitObjects(ListPage page, KeyRange range) {
        List<ObjectRecord> batch = new ArrayList<>(page.objects().size());
        long inRange = 0;
        boolean pastEnd = false;
        for (ListPage.Entry e : page.objects()) {
            if (range.isPastEnd(e.key())) {
                pastEnd = true;
                break;
            }
            if (!range.contains(e.key())) {
                continue;
            }
            inRange++;
            if (ctx.filter().matches(e.key())) {
                batch.add(new ObjectRecord(e.key(), e.size(), e.etag(), e.lastModified(),
                        e.storageClass(), ctx.direction()));
            }
        }

        objectsListed.addAndGet(inRange);
        ctx.state().addListed(inRange);
        if (!batch.isEmpty()) {
            ctx.sender().send(batch);
            objectsEmitted.addAndGet(batch.size());
            ctx.state().addEmitted(batch.size());
        }
        return pastEnd;
    }

    /** @return true once a common prefix past the range's upper bound was seen. */
    private boolean submitPrefixes(ListPage page, KeyRange range) {
        for (String cp : page.commonPrefixes()) {
            if (range.isPastEnd(cp)) {
                return true;
            }
            if (range.intersectsPrefix(cp)) {
                submit(new ListUnit(cp, range.narrowTo(cp)));
            }
        }
        return false;
    }

    /** @return the page, or null when the unit is to be abandoned. */
    private ListPage fetchWithRetry(ObjectLister lister, ListRequest request, ListUnit unit) {
        for (int attempt = 1; ; attempt++) {
            if (stopRequested()) {
                return null;
            }
            ctx.state().listRequestIssued();
            try {
                return lister.list(request);
            } catch (TransientListingException e) {
                if (attempt >= retry.maxAttempts()) {
                    log.warning(String.format("[list-%s] skipping prefix='%s' %s after %d attempts: %s",
                            ctx.direction().label(), unit.prefix(), unit.range(), attempt, e.getMessage()));
                    unitsSkipped.incrementAndGet();
                    ctx.state().rangeSkipped();
                    return null;
                }
                ctx.state().retried();
                Duration backoff = retry.jitteredBackoff(attempt);
                int failed = attempt;
                log.fine(() -> String.format("[list-%s] retry %d for prefix='%s' in %dms: %s",
                        ctx.direction().label(), failed, unit.prefix(), backoff.toMillis(), e.getMessage()));
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return null;
                }
            }
        }
    }

    private void fail(FatalListingException e) {
        if (!aborted) {
            log.severe(String.format("[list-%s] fatal: %s", ctx.direction().label(), e.getMessage()));
        }
        ctx.state().markFatal(ctx.direction(), e.getMessage());
        aborted = true;
    }

    private void closeQuietly(ObjectLister lister) {
        try {
            lister.close();
        } catch (Exception e) {
            log.log(Level.WARNING, "[list-" + ctx.direction().label() + "] failed to close lister", e);
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

// file: runner/src/main/java/io/fastlist/runner/FastListRunner.java
package io.fastlist.runner;

import io.fastlist.core.Direction;
import io.fastlist.core.KeyFilter;
import io.fastlist.core.KeySpaceHints;
import io.fastlist.core.RunMode;
import io.fastlist.core.RunState;
import io.fastlist.runner.datamap.AggregationTask;
import io.fastlist.runner.listing.ListingTask;
import io.fastlist.runner.listing.TaskContext;
import io.fastlist.runner.monitor.MonitorTask;
import io.fastlist.runner.pipeline.RecordChannel;
import io.fastlist.storage.ObjectListerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires and runs the top-level tasks of one run.
 * <p>
 * Task set:
 *  - one {@link ListingTask} per bucket side (one in list mode, two in diff mode),
 *  - one {@link AggregationTask} consuming the shared {@link RecordChannel},
 *  - one {@link MonitorTask}.
 * <p>
 * The run state is created up front so that {@link #cancel()} can be called
 * from a shutdown hook at any time, including before {@link #run()} starts.
 */
public final class FastListRunner {

    private static final Logger log = Logger.getLogger(FastListRunner.class.getName());

    private final FastListConfig cfg;
    private final EngineSettings settings;
    private final KeySpaceHints hints;
    private final KeyFilter filter;
    private final ObjectListerFactory listers;
    private final Outputs outputs;

    private final RunState state;
    private final CountDownLatch finished = new CountDownLatch(1);

    private final List<ListingTask> listingTasks = new ArrayList<>();
    private AggregationTask aggregation;

    public FastListRunner(
            FastListConfig cfg,
            EngineSettings settings,
            KeySpaceHints hints,
            KeyFilter filter,
            ObjectListerFactory listers,
            Outputs outputs
    ) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.hints = Objects.requireNonNull(hints, "hints");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.listers = Objects.requireNonNull(listers, "listers");
        this.outputs = Objects.requireNonNull(outputs, "outputs");
        if (outputs.mode() != cfg.mode()) {
            throw new IllegalArgumentException("outputs are for " + outputs.mode() + " but mode is " + cfg.mode());
        }
        // listing tasks + data map + monitor
        this.state = new RunState(sideCount() + 2);
    }

    public RunState state() {
        return state;
    }

    /**
     * Request cooperative shutdown. Safe to call more than once and from any thread.
     * No-op once {@link #run()} has returned.
     */
    public void cancel() {
        if (finished.getCount() == 0) {
            return;
        }
        if (state.cancel()) {
            log.warning("cancellation requested, waiting for tasks to wind down");
        }
    }

    /**
     * Wait for {@link #run()} to return.
     *
     * @return false if the wait timed out.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public RunOutcome run() {
        try {
            return runTasks();
        } finally {
            finished.countDown();
        }
    }

    public List<ListingTask> listingTasks() {
        return List.copyOf(listingTasks);
    }

    public AggregationTask aggregation() {
        return aggregation;
    }

    // ---------- internals ----------

    private int sideCount() {
        return cfg.mode() == RunMode.DIFF ? 2 : 1;
    }

    private RunOutcome runTasks() {
        int sides = sideCount();
        RecordChannel channel = new RecordChannel(sides);

        listingTasks.add(listingTask(new TaskContext(cfg.leftTarget(), Direction.LEFT, channel.sender(0), state, filter)));
        if (sides == 2) {
            listingTasks.add(listingTask(new TaskContext(cfg.rightTarget(), Direction.RIGHT, channel.sender(1), state, filter)));
        }

        aggregation = cfg.mode() == RunMode.LIST
                ? AggregationTask.forList(channel.receiver(), state, filter,
                        outputs.objects(), outputs.keySpaceFile(), settings.hintSampleSize())
                : AggregationTask.forDiff(channel.receiver(), state, filter,
                        outputs.diff(), outputs.keySpaceFile(), settings.hintSampleSize());

        MonitorTask monitor = new MonitorTask(state, settings.monitorInterval());

        List<Runnable> tasks = new ArrayList<>(listingTasks);
        tasks.add(aggregation);
        tasks.add(monitor);

        int poolSize = cfg.threads();
        if (poolSize < tasks.size()) {
            log.info(String.format("raising threads from %d to %d so every task gets one", poolSize, tasks.size()));
            poolSize = tasks.size();
        }

        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "fastlist-task-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<?>> futures = new ArrayList<>(tasks.size());
            for (Runnable task : tasks) {
                futures.add(pool.submit(task));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    log.log(Level.SEVERE, "task failed", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.cancel();
        } finally {
            pool.shutdown();
        }

        RunOutcome outcome = RunOutcome.of(state);
        log.info("All tasks quit, outcome " + outcome);
        return outcome;
    }

    private ListingTask listingTask(TaskContext ctx) {
        return new ListingTask(ctx, listers, cfg.prefix(), hints, cfg.concurrency(), settings);
    }
}

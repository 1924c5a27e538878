// file: runner/src/main/java/io/fastlist/runner/datamap/AggregationTask.java
package io.fastlist.runner.datamap;

import io.fastlist.core.Direction;
import io.fastlist.core.KeyFilter;
import io.fastlist.core.KeySpaceSampler;
import io.fastlist.core.ObjectRecord;
import io.fastlist.core.RunMode;
import io.fastlist.core.RunState;
import io.fastlist.core.diff.DiffEntry;
import io.fastlist.core.diff.DiffIndex;
import io.fastlist.runner.pipeline.RecordChannel;
import io.fastlist.storage.KeySpaceHintsFile;
import io.fastlist.storage.sink.RecordSink;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single consumer of the record channel.
 * <p>
 * List mode streams every matched record straight to the object sink.
 * Diff mode indexes records by key and classifies them once both listing
 * sides have closed their senders. A cancelled diff, or one where a side
 * failed fatally, is not classified: half-listed sides would show up as
 * spurious left/right-only keys.
 * <p>
 * A failing result sink is recorded as an output failure and cancels the run,
 * so the listing tasks stop producing into a channel nobody drains.
 * <p>
 * Either way a uniform sample of left-side keys is kept and written as the
 * key-space file, ready to be fed back as hints on the next run.
 */
public final class AggregationTask implements Runnable {

    private static final Logger log = Logger.getLogger(AggregationTask.class.getName());
    private static final long POLL_MILLIS = 100;

    /**
     * @param consumed   records taken off the channel.
     * @param matched    records that passed the filter.
     * @param written    rows written to the result sink.
     * @param diff       classification counts; null in list mode or when classification was skipped.
     * @param cancelled  the task stopped on cancellation rather than on channel close.
     */
    public record Result(long consumed, long matched, long written, DiffIndex.Summary diff, boolean cancelled) {
    }

    private final RunMode mode;
    private final RecordChannel.Receiver receiver;
    private final RunState state;
    private final KeyFilter filter;
    private final RecordSink<ObjectRecord> objectSink;
    private final RecordSink<DiffEntry> diffSink;
    private final Path keySpaceOutput;
    private final KeySpaceSampler sampler;

    private final DiffIndex index = new DiffIndex();
    private long consumed = 0;
    private long matched = 0;
    private volatile Result result;

    private AggregationTask(
            RunMode mode,
            RecordChannel.Receiver receiver,
            RunState state,
            KeyFilter filter,
            RecordSink<ObjectRecord> objectSink,
            RecordSink<DiffEntry> diffSink,
            Path keySpaceOutput,
            int sampleSize
    ) {
        this.mode = mode;
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        this.state = Objects.requireNonNull(state, "state");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.objectSink = objectSink;
        this.diffSink = diffSink;
        this.keySpaceOutput = keySpaceOutput;
        this.sampler = new KeySpaceSampler(sampleSize);
    }

    /**
     * @param keySpaceOutput where to write the key sample; null to skip it.
     */
    public static AggregationTask forList(RecordChannel.Receiver receiver, RunState state, KeyFilter filter,
                                          RecordSink<ObjectRecord> sink, Path keySpaceOutput, int sampleSize) {
        Objects.requireNonNull(sink, "sink");
        return new AggregationTask(RunMode.LIST, receiver, state, filter, sink, null, keySpaceOutput, sampleSize);
    }

    public static AggregationTask forDiff(RecordChannel.Receiver receiver, RunState state, KeyFilter filter,
                                          RecordSink<DiffEntry> sink, Path keySpaceOutput, int sampleSize) {
        Objects.requireNonNull(sink, "sink");
        return new AggregationTask(RunMode.DIFF, receiver, state, filter, null, sink, keySpaceOutput, sampleSize);
    }

    @Override
    public void run() {
        boolean cancelled = false;
        try {
            cancelled = consume();
            result = finish(cancelled);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "[data-map] failed", e);
            outputFailed("data map failed: " + e);
            result = new Result(consumed, matched, sinkWritten(), null, cancelled);
        } finally {
            closeSinks();
            state.taskFinished();
        }
    }

    /** Available once {@link #run()} has returned. */
    public Result result() {
        return result;
    }

    // ---------- internals ----------

    /** @return true if the loop ended on cancellation. */
    private boolean consume() {
        while (true) {
            if (state.isCancelled()) {
                return true;
            }
            List<ObjectRecord> batch;
            try {
                batch = receiver.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return true;
            }
            if (batch == null) {
                if (receiver.isDrained()) {
                    return false;
                }
                continue;
            }
            accept(batch);
        }
    }

    private void accept(List<ObjectRecord> batch) {
        consumed += batch.size();
        state.addConsumed(batch.size());
        long kept = 0;
        for (ObjectRecord r : batch) {
            if (!filter.matches(r.key())) {
                continue;
            }
            kept++;
            if (r.direction() == Direction.LEFT) {
                sampler.offer(r.key());
            }
            if (mode == RunMode.LIST) {
                objectSink.write(r);
            } else {
                index.add(r);
            }
        }
        matched += kept;
        state.addMatched(kept);
    }

    private Result finish(boolean cancelled) {
        DiffIndex.Summary summary = null;

        if (mode == RunMode.LIST) {
            objectSink.flush();
            log.info(String.format("[data-map] wrote %d objects%s",
                    objectSink.written(), cancelled ? " (partial, cancelled)" : ""));
        } else if (cancelled) {
            log.warning(String.format(
                    "[data-map] cancelled with %d keys indexed; diff classification skipped", index.size()));
        } else if (state.hasFatalFailure()) {
            log.warning(String.format(
                    "[data-map] side(s) %s failed with %d keys indexed; diff classification skipped",
                    state.incompleteSides(), index.size()));
        } else {
            summary = index.classify(diffSink::write);
            diffSink.flush();
            log.info(String.format("[data-map] diff: left_only=%d right_only=%d mismatch=%d identical=%d",
                    summary.leftOnly(), summary.rightOnly(), summary.mismatched(), summary.identical()));
            if (index.duplicates() > 0) {
                log.warning("[data-map] " + index.duplicates() + " keys were listed more than once on the same side");
            }
        }

        for (Map.Entry<Direction, String> f : state.fatalFailures().entrySet()) {
            log.warning(String.format("[data-map] incomplete side %s: %s; results do not cover the whole bucket",
                    f.getKey().label(), f.getValue()));
        }

        writeKeySpace();
        return new Result(consumed, matched, sinkWritten(), summary, cancelled);
    }

    private void writeKeySpace() {
        if (keySpaceOutput == null) {
            return;
        }
        List<String> sample = sampler.sortedSample();
        if (sample.isEmpty()) {
            log.info("[data-map] no keys sampled; key-space file not written");
            return;
        }
        KeySpaceHintsFile.write(keySpaceOutput, sample);
        log.info(String.format("[data-map] wrote %d key-space hints to %s", sample.size(), keySpaceOutput));
    }

    private long sinkWritten() {
        return mode == RunMode.LIST ? objectSink.written() : diffSink.written();
    }

    private void closeSinks() {
        RecordSink<?> sink = mode == RunMode.LIST ? objectSink : diffSink;
        try {
            sink.close();
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "[data-map] failed to close result sink", e);
            outputFailed("result sink close failed: " + e);
        }
    }

    private void outputFailed(String message) {
        state.markOutputFailed(message);
        if (state.cancel()) {
            log.warning("[data-map] cancelling run; results cannot be written");
        }
    }
}

// file: runner/src/main/java/io/fastlist/runner/pipeline/RecordChannel.java
package io.fastlist.runner.pipeline;

import io.fastlist.core.ObjectRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unbounded many-to-one channel carrying batches of {@link ObjectRecord}s
 * from the listing tasks to the aggregation task.
 * <p>
 * The channel is created with a fixed number of sender handles, one per
 * listing task. It counts as closed once every handle has been closed;
 * the receiver stops after it has seen the channel closed and empty.
 * A batch sent before its sender closes is always visible to the receiver
 * by the time {@link Receiver#isDrained()} returns true.
 */
public final class RecordChannel {

    private final LinkedBlockingQueue<List<ObjectRecord>> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger openSenders;
    private final List<Sender> senders;
    private final Receiver receiver = new Receiver();

    public RecordChannel(int senderCount) {
        if (senderCount <= 0) {
            throw new IllegalArgumentException("senderCount must be > 0");
        }
        this.openSenders = new AtomicInteger(senderCount);
        List<Sender> list = new ArrayList<>(senderCount);
        for (int i = 0; i < senderCount; i++) {
            list.add(new Sender());
        }
        this.senders = List.copyOf(list);
    }

    public Sender sender(int index) {
        return senders.get(index);
    }

    public Receiver receiver() {
        return receiver;
    }

    /** Batches queued but not yet taken by the receiver. */
    public int backlog() {
        return queue.size();
    }

    /** Producer-side handle. Closing is idempotent. */
    public final class Sender implements AutoCloseable {

        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Sender() {
        }

        public void send(List<ObjectRecord> batch) {
            if (closed.get()) {
                throw new IllegalStateException("send on closed sender");
            }
            if (batch.isEmpty()) {
                return;
            }
            queue.add(List.copyOf(batch));
        }

        public boolean isClosed() {
            return closed.get();
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                openSenders.decrementAndGet();
            }
        }
    }

    /** Consumer-side handle, used by the single aggregation task. */
    public final class Receiver {

        private Receiver() {
        }

        /**
         * Wait up to 'timeout' for the next batch.
         *
         * @return the batch, or null on timeout.
         */
        public List<ObjectRecord> poll(long timeout, TimeUnit unit) throws InterruptedException {
            return queue.poll(timeout, unit);
        }

        /** Every sender handle has been closed. */
        public boolean isClosed() {
            return openSenders.get() == 0;
        }

        /** Closed and nothing left to take. */
        public boolean isDrained() {
            return isClosed() && queue.isEmpty();
        }
    }
}

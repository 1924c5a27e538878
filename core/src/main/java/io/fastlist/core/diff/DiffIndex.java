// file: core/src/main/java/io/fastlist/core/diff/DiffIndex.java
package io.fastlist.core.diff;

import io.fastlist.core.Direction;
import io.fastlist.core.ObjectRecord;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * In-memory two-sided key index for diff mode.
 * <p>
 * Records from both listing tasks arrive interleaved and in no particular
 * order, so a key can only be classified once both producers are done.
 * Until then every seen key is retained: memory is proportional to the
 * larger bucket's key count. That is the scalability ceiling of diff mode;
 * a spill-to-disk or sorted-merge index could replace this class behind the
 * same add / classify contract.
 * <p>
 * Not thread-safe: fed by the single aggregation task.
 */
public final class DiffIndex {

    private static final class KeyState {
        ObjectRecord left;
        ObjectRecord right;
    }

    /** Counts produced by one {@link #classify(Consumer)} pass. */
    public record Summary(long leftOnly, long rightOnly, long mismatched, long identical) {
        public long reported() {
            return leftOnly + rightOnly + mismatched;
        }
    }

    private final Map<String, KeyState> index = new HashMap<>();
    private long duplicates = 0;

    public void add(ObjectRecord record) {
        KeyState state = index.computeIfAbsent(record.key(), k -> new KeyState());
        if (record.direction() == Direction.LEFT) {
            if (state.left != null) duplicates++;
            state.left = record;
        } else {
            if (state.right != null) duplicates++;
            state.right = record;
        }
    }

    public int size() {
        return index.size();
    }

    /** Same key seen twice from the same side. Non-zero means overlapping work units. */
    public long duplicates() {
        return duplicates;
    }

    /**
     * Classify every indexed key and hand each reported entry to 'sink'.
     * Keys present on both sides with equal metadata are counted but not reported.
     */
    public Summary classify(Consumer<DiffEntry> sink) {
        long leftOnly = 0;
        long rightOnly = 0;
        long mismatched = 0;
        long identical = 0;

        for (Map.Entry<String, KeyState> e : index.entrySet()) {
            KeyState s = e.getValue();
            if (s.right == null) {
                leftOnly++;
                sink.accept(new DiffEntry(DiffKind.LEFT_ONLY, e.getKey(), s.left, null));
            } else if (s.left == null) {
                rightOnly++;
                sink.accept(new DiffEntry(DiffKind.RIGHT_ONLY, e.getKey(), null, s.right));
            } else if (!s.left.sameContentAs(s.right)) {
                mismatched++;
                sink.accept(new DiffEntry(DiffKind.MISMATCH, e.getKey(), s.left, s.right));
            } else {
                identical++;
            }
        }
        return new Summary(leftOnly, rightOnly, mismatched, identical);
    }
}

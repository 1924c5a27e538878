// file: runner/src/main/java/io/fastlist/runner/listing/TaskContext.java
package io.fastlist.runner.listing;

import io.fastlist.core.Direction;
import io.fastlist.core.KeyFilter;
import io.fastlist.core.RunState;
import io.fastlist.runner.pipeline.RecordChannel;
import io.fastlist.storage.BucketTarget;

import java.util.Objects;

/**
 * Read-only inputs of one listing task.
 *
 * @param target    bucket side to list.
 * @param direction LEFT for the source bucket, RIGHT for the diff target.
 * @param sender    this task's own channel handle; closed when the task exits.
 * @param state     shared run state.
 * @param filter    key predicate applied before emitting.
 */
public record TaskContext(
        BucketTarget target,
        Direction direction,
        RecordChannel.Sender sender,
        RunState state,
        KeyFilter filter
) {
    public TaskContext {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(filter, "filter");
    }
}

// file: storage/src/main/java/io/fastlist/storage/sink/RecordSink.java
package io.fastlist.storage.sink;

/**
 * Output contract the aggregation task writes results through.
 * <p>
 * Implementations wrap I/O failures in unchecked exceptions; close() flushes.
 */
public interface RecordSink<T> extends AutoCloseable {

    void write(T item);

    void flush();

    /** Items accepted by {@link #write(Object)} so far. */
    long written();

    @Override
    void close();
}

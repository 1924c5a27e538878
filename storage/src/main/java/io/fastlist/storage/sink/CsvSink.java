// file: storage/src/main/java/io/fastlist/storage/sink/CsvSink.java
package io.fastlist.storage.sink;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.fastlist.core.ObjectRecord;
import io.fastlist.core.diff.DiffEntry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Structured, columnar result file: CSV with a header row, written with
 * Jackson's CSV data format. Rows are streamed; nothing is buffered beyond
 * the writer's own buffer.
 * <p>
 * Two layouts:
 *  - objects: key,size,etag,last_modified,storage_class,direction
 *  - diff:    kind,key,left_size,left_etag,left_last_modified,right_size,right_etag,right_last_modified
 */
public final class CsvSink<T> implements RecordSink<T> {

    private static final CsvMapper MAPPER = new CsvMapper();

    @JsonPropertyOrder({"key", "size", "etag", "last_modified", "storage_class", "direction"})
    record ObjectRow(
            @JsonProperty("key") String key,
            @JsonProperty("size") long size,
            @JsonProperty("etag") String etag,
            @JsonProperty("last_modified") String lastModified,
            @JsonProperty("storage_class") String storageClass,
            @JsonProperty("direction") String direction
    ) {
        static ObjectRow of(ObjectRecord r) {
            return new ObjectRow(r.key(), r.size(), r.etag(), iso(r.lastModified()),
                    r.storageClass(), r.direction().label());
        }
    }

    @JsonPropertyOrder({"kind", "key", "left_size", "left_etag", "left_last_modified",
            "right_size", "right_etag", "right_last_modified"})
    record DiffRow(
            @JsonProperty("kind") String kind,
            @JsonProperty("key") String key,
            @JsonProperty("left_size") Long leftSize,
            @JsonProperty("left_etag") String leftEtag,
            @JsonProperty("left_last_modified") String leftLastModified,
            @JsonProperty("right_size") Long rightSize,
            @JsonProperty("right_etag") String rightEtag,
            @JsonProperty("right_last_modified") String rightLastModified
    ) {
        static DiffRow of(DiffEntry e) {
            ObjectRecord l = e.left();
            ObjectRecord r = e.right();
            return new DiffRow(
                    e.kind().name().toLowerCase(java.util.Locale.ROOT),
                    e.key(),
                    l == null ? null : l.size(),
                    l == null ? null : l.etag(),
                    l == null ? null : iso(l.lastModified()),
                    r == null ? null : r.size(),
                    r == null ? null : r.etag(),
                    r == null ? null : iso(r.lastModified())
            );
        }
    }

    private final Writer out;
    private final SequenceWriter writer;
    private final Function<T, ?> toRow;
    private long written = 0;

    private CsvSink(Writer out, Class<?> rowType, Function<T, ?> toRow) {
        this.out = Objects.requireNonNull(out, "out");
        this.toRow = toRow;
        CsvSchema schema = MAPPER.schemaFor(rowType).withHeader();
        try {
            this.writer = MAPPER.writer(schema).writeValues(out);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open CSV writer", e);
        }
    }

    public static CsvSink<ObjectRecord> objects(Writer out) {
        return new CsvSink<>(out, ObjectRow.class, ObjectRow::of);
    }

    public static CsvSink<ObjectRecord> objects(Path path) {
        return objects(open(path));
    }

    public static CsvSink<DiffEntry> diff(Writer out) {
        return new CsvSink<>(out, DiffRow.class, DiffRow::of);
    }

    public static CsvSink<DiffEntry> diff(Path path) {
        return diff(open(path));
    }

    @Override
    public void write(T item) {
        try {
            writer.write(toRow.apply(item));
            written++;
        } catch (IOException e) {
            throw new RuntimeException("CSV write failed", e);
        }
    }

    @Override
    public void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new RuntimeException("CSV flush failed", e);
        }
    }

    @Override
    public long written() {
        return written;
    }

    @Override
    public void close() {
        try {
            writer.close();
            out.close();
        } catch (IOException e) {
            throw new RuntimeException("CSV close failed", e);
        }
    }

    private static Writer open(Path path) {
        try {
            return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open CSV file " + path, e);
        }
    }

    private static String iso(Instant t) {
        return t == null ? null : t.toString();
    }
}

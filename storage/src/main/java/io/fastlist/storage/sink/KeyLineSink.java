// file: storage/src/main/java/io/fastlist/storage/sink/KeyLineSink.java
package io.fastlist.storage.sink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line-oriented key output: one key per line, UTF-8, '\n' separated.
 * Used for the key-space file, which the next run can load as hints.
 */
public final class KeyLineSink implements RecordSink<String> {

    private final Writer out;
    private long written = 0;

    public KeyLineSink(Path path) {
        try {
            this.out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open key file " + path, e);
        }
    }

    public KeyLineSink(Writer out) {
        this.out = out instanceof BufferedWriter ? out : new BufferedWriter(out);
    }

    @Override
    public void write(String key) {
        try {
            out.write(key);
            out.write('\n');
            written++;
        } catch (IOException e) {
            throw new RuntimeException("key file write failed", e);
        }
    }

    @Override
    public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new RuntimeException("key file flush failed", e);
        }
    }

    @Override
    public long written() {
        return written;
    }

    @Override
    public void close() {
        try {
            out.close();
        } catch (IOException e) {
            throw new RuntimeException("key file close failed", e);
        }
    }
}

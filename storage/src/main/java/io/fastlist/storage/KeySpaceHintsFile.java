// file: storage/src/main/java/io/fastlist/storage/KeySpaceHintsFile.java
package io.fastlist.storage;

import io.fastlist.core.KeyOrder;
import io.fastlist.core.KeySpaceHints;
import io.fastlist.storage.sink.KeyLineSink;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Text file of key-space hints: UTF-8, one prefix (or sampled key) per line.
 * <p>
 * Loading:
 *  - a missing file is not an error: the run falls back to full-range discovery,
 *  - blank lines are ignored,
 *  - lines that are not valid keys (bad UTF-8, control characters) are logged and skipped,
 *  - the remainder is sorted by {@link KeyOrder} and deduplicated.
 * <p>
 * Writing produces a file that loads back into the same hints.
 */
public final class KeySpaceHintsFile {

    private static final Logger log = Logger.getLogger(KeySpaceHintsFile.class.getName());
    private static final int READ_BUFFER = 8 * 1024 * 1024;
    private static final int MAX_LOGGED_BAD_LINES = 10;

    /**
     * Result of one load.
     *
     * @param path         file that was read.
     * @param found        false when the file did not exist.
     * @param linesRead    raw lines read.
     * @param linesSkipped malformed lines dropped.
     * @param hints        sorted, distinct hints.
     */
    public record Loaded(Path path, boolean found, int linesRead, int linesSkipped, List<String> hints) {
        public KeySpaceHints toHints() {
            return KeySpaceHints.build(hints);
        }
    }

    private KeySpaceHintsFile() {
        // utility
    }

    public static Loaded load(Path path) {
        TreeSet<String> sorted = new TreeSet<>(KeyOrder.COMPARATOR);
        int read = 0;
        int skipped = 0;

        // InputStreamReader replaces malformed input with U+FFFD instead of failing the whole file.
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8), READ_BUFFER)) {
            String line;
            while ((line = in.readLine()) != null) {
                read++;
                if (line.isEmpty()) {
                    continue;
                }
                if (!isValidKey(line)) {
                    skipped++;
                    if (skipped <= MAX_LOGGED_BAD_LINES) {
                        log.log(Level.WARNING, "skipping malformed hint at {0}:{1}", new Object[]{path, read});
                    }
                    continue;
                }
                sorted.add(line);
            }
        } catch (NoSuchFileException e) {
            return new Loaded(path, false, 0, 0, List.of());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read key-space hints from " + path, e);
        }

        if (skipped > MAX_LOGGED_BAD_LINES) {
            log.warning(String.format("skipped %d malformed hint lines in %s", skipped, path));
        }
        return new Loaded(path, true, read, skipped, List.copyOf(new ArrayList<>(sorted)));
    }

    /** Write hints one per line, sorted and deduplicated. */
    public static void write(Path path, Collection<String> hints) {
        TreeSet<String> sorted = new TreeSet<>(KeyOrder.COMPARATOR);
        sorted.addAll(hints);
        try (KeyLineSink sink = new KeyLineSink(path)) {
            for (String h : sorted) {
                sink.write(h);
            }
            sink.flush();
        }
    }

    static boolean isValidKey(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\uFFFD' || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }
}

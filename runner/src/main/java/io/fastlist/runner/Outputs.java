// file: runner/src/main/java/io/fastlist/runner/Outputs.java
package io.fastlist.runner;

import io.fastlist.core.ObjectRecord;
import io.fastlist.core.RunMode;
import io.fastlist.core.diff.DiffEntry;
import io.fastlist.storage.sink.CsvSink;
import io.fastlist.storage.sink.RecordSink;

import java.nio.file.Path;

/**
 * Where a run writes its results. Exactly one of 'objects' / 'diff' is set,
 * matching the run mode.
 *
 * @param objects      list-mode record sink.
 * @param diff         diff-mode result sink.
 * @param keySpaceFile key-space sample output; null to skip it.
 */
public record Outputs(
        RecordSink<ObjectRecord> objects,
        RecordSink<DiffEntry> diff,
        Path keySpaceFile
) {

    public Outputs {
        if ((objects == null) == (diff == null)) {
            throw new IllegalArgumentException("exactly one of objects / diff must be set");
        }
    }

    public static Outputs forList(RecordSink<ObjectRecord> objects, Path keySpaceFile) {
        return new Outputs(objects, null, keySpaceFile);
    }

    public static Outputs forDiff(RecordSink<DiffEntry> diff, Path keySpaceFile) {
        return new Outputs(null, diff, keySpaceFile);
    }

    /** CSV result file plus key-space file, at the paths the config names. */
    public static Outputs files(FastListConfig cfg) {
        if (cfg.mode() == RunMode.LIST) {
            return forList(CsvSink.objects(cfg.resultOutput()), cfg.keySpaceOutput());
        }
        return forDiff(CsvSink.diff(cfg.resultOutput()), cfg.keySpaceOutput());
    }

    public RunMode mode() {
        return objects != null ? RunMode.LIST : RunMode.DIFF;
    }
}

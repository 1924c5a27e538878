// file: runner/src/test/java/io/fastlist/runner/FastListRunnerTest.java
package io.fastlist.runner;

import io.fastlist.core.KeyFilter;
import io.fastlist.core.ObjectRecord;
import io.fastlist.core.KeySpaceHints;
import io.fastlist.runner.listing.InMemoryObjectLister;
import io.fastlist.storage.FatalListingException;
import io.fastlist.storage.KeySpaceHintsFile;
import io.fastlist.storage.TransientListingException;
import io.fastlist.storage.sink.CsvSink;
import io.fastlist.storage.sink.RecordSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs: CLI config, listing tasks, data map, monitor and sinks
 * wired together over in-memory buckets.
 */
class FastListRunnerTest {

    @TempDir
    Path tmp;

    private static final EngineSettings FAST = new EngineSettings(
            4, "/", 3,
            Duration.ofMillis(1), Duration.ofMillis(5),
            Duration.ofSeconds(5), Duration.ofMillis(20),
            50, Duration.ofSeconds(1)
    );

    private static InMemoryObjectLister bucket(String... keys) {
        InMemoryObjectLister b = new InMemoryObjectLister();
        for (String k : keys) {
            b.put(k);
        }
        return b;
    }

    private static InMemoryObjectLister bigBucket() {
        InMemoryObjectLister b = new InMemoryObjectLister();
        for (int d = 0; d < 6; d++) {
            for (int f = 0; f < 9; f++) {
                b.put("part=" + d + "/file-" + f + ".parquet");
            }
        }
        b.put("_SUCCESS");
        return b;
    }

    /** Key-space output defaults into the temp dir; a later --output-ks-file wins. */
    private FastListConfig config(String... args) {
        String[] all = new String[args.length + 2];
        all[0] = "--output-ks-file";
        all[1] = tmp.resolve("default.ks").toString();
        System.arraycopy(args, 0, all, 2, args.length);
        return FastListConfig.parse(all, LocalDateTime.of(2024, 1, 1, 0, 0));
    }

    private List<String> csvLines(Path p) throws Exception {
        return Files.readAllLines(p, StandardCharsets.UTF_8);
    }

    @Test
    void list_run_completes_and_writes_results_and_key_space() throws Exception {
        Path out = tmp.resolve("out.csv");
        Path ks = tmp.resolve("out.ks");
        FastListConfig cfg = config("list", "--bucket", "data", "-c", "8",
                "--output-file", out.toString(), "--output-ks-file", ks.toString());
        InMemoryObjectLister lister = bigBucket();

        FastListRunner runner = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL,
                t -> lister, Outputs.files(cfg));
        RunOutcome outcome = runner.run();

        assertEquals(RunOutcome.COMPLETE, outcome);
        assertEquals(0, outcome.exitCode());
        assertEquals(0, runner.state().tasksRemaining());
        assertTrue(runner.awaitCompletion(Duration.ZERO));

        List<String> lines = csvLines(out);
        assertEquals("key,size,etag,last_modified,storage_class,direction", lines.get(0));
        assertEquals(lister.keys().size() + 1, lines.size());

        // Sample feeds the next run: loads back into ranges that still cover every key.
        KeySpaceHints next = KeySpaceHintsFile.load(ks).toHints();
        assertTrue(next.size() > 1);

        Path again = tmp.resolve("again.csv");
        FastListConfig cfg2 = config("list", "--bucket", "data", "-c", "3", "--output-file", again.toString());
        RunOutcome second = new FastListRunner(cfg2, FAST, next, KeyFilter.ALL, t -> lister,
                Outputs.forList(CsvSink.objects(again), null)).run();
        assertEquals(RunOutcome.COMPLETE, second);
        assertEquals(lines.stream().skip(1).sorted().collect(Collectors.toList()),
                csvLines(again).stream().skip(1).sorted().collect(Collectors.toList()));
    }

    @Test
    void diff_run_reports_differences_between_buckets() throws Exception {
        Path out = tmp.resolve("diff.csv");
        FastListConfig cfg = config("diff", "--bucket", "src", "--target-bucket", "dst",
                "--output-file", out.toString(), "--output-ks-file", tmp.resolve("d.ks").toString());
        InMemoryObjectLister src = bucket("a", "b", "c");
        InMemoryObjectLister dst = bucket("b", "c", "d");

        FastListRunner runner = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL,
                t -> t.bucket().equals("src") ? src : dst, Outputs.files(cfg));

        assertEquals(RunOutcome.COMPLETE, runner.run());

        List<String> rows = csvLines(out).stream().skip(1).sorted().collect(Collectors.toList());
        assertEquals(2, rows.size());
        assertTrue(rows.get(0).startsWith("left_only,a,"));
        assertTrue(rows.get(1).startsWith("right_only,d,"));
    }

    @Test
    void skipped_ranges_make_the_run_partial() {
        FastListConfig cfg = config("list", "--bucket", "data", "--output-file", tmp.resolve("p.csv").toString());
        InMemoryObjectLister lister = bigBucket()
                .failPrefix("part=2/", Integer.MAX_VALUE, () -> new TransientListingException("SlowDown"));

        FastListRunner runner = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL,
                t -> lister, Outputs.files(cfg));
        RunOutcome outcome = runner.run();

        assertEquals(RunOutcome.PARTIAL, outcome);
        assertEquals(0, outcome.exitCode());
        assertEquals(1, runner.state().snapshot().skippedRanges());
    }

    @Test
    void fatal_side_failure_fails_the_run() throws Exception {
        Path out = tmp.resolve("f.csv");
        FastListConfig cfg = config("diff", "--bucket", "src", "--target-bucket", "dst", "--output-file", out.toString());
        InMemoryObjectLister src = bucket("a", "b");

        FastListRunner runner = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL, t -> {
            if (t.bucket().equals("dst")) {
                throw new FatalListingException("status=404 code=NoSuchBucket");
            }
            return src;
        }, Outputs.files(cfg));
        RunOutcome outcome = runner.run();

        assertEquals(RunOutcome.FAILED, outcome);
        assertEquals(1, outcome.exitCode());
        assertEquals(0, runner.state().tasksRemaining(), "other tasks still wind down");
        assertTrue(Files.exists(out));
        assertTrue(csvLines(out).stream().noneMatch(l -> l.startsWith("left_only,")),
                "no false left-only rows for the side that did list");
    }

    @Test
    void failing_result_sink_fails_the_run() {
        FastListConfig cfg = config("list", "--bucket", "data");
        RecordSink<ObjectRecord> broken = new RecordSink<>() {
            @Override
            public void write(ObjectRecord item) {
                throw new RuntimeException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public long written() {
                return 0;
            }

            @Override
            public void close() {
            }
        };

        FastListRunner runner = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL,
                t -> bigBucket(), Outputs.forList(broken, null));
        RunOutcome outcome = runner.run();

        assertEquals(RunOutcome.FAILED, outcome);
        assertNotEquals(0, outcome.exitCode());
        assertTrue(runner.state().outputFailure().contains("disk full"));
        assertTrue(runner.state().isCancelled(), "listing stops once nobody drains the channel");
        assertEquals(0, runner.state().tasksRemaining());
    }

    @Test
    void cancel_after_the_run_returned_is_ignored() {
        FastListConfig cfg = config("list", "--bucket", "data", "--output-file", tmp.resolve("n.csv").toString());
        FastListRunner runner = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL,
                t -> bucket("k1"), Outputs.files(cfg));

        assertEquals(RunOutcome.COMPLETE, runner.run());
        runner.cancel();

        assertFalse(runner.state().isCancelled(), "a shutdown hook on normal exit is not a cancellation");
        assertEquals(RunOutcome.COMPLETE, RunOutcome.of(runner.state()));
    }

    @Test
    void cancellation_before_start_ends_the_run_as_cancelled() {
        FastListConfig cfg = config("list", "--bucket", "data", "--output-file", tmp.resolve("c.csv").toString());
        FastListRunner runner = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL,
                t -> bigBucket(), Outputs.files(cfg));

        runner.cancel();
        runner.cancel();
        RunOutcome outcome = runner.run();

        assertEquals(RunOutcome.CANCELLED, outcome);
        assertEquals(130, outcome.exitCode());
        assertEquals(0, runner.state().tasksRemaining());
    }

    @Test
    void threads_are_raised_to_the_task_count() {
        FastListConfig cfg = config("diff", "--bucket", "src", "--target-bucket", "dst", "-t", "1",
                "--output-file", tmp.resolve("t.csv").toString());
        InMemoryObjectLister same = bucket("k1", "k2");

        RunOutcome outcome = new FastListRunner(cfg, FAST, KeySpaceHints.none(), KeyFilter.ALL,
                t -> same, Outputs.files(cfg)).run();

        assertEquals(RunOutcome.COMPLETE, outcome, "one thread per task, no deadlock");
    }

    @Test
    void outputs_must_match_the_mode() {
        FastListConfig cfg = config("diff", "--bucket", "src", "--target-bucket", "dst");

        assertThrows(IllegalArgumentException.class, () -> new FastListRunner(cfg, FAST, KeySpaceHints.none(),
                KeyFilter.ALL, t -> bucket(), Outputs.forList(CsvSink.objects(new java.io.StringWriter()), null)));
    }
}

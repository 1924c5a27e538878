// file: runner/src/main/java/io/fastlist/runner/FastListConfig.java
package io.fastlist.runner;

import io.fastlist.core.RunMode;
import io.fastlist.storage.BucketTarget;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Run configuration parsed from CLI args.
 *
 * Supports:
 *  - mode:            list one bucket, or diff two buckets
 *  - bucket/region:   source (left) side
 *  - targetBucket/targetRegion: diff target (right) side, diff mode only
 *  - prefix:          key prefix to start from ("" is the bucket root)
 *  - threads:         top-level task threads
 *  - concurrency:     listing workers per bucket side
 *  - ksFile:          key-space hints input
 *  - filter:          key filter expression
 *  - endpoint/forcePathStyle: S3-compatible endpoint settings
 *  - outputs:         log, key-space and result files
 *  - settingsPath:    optional JSON tuning file
 *  - timestamp:       start time stamp used in default file names
 */
public record FastListConfig(
        RunMode mode,
        String bucket,
        String region,
        String targetBucket,
        String targetRegion,
        String prefix,
        int threads,
        int concurrency,
        String ksFile,
        String filter,
        boolean logToFile,
        String endpoint,
        boolean forcePathStyle,
        String outputLogFile,
        String outputKsFile,
        String outputFile,
        String settingsPath,
        String timestamp
) {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /**
     * CLI parser; prints usage and exits on bad input.
     *
     * Usage:
     *   fastlist [options] list --bucket B [--region R]
     *   fastlist [options] diff --bucket B [--region R] --target-bucket T [--target-region TR]
     *
     * Options may appear before or after the command word.
     */
    public static FastListConfig fromArgs(String[] args) {
        try {
            return parse(args, LocalDateTime.now());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Try --help for usage.");
            System.exit(1);
            return null;
        }
    }

    /** Same as {@link #fromArgs(String[])} but reports bad input as IllegalArgumentException. */
    static FastListConfig parse(String[] args, LocalDateTime now) {
        RunMode mode = null;
        String bucket = null;
        String region = null;
        String targetBucket = null;
        String targetRegion = null;
        String prefix = "/";
        int threads = 10;
        int concurrency = 100;
        String ksFile = null;
        String filter = null;
        boolean log = false;
        String endpoint = null;
        boolean forcePathStyle = false;
        String outputLogFile = null;
        String outputKsFile = null;
        String outputFile = null;
        String settingsPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "list", "diff" -> {
                    if (mode != null) {
                        throw new IllegalArgumentException("Only one command allowed, got: " + args[i]);
                    }
                    mode = args[i].equals("list") ? RunMode.LIST : RunMode.DIFF;
                }

                case "--bucket" -> bucket = value(args, i++);
                case "--region" -> region = value(args, i++);
                case "--target-bucket" -> targetBucket = value(args, i++);
                case "--target-region" -> targetRegion = value(args, i++);

                case "--prefix", "-p" -> prefix = value(args, i++);
                case "--threads", "-t" -> threads = positiveInt(args, i++);
                case "--concurrency", "-c" -> concurrency = positiveInt(args, i++);
                case "--ks-file", "-k" -> ksFile = value(args, i++);
                case "--filter", "-f" -> filter = value(args, i++);
                case "--log", "-l" -> log = true;
                case "--endpoint-url" -> endpoint = value(args, i++);
                case "--force-path-style" -> forcePathStyle = true;
                case "--output-log-file" -> outputLogFile = value(args, i++);
                case "--output-ks-file" -> outputKsFile = value(args, i++);
                case "--output-file" -> outputFile = value(args, i++);
                case "--settings" -> settingsPath = value(args, i++);

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (mode == null) {
            throw new IllegalArgumentException("Missing command: list or diff");
        }
        if (bucket == null) {
            throw new IllegalArgumentException("Missing required option: --bucket");
        }
        if (mode == RunMode.DIFF && targetBucket == null) {
            throw new IllegalArgumentException("Missing required option for diff: --target-bucket");
        }
        if (mode == RunMode.LIST && (targetBucket != null || targetRegion != null)) {
            throw new IllegalArgumentException("--target-bucket / --target-region are only valid for diff");
        }

        return new FastListConfig(
                mode,
                bucket,
                region,
                targetBucket,
                targetRegion,
                "/".equals(prefix) ? "" : prefix,
                threads,
                concurrency,
                ksFile,
                filter,
                log || outputLogFile != null,
                endpoint,
                forcePathStyle || endpoint != null,
                outputLogFile,
                outputKsFile,
                outputFile,
                settingsPath,
                now.format(STAMP)
        );
    }

    public BucketTarget leftTarget() {
        return new BucketTarget(bucket, region, endpoint, forcePathStyle);
    }

    /** Diff target, or null in list mode. */
    public BucketTarget rightTarget() {
        return mode == RunMode.DIFF ? new BucketTarget(targetBucket, targetRegion, endpoint, forcePathStyle) : null;
    }

    /** Hints input: --ks-file, else {region}_{bucket}_ks_hints.input. */
    public Path hintsFile() {
        if (ksFile != null) {
            return Path.of(ksFile);
        }
        return Path.of(regionPart(region) + bucket + "_ks_hints.input");
    }

    public Path keySpaceOutput() {
        if (outputKsFile != null) {
            return Path.of(outputKsFile);
        }
        return Path.of(regionPart(region) + bucket + "_" + timestamp + ".ks");
    }

    public Path resultOutput() {
        if (outputFile != null) {
            return Path.of(outputFile);
        }
        if (mode == RunMode.LIST) {
            return Path.of(regionPart(region) + bucket + "_" + timestamp + ".csv");
        }
        return Path.of(regionPart(region) + bucket + "_"
                + regionPart(targetRegion) + targetBucket + "_" + timestamp + ".csv");
    }

    /** Log file, or null when logging to the console. */
    public Path logFile() {
        if (!logToFile) {
            return null;
        }
        return Path.of(outputLogFile != null ? outputLogFile : "fastlist_" + timestamp + ".log");
    }

    private static String regionPart(String region) {
        return region == null ? "" : region + "_";
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int positiveInt(String[] args, int i) {
        String raw = value(args, i);
        int v;
        try {
            v = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i] + ": " + raw);
        }
        if (v <= 0) {
            throw new IllegalArgumentException(args[i] + " must be > 0, got " + v);
        }
        return v;
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: fastlist [options] <command>

            Commands:
              list --bucket <b> [--region <r>]
                    fast list one bucket and export results
              diff --bucket <b> [--region <r>] --target-bucket <t> [--target-region <tr>]
                    list two buckets and export the differences

            Options:
              --prefix,      -p   Prefix to start with (default: / for the bucket root)
              --threads,     -t   Worker threads for top-level tasks (default: 10)
              --concurrency, -c   Max concurrent list requests per bucket (default: 100)
              --ks-file,     -k   Key-space hints input (default: {region}_{bucket}_ks_hints.input)
              --filter,      -f   Key filter: prefix:<p>, glob:<g>, regex:<r> or a bare regex
              --log,         -l   Log to file (default: fastlist_{datetime}.log)
              --endpoint-url      Custom S3 endpoint URL
              --force-path-style  Path-style addressing (default when --endpoint-url is set)
              --output-log-file   Log file path (implies --log)
              --output-ks-file    Key-space output (default: {region}_{bucket}_{datetime}.ks)
              --output-file       Result CSV (default: {region}_{bucket}_{datetime}.csv)
              --settings          JSON tuning file (optional)
              --help,        -h   Show this help message
            """);
        System.exit(0);
    }
}

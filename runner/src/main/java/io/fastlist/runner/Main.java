// file: runner/src/main/java/io/fastlist/runner/Main.java
package io.fastlist.runner;

import io.fastlist.core.KeyFilter;
import io.fastlist.core.KeyFilters;
import io.fastlist.core.KeySpaceHints;
import io.fastlist.storage.KeySpaceHintsFile;
import io.fastlist.storage.ObjectListerFactory;
import io.fastlist.storage.s3.S3ObjectLister;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Entry point for the fastlist CLI.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON settings file).
 *  - Set up logging (console, or a log file).
 *  - Load key-space hints and compile the key filter.
 *  - Open result sinks and run the listing / data map / monitor tasks.
 *  - Turn an operator interrupt into cooperative cancellation.
 *  - Exit with the run outcome's status code.
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = FastListConfig.fromArgs(args);
        LoggingSetup.configure(cfg.logFile());

        // ------ Settings + filter ------
        EngineSettings settings;
        KeyFilter filter;
        try {
            settings = cfg.settingsPath() != null
                    ? EngineSettings.fromJsonFile(Path.of(cfg.settingsPath()))
                    : EngineSettings.defaults();
            filter = KeyFilters.compile(cfg.filter());
        } catch (RuntimeException e) {
            System.err.println("Invalid configuration: " + describe(e));
            System.exit(1);
            return;
        }

        // ------ Key-space hints ------
        KeySpaceHintsFile.Loaded loaded = KeySpaceHintsFile.load(cfg.hintsFile());
        KeySpaceHints hints = loaded.toHints();

        logBanner(cfg, loaded, hints);

        ObjectListerFactory listers = target ->
                S3ObjectLister.open(target, settings.requestTimeout(), cfg.concurrency());
        var runner = new FastListRunner(cfg, settings, hints, filter, listers, Outputs.files(cfg));

        // Shutdown hook: Ctrl-C cancels once, then waits a bounded time for sinks to flush.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runner.cancel();
            try {
                if (!runner.awaitCompletion(settings.drainTimeout())) {
                    System.err.println("fastlist: tasks did not finish within " + settings.drainTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "fastlist-shutdown"));

        RunOutcome outcome = runner.run();
        System.exit(outcome.exitCode());
    }

    private static void logBanner(FastListConfig cfg, KeySpaceHintsFile.Loaded loaded, KeySpaceHints hints) {
        String version = Main.class.getPackage().getImplementationVersion();
        log.info("fastlist " + (version != null ? "v" + version + " " : "") + "starting:");
        log.info(String.format("  - mode %s, threads %d, concurrency %d", cfg.mode(), cfg.threads(), cfg.concurrency()));
        log.info("  - start prefix '" + cfg.prefix() + "'");
        log.info("  - source " + cfg.leftTarget().describe());
        if (cfg.rightTarget() != null) {
            log.info("  - target " + cfg.rightTarget().describe());
        }
        if (cfg.filter() != null) {
            log.info("  - filter \"" + cfg.filter() + "\"");
        }
        if (cfg.endpoint() != null) {
            log.info("  - using custom endpoint-url: " + cfg.endpoint());
        }
        if (cfg.forcePathStyle()) {
            log.info("  - using path-style addressing");
        }
        if (!loaded.found() || loaded.hints().isEmpty()) {
            log.info("  - NO ks hints found at " + loaded.path());
        } else {
            log.info(String.format("  - loaded %d prefixes from %s (%d skipped), %d ks hint ranges",
                    loaded.hints().size(), loaded.path(), loaded.linesSkipped(), hints.size()));
        }
        log.info("  - output " + cfg.resultOutput() + ", key space " + cfg.keySpaceOutput());
    }

    private static String describe(Throwable e) {
        Throwable cause = e.getCause();
        return cause != null ? e.getMessage() + ": " + cause.getMessage() : e.getMessage();
    }
}

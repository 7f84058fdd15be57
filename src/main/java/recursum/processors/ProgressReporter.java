package recursum.processors;

import recursum.pipeline.*;
import recursum.utils.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;

/**
 * Periodic progress line and final summary on a side channel, normally stderr. Never touches
 * the result output.
 */
public class ProgressReporter {
    private static final long   PROGRESS_INTERVAL_MS = 1_000;
    private static final double MS_PER_SECOND        = 1_000.0;

    private static final String ANSI_CARRIAGE_RETURN = "\r";
    private static final String ANSI_ERASE_LINE      = "\u001B[2K";

    private static final String PROGRESS_FORMAT = "Hashing: %,d/%,d files (%s) at %.2f f/s, %,d errors";
    private static final String DONE_FORMAT     = "%,d files (%s) hashed in %s (%s/s)%n";

    private final PrintStream err;
    private final HashPipeline pipeline;
    private ScheduledExecutorService progressExecutor;

    public ProgressReporter(HashPipeline pipeline, PrintStream err) {
        this.pipeline = pipeline;
        this.err = err;
    }

    public void start() {
        progressExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recursum-progress");
            t.setDaemon(true);
            return t;
        });
        progressExecutor.scheduleAtFixedRate(this::printProgress,
                PROGRESS_INTERVAL_MS, PROGRESS_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        if (progressExecutor == null) return;
        progressExecutor.shutdownNow();
        progressExecutor = null;
        err.print(ANSI_CARRIAGE_RETURN + ANSI_ERASE_LINE);
        err.flush();
    }

    void printProgress() {
        PipelineStats stats = pipeline.stats();
        long elapsed = System.currentTimeMillis() - stats.startMillis;
        long done = stats.completed();
        double rate = elapsed > 0 ? done * MS_PER_SECOND / elapsed : 0;
        String line = String.format(Locale.ROOT, PROGRESS_FORMAT,
                done, pipeline.produced(), SizeUtils.humanReadable(stats.bytesHashed.sum()), rate,
                stats.fileErrors.sum());
        err.print(ANSI_CARRIAGE_RETURN + ANSI_ERASE_LINE + line);
        err.flush();
    }

    public void printSummary(PipelineResult result, long elapsedMs) {
        long files = result.emitted();
        long rate = elapsedMs > 0 ? (long) (result.bytesHashed() * MS_PER_SECOND / elapsedMs) : result.bytesHashed();
        err.printf(Locale.ROOT, DONE_FORMAT,
                files, SizeUtils.humanReadable(result.bytesHashed()), SizeUtils.formatHMS(elapsedMs),
                SizeUtils.humanReadable(rate));
        if (result.fileErrors() > 0) {
            err.printf(Locale.ROOT, "%,d files could not be read%n", result.fileErrors());
        }
        if (result.skipped() > 0) {
            err.printf(Locale.ROOT, "%,d entries skipped%n", result.skipped());
        }
        err.flush();
    }
}

package recursum.processors;

import recursum.output.*;
import recursum.pipeline.*;
import recursum.sources.*;
import org.slf4j.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;

/**
 * Runs one hashing job: builds the source for the input mode, runs the pipeline against the
 * output stream and reports progress and a summary on the error stream.
 */
public class HashProcessor implements Processor {
    private static final Logger log = LoggerFactory.getLogger(HashProcessor.class);

    private static final long SHUTDOWN_WAIT_MS = 5_000;

    private final PipelineConfig config;
    private final InputStream stdin;
    private final OutputStream out;
    private final PrintStream err;
    private final boolean handleInterrupts;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean cancelled;
    private volatile HashPipeline pipeline;

    public HashProcessor(PipelineConfig config) {
        this(config, System.in, System.out, System.err, true);
    }

    public HashProcessor(PipelineConfig config, InputStream stdin, OutputStream out, PrintStream err,
                         boolean handleInterrupts) {
        this.config = config;
        this.stdin = stdin;
        this.out = out;
        this.err = err;
        this.handleInterrupts = handleInterrupts;
    }

    @Override
    public void run() {
        PipelineResult result;
        try {
            result = execute();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write results: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while hashing", e);
        }
        if (result.failure() != null) {
            throw new IllegalStateException(result.failure().getMessage(), result.failure());
        }
        if (!result.isComplete()) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                    "Cancelled, %,d of %,d files not processed", result.unprocessed(), result.produced()));
        }
    }

    public PipelineResult execute() throws IOException, InterruptedException {
        PathSource source = config.createSource(stdin);
        ResultWriter writer = new ResultWriter(out, config.format(), config.batchSize());
        HashPipeline pipeline = new HashPipeline(
                source,
                FileHasher.of(config.algorithm()),
                writer,
                config.workerCount(),
                config.queueFactor()
        );
        this.pipeline = pipeline;
        if (cancelled) pipeline.cancel();

        Thread hook = handleInterrupts ? registerShutdownHook() : null;
        ProgressReporter progress = config.quiet() ? null : new ProgressReporter(pipeline, err);
        long startTime = System.currentTimeMillis();
        try {
            if (progress != null) progress.start();
            PipelineResult result = pipeline.run();
            if (progress != null) {
                progress.stop();
                progress.printSummary(result, System.currentTimeMillis() - startTime);
            }
            if (!result.isComplete()) {
                err.printf(Locale.ROOT, "Stopped early: %,d of %,d files not processed%n",
                        result.unprocessed(), result.produced());
            }
            return result;
        } finally {
            if (progress != null) progress.stop();
            finished.countDown();
            if (hook != null) removeShutdownHook(hook);
        }
    }

    // Stops the running job; output already orderable is still written.
    public void cancel() {
        cancelled = true;
        HashPipeline p = pipeline;
        if (p != null) p.cancel();
    }

    // Ctrl-C cancels the pipeline and waits for the written output to be flushed.
    private Thread registerShutdownHook() {
        Thread hook = new Thread(() -> {
            cancel();
            try {
                if (!finished.await(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("Hashing did not stop within {} ms", SHUTDOWN_WAIT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "recursum-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, keeping hook");
        }
    }
}

package recursum.pipeline;

import recursum.sources.*;
import org.slf4j.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/**
 * Wires a path source, the dispatch queue, a fixed pool of hashing workers and the ordered
 * collector together for a single run.
 */
public class HashPipeline {
    private static final Logger log = LoggerFactory.getLogger(HashPipeline.class);

    private static final long SOURCE_JOIN_AFTER_CANCEL_MS = 1_000;

    private final PathSource source;
    private final FileHasher hasher;
    private final ResultSink sink;
    private final int workerCount;
    private final double queueFactor;
    private final PipelineStats stats = new PipelineStats();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean();

    private volatile boolean cancelled;
    private volatile DispatchQueue queue;
    private volatile Sequencer sequencer;
    private volatile Thread sourceThread;

    public HashPipeline(PathSource source, FileHasher hasher, ResultSink sink, int workerCount, double queueFactor) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        }
        if (queueFactor <= 0) {
            throw new IllegalArgumentException("Queue factor must be positive: " + queueFactor);
        }
        this.source = source;
        this.hasher = hasher;
        this.sink = sink;
        this.workerCount = workerCount;
        this.queueFactor = queueFactor;
    }

    /**
     * Runs to completion on the calling thread's behalf: returns once every produced path has
     * been written, or once a cancelled or failed run has stopped.
     */
    public PipelineResult run() throws InterruptedException, IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already started");
        }

        queue = new DispatchQueue(source.queueCapacity(workerCount, queueFactor));
        sequencer = new Sequencer(queue);
        OrderedCollector collector = new OrderedCollector(sink);
        log.debug("Hashing {} with {} workers, queue capacity {}", source.describe(), workerCount,
                queue.capacity() == DispatchQueue.UNBOUNDED ? "unbounded" : queue.capacity());

        AtomicInteger threadNumber = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(workerCount, r ->
                new Thread(r, "recursum-hasher-" + threadNumber.incrementAndGet()));
        List<Future<?>> running = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            running.add(workers.submit(new HashWorker(queue, hasher, collector, stats, this::fail)));
        }
        workers.shutdown();

        sourceThread = new Thread(this::produce, "recursum-source");
        sourceThread.setDaemon(true);
        sourceThread.start();
        if (cancelled) {
            // cancel() may have run before the queue and source thread existed
            abort();
        }

        try {
            for (Future<?> worker : running) {
                try {
                    worker.get();
                } catch (ExecutionException e) {
                    fail(e.getCause());
                }
            }
        } catch (InterruptedException e) {
            cancel();
            workers.shutdownNow();
            throw e;
        }

        Throwable error = failure.get();
        boolean aborted = cancelled || error != null;
        if (aborted) {
            // a stdin reader may be stuck in a read that ignores interrupts
            sourceThread.join(SOURCE_JOIN_AFTER_CANCEL_MS);
        } else {
            sourceThread.join();
            error = failure.get();
            aborted = error != null;
        }

        if (error instanceof RuntimeException) {
            throw (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        if (error != null && !(error instanceof SourceException)) {
            throw new IOException(error.getMessage(), error);
        }

        if (aborted) {
            collector.flushOrderable();
        } else {
            collector.finish(sequencer.produced());
        }

        return new PipelineResult(
                sequencer.produced(),
                collector.emitted(),
                stats.fileErrors.sum(),
                stats.bytesHashed.sum(),
                source.skipped(),
                queue.peakSize(),
                collector.peakPending(),
                cancelled && error == null,
                (SourceException) error
        );
    }

    private void produce() {
        try {
            source.produce(sequencer);
            if (!queue.isAborted()) {
                queue.close();
            }
        } catch (SourceException e) {
            log.debug("Path source failed", e);
            fail(e);
        } catch (InterruptedException e) {
            // cancelled
            queue.abort();
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private void fail(Throwable t) {
        if (failure.compareAndSet(null, t)) {
            abort();
        }
    }

    private void abort() {
        Thread t = sourceThread;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
        DispatchQueue q = queue;
        if (q != null) {
            q.abort();
        }
    }

    // Stops discovery, drops queued paths and lets each worker finish its current file.
    public void cancel() {
        cancelled = true;
        abort();
    }

    public PipelineStats stats() {
        return stats;
    }

    // Paths handed to the dispatch queue so far.
    public long produced() {
        Sequencer s = sequencer;
        return s != null ? s.produced() : 0;
    }
}

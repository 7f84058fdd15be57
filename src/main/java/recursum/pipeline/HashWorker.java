package recursum.pipeline;

import recursum.models.*;

import java.io.*;
import java.nio.file.*;
import java.util.function.*;

/**
 * One hashing thread's loop: take a path, hash the whole file, hand the result to the collector.
 * Per-file problems become error results; only collector or sink failures end the loop abnormally.
 */
class HashWorker implements Runnable {

    private final DispatchQueue queue;
    private final FileHasher hasher;
    private final OrderedCollector collector;
    private final PipelineStats stats;
    private final Consumer<Throwable> onFailure;

    HashWorker(DispatchQueue queue, FileHasher hasher, OrderedCollector collector,
               PipelineStats stats, Consumer<Throwable> onFailure) {
        this.queue = queue;
        this.hasher = hasher;
        this.collector = collector;
        this.stats = stats;
        this.onFailure = onFailure;
    }

    @Override
    public void run() {
        try {
            PathItem item;
            while ((item = queue.take()) != null) {
                collector.accept(hash(item));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            onFailure.accept(new UncheckedIOException("Unable to write results: " + e.getMessage(), e));
        } catch (RuntimeException | Error e) {
            onFailure.accept(e);
            throw e;
        }
    }

    ResultItem hash(PathItem item) {
        try {
            Path file = Path.of(item.path());
            if (Files.isDirectory(file)) {
                throw new IOException("is a directory");
            }
            var digest = hasher.hash(file);
            stats.filesHashed.increment();
            stats.bytesHashed.add(digest.size());
            return ResultItem.success(item, digest.hex(), digest.size());
        } catch (IOException | UncheckedIOException | InvalidPathException e) {
            stats.fileErrors.increment();
            return ResultItem.failure(item, describe(e));
        }
    }

    static String describe(Exception e) {
        if (e instanceof UncheckedIOException) {
            return describe(((UncheckedIOException) e).getCause());
        }
        if (e instanceof NoSuchFileException) {
            return "no such file";
        }
        if (e instanceof AccessDeniedException) {
            return "permission denied";
        }
        if (e instanceof InvalidPathException) {
            return "invalid path";
        }
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}

package recursum.sources;

import recursum.pipeline.*;
import recursum.utils.*;
import org.slf4j.*;

import java.io.*;
import java.nio.file.*;
import java.nio.file.attribute.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.stream.*;

/**
 * Depth-first walk of a directory tree, entries of each directory in file name order.
 * <p>
 * Walker threads read directory listings ahead of the traversal. Within each directory, at
 * most {@code walkerCount} subdirectory listings are requested ahead of the one being visited,
 * and the next one is requested only when the traversal moves into a subdirectory. A single
 * traversal thread (the caller of {@link #produce}) consumes the listings in depth-first order
 * and is the only thread that emits paths, so output order does not depend on walker timing.
 * When the dispatch queue is full the traversal thread blocks, and with it any further
 * listing, so memory held by read-ahead stays bounded by walker count times tree depth.
 * <p>
 * Symbolic links are neither followed nor emitted. Directories that cannot be listed are
 * skipped with a warning.
 */
public class DirectoryWalkSource implements PathSource {
    public static final double DEFAULT_QUEUE_FACTOR = 3.0;

    private static final Logger log = LoggerFactory.getLogger(DirectoryWalkSource.class);

    private final Path root;
    private final int walkerCount;
    private final Set<String> includeTypes;
    private final MimeUtils mimeUtils;
    private final LongAdder skippedDirectories = new LongAdder();
    private final LongAdder skippedFiles = new LongAdder();

    private record Entry(Path path, boolean directory) {}

    public DirectoryWalkSource(Path root, int walkerCount) {
        this(root, walkerCount, Collections.emptySet());
    }

    public DirectoryWalkSource(Path root, int walkerCount, Set<String> includeTypes) {
        if (walkerCount < 1) {
            throw new IllegalArgumentException("Walker count must be positive: " + walkerCount);
        }
        this.root = root;
        this.walkerCount = walkerCount;
        this.includeTypes = includeTypes != null ? includeTypes : Collections.emptySet();
        this.mimeUtils = this.includeTypes.isEmpty() ? null : new MimeUtils();
    }

    @Override
    public int queueCapacity(int workerCount, double queueFactor) {
        return (int) Math.max(1, Math.ceil(workerCount * queueFactor));
    }

    @Override
    public void produce(Sequencer sequencer) throws SourceException, InterruptedException {
        if (!Files.isDirectory(root)) {
            throw new SourceException(root + " is not a directory");
        }

        AtomicInteger threadNumber = new AtomicInteger();
        ExecutorService walkers = Executors.newFixedThreadPool(walkerCount, r -> {
            Thread t = new Thread(r, "recursum-walker-" + threadNumber.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Future<List<Entry>> rootListing = submitListing(root, walkers);
            visit(root, rootListing, sequencer, walkers);
        } finally {
            walkers.shutdownNow();
        }
    }

    // Returns false once the sequencer refuses further paths.
    private boolean visit(Path dir, Future<List<Entry>> listing, Sequencer sequencer, ExecutorService walkers)
            throws SourceException, InterruptedException {
        List<Entry> entries;
        try {
            entries = listing.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (dir.equals(root)) {
                throw new SourceException("Unable to list " + root + ": " + cause.getMessage(), cause);
            }
            log.warn("Skipping unreadable directory {}: {}", dir, cause.getMessage());
            skippedDirectories.increment();
            return true;
        }

        List<Path> subdirectories = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.directory()) subdirectories.add(entry.path());
        }

        // at most walkerCount listings of this directory's children are read ahead
        Deque<Future<List<Entry>>> ahead = new ArrayDeque<>(walkerCount);
        int nextToList = 0;
        while (nextToList < subdirectories.size() && ahead.size() < walkerCount) {
            ahead.add(submitListing(subdirectories.get(nextToList++), walkers));
        }

        for (Entry entry : entries) {
            if (entry.directory()) {
                Future<List<Entry>> subListing = ahead.poll();
                if (nextToList < subdirectories.size()) {
                    ahead.add(submitListing(subdirectories.get(nextToList++), walkers));
                }
                if (!visit(entry.path(), subListing, sequencer, walkers)) return false;
            } else if (included(entry.path())) {
                if (!sequencer.emit(entry.path().toString())) return false;
            }
        }
        return true;
    }

    private Future<List<Entry>> submitListing(Path dir, ExecutorService walkers) {
        return walkers.submit(() -> list(dir));
    }

    private boolean included(Path file) {
        if (mimeUtils == null) return true;
        if (mimeUtils.accepts(file, includeTypes)) return true;
        skippedFiles.increment();
        return false;
    }

    // Regular files and real directories of one directory, sorted by name. Runs on a walker thread.
    private List<Entry> list(Path dir) throws IOException {
        List<Entry> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    log.warn("Skipping {}: {}", child, e.getMessage());
                    skippedFiles.increment();
                    continue;
                }
                if (attrs.isRegularFile()) {
                    entries.add(new Entry(child, false));
                } else if (attrs.isDirectory()) {
                    entries.add(new Entry(child, true));
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        entries.sort(Comparator.comparing((Entry e) -> e.path().getFileName().toString()));
        return entries;
    }

    @Override
    public long skipped() {
        return skippedDirectories.sum() + skippedFiles.sum();
    }

    public long skippedDirectories() {
        return skippedDirectories.sum();
    }

    @Override
    public String describe() {
        return String.format("directory %s with %d %s", root, walkerCount, walkerCount == 1 ? "walker" : "walkers");
    }
}

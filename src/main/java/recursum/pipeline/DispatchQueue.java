package recursum.pipeline;

import recursum.models.*;

import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/**
 * FIFO channel between a path source and the hashing workers.
 * <p>
 * A bounded queue blocks the producer when full, which is what keeps a directory walk from
 * racing ahead of hashing. An unbounded queue never blocks the producer. Closing the queue
 * lets consumers drain what is left and then see end-of-stream; aborting discards what is left.
 */
public class DispatchQueue {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final PathItem END_OF_STREAM = new PathItem(-1, "");

    private final BlockingQueue<PathItem> queue;
    private final int capacity;
    private final AtomicInteger peakSize = new AtomicInteger();
    private volatile boolean closed;
    private volatile boolean aborted;

    public DispatchQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = capacity == UNBOUNDED ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Appends an item, blocking while the queue is full.
     *
     * @return false if the queue was aborted and the item was dropped
     */
    public boolean put(PathItem item) throws InterruptedException {
        if (closed) {
            throw new QueueClosedException("Put after close: " + item.path());
        }
        if (aborted) {
            return false;
        }
        queue.put(item);
        peakSize.accumulateAndGet(queue.size(), Math::max);
        return true;
    }

    /**
     * Takes the next item, blocking while the queue is empty.
     *
     * @return the next item, or null once the queue is closed and drained, or aborted
     */
    public PathItem take() throws InterruptedException {
        PathItem item = queue.take();
        if (item == END_OF_STREAM) {
            // leave the marker in place for the other consumers
            queue.offer(END_OF_STREAM);
            return null;
        }
        if (aborted) {
            queue.offer(END_OF_STREAM);
            return null;
        }
        return item;
    }

    // Called once by the producer after its last put.
    public void close() throws InterruptedException {
        if (closed) return;
        closed = true;
        queue.put(END_OF_STREAM);
    }

    public void abort() {
        aborted = true;
        queue.clear();
        queue.offer(END_OF_STREAM);
    }

    public boolean isAborted() {
        return aborted;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        int size = queue.size();
        return queue.contains(END_OF_STREAM) ? size - 1 : size;
    }

    public int peakSize() {
        return peakSize.get();
    }
}

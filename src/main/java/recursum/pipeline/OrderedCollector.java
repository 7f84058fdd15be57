package recursum.pipeline;

import recursum.models.*;

import java.io.*;
import java.util.*;

/**
 * Reorder buffer between the hashing workers and the output sink.
 * <p>
 * Results arrive in completion order. Each one is parked in the pending window until every
 * lower index has been written, so the sink sees indices 0, 1, 2... with no gaps.
 */
public class OrderedCollector {

    private final ResultSink sink;
    private final Map<Long, ResultItem> pending = new HashMap<>();
    private long nextEmitIndex;
    private int peakPending;

    public OrderedCollector(ResultSink sink) {
        this.sink = sink;
    }

    public synchronized void accept(ResultItem result) throws IOException {
        long index = result.sequenceIndex();
        if (index < nextEmitIndex || pending.containsKey(index)) {
            throw new QueueClosedException("Result delivered twice for index " + index + ": " + result.path());
        }
        pending.put(index, result);
        peakPending = Math.max(peakPending, pending.size());

        ResultItem next;
        while ((next = pending.remove(nextEmitIndex)) != null) {
            sink.write(next);
            nextEmitIndex++;
        }
    }

    /**
     * Completes a run in which {@code expected} items were produced. Every one of them must have
     * been written by now.
     */
    public synchronized void finish(long expected) throws IOException {
        if (nextEmitIndex != expected || !pending.isEmpty()) {
            throw new QueueClosedException(String.format(
                    "Collector incomplete: expected %d results, emitted %d, %d still pending",
                    expected, nextEmitIndex, pending.size()));
        }
        sink.flush();
    }

    // Flushes the contiguous prefix that was written before a cancelled run stopped.
    public synchronized void flushOrderable() throws IOException {
        sink.flush();
    }

    public synchronized long emitted() {
        return nextEmitIndex;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized int peakPending() {
        return peakPending;
    }
}

package recursum.pipeline;

import recursum.models.*;

/**
 * Single point where discovered paths get their output position. Indices are dense and start at 0.
 * Numbering and enqueueing happen under one lock, so queue order always equals index order even
 * when several threads discover paths.
 */
public class Sequencer {

    private final DispatchQueue queue;
    private long nextIndex;
    private volatile long produced;

    public Sequencer(DispatchQueue queue) {
        this.queue = queue;
    }

    /**
     * Numbers the path and pushes it onto the dispatch queue, blocking while the queue is full.
     *
     * @return false if the pipeline was aborted; the source should stop producing
     */
    public synchronized boolean emit(String path) throws InterruptedException {
        if (!queue.put(new PathItem(nextIndex, path))) {
            return false;
        }
        nextIndex++;
        produced = nextIndex;
        return true;
    }

    public long produced() {
        return produced;
    }
}

package recursum.sources;

import recursum.pipeline.*;

/**
 * Produces the paths to hash, in output order, through a {@link Sequencer}.
 * Runs on its own thread; {@link #produce} returns when the input is exhausted.
 */
public interface PathSource {

    /**
     * Dispatch queue capacity for this source, or {@link DispatchQueue#UNBOUNDED}.
     */
    int queueCapacity(int workerCount, double queueFactor);

    /**
     * Emits every path through the sequencer. Returns early, without error, once the sequencer
     * reports the pipeline was aborted.
     */
    void produce(Sequencer sequencer) throws SourceException, InterruptedException;

    // Entries passed over while producing (unreadable directories, filtered files).
    default long skipped() {
        return 0;
    }

    String describe();
}

package recursum.pipeline;

// Internal invariant violation between the dispatch queue and the collector. Never expected at runtime.
public class QueueClosedException extends IllegalStateException {
    public QueueClosedException(String message) {
        super(message);
    }
}

package recursum.pipeline;

import recursum.sources.*;

/**
 * Outcome of one pipeline run. {@code failure} is set when the path source gave up; output
 * written before that point is kept.
 */
public record PipelineResult(
        long produced,
        long emitted,
        long fileErrors,
        long bytesHashed,
        long skipped,
        int peakQueueSize,
        int peakPendingWindow,
        boolean cancelled,
        SourceException failure
) {
    public long unprocessed() {
        return produced - emitted;
    }

    public boolean isComplete() {
        return !cancelled && failure == null;
    }
}

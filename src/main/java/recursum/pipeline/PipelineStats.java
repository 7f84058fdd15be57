package recursum.pipeline;

import java.util.concurrent.atomic.*;

// Counters updated by the workers as files complete; read by the progress reporter.
public final class PipelineStats {
    public final LongAdder filesHashed = new LongAdder();
    public final LongAdder bytesHashed = new LongAdder();
    public final LongAdder fileErrors = new LongAdder();
    public final long startMillis = System.currentTimeMillis();

    public long completed() {
        return filesHashed.sum() + fileErrors.sum();
    }
}

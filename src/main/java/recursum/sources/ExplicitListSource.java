package recursum.sources;

import recursum.pipeline.*;

import java.util.*;

// Paths given on the command line, hashed in argument order.
public class ExplicitListSource implements PathSource {

    private final List<String> paths;

    public ExplicitListSource(List<String> paths) {
        this.paths = List.copyOf(paths);
    }

    @Override
    public int queueCapacity(int workerCount, double queueFactor) {
        return Math.max(1, paths.size());
    }

    @Override
    public void produce(Sequencer sequencer) throws InterruptedException {
        for (String path : paths) {
            if (!sequencer.emit(path)) return;
        }
    }

    @Override
    public String describe() {
        return String.format("%,d listed %s", paths.size(), paths.size() == 1 ? "file" : "files");
    }
}

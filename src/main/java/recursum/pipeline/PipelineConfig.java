package recursum.pipeline;

import recursum.output.*;
import recursum.sources.*;
import recursum.utils.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Fully resolved settings for one run.
 */
public record PipelineConfig(
        InputMode mode,
        List<String> inputs,
        int workerCount,
        int walkerCount,
        double queueFactor,
        OutputFormat format,
        HashAlgorithm algorithm,
        int batchSize,
        boolean quiet,
        Set<String> includeTypes
) {
    public PipelineConfig {
        inputs = List.copyOf(inputs);
        includeTypes = includeTypes != null ? Set.copyOf(includeTypes) : Collections.emptySet();
        if (workerCount < 1) throw new IllegalArgumentException("Thread count must be positive: " + workerCount);
        if (walkerCount < 1) throw new IllegalArgumentException("Walker count must be positive: " + walkerCount);
        if (queueFactor <= 0) throw new IllegalArgumentException("Queue factor must be positive: " + queueFactor);
        if (batchSize < 1) throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
    }

    public PathSource createSource(InputStream stdin) {
        switch (mode) {
            case DIRECTORY:
                return new DirectoryWalkSource(Path.of(inputs.get(0)), walkerCount, includeTypes);
            case STDIN:
                return new StdinStreamSource(stdin);
            default:
                return new ExplicitListSource(inputs);
        }
    }
}

package recursum.sources;

import recursum.pipeline.*;

import java.io.*;
import java.nio.charset.*;

/**
 * Newline-delimited paths read from a stream, typically standard input.
 * <p>
 * Lines are read as fast as they arrive and buffered without limit, so the process writing
 * them never stalls on a full pipe. Empty lines are ignored.
 */
public class StdinStreamSource implements PathSource {

    private final InputStream in;

    public StdinStreamSource(InputStream in) {
        this.in = in;
    }

    @Override
    public int queueCapacity(int workerCount, double queueFactor) {
        return DispatchQueue.UNBOUNDED;
    }

    @Override
    public void produce(Sequencer sequencer) throws SourceException, InterruptedException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) continue;
                if (!sequencer.emit(line)) return;
            }
        } catch (InterruptedIOException e) {
            throw new InterruptedException("Interrupted while reading paths");
        } catch (IOException e) {
            throw new SourceException("Unable to read paths from standard input: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "paths from standard input";
    }
}

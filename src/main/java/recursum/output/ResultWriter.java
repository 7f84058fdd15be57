package recursum.output;

import recursum.models.*;
import recursum.pipeline.*;

import java.io.*;
import java.nio.charset.*;

// Writes ordered results as \n-terminated lines, flushing every batchSize lines and on flush().
public class ResultWriter implements ResultSink {
    public static final int DEFAULT_BATCH_SIZE = 500;

    private final BufferedWriter writer;
    private final OutputFormat format;
    private final int batchSize;
    private int unflushed;

    public ResultWriter(OutputStream out, OutputFormat format, int batchSize) {
        this(new OutputStreamWriter(out, StandardCharsets.UTF_8), format, batchSize);
    }

    public ResultWriter(Writer out, OutputFormat format, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.writer = out instanceof BufferedWriter ? (BufferedWriter) out : new BufferedWriter(out);
        this.format = format;
        this.batchSize = batchSize;
    }

    @Override
    public void write(ResultItem result) throws IOException {
        writer.write(format.format(result));
        writer.write('\n');
        if (++unflushed >= batchSize) {
            flush();
        }
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
        unflushed = 0;
    }
}

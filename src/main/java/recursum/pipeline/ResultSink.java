package recursum.pipeline;

import recursum.models.*;

import java.io.*;

// Receives results in sequence order, from whichever worker thread completed the front of the window.
public interface ResultSink {

    void write(ResultItem result) throws IOException;

    void flush() throws IOException;
}

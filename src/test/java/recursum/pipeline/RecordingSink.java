package recursum.pipeline;

import recursum.models.*;

import java.util.*;

// Keeps every written result, in write order.
class RecordingSink implements ResultSink {
    private final List<ResultItem> written = Collections.synchronizedList(new ArrayList<>());
    private volatile int flushes;

    @Override
    public void write(ResultItem result) {
        written.add(result);
    }

    @Override
    public void flush() {
        flushes++;
    }

    List<ResultItem> written() {
        synchronized (written) {
            return new ArrayList<>(written);
        }
    }

    List<String> paths() {
        List<String> paths = new ArrayList<>();
        for (ResultItem item : written()) paths.add(item.path());
        return paths;
    }

    int flushes() {
        return flushes;
    }
}

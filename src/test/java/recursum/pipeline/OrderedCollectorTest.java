package recursum.pipeline;

import recursum.models.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class OrderedCollectorTest {

    private static ResultItem result(long index) {
        return ResultItem.success(new PathItem(index, "f" + index), "d" + index, index);
    }

    @Test
    void accept_holdsResultsUntilTheirPredecessorsArrive() throws Exception {
        RecordingSink sink = new RecordingSink();
        OrderedCollector collector = new OrderedCollector(sink);

        collector.accept(result(2));
        collector.accept(result(1));
        assertTrue(sink.written().isEmpty());
        assertEquals(2, collector.pendingCount());

        collector.accept(result(0));
        assertEquals(List.of("f0", "f1", "f2"), sink.paths());
        assertEquals(0, collector.pendingCount());

        collector.accept(result(4));
        collector.accept(result(3));
        collector.finish(5);

        assertEquals(List.of("f0", "f1", "f2", "f3", "f4"), sink.paths());
        assertEquals(5, collector.emitted());
        assertEquals(2, collector.peakPending());
        assertEquals(1, sink.flushes());
    }

    @Test
    void accept_emitsAnyPermutationInIndexOrder() throws Exception {
        List<Long> order = new ArrayList<>();
        for (long i = 0; i < 200; i++) order.add(i);
        Collections.shuffle(order, new Random(42));

        RecordingSink sink = new RecordingSink();
        OrderedCollector collector = new OrderedCollector(sink);
        for (long index : order) collector.accept(result(index));
        collector.finish(200);

        List<ResultItem> written = sink.written();
        for (int i = 0; i < written.size(); i++) {
            assertEquals(i, written.get(i).sequenceIndex());
        }
    }

    @Test
    void accept_rejectsDuplicates() throws Exception {
        OrderedCollector collector = new OrderedCollector(new RecordingSink());
        collector.accept(result(0));
        collector.accept(result(2));

        assertThrows(QueueClosedException.class, () -> collector.accept(result(0)));
        assertThrows(QueueClosedException.class, () -> collector.accept(result(2)));
    }

    @Test
    void finish_failsWhenResultsAreMissing() throws Exception {
        OrderedCollector collector = new OrderedCollector(new RecordingSink());
        collector.accept(result(0));
        collector.accept(result(2));

        QueueClosedException e = assertThrows(QueueClosedException.class, () -> collector.finish(3));
        assertTrue(e.getMessage().contains("expected 3"));
    }

    @Test
    void errorResultsTakeTheirPlaceInOrder() throws Exception {
        RecordingSink sink = new RecordingSink();
        OrderedCollector collector = new OrderedCollector(sink);

        collector.accept(result(1));
        collector.accept(ResultItem.failure(new PathItem(0, "broken"), "permission denied"));
        collector.finish(2);

        assertEquals(List.of("broken", "f1"), sink.paths());
        assertTrue(sink.written().get(0).isError());
    }
}

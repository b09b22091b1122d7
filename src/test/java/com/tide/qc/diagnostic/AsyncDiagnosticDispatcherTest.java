package com.tide.qc.diagnostic;

import com.tide.qc.core.Sample;
import com.tide.qc.statistics.ConfidenceInterval;
import com.tide.qc.statistics.WindowExtractor;
import com.tide.qc.core.SampleSeries;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncDiagnosticDispatcherTest {

    private static final Instant START = Instant.parse("2018-08-01T00:00:00Z");

    @Test
    void testEventsDeliveredOffCallerThread() {
        List<String> threads = new CopyOnWriteArrayList<>();
        List<Integer> indices = new CopyOnWriteArrayList<>();
        AsyncDiagnosticDispatcher dispatcher = new AsyncDiagnosticDispatcher(new SpikeDiagnosticListener() {
            @Override
            public void onDiagnostic(DiagnosticEvent event) {
                threads.add(Thread.currentThread().getName());
                indices.add(event.getIndex());
            }
        }, 16);

        dispatcher.onDiagnostic(event(2));
        dispatcher.onDiagnostic(event(3));
        dispatcher.close();

        assertEquals(List.of(2, 3), indices);
        assertTrue(threads.stream().allMatch("spike-diagnostics"::equals));
    }

    @Test
    void testFullQueueDropsInsteadOfBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        List<Integer> delivered = new CopyOnWriteArrayList<>();
        AsyncDiagnosticDispatcher dispatcher = new AsyncDiagnosticDispatcher(new SpikeDiagnosticListener() {
            @Override
            public void onDiagnostic(DiagnosticEvent event) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                delivered.add(event.getIndex());
            }
        }, 1);

        dispatcher.onDiagnostic(event(2)); // 工作线程处理中
        dispatcher.onDiagnostic(event(3)); // 排队
        dispatcher.onDiagnostic(event(4)); // 队列已满，丢弃

        assertEquals(1, dispatcher.getDroppedCount());
        release.countDown();
        dispatcher.close();

        assertEquals(List.of(2, 3), delivered);
    }

    @Test
    void testListenerFailureIsContained() {
        List<Integer> delivered = new CopyOnWriteArrayList<>();
        AsyncDiagnosticDispatcher dispatcher = new AsyncDiagnosticDispatcher(new SpikeDiagnosticListener() {
            @Override
            public void onDiagnostic(DiagnosticEvent event) {
                if (event.getIndex() == 2) {
                    throw new IllegalStateException("render failed");
                }
                delivered.add(event.getIndex());
            }
        }, 16);

        dispatcher.onDiagnostic(event(2));
        dispatcher.onDiagnostic(event(3));
        dispatcher.close();

        assertEquals(1, dispatcher.getFailedCount());
        assertEquals(List.of(3), delivered);
    }

    @Test
    void testEventLabelHistoryIsCopied() {
        boolean[] history = {false, true};
        DiagnosticEvent event = new DiagnosticEvent(2, sample(2), window(2), history,
                new ConfidenceInterval(0.0, 1.0), true, false);

        history[0] = true;
        assertFalse(event.getLabelHistory()[0]);
        assertEquals(1, event.getSpikesInWindow());
        assertTrue(event.isMisclassified());
    }

    @Test
    void testLoggingListenerHandlesMissingValues() {
        DiagnosticEvent event = new DiagnosticEvent(2, new Sample(START.plusSeconds(720), Double.NaN, 1.0),
                window(2), new boolean[]{false, false}, new ConfidenceInterval(0.85, 1.15), false, false);

        assertDoesNotThrow(() -> new LoggingDiagnosticListener().onDiagnostic(event));
    }

    private static DiagnosticEvent event(int index) {
        return new DiagnosticEvent(index, sample(index), window(index), new boolean[index],
                new ConfidenceInterval(0.85, 1.15), true, true);
    }

    private static Sample sample(int index) {
        return new Sample(START.plusSeconds(360L * index), 2.0, 1.0);
    }

    private static com.tide.qc.statistics.SampleWindow window(int index) {
        SampleSeries series = new SampleSeries(List.of(
                new Sample(START, 1.0, 1.0),
                new Sample(START.plusSeconds(360), 1.0, 1.0),
                new Sample(START.plusSeconds(720), 1.0, 1.0),
                new Sample(START.plusSeconds(1080), 1.0, 1.0),
                new Sample(START.plusSeconds(1440), 1.0, 1.0)
        ));
        return new WindowExtractor(10, 1).extract(series, index);
    }
}

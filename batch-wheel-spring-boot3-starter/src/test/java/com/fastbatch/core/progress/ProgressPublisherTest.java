package com.fastbatch.core.progress;

import com.fastbatch.core.metric.BatchMetrics;
import com.fastbatch.core.spi.progress.ProgressListener;
import com.fastbatch.model.ProgressSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProgressPublisherTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private final BatchMetrics metrics = BatchMetrics.create(registry);

    private static ProgressSnapshot snapshot(int completed) {
        return ProgressSnapshot.builder().batchId("b1").completed(completed).succeeded(completed).total(3).build();
    }

    @Test
    void deliversInPublishOrder() throws Exception {
        // given
        ProgressListener listener = mock(ProgressListener.class);
        ProgressPublisher publisher = new ProgressPublisher(listener, metrics);

        // when
        for (int i = 1; i <= 3; i++) {
            publisher.publish(snapshot(i));
        }
        publisher.flush(1_000);

        // then
        InOrder order = inOrder(listener);
        order.verify(listener).onProgress(argThat(s -> s.getCompleted() == 1));
        order.verify(listener).onProgress(argThat(s -> s.getCompleted() == 2));
        order.verify(listener).onProgress(argThat(s -> s.getCompleted() == 3));
    }

    @Test
    void listenerFailure_isCountedAndContained() throws Exception {
        // given
        ProgressListener listener = mock(ProgressListener.class);
        when(listener.name()).thenReturn("broken");
        doThrow(new IllegalStateException("boom")).when(listener).onProgress(argThat(s -> s.getCompleted() == 1));
        ProgressPublisher publisher = new ProgressPublisher(listener, metrics);

        // when
        assertThatCode(() -> {
            publisher.publish(snapshot(1));
            publisher.publish(snapshot(2));
        }).doesNotThrowAnyException();
        publisher.flush(1_000);

        // then
        verify(listener, times(2)).onProgress(argThat(s -> s.getTotal() == 3));
        assertThat(registry.get("batch.progress.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void withoutListener_publishIsNoop() throws Exception {
        ProgressPublisher publisher = new ProgressPublisher(null, metrics);

        publisher.publish(snapshot(1));
        publisher.flush(10);
        publisher.close();

        assertThat(registry.get("batch.progress.failed").counter().count()).isZero();
    }
}

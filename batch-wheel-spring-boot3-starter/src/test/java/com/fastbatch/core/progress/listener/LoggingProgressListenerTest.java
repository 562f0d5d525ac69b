package com.fastbatch.core.progress.listener;

import com.fastbatch.model.ProgressSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingProgressListenerTest {

    private static ProgressSnapshot snapshot(int completed, int total, double throughput) {
        return ProgressSnapshot.builder()
                .batchId("b1")
                .completed(completed)
                .succeeded(completed)
                .total(total)
                .throughputPerSec(throughput)
                .build();
    }

    @Test
    void etaFromCurrentThroughput() {
        assertThat(LoggingProgressListener.etaSeconds(snapshot(10, 30, 4.0))).isEqualTo(5);
        assertThat(LoggingProgressListener.etaSeconds(snapshot(30, 30, 4.0))).isZero();
        assertThat(LoggingProgressListener.etaSeconds(snapshot(1, 30, 0))).isEqualTo(-1);
    }

    @Test
    void onProgress_logsWithoutFailing() {
        LoggingProgressListener listener = new LoggingProgressListener();

        assertThat(listener.name()).isEqualTo("log");
        assertThatCode(() -> listener.onProgress(snapshot(0, 0, 0))).doesNotThrowAnyException();
    }
}

package com.fastbatch.core.progress;

import com.fastbatch.core.metric.BatchMetrics;
import com.fastbatch.core.spi.progress.ProgressListener;
import com.fastbatch.model.ProgressSnapshot;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 单批次的进度派发
 * 单线程串行回调, 与引擎内部锁解耦, 监听器异常不影响批次
 */
public class ProgressPublisher implements AutoCloseable {

    private final Logger log = LoggerFactory.getLogger(ProgressPublisher.class);

    private final ProgressListener listener;

    private final BatchMetrics metrics;

    private final ExecutorService exec;

    public ProgressPublisher(ProgressListener listener, BatchMetrics metrics) {
        this.listener = listener;
        this.metrics = metrics;
        this.exec = listener == null ? null
                : Executors.newSingleThreadExecutor(new NamedThreadFactory("batch-progress"));
    }

    /**
     * 调用方须保证快照按产生顺序传入
     */
    public void publish(ProgressSnapshot snapshot) {
        if (exec == null) {
            return;
        }
        exec.execute(() -> {
            try {
                listener.onProgress(snapshot);
            } catch (Exception e) {
                metrics.incProgressFailed();
                log.error("[Progress] listener={} batchId={} completed={} failed",
                        listener.name(), snapshot.getBatchId(), snapshot.getCompleted(), e);
            }
        });
    }

    /**
     * 等待已提交的回调执行完
     */
    public void flush(long awaitMs) throws InterruptedException {
        if (exec == null) {
            return;
        }
        exec.shutdown();
        if (!exec.awaitTermination(Math.max(1, awaitMs), TimeUnit.MILLISECONDS)) {
            exec.shutdownNow();
            log.warn("[Progress] listener={} did not drain within {} ms", listener.name(), awaitMs);
        }
    }

    @Override
    public void close() {
        if (exec != null) {
            exec.shutdownNow();
        }
    }
}

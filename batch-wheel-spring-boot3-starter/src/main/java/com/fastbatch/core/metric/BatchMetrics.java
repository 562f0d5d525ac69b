package com.fastbatch.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class BatchMetrics {
    private final Counter enqueued;
    private final Counter success;
    private final Counter failed;
    private final Counter retried;
    private final Counter timeout;
    private final Counter cancelled;
    private final Counter progressFailed;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private BatchMetrics(MeterRegistry reg) {
        this.enqueued  = Counter.builder("batch.task.enqueued").description("tasks enqueued").register(reg);
        this.success   = Counter.builder("batch.task.success").description("tasks succeeded").register(reg);
        this.failed    = Counter.builder("batch.task.failed").description("tasks failed terminally").register(reg);
        this.retried   = Counter.builder("batch.task.retried").description("retries scheduled").register(reg);
        this.timeout   = Counter.builder("batch.task.timeout").description("attempts timed out").register(reg);
        this.cancelled = Counter.builder("batch.task.cancelled").description("tasks cancelled before dispatch").register(reg);
        this.progressFailed = Counter.builder("batch.progress.failed").description("progress listener errors").register(reg);
        this.attempts  = DistributionSummary.builder("batch.task.attempts")
                .description("attempt count per task").baseUnit("times").register(reg);
        this.execTimer = Timer.builder("batch.exec.time").description("single attempt execution time").register(reg);
    }

    public static BatchMetrics create(MeterRegistry reg) { return new BatchMetrics(reg); }

    public void incEnqueued(int n){ enqueued.increment(n); }
    public void incSuccess(){   success.increment(); }
    public void incFailed(){    failed.increment(); }
    public void incRetried(){   retried.increment(); }
    public void incTimeout(){   timeout.increment(); }
    public void incCancelled(){ cancelled.increment(); }
    public void incProgressFailed(){ progressFailed.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }
}

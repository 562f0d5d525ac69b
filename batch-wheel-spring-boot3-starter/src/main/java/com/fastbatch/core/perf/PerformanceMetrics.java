package com.fastbatch.core.perf;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder
@ToString
public final class PerformanceMetrics {

    private final Instant timestamp;
    private final int batchSize;
    private final int concurrency;
    private final long totalDurationMs;
    private final double averageDurationMs;
    /** 每秒完成任务数 */
    private final double throughputPerSec;
    /** 0~1 */
    private final double successRate;
    /** 每任务平均重试次数 */
    private final double retryRate;
    /** 0~1 */
    private final double errorRate;
    private final long p50;
    private final long p95;
    private final long p99;
    /** 派发总次数（含重试） */
    private final long attempts;
    private final long timeouts;
}

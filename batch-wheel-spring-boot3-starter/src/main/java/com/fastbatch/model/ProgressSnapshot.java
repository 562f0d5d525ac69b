package com.fastbatch.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 每次任务完成时重算的进度快照, 只读
 */
@Getter
@Builder
@ToString
public final class ProgressSnapshot {

    private final String batchId;
    /** 已完成数（成功 + 终态失败） */
    private final int completed;
    private final int succeeded;
    private final int failed;
    private final int total;
    private final long elapsedMs;
    private final double averageDurationMs;
    private final double throughputPerSec;
    /** 0~1 */
    private final double successRate;
    /** 每个已完成任务的平均重试次数 */
    private final double retryRate;
    /** 0~1 */
    private final double errorRate;
}

package com.fastbatch.model;

import com.fastbatch.model.enums.AttemptOutcome;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 单次派发记录, 交给 PerformanceTracker 汇总后丢弃
 */
@Getter
@ToString
@AllArgsConstructor
public final class TaskAttempt {

    private final String taskId;
    private final int attemptNumber;
    private final long startedAt;
    private final long finishedAt;
    private final AttemptOutcome outcome;

    public long getDurationMs() {
        return Math.max(0, finishedAt - startedAt);
    }
}

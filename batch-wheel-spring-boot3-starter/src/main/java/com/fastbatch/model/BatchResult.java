package com.fastbatch.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 每个提交任务恰好一条结果
 */
@Getter
@Builder
@ToString
public final class BatchResult<R> {

    private final String taskId;

    private final boolean succeeded;

    /** 成功时的返回值 */
    private final R value;

    /** 失败时的描述 */
    private final ErrorDescriptor error;

    /** 各次尝试执行耗时之和, 不含退避等待 */
    private final long durationMs;

    private final int retriesUsed;
}

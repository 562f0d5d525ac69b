package com.fastbatch.core.spi;

import com.fastbatch.core.cost.UnitUsage;
import com.fastbatch.model.BatchTask;

/**
 * 从任务结果中提取资源用量, 用于成本记账
 */
@FunctionalInterface
public interface UsageExtractor<R> {

    UsageExtractor<Object> NONE = (task, value) -> UnitUsage.ZERO;

    /**
     * @param task  已完成的任务
     * @param value 成功时的返回值, 失败时为 null
     */
    UnitUsage extract(BatchTask<?> task, R value);

    @SuppressWarnings("unchecked")
    static <R> UsageExtractor<R> none() {
        return (UsageExtractor<R>) NONE;
    }
}

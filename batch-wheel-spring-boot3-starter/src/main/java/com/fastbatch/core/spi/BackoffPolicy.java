package com.fastbatch.core.spi;

import com.fastbatch.model.RetryPolicy;

/**
 * 回退策略（计算下一次重试前的等待）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算退避时长
     * @param attemptNumber 刚失败的尝试序号（从0开始）
     * @param policy        本批重试配置（读取 base/multiplier/jitterRatio/maxDelay）
     * @return 毫秒, 不小于 0
     */
    long nextDelayMillis(int attemptNumber, RetryPolicy policy);
}

package com.fastbatch.model;

import com.fastbatch.exception.BatchConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 批次重试配置, 提交时构建, 批次结束即丢弃
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class RetryPolicy {

    /** 允许的最大重试次数（不含首次执行） */
    @Builder.Default
    private final int maxAttempts = 3;

    /** 指数退避的 base */
    @Builder.Default
    private final long baseDelayMs = 1000;

    @Builder.Default
    private final double backoffMultiplier = 2.0;

    /** 抖动比例（0~1），例如 0.2 表示 ±20% */
    @Builder.Default
    private final double jitterRatio = 0.0;

    /** 单次尝试超时 */
    @Builder.Default
    private final long perTaskTimeoutMs = 60_000;

    /** 退避上限 */
    @Builder.Default
    private final long maxDelayMs = 300_000;

    /** fixed | exponential | spi:{name} */
    @Builder.Default
    private final String backoffStrategy = "exponential";

    public RetryPolicy validate() {
        if (maxAttempts < 0) {
            throw new BatchConfigurationException("retryAttempts must be >= 0, got " + maxAttempts);
        }
        if (baseDelayMs < 0) {
            throw new BatchConfigurationException("retryDelayMs must be >= 0, got " + baseDelayMs);
        }
        if (backoffMultiplier < 1.0) {
            throw new BatchConfigurationException("backoffMultiplier must be >= 1, got " + backoffMultiplier);
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new BatchConfigurationException("jitterRatio must be within [0, 1], got " + jitterRatio);
        }
        if (perTaskTimeoutMs <= 0) {
            throw new BatchConfigurationException("taskTimeoutMs must be > 0, got " + perTaskTimeoutMs);
        }
        if (maxDelayMs < 0) {
            throw new BatchConfigurationException("maxRetryDelayMs must be >= 0, got " + maxDelayMs);
        }
        return this;
    }
}

package com.fastbatch.core.backoff;

import com.fastbatch.core.spi.BackoffPolicy;
import com.fastbatch.model.RetryPolicy;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public long nextDelayMillis(int attemptNumber, RetryPolicy policy) {
        return BackoffJitter.apply(policy.getBaseDelayMs(), policy.getJitterRatio(), policy.getMaxDelayMs());
    }
}

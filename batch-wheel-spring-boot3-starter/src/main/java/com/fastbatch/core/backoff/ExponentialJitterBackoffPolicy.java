package com.fastbatch.core.backoff;

import com.fastbatch.core.spi.BackoffPolicy;
import com.fastbatch.model.RetryPolicy;

public class ExponentialJitterBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long nextDelayMillis(int attemptNumber, RetryPolicy policy) {
        long base = policy.getBaseDelayMs(), max = policy.getMaxDelayMs();
        double jr = policy.getJitterRatio();

        // attempt从0开始计数：0 -> base, 1 -> base * m^1, 2 -> base * m^2 ...
        double pow = Math.pow(policy.getBackoffMultiplier(), Math.max(0, attemptNumber));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        return BackoffJitter.apply(ideal, jr, max);
    }
}

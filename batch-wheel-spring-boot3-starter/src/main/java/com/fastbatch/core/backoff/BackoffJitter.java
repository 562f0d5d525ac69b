package com.fastbatch.core.backoff;

import java.util.concurrent.ThreadLocalRandom;

final class BackoffJitter {

    private BackoffJitter() {
    }

    /**
     * ideal ± jitterRatio * ideal, 再截断到 [0, max]
     */
    static long apply(long ideal, double jitterRatio, long max) {
        long jittered = ideal;
        if (jitterRatio > 0 && ideal > 0) {
            // 向零截断, |jitter| 不会超过 jitterRatio * ideal
            long jitter = (long) (ThreadLocalRandom.current().nextDouble(-jitterRatio, jitterRatio) * ideal);
            jittered = ideal + jitter;
        }
        return Math.max(0, Math.min(jittered, max));
    }
}

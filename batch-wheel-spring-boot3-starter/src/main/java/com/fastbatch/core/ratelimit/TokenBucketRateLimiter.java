package com.fastbatch.core.ratelimit;

import com.fastbatch.core.spi.RateLimiter;
import com.fastbatch.core.time.TimeSource;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;

/**
 * 令牌桶限流, 每分钟 requestsPerMinute 个许可, 最多突发 burst 个
 * 付费档 500/min burst 50, 免费档 10/min burst 5
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private final io.github.resilience4j.ratelimiter.RateLimiter delegate;

    private final TimeSource time;

    public TokenBucketRateLimiter(String name, int requestsPerMinute, int burst) {
        this(name, requestsPerMinute, burst, TimeSource.SYSTEM);
    }

    public TokenBucketRateLimiter(String name, int requestsPerMinute, int burst, TimeSource time) {
        if (requestsPerMinute <= 0 || burst <= 0) {
            throw new IllegalArgumentException("requestsPerMinute and burst must be > 0");
        }
        // burst 个许可按 requestsPerMinute 的速率整窗补充
        long refreshMs = Math.max(1, 60_000L * burst / requestsPerMinute);
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(burst)
                .limitRefreshPeriod(Duration.ofMillis(refreshMs))
                .timeoutDuration(Duration.ofMillis(refreshMs))
                .build();
        this.delegate = io.github.resilience4j.ratelimiter.RateLimiter.of("rl:" + name, cfg);
        this.time = time;
    }

    @Override
    public long awaitSlot() throws InterruptedException {
        // 单次等待不超过一个窗口, 未获许可则继续等
        while (!delegate.acquirePermission()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("interrupted while waiting for rate limit permit");
            }
        }
        return time.nowMillis();
    }

    public int getAvailablePermissions() {
        return delegate.getMetrics().getAvailablePermissions();
    }
}

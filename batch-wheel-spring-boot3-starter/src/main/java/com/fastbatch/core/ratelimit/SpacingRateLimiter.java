package com.fastbatch.core.ratelimit;

import com.fastbatch.core.spi.RateLimiter;
import com.fastbatch.core.time.TimeSource;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 全局派发间隔闸门
 * 单个 lastGrantedAt 时间戳 + 一把锁, 所有工作槽共用, 等待期间持锁以保证严格间隔
 */
public class SpacingRateLimiter implements RateLimiter {

    private final long delayMs;

    private final TimeSource time;

    /** 公平锁, 先到先得 */
    private final ReentrantLock lock = new ReentrantLock(true);

    /** guarded by lock, -1 表示尚未发放 */
    private long lastGrantedAt = -1;

    public SpacingRateLimiter(long delayMs) {
        this(delayMs, TimeSource.SYSTEM);
    }

    public SpacingRateLimiter(long delayMs, TimeSource time) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0");
        }
        this.delayMs = delayMs;
        this.time = time;
    }

    @Override
    public long awaitSlot() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (lastGrantedAt >= 0 && delayMs > 0) {
                long wait;
                while ((wait = lastGrantedAt + delayMs - time.nowMillis()) > 0) {
                    time.sleep(wait);
                }
            }
            lastGrantedAt = time.nowMillis();
            return lastGrantedAt;
        } finally {
            lock.unlock();
        }
    }

    public long getDelayMs() {
        return delayMs;
    }
}

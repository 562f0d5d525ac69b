package com.fastbatch.core.time;

import java.util.concurrent.TimeUnit;

/**
 * 单调时钟 + 睡眠抽象, 测试可替换为虚拟时间
 */
public interface TimeSource {

    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nowMillis() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
        }

        @Override
        public void sleep(long millis) throws InterruptedException {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        }
    };

    /** 单调毫秒, 只用于计算间隔 */
    long nowMillis();

    void sleep(long millis) throws InterruptedException;
}

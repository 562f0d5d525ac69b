package com.fastbatch.core.spi;

/**
 * 派发闸门, 所有工作槽共享
 */
public interface RateLimiter {

    /**
     * 阻塞直到允许下一次派发
     * @return 获得许可的时间戳（毫秒）
     */
    long awaitSlot() throws InterruptedException;
}

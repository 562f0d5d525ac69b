package com.fastbatch.core.spi;

/**
 * 退避调度, 到期后把任务放回派发队列
 */
public interface RetryScheduler {

    ScheduledRetry schedule(String taskId, long delayMs, Runnable requeue);

    /**
     * 停止调度, 返回未触发的退避任务数
     */
    default int stop() {
        return 0;
    }

    interface ScheduledRetry {

        /** 到期前取消成功返回 true */
        boolean cancel();
    }
}

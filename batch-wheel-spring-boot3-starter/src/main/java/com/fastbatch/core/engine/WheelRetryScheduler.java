package com.fastbatch.core.engine;

import com.fastbatch.core.spi.RetryScheduler;
import com.fastbatch.model.WheelTask;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * 基于 HashedWheelTimer 的退避调度, 等待期间不占用工作槽
 */
public class WheelRetryScheduler implements RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(WheelRetryScheduler.class);

    private final HashedWheelTimer timer;

    public WheelRetryScheduler(HashedWheelTimer timer) {
        this.timer = timer;
    }

    @Override
    public ScheduledRetry schedule(String taskId, long delayMs, Runnable requeue) {
        if (delayMs <= 0) {
            requeue.run();
            return () -> false;
        }
        Timeout timeout = timer.newTimeout(new WheelTask(taskId, requeue), delayMs, TimeUnit.MILLISECONDS);
        return timeout::cancel;
    }

    /**
     * 停止时间轮, 统计未触发的退避任务
     */
    @Override
    public int stop() {
        Set<Timeout> unProcessed = timer.stop();
        if (unProcessed == null || unProcessed.isEmpty()) {
            log.info("[Batch-Engine] timer stopped with no unprocessed timeouts.");
            return 0;
        }
        int drained = 0;
        for (Timeout t : unProcessed) {
            if (t != null && t.task() instanceof WheelTask) {
                drained++;
            }
        }
        log.info("[Batch-Engine] timer stopped, dropped {} pending retries.", drained);
        return drained;
    }
}

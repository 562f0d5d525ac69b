package com.fastbatch.core.engine;

import com.fastbatch.config.BatchWheelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class BatchEngineLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(BatchEngineLifecycle.class);

    private final BatchExecutionEngine engine;

    private final BatchWheelProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public BatchEngineLifecycle(BatchExecutionEngine engine, BatchWheelProperties props) {
        this.engine = engine;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // 打印关键启动信息（一次性）
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ BatchExecutionEngine started                               │");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ concurrency         : {}", props.getConcurrency());
            log.info("│ task.timeout        : {} ms", props.getTaskTimeout().toMillis());
            log.info("│ retry.attempts      : {}", props.getRetry().getAttempts());
            log.info("│ retry.delay         : {} ms", props.getRetry().getDelay().toMillis());
            log.info("│ retry.multiplier    : {}", props.getRetry().getMultiplier());
            log.info("│ retry.jitterRatio   : {}", props.getRetry().getJitterRatio());
            log.info("│ retry.strategy      : {}", props.getRetry().getStrategy());
            log.info("│ rateLimit.mode      : {}", props.getRateLimit().getMode());
            if (props.getRateLimit().isTokenBucket()) {
                log.info("│ rateLimit.rpm       : {}", props.getRateLimit().getRequestsPerMinute());
                log.info("│ rateLimit.burst     : {}", props.getRateLimit().getBurst());
            } else {
                log.info("│ rateLimit.delay     : {} ms", props.getRateLimit().getDelay().toMillis());
            }
            log.info("│ wheel.tick          : {} ms", props.getWheel().getTickDuration().toMillis());
            log.info("│ wheel.size          : {}", props.getWheel().getTicksPerWheel());
            log.info("│ cost.priceTable     : {}", props.getCost().getPriceTable());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            // banner 失败只告警
            log.warn("[Batch-Engine] failed to render startup banner: {}", t.toString());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Batch-Engine] stop skipped: already stopped");
            return;
        }
        log.info("[Batch-Engine] stopping... activeRuns={}", engine.activeRunCount());
        // 停止接受新批次, 等待在途批次收尾
        try {
            engine.gracefulShutdown(props.getShutdown().getAwait().toMillis());
        } finally {
            log.info("[Batch-Engine] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}

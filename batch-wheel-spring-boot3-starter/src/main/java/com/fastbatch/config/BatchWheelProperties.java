package com.fastbatch.config;

import com.fastbatch.exception.BatchConfigurationException;
import com.fastbatch.model.RetryPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 批处理引擎配置（绑定前缀：batch）
 *
 * YAML 示例：
 * batch:
 *   concurrency: 4
 *   task-timeout: 60s
 *   retry:
 *     attempts: 3
 *     delay: 1s
 *     multiplier: 2.0
 *     jitter-ratio: 0.0
 *     max-delay: 300s
 *     strategy: exponential
 *   rate-limit:
 *     mode: spacing
 *     delay: 200ms
 *     requests-per-minute: 500
 *     burst: 50
 *   wheel:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *     max-pending-timeouts: 100000
 *   sizer:
 *     min: 5
 *     max: 100
 *     optimal: 20
 *   cost:
 *     price-table: standard
 *     auxiliary-units-per-task: 1600
 *   progress:
 *     log-enabled: true
 *   shutdown:
 *     await: 30s
 */
@ConfigurationProperties(prefix = "batch")
public class BatchWheelProperties implements InitializingBean {

    /** 同时在途的工作函数上限 */
    private int concurrency = 4;

    /** 单次尝试超时 */
    private Duration taskTimeout = Duration.ofSeconds(60);

    private Retry retry = new Retry();

    private RateLimit rateLimit = new RateLimit();

    private Wheel wheel = new Wheel();

    private Sizer sizer = new Sizer();

    private Cost cost = new Cost();

    private Progress progress = new Progress();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Retry {
        /** 最大重试次数（不含首次执行） */
        private int attempts = 3;

        /** 首次重试前的等待 */
        private Duration delay = Duration.ofSeconds(1);

        private double multiplier = 2.0;

        /** 抖动比例（0~1），例如 0.2 表示 ±20% */
        private double jitterRatio = 0.0;

        private Duration maxDelay = Duration.ofSeconds(300);

        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        public int getAttempts() { return attempts; }
        public void setAttempts(int attempts) { this.attempts = attempts; }
        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }

    public static class RateLimit {
        /** spacing | token-bucket */
        private String mode = "spacing";

        /** spacing 模式下相邻两次派发的最小间隔 */
        private Duration delay = Duration.ofMillis(200);

        /** token-bucket 模式每分钟许可数 */
        private int requestsPerMinute = 500;

        /** token-bucket 模式突发上限 */
        private int burst = 50;

        public boolean isTokenBucket() { return "token-bucket".equalsIgnoreCase(mode); }

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }
        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }
        public int getBurst() { return burst; }
        public void setBurst(int burst) { this.burst = burst; }
    }

    public static class Wheel {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数, <=0 不限） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Sizer {
        private int min = 5;
        private int max = 100;
        private int optimal = 20;

        public int getMin() { return min; }
        public void setMin(int min) { this.min = min; }
        public int getMax() { return max; }
        public void setMax(int max) { this.max = max; }
        public int getOptimal() { return optimal; }
        public void setOptimal(int optimal) { this.optimal = optimal; }
    }

    public static class Cost {
        /** standard | premium | economy | 自定义注册名 */
        private String priceTable = "standard";

        /** 预估时每任务计入的附加单位 */
        private long auxiliaryUnitsPerTask = 1600;

        public String getPriceTable() { return priceTable; }
        public void setPriceTable(String priceTable) { this.priceTable = priceTable; }
        public long getAuxiliaryUnitsPerTask() { return auxiliaryUnitsPerTask; }
        public void setAuxiliaryUnitsPerTask(long auxiliaryUnitsPerTask) { this.auxiliaryUnitsPerTask = auxiliaryUnitsPerTask; }
    }

    public static class Progress {
        /** 未指定监听器时是否打印进度日志 */
        private boolean logEnabled = true;

        public boolean isLogEnabled() { return logEnabled; }
        public void setLogEnabled(boolean logEnabled) { this.logEnabled = logEnabled; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    @Override
    public void afterPropertiesSet() {
        if (concurrency <= 0) {
            throw new BatchConfigurationException("batch.concurrency must be > 0, got " + concurrency);
        }
        if (taskTimeout == null || taskTimeout.isNegative() || taskTimeout.isZero()) {
            throw new BatchConfigurationException("batch.task-timeout must be > 0");
        }
        if (rateLimit.getDelay().isNegative()) {
            throw new BatchConfigurationException("batch.rate-limit.delay must be >= 0");
        }
        if (rateLimit.isTokenBucket() && (rateLimit.getRequestsPerMinute() <= 0 || rateLimit.getBurst() <= 0)) {
            throw new BatchConfigurationException("batch.rate-limit requests-per-minute and burst must be > 0");
        }
        if (wheel.getTickDuration().isNegative() || wheel.getTickDuration().isZero()) {
            throw new BatchConfigurationException("batch.wheel.tick-duration must be > 0");
        }
        defaultRetryPolicy().validate();
    }

    /**
     * 全局默认重试策略
     */
    public RetryPolicy defaultRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(retry.getAttempts())
                .baseDelayMs(retry.getDelay().toMillis())
                .backoffMultiplier(retry.getMultiplier())
                .jitterRatio(retry.getJitterRatio())
                .maxDelayMs(retry.getMaxDelay().toMillis())
                .backoffStrategy(retry.getStrategy())
                .perTaskTimeoutMs(taskTimeout.toMillis())
                .build();
    }

    // ----------------- getters/setters 顶层 -----------------

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    public Duration getTaskTimeout() { return taskTimeout; }
    public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Sizer getSizer() { return sizer; }
    public void setSizer(Sizer sizer) { this.sizer = sizer; }

    public Cost getCost() { return cost; }
    public void setCost(Cost cost) { this.cost = cost; }

    public Progress getProgress() { return progress; }
    public void setProgress(Progress progress) { this.progress = progress; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }
}

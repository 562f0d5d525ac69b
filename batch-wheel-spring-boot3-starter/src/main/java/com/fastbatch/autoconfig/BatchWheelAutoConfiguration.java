package com.fastbatch.autoconfig;

import com.fastbatch.config.BatchWheelProperties;
import com.fastbatch.core.backoff.BackoffRegistry;
import com.fastbatch.core.cost.PriceTableRegistry;
import com.fastbatch.core.engine.BatchEngineLifecycle;
import com.fastbatch.core.engine.BatchExecutionEngine;
import com.fastbatch.core.engine.WheelRetryScheduler;
import com.fastbatch.core.handler.GuardedWorkExecutor;
import com.fastbatch.core.metric.BatchMetrics;
import com.fastbatch.core.progress.listener.LoggingProgressListener;
import com.fastbatch.core.ratelimit.TokenBucketRateLimiter;
import com.fastbatch.core.report.BatchReportWriter;
import com.fastbatch.core.retry.RetryController;
import com.fastbatch.core.sizing.AdaptiveBatchSizer;
import com.fastbatch.core.spi.BackoffPolicy;
import com.fastbatch.core.spi.RateLimiter;
import com.fastbatch.core.spi.RetryScheduler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.core.spi.progress.ProgressListener;
import com.fastbatch.core.time.TimeSource;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮及批处理引擎组件
 */
@AutoConfiguration(after = {
        BatchWheelMetricsAutoConfiguration.class,
        BatchGuardAutoConfiguration.class,
        FailureDeciderAutoConfiguration.class
})
@EnableConfigurationProperties(BatchWheelProperties.class)
public class BatchWheelAutoConfiguration {

    /**
     * 时间轮, 承载重试退避
     */
    @Bean(name = "batchWheelTimer", destroyMethod = "stop")
    @ConditionalOnMissingBean(name = "batchWheelTimer")
    public HashedWheelTimer batchWheelTimer(BatchWheelProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("batch-wheel-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    @Bean
    @ConditionalOnMissingBean(RetryScheduler.class)
    public RetryScheduler retryScheduler(HashedWheelTimer batchWheelTimer) {
        return new WheelRetryScheduler(batchWheelTimer);
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(@Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(discoveredPolicies);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryController retryController(BackoffRegistry backoffRegistry) {
        return new RetryController(backoffRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public PriceTableRegistry priceTableRegistry() {
        return new PriceTableRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public AdaptiveBatchSizer adaptiveBatchSizer(BatchWheelProperties props) {
        BatchWheelProperties.Sizer s = props.getSizer();
        return new AdaptiveBatchSizer(s.getMin(), s.getMax(), s.getOptimal());
    }

    /**
     * token-bucket 模式下所有批次共用一个令牌桶
     */
    @Bean
    @ConditionalOnMissingBean(RateLimiter.class)
    @ConditionalOnProperty(prefix = "batch.rate-limit", name = "mode", havingValue = "token-bucket")
    public RateLimiter batchRateLimiter(BatchWheelProperties props) {
        BatchWheelProperties.RateLimit rl = props.getRateLimit();
        return new TokenBucketRateLimiter("batch", rl.getRequestsPerMinute(), rl.getBurst());
    }

    @Bean
    @ConditionalOnMissingBean(ProgressListener.class)
    @ConditionalOnProperty(prefix = "batch.progress", name = "log-enabled", havingValue = "true", matchIfMissing = true)
    public ProgressListener loggingProgressListener() {
        return new LoggingProgressListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchReportWriter batchReportWriter() {
        return new BatchReportWriter();
    }

    /**
     * 批处理引擎
     */
    @Bean
    @ConditionalOnMissingBean
    public BatchExecutionEngine batchExecutionEngine(BatchWheelProperties props,
                                                     RetryController retryController,
                                                     FailureDecider failureDecider,
                                                     GuardedWorkExecutor guard,
                                                     RetryScheduler retryScheduler,
                                                     ObjectProvider<RateLimiter> sharedRateLimiter,
                                                     PriceTableRegistry priceTables,
                                                     BatchMetrics metrics,
                                                     ObjectProvider<ProgressListener> listener) {
        return new BatchExecutionEngine(props, retryController, failureDecider, guard, retryScheduler,
                sharedRateLimiter.getIfUnique(), priceTables, metrics, listener.getIfUnique(), TimeSource.SYSTEM);
    }

    @Bean
    public BatchEngineLifecycle batchEngineLifecycle(BatchExecutionEngine engine, BatchWheelProperties props) {
        return new BatchEngineLifecycle(engine, props);
    }
}

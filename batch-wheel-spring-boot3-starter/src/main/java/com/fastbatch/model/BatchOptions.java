package com.fastbatch.model;

import com.fastbatch.core.cost.CostLedger;
import com.fastbatch.core.engine.CancellationSignal;
import com.fastbatch.core.perf.PerformanceTracker;
import com.fastbatch.core.spi.RateLimiter;
import com.fastbatch.core.spi.UsageExtractor;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.core.spi.progress.ProgressListener;
import lombok.Builder;
import lombok.Getter;

/**
 * 单批次选项, 未设置的项取 batch.* 全局配置
 */
@Getter
@Builder(toBuilder = true)
public class BatchOptions<R> {

    /** 日志与指标中的批次标识 */
    private String batchId;

    /** 同时在途的工作函数上限 */
    private Integer concurrency;
    private Integer retryAttempts;
    private Long retryDelayMs;
    private Double backoffMultiplier;
    private Double jitterRatio;
    private Long maxRetryDelayMs;
    /** fixed | exponential | spi:{name} */
    private String backoffStrategy;
    private Long taskTimeoutMs;
    /** 相邻两次派发的最小间隔 */
    private Long rateLimitDelayMs;

    private ProgressListener progressListener;

    /** 跨批共享的限流器, 为空时按 rateLimitDelayMs 新建 */
    private RateLimiter rateLimiter;

    /** 覆盖全局失败判定 */
    private FailureDecider failureDecider;

    /** 为空时每批新建 */
    private PerformanceTracker tracker;

    /** 为空时每批新建 */
    private CostLedger ledger;

    private UsageExtractor<R> usageExtractor;

    private CancellationSignal cancellation;

    public static <R> BatchOptions<R> defaults() {
        return BatchOptions.<R>builder().build();
    }
}

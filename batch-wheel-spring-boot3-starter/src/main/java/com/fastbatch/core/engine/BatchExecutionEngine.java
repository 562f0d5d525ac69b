package com.fastbatch.core.engine;

import com.fastbatch.config.BatchWheelProperties;
import com.fastbatch.core.cost.CostLedger;
import com.fastbatch.core.cost.PriceTableRegistry;
import com.fastbatch.core.handler.GuardedWorkExecutor;
import com.fastbatch.core.metric.BatchMetrics;
import com.fastbatch.core.perf.PerformanceTracker;
import com.fastbatch.core.progress.ProgressPublisher;
import com.fastbatch.core.ratelimit.SpacingRateLimiter;
import com.fastbatch.core.retry.RetryController;
import com.fastbatch.core.sizing.AdaptiveBatchSizer;
import com.fastbatch.core.spi.RateLimiter;
import com.fastbatch.core.spi.RetryScheduler;
import com.fastbatch.core.spi.TaskWorker;
import com.fastbatch.core.spi.UsageExtractor;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.core.spi.progress.ProgressListener;
import com.fastbatch.core.time.TimeSource;
import com.fastbatch.exception.BatchConfigurationException;
import com.fastbatch.model.BatchOptions;
import com.fastbatch.model.BatchResult;
import com.fastbatch.model.BatchTask;
import com.fastbatch.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 批处理核心引擎
 * 单批内任务失败不会中断批次, 返回结果与提交顺序一一对应
 */
public class BatchExecutionEngine {

    Logger log = LoggerFactory.getLogger(BatchExecutionEngine.class);

    /** 配置 */
    private final BatchWheelProperties props;

    private final RetryController retryController;

    /** 失败判定器 */
    private final FailureDecider failureDecider;

    /** 熔断装饰 */
    private final GuardedWorkExecutor guard;

    /** 退避调度（时间轮） */
    private final RetryScheduler retryScheduler;

    /** token-bucket 模式下跨批共享, spacing 模式为 null */
    private final RateLimiter sharedRateLimiter;

    private final PriceTableRegistry priceTables;

    /** 指标 */
    private final BatchMetrics metrics;

    /** 未指定监听器时使用, 可为 null */
    private final ProgressListener defaultListener;

    private final TimeSource time;

    /** 引擎运行状态 */
    private final AtomicBoolean running = new AtomicBoolean(true);

    private final AtomicLong batchSeq = new AtomicLong();

    private final Set<BatchRunner<?, ?>> activeRuns = ConcurrentHashMap.newKeySet();

    public BatchExecutionEngine(BatchWheelProperties props,
                                RetryController retryController,
                                FailureDecider failureDecider,
                                GuardedWorkExecutor guard,
                                RetryScheduler retryScheduler,
                                RateLimiter sharedRateLimiter,
                                PriceTableRegistry priceTables,
                                BatchMetrics metrics,
                                ProgressListener defaultListener,
                                TimeSource time) {
        this.props = props;
        this.retryController = retryController;
        this.failureDecider = failureDecider;
        this.guard = guard;
        this.retryScheduler = retryScheduler;
        this.sharedRateLimiter = sharedRateLimiter;
        this.priceTables = priceTables;
        this.metrics = metrics;
        this.defaultListener = defaultListener;
        this.time = time == null ? TimeSource.SYSTEM : time;
    }

    /**
     * 阻塞直到批次内所有任务进入终态; 等待被中断时取消批次
     */
    public <P, R> List<BatchResult<R>> processBatch(List<BatchTask<P>> tasks, TaskWorker<P, R> workFn,
                                                    BatchOptions<R> options) throws InterruptedException {
        BatchRun<R> run = submitBatch(tasks, workFn, options);
        try {
            return run.await();
        } catch (InterruptedException ie) {
            run.cancel();
            throw ie;
        }
    }

    public <P, R> List<BatchResult<R>> processBatch(List<BatchTask<P>> tasks, TaskWorker<P, R> workFn)
            throws InterruptedException {
        return processBatch(tasks, workFn, null);
    }

    /**
     * 非阻塞提交, 返回批次句柄
     * 配置非法时在派发前抛出 BatchConfigurationException
     */
    public <P, R> BatchRun<R> submitBatch(List<BatchTask<P>> tasks, TaskWorker<P, R> workFn,
                                          BatchOptions<R> options) {
        if (!running.get()) {
            throw new IllegalStateException("batch engine is stopped, reject batch submit");
        }
        BatchOptions<R> opt = options == null ? BatchOptions.defaults() : options;
        validateInput(tasks, workFn);

        int concurrency = opt.getConcurrency() != null ? opt.getConcurrency() : props.getConcurrency();
        if (concurrency <= 0) {
            throw new BatchConfigurationException("concurrency must be > 0, got " + concurrency);
        }
        RetryPolicy policy = resolvePolicy(opt).validate();
        RateLimiter limiter = resolveRateLimiter(opt);

        String batchId = opt.getBatchId() != null ? opt.getBatchId() : "batch-" + batchSeq.incrementAndGet();
        CancellationSignal signal = opt.getCancellation() != null ? opt.getCancellation() : new CancellationSignal();
        PerformanceTracker tracker = opt.getTracker() != null ? opt.getTracker() : newTracker();
        CostLedger ledger = opt.getLedger() != null ? opt.getLedger() : newLedger();
        UsageExtractor<R> extractor = opt.getUsageExtractor() != null ? opt.getUsageExtractor() : UsageExtractor.none();
        FailureDecider decider = opt.getFailureDecider() != null ? opt.getFailureDecider() : failureDecider;
        ProgressListener listener = opt.getProgressListener() != null ? opt.getProgressListener() : defaultListener;

        BatchRun<R> run = new BatchRun<>(batchId, tasks.size(), signal);
        BatchRunner<P, R> runner = new BatchRunner<>(this, run, List.copyOf(tasks), workFn, concurrency, policy,
                limiter, decider, tracker, ledger, extractor, new ProgressPublisher(listener, metrics));
        activeRuns.add(runner);
        runner.start();
        return run;
    }

    /**
     * 按 sizer 切分后逐批执行, 各批共用同一个 tracker 与 ledger
     */
    public <P, R> List<BatchResult<R>> processInChunks(List<BatchTask<P>> tasks, TaskWorker<P, R> workFn,
                                                       BatchOptions<R> options, AdaptiveBatchSizer sizer)
            throws InterruptedException {
        BatchOptions<R> base = options == null ? BatchOptions.defaults() : options;
        validateInput(tasks, workFn);
        PerformanceTracker tracker = base.getTracker() != null ? base.getTracker() : newTracker();
        CostLedger ledger = base.getLedger() != null ? base.getLedger() : newLedger();
        CancellationSignal signal = base.getCancellation() != null ? base.getCancellation() : new CancellationSignal();
        String prefix = base.getBatchId() != null ? base.getBatchId() : "batch-" + batchSeq.incrementAndGet();

        List<BatchResult<R>> out = new ArrayList<>(tasks.size());
        int offset = 0, chunk = 0;
        while (offset < tasks.size()) {
            int size = Math.max(1, sizer.next(tasks.size() - offset));
            List<BatchTask<P>> slice = tasks.subList(offset, Math.min(tasks.size(), offset + size));
            BatchOptions<R> chunkOptions = base.toBuilder()
                    .batchId(prefix + "-" + (++chunk))
                    .tracker(tracker)
                    .ledger(ledger)
                    .cancellation(signal)
                    .build();
            out.addAll(processBatch(slice, workFn, chunkOptions));
            offset += slice.size();
        }
        return out;
    }

    public PerformanceTracker newTracker() {
        return new PerformanceTracker(time);
    }

    /**
     * 按 batch.cost.* 配置新建台账
     */
    public CostLedger newLedger() {
        return new CostLedger(priceTables.resolve(props.getCost().getPriceTable()),
                props.getCost().getAuxiliaryUnitsPerTask());
    }

    public boolean isRunning() {
        return running.get();
    }

    public int activeRunCount() {
        return activeRuns.size();
    }

    private static <P> void validateInput(List<BatchTask<P>> tasks, TaskWorker<P, ?> workFn) {
        if (tasks == null) {
            throw new BatchConfigurationException("tasks must not be null");
        }
        if (workFn == null) {
            throw new BatchConfigurationException("workFn must not be null");
        }
        Set<String> ids = new HashSet<>();
        for (BatchTask<P> t : tasks) {
            if (t == null) {
                throw new BatchConfigurationException("tasks must not contain null");
            }
            if (!ids.add(t.getId())) {
                throw new BatchConfigurationException("duplicate task id: " + t.getId());
            }
        }
    }

    /**
     * 未设置的项取全局默认
     */
    private RetryPolicy resolvePolicy(BatchOptions<?> opt) {
        RetryPolicy.RetryPolicyBuilder b = props.defaultRetryPolicy().toBuilder();
        if (opt.getRetryAttempts() != null) {
            b.maxAttempts(opt.getRetryAttempts());
        }
        if (opt.getRetryDelayMs() != null) {
            b.baseDelayMs(opt.getRetryDelayMs());
        }
        if (opt.getBackoffMultiplier() != null) {
            b.backoffMultiplier(opt.getBackoffMultiplier());
        }
        if (opt.getJitterRatio() != null) {
            b.jitterRatio(opt.getJitterRatio());
        }
        if (opt.getMaxRetryDelayMs() != null) {
            b.maxDelayMs(opt.getMaxRetryDelayMs());
        }
        if (opt.getBackoffStrategy() != null) {
            b.backoffStrategy(opt.getBackoffStrategy());
        }
        if (opt.getTaskTimeoutMs() != null) {
            b.perTaskTimeoutMs(opt.getTaskTimeoutMs());
        }
        return b.build();
    }

    /**
     * 显式传入 > 全局共享（token-bucket） > 按间隔新建
     */
    private RateLimiter resolveRateLimiter(BatchOptions<?> opt) {
        if (opt.getRateLimiter() != null) {
            return opt.getRateLimiter();
        }
        if (opt.getRateLimitDelayMs() == null && sharedRateLimiter != null) {
            return sharedRateLimiter;
        }
        long delayMs = opt.getRateLimitDelayMs() != null
                ? opt.getRateLimitDelayMs() : props.getRateLimit().getDelay().toMillis();
        if (delayMs < 0) {
            throw new BatchConfigurationException("rateLimitDelayMs must be >= 0, got " + delayMs);
        }
        return new SpacingRateLimiter(delayMs, time);
    }

    /**
     * 停止接收新批次, 取消在途批次并等待其收尾, 超时强制结束, 最后停止时间轮
     */
    protected void gracefulShutdown(long awaitMillis) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        List<BatchRunner<?, ?>> runners = new ArrayList<>(activeRuns);
        runners.forEach(r -> r.run().cancel());

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(1, awaitMillis));
        int forced = 0;
        for (BatchRunner<?, ?> r : runners) {
            long left = deadline - System.nanoTime();
            try {
                r.run().await(Math.max(0, left), TimeUnit.NANOSECONDS);
            } catch (TimeoutException te) {
                forced++;
                log.warn("[Batch-Engine] batchId={} not finished within {} ms, forcing stop", r.run().getBatchId(), awaitMillis);
                r.forceStop();
            } catch (InterruptedException ie) {
                r.forceStop();
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.warn("[Batch-Engine] batchId={} finished with error during shutdown", r.run().getBatchId(), e);
            }
        }
        int drained = retryScheduler.stop();
        log.info("[Batch-Engine] graceful shutdown done, cancelledRuns={} forcedRuns={} drainedRetries={}",
                runners.size(), forced, drained);
    }

    void onRunFinished(BatchRunner<?, ?> runner) {
        activeRuns.remove(runner);
    }

    RetryController retryController() {
        return retryController;
    }

    GuardedWorkExecutor guard() {
        return guard;
    }

    RetryScheduler retryScheduler() {
        return retryScheduler;
    }

    BatchMetrics metrics() {
        return metrics;
    }

    TimeSource time() {
        return time;
    }
}

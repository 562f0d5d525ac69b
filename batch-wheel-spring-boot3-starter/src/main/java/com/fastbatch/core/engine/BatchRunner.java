package com.fastbatch.core.engine;

import com.fastbatch.core.cost.CostLedger;
import com.fastbatch.core.cost.UnitUsage;
import com.fastbatch.core.perf.PerformanceMetrics;
import com.fastbatch.core.perf.PerformanceTracker;
import com.fastbatch.core.progress.ProgressPublisher;
import com.fastbatch.core.report.BatchReport;
import com.fastbatch.core.retry.RetryDecision;
import com.fastbatch.core.spi.RateLimiter;
import com.fastbatch.core.spi.TaskWorker;
import com.fastbatch.core.spi.UsageExtractor;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.model.BatchResult;
import com.fastbatch.model.BatchTask;
import com.fastbatch.model.ErrorDescriptor;
import com.fastbatch.model.ProgressSnapshot;
import com.fastbatch.model.RetryPolicy;
import com.fastbatch.model.TaskAttempt;
import com.fastbatch.model.ctx.TaskContext;
import com.fastbatch.model.enums.AttemptOutcome;
import com.fastbatch.model.enums.TaskState;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个批次的执行
 * concurrency 个工作槽从优先队列取任务, 过限流闸门后交给同样大小的 handler 线程池执行,
 * 失败按 RetryController 决策挂到时间轮退避, 退避期间不占工作槽
 */
final class BatchRunner<P, R> {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    /** 工作槽空闲轮询间隔 */
    private static final long POLL_MILLIS = 50;

    private static final long PROGRESS_FLUSH_MILLIS = 5_000;

    private final BatchExecutionEngine engine;

    private final BatchRun<R> run;

    private final String batchId;

    private final TaskWorker<P, R> workFn;

    private final int concurrency;

    private final RetryPolicy policy;

    private final RateLimiter limiter;

    private final FailureDecider decider;

    private final PerformanceTracker tracker;

    private final CostLedger ledger;

    private final UsageExtractor<R> extractor;

    private final ProgressPublisher publisher;

    private final List<TaskExecution<P>> executions;

    private final PriorityBlockingQueue<TaskExecution<P>> queue;

    private final CountDownLatch remaining;

    private final AtomicBoolean finished = new AtomicBoolean(false);

    private final AtomicInteger cancelledCount = new AtomicInteger();

    private volatile ExecutorService workerPool;

    private volatile ExecutorService handlerPool;

    private final Object progressLock = new Object();

    // guarded by progressLock
    private int completed;
    private int succeeded;
    private int failed;
    private long retriesTotal;
    private long durationTotal;

    private long startedAt;

    BatchRunner(BatchExecutionEngine engine, BatchRun<R> run, List<BatchTask<P>> tasks, TaskWorker<P, R> workFn,
                int concurrency, RetryPolicy policy, RateLimiter limiter, FailureDecider decider,
                PerformanceTracker tracker, CostLedger ledger, UsageExtractor<R> extractor,
                ProgressPublisher publisher) {
        this.engine = engine;
        this.run = run;
        this.batchId = run.getBatchId();
        this.workFn = workFn;
        this.concurrency = concurrency;
        this.policy = policy;
        this.limiter = limiter;
        this.decider = decider;
        this.tracker = tracker;
        this.ledger = ledger;
        this.extractor = extractor;
        this.publisher = publisher;
        this.executions = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            executions.add(new TaskExecution<>(tasks.get(i), i));
        }
        this.queue = new PriorityBlockingQueue<>(Math.max(1, tasks.size()), TaskExecution.DISPATCH_ORDER);
        this.remaining = new CountDownLatch(tasks.size());
    }

    BatchRun<R> run() {
        return run;
    }

    void start() {
        startedAt = engine.time().nowMillis();
        tracker.start();
        tracker.expect(executions.size());
        engine.metrics().incEnqueued(executions.size());
        log.info("[Batch-Engine] batch start, batchId={} tasks={} concurrency={} maxAttempts={} timeoutMs={}",
                batchId, executions.size(), concurrency, policy.getMaxAttempts(), policy.getPerTaskTimeoutMs());
        if (executions.isEmpty()) {
            finish();
            return;
        }
        queue.addAll(executions);
        handlerPool = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory("batch-handler-" + batchId));
        workerPool = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory("batch-worker-" + batchId));
        run.cancellation().onCancel(this::cancelWaiting);
        for (int i = 0; i < concurrency; i++) {
            // 并发取消可能已结束批次并关闭线程池
            if (finished.get()) {
                return;
            }
            try {
                workerPool.execute(this::workLoop);
            } catch (RejectedExecutionException rejected) {
                log.debug("[Batch-Engine] batch finished while starting workers, batchId={} started={}", batchId, i);
                return;
            }
        }
    }

    /**
     * 工作槽主循环, 直到所有任务进入终态
     */
    private void workLoop() {
        while (remaining.getCount() > 0) {
            TaskExecution<P> exec;
            try {
                exec = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("[Dispatch] worker interrupted, batchId={}", batchId);
                return;
            }
            if (exec == null) {
                continue;
            }
            try {
                dispatch(exec);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("[Dispatch] worker interrupted, batchId={} taskId={}", batchId, exec.getTask().getId());
                abort(exec, shutdownError());
                return;
            } catch (Throwable t) {
                // 工作槽不因单个任务异常退出
                log.error("[Dispatch] engine error, batchId={} taskId={}", batchId, exec.getTask().getId(), t);
                abort(exec, ErrorDescriptor.of(ErrorDescriptor.CODE_ENGINE_ERROR, "ENGINE", t));
            }
        }
    }

    /**
     * 取消检查 → 限流 → 取消检查 → 带超时执行
     */
    private void dispatch(TaskExecution<P> exec) throws InterruptedException {
        if (run.isCancelled()) {
            cancelOne(exec);
            return;
        }
        limiter.awaitSlot();
        if (run.isCancelled()) {
            cancelOne(exec);
            return;
        }
        if (!exec.begin()) {
            // 已被取消
            return;
        }
        BatchTask<P> task = exec.getTask();
        int attemptNo = exec.nextAttemptNumber();
        long start = engine.time().nowMillis();
        long startNanos = System.nanoTime();

        Future<R> f = handlerPool.submit(() -> engine.guard().execute(task, workFn));
        R value = null;
        Throwable error = null;
        AttemptOutcome outcome;
        try {
            value = f.get(policy.getPerTaskTimeoutMs(), TimeUnit.MILLISECONDS);
            outcome = AttemptOutcome.SUCCESS;
        } catch (TimeoutException te) {
            f.cancel(true);
            outcome = AttemptOutcome.TIMEOUT;
            error = new TimeoutException("[Dispatch] task " + task.getId() + " attempt " + attemptNo
                    + " timed out after " + policy.getPerTaskTimeoutMs() + " ms");
            engine.metrics().incTimeout();
        } catch (ExecutionException ee) {
            outcome = AttemptOutcome.FAILURE;
            error = ee.getCause() == null ? ee : ee.getCause();
        } catch (InterruptedException ie) {
            f.cancel(true);
            throw ie;
        }
        engine.metrics().recordExecNanos(System.nanoTime() - startNanos);

        TaskAttempt attempt = new TaskAttempt(task.getId(), attemptNo, start, engine.time().nowMillis(), outcome);
        exec.recordAttempt(attempt);
        tracker.recordAttempt(attempt);

        if (outcome == AttemptOutcome.SUCCESS) {
            if (exec.transit(TaskState.ATTEMPTING, TaskState.SUCCEEDED)) {
                BatchResult<R> result = BatchResult.<R>builder()
                        .taskId(task.getId())
                        .succeeded(true)
                        .value(value)
                        .durationMs(exec.getDurationMs())
                        .retriesUsed(exec.retriesUsed())
                        .build();
                finalizeResult(exec, result, value, true);
            }
            return;
        }
        handleFailure(exec, error, attemptNo);
    }

    /**
     * 失败处理
     */
    private void handleFailure(TaskExecution<P> exec, Throwable error, int attemptNo) {
        BatchTask<P> task = exec.getTask();
        TaskContext ctx = TaskContext.builder()
                .batchId(batchId)
                .taskId(task.getId())
                .priority(task.getPriority())
                .err(String.valueOf(error.getMessage()))
                .attempt(attemptNo)
                .maxAttempts(policy.getMaxAttempts())
                .build();
        RetryDecision d = engine.retryController().decide(error, ctx, policy, decider);

        // 不可重试或者达到最大重试次数
        if (!d.isRetry()) {
            if (exec.transit(TaskState.ATTEMPTING, TaskState.FAILED)) {
                log.warn("[Task-Failed] batchId={} taskId={} attempts={} reason={} err={}",
                        batchId, task.getId(), exec.getAttempts(), d.getReason(), error.toString());
                ErrorDescriptor desc = ErrorDescriptor.of(d.getReason(), d.getDecision().getCategory().name(), error);
                finalizeResult(exec, failedResult(exec, desc), null, true);
            }
            return;
        }
        // 批次已取消, 不再安排重试
        if (run.isCancelled()) {
            if (exec.transit(TaskState.ATTEMPTING, TaskState.FAILED)) {
                ErrorDescriptor desc = ErrorDescriptor.of(ErrorDescriptor.CODE_CANCELLED, "CANCELLED", error);
                finalizeResult(exec, failedResult(exec, desc), null, true);
            }
            return;
        }
        if (!exec.transit(TaskState.ATTEMPTING, TaskState.RETRYING)) {
            return;
        }
        engine.metrics().incRetried();
        log.info("[Task-Retry] batchId={} taskId={} attempt={} delayMs={} reason={}",
                batchId, task.getId(), attemptNo + 1, d.getDelayMs(), d.getReason());
        // 挂到时间轮, 到期放回队列
        exec.setPendingRetry(engine.retryScheduler().schedule(task.getId(), d.getDelayMs(), () -> requeue(exec)));
    }

    private void requeue(TaskExecution<P> exec) {
        if (exec.getState() == TaskState.RETRYING) {
            queue.offer(exec);
        }
    }

    /**
     * 取消回调: 结束所有未派发与退避中的任务
     */
    private void cancelWaiting() {
        int before = cancelledCount.get();
        for (TaskExecution<P> exec : executions) {
            cancelOne(exec);
        }
        log.warn("[Batch-Engine] batch cancelled, batchId={} cancelledTasks={}", batchId, cancelledCount.get() - before);
    }

    private void cancelOne(TaskExecution<P> exec) {
        if (exec.cancelIfWaiting()) {
            cancelledCount.incrementAndGet();
            engine.metrics().incCancelled();
            finalizeResult(exec, failedResult(exec, ErrorDescriptor.cancelled()), null, false);
        }
    }

    /**
     * 异常或停机时强制结束
     */
    private void abort(TaskExecution<P> exec, ErrorDescriptor error) {
        if (exec.transit(TaskState.ATTEMPTING, TaskState.FAILED)) {
            finalizeResult(exec, failedResult(exec, error), null, true);
        } else if (exec.cancelIfWaiting()) {
            cancelledCount.incrementAndGet();
            engine.metrics().incCancelled();
            finalizeResult(exec, failedResult(exec, error), null, false);
        }
    }

    private BatchResult<R> failedResult(TaskExecution<P> exec, ErrorDescriptor error) {
        return BatchResult.<R>builder()
                .taskId(exec.getTask().getId())
                .succeeded(false)
                .error(error)
                .durationMs(exec.getDurationMs())
                .retriesUsed(exec.retriesUsed())
                .build();
    }

    /**
     * 写结果槽; record 为 false 时（派发前取消）不计入统计、成本与进度
     */
    private void finalizeResult(TaskExecution<P> exec, BatchResult<R> result, R value, boolean record) {
        if (!run.setResult(exec.getIndex(), result)) {
            log.error("[Batch-Engine] duplicate result ignored, batchId={} taskId={}", batchId, result.getTaskId());
            return;
        }
        if (record) {
            tracker.recordTask(result.getDurationMs(), result.getRetriesUsed(), !result.isSucceeded());
            ledger.trackUsage(extractUsage(exec.getTask(), value));
            engine.metrics().recordAttempts(exec.getAttempts());
            if (result.isSucceeded()) {
                engine.metrics().incSuccess();
            } else {
                engine.metrics().incFailed();
            }
            synchronized (progressLock) {
                completed++;
                if (result.isSucceeded()) {
                    succeeded++;
                } else {
                    failed++;
                }
                retriesTotal += result.getRetriesUsed();
                durationTotal += result.getDurationMs();
                ProgressSnapshot snapshot = snapshot();
                run.setLatest(snapshot);
                publisher.publish(snapshot);
            }
        }
        remaining.countDown();
        if (remaining.getCount() == 0) {
            finish();
        }
    }

    private UnitUsage extractUsage(BatchTask<P> task, R value) {
        try {
            UnitUsage usage = extractor.extract(task, value);
            return usage == null ? UnitUsage.ZERO : usage;
        } catch (RuntimeException e) {
            log.error("[Cost] usage extractor failed, batchId={} taskId={}", batchId, task.getId(), e);
            return UnitUsage.ZERO;
        }
    }

    // guarded by progressLock
    private ProgressSnapshot snapshot() {
        long elapsed = Math.max(0, engine.time().nowMillis() - startedAt);
        return ProgressSnapshot.builder()
                .batchId(batchId)
                .completed(completed)
                .succeeded(succeeded)
                .failed(failed)
                .total(executions.size())
                .elapsedMs(elapsed)
                .averageDurationMs((double) durationTotal / completed)
                .throughputPerSec(elapsed > 0 ? completed / (elapsed / 1000.0) : 0)
                .successRate((double) succeeded / completed)
                .errorRate((double) failed / completed)
                .retryRate((double) retriesTotal / completed)
                .build();
    }

    private void finish() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        shutdownPools(false);
        try {
            publisher.flush(PROGRESS_FLUSH_MILLIS);
        } catch (InterruptedException ie) {
            publisher.close();
            Thread.currentThread().interrupt();
        }
        try {
            PerformanceMetrics m = tracker.getMetrics(concurrency);
            BatchReport report = BatchReport.of(m, ledger);
            int ok, ko;
            synchronized (progressLock) {
                ok = succeeded;
                ko = failed;
            }
            log.info("[Batch-Engine] batch done, batchId={} succeeded={} failed={} cancelled={} durationMs={} " +
                            "throughput={}/s p50={} p95={} p99={} cost={}",
                    batchId, ok, ko, cancelledCount.get(), report.getTotalDurationMs(),
                    String.format("%.2f", report.getThroughputPerSec()),
                    report.getP50(), report.getP95(), report.getP99(),
                    CostLedger.formatCost(report.getCumulativeCost()));
            run.complete(report);
        } catch (RuntimeException e) {
            log.error("[Batch-Engine] failed to build report, batchId={}", batchId, e);
            run.completeExceptionally(e);
        } finally {
            engine.onRunFinished(this);
        }
    }

    /**
     * 停机超时后强制结束: 中断工作槽与 handler, 剩余任务直接落终态
     */
    void forceStop() {
        shutdownPools(true);
        ErrorDescriptor error = shutdownError();
        for (TaskExecution<P> exec : executions) {
            if (!exec.getState().isTerminal()) {
                abort(exec, error);
            }
        }
    }

    private void shutdownPools(boolean now) {
        ExecutorService workers = workerPool;
        ExecutorService handlers = handlerPool;
        if (workers != null) {
            if (now) {
                workers.shutdownNow();
            } else {
                workers.shutdown();
            }
        }
        if (handlers != null) {
            // 仅剩超时被放弃的调用
            handlers.shutdownNow();
        }
    }

    private static ErrorDescriptor shutdownError() {
        return new ErrorDescriptor(ErrorDescriptor.CODE_CANCELLED, "CANCELLED", null, "batch engine shutdown");
    }
}

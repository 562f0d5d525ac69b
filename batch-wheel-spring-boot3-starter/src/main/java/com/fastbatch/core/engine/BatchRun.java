package com.fastbatch.core.engine;

import com.fastbatch.core.report.BatchReport;
import com.fastbatch.model.BatchResult;
import com.fastbatch.model.ProgressSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * 已提交批次的句柄
 * 结果按提交顺序返回, 每个任务恰好一条
 */
public final class BatchRun<R> {

    private final String batchId;

    private final AtomicReferenceArray<BatchResult<R>> results;

    private final CancellationSignal cancellation;

    private final CompletableFuture<BatchReport> done = new CompletableFuture<>();

    private volatile ProgressSnapshot latest;

    BatchRun(String batchId, int total, CancellationSignal cancellation) {
        this.batchId = batchId;
        this.results = new AtomicReferenceArray<>(total);
        this.cancellation = cancellation;
    }

    public String getBatchId() {
        return batchId;
    }

    public int size() {
        return results.length();
    }

    /**
     * 协作式取消: 在途任务照常完成, 未派发和退避中的任务以 CANCELLED 结束
     */
    public boolean cancel() {
        return cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isDone() {
        return done.isDone();
    }

    public List<BatchResult<R>> await() throws InterruptedException {
        try {
            done.get();
        } catch (ExecutionException e) {
            throw failure(e);
        }
        return results();
    }

    public List<BatchResult<R>> await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            done.get(timeout, unit);
        } catch (ExecutionException e) {
            throw failure(e);
        }
        return results();
    }

    /**
     * 批次结束后可用
     */
    public List<BatchResult<R>> results() {
        ensureDone();
        List<BatchResult<R>> out = new ArrayList<>(results.length());
        for (int i = 0; i < results.length(); i++) {
            BatchResult<R> r = results.get(i);
            if (r == null) {
                throw new IllegalStateException("batch " + batchId + " finished without a result at index " + i);
            }
            out.add(r);
        }
        return Collections.unmodifiableList(out);
    }

    public BatchReport report() {
        ensureDone();
        return done.join();
    }

    /**
     * 最近一次进度快照, 尚无任务完成时为 null
     */
    public ProgressSnapshot latestProgress() {
        return latest;
    }

    CancellationSignal cancellation() {
        return cancellation;
    }

    /**
     * 每个下标只写一次
     */
    boolean setResult(int index, BatchResult<R> result) {
        return results.compareAndSet(index, null, result);
    }

    void setLatest(ProgressSnapshot snapshot) {
        this.latest = snapshot;
    }

    void complete(BatchReport report) {
        done.complete(report);
    }

    void completeExceptionally(Throwable t) {
        done.completeExceptionally(t);
    }

    private void ensureDone() {
        if (!done.isDone()) {
            throw new IllegalStateException("batch " + batchId + " is still running");
        }
    }

    private static RuntimeException failure(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new IllegalStateException(cause);
    }
}

package com.fastbatch.core.engine;

import com.fastbatch.core.spi.RetryScheduler;
import com.fastbatch.model.BatchTask;
import com.fastbatch.model.TaskAttempt;
import com.fastbatch.model.enums.TaskState;

import java.util.Comparator;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 批内单个任务的运行态
 * 状态迁移走 CAS, 终态只会被设置一次
 */
final class TaskExecution<P> {

    /** 优先级高者先派发, 同优先级按提交顺序 */
    static final Comparator<TaskExecution<?>> DISPATCH_ORDER =
            Comparator.<TaskExecution<?>>comparingInt(e -> e.getTask().getPriority()).reversed()
                    .thenComparingInt(TaskExecution::getIndex);

    private final BatchTask<P> task;

    /** 提交序号, 即结果下标 */
    private final int index;

    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);

    /** 已派发次数, 仅由持有该任务的工作槽修改 */
    private volatile int attempts;

    private volatile long durationMs;

    private volatile RetryScheduler.ScheduledRetry pendingRetry;

    TaskExecution(BatchTask<P> task, int index) {
        this.task = task;
        this.index = index;
    }

    boolean transit(TaskState from, TaskState to) {
        if (!from.canTransitTo(to)) {
            throw new IllegalStateException("illegal task state transition " + from + " -> " + to);
        }
        return state.compareAndSet(from, to);
    }

    /**
     * 从 PENDING 或 RETRYING 进入执行
     */
    boolean begin() {
        return transit(TaskState.PENDING, TaskState.ATTEMPTING)
                || transit(TaskState.RETRYING, TaskState.ATTEMPTING);
    }

    /**
     * 尚未派发或处于退避中则取消, 成功返回 true
     */
    boolean cancelIfWaiting() {
        if (transit(TaskState.PENDING, TaskState.CANCELLED) || transit(TaskState.RETRYING, TaskState.CANCELLED)) {
            RetryScheduler.ScheduledRetry h = pendingRetry;
            if (h != null) {
                h.cancel();
            }
            return true;
        }
        return false;
    }

    void recordAttempt(TaskAttempt attempt) {
        attempts++;
        durationMs += attempt.getDurationMs();
    }

    /** 下一次派发的尝试序号, 从0开始 */
    int nextAttemptNumber() {
        return attempts;
    }

    int retriesUsed() {
        return Math.max(0, attempts - 1);
    }

    void setPendingRetry(RetryScheduler.ScheduledRetry pendingRetry) {
        this.pendingRetry = pendingRetry;
    }

    BatchTask<P> getTask() {
        return task;
    }

    int getIndex() {
        return index;
    }

    TaskState getState() {
        return state.get();
    }

    int getAttempts() {
        return attempts;
    }

    long getDurationMs() {
        return durationMs;
    }
}

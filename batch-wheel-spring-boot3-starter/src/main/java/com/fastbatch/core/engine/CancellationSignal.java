package com.fastbatch.core.engine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消标记
 * 只在每次派发前检查, 不中断在途的工作函数
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        callbacks.forEach(Runnable::run);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void onCancel(Runnable callback) {
        callbacks.add(callback);
        // 注册前已取消
        if (cancelled.get()) {
            callback.run();
        }
    }
}

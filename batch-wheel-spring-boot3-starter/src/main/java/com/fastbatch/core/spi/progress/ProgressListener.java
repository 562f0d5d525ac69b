package com.fastbatch.core.spi.progress;

import com.fastbatch.model.ProgressSnapshot;

/**
 * 进度观察者
 * 每个任务完成（成功或终态失败）最多回调一次, 由框架串行投递
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressSnapshot snapshot);

    /**
     * 用于日志与指标纬度
     */
    default String name() {
        return getClass().getSimpleName();
    }
}

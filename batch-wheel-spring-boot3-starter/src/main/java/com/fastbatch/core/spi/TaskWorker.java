package com.fastbatch.core.spi;

import com.fastbatch.model.BatchTask;

/**
 * 批任务工作函数
 * 返回值即结果；抛异常=本次尝试失败（进入重试/失败判定）
 */
@FunctionalInterface
public interface TaskWorker<P, R> {

    R execute(BatchTask<P> task) throws Exception;
}

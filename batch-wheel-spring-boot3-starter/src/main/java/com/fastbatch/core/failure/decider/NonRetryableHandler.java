package com.fastbatch.core.failure.decider;

import com.fastbatch.core.spi.failure.FailureCaseHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.model.ctx.TaskContext;

/**
 * 按异常类型直接判定为永久失败
 * 默认注册 NonRetryableTaskException, 其余类型来自 batch.failure.non-retryable-exceptions
 */
public class NonRetryableHandler<E extends Throwable> implements FailureCaseHandler<E> {

    private final Class<E> type;

    public NonRetryableHandler(Class<E> type) {
        this.type = type;
    }

    @Override
    public Class<E> exceptionType() {
        return type;
    }

    @Override
    public FailureDecider.Decision execute(E ex, TaskContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.FAIL, FailureDecider.Category.NON_RETRYABLE)
                .withCode("NON_RETRYABLE")
                .withMsg(type.getSimpleName());
    }
}

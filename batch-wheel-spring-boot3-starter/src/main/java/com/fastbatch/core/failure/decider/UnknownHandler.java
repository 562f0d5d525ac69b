package com.fastbatch.core.failure.decider;

import com.fastbatch.core.spi.failure.FailureCaseHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.model.ctx.TaskContext;

/**
 * 未知异常兜底, batch.failure.retry-unknown 决定重试还是直接失败
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {

    private final boolean retryUnknown;

    public UnknownHandler(boolean retryUnknown) {
        this.retryUnknown = retryUnknown;
    }

    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public FailureDecider.Decision execute(Throwable ex, TaskContext ctx) {
        FailureDecider.Outcome outcome = retryUnknown ? FailureDecider.Outcome.RETRY : FailureDecider.Outcome.FAIL;
        return FailureDecider.Decision.of(outcome, FailureDecider.Category.UNKNOWN)
                .withCode("UNHANDLED");
    }
}

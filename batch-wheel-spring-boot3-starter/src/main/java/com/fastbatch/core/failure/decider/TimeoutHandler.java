package com.fastbatch.core.failure.decider;

import com.fastbatch.core.spi.failure.FailureCaseHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.model.ctx.TaskContext;

import java.util.concurrent.TimeoutException;

/**
 * 超时处理
 */
public class TimeoutHandler implements FailureCaseHandler<TimeoutException> {
    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public FailureDecider.Decision execute(TimeoutException ex, TaskContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.TIMEOUT)
                .withCode("TIMEOUT");
    }
}

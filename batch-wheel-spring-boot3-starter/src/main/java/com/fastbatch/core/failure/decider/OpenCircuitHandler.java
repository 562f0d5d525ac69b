package com.fastbatch.core.failure.decider;

import com.fastbatch.core.spi.failure.FailureCaseHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.exception.guard.DownstreamOpenCircuitException;
import com.fastbatch.model.ctx.TaskContext;

/**
 * 熔断打开
 */
public class OpenCircuitHandler implements FailureCaseHandler<DownstreamOpenCircuitException> {
    @Override
    public Class<DownstreamOpenCircuitException> exceptionType() {
        return DownstreamOpenCircuitException.class;
    }

    @Override
    public FailureDecider.Decision execute(DownstreamOpenCircuitException ex, TaskContext ctx) {
        return FailureDecider.Decision
                .of(FailureDecider.Outcome.RETRY, FailureDecider.Category.OPEN_CIRCUIT)
                .withCode("CB_OPEN");
    }
}

package com.fastbatch.core.failure.decider;

import com.fastbatch.core.spi.failure.FailureCaseHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.model.ctx.TaskContext;

import java.io.IOException;

/**
 * 网络/IO 类异常, 可重试
 */
public class IoHandler implements FailureCaseHandler<IOException> {
    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public FailureDecider.Decision execute(IOException ex, TaskContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.IO)
                .withCode("IO");
    }
}

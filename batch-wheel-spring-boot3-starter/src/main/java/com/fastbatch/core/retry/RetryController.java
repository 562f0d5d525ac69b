package com.fastbatch.core.retry;

import com.fastbatch.core.backoff.BackoffRegistry;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.model.RetryPolicy;
import com.fastbatch.model.ctx.TaskContext;

import java.util.Objects;

/**
 * 重试控制
 * attemptNumber 为刚失败的尝试序号（从0开始）, 即已用掉的重试次数
 */
public class RetryController {

    public static final String REASON_MAX_RETRY = "MAX_RETRY";

    private final BackoffRegistry backoff;

    public RetryController(BackoffRegistry backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    public boolean shouldRetry(int attemptNumber, RetryPolicy policy) {
        return attemptNumber < policy.getMaxAttempts();
    }

    public long nextDelay(int attemptNumber, RetryPolicy policy) {
        return backoff.nextDelayMillis(attemptNumber, policy);
    }

    /**
     * 先按异常类型判定, 可重试且未超上限才计算退避
     */
    public RetryDecision decide(Throwable error, TaskContext ctx, RetryPolicy policy, FailureDecider decider) {
        FailureDecider.Decision decision = decider.decide(error, ctx);
        if (!decision.isRetry()) {
            return new RetryDecision(false, -1, decision, decision.getCode());
        }
        // 上限保护 RETRY 但超过 maxAttempts → 强制失败
        if (!shouldRetry(ctx.getAttempt(), policy)) {
            return new RetryDecision(false, -1, decision, REASON_MAX_RETRY);
        }
        return new RetryDecision(true, nextDelay(ctx.getAttempt(), policy), decision, decision.getCode());
    }
}

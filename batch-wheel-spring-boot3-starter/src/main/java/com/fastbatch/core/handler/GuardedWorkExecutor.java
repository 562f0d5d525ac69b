package com.fastbatch.core.handler;

import com.fastbatch.config.BatchGuardProperties;
import com.fastbatch.core.spi.TaskWorker;
import com.fastbatch.exception.guard.DownstreamOpenCircuitException;
import com.fastbatch.model.BatchTask;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;

import java.util.concurrent.Callable;

/**
 * 工作函数执行入口, 按配置增加熔断装饰
 */
public class GuardedWorkExecutor {

    private final CircuitBreaker circuitBreaker;

    public GuardedWorkExecutor(BatchGuardProperties props) {
        BatchGuardProperties.CbConfig c = props == null ? null : props.getCircuitBreaker();
        this.circuitBreaker = c != null && c.isEnabled() ? buildCb(c) : null;
    }

    /**
     * 未开启熔断时直接执行
     */
    public <P, R> R execute(BatchTask<P> task, TaskWorker<P, R> worker) throws Exception {
        Callable<R> decorated = () -> worker.execute(task);
        if (circuitBreaker != null) {
            decorated = CircuitBreaker.decorateCallable(circuitBreaker, decorated);
        }
        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            // 熔断打开 → 标记 系统性可重试，让 Backoff 拉大
            throw new DownstreamOpenCircuitException(open);
        }
    }

    private CircuitBreaker buildCb(BatchGuardProperties.CbConfig c) {
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class) // 在 FailureDecider 再精细化
                .build();
        return CircuitBreaker.of("cb:batch", cfg);
    }

    public CircuitBreaker getCircuitBreakerIfEnabled() {
        return circuitBreaker;
    }
}

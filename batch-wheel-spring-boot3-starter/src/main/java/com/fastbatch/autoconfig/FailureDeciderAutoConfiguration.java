package com.fastbatch.autoconfig;

import com.fastbatch.config.BatchFailureProperties;
import com.fastbatch.core.failure.RouterFailureDecider;
import com.fastbatch.core.failure.decider.IoHandler;
import com.fastbatch.core.failure.decider.NonRetryableHandler;
import com.fastbatch.core.failure.decider.OpenCircuitHandler;
import com.fastbatch.core.failure.decider.TimeoutHandler;
import com.fastbatch.core.failure.decider.UnknownHandler;
import com.fastbatch.core.spi.failure.FailureCaseHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.exception.BatchConfigurationException;
import com.fastbatch.exception.NonRetryableTaskException;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;

@AutoConfiguration
@EnableConfigurationProperties(BatchFailureProperties.class)
public class FailureDeciderAutoConfiguration {

    // 默认内置一组决策器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(OpenCircuitHandler.class)
    public OpenCircuitHandler openCircuitHandler(){ return new OpenCircuitHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler(){ return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(IoHandler.class)
    public IoHandler ioHandler(){ return new IoHandler(); }

    @Bean
    @ConditionalOnMissingBean(name = "nonRetryableTaskHandler")
    public NonRetryableHandler<NonRetryableTaskException> nonRetryableTaskHandler() {
        return new NonRetryableHandler<>(NonRetryableTaskException.class);
    }

    @Bean
    @ConditionalOnMissingBean(UnknownHandler.class)
    public UnknownHandler unknownHandler(BatchFailureProperties props) {
        return new UnknownHandler(props.isRetryUnknown());
    }

    // Router 决策器, 配置的不可重试异常排在内置处理器之前, 同距离时优先命中
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider(List<FailureCaseHandler<?>> handlers, BatchFailureProperties props) {
        List<FailureCaseHandler<?>> all = new ArrayList<>();
        for (String name : props.getNonRetryableExceptions()) {
            all.add(nonRetryable(name));
        }
        all.addAll(handlers);
        return new RouterFailureDecider(all);
    }

    private static FailureCaseHandler<?> nonRetryable(String className) {
        Class<?> type;
        try {
            type = ClassUtils.forName(className.trim(), FailureDeciderAutoConfiguration.class.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new BatchConfigurationException("batch.failure.non-retryable-exceptions: class not found " + className, e);
        }
        if (!Throwable.class.isAssignableFrom(type)) {
            throw new BatchConfigurationException("batch.failure.non-retryable-exceptions: not a Throwable " + className);
        }
        return handlerFor(type.asSubclass(Throwable.class));
    }

    private static <E extends Throwable> FailureCaseHandler<E> handlerFor(Class<E> type) {
        return new NonRetryableHandler<>(type);
    }
}

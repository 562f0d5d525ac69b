package com.fastbatch.autoconfig;

import com.fastbatch.config.BatchGuardProperties;
import com.fastbatch.core.handler.GuardedWorkExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        BatchGuardProperties.class
})
public class BatchGuardAutoConfiguration {

    /**
     * 工作函数统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedWorkExecutor guardedWorkExecutor(BatchGuardProperties props) {
        return new GuardedWorkExecutor(props);
    }
}

package com.fastbatch.autoconfig;

import com.fastbatch.core.metric.BatchMeterRegistryProvider;
import com.fastbatch.core.metric.BatchMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class BatchWheelMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BatchMeterRegistryProvider batchMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new BatchMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchMetrics batchMetrics(BatchMeterRegistryProvider provider) {
        return BatchMetrics.create(provider.getRegistry());
    }
}

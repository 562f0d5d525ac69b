package com.fastbatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * batch:
 *   guard:
 *     circuit-breaker:
 *       enabled: true
 *       failure-rate-threshold: 60
 *       slow-call-duration-threshold: 30s
 *       sliding-window-size: 50
 *       wait-duration-in-open-state: 15s
 */
@Data
@ConfigurationProperties(prefix = "batch.guard")
public class BatchGuardProperties {

    private CbConfig circuitBreaker = new CbConfig();

    @Data
    public static class CbConfig {
        /** 默认关闭, 开启后所有批次共用一个熔断器 */
        private boolean enabled = false;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(60);
        private int slidingWindowSize = 100;
        private int minimumNumberOfCalls = 20;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }
}

package com.fastbatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * batch:
 *   failure:
 *     retry-unknown: true
 *     non-retryable-exceptions:
 *       - java.lang.IllegalArgumentException
 */
@Data
@ConfigurationProperties(prefix = "batch.failure")
public class BatchFailureProperties {

    /** 未匹配任何处理器的异常是否重试 */
    private boolean retryUnknown = true;

    /** 额外的不可重试异常全限定类名 */
    private List<String> nonRetryableExceptions = new ArrayList<>();
}

package com.fastbatch.exception;

/**
 * 批次配置非法, 在任何任务派发前同步抛出
 */
public class BatchConfigurationException extends RuntimeException {

    public BatchConfigurationException(String message) {
        super(message);
    }

    public BatchConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

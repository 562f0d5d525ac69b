package com.fastbatch.exception;

/**
 * 工作函数抛出此异常表示永久性失败, 不消耗重试预算直接终结
 */
public class NonRetryableTaskException extends RuntimeException {

    public NonRetryableTaskException(String message) {
        super(message);
    }

    public NonRetryableTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}

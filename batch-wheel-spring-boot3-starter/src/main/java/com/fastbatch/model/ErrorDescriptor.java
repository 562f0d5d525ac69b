package com.fastbatch.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 终态失败的描述
 */
@Getter
@ToString
@AllArgsConstructor
public final class ErrorDescriptor {

    public static final String CODE_CANCELLED = "CANCELLED";
    public static final String CODE_ENGINE_ERROR = "ENGINE_ERROR";

    /** 判定码 如 TIMEOUT / NON_RETRYABLE / CANCELLED */
    private final String code;

    /** 失败分类 */
    private final String category;

    /** 异常类型全名, 取消时为null */
    private final String type;

    private final String message;

    public static ErrorDescriptor cancelled() {
        return new ErrorDescriptor(CODE_CANCELLED, "CANCELLED", null, "batch cancelled before dispatch");
    }

    public static ErrorDescriptor of(String code, String category, Throwable t) {
        // 截断 4000 字符
        String msg = t.getMessage();
        if (msg != null && msg.length() > 4000) {
            msg = msg.substring(0, 4000);
        }
        return new ErrorDescriptor(code, category, t.getClass().getName(), msg);
    }
}

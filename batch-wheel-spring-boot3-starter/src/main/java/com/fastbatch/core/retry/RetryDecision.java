package com.fastbatch.core.retry;

import com.fastbatch.core.spi.failure.FailureDecider;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次失败之后的处理结论
 */
@Getter
@ToString
@AllArgsConstructor
public final class RetryDecision {

    private final boolean retry;

    /** 重试前等待, 不重试时为 -1 */
    private final long delayMs;

    /** 失败判定器给出的原始决策 */
    private final FailureDecider.Decision decision;

    /** 终结原因: 判定码, 或重试耗尽时的 MAX_RETRY */
    private final String reason;
}

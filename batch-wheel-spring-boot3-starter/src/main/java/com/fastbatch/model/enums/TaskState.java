package com.fastbatch.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * 批内任务状态
 * PENDING -> ATTEMPTING -> (SUCCEEDED | RETRYING -> ATTEMPTING | FAILED)
 * PENDING / RETRYING 可被取消
 */
@AllArgsConstructor
@Getter
public enum TaskState {
    PENDING(0, "排队待派发"),
    ATTEMPTING(1, "执行中（占用一个工作槽）"),
    RETRYING(2, "退避等待中, 不占用工作槽"),
    SUCCEEDED(3, "执行成功，终态"),
    FAILED(4, "重试耗尽或不可重试，终态"),
    CANCELLED(5, "批次取消时尚未派发，终态")
    ;

    public final int code;
    public final String desc;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitTo(TaskState next) {
        return allowedNext().contains(next);
    }

    private Set<TaskState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(ATTEMPTING, CANCELLED);
            case ATTEMPTING -> EnumSet.of(SUCCEEDED, RETRYING, FAILED);
            case RETRYING -> EnumSet.of(ATTEMPTING, CANCELLED);
            case SUCCEEDED, FAILED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }
}

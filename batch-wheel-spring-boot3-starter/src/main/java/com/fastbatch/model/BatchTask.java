package com.fastbatch.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 提交给引擎的一个工作单元, 提交后不可变
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BatchTask<P> {

    private final String id;

    private final P payload;

    /** 值越大越先派发, 默认0 */
    private final int priority;

    public BatchTask(String id, P payload, int priority) {
        this.id = Objects.requireNonNull(id, "id");
        this.payload = payload;
        this.priority = priority;
    }

    public static <P> BatchTask<P> of(String id, P payload) {
        return new BatchTask<>(id, payload, 0);
    }

    public static <P> BatchTask<P> of(String id, P payload, int priority) {
        return new BatchTask<>(id, payload, priority);
    }
}

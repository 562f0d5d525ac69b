package com.fastbatch.model.ctx;

import lombok.Builder;
import lombok.Data;

/**
 * 单次派发的上下文, 交给失败判定器
 */
@Data
@Builder
public class TaskContext {

    private String batchId;
    private String taskId;
    private int priority;
    private String err;
    /** 刚失败的这次尝试序号, 从0开始 = 已用重试次数 */
    private int attempt;
    private int maxAttempts;
}

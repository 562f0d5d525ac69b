package com.fastbatch.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的退避任务封装
 * 让时间轮返回的 Timeout 能识别任务信息
 */
public class WheelTask implements TimerTask {

    private final String taskId;

    /** 到期后放回派发队列 */
    private final Runnable requeue;

    public WheelTask(String taskId, Runnable requeue) {
        this.taskId = taskId;
        this.requeue = requeue;
    }

    @Override
    public void run(Timeout timeout) throws Exception {
        if (timeout.isCancelled()) {
            return;
        }
        requeue.run();
    }

    public String getTaskId() {
        return taskId;
    }
}

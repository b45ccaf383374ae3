package com.notifywheel.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 本地时间轮上的`流轮询`任务封装
 * 让时间轮返回的 Timeout 能识别所属用户
 */
public class PollWheelTask implements TimerTask {

    private final String userId;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    public PollWheelTask(String userId, Runnable actual) {
        this.userId = userId;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) throws Exception {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    public String getUserId() {
        return userId;
    }
}

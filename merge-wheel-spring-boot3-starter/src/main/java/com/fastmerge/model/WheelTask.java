package com.fastmerge.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

import java.util.concurrent.CompletableFuture;

/**
 * 本地时间轮上的退避唤醒任务
 * 让时间轮返回的 Timeout 能识别资源信息
 */
public class WheelTask implements TimerTask {

    private final String resourceId;

    private final int attemptNumber;

    /** 到期时完成, 等待方据此醒来 */
    private final CompletableFuture<Void> wake;

    public WheelTask(String resourceId, int attemptNumber, CompletableFuture<Void> wake) {
        this.resourceId = resourceId;
        this.attemptNumber = attemptNumber;
        this.wake = wake;
    }

    @Override
    public void run(Timeout timeout) {
        wake.complete(null);
    }

    public String getResourceId() {
        return resourceId;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public CompletableFuture<Void> getWake() {
        return wake;
    }
}

package com.fastmerge.core.engine;

import java.util.concurrent.CompletableFuture;

/**
 * 取消信号, 可在任意线程触发
 * 引擎在轮询前、客户端调用期间以及退避等待期间检查
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /** 取消时完成的 future, 用于与等待中的 future 组合 */
    CompletableFuture<Void> signal() {
        return signal;
    }
}

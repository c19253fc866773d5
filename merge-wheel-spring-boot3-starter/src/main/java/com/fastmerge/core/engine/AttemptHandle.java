package com.fastmerge.core.engine;

import com.fastmerge.model.AttemptResult;

import java.util.concurrent.CompletableFuture;

/**
 * 异步提交的 attempt, 可取消
 */
public final class AttemptHandle {

    private final String resourceId;

    private final CancellationToken token;

    private final CompletableFuture<AttemptResult> result;

    AttemptHandle(String resourceId, CancellationToken token, CompletableFuture<AttemptResult> result) {
        this.resourceId = resourceId;
        this.token = token;
        this.result = result;
    }

    public String getResourceId() {
        return resourceId;
    }

    /** 正在退避的任务会立即被唤醒并以 CANCELLED 结束 */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    CancellationToken token() {
        return token;
    }

    public CompletableFuture<AttemptResult> result() {
        return result;
    }
}

package com.fastmerge.core.notify;

import com.fastmerge.model.AttemptResult;
import com.fastmerge.model.ctx.NotifyContext;
import com.fastmerge.model.enums.CompletionReason;
import com.fastmerge.model.enums.NotifyEventType;
import com.fastmerge.model.enums.Severity;
import com.fastmerge.model.enums.State;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（使用系统UTC时钟） ========== */

    public static NotifyContext ctxForResult(String nodeId, AttemptResult r, int maxRetries) {
        return ctxForResult(nodeId, r, maxRetries, Clock.systemUTC());
    }

    public static NotifyContext ctxForActFailed(String nodeId, String resourceId, int attemptNumber, Throwable e) {
        return ctxForActFailed(nodeId, resourceId, attemptNumber, e, Clock.systemUTC());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForResult(String nodeId, AttemptResult r, int maxRetries, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        if (r.getElapsed() != null) {
            attrs.put("elapsedMs", r.getElapsed().toMillis());
        }
        attrs.put("success", r.isSuccess());
        return new NotifyContext(
                eventOf(r.getReason()),
                nodeId,
                r.getResourceId(),
                r.getAttempts(),
                maxRetries,
                r.getFinalState(),
                r.getReason().name(),
                truncate(r.lastError().map(Throwable::getMessage).orElse(null)),
                clock.instant(),
                attrs);
    }

    public static NotifyContext ctxForActFailed(String nodeId, String resourceId, int attemptNumber,
                                                Throwable e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("attemptNumber", attemptNumber);
        return new NotifyContext(
                NotifyEventType.ACT_FAILED,
                nodeId,
                resourceId,
                attemptNumber,
                null,
                State.CLEAN,
                "ACT_FAILED",
                truncate(e == null ? null : e.getMessage()),
                clock.instant(),
                attrs);
    }

    public static NotifyEventType eventOf(CompletionReason reason) {
        return switch (reason) {
            case MERGED -> NotifyEventType.MERGED;
            case ALREADY_DONE -> NotifyEventType.ALREADY_MERGED;
            case TERMINAL_STATE -> NotifyEventType.TERMINAL_STATE;
            case RETRIES_EXHAUSTED -> NotifyEventType.RETRIES_EXHAUSTED;
            case TIMEOUT_EXCEEDED -> NotifyEventType.TIMEOUT;
            case CANCELLED -> NotifyEventType.CANCELLED;
        };
    }

    public static Severity severityOf(CompletionReason reason) {
        return switch (reason) {
            case MERGED, ALREADY_DONE, CANCELLED -> Severity.INFO;
            case RETRIES_EXHAUSTED, TIMEOUT_EXCEEDED -> Severity.WARNING;
            case TERMINAL_STATE -> Severity.ERROR;
        };
    }

    private static String truncate(String s) {
        if (s == null) {
            return null;
        }
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}

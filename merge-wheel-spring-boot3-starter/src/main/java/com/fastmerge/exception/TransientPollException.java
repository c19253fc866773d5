package com.fastmerge.exception;

/**
 * 轮询失败, 记录到 AttemptRecord 后按 UNKNOWN 状态处理
 */
public class TransientPollException extends RuntimeException {

    public TransientPollException(String resourceId, Throwable cause) {
        super("poll failed for " + resourceId + ": " + describe(cause), cause);
    }

    static String describe(Throwable t) {
        if (t == null) {
            return "null";
        }
        return t.getMessage() == null ? t.getClass().getSimpleName()
                : t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}

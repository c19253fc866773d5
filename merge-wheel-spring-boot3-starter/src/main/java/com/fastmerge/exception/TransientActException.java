package com.fastmerge.exception;

/**
 * 终态动作失败, 下一轮按 UNKNOWN 策略重新轮询
 */
public class TransientActException extends RuntimeException {

    public TransientActException(String resourceId, Throwable cause) {
        super("act failed for " + resourceId + ": " + TransientPollException.describe(cause), cause);
    }

    public TransientActException(String resourceId, String message) {
        super("act rejected for " + resourceId + ": " + message);
    }
}

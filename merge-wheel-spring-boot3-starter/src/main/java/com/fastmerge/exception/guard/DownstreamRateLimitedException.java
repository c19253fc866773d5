package com.fastmerge.exception.guard;

/**
 * 限流窗口内许可耗尽, 调用未发出
 */
public class DownstreamRateLimitedException extends RuntimeException {

    private final String op;

    public DownstreamRateLimitedException(String op, Throwable cause) {
        super("rate limit exceeded, " + op + " not sent", cause);
        this.op = op;
    }

    public String getOp() {
        return op;
    }
}

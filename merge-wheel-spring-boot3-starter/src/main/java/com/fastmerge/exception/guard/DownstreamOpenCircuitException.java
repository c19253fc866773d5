package com.fastmerge.exception.guard;

/**
 * fetch/act 所在熔断器处于 OPEN, 调用未发出
 */
public class DownstreamOpenCircuitException extends RuntimeException {

    private final String op;

    public DownstreamOpenCircuitException(String op, Throwable cause) {
        super("circuit open, " + op + " not sent", cause);
        this.op = op;
    }

    public String getOp() {
        return op;
    }
}

package com.fastmerge.exception;

/**
 * 重试配置非法, 在构造或 attempt 入口处抛出
 */
public class RetryConfigException extends IllegalArgumentException {

    public RetryConfigException(String message) {
        super(message);
    }
}

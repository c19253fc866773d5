package com.fastmerge.model;

import com.fastmerge.exception.RetryConfigException;
import com.fastmerge.model.enums.BackoffStrategy;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 单个状态的重试配置, 构造即校验, 之后不可变
 *
 * 约束：
 * maxRetries >= 0, baseDelay > 0, maxDelay >= baseDelay,
 * backoffFactor >= 1.0, timeout > 0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryConfig {

    /** 未配置状态使用的默认值 */
    public static final RetryConfig DEFAULT = RetryConfig.builder()
            .maxRetries(5)
            .baseDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(60))
            .backoffFactor(2.0)
            .strategy(BackoffStrategy.EXPONENTIAL_BACKOFF)
            .jitter(false)
            .timeout(Duration.ofMinutes(30))
            .build();

    private final int maxRetries;

    private final Duration baseDelay;

    private final Duration maxDelay;

    private final double backoffFactor;

    private final BackoffStrategy strategy;

    private final boolean jitter;

    /** 整个 attempt 调用的截止时长 */
    private final Duration timeout;

    /** 引擎以纳秒计时, 时长不能超过 long 纳秒范围（约 292 年） */
    public static final Duration MAX_DURATION = Duration.ofNanos(Long.MAX_VALUE);

    @Builder(toBuilder = true)
    private RetryConfig(int maxRetries, Duration baseDelay, Duration maxDelay, double backoffFactor,
                        BackoffStrategy strategy, boolean jitter, Duration timeout) {
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.backoffFactor = backoffFactor;
        this.strategy = strategy;
        this.jitter = jitter;
        this.timeout = timeout;
        validate();
    }

    /**
     * 校验约束, 失败抛 RetryConfigException
     */
    public RetryConfig validate() {
        if (maxRetries < 0) {
            throw new RetryConfigException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new RetryConfigException("baseDelay must be > 0, got " + baseDelay);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new RetryConfigException("maxDelay must be >= baseDelay, got " + maxDelay);
        }
        if (maxDelay.compareTo(MAX_DURATION) > 0) {
            throw new RetryConfigException("maxDelay must be <= " + MAX_DURATION + ", got " + maxDelay);
        }
        // NaN 也在这里拦截
        if (!(backoffFactor >= 1.0) || Double.isInfinite(backoffFactor)) {
            throw new RetryConfigException("backoffFactor must be >= 1.0, got " + backoffFactor);
        }
        if (strategy == null) {
            throw new RetryConfigException("strategy must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new RetryConfigException("timeout must be > 0, got " + timeout);
        }
        if (timeout.compareTo(MAX_DURATION) > 0) {
            throw new RetryConfigException("timeout must be <= " + MAX_DURATION + ", got " + timeout);
        }
        return this;
    }
}

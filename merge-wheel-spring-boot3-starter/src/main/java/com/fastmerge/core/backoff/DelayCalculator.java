package com.fastmerge.core.backoff;

import com.fastmerge.model.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 根据重试序号与配置计算下一次等待时长
 *
 * 结果恒满足 0 < delay <= maxDelay；
 * 抖动为 [0.5, 1.0] 的乘数, 只会缩短, 不会突破上限
 */
public class DelayCalculator {

    private static final double JITTER_MIN = 0.5;

    private final BackoffRegistry registry;

    /** [0, 1) 均匀随机源 */
    private final DoubleSupplier random;

    public DelayCalculator(BackoffRegistry registry) {
        this(registry, () -> ThreadLocalRandom.current().nextDouble());
    }

    public DelayCalculator(BackoffRegistry registry, DoubleSupplier random) {
        this.registry = registry;
        this.random = random;
    }

    public Duration compute(int attempt, RetryConfig config) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        long maxNanos = config.getMaxDelay().toNanos();
        double ideal = registry.resolve(config.getStrategy()).idealNanos(attempt, config);
        // 溢出或非法值直接取上限
        double capped = Double.isNaN(ideal) || ideal > maxNanos ? maxNanos : ideal;

        if (config.isJitter()) {
            double r = Math.min(1.0, Math.max(0.0, random.getAsDouble()));
            capped = capped * (JITTER_MIN + (1.0 - JITTER_MIN) * r);
        }
        long nanos = Math.min(maxNanos, Math.max(1L, (long) capped));
        return Duration.ofNanos(nanos);
    }
}

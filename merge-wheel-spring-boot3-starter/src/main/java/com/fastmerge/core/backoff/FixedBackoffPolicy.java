package com.fastmerge.core.backoff;

import com.fastmerge.core.spi.BackoffPolicy;
import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.enums.BackoffStrategy;

/**
 * 固定间隔策略
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public BackoffStrategy strategy() {
        return BackoffStrategy.FIXED;
    }

    @Override
    public double idealNanos(int attempt, RetryConfig config) {
        return config.getBaseDelay().toNanos();
    }
}

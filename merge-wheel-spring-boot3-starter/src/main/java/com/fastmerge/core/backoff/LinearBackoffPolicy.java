package com.fastmerge.core.backoff;

import com.fastmerge.core.spi.BackoffPolicy;
import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.enums.BackoffStrategy;

/**
 * 线性递增：base * (attempt + 1)
 */
public class LinearBackoffPolicy implements BackoffPolicy {

    @Override
    public BackoffStrategy strategy() {
        return BackoffStrategy.LINEAR;
    }

    @Override
    public double idealNanos(int attempt, RetryConfig config) {
        return (double) config.getBaseDelay().toNanos() * (attempt + 1L);
    }
}

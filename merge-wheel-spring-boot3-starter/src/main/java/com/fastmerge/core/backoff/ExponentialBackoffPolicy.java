package com.fastmerge.core.backoff;

import com.fastmerge.core.spi.BackoffPolicy;
import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.enums.BackoffStrategy;

/**
 * 指数退避：base * factor^attempt
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    @Override
    public BackoffStrategy strategy() {
        return BackoffStrategy.EXPONENTIAL_BACKOFF;
    }

    @Override
    public double idealNanos(int attempt, RetryConfig config) {
        // attempt从0开始计数：0 -> base, 1 -> base * factor, 2 -> base * factor^2 ...
        double pow = Math.pow(config.getBackoffFactor(), Math.max(0, attempt));
        return config.getBaseDelay().toNanos() * pow;
    }
}

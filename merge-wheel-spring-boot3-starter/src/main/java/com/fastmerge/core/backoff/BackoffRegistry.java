package com.fastmerge.core.backoff;

import com.fastmerge.core.spi.BackoffPolicy;
import com.fastmerge.model.enums.BackoffStrategy;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / linear / exponential
 * - 外部注册的 BackoffPolicy 可覆盖内置实现
 * - 线程安全
 */
public class BackoffRegistry {

    private final Map<BackoffStrategy, BackoffPolicy> policies = new ConcurrentHashMap<>(8);

    public BackoffRegistry(@Nullable List<BackoffPolicy> discovered) {
        if (discovered != null) {
            discovered.forEach(this::registry);
        }
        // 内置策略
        policies.putIfAbsent(BackoffStrategy.FIXED, new FixedBackoffPolicy());
        policies.putIfAbsent(BackoffStrategy.LINEAR, new LinearBackoffPolicy());
        policies.putIfAbsent(BackoffStrategy.EXPONENTIAL_BACKOFF, new ExponentialBackoffPolicy());
    }

    public BackoffRegistry() {
        this(null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(BackoffPolicy policy) {
        policies.put(policy.strategy(), policy);
        return this;
    }

    /**
     * 按枚举解析策略, 为空时采用默认 exponential 策略
     */
    public BackoffPolicy resolve(@Nullable BackoffStrategy strategy) {
        if (strategy == null) {
            return policies.get(BackoffStrategy.EXPONENTIAL_BACKOFF);
        }
        return policies.getOrDefault(strategy, policies.get(BackoffStrategy.EXPONENTIAL_BACKOFF));
    }

    /** 列出已注册策略 */
    public Set<BackoffStrategy> names() { return Collections.unmodifiableSet(policies.keySet()); }
}

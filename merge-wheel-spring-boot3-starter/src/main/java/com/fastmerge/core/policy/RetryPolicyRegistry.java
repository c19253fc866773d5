package com.fastmerge.core.policy;

import com.fastmerge.exception.RetryConfigException;
import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.enums.State;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * State -> RetryConfig 映射, 构造后不可变, 可并发读取
 * 未配置的状态使用 defaultConfig
 */
public final class RetryPolicyRegistry {

    private final RetryConfig defaultConfig;

    private final Map<State, RetryConfig> policies;

    public RetryPolicyRegistry(RetryConfig defaultConfig, Map<State, RetryConfig> policies) {
        this.defaultConfig = checked(null, defaultConfig);
        Map<State, RetryConfig> copy = new EnumMap<>(State.class);
        if (policies != null) {
            policies.forEach((state, config) -> copy.put(checkedState(state), checked(state, config)));
        }
        this.policies = Collections.unmodifiableMap(copy);
    }

    public static RetryPolicyRegistry defaults() {
        return new RetryPolicyRegistry(RetryConfig.DEFAULT, Map.of());
    }

    public RetryConfig configFor(State state) {
        return policies.getOrDefault(state, defaultConfig);
    }

    public RetryConfig getDefaultConfig() {
        return defaultConfig;
    }

    public Map<State, RetryConfig> getPolicies() {
        return policies;
    }

    /**
     * 合并调用方覆盖项, 返回新的注册表, 当前实例不变
     * 覆盖项非法时抛 RetryConfigException
     */
    public RetryPolicyRegistry withOverrides(Map<State, RetryConfig> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<State, RetryConfig> merged = new EnumMap<>(State.class);
        merged.putAll(policies);
        overrides.forEach((state, config) -> merged.put(checkedState(state), checked(state, config)));
        return new RetryPolicyRegistry(defaultConfig, merged);
    }

    private static State checkedState(State state) {
        if (state == null) {
            throw new RetryConfigException("policy state must not be null");
        }
        return state;
    }

    private static RetryConfig checked(State state, RetryConfig config) {
        if (config == null) {
            throw new RetryConfigException("retry config for " + Objects.toString(state, "default") + " must not be null");
        }
        return config.validate();
    }
}

package com.fastmerge.core.spi;

import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.enums.BackoffStrategy;

/**
 * 回退策略（计算未加抖动、未截断的理想间隔）
 */
public interface BackoffPolicy {

    /** 策略对应的枚举 */
    BackoffStrategy strategy();

    /**
     * 计算理想间隔
     * @param attempt  第几次重试, 从0开始
     * @param config   重试配置（读取 baseDelay/backoffFactor 等）
     * @return 理想间隔纳秒数, 可能超过 maxDelay, 由 DelayCalculator 截断
     */
    double idealNanos(int attempt, RetryConfig config);
}

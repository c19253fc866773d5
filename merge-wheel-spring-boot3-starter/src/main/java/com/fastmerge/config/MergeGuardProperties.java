package com.fastmerge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * merge:
 *   guard:
 *     enabled: true
 *     circuit-breaker:
 *       failure-rate-threshold: 60
 *       sliding-window-size: 20
 *       wait-duration-in-open-state: 15s
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 30
 *       limit-refresh-period: 1s
 *       timeout-duration: 100ms
 */
@Data
@ConfigurationProperties(prefix = "merge.guard")
public class MergeGuardProperties {
    /** 开关 */
    private boolean enabled = false;

    private CbConfig circuitBreaker = new CbConfig();
    private RlConfig rateLimiter = new RlConfig();

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(5);
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数, GitHub API 约 5000/h
        private int limitForPeriod = 80;
        private Duration limitRefreshPeriod = Duration.ofMinutes(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(100);
    }
}

package com.fastmerge.config;

import com.fastmerge.model.enums.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * merge:
 *   notify:
 *     enabled: true
 *     min-severity: WARNING
 *     async: { core-pool-size: 2, max-pool-size: 4, queue-capacity: 2000 }
 *     rate-limit: { window: 60s, threshold: 20 }
 */
@ConfigurationProperties(prefix = "merge.notify")
public class MergeNotifierProperties {

    /** 关闭时 NotifyingFacade 为空实现 */
    private boolean enabled = false;

    /** 低于此级别的事件不派发 */
    private Severity minSeverity = Severity.INFO;

    private Async async = new Async();

    private RateLimit rateLimit = new RateLimit();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Severity getMinSeverity() { return minSeverity; }
    public void setMinSeverity(Severity minSeverity) { this.minSeverity = minSeverity; }

    public Async getAsync() { return async; }
    public void setAsync(Async async) { this.async = async; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    /** 通知线程池, 队列满时丢弃并计入 failed */
    public static class Async {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 2000;
        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    }

    /** 每个 事件类型+级别 在 window 内最多 threshold 条 */
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(60);
        private int threshold = 20;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
    }
}

package com.fastmerge.config;

import com.fastmerge.core.policy.RetryPolicyRegistry;
import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.enums.BackoffStrategy;
import com.fastmerge.model.enums.DeadlineMode;
import com.fastmerge.model.enums.State;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 合并重试引擎配置（绑定前缀：merge）
 *
 * YAML 示例：
 * merge:
 *   node-id: merge-node-1
 *   wheel:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *   executor:
 *     core-pool-size: 8
 *     max-pool-size: 32
 *     queue-capacity: 1000
 *     keep-alive: 60s
 *     rejected-handler: CALLER_RUNS
 *   handler-executor:
 *     core-pool-size: 8
 *     rejected-handler: ABORT
 *   call-timeout: 10s
 *   deadline-mode: GLOBAL
 *   default-policy:
 *     max-retries: 5
 *     base-delay: 1s
 *     max-delay: 60s
 *     backoff-factor: 2.0
 *     strategy: EXPONENTIAL_BACKOFF
 *     jitter: false
 *     timeout: 30m
 *   policies:
 *     unstable:
 *       max-retries: 10
 *       base-delay: 30s
 *       strategy: LINEAR
 *   shutdown:
 *     await: 30s
 */
@ConfigurationProperties(prefix = "merge")
public class MergeWheelProperties {

    private Wheel wheel = new Wheel();

    /** submit 异步 attempt 线程池 */
    private Exec executor = new Exec();

    /** fetch/act 线程池, 满载时拒绝而不是在 attempt 线程上执行, 否则绕过 call-timeout 与取消 */
    private Exec handlerExecutor = new Exec(RejectedHandlerPolicy.ABORT);

    private Shutdown shutdown = new Shutdown();

    /** 节点标识, 为空时取 spring.application.name + 随机 UUID */
    private String nodeId;

    /** 单次 fetch/act 调用的最大等待时间 */
    private Duration callTimeout = Duration.ofSeconds(10);

    /** 截止时间锚点 */
    private DeadlineMode deadlineMode = DeadlineMode.GLOBAL;

    /** 未配置状态使用的默认策略 */
    private Policy defaultPolicy = new Policy();

    /** 按状态覆盖, 未设置的字段继承 defaultPolicy */
    private Map<State, Policy> policies = new LinkedHashMap<>();

    // ----------------- 嵌套配置对象 -----------------

    public static class Wheel {
        /** 时间轮刻度, 决定退避唤醒精度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
    }

    public static class Exec {
        private int corePoolSize = 8;

        private int maxPoolSize = 32;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler;

        public Exec() {
            this(RejectedHandlerPolicy.CALLER_RUNS);
        }

        public Exec(RejectedHandlerPolicy rejectedHandler) {
            this.rejectedHandler = rejectedHandler;
        }

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    /**
     * 单个状态的策略, 字段为 null 时继承上层配置
     */
    public static class Policy {
        private Integer maxRetries;
        private Duration baseDelay;
        private Duration maxDelay;
        private Double backoffFactor;
        private BackoffStrategy strategy;
        private Boolean jitter;
        private Duration timeout;

        public Integer getMaxRetries() { return maxRetries; }
        public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public Double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(Double backoffFactor) { this.backoffFactor = backoffFactor; }
        public BackoffStrategy getStrategy() { return strategy; }
        public void setStrategy(BackoffStrategy strategy) { this.strategy = strategy; }
        public Boolean getJitter() { return jitter; }
        public void setJitter(Boolean jitter) { this.jitter = jitter; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        /**
         * 以 parent 为底合并出不可变配置, 非法时抛 RetryConfigException
         */
        public RetryConfig toRetryConfig(RetryConfig parent) {
            RetryConfig.RetryConfigBuilder b = parent.toBuilder();
            if (maxRetries != null) b.maxRetries(maxRetries);
            if (baseDelay != null) b.baseDelay(baseDelay);
            if (maxDelay != null) b.maxDelay(maxDelay);
            if (backoffFactor != null) b.backoffFactor(backoffFactor);
            if (strategy != null) b.strategy(strategy);
            if (jitter != null) b.jitter(jitter);
            if (timeout != null) b.timeout(timeout);
            return b.build();
        }
    }

    // ----------------- 公共枚举/工具 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Exec getHandlerExecutor() { return handlerExecutor; }
    public void setHandlerExecutor(Exec handlerExecutor) { this.handlerExecutor = handlerExecutor; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public Duration getCallTimeout() { return callTimeout; }
    public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }

    public DeadlineMode getDeadlineMode() { return deadlineMode; }
    public void setDeadlineMode(DeadlineMode deadlineMode) { this.deadlineMode = deadlineMode; }

    public Policy getDefaultPolicy() { return defaultPolicy; }
    public void setDefaultPolicy(Policy defaultPolicy) { this.defaultPolicy = defaultPolicy; }

    public Map<State, Policy> getPolicies() { return policies; }
    public void setPolicies(Map<State, Policy> policies) { this.policies = policies; }

    // ----------------- 便捷换算 -----------------

    /**
     * 构造策略注册表：defaultPolicy 继承 RetryConfig.DEFAULT, 各状态继承 defaultPolicy
     */
    public RetryPolicyRegistry toPolicyRegistry() {
        RetryConfig def = defaultPolicy == null ? RetryConfig.DEFAULT : defaultPolicy.toRetryConfig(RetryConfig.DEFAULT);
        Map<State, RetryConfig> map = new EnumMap<>(State.class);
        if (policies != null) {
            policies.forEach((state, p) -> map.put(state, p == null ? def : p.toRetryConfig(def)));
        }
        return new RetryPolicyRegistry(def, map);
    }

    /**
     * 未显式配置时生成节点标识, 之后保持不变
     */
    public synchronized String resolveNodeId(String applicationName) {
        if (nodeId == null || nodeId.isBlank()) {
            nodeId = applicationName + "-" + UUID.randomUUID();
        }
        return nodeId;
    }

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }

    /** 单次调用超时毫秒 */
    public long callTimeoutMillis() { return callTimeout.toMillis(); }
}

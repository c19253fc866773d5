package com.fastmerge.core;

import com.fastmerge.config.MergeGuardProperties;
import com.fastmerge.config.MergeNotifierProperties;
import com.fastmerge.config.MergeWheelProperties;
import com.fastmerge.core.engine.RetryEngine;
import com.fastmerge.model.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class MergeEngineLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(MergeEngineLifecycle.class);

    private final RetryEngine engine;

    private final MergeWheelProperties props;

    private final MergeGuardProperties guardProps;

    private final MergeNotifierProperties notifyProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public MergeEngineLifecycle(RetryEngine engine, MergeWheelProperties props,
                                MergeGuardProperties guardProps, MergeNotifierProperties notifyProps) {
        this.engine = engine;
        this.props = props;
        this.guardProps = guardProps;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // 打印关键启动信息（一次性）
        try {
            RetryConfig def = engine.getPolicies().getDefaultConfig();
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ MergeEngine starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ nodeId              : {}", engine.getNodeId());
            log.info("│ wheel.tick          : {} ms", props.getWheel().getTickDuration().toMillis());
            log.info("│ wheel.size          : {}", props.getWheel().getTicksPerWheel());
            log.info("│ exec.core / max     : {} / {}", props.getExecutor().getCorePoolSize(), props.getExecutor().getMaxPoolSize());
            log.info("│ exec.queue          : {}", props.getExecutor().getQueueCapacity());
            log.info("│ handler.core / max  : {} / {} ({})", props.getHandlerExecutor().getCorePoolSize(),
                    props.getHandlerExecutor().getMaxPoolSize(), props.getHandlerExecutor().getRejectedHandler());
            log.info("│ callTimeout         : {} ms", props.callTimeoutMillis());
            log.info("│ deadlineMode        : {}", props.getDeadlineMode());
            log.info("│ default.maxRetries  : {}", def.getMaxRetries());
            log.info("│ default.strategy    : {} (base={} ms, max={} ms, factor={}, jitter={})",
                    def.getStrategy(), def.getBaseDelay().toMillis(), def.getMaxDelay().toMillis(),
                    def.getBackoffFactor(), def.isJitter());
            log.info("│ default.timeout     : {} ms", def.getTimeout().toMillis());
            log.info("│ policy overrides    : {}", engine.getPolicies().getPolicies().keySet());
            log.info("│ guard.enabled       : {}", guardProps.isEnabled());
            log.info("│ notifier.enabled    : {}", notifyProps.isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (RuntimeException t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Merge-Engine] failed to render startup banner: {}", t.toString());
        }
        log.info("[Merge-Engine] started (nodeId={})", engine.getNodeId());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Merge-Engine] stop skipped: already stopped (nodeId={})", engine.getNodeId());
            return;
        }
        log.info("[Merge-Engine] stopping... (nodeId={})", engine.getNodeId());
        // 取消在途 attempt, 等待收尾
        try {
            engine.gracefulShutdown(props.getShutdown().getAwait().toSeconds());
        } finally {
            log.info("[Merge-Engine] stopped (nodeId={})", engine.getNodeId());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}

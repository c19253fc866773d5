package com.fastmerge.core.engine;

import com.fastmerge.config.MergeWheelProperties;
import com.fastmerge.core.backoff.DelayCalculator;
import com.fastmerge.core.handler.GuardedClientExecutor;
import com.fastmerge.core.metric.RetryMetrics;
import com.fastmerge.core.notify.NotifyContexts;
import com.fastmerge.core.notify.NotifyingFacade;
import com.fastmerge.core.policy.RetryPolicyRegistry;
import com.fastmerge.core.spi.HistoryStore;
import com.fastmerge.core.spi.PollingClient;
import com.fastmerge.core.spi.StateClassifier;
import com.fastmerge.core.stats.StatisticsAggregator;
import com.fastmerge.exception.TransientActException;
import com.fastmerge.exception.TransientPollException;
import com.fastmerge.model.ActResult;
import com.fastmerge.model.AttemptRecord;
import com.fastmerge.model.AttemptResult;
import com.fastmerge.model.EngineStatistics;
import com.fastmerge.model.RawState;
import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.WheelTask;
import com.fastmerge.model.enums.AttemptOutcome;
import com.fastmerge.model.enums.CompletionReason;
import com.fastmerge.model.enums.DeadlineMode;
import com.fastmerge.model.enums.Severity;
import com.fastmerge.model.enums.State;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 合并重试引擎核心
 *
 * 单个资源的循环：轮询 → 分类 → 策略查找 → 决策 →（执行动作 | 退避等待 | 结束）
 * 同一资源内严格串行；不同资源可在不同线程并发执行, 只共享 HistoryStore 与 StatisticsAggregator
 */
public class RetryEngine {

    Logger log = LoggerFactory.getLogger(RetryEngine.class);

    /** 时间轮, 承载退避等待 */
    private final HashedWheelTimer timer;

    /** submit 提交的 attempt 循环线程池 */
    private final ExecutorService dispatchExecutor;

    /** fetch/act 执行线程池 */
    private final ExecutorService handlerExecutor;

    /** 外部系统客户端 */
    private final PollingClient client;

    /** 状态分类器 */
    private final StateClassifier classifier;

    /** 退避计算 */
    private final DelayCalculator delays;

    /** 默认策略, 不可变 */
    private final RetryPolicyRegistry policies;

    /** 尝试历史 */
    private final HistoryStore history;

    /** 统计 */
    private final StatisticsAggregator stats;

    /** 指标 */
    private final RetryMetrics meter;

    /** 通知模块 */
    private final NotifyingFacade notifyService;

    /** 客户端调用保护 */
    private final GuardedClientExecutor guard;

    /** 配置 */
    private final MergeWheelProperties props;

    /** 节点id */
    private final String nodeId;

    private final Clock clock;

    /** 引擎运行状态 */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** 在途 attempt 的取消信号, 停机时统一取消 */
    private final Set<CancellationToken> inflight = ConcurrentHashMap.newKeySet();

    /** 已提交但尚未开始执行的 submit, 停机时补齐结果 */
    private final Map<CompletableFuture<AttemptResult>, Runnable> queued = new ConcurrentHashMap<>();

    public RetryEngine(HashedWheelTimer timer,
                       ExecutorService dispatchExecutor,
                       ExecutorService handlerExecutor,
                       PollingClient client,
                       StateClassifier classifier,
                       DelayCalculator delays,
                       RetryPolicyRegistry policies,
                       HistoryStore history,
                       StatisticsAggregator stats,
                       RetryMetrics meter,
                       NotifyingFacade notifyService,
                       GuardedClientExecutor guard,
                       MergeWheelProperties props,
                       String nodeId,
                       Clock clock) {
        this.timer = timer;
        this.dispatchExecutor = dispatchExecutor;
        this.handlerExecutor = handlerExecutor;
        this.client = Objects.requireNonNull(client, "client");
        this.classifier = classifier;
        this.delays = delays;
        this.policies = policies;
        this.history = history;
        this.stats = stats;
        this.meter = meter;
        this.notifyService = notifyService;
        this.guard = guard;
        this.props = props;
        this.nodeId = nodeId;
        this.clock = clock;
    }

    public String getNodeId() { return nodeId; }

    public RetryPolicyRegistry getPolicies() { return policies; }

    public boolean isRunning() { return running.get(); }

    public int inflightCount() { return inflight.size(); }

    // ----------------- 对外接口 -----------------

    public AttemptResult attempt(String resourceId) {
        return attempt(resourceId, null, null);
    }

    public AttemptResult attempt(String resourceId, Map<State, RetryConfig> overrides) {
        return attempt(resourceId, overrides, null);
    }

    /**
     * 同步执行直到终态、耗尽、超时或取消
     * 唯一会抛出的是入口处的 RetryConfigException（覆盖配置非法）
     */
    public AttemptResult attempt(String resourceId, Map<State, RetryConfig> overrides, CancellationToken token) {
        Objects.requireNonNull(resourceId, "resourceId");
        RetryPolicyRegistry policy = policies.withOverrides(overrides);
        return run(resourceId, policy, token == null ? new CancellationToken() : token);
    }

    /**
     * 异步执行, 覆盖配置在提交时同步校验
     */
    public AttemptHandle submit(String resourceId, Map<State, RetryConfig> overrides) {
        Objects.requireNonNull(resourceId, "resourceId");
        RetryPolicyRegistry policy = policies.withOverrides(overrides);
        CancellationToken token = new CancellationToken();
        CompletableFuture<AttemptResult> f = new CompletableFuture<>();
        AttemptHandle handle = new AttemptHandle(resourceId, token, f);
        if (!running.get()) {
            completeCancelled(handle, policy);
            return handle;
        }
        queued.put(f, () -> completeCancelled(handle, policy));
        try {
            dispatchExecutor.execute(() -> {
                // 已被停机或拒绝路径收尾
                if (queued.remove(f) == null) {
                    return;
                }
                try {
                    f.complete(run(resourceId, policy, token));
                } catch (Throwable t) {
                    f.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Merge-Engine] dispatch rejected resource={}: {}", resourceId, e.toString());
            drain(f);
            return handle;
        }
        // 提交期间引擎停机, CALLER_RUNS/DISCARD 会静默丢弃任务
        if (!running.get()) {
            drain(f);
        }
        return handle;
    }

    private void drain(CompletableFuture<AttemptResult> f) {
        Runnable onDrop = queued.remove(f);
        if (onDrop != null) {
            onDrop.run();
        }
    }

    /** 未进入主循环的提交直接以 CANCELLED 结束, 仍记录历史与统计 */
    private void completeCancelled(AttemptHandle handle, RetryPolicyRegistry policy) {
        handle.cancel();
        handle.result().complete(run(handle.getResourceId(), policy, handle.token()));
    }

    public List<AttemptRecord> getHistory(String resourceId) {
        return history.get(resourceId);
    }

    public EngineStatistics getStatistics() {
        return stats.snapshot();
    }

    public void resetStatistics() {
        stats.reset();
        log.info("[Merge-Engine] statistics reset, nodeId={}", nodeId);
    }

    // ----------------- 主循环 -----------------

    private AttemptResult run(String resourceId, RetryPolicyRegistry policy, CancellationToken cancel) {
        inflight.add(cancel);
        if (!running.get()) {
            // 已停机, 直接以 CANCELLED 结束
            cancel.cancel();
        }
        try {
            return new AttemptRun(resourceId, policy, cancel).loop();
        } finally {
            inflight.remove(cancel);
        }
    }

    /**
     * 单次 attempt 调用的状态, 仅由执行它的线程访问
     */
    private final class AttemptRun {

        private final String resourceId;
        private final RetryPolicyRegistry policy;
        private final CancellationToken cancel;
        private final long startNanos = System.nanoTime();
        private final List<AttemptRecord> records = new ArrayList<>();
        private int polls;

        AttemptRun(String resourceId, RetryPolicyRegistry policy, CancellationToken cancel) {
            this.resourceId = resourceId;
            this.policy = policy;
            this.cancel = cancel;
        }

        AttemptResult loop() {
            long anchorNanos = startNanos;
            int attempt = 0;
            State previous = null;
            log.info("[Attempt] resource={} start, deadlineMode={}", resourceId, props.getDeadlineMode());

            while (true) {
                int number = attempt + 1;
                if (cancel.isCancelled()) {
                    State last = previous == null ? State.UNKNOWN : previous;
                    return finish(number, last, null, CompletionReason.CANCELLED,
                            policy.configFor(last), "cancelled before poll #" + number);
                }

                // 1. 轮询, 失败视为原始状态缺失
                polls++;
                meter.incPoll();
                Throwable err = null;
                RawState raw;
                try {
                    raw = invoke(GuardedClientExecutor.OP_FETCH, () -> client.fetch(resourceId), cancel);
                } catch (Exception e) {
                    raw = RawState.absent();
                    // 取消不是调用错误, 不记 rawError
                    if (!cancelledBy(e)) {
                        err = new TransientPollException(resourceId, e);
                        meter.incPollErr();
                        log.warn("[Poll] resource={} attempt={} failed: {}", resourceId, number, err.getMessage());
                    }
                }

                // 2. 分类
                State state = classify(raw);
                if (cancel.isCancelled()) {
                    return finish(number, state, err, CompletionReason.CANCELLED,
                            policy.configFor(state), "cancelled during poll #" + number);
                }
                if (props.getDeadlineMode() == DeadlineMode.RESET_ON_STATE_CHANGE
                        && previous != null && previous != state) {
                    anchorNanos = System.nanoTime();
                    log.debug("[Attempt] resource={} state {} -> {}, deadline reset", resourceId, previous, state);
                }
                previous = state;

                // 3. 策略查找
                RetryConfig config = policy.configFor(state);

                // 4. 决策
                if (state == State.ALREADY_DONE) {
                    return finish(number, state, err, CompletionReason.ALREADY_DONE, config, "resource already done");
                }
                if (state == State.CLEAN) {
                    try {
                        ActResult r = invoke(GuardedClientExecutor.OP_ACT, () -> client.act(resourceId), cancel);
                        if (r != null && r.isSuccess()) {
                            return finish(number, state, null, CompletionReason.MERGED, config,
                                    r.getMessage() == null ? "terminal action succeeded" : r.getMessage());
                        }
                        err = new TransientActException(resourceId, r == null ? "no result" : String.valueOf(r.getMessage()));
                    } catch (Exception e) {
                        err = cancelledBy(e) ? null : new TransientActException(resourceId, e);
                    }
                    if (cancel.isCancelled()) {
                        return finish(number, state, err, CompletionReason.CANCELLED, config,
                                "cancelled during act #" + number);
                    }
                    meter.incActErr();
                    log.warn("[Act] resource={} attempt={} failed, retry under UNKNOWN policy: {}",
                            resourceId, number, err.getMessage());
                    notifyService.fire(NotifyContexts.ctxForActFailed(nodeId, resourceId, number, err, clock), Severity.WARNING);
                    // 动作失败不直接判失败, 按 UNKNOWN 策略继续
                    config = policy.configFor(State.UNKNOWN);
                } else if (state.isTerminalFailure()) {
                    // 终态失败不消耗重试预算
                    return finish(number, state, err, CompletionReason.TERMINAL_STATE, config,
                            "terminal state " + state);
                }

                // 瞬时状态：先判耗尽, 再判截止时间, 都通过才退避
                if (attempt >= config.getMaxRetries()) {
                    return finish(number, state, err, CompletionReason.RETRIES_EXHAUSTED, config,
                            "max retries " + config.getMaxRetries() + " reached in state " + state);
                }
                Duration delay = delays.compute(attempt, config);
                long elapsedNanos = System.nanoTime() - anchorNanos;
                // 两侧都非负, 用减法比较避免相加溢出
                if (delay.toNanos() > config.getTimeout().toNanos() - elapsedNanos) {
                    return finish(number, state, err, CompletionReason.TIMEOUT_EXCEEDED, config,
                            "next delay " + delay.toMillis() + " ms would exceed timeout "
                                    + config.getTimeout().toMillis() + " ms (elapsed "
                                    + TimeUnit.NANOSECONDS.toMillis(elapsedNanos) + " ms)");
                }
                append(number, state, err, delay, AttemptOutcome.RETRYING);
                meter.incRetry();
                log.debug("[Attempt] resource={} attempt={} state={} sleep {} ms",
                        resourceId, number, state, delay.toMillis());

                // 被取消时立即醒来, 由下一轮开头统一收尾
                sleep(resourceId, number, delay, cancel);
                attempt++;
            }
        }

        private State classify(RawState raw) {
            try {
                State s = classifier.classify(raw);
                return s == null ? State.UNKNOWN : s;
            } catch (RuntimeException e) {
                log.warn("[Classify] resource={} classifier failed, fallback UNKNOWN", resourceId, e);
                return State.UNKNOWN;
            }
        }

        private void append(int number, State state, Throwable err, Duration delay, AttemptOutcome outcome) {
            AttemptRecord record = AttemptRecord.builder()
                    .attemptNumber(number)
                    .timestamp(clock.instant())
                    .observedState(state)
                    .rawError(err)
                    .delayApplied(delay)
                    .outcome(outcome)
                    .build();
            records.add(record);
            history.append(resourceId, record);
        }

        /**
         * 记录终态并更新统计, 每次 attempt 调用恰好一次
         */
        private boolean cancelledBy(Exception e) {
            return e instanceof CancellationException && cancel.isCancelled();
        }

        private AttemptResult finish(int number, State state, Throwable err, CompletionReason reason,
                                     RetryConfig config, String message) {
            append(number, state, err, null, reason.outcome);
            long nanos = System.nanoTime() - startNanos;
            AttemptResult result = AttemptResult.builder()
                    .resourceId(resourceId)
                    .success(reason.success)
                    .attempts(polls)
                    .finalState(state)
                    .reason(reason)
                    .message(message)
                    .elapsed(Duration.ofNanos(nanos))
                    .history(records)
                    .build();
            stats.record(result);
            meter.recordResult(reason, polls, nanos);
            notifyService.fire(NotifyContexts.ctxForResult(nodeId, result, config.getMaxRetries(), clock),
                    NotifyContexts.severityOf(reason));
            if (reason.success) {
                log.info("[Attempt] resource={} succeeded, reason={}, polls={}, elapsed={} ms",
                        resourceId, reason, polls, TimeUnit.NANOSECONDS.toMillis(nanos));
            } else {
                log.warn("[Attempt] resource={} failed, reason={}, state={}, polls={}, elapsed={} ms: {}",
                        resourceId, reason, state, polls, TimeUnit.NANOSECONDS.toMillis(nanos), message);
            }
            return result;
        }
    }

    // ----------------- 挂起点 -----------------

    /**
     * 在 handler 线程池执行客户端调用, 等待结果、调用超时或取消信号
     */
    private <T> T invoke(String op, Callable<T> call, CancellationToken cancel) throws Exception {
        long startNanos = System.nanoTime();
        CompletableFuture<T> f = new CompletableFuture<>();
        Future<?> task = handlerExecutor.submit(() -> {
            try {
                f.complete(guard.execute(op, call));
            } catch (Throwable t) {
                f.completeExceptionally(t);
            }
        });
        // handle 保证等待本身不会异常完成
        CompletableFuture<Object> done = CompletableFuture.anyOf(f.handle((v, t) -> null), cancel.signal());
        try {
            done.get(props.callTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            task.cancel(true);
            CircuitBreaker cb = guard.getCircuitBreakerIfEnabled(op);
            if (cb != null) {
                // 外层等待超时, 手动记一次熔断失败
                cb.onError(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS, te);
            }
            throw new TimeoutException(op + " timed out after " + props.callTimeoutMillis() + " ms");
        } catch (InterruptedException ie) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            cancel.cancel();
            throw new CancellationException(op + " interrupted");
        } catch (ExecutionException ee) {
            throw new IllegalStateException("unexpected wait failure", ee);
        }

        if (!f.isDone()) {
            // 取消信号先到
            task.cancel(true);
            throw new CancellationException(op + " cancelled");
        }
        try {
            return f.join();
        } catch (CompletionException ce) {
            Throwable cause = ce.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error e) {
                throw e;
            }
            throw ce;
        }
    }

    /**
     * 退避等待：时间轮到期或取消信号, 先到者唤醒
     * 不轮询时钟
     */
    private void sleep(String resourceId, int number, Duration delay, CancellationToken cancel) {
        CompletableFuture<Void> wake = new CompletableFuture<>();
        Timeout timeout;
        try {
            timeout = timer.newTimeout(new WheelTask(resourceId, number, wake),
                    delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (IllegalStateException e) {
            // 时间轮已停止, 引擎停机中
            log.warn("[Backoff] wheel timer stopped, cancel attempt: {}", e.toString());
            cancel.cancel();
            return;
        }
        try {
            CompletableFuture.anyOf(wake, cancel.signal()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel.cancel();
        } catch (ExecutionException e) {
            // 两个 future 都只会正常完成
            throw new IllegalStateException("unexpected wakeup failure", e);
        } finally {
            timeout.cancel();
        }
    }

    // ----------------- 生命周期 -----------------

    /**
     * 停止接受新 attempt, 取消在途任务并等待其收尾
     */
    public void gracefulShutdown(long awaitSeconds) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("[Merge-Engine] shutting down, cancel {} inflight attempts (nodeId={})", inflight.size(), nodeId);
        inflight.forEach(CancellationToken::cancel);
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(awaitSeconds, TimeUnit.SECONDS)) {
                log.warn("[Merge-Engine] dispatch executor not terminated in {} s, force shutdown", awaitSeconds);
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatchExecutor.shutdownNow();
        } finally {
            handlerExecutor.shutdownNow();
            timer.stop();
        }
        // shutdownNow 丢弃的排队任务
        queued.keySet().forEach(this::drain);
    }
}

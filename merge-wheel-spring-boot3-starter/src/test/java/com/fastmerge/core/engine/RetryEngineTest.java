package com.fastmerge.core.engine;

import com.fastmerge.config.MergeWheelProperties;
import com.fastmerge.core.backoff.BackoffRegistry;
import com.fastmerge.core.backoff.DelayCalculator;
import com.fastmerge.core.classify.MergeableStateClassifier;
import com.fastmerge.core.handler.GuardedClientExecutor;
import com.fastmerge.core.history.InMemoryHistoryStore;
import com.fastmerge.core.metric.RetryMetrics;
import com.fastmerge.core.notify.NotifyingFacade;
import com.fastmerge.core.policy.RetryPolicyRegistry;
import com.fastmerge.core.spi.PollingClient;
import com.fastmerge.core.stats.StatisticsAggregator;
import com.fastmerge.exception.RetryConfigException;
import com.fastmerge.exception.TransientActException;
import com.fastmerge.exception.TransientPollException;
import com.fastmerge.model.ActResult;
import com.fastmerge.model.AttemptRecord;
import com.fastmerge.model.AttemptResult;
import com.fastmerge.model.EngineStatistics;
import com.fastmerge.model.RawState;
import com.fastmerge.model.RetryConfig;
import com.fastmerge.model.enums.AttemptOutcome;
import com.fastmerge.model.enums.BackoffStrategy;
import com.fastmerge.model.enums.CompletionReason;
import com.fastmerge.model.enums.DeadlineMode;
import com.fastmerge.model.enums.State;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 引擎状态机测试
 *
 * 客户端用 Mockito 模拟, 时间轮与线程池为真实实例, 退避时长为毫秒级
 */
@ExtendWith(MockitoExtension.class)
class RetryEngineTest {

    static final RawState CLEAN = RawState.fromMap(Map.of("mergeable_state", "clean", "mergeable", true));
    static final RawState UNSTABLE = RawState.fromMap(Map.of("mergeable_state", "unstable"));
    static final RawState UNKNOWN = RawState.fromMap(Map.of());
    static final RawState BLOCKED = RawState.fromMap(Map.of("mergeable_state", "dirty"));
    static final RawState MERGED = RawState.fromMap(Map.of("merged", true, "state", "closed"));

    static final RetryConfig FAST = RetryConfig.builder()
            .maxRetries(3)
            .baseDelay(Duration.ofMillis(5))
            .maxDelay(Duration.ofMillis(50))
            .backoffFactor(2.0)
            .strategy(BackoffStrategy.EXPONENTIAL_BACKOFF)
            .jitter(false)
            .timeout(Duration.ofSeconds(5))
            .build();

    @Mock PollingClient client;

    HashedWheelTimer timer;
    ExecutorService dispatch;
    ExecutorService handler;
    InMemoryHistoryStore history;
    StatisticsAggregator stats;
    MeterRegistry meterRegistry;
    MergeWheelProperties props;
    RetryEngine engine;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTimer(1, TimeUnit.MILLISECONDS);
        dispatch = Executors.newFixedThreadPool(8);
        handler = Executors.newCachedThreadPool();
        history = new InMemoryHistoryStore();
        stats = new StatisticsAggregator();
        meterRegistry = new SimpleMeterRegistry();
        props = new MergeWheelProperties();
        props.setCallTimeout(Duration.ofSeconds(2));
        engine = newEngine(new RetryPolicyRegistry(FAST, Map.of()));
    }

    @AfterEach
    void tearDown() {
        engine.gracefulShutdown(1);
    }

    RetryEngine newEngine(RetryPolicyRegistry policies) {
        return new RetryEngine(timer, dispatch, handler, client, new MergeableStateClassifier(),
                new DelayCalculator(new BackoffRegistry()), policies, history, stats,
                RetryMetrics.create(meterRegistry), NotifyingFacade.noop(), GuardedClientExecutor.disabled(),
                props, "test-node", Clock.systemUTC());
    }

    // ------------------------------------------------------------------
    // 基本场景
    // ------------------------------------------------------------------

    @Test
    void attempt_cleanOnFirstPoll_actsOnceAndSucceeds() throws Exception {
        when(client.fetch("pr-1")).thenReturn(CLEAN);
        when(client.act("pr-1")).thenReturn(ActResult.success("sha-1"));

        AttemptResult result = engine.attempt("pr-1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReason()).isEqualTo(CompletionReason.MERGED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getFinalState()).isEqualTo(State.CLEAN);
        assertThat(result.getHistory()).hasSize(1);
        assertThat(result.getHistory().get(0).getOutcome()).isEqualTo(AttemptOutcome.SUCCEEDED);
        verify(client, times(1)).act("pr-1");
    }

    @Test
    void attempt_unstableTwiceThenClean_succeedsWithGrowingDelays() throws Exception {
        when(client.fetch("pr-2")).thenReturn(UNSTABLE, UNSTABLE, CLEAN);
        when(client.act("pr-2")).thenReturn(ActResult.success("sha-2"));

        AttemptResult result = engine.attempt("pr-2");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(3);
        List<AttemptRecord> records = result.getHistory();
        assertThat(records).extracting(AttemptRecord::getOutcome)
                .containsExactly(AttemptOutcome.RETRYING, AttemptOutcome.RETRYING, AttemptOutcome.SUCCEEDED);
        Duration first = records.get(0).getDelayApplied();
        Duration second = records.get(1).getDelayApplied();
        assertThat(second).isGreaterThanOrEqualTo(first);
        assertThat(records.get(2).delay()).isEmpty();
        verify(client, times(1)).act("pr-2");
    }

    @Test
    void attempt_alwaysUnknown_exhaustsAfterMaxRetries() throws Exception {
        when(client.fetch("pr-3")).thenReturn(UNKNOWN);

        AttemptResult result = engine.attempt("pr-3");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo(CompletionReason.RETRIES_EXHAUSTED);
        assertThat(result.getAttempts()).isEqualTo(FAST.getMaxRetries() + 1);
        assertThat(result.getHistory()).extracting(AttemptRecord::getOutcome).containsExactly(
                AttemptOutcome.RETRYING, AttemptOutcome.RETRYING, AttemptOutcome.RETRYING,
                AttemptOutcome.FAILED_EXHAUSTED);
        verify(client, times(4)).fetch("pr-3");
        verify(client, never()).act(anyString());
    }

    @Test
    void attempt_delaysExceedTimeout_failsBeforeMaxRetries() throws Exception {
        RetryConfig slow = RetryConfig.builder()
                .maxRetries(10)
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(1))
                .backoffFactor(2.0)
                .strategy(BackoffStrategy.EXPONENTIAL_BACKOFF)
                .timeout(Duration.ofMillis(500))
                .build();
        when(client.fetch("pr-4")).thenReturn(UNSTABLE);

        AttemptResult result = engine.attempt("pr-4", Map.of(State.UNSTABLE, slow));

        assertThat(result.getReason()).isEqualTo(CompletionReason.TIMEOUT_EXCEEDED);
        assertThat(result.getAttempts()).isLessThan(slow.getMaxRetries() + 1);
        assertThat(result.getHistory().get(result.getHistory().size() - 1).getOutcome())
                .isEqualTo(AttemptOutcome.FAILED_TIMEOUT);
        // 不会为了判超时而睡满最后一次退避
        assertThat(result.getElapsed()).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void attempt_blockedOnFirstPoll_failsTerminalImmediately() throws Exception {
        when(client.fetch("pr-5")).thenReturn(BLOCKED);

        AttemptResult result = engine.attempt("pr-5", Map.of(State.BLOCKED, FAST.toBuilder().maxRetries(50).build()));

        assertThat(result.getReason()).isEqualTo(CompletionReason.TERMINAL_STATE);
        assertThat(result.getFinalState()).isEqualTo(State.BLOCKED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getHistory()).singleElement()
                .extracting(AttemptRecord::getOutcome).isEqualTo(AttemptOutcome.FAILED_TERMINAL);
        verify(client, never()).act(anyString());
    }

    @Test
    void attempt_alreadyMerged_succeedsWithoutAct() throws Exception {
        when(client.fetch("pr-6")).thenReturn(MERGED);

        AttemptResult result = engine.attempt("pr-6");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReason()).isEqualTo(CompletionReason.ALREADY_DONE);
        assertThat(result.getFinalState()).isEqualTo(State.ALREADY_DONE);
        verify(client, never()).act(anyString());
    }

    // ------------------------------------------------------------------
    // 客户端错误
    // ------------------------------------------------------------------

    @Test
    void attempt_fetchThrows_treatedAsUnknownAndRecorded() throws Exception {
        when(client.fetch("pr-7"))
                .thenThrow(new IOException("connection reset"))
                .thenReturn(CLEAN);
        when(client.act("pr-7")).thenReturn(ActResult.success("sha-7"));

        AttemptResult result = engine.attempt("pr-7");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(2);
        AttemptRecord first = result.getHistory().get(0);
        assertThat(first.getObservedState()).isEqualTo(State.UNKNOWN);
        assertThat(first.getOutcome()).isEqualTo(AttemptOutcome.RETRYING);
        assertThat(first.getRawError()).isInstanceOf(TransientPollException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(meterRegistry.get("merge.client.errors").tag("op", "fetch").counter().count()).isEqualTo(1.0);
    }

    @Test
    void attempt_actRejected_retriesUnderUnknownPolicy() throws Exception {
        when(client.fetch("pr-8")).thenReturn(CLEAN);
        when(client.act("pr-8"))
                .thenReturn(ActResult.rejected("base branch was modified"))
                .thenReturn(ActResult.success("sha-8"));

        AttemptResult result = engine.attempt("pr-8");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(2);
        AttemptRecord first = result.getHistory().get(0);
        assertThat(first.getObservedState()).isEqualTo(State.CLEAN);
        assertThat(first.getRawError()).isInstanceOf(TransientActException.class)
                .hasMessageContaining("base branch was modified");
        assertThat(meterRegistry.get("merge.client.errors").tag("op", "act").counter().count()).isEqualTo(1.0);
    }

    @Test
    void attempt_actKeepsThrowing_exhaustsAndKeepsLastError() throws Exception {
        when(client.fetch("pr-9")).thenReturn(CLEAN);
        when(client.act("pr-9")).thenThrow(new IllegalStateException("405 not allowed"));

        AttemptResult result = engine.attempt("pr-9", Map.of(State.UNKNOWN, FAST.toBuilder().maxRetries(1).build()));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo(CompletionReason.RETRIES_EXHAUSTED);
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(result.lastError()).containsInstanceOf(TransientActException.class);
        verify(client, times(2)).act("pr-9");
    }

    // ------------------------------------------------------------------
    // 配置
    // ------------------------------------------------------------------

    @Test
    void attempt_invalidOverride_rejectedBeforeAnyPoll() throws Exception {
        assertThatThrownBy(() -> engine.attempt("pr-10", Collections.singletonMap(State.UNKNOWN, null)))
                .isInstanceOf(RetryConfigException.class);

        verify(client, never()).fetch(anyString());
        assertThat(engine.getHistory("pr-10")).isEmpty();
        assertThat(engine.getStatistics()).isEqualTo(EngineStatistics.EMPTY);
    }

    @Test
    void attempt_zeroRetriesOverride_exhaustsAfterSinglePoll() throws Exception {
        when(client.fetch("pr-11")).thenReturn(UNSTABLE);

        AttemptResult result = engine.attempt("pr-11", Map.of(State.UNSTABLE, FAST.toBuilder().maxRetries(0).build()));

        assertThat(result.getReason()).isEqualTo(CompletionReason.RETRIES_EXHAUSTED);
        assertThat(result.getAttempts()).isEqualTo(1);
        // 覆盖只作用于本次调用
        assertThat(engine.getPolicies().configFor(State.UNSTABLE)).isEqualTo(FAST);
    }

    @Test
    void attempt_randomTransientSequences_neverPollMoreThanMaxRetriesPlusOne() throws Exception {
        Random random = new Random(42);
        RawState[] transients = {UNSTABLE, UNKNOWN, RawState.fromMap(Map.of("draft", true))};
        when(client.fetch(anyString())).thenAnswer(inv -> transients[random.nextInt(transients.length)]);

        for (int max = 0; max <= 4; max++) {
            RetryConfig cfg = FAST.toBuilder().maxRetries(max).baseDelay(Duration.ofMillis(1)).build();
            Map<State, RetryConfig> overrides = Map.of(State.UNSTABLE, cfg, State.UNKNOWN, cfg, State.DRAFT, cfg);

            AttemptResult result = engine.attempt("seq-" + max, overrides);

            assertThat(result.getAttempts()).isEqualTo(max + 1);
            assertThat(result.getReason()).isEqualTo(CompletionReason.RETRIES_EXHAUSTED);
        }
    }

    // ------------------------------------------------------------------
    // 截止时间模式
    // ------------------------------------------------------------------

    @Test
    void attempt_globalDeadline_timesOutAcrossStateChanges() throws Exception {
        stubAlternatingThenClean("pr-12");

        AttemptResult result = engine.attempt("pr-12", alternatingPolicy());

        assertThat(result.getReason()).isEqualTo(CompletionReason.TIMEOUT_EXCEEDED);
    }

    @Test
    void attempt_resetOnStateChange_deadlineRestartsWhenStateMoves() throws Exception {
        props.setDeadlineMode(DeadlineMode.RESET_ON_STATE_CHANGE);
        stubAlternatingThenClean("pr-13");
        when(client.act("pr-13")).thenReturn(ActResult.success("sha-13"));

        AttemptResult result = engine.attempt("pr-13", alternatingPolicy());

        assertThat(result.getReason()).isEqualTo(CompletionReason.MERGED);
        assertThat(result.getAttempts()).isEqualTo(5);
    }

    private void stubAlternatingThenClean(String id) throws Exception {
        when(client.fetch(id)).thenReturn(UNKNOWN, UNSTABLE, UNKNOWN, UNSTABLE, CLEAN);
    }

    private Map<State, RetryConfig> alternatingPolicy() {
        RetryConfig cfg = RetryConfig.builder()
                .maxRetries(10)
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofMillis(100))
                .backoffFactor(1.0)
                .strategy(BackoffStrategy.FIXED)
                .timeout(Duration.ofMillis(250))
                .build();
        return Map.of(State.UNKNOWN, cfg, State.UNSTABLE, cfg);
    }

    // ------------------------------------------------------------------
    // 取消与并发
    // ------------------------------------------------------------------

    @Test
    void submit_cancelDuringBackoff_finishesPromptly() throws Exception {
        CountDownLatch polled = new CountDownLatch(1);
        when(client.fetch("pr-14")).thenAnswer(inv -> {
            polled.countDown();
            return UNSTABLE;
        });
        RetryConfig longWait = FAST.toBuilder()
                .baseDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(10))
                .timeout(Duration.ofMinutes(1))
                .build();

        AttemptHandle handle = engine.submit("pr-14", Map.of(State.UNSTABLE, longWait));
        assertThat(polled.await(2, TimeUnit.SECONDS)).isTrue();
        handle.cancel();

        AttemptResult result = handle.result().get(2, TimeUnit.SECONDS);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo(CompletionReason.CANCELLED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getHistory().get(result.getHistory().size() - 1).getOutcome())
                .isEqualTo(AttemptOutcome.CANCELLED);
    }

    @Test
    void attempt_cancelledBeforeStart_neverPolls() throws Exception {
        CancellationToken token = new CancellationToken();
        token.cancel();

        AttemptResult result = engine.attempt("pr-15", null, token);

        assertThat(result.getReason()).isEqualTo(CompletionReason.CANCELLED);
        assertThat(result.getAttempts()).isZero();
        assertThat(result.getHistory()).singleElement().satisfies(r -> {
            assertThat(r.getAttemptNumber()).isEqualTo(1);
            assertThat(r.getOutcome()).isEqualTo(AttemptOutcome.CANCELLED);
        });
        verify(client, never()).fetch(anyString());
    }

    @Test
    void attempt_afterShutdown_returnsCancelled() throws Exception {
        engine.gracefulShutdown(1);

        AttemptResult result = engine.attempt("pr-16");

        assertThat(result.getReason()).isEqualTo(CompletionReason.CANCELLED);
        verify(client, never()).fetch(anyString());
    }

    @Test
    void submit_cancelDuringBlockedFetch_finishesPromptlyWithoutError() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.fetch("pr-17")).thenAnswer(inv -> {
            entered.countDown();
            release.await();
            return CLEAN;
        });

        AttemptHandle handle = engine.submit("pr-17", null);
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
        long startNanos = System.nanoTime();
        handle.cancel();

        AttemptResult result = handle.result().get(1, TimeUnit.SECONDS);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)).isLessThan(1000L);
        assertThat(result.getReason()).isEqualTo(CompletionReason.CANCELLED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getHistory()).singleElement().satisfies(r -> {
            assertThat(r.getOutcome()).isEqualTo(AttemptOutcome.CANCELLED);
            assertThat(r.getRawError()).isNull();
        });
        assertThat(result.lastError()).isEmpty();
        assertThat(meterRegistry.get("merge.client.errors").tag("op", "fetch").counter().count()).isZero();
        verify(client, never()).act(anyString());
        release.countDown();
    }

    @Test
    void submit_cancelDuringBlockedAct_finishesCancelledWithoutActError() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.fetch("pr-18")).thenReturn(CLEAN);
        when(client.act("pr-18")).thenAnswer(inv -> {
            entered.countDown();
            release.await();
            return ActResult.success("sha-18");
        });

        AttemptHandle handle = engine.submit("pr-18", null);
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
        handle.cancel();

        AttemptResult result = handle.result().get(1, TimeUnit.SECONDS);
        assertThat(result.getReason()).isEqualTo(CompletionReason.CANCELLED);
        assertThat(result.getFinalState()).isEqualTo(State.CLEAN);
        assertThat(result.lastError()).isEmpty();
        assertThat(meterRegistry.get("merge.client.errors").tag("op", "act").counter().count()).isZero();
        release.countDown();
    }

    @Test
    void submit_afterShutdownWithCallerRunsPool_completesCancelled() throws Exception {
        engine.gracefulShutdown(1);
        dispatch = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
                new ThreadPoolExecutor.CallerRunsPolicy());
        timer = new HashedWheelTimer(1, TimeUnit.MILLISECONDS);
        handler = Executors.newCachedThreadPool();
        engine = newEngine(new RetryPolicyRegistry(FAST, Map.of()));
        engine.gracefulShutdown(1);

        AttemptHandle handle = engine.submit("pr-19", null);

        AttemptResult result = handle.result().get(2, TimeUnit.SECONDS);
        assertThat(result.getReason()).isEqualTo(CompletionReason.CANCELLED);
        assertThat(result.getAttempts()).isZero();
        assertThat(handle.isCancelled()).isTrue();
        assertThat(engine.getHistory("pr-19")).singleElement()
                .satisfies(r -> assertThat(r.getOutcome()).isEqualTo(AttemptOutcome.CANCELLED));
        verify(client, never()).fetch(anyString());
    }

    @Test
    void submit_rejectedBySaturatedPool_completesCancelled() throws Exception {
        engine.gracefulShutdown(1);
        dispatch = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new ThreadPoolExecutor.AbortPolicy());
        timer = new HashedWheelTimer(1, TimeUnit.MILLISECONDS);
        handler = Executors.newCachedThreadPool();
        engine = newEngine(new RetryPolicyRegistry(FAST, Map.of()));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.fetch("pr-20")).thenAnswer(inv -> {
            entered.countDown();
            release.await();
            return MERGED;
        });

        AttemptHandle busy = engine.submit("pr-20", null);
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
        AttemptHandle rejected = engine.submit("pr-21", null);

        AttemptResult result = rejected.result().get(2, TimeUnit.SECONDS);
        assertThat(result.getReason()).isEqualTo(CompletionReason.CANCELLED);
        assertThat(result.getAttempts()).isZero();
        verify(client, never()).fetch("pr-21");

        release.countDown();
        assertThat(busy.result().get(2, TimeUnit.SECONDS).getReason()).isEqualTo(CompletionReason.ALREADY_DONE);
    }

    @Test
    void attempt_hugeMaxDelayOverride_rejectedAsConfigError() throws Exception {
        RetryConfig.RetryConfigBuilder huge = FAST.toBuilder().maxDelay(Duration.ofDays(365L * 300));

        assertThatThrownBy(() -> engine.attempt("pr-22", Map.of(State.UNSTABLE, huge.build())))
                .isInstanceOf(RetryConfigException.class);
        verify(client, never()).fetch(anyString());
    }

    @Test
    void attempt_timeoutAtNanoLimit_doesNotOverflowDeadlineCheck() throws Exception {
        when(client.fetch("pr-23")).thenReturn(UNSTABLE, CLEAN);
        when(client.act("pr-23")).thenReturn(ActResult.success("sha-23"));
        RetryConfig longest = FAST.toBuilder().timeout(RetryConfig.MAX_DURATION).build();

        AttemptResult result = engine.attempt("pr-23", Map.of(State.UNSTABLE, longest));

        assertThat(result.getReason()).isEqualTo(CompletionReason.MERGED);
        assertThat(result.getAttempts()).isEqualTo(2);
    }

    @Test
    void submit_distinctResourcesConcurrently_keepHistoriesApart() throws Exception {
        AtomicInteger acts = new AtomicInteger();
        Set<String> seen = ConcurrentHashMap.newKeySet();
        // 每个资源第一次 UNSTABLE, 之后 CLEAN
        when(client.fetch(anyString())).thenAnswer(inv -> seen.add(inv.getArgument(0)) ? UNSTABLE : CLEAN);
        when(client.act(anyString())).thenAnswer(inv -> {
            acts.incrementAndGet();
            return ActResult.success("sha");
        });

        List<AttemptHandle> handles = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            handles.add(engine.submit("res-" + i, null));
        }
        for (AttemptHandle h : handles) {
            AttemptResult r = h.result().get(5, TimeUnit.SECONDS);
            assertThat(r.isSuccess()).isTrue();
            assertThat(r.getAttempts()).isEqualTo(2);
            assertThat(engine.getHistory(h.getResourceId())).isEqualTo(r.getHistory());
        }

        EngineStatistics s = engine.getStatistics();
        assertThat(s.getTotalResources()).isEqualTo(20);
        assertThat(s.getSuccessRate()).isEqualTo(1.0);
        assertThat(acts.get()).isEqualTo(20);
    }

    // ------------------------------------------------------------------
    // 历史与统计
    // ------------------------------------------------------------------

    @Test
    void history_accumulatesAcrossCalls_andStatisticsCountEachCallOnce() throws Exception {
        when(client.fetch("pr-17")).thenReturn(UNSTABLE, BLOCKED, MERGED);

        AttemptResult first = engine.attempt("pr-17", Map.of(State.UNSTABLE, FAST.toBuilder().maxRetries(0).build()));
        AttemptResult second = engine.attempt("pr-17");
        AttemptResult third = engine.attempt("pr-17");

        assertThat(first.getReason()).isEqualTo(CompletionReason.RETRIES_EXHAUSTED);
        assertThat(second.getReason()).isEqualTo(CompletionReason.TERMINAL_STATE);
        assertThat(third.getReason()).isEqualTo(CompletionReason.ALREADY_DONE);
        assertThat(engine.getHistory("pr-17")).hasSize(3);

        EngineStatistics s = engine.getStatistics();
        assertThat(s.getTotalResources()).isEqualTo(3);
        assertThat(s.getSuccessfulResources()).isEqualTo(1);
        assertThat(s.getTotalAttempts()).isEqualTo(3);
        assertThat(s.countOf(CompletionReason.TERMINAL_STATE)).isEqualTo(1);

        engine.resetStatistics();
        assertThat(engine.getStatistics().getTotalResources()).isZero();
        assertThat(engine.getHistory("pr-17")).hasSize(3);
    }
}

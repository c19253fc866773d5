package com.fastmerge.core.metric;

import com.fastmerge.model.enums.CompletionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class RetryMetrics {
    private final Counter polls;
    private final Counter retries;
    private final Counter pollErr;
    private final Counter actErr;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final Map<CompletionReason, Counter> results = new EnumMap<>(CompletionReason.class);
    private final DistributionSummary attempts;
    private final Timer attemptTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.polls    = Counter.builder("merge.attempt.polls").description("resource polls").register(reg);
        this.retries  = Counter.builder("merge.attempt.retries").description("backoff sleeps scheduled").register(reg);
        this.pollErr  = Counter.builder("merge.client.errors").tag("op", "fetch").description("fetch errors").register(reg);
        this.actErr   = Counter.builder("merge.client.errors").tag("op", "act").description("act errors").register(reg);
        for (CompletionReason r : CompletionReason.values()) {
            results.put(r, Counter.builder("merge.result")
                    .tag("reason", r.name())
                    .tag("success", String.valueOf(r.success))
                    .description("completed attempt calls").register(reg));
        }
        this.attempts = DistributionSummary.builder("merge.attempts")
                .description("polls per attempt call").baseUnit("times").register(reg);
        this.notifySuppressed = Counter.builder("merge.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("merge.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("merge.notify.failed").description("notify failed").register(reg);
        this.attemptTimer = Timer.builder("merge.attempt.time").description("wall time per attempt call").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    /** 未接入注册表时使用 */
    public static RetryMetrics noop() { return new RetryMetrics(new SimpleMeterRegistry()); }

    public void incPoll(){     polls.increment(); }
    public void incRetry(){    retries.increment(); }
    public void incPollErr(){  pollErr.increment(); }
    public void incActErr(){   actErr.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment();}
    public void incNotifyFailed(){ notifyFailed.increment();}
    public void incNotifySent(){ notifySent.increment();}

    /** attempt 调用完成 */
    public void recordResult(CompletionReason reason, int n, long nanos) {
        results.get(reason).increment();
        attempts.record(n);
        attemptTimer.record(nanos, TimeUnit.NANOSECONDS);
    }
}

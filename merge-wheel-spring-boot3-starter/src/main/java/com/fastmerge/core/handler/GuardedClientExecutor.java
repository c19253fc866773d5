package com.fastmerge.core.handler;

import com.fastmerge.config.MergeGuardProperties;
import com.fastmerge.exception.guard.DownstreamOpenCircuitException;
import com.fastmerge.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 对 PollingClient 的 fetch/act 调用增加 RL/CB 保护
 * 按操作名（fetch/act）分别建熔断器与限流器
 */
public class GuardedClientExecutor {

    public static final String OP_FETCH = "fetch";
    public static final String OP_ACT = "act";

    private final MergeGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedClientExecutor(MergeGuardProperties props) {
        this.props = props;
    }

    /** 不做任何保护 */
    public static GuardedClientExecutor disabled() {
        MergeGuardProperties p = new MergeGuardProperties();
        p.setEnabled(false);
        return new GuardedClientExecutor(p);
    }

    /**
     * 统一入口
     * 组合装饰 RateLimiter → CircuitBreaker 后执行
     */
    public <T> T execute(String op, Callable<T> call) throws Exception {
        if (!props.isEnabled()) {
            return call.call();
        }
        Callable<T> decorated = call;

        // CircuitBreaker fail-fast 熔断器
        if (props.getCircuitBreaker().isEnabled()) {
            CircuitBreaker cb = cbCache.computeIfAbsent(op, this::buildCb);
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }

        // RateLimit最外层限流，避免打满外部 API 配额
        if (props.getRateLimiter().isEnabled()) {
            RateLimiter rl = rlCache.computeIfAbsent(op, this::buildRl);
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }

        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            throw new DownstreamOpenCircuitException(op, open);
        } catch (RequestNotPermitted rnp) {
            throw new DownstreamRateLimitedException(op, rnp);
        }
    }

    private RateLimiter buildRl(String op) {
        MergeGuardProperties.RlConfig r = props.getRateLimiter();
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + op, cfg);
    }

    private CircuitBreaker buildCb(String op) {
        MergeGuardProperties.CbConfig c = props.getCircuitBreaker();
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + op, cfg);
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String op) {
        if (!props.isEnabled() || !props.getCircuitBreaker().isEnabled()) {
            return null;
        }
        return cbCache.computeIfAbsent(op, this::buildCb);
    }
}

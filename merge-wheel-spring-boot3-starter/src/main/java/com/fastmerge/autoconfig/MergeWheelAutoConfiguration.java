package com.fastmerge.autoconfig;

import com.fastmerge.config.MergeGuardProperties;
import com.fastmerge.config.MergeNotifierProperties;
import com.fastmerge.config.MergeWheelProperties;
import com.fastmerge.core.MergeEngineLifecycle;
import com.fastmerge.core.backoff.BackoffRegistry;
import com.fastmerge.core.backoff.DelayCalculator;
import com.fastmerge.core.classify.MergeableStateClassifier;
import com.fastmerge.core.engine.RetryEngine;
import com.fastmerge.core.handler.GuardedClientExecutor;
import com.fastmerge.core.history.InMemoryHistoryStore;
import com.fastmerge.core.metric.RetryMetrics;
import com.fastmerge.core.notify.NotifyingFacade;
import com.fastmerge.core.policy.RetryPolicyRegistry;
import com.fastmerge.core.spi.BackoffPolicy;
import com.fastmerge.core.spi.HistoryStore;
import com.fastmerge.core.spi.PollingClient;
import com.fastmerge.core.spi.StateClassifier;
import com.fastmerge.core.stats.StatisticsAggregator;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮、线程池与合并重试引擎
 * 业务方提供 PollingClient Bean 后引擎才会装配
 */
@AutoConfiguration(after = {
        MergeWheelMetricsAutoConfiguration.class,
        MergeNotifierAutoConfiguration.class,
        MergeGuardAutoConfiguration.class
})
@EnableConfigurationProperties({
        MergeWheelProperties.class,
        MergeGuardProperties.class,
        MergeNotifierProperties.class
})
public class MergeWheelAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean(HashedWheelTimer.class)
    public HashedWheelTimer mergeWheelTimer(MergeWheelProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("merge-wheel-timer"),
                props.wheelTickMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                -1
        );
    }

    /**
     * submit 异步 attempt 线程池
     */
    @Bean(name = "mergeDispatchExecutor")
    public ExecutorService mergeDispatchExecutor(MergeWheelProperties props) {
        return newExecutor(props.getExecutor(), "merge-dispatch-exec");
    }

    /**
     * fetch/act 执行线程池
     */
    @Bean(name = "mergeHandlerExecutor")
    public ExecutorService mergeHandlerExecutor(MergeWheelProperties props) {
        return newExecutor(props.getHandlerExecutor(), "merge-handler-exec");
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(@Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(discoveredPolicies);
    }

    @Bean
    @ConditionalOnMissingBean
    public DelayCalculator delayCalculator(BackoffRegistry backoffRegistry) {
        return new DelayCalculator(backoffRegistry);
    }

    /**
     * 默认分类器, 按 PR 字段分类
     */
    @Bean
    @ConditionalOnMissingBean(StateClassifier.class)
    public StateClassifier stateClassifier() {
        return new MergeableStateClassifier();
    }

    /**
     * 配置中的默认策略与状态策略, 非法配置在启动时失败
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicyRegistry retryPolicyRegistry(MergeWheelProperties props) {
        return props.toPolicyRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(HistoryStore.class)
    public HistoryStore historyStore() {
        return new InMemoryHistoryStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public StatisticsAggregator statisticsAggregator() {
        return new StatisticsAggregator();
    }

    /**
     * 重试引擎
     */
    @Bean
    @ConditionalOnBean(PollingClient.class)
    @ConditionalOnMissingBean
    public RetryEngine retryEngine(HashedWheelTimer timer,
                                   @Qualifier("mergeDispatchExecutor") ExecutorService dispatchExecutor,
                                   @Qualifier("mergeHandlerExecutor") ExecutorService handlerExecutor,
                                   PollingClient client,
                                   StateClassifier classifier,
                                   DelayCalculator delayCalculator,
                                   RetryPolicyRegistry policies,
                                   HistoryStore historyStore,
                                   StatisticsAggregator statistics,
                                   RetryMetrics meter,
                                   NotifyingFacade notifyService,
                                   GuardedClientExecutor guard,
                                   MergeWheelProperties props,
                                   Environment env) {
        String nodeId = props.resolveNodeId(env.getProperty("spring.application.name", "merge-wheel"));
        return new RetryEngine(timer, dispatchExecutor, handlerExecutor, client, classifier, delayCalculator,
                policies, historyStore, statistics, meter, notifyService, guard, props, nodeId, Clock.systemUTC());
    }

    /**
     * 引擎生命周期, 负责启动信息与优雅停机
     */
    @Bean
    @ConditionalOnBean(RetryEngine.class)
    public MergeEngineLifecycle mergeEngineLifecycle(RetryEngine engine,
                                                     MergeWheelProperties props,
                                                     MergeGuardProperties guardProps,
                                                     MergeNotifierProperties notifyProps) {
        return new MergeEngineLifecycle(engine, props, guardProps, notifyProps);
    }

    private static ExecutorService newExecutor(MergeWheelProperties.Exec exec, String name) {
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory(name),
                exec.getRejectedHandler().toHandler()
        );
    }
}

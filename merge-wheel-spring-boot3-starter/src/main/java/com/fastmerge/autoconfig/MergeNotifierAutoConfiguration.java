package com.fastmerge.autoconfig;

import com.fastmerge.config.MergeNotifierProperties;
import com.fastmerge.core.metric.RetryMetrics;
import com.fastmerge.core.notify.AsyncNotifyingService;
import com.fastmerge.core.notify.NotifyingFacade;
import com.fastmerge.core.notify.notifier.LoggingNotifier;
import com.fastmerge.core.notify.ratelimit.RateLimitFilter;
import com.fastmerge.core.spi.notify.Notifier;
import com.fastmerge.core.spi.notify.NotifierFilter;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@AutoConfiguration(after = MergeWheelMetricsAutoConfiguration.class)
@EnableConfigurationProperties(MergeNotifierProperties.class)
public class MergeNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "merge.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(ObjectProvider<Notifier> notifiers,
                                                       RetryMetrics metrics,
                                                       MergeNotifierProperties props) {
        MergeNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                new NamedThreadFactory("merge-notify"),
                // 队列满时丢弃, 不阻塞 attempt 线程
                new ThreadPoolExecutor.AbortPolicy());
        // 先按级别过滤, 再限流, 被级别丢弃的事件不占限流额度
        NotifierFilter filter = NotifierFilter.atLeast(props.getMinSeverity())
                .and(new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold()));
        return new AsyncNotifyingService(exec, notifiers.orderedStream().toList(), filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}

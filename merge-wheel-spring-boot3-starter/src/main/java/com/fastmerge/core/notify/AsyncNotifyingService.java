package com.fastmerge.core.notify;

import com.fastmerge.core.metric.RetryMetrics;
import com.fastmerge.core.spi.notify.Notifier;
import com.fastmerge.core.spi.notify.NotifierFilter;
import com.fastmerge.model.ctx.NotifyContext;
import com.fastmerge.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发
 * 通过过滤、限流、异步执行通知
 */
public class AsyncNotifyingService {

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private static final int MAX_SEND_ATTEMPTS = 3;

    private final ExecutorService exec;

    private final List<Notifier> notifiers;

    private final NotifierFilter filter;

    private final RetryMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, List<Notifier> notifiers, NotifierFilter filter, RetryMetrics metrics) {
        this.exec = exec;
        this.notifiers = List.copyOf(notifiers);
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] event={} resource={} rejected, executor saturated or stopped",
                    ctx.getType(), ctx.getResourceId());
        }
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        for (Notifier n : notifiers) {
            if (!n.supports(ctx.getType())) {
                continue;
            }
            try {
                // 重试
                int attempt = 0;
                long backoff = 200;
                while (true) {
                    try {
                        n.notify(ctx, sev);
                        break;
                    } catch (RuntimeException e) {
                        if (++attempt >= MAX_SEND_ATTEMPTS) {
                            throw e;
                        }
                        Thread.sleep(backoff);
                        // 指数退避
                        backoff = Math.min(backoff * 2, 4000);
                    }
                }
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] channel={} event={} interrupted", n.name(), ctx.getType());
                return;
            } catch (RuntimeException e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }

    public void shutdown() {
        exec.shutdown();
    }
}

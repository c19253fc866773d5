package com.fastmerge.core.notify.ratelimit;

import com.fastmerge.core.spi.notify.NotifierFilter;
import com.fastmerge.model.ctx.NotifyContext;
import com.fastmerge.model.enums.Severity;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 固定窗口计数, 每个 事件类型+严重级别 各自一个窗口
 * 同一 PR 反复 ACT_FAILED 时不会刷屏, 也不影响其他类型的事件
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    private final Clock clock;

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int threshold) {
        this(window, threshold, Clock.systemUTC());
    }

    public RateLimitFilter(Duration window, int threshold, Clock clock) {
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        long now = clock.millis();
        Window w = windows.compute(ctx.getType() + "/" + sev, (k, cur) ->
                cur == null || now - cur.start >= windowMs ? new Window(now) : cur.hit());
        return w.count <= threshold;
    }

    /** 不可变窗口, 在 compute 内替换 */
    private static final class Window {
        final long start;
        final int count;

        Window(long start) {
            this(start, 1);
        }

        private Window(long start, int count) {
            this.start = start;
            this.count = count;
        }

        Window hit() {
            return new Window(start, count + 1);
        }
    }
}

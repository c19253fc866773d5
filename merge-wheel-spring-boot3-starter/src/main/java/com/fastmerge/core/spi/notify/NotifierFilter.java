package com.fastmerge.core.spi.notify;

import com.fastmerge.model.ctx.NotifyContext;
import com.fastmerge.model.enums.Severity;

/**
 * 派发前过滤, 返回 false 的事件计入 suppressed
 */
@FunctionalInterface
public interface NotifierFilter {

    boolean allow(NotifyContext ctx, Severity sev);

    /** 两个过滤器都放行才放行, 前者拒绝时后者不计数 */
    default NotifierFilter and(NotifierFilter next) {
        return (ctx, sev) -> allow(ctx, sev) && next.allow(ctx, sev);
    }

    /** 丢弃低于 min 的事件 */
    static NotifierFilter atLeast(Severity min) {
        return (ctx, sev) -> sev.ordinal() >= min.ordinal();
    }
}

package com.fastmerge.core.spi.notify;

import com.fastmerge.model.ctx.NotifyContext;
import com.fastmerge.model.enums.NotifyEventType;
import com.fastmerge.model.enums.Severity;

/**
 * 通知渠道（日志、IM 机器人、邮件等）, 以 Bean 形式注册即生效
 * 由 AsyncNotifyingService 在通知线程池中调用, 抛出的异常会被重试
 */
public interface Notifier {

    /** 渠道名, 出现在日志中 */
    String name();

    /** 只关心部分事件的渠道覆盖此方法 */
    default boolean supports(NotifyEventType type) {
        return true;
    }

    void notify(NotifyContext ctx, Severity severity);
}

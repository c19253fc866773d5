package com.fastmerge.core.notify;

import com.fastmerge.model.ctx.NotifyContext;
import com.fastmerge.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

/**
 * 引擎侧唯一的通知入口, merge.notify.enabled=false 时什么也不做
 */
public class NotifyingFacade {

    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        this(provider::getIfAvailable);
    }

    public NotifyingFacade(Supplier<AsyncNotifyingService> delegate) {
        this.delegate = delegate;
    }

    public static NotifyingFacade noop() {
        return new NotifyingFacade(() -> null);
    }

    public boolean isEnabled() {
        return delegate.get() != null;
    }

    /** 不会抛出, 也不会阻塞调用线程 */
    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService service = delegate.get();
        if (service == null) {
            return;
        }
        service.fire(ctx, sev);
    }
}

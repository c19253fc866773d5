package com.fastmerge.core.notify.notifier;

import com.fastmerge.core.spi.notify.Notifier;
import com.fastmerge.model.ctx.NotifyContext;
import com.fastmerge.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 默认渠道, 写应用日志
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private static final int MAX_ERROR_LOG = 500;

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        String line = "[Notify-" + ctx.getType() + "] node=" + ctx.getNodeId()
                + " resource=" + ctx.getResourceId()
                + " state=" + ctx.getState()
                + " attempts=" + ctx.getAttempts() + "/" + (ctx.getMaxRetries() == null ? "-" : ctx.getMaxRetries() + 1)
                + " reason=" + ctx.getReasonCode();
        if (ctx.getLastError() != null) {
            String err = ctx.getLastError();
            line += " error=" + (err.length() > MAX_ERROR_LOG ? err.substring(0, MAX_ERROR_LOG) + "..." : err);
        }
        if (severity == Severity.INFO) {
            log.info(line);
        } else if (severity == Severity.WARNING) {
            log.warn(line);
        } else {
            log.error("{} attrs={}", line, ctx.getAttributes());
        }
    }
}

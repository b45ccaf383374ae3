package com.notifywheel.core.notify.notifier;

import com.notifywheel.core.spi.notify.Notifier;
import com.notifywheel.model.ctx.NotifyContext;
import com.notifywheel.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] user={}, room={}, failures={}/{}, reason={}, err={}, attrs={}",
                    ctx.getType(), ctx.getUserId(), ctx.getRoomId(), ctx.getFailureCount(), ctx.getFailureThreshold(),
                    ctx.getReasonCode(), truncate(ctx.getLastError()), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] user={}, room={}, failures={}/{}, reason={}, attrs={}",
                    ctx.getType(), ctx.getUserId(), ctx.getRoomId(), ctx.getFailureCount(), ctx.getFailureThreshold(),
                    ctx.getReasonCode(), ctx.getAttributes());
            default -> log.info("[Notify-{}] user={}, room={}", ctx.getType(), ctx.getUserId(), ctx.getRoomId());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}

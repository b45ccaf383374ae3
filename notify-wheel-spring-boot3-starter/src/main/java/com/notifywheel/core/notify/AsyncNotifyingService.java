package com.notifywheel.core.notify;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.core.engine.Sleeper;
import com.notifywheel.core.metric.PollMetrics;
import com.notifywheel.core.notify.ratelimit.AlertRateLimiter;
import com.notifywheel.core.spi.notify.Notifier;
import com.notifywheel.core.spi.notify.NotifierRouter;
import com.notifywheel.model.ctx.NotifyContext;
import com.notifywheel.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 告警异步派发: 限流 -> 路由 -> 投递到告警线程池, 按渠道重试
 * 调用方（轮询线程）从不执行通知器本身, 告警池满时直接丢弃并计数
 */
public class AsyncNotifyingService {

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final AlertRateLimiter limiter;

    private final NotifyWheelProperties.Notify.Retry retry;

    private final PollMetrics metrics;

    private final Sleeper sleeper;

    public AsyncNotifyingService(ExecutorService exec,
                                 NotifierRouter router,
                                 AlertRateLimiter limiter,
                                 NotifyWheelProperties.Notify.Retry retry,
                                 PollMetrics metrics,
                                 Sleeper sleeper) {
        this.exec = exec;
        this.router = router;
        this.limiter = limiter;
        this.retry = retry;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (limiter != null && !limiter.tryAcquire(ctx)) {
            metrics.incNotifySuppressed();
            log.debug("[Notify] {} for user={} suppressed by rate limit", ctx.getType(), ctx.getUserId());
            return;
        }
        List<Notifier> targets = router.route(ctx.getType(), sev);
        if (targets.isEmpty()) {
            return;
        }
        try {
            exec.execute(() -> deliverAll(targets, ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifySuppressed();
            log.warn("[Notify] alert pool saturated, {} for user={} dropped", ctx.getType(), ctx.getUserId());
        }
    }

    private void deliverAll(List<Notifier> targets, NotifyContext ctx, Severity sev) {
        for (Notifier n : targets) {
            try {
                deliver(n, ctx, sev);
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] channel={} event={} interrupted", n.name(), ctx.getType());
                return;
            } catch (Exception e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} user={} failed after {} attempts",
                        n.name(), ctx.getType(), ctx.getUserId(), retry.getMaxAttempts(), e);
            }
        }
    }

    private void deliver(Notifier n, NotifyContext ctx, Severity sev) throws Exception {
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        long backoff = retry.getBackoff().toMillis();
        long maxBackoff = retry.getMaxBackoff().toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                n.notify(ctx, sev);
                return;
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.debug("[Notify] channel={} attempt {}/{} failed, retry in {}ms",
                        n.name(), attempt, maxAttempts, backoff);
                sleeper.sleep(backoff);
                backoff = Math.min(backoff * 2, maxBackoff);
            }
        }
    }

    public void shutdown() {
        exec.shutdown();
    }
}

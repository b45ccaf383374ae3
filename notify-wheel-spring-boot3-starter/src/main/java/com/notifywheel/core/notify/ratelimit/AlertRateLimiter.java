package com.notifywheel.core.notify.ratelimit;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.model.ctx.NotifyContext;
import com.notifywheel.model.enums.NotifyEventType;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 告警窗口限流, 按 (事件类型, 用户) 计数
 * 阈值按事件类型取 per-event 配置, 未配置时取默认阈值
 */
public class AlertRateLimiter {

    private final NotifyWheelProperties.Notify.RateLimit cfg;

    private final long windowMs;

    private final Clock clock;

    private volatile long windowStart;

    private final ConcurrentHashMap<String, AtomicInteger> counter = new ConcurrentHashMap<>();

    public AlertRateLimiter(NotifyWheelProperties.Notify.RateLimit cfg, Clock clock) {
        this.cfg = cfg;
        this.windowMs = cfg.getWindow().toMillis();
        this.clock = clock;
        this.windowStart = clock.millis();
    }

    /**
     * @return true 放行, false 本窗口内已达上限
     */
    public boolean tryAcquire(NotifyContext ctx) {
        long now = clock.millis();
        if (now - windowStart > windowMs) {
            windowStart = now;
            counter.clear();
        }
        NotifyEventType type = ctx.getType();
        // ENGINE_ERROR 等可能没有用户
        String key = type + "|" + (ctx.getUserId() == null ? "-" : ctx.getUserId());
        int c = counter.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return c <= cfg.thresholdFor(type);
    }
}

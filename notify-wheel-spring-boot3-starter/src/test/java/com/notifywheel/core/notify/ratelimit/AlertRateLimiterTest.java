package com.notifywheel.core.notify.ratelimit;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.model.ctx.NotifyContext;
import com.notifywheel.model.enums.NotifyEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AlertRateLimiter 测试")
class AlertRateLimiterTest {

    /** 可拨动的时钟 */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-03-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    private static NotifyContext ctx(NotifyEventType type, String userId) {
        NotifyContext c = new NotifyContext();
        c.setType(type);
        c.setUserId(userId);
        return c;
    }

    private static NotifyWheelProperties.Notify.RateLimit cfg(Duration window, int threshold,
                                                              Map<NotifyEventType, Integer> perEvent) {
        NotifyWheelProperties.Notify.RateLimit cfg = new NotifyWheelProperties.Notify.RateLimit();
        cfg.setWindow(window);
        cfg.setThreshold(threshold);
        cfg.setPerEvent(perEvent.isEmpty() ? new EnumMap<>(NotifyEventType.class) : new EnumMap<>(perEvent));
        return cfg;
    }

    @Test
    @DisplayName("按事件类型取阈值 - FETCH_FAILED 收紧, 其他事件走默认阈值")
    void tryAcquire_PerEventThreshold() {
        AlertRateLimiter limiter = new AlertRateLimiter(
                cfg(Duration.ofMinutes(10), 3, Map.of(NotifyEventType.FETCH_FAILED, 1)), new MutableClock());

        assertThat(limiter.tryAcquire(ctx(NotifyEventType.FETCH_FAILED, "@a:x"))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.FETCH_FAILED, "@a:x"))).isFalse();

        assertThat(limiter.tryAcquire(ctx(NotifyEventType.PUBLISH_FAILED, "@a:x"))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.PUBLISH_FAILED, "@a:x"))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.PUBLISH_FAILED, "@a:x"))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.PUBLISH_FAILED, "@a:x"))).isFalse();
    }

    @Test
    @DisplayName("不同用户分开计数, 无用户的事件也能限流")
    void tryAcquire_KeyedByUser() {
        AlertRateLimiter limiter = new AlertRateLimiter(cfg(Duration.ofMinutes(10), 1, Map.of()), new MutableClock());

        assertThat(limiter.tryAcquire(ctx(NotifyEventType.FETCH_FAILED, "@a:x"))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.FETCH_FAILED, "@b:x"))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.ENGINE_ERROR, null))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.ENGINE_ERROR, null))).isFalse();
    }

    @Test
    @DisplayName("窗口过期后重新计数")
    void tryAcquire_ResetsAfterWindow() {
        MutableClock clock = new MutableClock();
        AlertRateLimiter limiter = new AlertRateLimiter(cfg(Duration.ofSeconds(30), 1, Map.of()), clock);

        assertThat(limiter.tryAcquire(ctx(NotifyEventType.STREAM_DISABLED, "@a:x"))).isTrue();
        assertThat(limiter.tryAcquire(ctx(NotifyEventType.STREAM_DISABLED, "@a:x"))).isFalse();

        clock.advance(Duration.ofSeconds(31));

        assertThat(limiter.tryAcquire(ctx(NotifyEventType.STREAM_DISABLED, "@a:x"))).isTrue();
    }
}

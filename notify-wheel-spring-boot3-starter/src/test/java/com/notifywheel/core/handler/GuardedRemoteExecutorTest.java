package com.notifywheel.core.handler;

import com.notifywheel.config.RemoteGuardProperties;
import com.notifywheel.exception.NotificationFetchException;
import com.notifywheel.exception.guard.RemoteBulkheadFullException;
import com.notifywheel.exception.guard.RemoteRateLimitedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GuardedRemoteExecutor 测试")
class GuardedRemoteExecutorTest {

    @Test
    @DisplayName("默认不限制 - 原样返回, 原样抛出")
    void unguarded_PassesThrough() {
        GuardedRemoteExecutor guard = GuardedRemoteExecutor.unguarded();

        assertThat(guard.call(GuardedRemoteExecutor.OP_FETCH, () -> "[]")).isEqualTo("[]");
        assertThatThrownBy(() -> guard.call(GuardedRemoteExecutor.OP_FETCH, () -> {
            throw new NotificationFetchException("status 500");
        })).isInstanceOf(NotificationFetchException.class);
    }

    @Test
    @DisplayName("限流 - 超出许可后抛出 RemoteRateLimitedException")
    void rateLimiter_RejectsOverLimit() {
        // given
        RemoteGuardProperties props = new RemoteGuardProperties();
        RemoteGuardProperties.RlConfig rl = new RemoteGuardProperties.RlConfig();
        rl.setEnabled(true);
        rl.setLimitForPeriod(1);
        rl.setLimitRefreshPeriod(Duration.ofSeconds(10));
        rl.setTimeoutDuration(Duration.ZERO);
        props.setRlPerOp(Map.of(GuardedRemoteExecutor.OP_ENRICH, rl));
        GuardedRemoteExecutor guard = new GuardedRemoteExecutor(props);

        // when
        guard.call(GuardedRemoteExecutor.OP_ENRICH, () -> "ok");

        // then
        assertThatThrownBy(() -> guard.call(GuardedRemoteExecutor.OP_ENRICH, () -> "ok"))
                .isInstanceOf(RemoteRateLimitedException.class);
        // 其它 op 不受影响
        assertThat(guard.call(GuardedRemoteExecutor.OP_FETCH, () -> "ok")).isEqualTo("ok");
    }

    @Test
    @DisplayName("舱壁 - 并发已满时抛出 RemoteBulkheadFullException")
    void bulkhead_RejectsWhenFull() throws Exception {
        // given
        RemoteGuardProperties props = new RemoteGuardProperties();
        props.getBulkhead().setEnabled(true);
        props.getBulkhead().setMaxConcurrentCalls(1);
        props.getBulkhead().setMaxWaitDuration(Duration.ZERO);
        GuardedRemoteExecutor guard = new GuardedRemoteExecutor(props);

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> guard.call(GuardedRemoteExecutor.OP_FETCH, () -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "slow";
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            // when & then
            assertThatThrownBy(() -> guard.call(GuardedRemoteExecutor.OP_FETCH, () -> "fast"))
                    .isInstanceOf(RemoteBulkheadFullException.class);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}

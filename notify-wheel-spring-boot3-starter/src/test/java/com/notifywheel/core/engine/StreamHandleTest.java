package com.notifywheel.core.engine;

import com.notifywheel.model.StreamState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StreamHandle 测试")
class StreamHandleTest {

    private static StreamHandle handle() {
        return new StreamHandle(new StreamState("@a:x", path -> "[]", "!r:x", 0, false, 0));
    }

    @Test
    @DisplayName("首次挂轮资格只能被占用一次")
    void markScheduled_OnlyOnce() throws Exception {
        // given
        StreamHandle handle = handle();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> results = new ArrayList<>();

        // when
        for (int i = 0; i < 8; i++) {
            results.add(pool.submit(() -> {
                go.await();
                return handle.markScheduled();
            }));
        }
        go.countDown();

        // then
        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get(2, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();
        assertThat(winners).isEqualTo(1);
        assertThat(handle.markScheduled()).isFalse();
    }

    @Test
    @DisplayName("取消未在周期中的流 - 等待者收到取消")
    void cancel_Idle_CancelsPendingSignal() {
        StreamHandle handle = handle();

        assertThat(handle.cancel()).isTrue();
        assertThat(handle.cancel()).isFalse();
        assertThat(handle.nextCycle()).isCancelled();
    }
}

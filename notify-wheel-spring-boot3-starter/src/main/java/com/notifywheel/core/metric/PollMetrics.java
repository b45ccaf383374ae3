package com.notifywheel.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 轮询相关指标, 统一 poll.* 前缀
 */
public final class PollMetrics {
    private final MeterRegistry registry;
    private final Counter streamAdded;
    private final Counter streamRemoved;
    private final Counter streamDisabled;
    private final Counter cycles;
    private final Counter fetchSuccess;
    private final Counter fetchFailed;
    private final Counter enrichFailed;
    private final Counter publishSent;
    private final Counter publishFailed;
    private final Counter dispatchRejected;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary batchSize;
    private final Timer cycleTimer;
    private final Timer throttleTimer;

    private PollMetrics(MeterRegistry reg) {
        this.registry = reg;
        this.streamAdded    = Counter.builder("poll.stream.added").description("streams registered").register(reg);
        this.streamRemoved  = Counter.builder("poll.stream.removed").description("streams removed").register(reg);
        this.streamDisabled = Counter.builder("poll.stream.disabled").description("streams disabled by failure threshold").register(reg);
        this.cycles         = Counter.builder("poll.cycle").description("poll cycles started").register(reg);
        this.fetchSuccess   = Counter.builder("poll.fetch.success").description("notification list fetched").register(reg);
        this.fetchFailed    = Counter.builder("poll.fetch.failed").description("notification list fetch failed").register(reg);
        this.enrichFailed   = Counter.builder("poll.enrich.failed").description("subject detail fetch failed").register(reg);
        this.publishSent    = Counter.builder("poll.publish.sent").description("batches published").register(reg);
        this.publishFailed  = Counter.builder("poll.publish.failed").description("batches failed to publish").register(reg);
        this.dispatchRejected = Counter.builder("poll.dispatch.rejected").description("cycle dispatch rejected by executor").register(reg);
        this.notifySuppressed = Counter.builder("poll.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent     = Counter.builder("poll.notify.sent").description("notify sent").register(reg);
        this.notifyFailed   = Counter.builder("poll.notify.failed").description("notify failed").register(reg);
        this.batchSize = DistributionSummary.builder("poll.batch.size")
                .description("notifications per published batch").baseUnit("items").register(reg);
        this.cycleTimer    = Timer.builder("poll.cycle.time").description("fetch-enrich-publish time").register(reg);
        this.throttleTimer = Timer.builder("poll.throttle.wait").description("time waited for min interval").register(reg);
    }

    public static PollMetrics create(MeterRegistry reg) { return new PollMetrics(reg); }

    /** 测试/独立使用 */
    public static PollMetrics noop() { return new PollMetrics(new SimpleMeterRegistry()); }

    /**
     * 当前注册流数量, 由调度器以其注册表绑定
     */
    public void bindActiveStreams(Map<?, ?> streams) {
        Gauge.builder("poll.stream.active", streams, Map::size)
                .description("streams currently registered")
                .register(registry);
    }

    public MeterRegistry getRegistry() { return registry; }

    public void incStreamAdded(){ streamAdded.increment(); }
    public void incStreamRemoved(){ streamRemoved.increment(); }
    public void incStreamDisabled(){ streamDisabled.increment(); }
    public void incCycle(){ cycles.increment(); }
    public void incFetchSuccess(){ fetchSuccess.increment(); }
    public void incFetchFailed(){ fetchFailed.increment(); }
    public void incEnrichFailed(){ enrichFailed.increment(); }
    public void incPublishSent(){ publishSent.increment(); }
    public void incPublishFailed(){ publishFailed.increment(); }
    public void incDispatchRejected(){ dispatchRejected.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment();}
    public void incNotifyFailed(){ notifyFailed.increment();}
    public void incNotifySent(){ notifySent.increment();}
    public void recordBatchSize(int n){ batchSize.record(n); }
    public void recordCycleNanos(long nanos){ cycleTimer.record(nanos, TimeUnit.NANOSECONDS); }
    public void recordThrottleMillis(long millis){ throttleTimer.record(millis, TimeUnit.MILLISECONDS); }
}

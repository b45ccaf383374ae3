package com.notifywheel.core.engine;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.core.StreamOps;
import com.notifywheel.core.enrich.NotificationEnricher;
import com.notifywheel.core.handler.GuardedRemoteExecutor;
import com.notifywheel.core.metric.PollMetrics;
import com.notifywheel.core.notify.NotifyContexts;
import com.notifywheel.core.notify.NotifyingFacade;
import com.notifywheel.core.spi.MessageQueue;
import com.notifywheel.core.spi.NoticeSender;
import com.notifywheel.core.spi.NotificationCodec;
import com.notifywheel.exception.NotificationFetchException;
import com.notifywheel.model.MessageQueueMessage;
import com.notifywheel.model.StreamState;
import com.notifywheel.model.UserNotification;
import com.notifywheel.model.UserNotificationsEvent;
import com.notifywheel.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 单个流的一次 拉取-补全-发布 周期
 */
public class PollCycleExecutor {

    Logger log = LoggerFactory.getLogger(PollCycleExecutor.class);


    /** since 参数格式, 固定毫秒位 + UTC */
    private static final DateTimeFormatter SINCE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final NotificationEnricher enricher;

    private final GuardedRemoteExecutor guard;

    private final NotificationCodec codec;

    private final MessageQueue queue;

    private final NoticeSender noticeSender;

    private final NotifyingFacade notifyService;

    private final PollMetrics metrics;

    private final NotifyWheelProperties props;

    private final Clock clock;

    private final Sleeper sleeper;

    private final String nodeId;

    public PollCycleExecutor(NotificationEnricher enricher,
                             GuardedRemoteExecutor guard,
                             NotificationCodec codec,
                             MessageQueue queue,
                             NoticeSender noticeSender,
                             NotifyingFacade notifyService,
                             PollMetrics metrics,
                             NotifyWheelProperties props,
                             Clock clock,
                             Sleeper sleeper,
                             String nodeId) {
        this.enricher = enricher;
        this.guard = guard;
        this.codec = codec;
        this.queue = queue;
        this.noticeSender = noticeSender;
        this.notifyService = notifyService;
        this.metrics = metrics;
        this.props = props;
        this.clock = clock;
        this.sleeper = sleeper;
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * 距离允许下一次拉取还需等待的毫秒数, 上限为 min-interval（游标在未来时）
     */
    public long throttleDelay(StreamState stream, long now) {
        long min = props.minIntervalMillis();
        long elapsed = now - stream.getLastReadTs();
        return Math.max(0, Math.min(min, min - elapsed));
    }

    /**
     * 执行一个周期, 返回（可能被修改的）流状态供调度器保存
     *
     * @throws InterruptedException 限速等待期间被中断（停机）
     */
    public StreamState runCycle(StreamState stream, StreamOps ops) throws InterruptedException {
        // 1. 限速
        long wait = throttleDelay(stream, clock.millis());
        if (wait > 0) {
            log.info("[Poll-Cycle] read notifications of {} {}ms ago, waiting {}ms",
                    stream.getUserId(), props.minIntervalMillis() - wait, wait);
            sleeper.sleep(wait);
            metrics.recordThrottleMillis(wait);
        }

        log.info("[Poll-Cycle] getting notifications for {} since={}", stream.getUserId(), stream.getLastReadTs());
        metrics.incCycle();
        long startNanos = System.nanoTime();

        // 2. 拉取, 失败则整批丢弃
        List<UserNotification> raw = null;
        try {
            raw = fetch(stream);
            stream.advanceLastReadTs(clock.millis());
            if (props.isResetFailuresOnSuccess()) {
                stream.resetFailureCount();
            }
            metrics.incFetchSuccess();
            log.info("[Poll-Cycle] got {} notifications for {}", raw.size(), stream.getUserId());
        } catch (Exception e) {
            int failures = stream.incrementFailureCount();
            metrics.incFetchFailed();
            log.error("[Poll-Cycle] error getting notifications for {} (failures={})",
                    stream.getUserId(), failures, e);
            notifyService.fire(NotifyContexts.ctxForFetchFailed(nodeId, stream, props.getFailureThreshold(), e),
                    Severity.WARNING);
        }

        if (raw != null) {
            // 3. 补全  4. 发布
            List<UserNotification> events = enricher.enrichAll(stream.getClient(), raw);
            publish(stream, events);
        }
        metrics.recordCycleNanos(System.nanoTime() - startNanos);

        // 5. 阈值检查, 无论成功失败都执行
        if (stream.getFailureCount() > props.getFailureThreshold()) {
            disable(stream, ops);
        }
        return stream;
    }

    private List<UserNotification> fetch(StreamState stream) {
        String path = notificationsPath(stream);
        String body = guard.call(GuardedRemoteExecutor.OP_FETCH, () -> stream.getClient().request(path));
        try {
            return codec.decodeNotifications(body);
        } catch (IllegalStateException e) {
            throw new NotificationFetchException("Malformed notification list for " + stream.getUserId(), e);
        }
    }

    /**
     * /notifications?participating=<bool>[&since=<ISO8601>]
     */
    String notificationsPath(StreamState stream) {
        StringBuilder sb = new StringBuilder("/notifications?participating=").append(stream.isParticipating());
        if (stream.getLastReadTs() != 0) {
            sb.append("&since=").append(SINCE_FORMAT.format(Instant.ofEpochMilli(stream.getLastReadTs())));
        }
        return sb.toString();
    }

    private void publish(StreamState stream, List<UserNotification> events) {
        UserNotificationsEvent batch = new UserNotificationsEvent(stream.getRoomId(), stream.getLastReadTs(), events);
        try {
            queue.push(new MessageQueueMessage<>(UserNotificationsEvent.EVENT_NAME,
                    props.getPublish().getSender(), batch));
            metrics.incPublishSent();
            metrics.recordBatchSize(events.size());
        } catch (Exception e) {
            // 游标已推进, 本批丢失
            metrics.incPublishFailed();
            log.error("[Poll-Cycle] failed to publish {} notifications for {}", events.size(), stream.getUserId(), e);
            notifyService.fire(NotifyContexts.ctxForPublishFailed(nodeId, stream, events.size(), e), Severity.ERROR);
        }
    }

    private void disable(StreamState stream, StreamOps ops) {
        log.warn("[Poll-Cycle] stream of {} failed {} times (threshold={}), disabling",
                stream.getUserId(), stream.getFailureCount(), props.getFailureThreshold());
        ops.deregister(stream);
        metrics.incStreamDisabled();
        notifyService.fire(NotifyContexts.ctxForStreamDisabled(nodeId, stream, props.getFailureThreshold()),
                Severity.ERROR);
        try {
            noticeSender.sendNotice(stream.getRoomId(), props.getNotice().getText(), props.getNotice().getMsgtype());
        } catch (Exception e) {
            log.error("[Poll-Cycle] failed to send disabled notice to {} for {}", stream.getRoomId(), stream.getUserId(), e);
            notifyService.fire(NotifyContexts.ctxForNoticeFailed(nodeId, stream, e), Severity.ERROR);
        }
    }
}

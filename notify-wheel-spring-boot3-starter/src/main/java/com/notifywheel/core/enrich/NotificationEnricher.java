package com.notifywheel.core.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import com.notifywheel.core.handler.GuardedRemoteExecutor;
import com.notifywheel.core.metric.PollMetrics;
import com.notifywheel.core.spi.NotificationApiClient;
import com.notifywheel.core.spi.NotificationCodec;
import com.notifywheel.model.NotificationSubject;
import com.notifywheel.model.UserNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 通知补全
 * subject.url / subject.latest_comment_url 各自独立拉取, 任一失败只丢该字段, 不丢通知
 */
public class NotificationEnricher {

    private final Logger log = LoggerFactory.getLogger(NotificationEnricher.class);

    private final GuardedRemoteExecutor guard;

    private final NotificationCodec codec;

    private final PollMetrics metrics;

    public NotificationEnricher(GuardedRemoteExecutor guard, NotificationCodec codec, PollMetrics metrics) {
        this.guard = guard;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * 按输入顺序补全整批, 列表中的 null 元素直接跳过
     */
    public List<UserNotification> enrichAll(NotificationApiClient client, List<UserNotification> raw) {
        List<UserNotification> out = new ArrayList<>(raw.size());
        for (UserNotification n : raw) {
            if (n == null) {
                log.debug("[Enrich] skipped null entry in notification list");
                continue;
            }
            out.add(enrich(client, n));
        }
        return out;
    }

    /**
     * 原地补全单条通知, 永远返回该通知本身
     */
    public UserNotification enrich(NotificationApiClient client, UserNotification n) {
        NotificationSubject subject = n.getSubject();
        if (subject == null) {
            return n;
        }
        if (hasText(subject.getUrl())) {
            try {
                subject.setUrlData(fetchJson(client, subject.getUrl()));
            } catch (Exception e) {
                metrics.incEnrichFailed();
                log.warn("[Enrich] failed to fetch subject of {}: {}", n.getId(), e.toString());
            }
        }
        if (hasText(subject.getLatestCommentUrl())) {
            try {
                subject.setLatestCommentUrlData(fetchJson(client, subject.getLatestCommentUrl()));
            } catch (Exception e) {
                metrics.incEnrichFailed();
                log.warn("[Enrich] failed to fetch latest comment of {}: {}", n.getId(), e.toString());
            }
        }
        return n;
    }

    private JsonNode fetchJson(NotificationApiClient client, String url) {
        String body = guard.call(GuardedRemoteExecutor.OP_ENRICH, () -> client.request(url));
        return codec.decodeDetail(body);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}

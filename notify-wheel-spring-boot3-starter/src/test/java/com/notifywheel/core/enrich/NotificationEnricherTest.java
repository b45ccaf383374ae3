package com.notifywheel.core.enrich;

import com.notifywheel.core.handler.GuardedRemoteExecutor;
import com.notifywheel.core.metric.PollMetrics;
import com.notifywheel.core.serializer.JacksonNotificationCodec;
import com.notifywheel.core.spi.NotificationApiClient;
import com.notifywheel.exception.NotificationFetchException;
import com.notifywheel.model.NotificationSubject;
import com.notifywheel.model.UserNotification;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationEnricher 单元测试")
class NotificationEnricherTest {

    private static final String SUBJECT_URL = "https://api.github.com/repos/o/r/pulls/7";
    private static final String COMMENT_URL = "https://api.github.com/repos/o/r/issues/comments/70";

    @Mock
    private NotificationApiClient client;

    private SimpleMeterRegistry registry;
    private NotificationEnricher enricher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        enricher = new NotificationEnricher(GuardedRemoteExecutor.unguarded(), new JacksonNotificationCodec(),
                PollMetrics.create(registry));
    }

    private static UserNotification notification(String id, String url, String commentUrl) {
        NotificationSubject subject = new NotificationSubject();
        subject.setTitle("t-" + id);
        subject.setUrl(url);
        subject.setLatestCommentUrl(commentUrl);
        UserNotification n = new UserNotification();
        n.setId(id);
        n.setSubject(subject);
        return n;
    }

    private double enrichFailures() {
        return registry.get("poll.enrich.failed").counter().count();
    }

    @Test
    @DisplayName("两个地址都成功 - 都回填")
    void enrich_BothSucceed() {
        // given
        given(client.request(SUBJECT_URL)).willReturn("{\"merged\": false}");
        given(client.request(COMMENT_URL)).willReturn("{\"body\": \"ship it\"}");

        // when
        UserNotification n = enricher.enrich(client, notification("1", SUBJECT_URL, COMMENT_URL));

        // then
        assertThat(n.getSubject().getUrlData().get("merged").asBoolean()).isFalse();
        assertThat(n.getSubject().getLatestCommentUrlData().get("body").asText()).isEqualTo("ship it");
        assertThat(enrichFailures()).isZero();
    }

    @Test
    @DisplayName("subject 地址失败 - 评论仍回填, 通知保留")
    void enrich_SubjectFails_CommentStillFetched() {
        // given
        given(client.request(SUBJECT_URL)).willThrow(new NotificationFetchException("status 404"));
        given(client.request(COMMENT_URL)).willReturn("{\"body\": \"ship it\"}");

        // when
        UserNotification n = enricher.enrich(client, notification("1", SUBJECT_URL, COMMENT_URL));

        // then
        assertThat(n.getSubject().getUrlData()).isNull();
        assertThat(n.getSubject().getLatestCommentUrlData()).isNotNull();
        assertThat(enrichFailures()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("评论地址返回非 JSON - 只丢该字段")
    void enrich_CommentMalformed_SubjectKept() {
        // given
        given(client.request(SUBJECT_URL)).willReturn("{\"merged\": true}");
        given(client.request(COMMENT_URL)).willReturn("<html>oops</html>");

        // when
        UserNotification n = enricher.enrich(client, notification("1", SUBJECT_URL, COMMENT_URL));

        // then
        assertThat(n.getSubject().getUrlData()).isNotNull();
        assertThat(n.getSubject().getLatestCommentUrlData()).isNull();
    }

    @Test
    @DisplayName("没有地址 - 不发请求")
    void enrich_NoUrls_NoRequests() {
        // when
        UserNotification n = enricher.enrich(client, notification("1", null, ""));

        // then
        assertThat(n.getSubject().getUrlData()).isNull();
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("整批补全 - 保持输入顺序与条数")
    void enrichAll_PreservesOrder() {
        // given
        given(client.request(SUBJECT_URL)).willThrow(new NotificationFetchException("boom"));
        List<UserNotification> raw = List.of(
                notification("a", null, null),
                notification("b", SUBJECT_URL, null),
                notification("c", null, null));

        // when
        List<UserNotification> out = enricher.enrichAll(client, raw);

        // then
        assertThat(out).extracting(UserNotification::getId).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("整批补全 - 列表中的 null 元素被跳过")
    void enrichAll_SkipsNullEntries() {
        // given
        List<UserNotification> raw = new ArrayList<>();
        raw.add(null);
        raw.add(notification("a", null, null));
        raw.add(null);

        // when
        List<UserNotification> out = enricher.enrichAll(client, raw);

        // then
        assertThat(out).extracting(UserNotification::getId).containsExactly("a");
        verifyNoInteractions(client);
    }
}

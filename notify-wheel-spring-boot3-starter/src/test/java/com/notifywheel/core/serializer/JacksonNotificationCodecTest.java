package com.notifywheel.core.serializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.notifywheel.model.NotificationsEnableEvent;
import com.notifywheel.model.UserNotification;
import com.notifywheel.model.enums.NotificationReason;
import com.notifywheel.model.enums.SubjectType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JacksonNotificationCodec 测试")
class JacksonNotificationCodecTest {

    private final JacksonNotificationCodec codec = new JacksonNotificationCodec();

    @Test
    @DisplayName("解析 GitHub 通知列表")
    void decodeNotifications_GithubPayload() {
        String json = """
                [{
                  "id": "123",
                  "unread": true,
                  "reason": "team_mention",
                  "updated_at": "2024-03-01T10:00:00Z",
                  "last_read_at": null,
                  "url": "https://api.github.com/notifications/threads/123",
                  "repository": {"full_name": "o/r", "private": false},
                  "subject": {
                    "title": "Bump deps",
                    "url": "https://api.github.com/repos/o/r/pulls/5",
                    "latest_comment_url": "https://api.github.com/repos/o/r/issues/comments/50",
                    "type": "PullRequest"
                  },
                  "subscription_url": "https://api.github.com/notifications/threads/123/subscription"
                }]
                """;

        List<UserNotification> list = codec.decodeNotifications(json);

        assertThat(list).hasSize(1);
        UserNotification n = list.get(0);
        assertThat(n.getReason()).isEqualTo(NotificationReason.TEAM_MENTION);
        assertThat(n.getUpdatedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(n.getLastReadAt()).isNull();
        assertThat(n.getRepository().get("full_name").asText()).isEqualTo("o/r");
        assertThat(n.getSubject().getType()).isEqualTo(SubjectType.PULL_REQUEST);
        assertThat(n.getSubject().getLatestCommentUrl()).endsWith("/comments/50");
    }

    @Test
    @DisplayName("未知 reason / type - 置 null, 不丢整条")
    void decodeNotifications_UnknownEnums_Null() {
        List<UserNotification> list = codec.decodeNotifications("""
                [{"id": "9", "reason": "ci_activity", "subject": {"title": "x", "type": "Discussion"}}]
                """);

        assertThat(list.get(0).getReason()).isNull();
        assertThat(list.get(0).getSubject().getType()).isNull();
    }

    @Test
    @DisplayName("空响应体 / JSON null - 返回空列表")
    void decodeNotifications_Empty() {
        assertThat(codec.decodeNotifications(null)).isEmpty();
        assertThat(codec.decodeNotifications("  ")).isEmpty();
        assertThat(codec.decodeNotifications("null")).isEmpty();
    }

    @Test
    @DisplayName("非法 JSON - 抛出 IllegalStateException")
    void decodeNotifications_Malformed_Throws() {
        assertThatThrownBy(() -> codec.decodeNotifications("{oops"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("详情原样保留为 JSON 树")
    void decodeDetail_KeepsTree() {
        JsonNode node = codec.decodeDetail("{\"number\": 5, \"user\": {\"login\": \"octocat\"}}");

        assertThat(node.get("number").asInt()).isEqualTo(5);
        assertThat(node.at("/user/login").asText()).isEqualTo("octocat");
        assertThat(codec.decodeDetail("")).isNull();
    }

    @Test
    @DisplayName("注册事件编码 - snake_case 字段, 不输出 token")
    void encodeEvent_EnableEvent_OmitsToken() {
        NotificationsEnableEvent e = NotificationsEnableEvent.builder()
                .userId("@a:x").roomId("!r:x").since(1700000000000L)
                .filterParticipating(true).token("ghp_x").build();

        String json = codec.encodeEvent(e);

        assertThat(json).contains("\"user_id\":\"@a:x\"", "\"room_id\":\"!r:x\"", "\"filter_participating\":true");
        assertThat(json).doesNotContain("ghp_x");
        assertThat(e.toString()).doesNotContain("ghp_x");
    }
}

package com.notifywheel.core.queue;

import com.notifywheel.core.serializer.JacksonNotificationCodec;
import com.notifywheel.model.MatrixNotice;
import com.notifywheel.model.MessageQueueMessage;
import com.notifywheel.model.UserNotificationsEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("LocalMessageQueue 测试")
class LocalMessageQueueTest {

    private LocalMessageQueue queue;

    @BeforeEach
    void setUp() {
        queue = new LocalMessageQueue(new JacksonNotificationCodec());
    }

    @Test
    @DisplayName("按事件名派发给订阅者")
    void push_DeliversByEventName() {
        // given
        List<MessageQueueMessage<?>> batches = new ArrayList<>();
        List<MessageQueueMessage<?>> notices = new ArrayList<>();
        queue.on(UserNotificationsEvent.EVENT_NAME, batches::add);
        queue.on(MatrixNotice.EVENT_NAME, notices::add);

        // when
        queue.push(new MessageQueueMessage<>(UserNotificationsEvent.EVENT_NAME, "GithubWebhooks",
                new UserNotificationsEvent("!r:x", 42L, List.of())));

        // then
        assertThat(batches).hasSize(1);
        assertThat(notices).isEmpty();
        assertThat(batches.get(0).getMessageId()).isNotBlank();
    }

    @Test
    @DisplayName("订阅者异常不影响其他订阅者和发布方")
    void push_ListenerFailure_Isolated() {
        // given
        List<MessageQueueMessage<?>> received = new ArrayList<>();
        queue.on(MatrixNotice.EVENT_NAME, m -> {
            throw new IllegalStateException("listener down");
        });
        queue.on(MatrixNotice.EVENT_NAME, received::add);

        // when & then
        assertThatCode(() -> queue.push(new MessageQueueMessage<>(MatrixNotice.EVENT_NAME, "GithubWebhooks",
                new MatrixNotice("!r:x", "m.notice", "hi")))).doesNotThrowAnyException();
        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("QueueNoticeSender - 以 matrix.message 事件推送提示")
    void noticeSender_PushesMatrixMessage() {
        // given
        List<MessageQueueMessage<?>> received = new ArrayList<>();
        queue.on(MatrixNotice.EVENT_NAME, received::add);
        QueueNoticeSender sender = new QueueNoticeSender(queue, "GithubWebhooks");

        // when
        sender.sendNotice("!r:x", "disabled", "m.notice");

        // then
        assertThat(received).hasSize(1);
        MessageQueueMessage<?> msg = received.get(0);
        assertThat(msg.getSender()).isEqualTo("GithubWebhooks");
        MatrixNotice notice = (MatrixNotice) msg.getData();
        assertThat(notice.getRoomId()).isEqualTo("!r:x");
        assertThat(notice.getBody()).isEqualTo("disabled");
        assertThat(notice.getMsgtype()).isEqualTo("m.notice");
    }
}

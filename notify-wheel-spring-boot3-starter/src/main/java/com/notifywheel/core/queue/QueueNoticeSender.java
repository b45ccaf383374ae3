package com.notifywheel.core.queue;

import com.notifywheel.core.spi.MessageQueue;
import com.notifywheel.core.spi.NoticeSender;
import com.notifywheel.model.MatrixNotice;
import com.notifywheel.model.MessageQueueMessage;

/**
 * 通过消息总线把提示投递给房间消息发送方
 */
public class QueueNoticeSender implements NoticeSender {

    private final MessageQueue queue;

    private final String sender;

    public QueueNoticeSender(MessageQueue queue, String sender) {
        this.queue = queue;
        this.sender = sender;
    }

    @Override
    public void sendNotice(String roomId, String text, String msgtype) {
        queue.push(new MessageQueueMessage<>(MatrixNotice.EVENT_NAME, sender,
                new MatrixNotice(roomId, msgtype, text)));
    }
}

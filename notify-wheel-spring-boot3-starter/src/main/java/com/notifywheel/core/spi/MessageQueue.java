package com.notifywheel.core.spi;

import com.notifywheel.model.MessageQueueMessage;

/**
 * 出站消息总线
 * 同一个流的 push 顺序即可见顺序
 */
public interface MessageQueue {

    void push(MessageQueueMessage<?> message);
}

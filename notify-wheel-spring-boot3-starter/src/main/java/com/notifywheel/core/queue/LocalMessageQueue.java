package com.notifywheel.core.queue;

import com.notifywheel.core.spi.MessageQueue;
import com.notifywheel.core.spi.NotificationCodec;
import com.notifywheel.model.MessageQueueMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 进程内消息总线
 * 在 push 线程上同步派发, 保证同一个流的批次按周期顺序可见
 */
public class LocalMessageQueue implements MessageQueue {

    private final Logger log = LoggerFactory.getLogger(LocalMessageQueue.class);

    private final Map<String, List<Consumer<MessageQueueMessage<?>>>> listeners = new ConcurrentHashMap<>();

    private final NotificationCodec codec;

    public LocalMessageQueue(NotificationCodec codec) {
        this.codec = codec;
    }

    /**
     * 订阅某个事件名
     */
    public void on(String eventName, Consumer<MessageQueueMessage<?>> listener) {
        listeners.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    @Override
    public void push(MessageQueueMessage<?> message) {
        if (log.isDebugEnabled()) {
            log.debug("[Message-Queue] push event={} sender={} id={} data={}",
                    message.getEventName(), message.getSender(), message.getMessageId(),
                    codec.encodeEvent(message.getData()));
        }
        List<Consumer<MessageQueueMessage<?>>> subs = listeners.get(message.getEventName());
        if (subs == null || subs.isEmpty()) {
            log.debug("[Message-Queue] no listener for event={}", message.getEventName());
            return;
        }
        for (Consumer<MessageQueueMessage<?>> l : subs) {
            try {
                l.accept(message);
            } catch (Exception e) {
                // 单个订阅者异常不影响发布方
                log.error("[Message-Queue] listener failed, event={} id={}",
                        message.getEventName(), message.getMessageId(), e);
            }
        }
    }
}

package com.notifywheel.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 消息总线信封
 */
public final class MessageQueueMessage<T> {

    private final String eventName;

    private final String sender;

    private final T data;

    private final String messageId;

    private final Instant ts;

    public MessageQueueMessage(String eventName, String sender, T data) {
        this(eventName, sender, data, UUID.randomUUID().toString(), Instant.now());
    }

    public MessageQueueMessage(String eventName, String sender, T data, String messageId, Instant ts) {
        this.eventName = eventName;
        this.sender = sender;
        this.data = data;
        this.messageId = messageId;
        this.ts = ts;
    }

    public String getEventName() {
        return eventName;
    }

    public String getSender() {
        return sender;
    }

    public T getData() {
        return data;
    }

    public String getMessageId() {
        return messageId;
    }

    public Instant getTs() {
        return ts;
    }
}

package com.notifywheel.model;

import java.util.List;

/**
 * 每个轮询周期发布一次的批次
 */
public final class UserNotificationsEvent {

    public static final String EVENT_NAME = "notifications.user.events";

    private final String roomId;

    private final long lastReadTs;

    private final List<UserNotification> events;

    public UserNotificationsEvent(String roomId, long lastReadTs, List<UserNotification> events) {
        this.roomId = roomId;
        this.lastReadTs = lastReadTs;
        this.events = List.copyOf(events);
    }

    public String getRoomId() {
        return roomId;
    }

    public long getLastReadTs() {
        return lastReadTs;
    }

    public List<UserNotification> getEvents() {
        return events;
    }
}

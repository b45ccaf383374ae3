package com.notifywheel.model;

import com.notifywheel.core.spi.NotificationApiClient;

/**
 * 单个用户的通知流状态
 * 同一时刻只允许一个轮询周期写入
 */
public class StreamState {

    private final String userId;

    /** 该流独占的已鉴权客户端 */
    private final NotificationApiClient client;

    /** 发布目标房间, 生命周期内不变 */
    private final String roomId;

    /** 最近一次成功推进游标的时间戳(ms), 0 表示从未拉取 */
    private long lastReadTs;

    /** 是否只拉取 participating 通知 */
    private final boolean participating;

    /** 连续失败次数 */
    private int failureCount;

    public StreamState(String userId, NotificationApiClient client, String roomId,
                       long lastReadTs, boolean participating, int failureCount) {
        this.userId = userId;
        this.client = client;
        this.roomId = roomId;
        this.lastReadTs = lastReadTs;
        this.participating = participating;
        this.failureCount = failureCount;
    }

    public String getUserId() {
        return userId;
    }

    public NotificationApiClient getClient() {
        return client;
    }

    public String getRoomId() {
        return roomId;
    }

    public long getLastReadTs() {
        return lastReadTs;
    }

    /** 游标只进不退 */
    public void advanceLastReadTs(long ts) {
        this.lastReadTs = Math.max(this.lastReadTs, ts);
    }

    public boolean isParticipating() {
        return participating;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int incrementFailureCount() {
        return ++failureCount;
    }

    public void resetFailureCount() {
        this.failureCount = 0;
    }

    @Override
    public String toString() {
        return "StreamState{userId=" + userId + ", roomId=" + roomId + ", lastReadTs=" + lastReadTs
                + ", participating=" + participating + ", failureCount=" + failureCount + "}";
    }
}

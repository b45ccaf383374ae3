package com.notifywheel.model.ctx;


import com.notifywheel.model.enums.NotifyEventType;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
public class NotifyContext {

    private NotifyEventType type;
    private String nodeId;
    private String userId;
    private String roomId;
    private Integer failureCount;
    private Integer failureThreshold;
    // 分类码，如 FETCH_FAILED/THRESHOLD/PUBLISH
    private String reasonCode;
    // 可被截断/脱敏
    private String lastError;
    // 事件发生时间
    private Instant when;
    // 额外字段：lastReadTs、participating、op 等
    private Map<String, Object> attributes;

    public NotifyContext() {
    }

    public NotifyContext(NotifyEventType type, String nodeId, String userId, String roomId,
                         Integer failureCount, Integer failureThreshold, String reasonCode,
                         String lastError, Instant when, Map<String, Object> attributes) {
        this.type = type;
        this.nodeId = nodeId;
        this.userId = userId;
        this.roomId = roomId;
        this.failureCount = failureCount;
        this.failureThreshold = failureThreshold;
        this.reasonCode = reasonCode;
        this.lastError = lastError;
        this.when = when;
        this.attributes = attributes;
    }

    public NotifyEventType getType() {
        return type;
    }

    public void setType(NotifyEventType type) {
        this.type = type;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public Integer getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(Integer failureCount) {
        this.failureCount = failureCount;
    }

    public Integer getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(Integer failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public void setReasonCode(String reasonCode) {
        this.reasonCode = reasonCode;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getWhen() {
        return when;
    }

    public void setWhen(Instant when) {
        this.when = when;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = attributes;
    }
}

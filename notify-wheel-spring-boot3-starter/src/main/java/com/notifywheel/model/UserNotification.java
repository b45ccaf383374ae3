package com.notifywheel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.notifywheel.model.enums.NotificationReason;
import lombok.Data;

import java.time.Instant;

/**
 * 单条用户通知
 */
@Data
public class UserNotification {

    private String id;

    private NotificationReason reason;

    private boolean unread;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("last_read_at")
    private Instant lastReadAt;

    private String url;

    private NotificationSubject subject;

    /** 远端原样返回的仓库信息 */
    private JsonNode repository;
}

package com.notifywheel.model.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 通知产生原因（远端固定枚举集合）
 * 集合外的取值反序列化为 null
 */
public enum NotificationReason {
    @JsonProperty("assign") ASSIGN,
    @JsonProperty("author") AUTHOR,
    @JsonProperty("comment") COMMENT,
    @JsonProperty("invitation") INVITATION,
    @JsonProperty("manual") MANUAL,
    @JsonProperty("mention") MENTION,
    @JsonProperty("review_required") REVIEW_REQUIRED,
    @JsonProperty("security_alert") SECURITY_ALERT,
    @JsonProperty("state_change") STATE_CHANGE,
    @JsonProperty("subscribed") SUBSCRIBED,
    @JsonProperty("team_mention") TEAM_MENTION
}

package com.notifywheel.model.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 通知主体类型
 */
public enum SubjectType {
    @JsonProperty("PullRequest") PULL_REQUEST,
    @JsonProperty("Issue") ISSUE
}

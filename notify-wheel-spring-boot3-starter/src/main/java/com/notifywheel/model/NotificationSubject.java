package com.notifywheel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.notifywheel.model.enums.SubjectType;
import lombok.Data;

/**
 * 通知主体
 * urlData / latestCommentUrlData 由 Enricher 回填
 */
@Data
public class NotificationSubject {

    private String title;

    private String url;

    @JsonProperty("latest_comment_url")
    private String latestCommentUrl;

    private SubjectType type;

    @JsonProperty("url_data")
    private JsonNode urlData;

    @JsonProperty("latest_comment_url_data")
    private JsonNode latestCommentUrlData;
}

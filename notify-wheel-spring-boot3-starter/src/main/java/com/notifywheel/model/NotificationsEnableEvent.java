package com.notifywheel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 开启用户通知流的注册事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationsEnableEvent {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("room_id")
    private String roomId;

    /** 起始游标, 0 表示从未拉取 */
    private long since;

    @JsonProperty("filter_participating")
    private boolean filterParticipating;

    /** 只读入, 不随事件编码输出 */
    @ToString.Exclude
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String token;
}

package com.notifywheel.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.notifywheel.model.UserNotification;

import java.util.List;

/**
 * GitHub 响应体解码, 出站事件编码
 * 无法解码时抛出 IllegalStateException, 由调用方计入失败
 */
public interface NotificationCodec {

    /** 通知列表, 空响应体返回空列表 */
    List<UserNotification> decodeNotifications(String body);

    /** subject / comment 详情, 原样保留为 JSON 树, 空响应体返回 null */
    JsonNode decodeDetail(String body);

    /** 出站事件转 JSON, 仅用于日志 */
    String encodeEvent(Object event);
}

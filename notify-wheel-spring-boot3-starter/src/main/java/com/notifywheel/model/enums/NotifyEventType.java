package com.notifywheel.model.enums;

/**
 * 运维告警事件
 */
public enum NotifyEventType {
    /** 拉取通知列表失败 */
    FETCH_FAILED,

    /** 连续失败超过阈值, 流被自动下线 */
    STREAM_DISABLED,

    /** 批次投递到消息总线失败 */
    PUBLISH_FAILED,

    /** 给用户房间发送提示失败 */
    NOTICE_FAILED,

    /** 引擎级异常（线程池拒绝、调度异常等） */
    ENGINE_ERROR
}

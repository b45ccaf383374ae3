package com.notifywheel.core.spi.notify;

import com.notifywheel.model.ctx.NotifyContext;
import com.notifywheel.model.enums.NotifyEventType;
import com.notifywheel.model.enums.Severity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 运维告警通知器（拉取失败/连续失败下线等）
 * 按事件类型与最低级别订阅, 由路由筛选
 */
public interface Notifier {

    /** 渠道名, 用于日志 */
    String name();

    /** 订阅的事件类型, 默认全部 */
    default Set<NotifyEventType> events() {
        return EnumSet.allOf(NotifyEventType.class);
    }

    /** 低于该级别的事件不派发 */
    default Severity minSeverity() {
        return Severity.INFO;
    }

    /**
     * 同步派发, 失败直接抛出, 重试由框架负责
     */
    void notify(NotifyContext ctx, Severity severity);
}

package com.notifywheel.core.spi.notify;

import com.notifywheel.model.enums.NotifyEventType;
import com.notifywheel.model.enums.Severity;

import java.util.List;

/**
 * 按事件类型和级别选出要派发的通知器
 */
public interface NotifierRouter {

    List<Notifier> route(NotifyEventType type, Severity severity);
}

package com.notifywheel.core.notify.route;

import com.notifywheel.core.spi.notify.Notifier;
import com.notifywheel.core.spi.notify.NotifierRouter;
import com.notifywheel.model.enums.NotifyEventType;
import com.notifywheel.model.enums.Severity;

import java.util.List;

/**
 * 按通知器声明的事件类型与最低级别路由
 */
public class EventTypeRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public EventTypeRouter(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public List<Notifier> route(NotifyEventType type, Severity severity) {
        return notifiers.stream()
                .filter(n -> n.events().contains(type))
                .filter(n -> severity.compareTo(n.minSeverity()) >= 0)
                .toList();
    }
}

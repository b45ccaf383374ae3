package com.notifywheel.core;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.core.engine.UserStreamScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class UserStreamSchedulerLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(UserStreamSchedulerLifecycle.class);

    private final UserStreamScheduler scheduler;

    private final NotifyWheelProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public UserStreamSchedulerLifecycle(UserStreamScheduler scheduler, NotifyWheelProperties props) {
        this.scheduler = scheduler;
        this.props = props;
    }

    @Override
    public void start() {
        running.compareAndSet(false, props.isEnabled());
        if (!running.get()) {
            log.info("[Stream-Scheduler] start skipped, nodeId={}", scheduler.getNodeId());
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ UserStreamScheduler starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ nodeId                : {}", scheduler.getNodeId());
            log.info("│ minInterval           : {} ms", props.minIntervalMillis());
            log.info("│ failureThreshold      : {}", props.getFailureThreshold());
            log.info("│ resetFailuresOnSuccess: {}", props.isResetFailuresOnSuccess());
            log.info("│ schedule.initialDelay : {} ms", props.scheduleInitialDelayMillis());
            log.info("│ schedule.period       : {} ms", props.schedulePeriodMillis());
            log.info("│ wheel.tick            : {} ms", props.wheelTickMillis());
            log.info("│ wheel.size            : {}", props.getWheel().getTicksPerWheel());
            log.info("│ exec.core             : {}", props.getExecutor().getCorePoolSize());
            log.info("│ exec.max              : {}", props.getExecutor().getMaxPoolSize());
            log.info("│ exec.queue            : {}", props.getExecutor().getQueueCapacity());
            log.info("│ api.baseUrl           : {}", props.getApi().getBaseUrl());
            log.info("│ notify.enabled        : {}", props.getNotify().isEnabled());
            log.info("│ notify.retry.attempts : {}", props.getNotify().getRetry().getMaxAttempts());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            log.warn("[Stream-Scheduler] failed to render startup banner: {}", t.toString());
        }
        scheduler.start();
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Stream-Scheduler] stop skipped: already stopped (nodeId={})", scheduler.getNodeId());
            return;
        }
        log.info("[Stream-Scheduler] stopping... (nodeId={})", scheduler.getNodeId());
        try {
            scheduler.gracefulShutdown(props.getShutdown().getAwait().toSeconds());
        } finally {
            log.info("[Stream-Scheduler] stopped (nodeId={})", scheduler.getNodeId());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}

package com.notifywheel.core.engine;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.core.metric.PollMetrics;
import com.notifywheel.core.notify.NotifyContexts;
import com.notifywheel.core.notify.NotifyingFacade;
import com.notifywheel.core.spi.NotificationApiClient;
import com.notifywheel.core.spi.NotificationApiClientFactory;
import com.notifywheel.model.NotificationsEnableEvent;
import com.notifywheel.model.PollWheelTask;
import com.notifywheel.model.StreamState;
import com.notifywheel.model.enums.Severity;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 用户通知流调度核心
 * 每个流在时间轮上挂一个自我续约的触发, 到点后投递到调度线程池执行一个周期
 */
public class UserStreamScheduler {

    Logger log = LoggerFactory.getLogger(UserStreamScheduler.class);

    /** 时间轮 */
    private final HashedWheelTimer timer;

    /** 周期执行线程池 */
    private final ExecutorService dispatchExecutor;

    /** 单周期逻辑 */
    private final PollCycleExecutor cycleExecutor;

    /** 按 token 创建 API 客户端 */
    private final NotificationApiClientFactory clientFactory;

    /** 指标 */
    private final PollMetrics metrics;

    /** 通知模块 */
    private final NotifyingFacade notifyService;

    /** 配置 */
    private final NotifyWheelProperties props;

    private final Clock clock;

    /** 节点id */
    private final String nodeId;

    /** userId -> 流 */
    private final ConcurrentHashMap<String, StreamHandle> streams = new ConcurrentHashMap<>();

    /** 是否已开始在时间轮上调度 */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** 停机后不再接受注册 */
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public UserStreamScheduler(HashedWheelTimer timer,
                               ExecutorService dispatchExecutor,
                               PollCycleExecutor cycleExecutor,
                               NotificationApiClientFactory clientFactory,
                               PollMetrics metrics,
                               NotifyingFacade notifyService,
                               NotifyWheelProperties props,
                               Clock clock,
                               String nodeId) {
        this.timer = timer;
        this.dispatchExecutor = dispatchExecutor;
        this.cycleExecutor = cycleExecutor;
        this.clientFactory = clientFactory;
        this.metrics = metrics;
        this.notifyService = notifyService;
        this.props = props;
        this.clock = clock;
        this.nodeId = nodeId;
        metrics.bindActiveStreams(streams);
    }

    /**
     * 开始调度, 启动前注册的流在此时挂上时间轮
     */
    public void start() {
        if (terminated.get()) {
            throw new IllegalStateException("scheduler already stopped, nodeId=" + nodeId);
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (StreamHandle handle : streams.values()) {
            // 与并发的 addUser 竞争首次挂轮, 只有一方成功
            if (handle.markScheduled()) {
                scheduleNext(handle, initialDelay(handle));
            }
        }
        log.info("[Stream-Scheduler] started with {} streams (nodeId={})", streams.size(), nodeId);
    }

    /**
     * 注册一个用户的通知流, 同一用户已有的流先被移除
     */
    public void addUser(NotificationsEnableEvent data) {
        if (data == null || data.getUserId() == null || data.getRoomId() == null) {
            throw new IllegalArgumentException("userId and roomId are required");
        }
        if (terminated.get()) {
            throw new IllegalStateException("scheduler already stopped, cannot add " + data.getUserId());
        }
        String userId = data.getUserId();
        NotificationApiClient client = clientFactory.create(data.getToken());
        StreamState stream = new StreamState(userId, client, data.getRoomId(),
                data.getSince(), data.isFilterParticipating(), 0);
        StreamHandle handle = new StreamHandle(stream);

        AtomicBoolean replaced = new AtomicBoolean(false);
        streams.compute(userId, (k, old) -> {
            if (old != null) {
                old.cancel();
                replaced.set(true);
            }
            return handle;
        });
        metrics.incStreamAdded();
        if (replaced.get()) {
            metrics.incStreamRemoved();
            log.info("[Stream-Scheduler] Reinserted {} into the notif queue (room={})", userId, data.getRoomId());
        } else {
            log.info("[Stream-Scheduler] Inserted {} into the notif queue (room={})", userId, data.getRoomId());
        }
        if (running.get() && handle.markScheduled()) {
            scheduleNext(handle, initialDelay(handle));
        }
    }

    /**
     * 移除一个用户的通知流, 不存在时无操作
     * 在途周期会执行完, 但不会再有下一次
     */
    public void removeUser(String userId) {
        StreamHandle handle = userId == null ? null : streams.remove(userId);
        if (handle == null) {
            log.info("[Stream-Scheduler] {} is not in the notif queue, nothing to remove", userId);
            return;
        }
        handle.cancel();
        metrics.incStreamRemoved();
        log.info("[Stream-Scheduler] Removed {} from the notif queue", userId);
    }

    public boolean isRegistered(String userId) {
        return userId != null && streams.containsKey(userId);
    }

    public int streamCount() {
        return streams.size();
    }

    /**
     * 当前保存的流状态（最近一次周期返回的）
     */
    public Optional<StreamState> currentState(String userId) {
        StreamHandle handle = userId == null ? null : streams.get(userId);
        return handle == null ? Optional.empty() : Optional.of(handle.getState());
    }

    /**
     * 下一个周期完成时完成; 流在此之前被移除则取消
     */
    public CompletableFuture<StreamState> awaitNextCycle(String userId) {
        StreamHandle handle = userId == null ? null : streams.get(userId);
        if (handle == null) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException(userId + " is not in the notif queue"));
        }
        return handle.nextCycle();
    }

    public String getNodeId() {
        return nodeId;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 挂到时间轮上
     */
    private void scheduleNext(StreamHandle handle, long delayMs) {
        if (!running.get() || handle.isCancelled()) {
            return;
        }
        try {
            Timeout timeout = timer.newTimeout(
                    new PollWheelTask(handle.getUserId(), () -> dispatch(handle)),
                    delayMs, TimeUnit.MILLISECONDS);
            handle.setTimeout(timeout);
            // 挂轮期间被取消
            if (handle.isCancelled()) {
                timeout.cancel();
            }
        } catch (IllegalStateException | RejectedExecutionException e) {
            if (!running.get()) {
                log.debug("[Stream-Scheduler] scheduler stopping, {} not rescheduled", handle.getUserId());
                return;
            }
            // 时间轮已停止或挂起任务过多, 该流无法继续调度
            if (streams.remove(handle.getUserId(), handle)) {
                handle.cancel();
                metrics.incStreamRemoved();
            }
            log.error("[Stream-Scheduler] cannot schedule next cycle of {}, stream dropped", handle.getUserId(), e);
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, handle.getUserId(), "schedule", e),
                    Severity.ERROR);
        }
    }

    /**
     * 时间轮线程只负责投递, 不执行网络调用
     */
    private void dispatch(StreamHandle handle) {
        if (handle.isCancelled()) {
            return;
        }
        try {
            dispatchExecutor.execute(() -> runOnce(handle));
        } catch (RejectedExecutionException e) {
            metrics.incDispatchRejected();
            long retryMs = Math.max(props.schedulePeriodMillis(), props.wheelTickMillis());
            log.warn("[Stream-Scheduler] dispatch of {} rejected, retry in {}ms", handle.getUserId(), retryMs);
            scheduleNext(handle, retryMs);
        }
    }

    private void runOnce(StreamHandle handle) {
        boolean interrupted = false;
        handle.lock();
        try {
            if (!handle.isCancelled()) {
                int failuresBefore = handle.getState().getFailureCount();
                StreamState next = cycleExecutor.runCycle(handle.getState(), stream -> deregister(handle));
                handle.setLastCycleFailed(next.getFailureCount() > failuresBefore);
                handle.install(next);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            interrupted = true;
            log.info("[Stream-Scheduler] cycle of {} interrupted", handle.getUserId());
            handle.fail(ie);
        } catch (Throwable t) {
            log.error("[Stream-Scheduler] cycle of {} crashed", handle.getUserId(), t);
            handle.setLastCycleFailed(true);
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, handle.getUserId(), "runCycle", t),
                    Severity.ERROR);
            handle.fail(t);
        } finally {
            handle.unlock();
        }
        if (handle.isCancelled()) {
            handle.cancelPendingSignal();
            return;
        }
        if (interrupted) {
            return;
        }
        scheduleNext(handle, nextDelay(handle));
    }

    /**
     * 周期内达到失败阈值时由执行器回调, 只移除当前这个实例
     */
    private void deregister(StreamHandle handle) {
        if (streams.remove(handle.getUserId(), handle)) {
            handle.cancel();
            metrics.incStreamRemoved();
            log.info("[Stream-Scheduler] Removed {} from the notif queue (disabled)", handle.getUserId());
        }
    }

    private long initialDelay(StreamHandle handle) {
        return Math.max(props.scheduleInitialDelayMillis(),
                cycleExecutor.throttleDelay(handle.getState(), clock.millis()));
    }

    /**
     * 失败的周期不推进游标, 限速算出的等待为 0, 此时按 min-interval 退后
     */
    private long nextDelay(StreamHandle handle) {
        long throttle = handle.isLastCycleFailed()
                ? props.minIntervalMillis()
                : cycleExecutor.throttleDelay(handle.getState(), clock.millis());
        return Math.max(props.schedulePeriodMillis(), throttle);
    }

    /**
     * 停止调度, 取消所有流并等待在途周期完成
     *
     * @return 停机时时间轮上未触发的轮询任务数
     */
    public int gracefulShutdown(long awaitSecond) {
        terminated.set(true);
        running.set(false);
        int pending = stopWheel();
        List<StreamHandle> all = new ArrayList<>(streams.values());
        streams.clear();
        for (StreamHandle handle : all) {
            handle.cancel();
        }
        dispatchExecutor.shutdown();

        long awaitMs = Math.max(1, awaitSecond) * 1000L;
        try {
            if (!dispatchExecutor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                // 中断限速等待中的周期
                dispatchExecutor.shutdownNow();
                log.warn("[Stream-Scheduler] dispatchExecutor forced shutdown after {}s", awaitSecond);
            }
        } catch (InterruptedException ie) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Stream-Scheduler] graceful shutdown done, streams={}, pendingWheelTasks={}", all.size(), pending);
        return pending;
    }

    private int stopWheel() {
        Set<Timeout> unprocessed = timer.stop();
        if (unprocessed == null || unprocessed.isEmpty()) {
            log.info("[Stream-Scheduler] timer stopped with no unprocessed timeouts.");
            return 0;
        }
        int n = 0;
        for (Timeout t : unprocessed) {
            if (t != null && t.task() instanceof PollWheelTask) {
                n++;
            }
        }
        return n;
    }
}

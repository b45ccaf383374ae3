package com.notifywheel.core.engine;

import com.notifywheel.model.StreamState;
import io.netty.util.Timeout;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 注册表中的一个流
 * 持有最新状态、时间轮句柄、周期锁以及“下一周期完成”信号
 */
final class StreamHandle {

    private final String userId;

    /** 周期锁, 保证同一个流的周期串行 */
    private final ReentrantLock cycleLock = new ReentrantLock();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** 首次触发是否已挂轮, start() 与 addUser 并发时只挂一条链 */
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    /** 最近一个周期是否失败（拉取失败或周期异常） */
    private volatile boolean lastCycleFailed;

    /** 最近一次周期返回并安装的状态 */
    private volatile StreamState state;

    /** 当前挂在时间轮上的下一次触发 */
    private volatile Timeout timeout;

    private volatile CompletableFuture<StreamState> nextCycle = new CompletableFuture<>();

    StreamHandle(StreamState state) {
        this.userId = state.getUserId();
        this.state = state;
    }

    String getUserId() {
        return userId;
    }

    StreamState getState() {
        return state;
    }

    void lock() {
        cycleLock.lock();
    }

    void unlock() {
        cycleLock.unlock();
    }

    /**
     * 安装周期返回的状态并唤醒等待者, 调用方须持有周期锁
     */
    void install(StreamState next) {
        this.state = next;
        CompletableFuture<StreamState> done = nextCycle;
        nextCycle = new CompletableFuture<>();
        done.complete(next);
    }

    /**
     * 周期异常结束, 调用方须持有周期锁
     */
    void fail(Throwable t) {
        CompletableFuture<StreamState> done = nextCycle;
        nextCycle = new CompletableFuture<>();
        done.completeExceptionally(t);
    }

    CompletableFuture<StreamState> nextCycle() {
        return nextCycle;
    }

    /**
     * 占用首次挂轮的资格
     *
     * @return 仅第一次调用返回 true
     */
    boolean markScheduled() {
        return scheduled.compareAndSet(false, true);
    }

    boolean isLastCycleFailed() {
        return lastCycleFailed;
    }

    void setLastCycleFailed(boolean failed) {
        this.lastCycleFailed = failed;
    }

    void setTimeout(Timeout timeout) {
        this.timeout = timeout;
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 取消后续触发, 不中断在途周期
     *
     * @return 是否由本次调用完成取消
     */
    boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        Timeout t = timeout;
        if (t != null) {
            t.cancel();
        }
        // 在途周期结束时由调度器收尾
        if (!cycleLock.isLocked()) {
            cancelPendingSignal();
        }
        return true;
    }

    void cancelPendingSignal() {
        nextCycle.cancel(false);
    }
}

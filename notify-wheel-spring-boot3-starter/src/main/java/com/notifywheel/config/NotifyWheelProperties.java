package com.notifywheel.config;

import com.notifywheel.model.enums.NotifyEventType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 用户通知轮询配置（绑定前缀：notify-wheel）
 *
 * YAML 示例：
 * notify-wheel:
 *   enabled: true
 *   min-interval: 15000ms
 *   failure-threshold: 50
 *   reset-failures-on-success: false
 *   schedule:
 *     initial-delay: 0ms
 *     period: 0ms
 *   wheel:
 *     tick-duration: 100ms
 *     ticks-per-wheel: 512
 *     max-pending-timeouts: 100000
 *   executor:
 *     core-pool-size: 4
 *     max-pool-size: 16
 *     queue-capacity: 1000
 *     keep-alive: 60s
 *     rejected-handler: ABORT
 *   shutdown:
 *     await: 30s
 *   publish:
 *     sender: GithubWebhooks
 *   notice:
 *     msgtype: m.notice
 *   api:
 *     base-url: https://api.github.com
 *     user-agent: matrix-github v0.0.1
 *     connect-timeout: 5s
 *     read-timeout: 30s
 *   notify:
 *     enabled: true
 *     pool:
 *       core-pool-size: 1
 *       max-pool-size: 2
 *       queue-capacity: 500
 *     retry:
 *       max-attempts: 3
 *       backoff: 200ms
 *       max-backoff: 4s
 *     rate-limit:
 *       window: 10m
 *       threshold: 50
 *       per-event:
 *         fetch-failed: 3
 */
@Validated
@ConfigurationProperties(prefix = "notify-wheel")
public class NotifyWheelProperties {

    public static final long DEFAULT_MIN_INTERVAL_MS = 15000;

    public static final int DEFAULT_FAILURE_THRESHOLD = 50;

    public static final String DEFAULT_DISABLED_NOTICE =
            "The bridge has been unable to process your notification stream for some time, and has disabled notifications.\n"
            + "Check your GitHub token is still valid, and then turn notifications back on.";

    /** 是否启动轮询 */
    private boolean enabled = true;

    /** 同一个流两次拉取的最小间隔 */
    private Duration minInterval = Duration.ofMillis(DEFAULT_MIN_INTERVAL_MS);

    /** 连续失败超过该值后自动下线 */
    private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

    /** 成功拉取后是否清零失败次数, 默认不清零 */
    private boolean resetFailuresOnSuccess = false;

    private Schedule schedule = new Schedule();

    private Wheel wheel = new Wheel();

    private Exec executor = new Exec();

    private Shutdown shutdown = new Shutdown();

    private Publish publish = new Publish();

    private Notice notice = new Notice();

    private Api api = new Api();

    private Notify notify = new Notify();

    // ----------------- 嵌套配置对象 -----------------

    public static class Schedule {
        /** 注册后首次触发延迟（仍受 min-interval 约束） */
        private Duration initialDelay = Duration.ZERO;

        /** 周期结束到下一次触发的间隔, >= 0 */
        private Duration period = Duration.ZERO;

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getPeriod() { return period; }
        public void setPeriod(Duration period) { this.period = period; }
    }

    public static class Wheel {
        /** 时间轮刻度（Duration 友好写法：100ms、1s） */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.ABORT;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    public static class Publish {
        /** 发布批次时的 sender 标识 */
        private String sender = "GithubWebhooks";

        public String getSender() { return sender; }
        public void setSender(String sender) { this.sender = sender; }
    }

    public static class Notice {
        /** 下线提示文案 */
        private String text = DEFAULT_DISABLED_NOTICE;

        private String msgtype = "m.notice";

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
        public String getMsgtype() { return msgtype; }
        public void setMsgtype(String msgtype) { this.msgtype = msgtype; }
    }

    public static class Api {
        private String baseUrl = "https://api.github.com";

        private String userAgent = "matrix-github v0.0.1";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    /**
     * 运维告警, 默认关闭（关闭时所有告警只走日志）
     */
    public static class Notify {
        private boolean enabled = false;

        private Pool pool = new Pool();

        private Retry retry = new Retry();

        private RateLimit rateLimit = new RateLimit();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Pool getPool() { return pool; }
        public void setPool(Pool pool) { this.pool = pool; }
        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
        public RateLimit getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

        /** 告警派发线程池, 队列满时直接丢弃 */
        public static class Pool {
            private int corePoolSize = 1;

            private int maxPoolSize = 2;

            private int queueCapacity = 500;

            private Duration keepAlive = Duration.ofSeconds(60);

            public int getCorePoolSize() { return corePoolSize; }
            public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
            public int getMaxPoolSize() { return maxPoolSize; }
            public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
            public int getQueueCapacity() { return queueCapacity; }
            public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
            public Duration getKeepAlive() { return keepAlive; }
            public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        }

        /** 单个通知器失败后的重试 */
        public static class Retry {
            /** 含首次 */
            private int maxAttempts = 3;

            private Duration backoff = Duration.ofMillis(200);

            private Duration maxBackoff = Duration.ofSeconds(4);

            public int getMaxAttempts() { return maxAttempts; }
            public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
            public Duration getBackoff() { return backoff; }
            public void setBackoff(Duration backoff) { this.backoff = backoff; }
            public Duration getMaxBackoff() { return maxBackoff; }
            public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
        }

        /**
         * 同一用户同一类事件在窗口内最多放行的条数
         * 持续失败的流每个周期都会产生 FETCH_FAILED, 默认单独收紧
         */
        public static class RateLimit {
            private Duration window = Duration.ofMinutes(10);

            private int threshold = 50;

            private Map<NotifyEventType, Integer> perEvent = new EnumMap<>(Map.of(NotifyEventType.FETCH_FAILED, 3));

            public Duration getWindow() { return window; }
            public void setWindow(Duration window) { this.window = window; }
            public int getThreshold() { return threshold; }
            public void setThreshold(int threshold) { this.threshold = threshold; }
            public Map<NotifyEventType, Integer> getPerEvent() { return perEvent; }
            public void setPerEvent(Map<NotifyEventType, Integer> perEvent) { this.perEvent = perEvent; }

            /** 某类事件生效的阈值 */
            public int thresholdFor(NotifyEventType type) {
                Integer v = perEvent == null || type == null ? null : perEvent.get(type);
                return v == null ? threshold : v;
            }
        }
    }

    // ----------------- 公共枚举/工具 -----------------

    /** 线程池拒绝策略枚举 */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Duration getMinInterval() { return minInterval; }
    public void setMinInterval(Duration minInterval) { this.minInterval = minInterval; }

    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

    public boolean isResetFailuresOnSuccess() { return resetFailuresOnSuccess; }
    public void setResetFailuresOnSuccess(boolean resetFailuresOnSuccess) { this.resetFailuresOnSuccess = resetFailuresOnSuccess; }

    public Schedule getSchedule() { return schedule; }
    public void setSchedule(Schedule schedule) { this.schedule = schedule; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public Publish getPublish() { return publish; }
    public void setPublish(Publish publish) { this.publish = publish; }

    public Notice getNotice() { return notice; }
    public void setNotice(Notice notice) { this.notice = notice; }

    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api; }

    public Notify getNotify() { return notify; }
    public void setNotify(Notify notify) { this.notify = notify; }

    // ----------------- 便捷换算 -----------------

    /** 最小间隔毫秒 */
    public long minIntervalMillis() { return minInterval.toMillis(); }

    /** 周期间隔毫秒, 负值按 0 处理 */
    public long schedulePeriodMillis() { return Math.max(0, schedule.getPeriod().toMillis()); }

    /** 首次触发延迟毫秒 */
    public long scheduleInitialDelayMillis() { return Math.max(0, schedule.getInitialDelay().toMillis()); }

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }
}

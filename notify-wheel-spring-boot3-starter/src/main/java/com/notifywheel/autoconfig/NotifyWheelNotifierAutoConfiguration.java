package com.notifywheel.autoconfig;

import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.core.engine.Sleeper;
import com.notifywheel.core.metric.PollMetrics;
import com.notifywheel.core.notify.AsyncNotifyingService;
import com.notifywheel.core.notify.NotifyingFacade;
import com.notifywheel.core.notify.notifier.LoggingNotifier;
import com.notifywheel.core.notify.ratelimit.AlertRateLimiter;
import com.notifywheel.core.notify.route.EventTypeRouter;
import com.notifywheel.core.spi.notify.Notifier;
import com.notifywheel.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@AutoConfiguration(after = NotifyWheelMetricsAutoConfiguration.class)
@EnableConfigurationProperties(NotifyWheelProperties.class)
public class NotifyWheelNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    /**
     * 业务方注册的 Notifier bean 一并参与路由
     */
    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers) {
        return new EventTypeRouter(notifiers.orderedStream().toList());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "notify-wheel.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       PollMetrics metrics,
                                                       NotifyWheelProperties props,
                                                       ObjectProvider<Clock> clock,
                                                       ObjectProvider<Sleeper> sleeper) {
        NotifyWheelProperties.Notify cfg = props.getNotify();
        NotifyWheelProperties.Notify.Pool pool = cfg.getPool();
        AtomicInteger seq = new AtomicInteger();
        // 池满抛出拒绝, 由 fire 计入 suppressed, 不回落到调用线程
        ThreadPoolExecutor exec = new ThreadPoolExecutor(pool.getCorePoolSize(),
                pool.getMaxPoolSize(),
                pool.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(pool.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "notify-wheel-alert-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) ->
                            LoggerFactory.getLogger(AsyncNotifyingService.class).error("[Notify] uncaught in {}", th.getName(), e));
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        AlertRateLimiter limiter = new AlertRateLimiter(cfg.getRateLimit(), clock.getIfAvailable(Clock::systemUTC));
        return new AsyncNotifyingService(exec, router, limiter, cfg.getRetry(), metrics,
                sleeper.getIfAvailable(Sleeper::threadSleep));
    }

    @Bean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}

package com.notifywheel.autoconfig;

import com.notifywheel.annotation.EnableNotifyWheel;
import com.notifywheel.config.NotifyWheelProperties;
import com.notifywheel.core.UserStreamSchedulerLifecycle;
import com.notifywheel.core.client.RestClientNotificationApiClientFactory;
import com.notifywheel.core.engine.PollCycleExecutor;
import com.notifywheel.core.engine.Sleeper;
import com.notifywheel.core.engine.UserStreamScheduler;
import com.notifywheel.core.enrich.NotificationEnricher;
import com.notifywheel.core.handler.GuardedRemoteExecutor;
import com.notifywheel.core.metric.PollMetrics;
import com.notifywheel.core.notify.NotifyingFacade;
import com.notifywheel.core.queue.LocalMessageQueue;
import com.notifywheel.core.queue.QueueNoticeSender;
import com.notifywheel.core.serializer.JacksonNotificationCodec;
import com.notifywheel.core.spi.MessageQueue;
import com.notifywheel.core.spi.NoticeSender;
import com.notifywheel.core.spi.NotificationCodec;
import com.notifywheel.core.spi.NotificationApiClientFactory;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.AnnotationUtils;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮初始化及轮询组件
 */
@AutoConfiguration(after = {
        NotifyWheelMetricsAutoConfiguration.class,
        NotifyWheelGuardAutoConfiguration.class,
        NotifyWheelNotifierAutoConfiguration.class
})
@EnableConfigurationProperties(NotifyWheelProperties.class)
public class NotifyWheelAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean
    public HashedWheelTimer notifyWheelTimer(NotifyWheelProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("notify-wheel-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 周期执行线程池
     */
    @Bean("pollDispatchExecutor")
    public ExecutorService pollDispatchExecutor(NotifyWheelProperties props) {
        NotifyWheelProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("notify-wheel-poll-exec"),
                exec.getRejectedHandler().toHandler()
        );
    }

    /**
     * 默认 GitHub 响应体编解码
     */
    @Bean
    @ConditionalOnMissingBean(NotificationCodec.class)
    public NotificationCodec notificationCodec() {
        return new JacksonNotificationCodec();
    }

    /**
     * 默认 GitHub REST 客户端
     */
    @Bean
    @ConditionalOnMissingBean(NotificationApiClientFactory.class)
    public NotificationApiClientFactory notificationApiClientFactory(NotifyWheelProperties props) {
        return new RestClientNotificationApiClientFactory(props.getApi());
    }

    /**
     * 默认进程内消息队列
     */
    @Bean
    @ConditionalOnMissingBean(MessageQueue.class)
    public MessageQueue messageQueue(NotificationCodec codec) {
        return new LocalMessageQueue(codec);
    }

    @Bean
    @ConditionalOnMissingBean(NoticeSender.class)
    public NoticeSender noticeSender(MessageQueue queue, NotifyWheelProperties props) {
        return new QueueNoticeSender(queue, props.getPublish().getSender());
    }

    @Bean
    @ConditionalOnMissingBean(name = "notifyWheelClock")
    public Clock notifyWheelClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper notifyWheelSleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public NotificationEnricher notificationEnricher(GuardedRemoteExecutor guard,
                                                     NotificationCodec codec,
                                                     PollMetrics metrics) {
        return new NotificationEnricher(guard, codec, metrics);
    }

    @Bean
    public PollCycleExecutor pollCycleExecutor(NotificationEnricher enricher,
                                               GuardedRemoteExecutor guard,
                                               NotificationCodec codec,
                                               MessageQueue queue,
                                               NoticeSender noticeSender,
                                               NotifyingFacade notifyService,
                                               PollMetrics metrics,
                                               NotifyWheelProperties props,
                                               @Qualifier("notifyWheelClock") Clock clock,
                                               Sleeper sleeper,
                                               ApplicationContext applicationContext) {
        String appName = applicationContext.getEnvironment()
                .getProperty("spring.application.name", "notify-wheel");
        String nodeId = appName + "-" + UUID.randomUUID();
        return new PollCycleExecutor(enricher, guard, codec, queue, noticeSender, notifyService,
                metrics, props, clock, sleeper, nodeId);
    }

    /**
     * 用户通知流调度器
     */
    @Bean
    public UserStreamScheduler userStreamScheduler(HashedWheelTimer timer,
                                                   @Qualifier("pollDispatchExecutor") ExecutorService dispatchExecutor,
                                                   PollCycleExecutor cycleExecutor,
                                                   NotificationApiClientFactory clientFactory,
                                                   PollMetrics metrics,
                                                   NotifyingFacade notifyService,
                                                   NotifyWheelProperties props,
                                                   @Qualifier("notifyWheelClock") Clock clock) {
        return new UserStreamScheduler(timer, dispatchExecutor, cycleExecutor, clientFactory,
                metrics, notifyService, props, clock, cycleExecutor.getNodeId());
    }

    /**
     * 调度器启动器
     */
    @Bean
    public UserStreamSchedulerLifecycle userStreamSchedulerLifecycle(UserStreamScheduler scheduler,
                                                                     NotifyWheelProperties props,
                                                                     ApplicationContext applicationContext) {
        EnableNotifyWheel enableNotifyWheel = findEnableNotifyWheel(applicationContext);
        if (enableNotifyWheel != null) {
            props.setEnabled(enableNotifyWheel.value());
        }
        return new UserStreamSchedulerLifecycle(scheduler, props);
    }

    private EnableNotifyWheel findEnableNotifyWheel(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            EnableNotifyWheel an = AnnotationUtils.findAnnotation(type, EnableNotifyWheel.class);
            if (an != null) return an;
        }
        return null;
    }
}

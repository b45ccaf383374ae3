package com.notifywheel.autoconfig;

import com.notifywheel.core.metric.PollMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * 有唯一的 MeterRegistry（Actuator 场景）时注册到其上, 否则落到进程内 SimpleMeterRegistry
 */
@AutoConfiguration
public class NotifyWheelMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PollMetrics pollMetrics(ObjectProvider<MeterRegistry> registries) {
        return PollMetrics.create(registries.getIfUnique(SimpleMeterRegistry::new));
    }
}

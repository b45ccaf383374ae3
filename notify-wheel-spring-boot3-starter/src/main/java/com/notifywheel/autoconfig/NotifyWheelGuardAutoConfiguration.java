package com.notifywheel.autoconfig;

import com.notifywheel.config.RemoteGuardProperties;
import com.notifywheel.core.handler.GuardedRemoteExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        RemoteGuardProperties.class
})
public class NotifyWheelGuardAutoConfiguration {

    /**
     * 远端调用统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedRemoteExecutor guard(RemoteGuardProperties props) {
        return new GuardedRemoteExecutor(props);
    }
}

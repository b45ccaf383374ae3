package com.notifywheel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * notify-wheel:
 *   guard:
 *     bulkhead:
 *       enabled: true
 *       max-concurrent-calls: 32
 *       max-wait-duration: 5s
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 50
 *       limit-refresh-period: 1s
 *       timeout-duration: 5s
 *     rl-per-op:
 *       enrich: { limit-for-period: 20 }
 *
 * 不提供熔断：阈值触发前每次失败都必须真实请求远端
 */
@Data
@ConfigurationProperties(prefix = "notify-wheel.guard")
public class RemoteGuardProperties {

    /** 默认配置（可被 op 覆盖, op = fetch | enrich） */
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按 op 覆盖 */
    private Map<String, BhConfig> bhPerOp;
    private Map<String, RlConfig> rlPerOp;

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 32;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofSeconds(5);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 50;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofSeconds(5);
    }
}

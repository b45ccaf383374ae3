package com.notifywheel.core.handler;

import com.notifywheel.config.RemoteGuardProperties;
import com.notifywheel.exception.guard.RemoteBulkheadFullException;
import com.notifywheel.exception.guard.RemoteRateLimitedException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 远端调用统一入口
 * 所有流共享同一组 Bulkhead / RateLimiter, 按 op 区分
 */
public class GuardedRemoteExecutor {

    public static final String OP_FETCH = "fetch";

    public static final String OP_ENRICH = "enrich";

    private final RemoteGuardProperties props;

    private final ConcurrentHashMap<String, Bulkhead>    bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter> rlCache = new ConcurrentHashMap<>();

    public GuardedRemoteExecutor(RemoteGuardProperties props) {
        this.props = props;
    }

    /** 不做任何限制 */
    public static GuardedRemoteExecutor unguarded() {
        return new GuardedRemoteExecutor(new RemoteGuardProperties());
    }

    /**
     * 对远端调用增加 RL/BH 装饰后执行
     */
    public <T> T call(String op, Supplier<T> remoteCall) {
        // 组合装饰 RateLimiter → Bulkhead
        Supplier<T> decorated = remoteCall;

        // Bulkhead 限制下游并发
        if (bulkheadEnabled(op)) {
            Bulkhead bh = bhCache.computeIfAbsent(op, this::buildBh);
            decorated = Bulkhead.decorateSupplier(bh, decorated);
        }

        // RateLimit 最外层限流，抑制突发流量
        if (rateLimiterEnabled(op)) {
            RateLimiter rl = rlCache.computeIfAbsent(op, this::buildRl);
            decorated = RateLimiter.decorateSupplier(rl, decorated);
        }

        try {
            return decorated.get();
        } catch (BulkheadFullException full) {
            throw new RemoteBulkheadFullException(full);
        } catch (RequestNotPermitted rnp) {
            throw new RemoteRateLimitedException(rnp);
        }
    }

    private RateLimiter buildRl(String op) {
        RemoteGuardProperties.RlConfig r = resolve(props.getRlPerOp(), op, props.getRateLimiter());
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + op, cfg);
    }

    private Bulkhead buildBh(String op) {
        RemoteGuardProperties.BhConfig b = resolve(props.getBhPerOp(), op, props.getBulkhead());
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + op, cfg);
    }

    private boolean bulkheadEnabled(String op) {
        RemoteGuardProperties.BhConfig b = resolve(props.getBhPerOp(), op, props.getBulkhead());
        return b != null && b.isEnabled();
    }

    private boolean rateLimiterEnabled(String op) {
        RemoteGuardProperties.RlConfig r = resolve(props.getRlPerOp(), op, props.getRateLimiter());
        return r != null && r.isEnabled();
    }

    /** op 配置不为空则使用 op 配置 */
    private static <C> C resolve(Map<String, C> perOp, String op, C defaultCfg) {
        if (perOp == null) {
            return defaultCfg;
        }
        C opCfg = perOp.get(op);
        return opCfg == null ? defaultCfg : opCfg;
    }
}

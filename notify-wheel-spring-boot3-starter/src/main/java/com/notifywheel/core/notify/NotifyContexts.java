package com.notifywheel.core.notify;

import com.notifywheel.model.StreamState;
import com.notifywheel.model.ctx.NotifyContext;
import com.notifywheel.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（使用系统UTC时钟） ========== */

    public static NotifyContext ctxForFetchFailed(String nodeId, StreamState s, int threshold, Throwable e) {
        return ctxForFetchFailed(nodeId, s, threshold, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForStreamDisabled(String nodeId, StreamState s, int threshold) {
        return ctxForStreamDisabled(nodeId, s, threshold, Clock.systemUTC());
    }

    public static NotifyContext ctxForPublishFailed(String nodeId, StreamState s, int batchSize, Throwable e) {
        return ctxForPublishFailed(nodeId, s, batchSize, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForNoticeFailed(String nodeId, StreamState s, Throwable e) {
        return ctxForNoticeFailed(nodeId, s, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForEngineError(String nodeId, String userId, String op, Throwable e) {
        return ctxForEngineError(nodeId, userId, op, e, Clock.systemUTC());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForFetchFailed(String nodeId, StreamState s, int threshold, Throwable e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(s);
        attrs.put("op", "FETCH");
        return new NotifyContext(
                NotifyEventType.FETCH_FAILED,
                nodeId,
                s.getUserId(),
                s.getRoomId(),
                s.getFailureCount(),
                threshold,
                "FETCH_FAILED",
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForStreamDisabled(String nodeId, StreamState s, int threshold, Clock clock) {
        Map<String, Object> attrs = baseAttrs(s);
        attrs.put("state", "DISABLED");
        attrs.put("hit", "FAILURE_THRESHOLD");
        return new NotifyContext(
                NotifyEventType.STREAM_DISABLED,
                nodeId,
                s.getUserId(),
                s.getRoomId(),
                s.getFailureCount(),
                threshold,
                "FAILURE_THRESHOLD",
                null,
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForPublishFailed(String nodeId, StreamState s, int batchSize, Throwable e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(s);
        attrs.put("op", "PUBLISH");
        attrs.put("batchSize", batchSize);
        return new NotifyContext(
                NotifyEventType.PUBLISH_FAILED,
                nodeId,
                s.getUserId(),
                s.getRoomId(),
                s.getFailureCount(),
                null,
                "PUBLISH_FAILED",
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForNoticeFailed(String nodeId, StreamState s, Throwable e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(s);
        attrs.put("op", "NOTICE");
        return new NotifyContext(
                NotifyEventType.NOTICE_FAILED,
                nodeId,
                s.getUserId(),
                s.getRoomId(),
                s.getFailureCount(),
                null,
                "NOTICE_FAILED",
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForEngineError(String nodeId, String userId, String op, Throwable e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("op", op);
        return new NotifyContext(
                NotifyEventType.ENGINE_ERROR,
                nodeId,
                userId,
                null,
                null,
                null,
                "ENGINE_ERROR",
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    /* ========== 私有工具 ========== */

    private static Map<String, Object> baseAttrs(StreamState s) {
        Map<String, Object> m = new HashMap<>();
        m.put("lastReadTs", s.getLastReadTs());
        m.put("participating", s.isParticipating());
        return m;
    }

    private static Instant now(Clock clock) {
        return Instant.now(clock);
    }

    private static String toError(Throwable e) {
        if (e == null) return null;
        String msg = e.getClass().getName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        StringBuilder sb = new StringBuilder(msg);
        StackTraceElement[] stack = e.getStackTrace();
        // 只取前10行，避免过长
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}

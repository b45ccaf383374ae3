package com.notifywheel.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.notifywheel.core.spi.NotificationCodec;
import com.notifywheel.model.UserNotification;

import java.util.List;

public class JacksonNotificationCodec implements NotificationCodec {

    private static final TypeReference<List<UserNotification>> NOTIFICATION_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonNotificationCodec() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonNotificationCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<UserNotification> decodeNotifications(String body) {
        if (isBlank(body)) {
            return List.of();
        }
        try {
            List<UserNotification> list = mapper.readValue(body, NOTIFICATION_LIST);
            return list == null ? List.of() : list;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed notification list: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public JsonNode decodeDetail(String body) {
        if (isBlank(body)) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed subject detail: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String encodeEvent(Object event) {
        if (event == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + event.getClass().getSimpleName(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // Instant 按 ISO-8601 输出
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 远端新增字段不影响解析
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // reason / subject.type 出现集合外取值时置 null，不丢弃整条
        m.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
        // 自动发现（JSR310 等）
        m.findAndRegisterModules();
        return m;
    }
}

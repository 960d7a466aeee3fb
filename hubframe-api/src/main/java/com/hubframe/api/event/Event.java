package com.hubframe.api.event;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 总线事件
 *
 * @param topic     以点分隔的主题，如 {@code kitchen.device.power}
 * @param payload   不可变负载
 * @param source    发布者（插件ID 或 {@code system}），可为空
 * @param timestamp 发布时间
 * @author HubFrame
 */
public record Event(String topic, Map<String, Object> payload, @Nullable String source, Instant timestamp) {

    public Event {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Event of(String topic, Map<String, Object> payload, @Nullable String source) {
        return new Event(topic, payload, source, Instant.now());
    }
}

package com.hubframe.api.device;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * 设备快照
 * <p>
 * 归属插件不在此存储，总是通过关联图和绑定实时解析。
 *
 * @author HubFrame
 */
@Value
@Builder(toBuilder = true)
public class Device {

    String id;

    /**
     * 用于选择器匹配的属性，如 name / type / room
     */
    @Singular
    Map<String, String> attributes;

    boolean online;

    boolean on;

    @Nullable
    Instant lastSeen;

    @Nullable
    Instant updatedAt;

    /**
     * 自由格式的设备状态
     */
    @Singular("stateEntry")
    Map<String, Object> state;

    public String attribute(String key) {
        return attributes.get(key);
    }
}

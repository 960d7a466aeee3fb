package com.hubframe.api.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 插件运行模式
 * <p>
 * 线上格式使用小写下划线名称（如 {@code in_process}），与持久化列和 plugin.yml 保持一致。
 *
 * @author HubFrame
 */
public enum RuntimeMode {

    /**
     * 与宿主同进程，直接调用
     */
    IN_PROCESS("in_process"),

    /**
     * 独立进程，仅通过 RPC 通道交互
     */
    MICROSERVICE("microservice"),

    /**
     * 本地 shim 处理部分动作，其余转发给微服务实例
     */
    HYBRID("hybrid"),

    /**
     * 同进程调用契约，但运行在受限沙箱中
     */
    EMBEDDED("embedded");

    private final String wireName;

    RuntimeMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 按线上名称或枚举名解析，大小写不敏感，连字符视为下划线
     */
    public static Optional<RuntimeMode> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(m -> m.wireName.equals(normalized))
                .findFirst();
    }

    public static RuntimeMode fromWire(String value) {
        return parse(value).orElseThrow(
                () -> new IllegalArgumentException("Unknown runtime mode: " + value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}

package com.hubframe.core.registry;

import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.dependency.PluginDependency;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 插件注册记录（不可变快照）
 * <p>
 * {@code enabled} 是运维意图，{@code loaded} 是实际运行状态，两者独立。
 */
@Value
@Builder(toBuilder = true)
public class PluginRecord {

    String id;

    /**
     * 全局唯一
     */
    String name;

    String description;

    String publisher;

    String latestVersion;

    boolean enabled;

    boolean loaded;

    /**
     * 配置的运行模式，可为空
     */
    RuntimeMode runtimeMode;

    /**
     * 支持的运行模式，有序
     */
    @Singular
    List<RuntimeMode> supportedModes;

    boolean modeSwitchSupported;

    @Singular("configEntry")
    Map<String, Object> config;

    /**
     * 对其他插件的依赖与冲突声明
     */
    @Singular
    List<PluginDependency> dependencies;

    @Builder.Default
    ConfigSchema configSchema = ConfigSchema.empty();

    Instant createdAt;

    /**
     * 实际用于加载的模式：配置的模式，否则第一个支持的模式，否则进程内
     */
    public RuntimeMode effectiveMode() {
        if (runtimeMode != null) {
            return runtimeMode;
        }
        return supportedModes.isEmpty() ? RuntimeMode.IN_PROCESS : supportedModes.get(0);
    }

    public boolean supports(RuntimeMode mode) {
        return supportedModes.isEmpty() ? mode == RuntimeMode.IN_PROCESS : supportedModes.contains(mode);
    }
}

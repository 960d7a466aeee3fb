package com.hubframe.core.loader;

import com.hubframe.api.model.DependencyType;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.dependency.PluginDependency;
import com.hubframe.core.dependency.VersionSpec;
import com.hubframe.core.registry.ConfigSchema;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 插件清单 (plugin.yml)
 * <pre>
 * id: lights
 * name: Lights
 * version: 1.2.0
 * runtimeMode: in_process
 * supportedModes: [in_process, microservice]
 * modeSwitchSupported: true
 * config: { brightness: 80 }
 * configSchema:
 *   brightness: { type: integer, required: true }
 * dependencies:
 *   - { id: weather, version: ">=1.0.0,<2.0.0" }
 *   - { id: legacy-lights, type: conflicts }
 * </pre>
 */
@Data
public class PluginManifest {

    private String id;

    private String name;

    private String version;

    private String description;

    private String publisher;

    private String runtimeMode;

    private List<String> supportedModes = new ArrayList<>();

    private boolean modeSwitchSupported;

    /**
     * 安装后默认是否启用
     */
    private boolean enabled = true;

    private Map<String, Object> config = new LinkedHashMap<>();

    private Map<String, Object> configSchema = new LinkedHashMap<>();

    /**
     * 每项包含 id，可选 version（版本约束）和 type（默认 required）
     */
    private List<Map<String, Object>> dependencies = new ArrayList<>();

    public RuntimeMode resolveRuntimeMode() {
        return runtimeMode == null ? null : RuntimeMode.fromWire(runtimeMode);
    }

    public List<RuntimeMode> resolveSupportedModes() {
        List<RuntimeMode> modes = new ArrayList<>();
        if (supportedModes != null) {
            for (String mode : supportedModes) {
                RuntimeMode parsed = RuntimeMode.fromWire(mode);
                if (!modes.contains(parsed)) {
                    modes.add(parsed);
                }
            }
        }
        return modes;
    }

    public ConfigSchema resolveConfigSchema() {
        return ConfigSchema.fromMap(configSchema);
    }

    /**
     * @throws IllegalArgumentException 缺少 id、依赖自身、未知类型或无法解析的版本约束
     */
    public List<PluginDependency> resolveDependencies() {
        List<PluginDependency> resolved = new ArrayList<>();
        if (dependencies == null) {
            return resolved;
        }
        for (Map<String, Object> entry : dependencies) {
            Object target = entry == null ? null : entry.get("id");
            if (target == null || String.valueOf(target).isBlank()) {
                throw new IllegalArgumentException("dependency entry is missing 'id'");
            }
            String targetId = String.valueOf(target).trim();
            if (targetId.equals(id)) {
                throw new IllegalArgumentException("plugin cannot depend on itself");
            }
            Object version = entry.get("version");
            String versionSpec = version == null ? null : String.valueOf(version);
            VersionSpec.parse(versionSpec);
            Object type = entry.get("type");
            resolved.add(PluginDependency.builder()
                    .pluginId(targetId)
                    .versionSpec(versionSpec)
                    .type(type == null ? DependencyType.REQUIRED : DependencyType.fromWire(String.valueOf(type)))
                    .build());
        }
        return resolved;
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}

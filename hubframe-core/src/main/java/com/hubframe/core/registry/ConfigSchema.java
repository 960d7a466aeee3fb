package com.hubframe.core.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 插件配置 schema
 * <p>
 * manifest 中的写法：
 * <pre>
 * configSchema:
 *   brightness: { type: integer, required: true, default: 80 }
 *   scene: { type: string, allowed: [day, night] }
 * </pre>
 * 未声明的键不做校验。
 */
public final class ConfigSchema {

    private static final ConfigSchema EMPTY = new ConfigSchema(Collections.emptyMap());

    private final Map<String, ConfigField> fields;

    private ConfigSchema(Map<String, ConfigField> fields) {
        this.fields = fields;
    }

    public static ConfigSchema empty() {
        return EMPTY;
    }

    public static ConfigSchema of(Map<String, ConfigField> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new ConfigSchema(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    /**
     * 从 manifest / 持久化文件中的原始 Map 构建
     */
    @SuppressWarnings("unchecked")
    public static ConfigSchema fromMap(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, ConfigField> fields = new LinkedHashMap<>();
        raw.forEach((name, spec) -> {
            if (!(spec instanceof Map<?, ?> specMap)) {
                throw new IllegalArgumentException("Schema entry '" + name + "' must be a map");
            }
            Map<String, Object> m = (Map<String, Object>) specMap;
            ConfigField.ConfigFieldBuilder builder = ConfigField.builder()
                    .type(FieldType.fromWire(String.valueOf(m.getOrDefault("type", "string"))))
                    .required(Boolean.TRUE.equals(m.get("required")))
                    .defaultValue(m.get("default"));
            if (m.get("description") != null) {
                builder.description(String.valueOf(m.get("description")));
            }
            if (m.get("allowed") instanceof List<?> allowed) {
                builder.allowed(new ArrayList<>(allowed));
            }
            fields.put(name, builder.build());
        });
        return of(fields);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> raw = new LinkedHashMap<>();
        fields.forEach((name, field) -> {
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("type", field.getType().wireName());
            spec.put("required", field.isRequired());
            if (!field.getAllowed().isEmpty()) {
                spec.put("allowed", new ArrayList<>(field.getAllowed()));
            }
            if (field.getDefaultValue() != null) {
                spec.put("default", field.getDefaultValue());
            }
            if (field.getDescription() != null) {
                spec.put("description", field.getDescription());
            }
            raw.put(name, spec);
        });
        return raw;
    }

    /**
     * 校验配置
     *
     * @return 全部违规项，为空表示通过
     */
    public List<String> validate(Map<String, Object> config) {
        Map<String, Object> values = config == null ? Collections.emptyMap() : config;
        List<String> violations = new ArrayList<>();
        fields.forEach((name, field) -> {
            Object value = values.get(name);
            if (value == null) {
                if (field.isRequired()) {
                    violations.add("'" + name + "' is required");
                }
                return;
            }
            if (!field.getType().accepts(value)) {
                violations.add("'" + name + "' must be of type " + field.getType()
                        + " but was " + value.getClass().getSimpleName());
                return;
            }
            if (!field.getAllowed().isEmpty() && field.getAllowed().stream().noneMatch(a -> sameValue(a, value))) {
                violations.add("'" + name + "' must be one of " + field.getAllowed() + " but was " + value);
            }
        });
        return violations;
    }

    /**
     * 以声明的默认值补全配置
     */
    public Map<String, Object> applyDefaults(Map<String, Object> config) {
        Map<String, Object> result = new LinkedHashMap<>();
        fields.forEach((name, field) -> {
            if (field.getDefaultValue() != null) {
                result.put(name, field.getDefaultValue());
            }
        });
        if (config != null) {
            result.putAll(config);
        }
        return result;
    }

    public Map<String, ConfigField> getFields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    private static boolean sameValue(Object allowed, Object actual) {
        if (allowed instanceof Number a && actual instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(allowed, actual);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConfigSchema other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ConfigSchema" + fields.keySet();
    }
}

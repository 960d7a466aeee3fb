package com.hubframe.core.registry;

import com.hubframe.api.exception.HubException;
import com.hubframe.api.model.DependencyType;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.dependency.PluginDependency;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML 文件存储
 * <p>
 * 以插件ID为键保存记录，列名与持久化布局一致（snake_case）。
 * 每次写入整体重写文件，先写临时文件再原子替换。
 */
@Slf4j
public class YamlPluginStore implements PluginStore {

    private final Path file;
    private final Map<String, Map<String, Object>> rows = new LinkedHashMap<>();

    public YamlPluginStore(Path file) {
        this.file = file;
        read();
    }

    @Override
    public synchronized List<PluginRecord> loadAll() {
        List<PluginRecord> records = new ArrayList<>();
        rows.forEach((id, row) -> {
            try {
                records.add(fromRow(row));
            } catch (RuntimeException e) {
                log.error("Skipping unreadable plugin row {} in {}: {}", id, file, e.getMessage());
            }
        });
        return records;
    }

    @Override
    public synchronized void save(PluginRecord record) {
        rows.put(record.getId(), toRow(record));
        write();
    }

    @Override
    public synchronized void delete(String pluginId) {
        if (rows.remove(pluginId) != null) {
            write();
        }
    }

    // ==================== 序列化 ====================

    static Map<String, Object> toRow(PluginRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", record.getId());
        row.put("name", record.getName());
        row.put("description", record.getDescription());
        row.put("publisher", record.getPublisher());
        row.put("latest_version", record.getLatestVersion());
        row.put("loaded", record.isLoaded());
        row.put("enabled", record.isEnabled());
        row.put("runtime_mode", record.getRuntimeMode() == null ? null : record.getRuntimeMode().wireName());
        row.put("supported_modes", record.getSupportedModes().stream().map(RuntimeMode::wireName).toList());
        row.put("mode_switch_supported", record.isModeSwitchSupported());
        row.put("config", new LinkedHashMap<>(record.getConfig()));
        row.put("config_schema", record.getConfigSchema().toMap());
        row.put("dependencies", record.getDependencies().stream().map(YamlPluginStore::dependencyRow).toList());
        row.put("created_at", record.getCreatedAt() == null ? null : record.getCreatedAt().toString());
        return row;
    }

    private static Map<String, Object> dependencyRow(PluginDependency dependency) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("plugin_id", dependency.getPluginId());
        row.put("version_spec", dependency.getVersionSpec());
        row.put("type", dependency.getType().wireName());
        return row;
    }

    @SuppressWarnings("unchecked")
    static PluginRecord fromRow(Map<String, Object> row) {
        PluginRecord.PluginRecordBuilder builder = PluginRecord.builder()
                .id(String.valueOf(row.get("id")))
                .name(String.valueOf(row.get("name")))
                .description((String) row.get("description"))
                .publisher((String) row.get("publisher"))
                .latestVersion(row.get("latest_version") == null ? null : String.valueOf(row.get("latest_version")))
                .loaded(Boolean.TRUE.equals(row.get("loaded")))
                .enabled(Boolean.TRUE.equals(row.get("enabled")))
                .modeSwitchSupported(Boolean.TRUE.equals(row.get("mode_switch_supported")));
        Object mode = row.get("runtime_mode");
        if (mode != null) {
            builder.runtimeMode(RuntimeMode.fromWire(String.valueOf(mode)));
        }
        if (row.get("supported_modes") instanceof List<?> modes) {
            modes.forEach(m -> builder.supportedMode(RuntimeMode.fromWire(String.valueOf(m))));
        }
        if (row.get("config") instanceof Map<?, ?> config) {
            builder.config((Map<String, Object>) config);
        }
        if (row.get("config_schema") instanceof Map<?, ?> schema) {
            builder.configSchema(ConfigSchema.fromMap((Map<String, Object>) schema));
        }
        if (row.get("dependencies") instanceof List<?> dependencies) {
            for (Object dependency : dependencies) {
                if (dependency instanceof Map<?, ?> dep) {
                    Object type = dep.get("type");
                    builder.dependency(PluginDependency.builder()
                            .pluginId(String.valueOf(dep.get("plugin_id")))
                            .versionSpec(dep.get("version_spec") == null ? null : String.valueOf(dep.get("version_spec")))
                            .type(type == null ? DependencyType.REQUIRED : DependencyType.fromWire(String.valueOf(type)))
                            .build());
                }
            }
        }
        Object createdAt = row.get("created_at");
        if (createdAt != null) {
            builder.createdAt(Instant.parse(String.valueOf(createdAt)));
        }
        return builder.build();
    }

    // ==================== 文件读写 ====================

    @SuppressWarnings("unchecked")
    private void read() {
        if (!Files.exists(file)) {
            return;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object loaded = yaml.load(reader);
            if (loaded instanceof Map<?, ?> map) {
                map.forEach((id, row) -> {
                    if (row instanceof Map<?, ?>) {
                        rows.put(String.valueOf(id), (Map<String, Object>) row);
                    }
                });
            }
            log.info("Loaded {} plugin records from {}", rows.size(), file);
        } catch (IOException e) {
            throw new HubException("Failed to read plugin store " + file, e);
        }
    }

    private void write() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            DumperOptions options = new DumperOptions();
            options.setIndent(2);
            options.setPrettyFlow(true);
            options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
            Yaml yaml = new Yaml(new Representer(options), options);

            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                yaml.dump(rows, writer);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new HubException("Failed to write plugin store " + file, e);
        }
    }
}

package com.hubframe.core.registry;

import com.hubframe.api.model.DependencyType;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.dependency.PluginDependency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YamlPluginStore 单元测试")
public class YamlPluginStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("保存后可由新实例读回全部字段")
    void persistsAcrossInstances() {
        Path file = tempDir.resolve("registry.yml");
        YamlPluginStore store = new YamlPluginStore(file);
        PluginRecord record = PluginRecord.builder()
                .id("lights")
                .name("Lights")
                .publisher("acme")
                .latestVersion("1.2.0")
                .enabled(true)
                .runtimeMode(RuntimeMode.MICROSERVICE)
                .supportedMode(RuntimeMode.IN_PROCESS)
                .supportedMode(RuntimeMode.MICROSERVICE)
                .modeSwitchSupported(true)
                .configEntry("brightness", 80)
                .configSchema(ConfigSchema.fromMap(Map.of("brightness", Map.of("type", "integer"))))
                .dependency(PluginDependency.builder().pluginId("weather").versionSpec(">=1.0.0,<2.0.0").build())
                .dependency(PluginDependency.builder().pluginId("legacy-lights").type(DependencyType.CONFLICTS).build())
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        store.save(record);
        assertTrue(Files.exists(file));

        List<PluginRecord> restored = new YamlPluginStore(file).loadAll();
        assertEquals(1, restored.size());
        assertEquals(record, restored.get(0));
    }

    @Test
    @DisplayName("删除后不再读回")
    void deleteRemovesRow() {
        Path file = tempDir.resolve("registry.yml");
        YamlPluginStore store = new YamlPluginStore(file);
        store.save(PluginRecord.builder().id("a").name("a").build());
        store.save(PluginRecord.builder().id("b").name("b").build());

        store.delete("a");

        List<PluginRecord> restored = new YamlPluginStore(file).loadAll();
        assertEquals(List.of("b"), restored.stream().map(PluginRecord::getId).toList());
    }

    @Test
    @DisplayName("文件不存在时为空")
    void missingFileIsEmpty() {
        assertTrue(new YamlPluginStore(tempDir.resolve("absent.yml")).loadAll().isEmpty());
    }

    @Test
    @DisplayName("无法解析的行被跳过")
    void unreadableRowIsSkipped() throws Exception {
        Path file = tempDir.resolve("registry.yml");
        Files.writeString(file, """
                good:
                  id: good
                  name: good
                  enabled: true
                bad:
                  id: bad
                  name: bad
                  runtime_mode: teleport
                """);

        List<PluginRecord> restored = new YamlPluginStore(file).loadAll();

        assertEquals(1, restored.size());
        assertTrue(restored.get(0).isEnabled());
    }
}

package com.hubframe.core.loader;

import com.hubframe.api.exception.HubException;
import com.hubframe.api.model.DependencyType;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.dependency.PluginDependency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginManifestLoader 单元测试")
public class PluginManifestLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("解析完整清单")
    void parsesFullManifest() {
        PluginManifest manifest = load("""
                id: lights
                name: Lights
                version: "1.2.0"
                publisher: acme
                runtimeMode: microservice
                supportedModes: [in_process, microservice]
                modeSwitchSupported: true
                config:
                  brightness: 80
                configSchema:
                  brightness: { type: integer, required: true }
                """);

        assertEquals("lights", manifest.getId());
        assertEquals("1.2.0", manifest.getVersion());
        assertEquals(RuntimeMode.MICROSERVICE, manifest.resolveRuntimeMode());
        assertEquals(List.of(RuntimeMode.IN_PROCESS, RuntimeMode.MICROSERVICE), manifest.resolveSupportedModes());
        assertTrue(manifest.isModeSwitchSupported());
        assertTrue(manifest.isEnabled());
        assertEquals(80, manifest.getConfig().get("brightness"));
        assertFalse(manifest.resolveConfigSchema().isEmpty());
    }

    @Test
    @DisplayName("解析依赖声明，类型默认为 required")
    void parsesDependencies() {
        PluginManifest manifest = load("""
                id: scenes
                dependencies:
                  - { id: lights, version: ">=1.0.0,<2.0.0" }
                  - { id: weather, type: optional }
                  - { id: legacy-scenes, type: conflicts }
                """);

        List<PluginDependency> dependencies = manifest.resolveDependencies();

        assertEquals(3, dependencies.size());
        assertEquals("lights", dependencies.get(0).getPluginId());
        assertEquals(DependencyType.REQUIRED, dependencies.get(0).getType());
        assertEquals(">=1.0.0,<2.0.0", dependencies.get(0).getVersionSpec());
        assertEquals(DependencyType.OPTIONAL, dependencies.get(1).getType());
        assertNull(dependencies.get(1).getVersionSpec());
        assertEquals(DependencyType.CONFLICTS, dependencies.get(2).getType());
    }

    @Test
    @DisplayName("非法依赖声明被拒绝")
    void invalidDependenciesAreRejected() {
        assertThrows(HubException.class, () -> load("id: scenes\ndependencies:\n  - { version: '1.0' }\n"));
        assertThrows(HubException.class, () -> load("id: scenes\ndependencies:\n  - { id: scenes }\n"));
        assertThrows(HubException.class, () -> load("id: scenes\ndependencies:\n  - { id: lights, type: maybe }\n"));
        assertThrows(HubException.class, () -> load("id: scenes\ndependencies:\n  - { id: lights, version: '>=x' }\n"));
    }

    @Test
    @DisplayName("名称缺省时使用ID")
    void displayNameFallsBackToId() {
        assertEquals("blinds", load("id: blinds\n").displayName());
    }

    @Test
    @DisplayName("缺少 id 被拒绝")
    void missingIdIsRejected() {
        HubException e = assertThrows(HubException.class, () -> load("name: Nameless\n"));
        assertTrue(e.getMessage().contains("'id'"));
    }

    @Test
    @DisplayName("运行模式不在支持列表内被拒绝")
    void modeOutsideSupportedIsRejected() {
        assertThrows(HubException.class, () -> load("""
                id: lights
                runtimeMode: embedded
                supportedModes: [in_process]
                """));
    }

    @Test
    @DisplayName("未知运行模式被拒绝")
    void unknownModeIsRejected() {
        assertThrows(HubException.class, () -> load("id: lights\nruntimeMode: quantum\n"));
    }

    @Test
    @DisplayName("格式错误的 YAML")
    void malformedYaml() {
        assertThrows(HubException.class, () -> load("id: [unclosed\n"));
        assertThrows(HubException.class, () -> load(""));
    }

    @Test
    @DisplayName("从目录读取 plugin.yml")
    void loadsFromDirectory() throws Exception {
        Files.writeString(tempDir.resolve(PluginManifestLoader.MANIFEST_FILE), "id: lights\n");

        assertEquals("lights", PluginManifestLoader.load(tempDir).getId());
        assertThrows(HubException.class, () -> PluginManifestLoader.load(tempDir.resolve("missing")));
    }

    // ==================== 辅助方法 ====================

    private PluginManifest load(String yaml) {
        return PluginManifestLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}

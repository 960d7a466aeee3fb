package com.hubframe.core;

import com.hubframe.api.device.Device;
import com.hubframe.api.model.InstallType;
import com.hubframe.api.model.JobStatus;
import com.hubframe.api.plugin.HubPlugin;
import com.hubframe.api.plugin.PluginFactory;
import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.device.DeviceCommandService.CommandResult;
import com.hubframe.core.install.InstallJob;
import com.hubframe.core.testing.RecordingPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HubOrchestrator 集成测试")
public class HubOrchestratorTest {

    @TempDir
    Path pluginHome;

    private RecordingPlugin lights;
    private HubOrchestrator hub;

    @BeforeEach
    void setUp() throws Exception {
        writeManifest("lights", """
                id: lights
                name: Lights
                version: "1.0.0"
                runtimeMode: in_process
                supportedModes: [in_process, microservice]
                """);
        writeManifest("broken", """
                id: broken
                runtimeMode: quantum
                """);

        lights = new RecordingPlugin();
        lights.bindSelector = "type=light";

        HubFrameConfig config = HubFrameConfig.builder()
                .pluginHome(pluginHome.toString())
                .eventDebounceMs(0)
                .loadTimeoutSeconds(2)
                .healthCheckIntervalSeconds(0)
                .build();
        hub = HubOrchestrator.builder()
                .config(config)
                .plugin(factory("lights", lights))
                .build();
    }

    @AfterEach
    void tearDown() {
        hub.shutdown();
    }

    @Test
    @DisplayName("启动时扫描插件目录并加载已启用的插件")
    void startDiscoversAndLoads() {
        hub.start();

        assertTrue(hub.isRunning());
        assertTrue(hub.getRegistry().contains("lights"));
        assertFalse(hub.getRegistry().contains("broken"));
        assertTrue(hub.getRegistry().require("lights").isLoaded());
        assertEquals(1, lights.loads.get());
    }

    @Test
    @DisplayName("重复启动无效果")
    void startIsIdempotent() {
        hub.start();
        hub.start();

        assertEquals(1, lights.loads.get());
    }

    @Test
    @DisplayName("设备命令路由到认领插件并更新设备状态")
    void deviceCommandRoundTrip() {
        hub.start();
        hub.getDevices().upsert(Device.builder().id("lamp-1").attribute("type", "light").build());

        CommandResult result = hub.getCommands().execute("lamp-1", "toggle", Map.of());

        assertEquals("lights", result.ownerPluginId());
        assertTrue(result.device().isOn());
        assertEquals(List.of("device.toggle"), lights.invocations);
        assertFalse(hub.getEventBus().recentEvents("device.lamp-1.updated").isEmpty());
    }

    @Test
    @DisplayName("本地目录安装新插件")
    void installFromLocalPath(@TempDir Path source) throws Exception {
        Files.writeString(source.resolve("plugin.yml"), """
                id: scenes
                version: "0.3.0"
                supportedModes: [in_process]
                """);
        hub.start();

        String jobId = hub.getInstallPipeline().enqueue("scenes", InstallType.LOCAL, Map.of("path", source.toString()));
        InstallJob job = hub.getInstallPipeline().awaitTerminal(jobId).get(10, TimeUnit.SECONDS);

        assertEquals(JobStatus.SUCCESS, job.getStatus());
        assertEquals("0.3.0", hub.getRegistry().require("scenes").getLatestVersion());
    }

    @Test
    @DisplayName("关闭时卸载全部插件")
    void shutdownUnloads() {
        hub.start();

        hub.close();

        assertFalse(hub.isRunning());
        assertEquals(1, lights.unloads.get());
        assertTrue(hub.getEventBus().isShutdown());
    }

    // ==================== 辅助方法 ====================

    private void writeManifest(String dir, String yaml) throws Exception {
        Path pluginDir = Files.createDirectories(pluginHome.resolve(dir));
        Files.writeString(pluginDir.resolve("plugin.yml"), yaml);
    }

    private static PluginFactory factory(String id, HubPlugin plugin) {
        return new PluginFactory() {
            @Override
            public String pluginId() {
                return id;
            }

            @Override
            public HubPlugin create() {
                return plugin;
            }
        };
    }
}

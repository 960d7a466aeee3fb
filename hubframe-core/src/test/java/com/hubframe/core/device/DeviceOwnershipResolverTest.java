package com.hubframe.core.device;

import com.hubframe.api.device.Device;
import com.hubframe.api.model.LinkDirection;
import com.hubframe.api.model.LinkType;
import com.hubframe.core.registry.InMemoryPluginStore;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.registry.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeviceOwnershipResolver 单元测试")
public class DeviceOwnershipResolverTest {

    private DeviceRegistry devices;
    private BindingRegistry bindings;
    private DeviceLinkGraph graph;
    private PluginRegistry plugins;
    private DeviceOwnershipResolver resolver;

    @BeforeEach
    void setUp() {
        devices = new DeviceRegistry(null);
        bindings = new BindingRegistry();
        graph = new DeviceLinkGraph();
        plugins = new PluginRegistry(new InMemoryPluginStore(), bindings);
        resolver = new DeviceOwnershipResolver(devices, bindings, graph, plugins);

        devices.upsert(Device.builder().id("lamp").attribute("type", "light").build());
        devices.upsert(Device.builder().id("bulb").attribute("type", "bulb").build());
        devices.upsert(Device.builder().id("switch").attribute("type", "switch").build());
    }

    @Test
    @DisplayName("直接绑定且已加载的插件认领设备")
    void directOwner() {
        registerLoaded("lights");
        bindings.bind("lights", "type=light");

        assertEquals(Optional.of("lights"), resolver.resolveOwner("lamp"));
    }

    @Test
    @DisplayName("未加载的插件不认领，顺延到下一个绑定")
    void unloadedPluginIsSkipped() {
        register("first", false);
        registerLoaded("second");
        bindings.bind("first", "type=light");
        bindings.bind("second", "type=light");

        assertEquals(Optional.of("second"), resolver.resolveOwner("lamp"));
    }

    @Test
    @DisplayName("没有直接归属时经关联设备继承")
    void ownerThroughLinkedDevice() {
        registerLoaded("lights");
        bindings.bind("lights", "type=light");
        graph.addLink("bulb", "lamp", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL);

        assertEquals(Optional.of("lights"), resolver.resolveOwner("bulb"));
    }

    @Test
    @DisplayName("关联方向相反时不继承")
    void linkDirectionMatters() {
        registerLoaded("lights");
        bindings.bind("lights", "type=light");
        graph.addLink("lamp", "bulb", LinkType.PROXY, LinkDirection.UNIDIRECTIONAL);

        assertTrue(resolver.resolveOwner("bulb").isEmpty());
    }

    @Test
    @DisplayName("无人认领或设备不存在时为空")
    void noOwner() {
        assertTrue(resolver.resolveOwner("switch").isEmpty());
        assertTrue(resolver.resolveOwner("ghost").isEmpty());
    }

    // ==================== 辅助方法 ====================

    private void registerLoaded(String id) {
        register(id, true);
    }

    private void register(String id, boolean loaded) {
        plugins.register(PluginRecord.builder().id(id).name(id).enabled(true).build());
        if (loaded) {
            plugins.markLoaded(id, true);
        }
    }
}

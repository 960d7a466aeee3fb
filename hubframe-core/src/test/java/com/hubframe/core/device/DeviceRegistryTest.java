package com.hubframe.core.device;

import com.hubframe.api.device.Device;
import com.hubframe.api.event.Event;
import com.hubframe.api.exception.DeviceNotFoundException;
import com.hubframe.core.event.TopicEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeviceRegistry 单元测试")
public class DeviceRegistryTest {

    private final Instant now = Instant.parse("2026-03-01T08:00:00Z");
    private TopicEventBus bus;
    private DeviceRegistry devices;

    @BeforeEach
    void setUp() {
        bus = new TopicEventBus(0, 10, 100, 100, 1);
        devices = new DeviceRegistry(bus, Clock.fixed(now, ZoneOffset.UTC));
        devices.upsert(Device.builder().id("lamp-2").attribute("type", "light").attribute("room", "hall").build());
        devices.upsert(Device.builder().id("lamp-1").attribute("type", "light").attribute("room", "kitchen").build());
        devices.upsert(Device.builder().id("plug-1").attribute("type", "plug").build());
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    @Test
    @DisplayName("查询按ID排序，选择器过滤")
    void listAndFind() {
        assertEquals(List.of("lamp-1", "lamp-2", "plug-1"), devices.list().stream().map(Device::getId).toList());
        assertEquals(List.of("lamp-1"),
                devices.find(DeviceSelector.parse("type=light,room=kitchen")).stream().map(Device::getId).toList());
        assertEquals(now, devices.require("plug-1").getUpdatedAt());
    }

    @Test
    @DisplayName("心跳和开关更新设备并发布事件")
    void updatesPublishEvents() {
        devices.markSeen("lamp-1", true);
        Device lamp = devices.setPower("lamp-1", true);

        assertTrue(lamp.isOnline());
        assertTrue(lamp.isOn());
        assertEquals(now, lamp.getLastSeen());
        List<Event> events = bus.recentEvents("device.lamp-1.updated");
        assertEquals(Boolean.TRUE, events.get(events.size() - 1).payload().get("on"));
    }

    @Test
    @DisplayName("状态合并保留已有键")
    void mergeState() {
        devices.mergeState("lamp-1", Map.of("brightness", 40));
        Device lamp = devices.mergeState("lamp-1", Map.of("color", "warm"));

        assertEquals(Map.of("brightness", 40, "color", "warm"), lamp.getState());
    }

    @Test
    @DisplayName("未知设备")
    void unknownDevice() {
        assertThrows(DeviceNotFoundException.class, () -> devices.require("ghost"));
        assertThrows(DeviceNotFoundException.class, () -> devices.setPower("ghost", true));
        assertFalse(devices.remove("ghost"));
        assertTrue(devices.remove("plug-1"));
        assertTrue(devices.get("plug-1").isEmpty());
    }
}

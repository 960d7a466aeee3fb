package com.hubframe.core.device;

import com.hubframe.api.device.Device;
import com.hubframe.api.exception.DeviceNotFoundException;
import com.hubframe.core.event.SystemTopics;
import com.hubframe.core.event.TopicEventBus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 设备注册表
 * 保存设备快照；状态变化发布到 {@code device.<id>.updated}。
 */
@Slf4j
public class DeviceRegistry {

    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final TopicEventBus eventBus;
    private final Clock clock;

    public DeviceRegistry(TopicEventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    public DeviceRegistry(TopicEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Device upsert(Device device) {
        Device stored = device.toBuilder().updatedAt(clock.instant()).build();
        devices.put(device.getId(), stored);
        publish(stored);
        return stored;
    }

    public Optional<Device> get(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    public Device require(String deviceId) {
        return get(deviceId).orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }

    public List<Device> list() {
        return devices.values().stream().sorted(Comparator.comparing(Device::getId)).toList();
    }

    public List<Device> find(DeviceSelector selector) {
        return list().stream().filter(selector::matches).toList();
    }

    public boolean remove(String deviceId) {
        return devices.remove(deviceId) != null;
    }

    /**
     * 设备上报心跳
     */
    public Device markSeen(String deviceId, boolean online) {
        Instant now = clock.instant();
        return update(deviceId, d -> d.toBuilder().online(online).lastSeen(now).build());
    }

    public Device setPower(String deviceId, boolean on) {
        return update(deviceId, d -> d.toBuilder().on(on).build());
    }

    public Device mergeState(String deviceId, Map<String, Object> state) {
        return update(deviceId, d -> {
            Map<String, Object> merged = new LinkedHashMap<>(d.getState());
            merged.putAll(state);
            return d.toBuilder().clearState().state(merged).build();
        });
    }

    private Device update(String deviceId, UnaryOperator<Device> change) {
        Instant now = clock.instant();
        Device updated = devices.computeIfPresent(deviceId,
                (id, current) -> change.apply(current).toBuilder().updatedAt(now).build());
        if (updated == null) {
            throw new DeviceNotFoundException(deviceId);
        }
        publish(updated);
        return updated;
    }

    private void publish(Device device) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("deviceId", device.getId());
        payload.put("online", device.isOnline());
        payload.put("on", device.isOn());
        payload.put("state", device.getState());
        eventBus.emit(SystemTopics.deviceUpdated(device.getId()), payload, SystemTopics.SOURCE);
    }
}

package com.hubframe.core.device;

import com.hubframe.api.device.Device;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.registry.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 设备归属解析
 * <p>
 * 归属不落库，每次查询时计算：
 * 1. 按登记顺序取第一个匹配该设备且已加载的插件
 * 2. 没有直接归属时，沿连接图按 BFS 顺序取第一个有直接归属的关联设备
 */
@Slf4j
public class DeviceOwnershipResolver {

    private final DeviceRegistry devices;
    private final BindingRegistry bindings;
    private final DeviceLinkGraph linkGraph;
    private final PluginRegistry plugins;

    public DeviceOwnershipResolver(DeviceRegistry devices,
                                   BindingRegistry bindings,
                                   DeviceLinkGraph linkGraph,
                                   PluginRegistry plugins) {
        this.devices = devices;
        this.bindings = bindings;
        this.linkGraph = linkGraph;
        this.plugins = plugins;
    }

    /**
     * @return 归属插件ID；设备不存在或无人认领时为空
     */
    public Optional<String> resolveOwner(String deviceId) {
        Optional<Device> device = devices.get(deviceId);
        if (device.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> direct = directOwner(device.get());
        if (direct.isPresent()) {
            return direct;
        }
        for (RelatedDevice related : linkGraph.relatedDevices(deviceId)) {
            Optional<String> owner = devices.get(related.deviceId()).flatMap(this::directOwner);
            if (owner.isPresent()) {
                log.debug("Device {} owned by [{}] through linked device {} ({} hops)",
                        deviceId, owner.get(), related.deviceId(), related.depth());
                return owner;
            }
        }
        return Optional.empty();
    }

    private Optional<String> directOwner(Device device) {
        return bindings.findMatching(device).stream()
                .map(PluginBinding::pluginId)
                .filter(this::isLoaded)
                .findFirst();
    }

    private boolean isLoaded(String pluginId) {
        return plugins.get(pluginId).map(PluginRecord::isLoaded).orElse(false);
    }
}

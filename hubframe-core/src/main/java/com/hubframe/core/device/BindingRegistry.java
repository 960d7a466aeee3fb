package com.hubframe.core.device;

import com.hubframe.api.device.Device;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 绑定注册表
 * 绑定归插件所有，插件卸载时全部释放。
 */
@Slf4j
public class BindingRegistry {

    private final List<PluginBinding> bindings = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * 登记绑定；同一插件重复登记同一选择器返回已有绑定
     */
    public synchronized PluginBinding bind(String pluginId, String selector) {
        DeviceSelector parsed = DeviceSelector.parse(selector);
        for (PluginBinding existing : bindings) {
            if (existing.pluginId().equals(pluginId) && existing.expression().equals(parsed.expression())) {
                return existing;
            }
        }
        PluginBinding binding = new PluginBinding(pluginId, parsed, sequence.incrementAndGet());
        bindings.add(binding);
        log.debug("[{}] Bound devices '{}'", pluginId, parsed);
        return binding;
    }

    public synchronized boolean unbind(String pluginId, String selector) {
        String expression = DeviceSelector.parse(selector).expression();
        return bindings.removeIf(b -> b.pluginId().equals(pluginId) && b.expression().equals(expression));
    }

    /**
     * @return 释放的绑定数量
     */
    public synchronized int unbindAll(String pluginId) {
        List<PluginBinding> owned = bindingsFor(pluginId);
        bindings.removeAll(owned);
        if (!owned.isEmpty()) {
            log.debug("[{}] Released {} bindings", pluginId, owned.size());
        }
        return owned.size();
    }

    public List<PluginBinding> bindingsFor(String pluginId) {
        return bindings.stream().filter(b -> b.pluginId().equals(pluginId)).toList();
    }

    public boolean hasBindings(String pluginId) {
        return bindings.stream().anyMatch(b -> b.pluginId().equals(pluginId));
    }

    /**
     * 匹配设备的绑定，按登记顺序
     */
    public List<PluginBinding> findMatching(Device device) {
        return bindings.stream().filter(b -> b.selector().matches(device)).toList();
    }

    public List<PluginBinding> all() {
        return List.copyOf(bindings);
    }
}

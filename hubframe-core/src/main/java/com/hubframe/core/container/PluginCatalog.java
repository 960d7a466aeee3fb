package com.hubframe.core.container;

import com.hubframe.api.plugin.HubPlugin;
import com.hubframe.api.plugin.PluginFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 进程内插件注册表：插件ID → 工厂
 */
@Slf4j
public class PluginCatalog {

    private final Map<String, PluginFactory> factories = new ConcurrentHashMap<>();

    public PluginCatalog() {
    }

    public PluginCatalog(Collection<? extends PluginFactory> initial) {
        initial.forEach(this::register);
    }

    public void register(PluginFactory factory) {
        PluginFactory previous = factories.put(factory.pluginId(), factory);
        if (previous != null && previous != factory) {
            log.warn("[{}] Plugin factory replaced: {} -> {}", factory.pluginId(),
                    previous.getClass().getName(), factory.getClass().getName());
        } else {
            log.debug("[{}] Plugin factory registered: {}", factory.pluginId(), factory.getClass().getName());
        }
    }

    public void register(String pluginId, Supplier<? extends HubPlugin> supplier) {
        register(new PluginFactory() {
            @Override
            public String pluginId() {
                return pluginId;
            }

            @Override
            public HubPlugin create() {
                return supplier.get();
            }
        });
    }

    public boolean unregister(String pluginId) {
        return factories.remove(pluginId) != null;
    }

    public boolean contains(String pluginId) {
        return factories.containsKey(pluginId);
    }

    /**
     * 创建新的插件实例
     */
    public Optional<HubPlugin> create(String pluginId) {
        PluginFactory factory = factories.get(pluginId);
        return factory == null ? Optional.empty() : Optional.ofNullable(factory.create());
    }

    public Set<String> pluginIds() {
        return Set.copyOf(factories.keySet());
    }
}

package com.hubframe.core.registry;

import java.util.List;

/**
 * 注册表持久化 SPI
 */
public interface PluginStore {

    List<PluginRecord> loadAll();

    void save(PluginRecord record);

    void delete(String pluginId);
}

package com.hubframe.core.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存存储，进程退出即丢失
 */
public class InMemoryPluginStore implements PluginStore {

    private final Map<String, PluginRecord> records = new ConcurrentHashMap<>();

    @Override
    public List<PluginRecord> loadAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public void save(PluginRecord record) {
        records.put(record.getId(), record);
    }

    @Override
    public void delete(String pluginId) {
        records.remove(pluginId);
    }
}

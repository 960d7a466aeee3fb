package com.hubframe.core.registry;

import com.hubframe.api.exception.DuplicateNameException;
import com.hubframe.api.exception.HubException;
import com.hubframe.api.exception.InvalidConfigException;
import com.hubframe.api.exception.PluginBusyException;
import com.hubframe.api.exception.PluginNotFoundException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.loader.PluginManifest;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * 插件注册表
 * <p>
 * 职责：保存插件记录、校验配置、维护名称唯一性。
 * 同一插件的全部变更（包括按清单更新与删除）都在 {@link ConcurrentHashMap#compute} 内基于最新记录完成，
 * 读取方只会看到完整快照。名称变更另外持有注册表锁。
 */
@Slf4j
public class PluginRegistry {

    private final Map<String, PluginRecord> records = new ConcurrentHashMap<>();
    private final Map<String, String> nameIndex = new ConcurrentHashMap<>();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();
    private final Object nameLock = new Object();

    private final PluginStore store;
    private final BindingRegistry bindings;
    private final Clock clock;

    public PluginRegistry(PluginStore store, BindingRegistry bindings) {
        this(store, bindings, Clock.systemUTC());
    }

    public PluginRegistry(PluginStore store, BindingRegistry bindings, Clock clock) {
        this.store = store != null ? store : new InMemoryPluginStore();
        this.bindings = bindings;
        this.clock = clock;
        restore();
    }

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }

    // ==================== 写操作 ====================

    /**
     * 注册新插件
     *
     * @return 插件ID
     * @throws DuplicateNameException 名称已被其他插件使用
     */
    public String register(PluginRecord record) {
        Objects.requireNonNull(record.getId(), "plugin id");
        PluginRecord prepared = prepare(record.toBuilder()
                .loaded(false)
                .createdAt(record.getCreatedAt() != null ? record.getCreatedAt() : clock.instant())
                .build());

        synchronized (nameLock) {
            if (records.containsKey(prepared.getId())) {
                throw new HubException("Plugin already registered: " + prepared.getId());
            }
            claimName(prepared.getName(), prepared.getId());
            records.put(prepared.getId(), prepared);
            store.save(prepared);
        }
        log.info("[{}] Registered plugin '{}' v{}", prepared.getId(), prepared.getName(), prepared.getLatestVersion());
        notifyListeners(l -> l.onRegistered(prepared));
        return prepared.getId();
    }

    /**
     * 按清单创建或更新记录
     * 保留已有记录的 enabled / loaded / config / createdAt，配置只补全新增的默认值
     */
    public PluginRecord upsertFromManifest(PluginManifest manifest) {
        String id = manifest.getId();
        RuntimeMode declaredMode = manifest.resolveRuntimeMode();
        List<RuntimeMode> supported = manifest.resolveSupportedModes();
        ConfigSchema schema = manifest.resolveConfigSchema();

        PluginRecord[] previousHolder = new PluginRecord[1];
        PluginRecord current;
        synchronized (nameLock) {
            // 在同一插件的 compute 临界区内基于最新记录合并，与 setEnabled 等并发变更不会互相覆盖
            current = records.compute(id, (key, existing) -> {
                previousHolder[0] = existing;
                PluginRecord.PluginRecordBuilder builder = existing != null
                        ? existing.toBuilder()
                        : PluginRecord.builder()
                        .id(id)
                        .enabled(manifest.isEnabled())
                        .loaded(false)
                        .createdAt(clock.instant());

                Map<String, Object> baseConfig = existing != null ? existing.getConfig() : manifest.getConfig();
                RuntimeMode mode = existing != null && existing.getRuntimeMode() != null
                        && (supported.isEmpty() || supported.contains(existing.getRuntimeMode()))
                        ? existing.getRuntimeMode()
                        : declaredMode;

                PluginRecord next = prepare(builder
                        .name(manifest.displayName())
                        .description(manifest.getDescription())
                        .publisher(manifest.getPublisher())
                        .latestVersion(manifest.getVersion())
                        .runtimeMode(mode)
                        .clearSupportedModes()
                        .supportedModes(supported)
                        .modeSwitchSupported(manifest.isModeSwitchSupported())
                        .configSchema(schema)
                        .clearDependencies()
                        .dependencies(manifest.resolveDependencies())
                        .clearConfig()
                        .config(schema.applyDefaults(baseConfig))
                        .build());

                if (existing == null || !existing.getName().equals(next.getName())) {
                    claimName(next.getName(), id);
                    if (existing != null) {
                        nameIndex.remove(existing.getName(), id);
                    }
                }
                store.save(next);
                return next;
            });
        }
        PluginRecord previous = previousHolder[0];

        if (previous == null) {
            log.info("[{}] Registered from manifest, version {}", id, current.getLatestVersion());
            notifyListeners(l -> l.onRegistered(current));
        } else {
            log.info("[{}] Updated from manifest: {} -> {}", id, previous.getLatestVersion(), current.getLatestVersion());
            notifyListeners(l -> l.onUpdated(previous, current));
        }
        return current;
    }

    public PluginRecord setEnabled(String pluginId, boolean enabled) {
        boolean[] changed = new boolean[1];
        PluginRecord current = update(pluginId, r -> {
            changed[0] = r.isEnabled() != enabled;
            return changed[0] ? r.toBuilder().enabled(enabled).build() : r;
        });
        if (changed[0]) {
            log.info("[{}] {}", pluginId, enabled ? "Enabled" : "Disabled");
            notifyListeners(l -> l.onEnabledChanged(current));
        }
        return current;
    }

    /**
     * 替换插件配置
     *
     * @throws InvalidConfigException 列出全部违规项
     */
    public PluginRecord setConfig(String pluginId, Map<String, Object> config) {
        PluginRecord current = update(pluginId, r -> {
            List<String> violations = r.getConfigSchema().validate(config);
            if (!violations.isEmpty()) {
                throw new InvalidConfigException(pluginId, violations);
            }
            return r.toBuilder().clearConfig().config(config).build();
        });
        log.info("[{}] Config updated ({} keys)", pluginId, current.getConfig().size());
        return current;
    }

    /**
     * 更新配置的运行模式，由监管器在模式切换时调用
     */
    public PluginRecord setRuntimeMode(String pluginId, RuntimeMode mode) {
        return update(pluginId, r -> {
            if (mode != null && !r.supports(mode)) {
                throw new HubException("Plugin [" + pluginId + "] does not support mode " + mode);
            }
            return r.toBuilder().runtimeMode(mode).build();
        });
    }

    /**
     * 更新实际运行状态，由监管器调用
     */
    public PluginRecord markLoaded(String pluginId, boolean loaded) {
        return update(pluginId, r -> r.isLoaded() == loaded ? r : r.toBuilder().loaded(loaded).build());
    }

    /**
     * 删除记录
     *
     * @throws PluginBusyException 插件仍在运行或仍有设备绑定
     */
    public PluginRecord remove(String pluginId) {
        PluginRecord[] removedHolder = new PluginRecord[1];
        synchronized (nameLock) {
            records.compute(pluginId, (id, record) -> {
                if (record == null) {
                    throw new PluginNotFoundException(pluginId);
                }
                if (record.isLoaded()) {
                    throw new PluginBusyException(pluginId, "still loaded");
                }
                if (bindings != null && bindings.hasBindings(pluginId)) {
                    throw new PluginBusyException(pluginId, "device bindings not released");
                }
                nameIndex.remove(record.getName(), pluginId);
                store.delete(pluginId);
                removedHolder[0] = record;
                return null;
            });
        }
        PluginRecord removed = removedHolder[0];
        log.info("[{}] Removed from registry", pluginId);
        notifyListeners(l -> l.onRemoved(removed));
        return removed;
    }

    // ==================== 读操作 ====================

    public Optional<PluginRecord> get(String pluginId) {
        return Optional.ofNullable(records.get(pluginId));
    }

    public PluginRecord require(String pluginId) {
        return get(pluginId).orElseThrow(() -> new PluginNotFoundException(pluginId));
    }

    public Optional<PluginRecord> findByName(String name) {
        String id = nameIndex.get(name);
        return id == null ? Optional.empty() : get(id);
    }

    /**
     * 按创建时间排序的快照
     */
    public List<PluginRecord> list() {
        return records.values().stream()
                .sorted(Comparator.comparing(PluginRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(PluginRecord::getId))
                .toList();
    }

    public boolean contains(String pluginId) {
        return records.containsKey(pluginId);
    }

    // ==================== 内部方法 ====================

    private PluginRecord update(String pluginId, UnaryOperator<PluginRecord> change) {
        PluginRecord updated = records.computeIfPresent(pluginId, (id, current) -> {
            PluginRecord next = change.apply(current);
            if (next != current) {
                store.save(next);
            }
            return next;
        });
        if (updated == null) {
            throw new PluginNotFoundException(pluginId);
        }
        return updated;
    }

    /**
     * 校验记录不变量并补全默认配置
     */
    private PluginRecord prepare(PluginRecord record) {
        String name = record.getName() == null || record.getName().isBlank() ? record.getId() : record.getName();
        if (record.getRuntimeMode() != null && !record.getSupportedModes().isEmpty()
                && !record.getSupportedModes().contains(record.getRuntimeMode())) {
            throw new HubException("Plugin [" + record.getId() + "] runtime mode " + record.getRuntimeMode()
                    + " is not in supported modes " + record.getSupportedModes());
        }
        Map<String, Object> config = record.getConfigSchema().applyDefaults(record.getConfig());
        List<String> violations = record.getConfigSchema().validate(config);
        if (!violations.isEmpty()) {
            throw new InvalidConfigException(record.getId(), violations);
        }
        return record.toBuilder().name(name).clearConfig().config(config).build();
    }

    private void claimName(String name, String pluginId) {
        String owner = nameIndex.putIfAbsent(name, pluginId);
        if (owner != null && !owner.equals(pluginId)) {
            throw new DuplicateNameException(name);
        }
    }

    private void restore() {
        List<PluginRecord> stored = store.loadAll();
        for (PluginRecord record : stored) {
            // 进程重启后没有任何运行句柄
            PluginRecord restored = record.isLoaded() ? record.toBuilder().loaded(false).build() : record;
            if (nameIndex.putIfAbsent(restored.getName(), restored.getId()) != null) {
                log.warn("[{}] Skipping stored record with duplicate name '{}'", restored.getId(), restored.getName());
                continue;
            }
            records.put(restored.getId(), restored);
            if (restored != record) {
                store.save(restored);
            }
        }
        if (!records.isEmpty()) {
            log.info("Restored {} plugin records", records.size());
        }
    }

    private void notifyListeners(Consumer<RegistryListener> action) {
        for (RegistryListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("Registry listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}

package com.hubframe.core.context;

import com.hubframe.api.auth.TokenService;
import com.hubframe.api.cache.KeyValueCache;
import com.hubframe.api.context.PluginContext;
import com.hubframe.api.event.EventHandler;
import com.hubframe.api.exception.HubException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.cache.NamespacedCache;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.event.TopicEventBus;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Core 层插件上下文
 * <p>
 * 记录插件建立的订阅，卸载时通过 {@link #release()} 一并回收订阅、绑定和缓存命名空间。
 * 释放后的上下文拒绝所有操作。
 */
@Slf4j
public class CorePluginContext implements PluginContext {

    private final String pluginId;
    private final RuntimeMode runtimeMode;
    private final Map<String, Object> config;
    private final TopicEventBus eventBus;
    private final BindingRegistry bindings;
    private final NamespacedCache cache;
    private final TokenService tokenService;

    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean released = new AtomicBoolean(false);

    public CorePluginContext(String pluginId,
                             RuntimeMode runtimeMode,
                             Map<String, Object> config,
                             TopicEventBus eventBus,
                             BindingRegistry bindings,
                             KeyValueCache cache,
                             TokenService tokenService) {
        this.pluginId = pluginId;
        this.runtimeMode = runtimeMode;
        this.config = config == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.eventBus = eventBus;
        this.bindings = bindings;
        this.cache = cache != null ? new NamespacedCache(cache, pluginId) : null;
        this.tokenService = tokenService;
    }

    @Override
    public String getPluginId() {
        return pluginId;
    }

    @Override
    public RuntimeMode getRuntimeMode() {
        return runtimeMode;
    }

    @Override
    public Map<String, Object> getConfig() {
        return config;
    }

    @Override
    public String subscribeEvent(String pattern, EventHandler handler) {
        checkActive();
        String id = eventBus.subscribe(pattern, handler, pluginId);
        subscriptions.add(id);
        return id;
    }

    @Override
    public void unsubscribeEvent(String subscriptionId) {
        checkActive();
        if (subscriptions.remove(subscriptionId)) {
            eventBus.unsubscribe(subscriptionId);
        }
    }

    @Override
    public void emitEvent(String topic, Map<String, Object> payload) {
        checkActive();
        eventBus.emit(topic, payload, pluginId);
    }

    @Override
    public void bindDevices(String selector) {
        checkActive();
        bindings.bind(pluginId, selector);
    }

    @Override
    public Optional<KeyValueCache> getCache() {
        return Optional.ofNullable(cache);
    }

    @Override
    public Optional<TokenService> getTokenService() {
        return Optional.ofNullable(tokenService);
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    public int getBindingCount() {
        return bindings.bindingsFor(pluginId).size();
    }

    /**
     * 回收插件持有的全部资源，可重复调用
     */
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        subscriptions.forEach(eventBus::unsubscribe);
        subscriptions.clear();
        // 兜底清理其他路径建立的订阅
        int extraSubs = eventBus.unsubscribeAll(pluginId);
        int bindingCount = bindings.unbindAll(pluginId);
        int cacheKeys = cache != null ? cache.clear() : 0;
        log.info("[{}] Context released: {} bindings, {} cache keys, {} stray subscriptions",
                pluginId, bindingCount, cacheKeys, extraSubs);
    }

    public boolean isReleased() {
        return released.get();
    }

    private void checkActive() {
        if (released.get()) {
            throw new HubException("Plugin context of [" + pluginId + "] has been released");
        }
    }
}

package com.hubframe.core.context;

import com.hubframe.api.auth.TokenService;
import com.hubframe.api.cache.KeyValueCache;
import com.hubframe.api.context.PluginContext;
import com.hubframe.api.event.EventHandler;
import com.hubframe.api.exception.PermissionDeniedException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.config.SandboxPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * 沙箱上下文
 * 在 {@link CorePluginContext} 外层执行 {@link SandboxPolicy} 的限制，越权时抛出 {@link PermissionDeniedException}
 */
@Slf4j
public class SandboxedPluginContext implements PluginContext {

    private final CorePluginContext delegate;
    private final SandboxPolicy policy;

    public SandboxedPluginContext(CorePluginContext delegate, SandboxPolicy policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override
    public String getPluginId() {
        return delegate.getPluginId();
    }

    @Override
    public RuntimeMode getRuntimeMode() {
        return delegate.getRuntimeMode();
    }

    @Override
    public Map<String, Object> getConfig() {
        return delegate.getConfig();
    }

    @Override
    public String subscribeEvent(String pattern, EventHandler handler) {
        if (delegate.getSubscriptionCount() >= policy.getMaxSubscriptions()) {
            throw denied("subscription limit " + policy.getMaxSubscriptions() + " reached");
        }
        return delegate.subscribeEvent(pattern, handler);
    }

    @Override
    public void unsubscribeEvent(String subscriptionId) {
        delegate.unsubscribeEvent(subscriptionId);
    }

    @Override
    public void emitEvent(String topic, Map<String, Object> payload) {
        if (!policy.isTopicAllowed(getPluginId(), topic)) {
            throw denied("emitting to topic '" + topic + "' is not allowed");
        }
        delegate.emitEvent(topic, payload);
    }

    @Override
    public void bindDevices(String selector) {
        if (delegate.getBindingCount() >= policy.getMaxBindings()) {
            throw denied("binding limit " + policy.getMaxBindings() + " reached");
        }
        delegate.bindDevices(selector);
    }

    @Override
    public Optional<KeyValueCache> getCache() {
        return delegate.getCache();
    }

    @Override
    public Optional<TokenService> getTokenService() {
        if (!policy.isTokenServiceAllowed()) {
            throw denied("token service is not available in the sandbox");
        }
        return delegate.getTokenService();
    }

    private PermissionDeniedException denied(String reason) {
        log.warn("[{}] Sandbox violation: {}", getPluginId(), reason);
        return new PermissionDeniedException("Plugin [" + getPluginId() + "] " + reason);
    }
}

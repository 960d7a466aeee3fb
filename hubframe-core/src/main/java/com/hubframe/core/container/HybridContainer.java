package com.hubframe.core.container;

import com.hubframe.api.context.PluginContext;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.rpc.RpcRequest;
import com.hubframe.core.rpc.RpcResponse;
import com.hubframe.core.spi.InboundRpcHandler;
import com.hubframe.core.spi.PluginContainer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * 混合容器
 * 本地 shim 处理 {@code localActions} 中的动作，其余动作转发给微服务实例
 */
@Slf4j
public class HybridContainer implements PluginContainer, InboundRpcHandler {

    private final String pluginId;
    private final InProcessContainer local;
    private final MicroserviceContainer remote;
    private final Set<String> localActions;

    /**
     * @param local 本地 shim，没有本地动作时可为空
     */
    public HybridContainer(String pluginId, InProcessContainer local, MicroserviceContainer remote,
                           Set<String> localActions) {
        this.pluginId = pluginId;
        this.local = local;
        this.remote = remote;
        this.localActions = Set.copyOf(localActions);
    }

    @Override
    public RuntimeMode mode() {
        return RuntimeMode.HYBRID;
    }

    @Override
    public void start(PluginContext context, Duration deadline) throws Exception {
        long startedAt = System.nanoTime();
        remote.start(context, deadline);
        if (local == null) {
            return;
        }
        Duration remaining = deadline.minusNanos(System.nanoTime() - startedAt);
        try {
            local.start(context, remaining.isNegative() ? Duration.ZERO : remaining);
        } catch (RuntimeException e) {
            log.warn("[{}] Local shim failed to start, stopping remote part", pluginId);
            remote.stop(deadline);
            throw e;
        }
    }

    @Override
    public void stop(Duration deadline) {
        if (local != null) {
            local.stop(deadline);
        }
        remote.stop(deadline);
    }

    @Override
    public boolean isActive() {
        return remote.isActive() && (local == null || local.isActive());
    }

    @Override
    public boolean checkHealth() {
        return remote.checkHealth() && (local == null || local.checkHealth());
    }

    @Override
    public Object invoke(String action, Map<String, Object> params) {
        if (local != null && localActions.contains(action)) {
            return local.invoke(action, params);
        }
        return remote.invoke(action, params);
    }

    @Override
    public RpcResponse handleInbound(RpcRequest request) {
        return remote.handleInbound(request);
    }

    public Set<String> getLocalActions() {
        return localActions;
    }
}

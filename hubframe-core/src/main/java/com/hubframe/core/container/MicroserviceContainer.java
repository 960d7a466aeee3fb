package com.hubframe.core.container;

import com.hubframe.api.context.PluginContext;
import com.hubframe.api.exception.PluginLoadException;
import com.hubframe.api.exception.PluginNotLoadedException;
import com.hubframe.api.exception.RpcException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.rpc.ManagedProcess;
import com.hubframe.core.rpc.RemotePluginProxy;
import com.hubframe.core.rpc.RpcChannel;
import com.hubframe.core.rpc.RpcChannelFactory;
import com.hubframe.core.rpc.RpcRequest;
import com.hubframe.core.rpc.RpcResponse;
import com.hubframe.core.spi.InboundRpcHandler;
import com.hubframe.core.spi.PluginContainer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * 微服务容器
 * <p>
 * 按需拉起插件进程，之后只通过 RPC 通道交互。
 * 加载在期限内完成就绪握手才算成功；失败时终止已拉起的进程并确认退出。
 */
@Slf4j
public class MicroserviceContainer implements PluginContainer, InboundRpcHandler {

    private final String pluginId;
    private final MicroserviceSpec spec;
    private final RpcChannelFactory channelFactory;
    private final Duration handshakeInterval;
    private final Duration processGrace;

    private volatile ManagedProcess process;
    private volatile RpcChannel channel;
    private volatile RemotePluginProxy proxy;
    private volatile PluginContext context;
    private volatile boolean active;

    public MicroserviceContainer(String pluginId,
                                 MicroserviceSpec spec,
                                 RpcChannelFactory channelFactory,
                                 Duration handshakeInterval,
                                 Duration processGrace) {
        this.pluginId = pluginId;
        this.spec = spec;
        this.channelFactory = channelFactory;
        this.handshakeInterval = handshakeInterval;
        this.processGrace = processGrace;
    }

    @Override
    public RuntimeMode mode() {
        return RuntimeMode.MICROSERVICE;
    }

    @Override
    public void start(PluginContext context, Duration deadline) {
        long deadlineAt = System.nanoTime() + deadline.toNanos();
        try {
            if (spec.launchesProcess()) {
                process = ManagedProcess.start(pluginId, spec.command(), spec.workingDir(), spec.environment());
            }
            channel = channelFactory.open(pluginId, spec.endpoint());
            proxy = new RemotePluginProxy(pluginId, channel);

            awaitHandshake(deadlineAt, deadline);
            proxy.onLoad(context);
            if (System.nanoTime() > deadlineAt) {
                throw new PluginLoadException(pluginId, PluginLoadException.Reason.TIMEOUT,
                        "onLoad finished after the " + deadline.toMillis() + " ms deadline");
            }
            this.context = context;
            active = true;
            log.info("[{}] Microservice ready at {}", pluginId, spec.endpoint());
        } catch (PluginLoadException e) {
            teardown();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            teardown();
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED, "load interrupted", e);
        } catch (Exception e) {
            teardown();
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED,
                    String.valueOf(e.getMessage()), e);
        }
    }

    private void awaitHandshake(long deadlineAt, Duration deadline) throws InterruptedException {
        RpcException lastError = null;
        while (true) {
            ManagedProcess p = process;
            if (p != null && !p.isAlive()) {
                throw new PluginLoadException(pluginId, PluginLoadException.Reason.HANDSHAKE_FAILED,
                        "plugin process exited with code " + p.exitValue() + " before becoming ready");
            }
            try {
                if (proxy.handshake()) {
                    return;
                }
                lastError = null;
            } catch (RpcException e) {
                lastError = e;
                log.debug("[{}] Handshake not ready yet: {}", pluginId, e.getMessage());
            }
            if (System.nanoTime() + handshakeInterval.toNanos() > deadlineAt) {
                throw new PluginLoadException(pluginId, PluginLoadException.Reason.TIMEOUT,
                        "no readiness handshake within " + deadline.toMillis() + " ms", lastError);
            }
            Thread.sleep(handshakeInterval.toMillis());
        }
    }

    @Override
    public void stop(Duration deadline) {
        active = false;
        PluginContext ctx = context;
        context = null;
        RemotePluginProxy p = proxy;
        if (ctx != null && p != null) {
            try {
                p.onUnload(ctx);
            } catch (RuntimeException e) {
                log.warn("[{}] Remote onUnload failed: {}", pluginId, e.getMessage());
            }
        }
        teardown();
    }

    /**
     * 关闭通道并终止进程，返回前确认进程已退出
     */
    private void teardown() {
        RpcChannel c = channel;
        if (c != null) {
            c.close();
        }
        ManagedProcess p = process;
        if (p != null && !p.terminate(processGrace)) {
            log.error("[{}] Plugin process {} is still alive after termination", pluginId, p.pid());
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public boolean checkHealth() {
        ManagedProcess p = process;
        if (p != null && !p.isAlive()) {
            return false;
        }
        RemotePluginProxy current = proxy;
        return current != null && current.healthCheck();
    }

    @Override
    public Object invoke(String action, Map<String, Object> params) {
        RemotePluginProxy current = proxy;
        if (!active || current == null) {
            throw new PluginNotLoadedException(pluginId, "microservice inactive");
        }
        return current.invoke(action, params);
    }

    @Override
    public RpcResponse handleInbound(RpcRequest request) {
        RemotePluginProxy current = proxy;
        if (current == null) {
            return RpcResponse.failure("Plugin [" + pluginId + "] is not connected");
        }
        return current.handleInbound(request);
    }

    ManagedProcess getProcess() {
        return process;
    }
}

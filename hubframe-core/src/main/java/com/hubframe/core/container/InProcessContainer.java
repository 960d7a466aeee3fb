package com.hubframe.core.container;

import com.hubframe.api.context.PluginContext;
import com.hubframe.api.exception.PluginLoadException;
import com.hubframe.api.exception.PluginNotLoadedException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.api.plugin.HubPlugin;
import com.hubframe.core.spi.PluginContainer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * 进程内容器
 * 插件实例直接在宿主中运行，生命周期回调和动作调用都经过 {@link PluginCallExecutor}
 */
@Slf4j
public class InProcessContainer implements PluginContainer {

    private final String pluginId;
    private final HubPlugin plugin;
    private final PluginCallExecutor callExecutor;
    private final RuntimeMode mode;

    private volatile PluginContext context;
    private volatile boolean active;

    public InProcessContainer(String pluginId, HubPlugin plugin, PluginCallExecutor callExecutor) {
        this(pluginId, plugin, callExecutor, RuntimeMode.IN_PROCESS);
    }

    public InProcessContainer(String pluginId, HubPlugin plugin, PluginCallExecutor callExecutor, RuntimeMode mode) {
        this.pluginId = pluginId;
        this.plugin = plugin;
        this.callExecutor = callExecutor;
        this.mode = mode;
    }

    @Override
    public RuntimeMode mode() {
        return mode;
    }

    @Override
    public void start(PluginContext context, Duration deadline) {
        try {
            callExecutor.executeWithDeadline("onLoad", () -> {
                plugin.onLoad(context);
                return null;
            }, deadline);
        } catch (TimeoutException e) {
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.TIMEOUT,
                    "onLoad did not finish within " + deadline.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED, "load interrupted", e);
        } catch (Exception e) {
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED,
                    String.valueOf(e.getMessage()), e);
        }
        // onLoad 成功后才记录上下文，启动失败时 stop 不会回调 onUnload
        this.context = context;
        active = true;
        log.debug("[{}] {} container started", pluginId, mode);
    }

    @Override
    public void stop(Duration deadline) {
        PluginContext ctx = context;
        if (ctx == null) {
            return;
        }
        active = false;
        context = null;
        try {
            callExecutor.executeWithDeadline("onUnload", () -> {
                plugin.onUnload(ctx);
                return null;
            }, deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while unloading", pluginId);
        } catch (Exception e) {
            log.warn("[{}] onUnload failed: {}", pluginId, e.getMessage(), e);
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public boolean checkHealth() {
        return callExecutor.execute("healthCheck", plugin::healthCheck);
    }

    @Override
    public Object invoke(String action, Map<String, Object> params) {
        if (!active) {
            throw new PluginNotLoadedException(pluginId, "container inactive");
        }
        return callExecutor.execute(action, () -> plugin.invoke(action, params));
    }

    HubPlugin getPlugin() {
        return plugin;
    }
}

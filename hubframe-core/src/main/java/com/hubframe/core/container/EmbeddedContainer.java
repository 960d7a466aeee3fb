package com.hubframe.core.container;

import com.hubframe.api.context.PluginContext;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.api.plugin.HubPlugin;
import com.hubframe.core.concurrent.NamedThreadFactory;
import com.hubframe.core.config.SandboxPolicy;
import com.hubframe.core.context.CorePluginContext;
import com.hubframe.core.context.SandboxedPluginContext;
import com.hubframe.core.spi.PluginContainer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 嵌入式容器
 * <p>
 * 与进程内相同的调用契约，但运行在独立的有界线程池上，
 * 并通过 {@link SandboxedPluginContext} 限制插件能做的事。
 */
@Slf4j
public class EmbeddedContainer implements PluginContainer {

    private final String pluginId;
    @Getter
    private final SandboxPolicy policy;
    private final ThreadPoolExecutor sandboxExecutor;
    private final InProcessContainer inner;

    public EmbeddedContainer(String pluginId, HubPlugin plugin, SandboxPolicy policy) {
        this.pluginId = pluginId;
        this.policy = policy;
        int permits = Math.max(1, policy.getMaxConcurrentCalls());
        // 额外线程留给生命周期回调和健康检查
        this.sandboxExecutor = new ThreadPoolExecutor(
                permits + 1, permits + 1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(permits * 4),
                new NamedThreadFactory("hubframe-sandbox-" + pluginId),
                new ThreadPoolExecutor.AbortPolicy());
        PluginCallExecutor callExecutor = new PluginCallExecutor(
                pluginId, sandboxExecutor, permits, policy.getCallTimeoutMs(), 0);
        this.inner = new InProcessContainer(pluginId, plugin, callExecutor, RuntimeMode.EMBEDDED);
    }

    @Override
    public RuntimeMode mode() {
        return RuntimeMode.EMBEDDED;
    }

    @Override
    public void start(PluginContext context, Duration deadline) {
        if (!(context instanceof CorePluginContext core)) {
            throw new IllegalArgumentException("Embedded container requires a core plugin context");
        }
        try {
            inner.start(new SandboxedPluginContext(core, policy), deadline);
        } catch (RuntimeException e) {
            sandboxExecutor.shutdownNow();
            throw e;
        }
        log.info("[{}] Embedded sandbox started: {}", pluginId, policy);
    }

    @Override
    public void stop(Duration deadline) {
        try {
            inner.stop(deadline);
        } finally {
            sandboxExecutor.shutdownNow();
        }
    }

    @Override
    public boolean isActive() {
        return inner.isActive();
    }

    @Override
    public boolean checkHealth() {
        return inner.checkHealth();
    }

    @Override
    public Object invoke(String action, Map<String, Object> params) {
        return inner.invoke(action, params);
    }
}

package com.hubframe.core.container;

import com.hubframe.api.exception.PluginLoadException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.api.plugin.HubPlugin;
import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.rpc.RpcChannelFactory;
import com.hubframe.core.spi.ContainerFactory;
import com.hubframe.core.spi.PluginContainer;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * 默认容器工厂，按运行模式创建四种容器
 */
public class DefaultContainerFactory implements ContainerFactory {

    private final PluginCatalog catalog;
    private final RpcChannelFactory channelFactory;
    private final HubFrameConfig config;
    private final ExecutorService pluginExecutor;

    public DefaultContainerFactory(PluginCatalog catalog,
                                   RpcChannelFactory channelFactory,
                                   HubFrameConfig config,
                                   ExecutorService pluginExecutor) {
        this.catalog = catalog;
        this.channelFactory = channelFactory;
        this.config = config;
        this.pluginExecutor = pluginExecutor;
    }

    @Override
    public PluginContainer create(PluginRecord record, RuntimeMode mode) {
        String id = record.getId();
        return switch (mode) {
            case IN_PROCESS -> new InProcessContainer(id, instantiate(id), newCallExecutor(id));
            case MICROSERVICE -> newMicroservice(record);
            case HYBRID -> newHybrid(record);
            case EMBEDDED -> new EmbeddedContainer(id, instantiate(id),
                    config.getSandbox().withPluginOverrides(record.getConfig()));
        };
    }

    private PluginContainer newHybrid(PluginRecord record) {
        String id = record.getId();
        Set<String> localActions = new LinkedHashSet<>();
        if (record.getConfig().get("localActions") instanceof List<?> actions) {
            actions.forEach(a -> localActions.add(String.valueOf(a)));
        }
        InProcessContainer shim = null;
        if (catalog.contains(id)) {
            shim = new InProcessContainer(id, instantiate(id), newCallExecutor(id), RuntimeMode.HYBRID);
        } else if (!localActions.isEmpty()) {
            throw new PluginLoadException(id, PluginLoadException.Reason.START_FAILED,
                    "hybrid mode declares localActions " + localActions + " but no local shim is registered");
        }
        return new HybridContainer(id, shim, newMicroservice(record), localActions);
    }

    private MicroserviceContainer newMicroservice(PluginRecord record) {
        return new MicroserviceContainer(
                record.getId(),
                MicroserviceSpec.from(record.getId(), record.getConfig()),
                channelFactory,
                Duration.ofMillis(config.getHandshakeIntervalMs()),
                Duration.ofSeconds(config.getProcessStopGraceSeconds()));
    }

    private HubPlugin instantiate(String pluginId) {
        return catalog.create(pluginId).orElseThrow(() -> new PluginLoadException(pluginId,
                PluginLoadException.Reason.START_FAILED, "no in-process implementation registered"));
    }

    private PluginCallExecutor newCallExecutor(String pluginId) {
        return new PluginCallExecutor(pluginId, pluginExecutor,
                config.getBulkheadMaxConcurrent(),
                config.getCallTimeoutMs(),
                config.getBulkheadAcquireTimeoutMs());
    }
}

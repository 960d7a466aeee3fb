package com.hubframe.core;

import com.hubframe.api.auth.TokenService;
import com.hubframe.api.cache.KeyValueCache;
import com.hubframe.api.plugin.PluginFactory;
import com.hubframe.core.auth.HttpTokenServiceClient;
import com.hubframe.core.cache.CaffeineKeyValueCache;
import com.hubframe.core.concurrent.NamedThreadFactory;
import com.hubframe.core.concurrent.PluginLocks;
import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.container.DefaultContainerFactory;
import com.hubframe.core.container.PluginCatalog;
import com.hubframe.core.dependency.PluginDependencyResolver;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.device.DeviceCommandService;
import com.hubframe.core.device.DeviceLinkGraph;
import com.hubframe.core.device.DeviceOwnershipResolver;
import com.hubframe.core.device.DeviceRegistry;
import com.hubframe.core.event.TopicEventBus;
import com.hubframe.core.install.InstallPipeline;
import com.hubframe.core.install.InstallerBackend;
import com.hubframe.core.install.RoutingInstallerBackend;
import com.hubframe.core.loader.PluginDiscoveryService;
import com.hubframe.core.registry.InMemoryPluginStore;
import com.hubframe.core.registry.PluginRegistry;
import com.hubframe.core.registry.PluginStore;
import com.hubframe.core.registry.YamlPluginStore;
import com.hubframe.core.rpc.HttpRpcChannelFactory;
import com.hubframe.core.rpc.RpcChannelFactory;
import com.hubframe.core.spi.ContainerFactory;
import com.hubframe.core.supervisor.RuntimeSupervisor;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 插件运行时编排器
 * <p>
 * 显式的上下文对象，持有并装配全部组件，不使用全局单例。
 * 通过 {@code HubOrchestrator.builder()} 创建，{@link #start()} 启动，{@link #shutdown()} 关闭。
 * <pre>
 * try (HubOrchestrator hub = HubOrchestrator.builder()
 *         .config(config)
 *         .plugin(new LightsPluginFactory())
 *         .build()) {
 *     hub.start();
 *     hub.getSupervisor().load("lights");
 * }
 * </pre>
 */
@Slf4j
@Getter
public class HubOrchestrator implements AutoCloseable {

    private final HubFrameConfig config;
    private final PluginLocks locks;
    private final TopicEventBus eventBus;
    private final BindingRegistry bindings;
    private final PluginRegistry registry;
    private final DeviceRegistry devices;
    private final DeviceLinkGraph linkGraph;
    private final PluginCatalog catalog;
    private final KeyValueCache cache;
    private final TokenService tokenService;
    private final RuntimeSupervisor supervisor;
    private final PluginDependencyResolver dependencies;
    private final InstallPipeline installPipeline;
    private final PluginDiscoveryService discovery;
    private final DeviceOwnershipResolver ownership;
    private final DeviceCommandService commands;

    @Getter(AccessLevel.NONE)
    private final ThreadPoolExecutor pluginExecutor;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean started = new AtomicBoolean(false);
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * 除 config 外的参数均可省略，省略时使用默认实现
     *
     * @param plugins          进程内插件实现
     * @param store            注册表持久化，默认按 registryFile 选择 YAML 或内存
     * @param installer        安装后端，默认 URL / Git / 本地目录
     * @param channelFactory   微服务 RPC 通道，默认 HTTP
     * @param containerFactory 容器工厂，默认按四种运行模式创建
     * @param cache            键值缓存，默认 Caffeine
     * @param tokenService     令牌服务，默认按 tokenServiceUrl 创建 HTTP 客户端
     */
    @Builder
    private HubOrchestrator(HubFrameConfig config,
                            @Singular List<PluginFactory> plugins,
                            PluginStore store,
                            InstallerBackend installer,
                            RpcChannelFactory channelFactory,
                            ContainerFactory containerFactory,
                            KeyValueCache cache,
                            TokenService tokenService) {
        this.config = config != null ? config : HubFrameConfig.defaults();
        HubFrameConfig cfg = this.config;

        this.locks = new PluginLocks();
        this.eventBus = new TopicEventBus(cfg);
        this.bindings = new BindingRegistry();
        this.registry = new PluginRegistry(store != null ? store : defaultStore(cfg), bindings);
        this.devices = new DeviceRegistry(eventBus);
        this.linkGraph = new DeviceLinkGraph(cfg.getMaxLinkDepth());
        this.catalog = new PluginCatalog(plugins);
        this.cache = cache != null ? cache : new CaffeineKeyValueCache(cfg);
        this.tokenService = tokenService != null ? tokenService : defaultTokenService(cfg);

        int threads = Math.max(1, cfg.getPluginExecutorThreads());
        this.pluginExecutor = new ThreadPoolExecutor(threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, cfg.getPluginExecutorQueueCapacity())),
                new NamedThreadFactory("hubframe-plugin"),
                new ThreadPoolExecutor.AbortPolicy());
        this.pluginExecutor.allowCoreThreadTimeOut(true);

        ContainerFactory containers = containerFactory != null
                ? containerFactory
                : new DefaultContainerFactory(catalog,
                channelFactory != null ? channelFactory : new HttpRpcChannelFactory(Duration.ofMillis(cfg.getRpcTimeoutMs())),
                cfg, pluginExecutor);

        this.supervisor = new RuntimeSupervisor(cfg, registry, containers, eventBus, bindings, locks,
                this.cache, this.tokenService);
        this.registry.addListener(supervisor);
        this.dependencies = supervisor.getDependencyResolver();

        InstallerBackend backend = installer != null
                ? installer
                : RoutingInstallerBackend.defaults(Paths.get(cfg.getPluginHome()),
                Duration.ofSeconds(cfg.getInstallTimeoutSeconds()));
        this.installPipeline = new InstallPipeline(cfg, registry, supervisor, bindings, backend, eventBus, locks);

        this.discovery = new PluginDiscoveryService(cfg, registry);
        this.ownership = new DeviceOwnershipResolver(devices, bindings, linkGraph, registry);
        this.commands = new DeviceCommandService(devices, ownership, supervisor);
    }

    /**
     * 扫描插件目录并加载已启用的插件，重复调用无效果
     */
    public HubOrchestrator start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("HubFrame is already started.");
            return this;
        }
        long begin = System.currentTimeMillis();
        log.info("Starting HubFrame, plugin home: {}", config.getPluginHome());

        if (config.isAutoScan()) {
            discovery.scan();
        }
        if (config.isLoadEnabledOnStart()) {
            supervisor.loadEnabled();
        }
        log.info("HubFrame started in {} ms, {} plugins registered, {} in-process implementations",
                System.currentTimeMillis() - begin, registry.list().size(), catalog.pluginIds().size());
        return this;
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    /**
     * 停止安装流水线、卸载全部插件、关闭事件总线
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("HubFrame shutting down...");
        installPipeline.shutdown();
        supervisor.shutdown();
        eventBus.shutdown();
        pluginExecutor.shutdownNow();
        log.info("HubFrame stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private static PluginStore defaultStore(HubFrameConfig config) {
        String file = config.getRegistryFile();
        if (file == null || file.isBlank()) {
            return new InMemoryPluginStore();
        }
        return new YamlPluginStore(Paths.get(file));
    }

    private static TokenService defaultTokenService(HubFrameConfig config) {
        String url = config.getTokenServiceUrl();
        if (url == null || url.isBlank()) {
            return null;
        }
        return new HttpTokenServiceClient(url, Duration.ofMillis(config.getRpcTimeoutMs()));
    }
}

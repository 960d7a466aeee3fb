package com.hubframe.runtime;

import com.hubframe.api.plugin.PluginFactory;
import com.hubframe.core.HubOrchestrator;
import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.runtime.config.HubFrameConfigLoader;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HubFrame Native 启动器
 * 宿主应用通过此类一键启动编排器，进程内插件通过 {@link ServiceLoader} 发现：
 * 在插件 jar 的 {@code META-INF/services/com.hubframe.api.plugin.PluginFactory} 中登记工厂类。
 */
@Slf4j
public class NativeHubFrame {

    private static final AtomicBoolean started = new AtomicBoolean(false);
    private static HubOrchestrator GLOBAL_ORCHESTRATOR;
    private static Thread SHUTDOWN_HOOK;

    /**
     * 启动 HubFrame (按 hubframe.yml 查找顺序加载配置)
     */
    public static HubOrchestrator start() {
        return start(HubFrameConfigLoader.load());
    }

    /**
     * 启动 HubFrame (自定义配置)
     */
    public static synchronized HubOrchestrator start(HubFrameConfig config) {
        if (started.get()) {
            log.warn("HubFrame is already started.");
            return GLOBAL_ORCHESTRATOR;
        }

        long start = System.currentTimeMillis();
        log.info("Starting HubFrame Native Runtime...");

        List<PluginFactory> factories = discoverFactories(Thread.currentThread().getContextClassLoader());
        HubOrchestrator orchestrator = HubOrchestrator.builder()
                .config(config)
                .plugins(factories)
                .build();
        orchestrator.start();

        SHUTDOWN_HOOK = new Thread(() -> {
            log.info("HubFrame shutting down...");
            orchestrator.shutdown();
        }, "hubframe-shutdown");
        Runtime.getRuntime().addShutdownHook(SHUTDOWN_HOOK);

        GLOBAL_ORCHESTRATOR = orchestrator;
        started.set(true);

        log.info("HubFrame Native started in {} ms", System.currentTimeMillis() - start);
        return orchestrator;
    }

    /**
     * 获取运行中的编排器
     */
    public static HubOrchestrator getOrchestrator() {
        if (!started.get()) {
            throw new IllegalStateException("HubFrame not started");
        }
        return GLOBAL_ORCHESTRATOR;
    }

    public static boolean isStarted() {
        return started.get();
    }

    /**
     * 主动关闭并移除关闭钩子，之后可以再次 start
     */
    public static synchronized void stop() {
        if (!started.get()) {
            return;
        }
        GLOBAL_ORCHESTRATOR.shutdown();
        try {
            Runtime.getRuntime().removeShutdownHook(SHUTDOWN_HOOK);
        } catch (IllegalStateException e) {
            // JVM 正在退出
            log.debug("Shutdown hook already running");
        }
        GLOBAL_ORCHESTRATOR = null;
        SHUTDOWN_HOOK = null;
        started.set(false);
    }

    /**
     * 发现 classpath 上登记的插件工厂，单个工厂实例化失败只记录日志
     */
    static List<PluginFactory> discoverFactories(ClassLoader classLoader) {
        List<PluginFactory> factories = new ArrayList<>();
        for (ServiceLoader.Provider<PluginFactory> provider : ServiceLoader.load(PluginFactory.class, classLoader)
                .stream().toList()) {
            try {
                PluginFactory factory = provider.get();
                factories.add(factory);
                log.info("[{}] Discovered plugin factory {}", factory.pluginId(), provider.type().getName());
            } catch (ServiceConfigurationError e) {
                log.error("Failed to instantiate plugin factory {}", provider.type().getName(), e);
            }
        }
        return factories;
    }
}

package com.hubframe.starter.config;

import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.config.SandboxPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code hubframe.*} 属性，默认值与 {@link HubFrameConfig} 一致
 */
@Setter
@Getter
@ConfigurationProperties(prefix = "hubframe")
public class HubFrameProperties {

    private static final HubFrameConfig DEFAULTS = HubFrameConfig.defaults();

    /**
     * 总开关
     */
    private boolean enabled = true;

    // ================= 全局环境 =================

    private String pluginHome = DEFAULTS.getPluginHome();
    private boolean autoScan = DEFAULTS.isAutoScan();
    private boolean loadEnabledOnStart = DEFAULTS.isLoadEnabledOnStart();

    /**
     * 注册表 YAML 文件，为空时只保存在内存
     */
    private String registryFile;

    // ================= 安装 =================

    private int installWorkers = DEFAULTS.getInstallWorkers();
    private int installQueueCapacity = DEFAULTS.getInstallQueueCapacity();
    private int installTimeoutSeconds = DEFAULTS.getInstallTimeoutSeconds();

    // ================= 生命周期 =================

    private int loadTimeoutSeconds = DEFAULTS.getLoadTimeoutSeconds();
    private int unloadTimeoutSeconds = DEFAULTS.getUnloadTimeoutSeconds();
    private int healthCheckIntervalSeconds = DEFAULTS.getHealthCheckIntervalSeconds();
    private int healthFailureThreshold = DEFAULTS.getHealthFailureThreshold();
    private int handshakeIntervalMs = DEFAULTS.getHandshakeIntervalMs();
    private int processStopGraceSeconds = DEFAULTS.getProcessStopGraceSeconds();
    private int rpcTimeoutMs = DEFAULTS.getRpcTimeoutMs();

    // ================= 调用隔离 =================

    private int pluginExecutorThreads = DEFAULTS.getPluginExecutorThreads();
    private int bulkheadMaxConcurrent = DEFAULTS.getBulkheadMaxConcurrent();
    private int bulkheadAcquireTimeoutMs = DEFAULTS.getBulkheadAcquireTimeoutMs();
    private int callTimeoutMs = DEFAULTS.getCallTimeoutMs();

    // ================= 事件 / 设备 / 缓存 =================

    private int eventDebounceMs = DEFAULTS.getEventDebounceMs();
    private int eventBatchSize = DEFAULTS.getEventBatchSize();
    private int eventLogCapacity = DEFAULTS.getEventLogCapacity();
    private int maxLinkDepth = DEFAULTS.getMaxLinkDepth();
    private int cacheDefaultTtlSeconds = DEFAULTS.getCacheDefaultTtlSeconds();
    private long cacheMaximumSize = DEFAULTS.getCacheMaximumSize();

    private String tokenServiceUrl;

    private Sandbox sandbox = new Sandbox();

    @Setter
    @Getter
    public static class Sandbox {
        private int maxConcurrentCalls = SandboxPolicy.defaults().getMaxConcurrentCalls();
        private int callTimeoutMs = SandboxPolicy.defaults().getCallTimeoutMs();
        private int maxSubscriptions = SandboxPolicy.defaults().getMaxSubscriptions();
        private int maxBindings = SandboxPolicy.defaults().getMaxBindings();
        private List<String> allowedTopicPrefixes = new ArrayList<>();
        private boolean tokenServiceAllowed;
    }

    public HubFrameConfig toConfig() {
        return HubFrameConfig.builder()
                .pluginHome(pluginHome)
                .autoScan(autoScan)
                .loadEnabledOnStart(loadEnabledOnStart)
                .registryFile(registryFile)
                .installWorkers(installWorkers)
                .installQueueCapacity(installQueueCapacity)
                .installTimeoutSeconds(installTimeoutSeconds)
                .loadTimeoutSeconds(loadTimeoutSeconds)
                .unloadTimeoutSeconds(unloadTimeoutSeconds)
                .healthCheckIntervalSeconds(healthCheckIntervalSeconds)
                .healthFailureThreshold(healthFailureThreshold)
                .handshakeIntervalMs(handshakeIntervalMs)
                .processStopGraceSeconds(processStopGraceSeconds)
                .rpcTimeoutMs(rpcTimeoutMs)
                .pluginExecutorThreads(pluginExecutorThreads)
                .bulkheadMaxConcurrent(bulkheadMaxConcurrent)
                .bulkheadAcquireTimeoutMs(bulkheadAcquireTimeoutMs)
                .callTimeoutMs(callTimeoutMs)
                .eventDebounceMs(eventDebounceMs)
                .eventBatchSize(eventBatchSize)
                .eventLogCapacity(eventLogCapacity)
                .maxLinkDepth(maxLinkDepth)
                .cacheDefaultTtlSeconds(cacheDefaultTtlSeconds)
                .cacheMaximumSize(cacheMaximumSize)
                .tokenServiceUrl(tokenServiceUrl)
                .sandbox(SandboxPolicy.builder()
                        .maxConcurrentCalls(sandbox.getMaxConcurrentCalls())
                        .callTimeoutMs(sandbox.getCallTimeoutMs())
                        .maxSubscriptions(sandbox.getMaxSubscriptions())
                        .maxBindings(sandbox.getMaxBindings())
                        .allowedTopicPrefixes(new ArrayList<>(sandbox.getAllowedTopicPrefixes()))
                        .tokenServiceAllowed(sandbox.isTokenServiceAllowed())
                        .build())
                .build();
    }
}

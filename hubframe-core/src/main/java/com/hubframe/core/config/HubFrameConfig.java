package com.hubframe.core.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * HubFrame Core 全局配置对象
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽原生 YAML 启动和 Spring Boot 属性绑定的差异。
 * 各项默认值即系统常量，时间单位在字段名中标明。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class HubFrameConfig {

    // ================= 全局环境 =================

    /**
     * 插件存放根目录（安装目标、发现扫描目录）
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 启动时是否扫描 pluginHome 下的 plugin.yml 并注册
     */
    @Builder.Default
    private boolean autoScan = true;

    /**
     * 启动时是否加载所有已启用的插件
     */
    @Builder.Default
    private boolean loadEnabledOnStart = true;

    /**
     * 注册表持久化文件；为空则只保存在内存
     */
    private String registryFile;

    // ================= 安装流水线 =================

    @Builder.Default
    private int installWorkers = 2;

    @Builder.Default
    private int installQueueCapacity = 64;

    /**
     * 非终态任务的最长存活时间，超时由看门狗强制失败
     */
    @Builder.Default
    private int installTimeoutSeconds = 300;

    @Builder.Default
    private int installWatchdogIntervalMs = 1000;

    // ================= 运行时监管 =================

    @Builder.Default
    private int loadTimeoutSeconds = 60;

    @Builder.Default
    private int unloadTimeoutSeconds = 10;

    @Builder.Default
    private int healthCheckIntervalSeconds = 30;

    /**
     * 连续失败多少次判定为 ERRORED
     */
    @Builder.Default
    private int healthFailureThreshold = 3;

    /**
     * 微服务就绪握手的轮询间隔
     */
    @Builder.Default
    private int handshakeIntervalMs = 500;

    /**
     * 终止插件进程时 SIGTERM 到 SIGKILL 的等待时间
     */
    @Builder.Default
    private int processStopGraceSeconds = 5;

    @Builder.Default
    private int rpcTimeoutMs = 10_000;

    @Builder.Default
    private int pluginExecutorThreads = Math.max(4, Runtime.getRuntime().availableProcessors());

    @Builder.Default
    private int pluginExecutorQueueCapacity = 1000;

    /**
     * 单个插件的并发调用上限（舱壁）
     */
    @Builder.Default
    private int bulkheadMaxConcurrent = 10;

    @Builder.Default
    private int bulkheadAcquireTimeoutMs = 3000;

    @Builder.Default
    private int callTimeoutMs = 30_000;

    // ================= 事件总线 =================

    @Builder.Default
    private int eventDebounceMs = 100;

    @Builder.Default
    private int eventBatchSize = 10;

    @Builder.Default
    private int eventLogCapacity = 1000;

    /**
     * 每个订阅者邮箱容量，满时丢弃最旧事件
     */
    @Builder.Default
    private int mailboxCapacity = 1000;

    @Builder.Default
    private int eventDeliveryThreads = 4;

    // ================= 设备关联 =================

    @Builder.Default
    private int maxLinkDepth = 5;

    // ================= 协作者 =================

    @Builder.Default
    private int cacheDefaultTtlSeconds = 300;

    @Builder.Default
    private long cacheMaximumSize = 10_000;

    /**
     * 令牌服务地址；为空则不提供令牌服务
     */
    private String tokenServiceUrl;

    // ================= 沙箱 =================

    /**
     * 嵌入模式插件的默认沙箱策略
     */
    @Builder.Default
    private SandboxPolicy sandbox = SandboxPolicy.defaults();

    public static HubFrameConfig defaults() {
        return HubFrameConfig.builder().build();
    }
}

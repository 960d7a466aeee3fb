package com.hubframe.core.event;

/**
 * 宿主发布的系统主题
 */
public final class SystemTopics {

    public static final String SOURCE = "system";

    public static final String PLUGIN_LOADED = "plugin.lifecycle.loaded";
    public static final String PLUGIN_UNLOADED = "plugin.lifecycle.unloaded";
    public static final String PLUGIN_LOAD_FAILED = "plugin.lifecycle.failed";
    public static final String PLUGIN_MODE_SWITCHED = "plugin.lifecycle.switched";
    public static final String PLUGIN_HEALTH_FAILED = "plugin.health.failed";

    public static final String PLUGIN_REGISTERED = "plugin.registry.registered";
    public static final String PLUGIN_REMOVED = "plugin.registry.removed";

    /**
     * 设备更新主题的订阅模式
     */
    public static final String DEVICE_UPDATED_PATTERN = "device.*.updated";

    private static final String JOB_PREFIX = "plugin.job.";

    private SystemTopics() {
    }

    /**
     * 安装任务状态主题，如 {@code plugin.job.running}
     */
    public static String jobStatus(String status) {
        return JOB_PREFIX + status;
    }

    /**
     * 设备更新主题，设备ID中的点替换为下划线以保持单段
     */
    public static String deviceUpdated(String deviceId) {
        return "device." + deviceId.replace('.', '_') + ".updated";
    }
}

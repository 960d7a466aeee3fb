package com.hubframe.api.exception;

import lombok.Getter;

/**
 * 插件加载失败
 */
@Getter
public class PluginLoadException extends HubException {

    public enum Reason {
        /**
         * 超过加载期限
         */
        TIMEOUT,
        /**
         * 微服务就绪握手失败
         */
        HANDSHAKE_FAILED,
        /**
         * 容器或插件 onLoad 抛出异常
         */
        START_FAILED
    }

    private final String pluginId;
    private final Reason reason;

    public PluginLoadException(String pluginId, Reason reason, String message) {
        super("Plugin [" + pluginId + "] load failed (" + reason + "): " + message);
        this.pluginId = pluginId;
        this.reason = reason;
    }

    public PluginLoadException(String pluginId, Reason reason, String message, Throwable cause) {
        super("Plugin [" + pluginId + "] load failed (" + reason + "): " + message, cause);
        this.pluginId = pluginId;
        this.reason = reason;
    }
}

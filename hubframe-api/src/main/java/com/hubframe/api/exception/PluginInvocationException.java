package com.hubframe.api.exception;

import lombok.Getter;

/**
 * 插件动作执行失败
 * {@code timeout} 为 true 表示调用超时被取消，{@code rejected} 为 true 表示舱壁已满。
 */
@Getter
public class PluginInvocationException extends HubException {

    private final String pluginId;
    private final String action;
    private final boolean timeout;
    private final boolean rejected;

    public PluginInvocationException(String pluginId, String action, String message,
                                     boolean timeout, boolean rejected, Throwable cause) {
        super("Plugin [" + pluginId + "] action '" + action + "' failed: " + message, cause);
        this.pluginId = pluginId;
        this.action = action;
        this.timeout = timeout;
        this.rejected = rejected;
    }
}

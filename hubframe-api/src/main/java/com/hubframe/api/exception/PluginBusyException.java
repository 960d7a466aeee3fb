package com.hubframe.api.exception;

import lombok.Getter;

/**
 * 插件正在使用中（已加载、仍有绑定或正在迁移状态）
 */
@Getter
public class PluginBusyException extends HubException {

    private final String pluginId;

    public PluginBusyException(String pluginId, String detail) {
        super("Plugin [" + pluginId + "] is busy: " + detail);
        this.pluginId = pluginId;
    }
}

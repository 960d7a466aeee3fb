package com.hubframe.api.exception;

import com.hubframe.api.model.RuntimeMode;
import lombok.Getter;

/**
 * 目标运行模式不被插件支持，或插件不允许切换模式
 */
@Getter
public class UnsupportedModeException extends HubException {

    private final String pluginId;
    private final RuntimeMode requestedMode;

    public UnsupportedModeException(String pluginId, RuntimeMode requestedMode, String detail) {
        super("Plugin [" + pluginId + "] cannot run in mode " + requestedMode + ": " + detail);
        this.pluginId = pluginId;
        this.requestedMode = requestedMode;
    }
}

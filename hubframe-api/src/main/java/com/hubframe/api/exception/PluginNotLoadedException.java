package com.hubframe.api.exception;

import lombok.Getter;

@Getter
public class PluginNotLoadedException extends HubException {

    private final String pluginId;

    public PluginNotLoadedException(String pluginId, String state) {
        super("Plugin [" + pluginId + "] is not loaded (state=" + state + ")");
        this.pluginId = pluginId;
    }
}

package com.hubframe.api.exception;

import lombok.Getter;

@Getter
public class PluginDisabledException extends HubException {

    private final String pluginId;

    public PluginDisabledException(String pluginId) {
        super("Plugin [" + pluginId + "] is disabled");
        this.pluginId = pluginId;
    }
}

package com.hubframe.api.exception;

import lombok.Getter;

@Getter
public class PluginNotFoundException extends HubException {

    private final String pluginId;

    public PluginNotFoundException(String pluginId) {
        super("Plugin not found: " + pluginId);
        this.pluginId = pluginId;
    }
}

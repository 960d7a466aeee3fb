package com.hubframe.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 插件配置不符合声明的 schema
 */
@Getter
public class InvalidConfigException extends HubException {

    private final String pluginId;
    private final List<String> violations;

    public InvalidConfigException(String pluginId, List<String> violations) {
        super("Invalid config for plugin [" + pluginId + "]: " + String.join("; ", violations));
        this.pluginId = pluginId;
        this.violations = List.copyOf(violations);
    }
}

package com.hubframe.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 插件依赖未满足或与已加载插件冲突，插件不能加载
 */
@Getter
public class DependencyException extends HubException {

    private final String pluginId;
    private final List<String> problems;

    public DependencyException(String pluginId, List<String> problems) {
        super("Dependencies of plugin [" + pluginId + "] not satisfied: " + String.join("; ", problems));
        this.pluginId = pluginId;
        this.problems = List.copyOf(problems);
    }
}

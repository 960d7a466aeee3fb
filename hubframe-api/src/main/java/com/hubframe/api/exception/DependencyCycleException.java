package com.hubframe.api.exception;

import lombok.Getter;

import java.util.List;

/**
 * 插件依赖存在环，无法确定加载顺序
 */
@Getter
public class DependencyCycleException extends HubException {

    /**
     * 环上的插件，首尾相同
     */
    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Plugin dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}

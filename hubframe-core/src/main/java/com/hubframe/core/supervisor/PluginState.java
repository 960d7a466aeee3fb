package com.hubframe.core.supervisor;

/**
 * 插件运行状态
 */
public enum PluginState {
    UNLOADED,
    LOADING,
    LOADED,
    UNLOADING,
    /**
     * 加载失败、回滚失败或健康检查连续失败
     */
    ERRORED;

    public boolean isRunning() {
        return this == LOADING || this == LOADED;
    }
}

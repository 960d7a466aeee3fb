package com.hubframe.core.supervisor;

import com.hubframe.api.model.RuntimeMode;
import lombok.NonNull;

/**
 * 插件运行状态快照
 */
public record PluginStatus(
        @NonNull String pluginId,
        @NonNull PluginState state,
        RuntimeMode mode,
        int healthFailures,
        String lastError
) {
    @Override
    public String toString() {
        return String.format("Plugin[%s] %s mode=%s healthFailures=%d%s",
                pluginId, state, mode, healthFailures, lastError == null ? "" : " error=" + lastError);
    }
}

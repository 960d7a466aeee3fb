package com.hubframe.api.exception;

import com.hubframe.api.model.RuntimeMode;
import lombok.Getter;

/**
 * 模式切换失败
 * <p>
 * {@code rolledBack} 为 true 表示插件已在原模式下重新加载。
 */
@Getter
public class SwitchFailedException extends HubException {

    private final String pluginId;
    private final RuntimeMode fromMode;
    private final RuntimeMode toMode;
    private final boolean rolledBack;

    public SwitchFailedException(String pluginId, RuntimeMode fromMode, RuntimeMode toMode,
                                 boolean rolledBack, Throwable cause) {
        super("Plugin [" + pluginId + "] failed to switch " + fromMode + " -> " + toMode
                + (rolledBack ? " (rolled back)" : " (rollback failed)"), cause);
        this.pluginId = pluginId;
        this.fromMode = fromMode;
        this.toMode = toMode;
        this.rolledBack = rolledBack;
    }
}

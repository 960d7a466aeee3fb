package com.hubframe.api.exception;

import lombok.Getter;

/**
 * 同一插件已存在未结束的安装任务
 */
@Getter
public class ConflictingJobException extends HubException {

    private final String pluginId;
    private final String activeJobId;

    public ConflictingJobException(String pluginId, String activeJobId) {
        super("Plugin [" + pluginId + "] already has a non-terminal job: " + activeJobId);
        this.pluginId = pluginId;
        this.activeJobId = activeJobId;
    }
}

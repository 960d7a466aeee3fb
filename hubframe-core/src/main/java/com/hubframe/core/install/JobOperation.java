package com.hubframe.core.install;

/**
 * 安装任务类型
 */
public enum JobOperation {
    INSTALL,
    /**
     * 插件已存在时的再次安装
     */
    UPGRADE,
    UNINSTALL
}

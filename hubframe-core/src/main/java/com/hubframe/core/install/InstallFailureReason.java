package com.hubframe.core.install;

/**
 * 安装任务失败原因
 */
public enum InstallFailureReason {
    /**
     * 超过安装期限，由看门狗强制失败
     */
    TIMEOUT,
    BACKEND_ERROR,
    INTEGRITY_MISMATCH,
    /**
     * 清单与任务不符，或注册表拒绝提交
     */
    REGISTRY_REJECTED,
    CANCELLED
}

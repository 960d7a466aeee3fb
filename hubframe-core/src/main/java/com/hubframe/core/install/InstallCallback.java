package com.hubframe.core.install;

/**
 * 后端向任务回报进度
 */
public interface InstallCallback {

    /**
     * 后端已接手任务，状态进入 running
     */
    void acknowledge();

    void log(String line);
}

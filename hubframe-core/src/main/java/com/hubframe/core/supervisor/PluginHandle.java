package com.hubframe.core.supervisor;

import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.context.CorePluginContext;
import com.hubframe.core.spi.PluginContainer;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个插件的运行句柄
 * <p>
 * 所有字段只在 {@link #getStateLock()} 内读写。
 * {@code attempt} 每次加载或卸载递增，迟到的加载回调据此判断自己是否已过期。
 */
@Getter
class PluginHandle {

    private final String pluginId;
    private final ReentrantLock stateLock = new ReentrantLock();

    private PluginState state = PluginState.UNLOADED;
    private RuntimeMode mode;
    private PluginContainer container;
    private CorePluginContext context;
    private CompletableFuture<Void> loadFuture;
    private Future<?> startTask;
    private Future<?> loadWatchdog;
    private Future<?> healthTask;
    private long attempt;
    private int healthFailures;
    private String lastError;

    PluginHandle(String pluginId) {
        this.pluginId = pluginId;
    }

    long beginLoading(RuntimeMode mode, PluginContainer container, CorePluginContext context,
                      CompletableFuture<Void> future) {
        this.state = PluginState.LOADING;
        this.mode = mode;
        this.container = container;
        this.context = context;
        this.loadFuture = future;
        this.healthFailures = 0;
        this.lastError = null;
        return ++attempt;
    }

    void attachStartTask(Future<?> startTask, Future<?> loadWatchdog) {
        this.startTask = startTask;
        this.loadWatchdog = loadWatchdog;
    }

    void markLoaded() {
        this.state = PluginState.LOADED;
        cancelLoadTasks(false);
    }

    void markErrored(String error) {
        this.state = PluginState.ERRORED;
        this.lastError = error;
        cancelLoadTasks(false);
        cancelHealth();
    }

    void markUnloading() {
        this.state = PluginState.UNLOADING;
        this.attempt++;
        cancelLoadTasks(true);
        cancelHealth();
    }

    void markUnloaded() {
        this.state = PluginState.UNLOADED;
        this.healthFailures = 0;
    }

    /**
     * 取走容器和上下文，之后由调用方负责停止与释放
     */
    void detach() {
        this.container = null;
        this.context = null;
        this.loadFuture = null;
    }

    void scheduleHealth(Future<?> healthTask) {
        cancelHealth();
        this.healthTask = healthTask;
    }

    int recordHealthFailure() {
        return ++healthFailures;
    }

    void resetHealthFailures() {
        healthFailures = 0;
    }

    boolean isCurrent(long expectedAttempt, PluginState expectedState) {
        return attempt == expectedAttempt && state == expectedState;
    }

    private void cancelLoadTasks(boolean interrupt) {
        if (startTask != null) {
            startTask.cancel(interrupt);
            startTask = null;
        }
        if (loadWatchdog != null) {
            loadWatchdog.cancel(false);
            loadWatchdog = null;
        }
    }

    private void cancelHealth() {
        if (healthTask != null) {
            healthTask.cancel(false);
            healthTask = null;
        }
    }
}

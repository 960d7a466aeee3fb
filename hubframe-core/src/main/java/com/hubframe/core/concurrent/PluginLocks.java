package com.hubframe.core.concurrent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按插件ID划分的操作锁
 * <p>
 * 同一插件的注册表提交、安装任务提交和监管操作（加载、卸载、切换）互斥，
 * 不同插件之间并行。锁可重入，持锁线程可以嵌套调用其他组件。
 */
public class PluginLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String pluginId) {
        return locks.computeIfAbsent(pluginId, k -> new ReentrantLock());
    }

    public <T> T withLock(String pluginId, Supplier<T> action) {
        ReentrantLock lock = lockFor(pluginId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String pluginId, Runnable action) {
        ReentrantLock lock = lockFor(pluginId);
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 插件删除后丢弃其锁；仍被其他线程持有或等待时保留
     */
    public void release(String pluginId) {
        locks.computeIfPresent(pluginId, (id, lock) ->
                (!lock.isLocked() || lock.isHeldByCurrentThread()) && !lock.hasQueuedThreads() ? null : lock);
    }

    int size() {
        return locks.size();
    }

    public boolean isHeldByCurrentThread(String pluginId) {
        ReentrantLock lock = locks.get(pluginId);
        return lock != null && lock.isHeldByCurrentThread();
    }
}

package com.hubframe.core.container;

import com.hubframe.api.exception.PluginInvocationException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 插件调用执行器
 * 职责：线程隔离、超时控制、舱壁隔离
 */
@Slf4j
public class PluginCallExecutor {

    private final String pluginId;
    private final ExecutorService executor;
    private final Semaphore bulkhead;
    private final int timeoutMs;
    private final int acquireTimeoutMs;

    public PluginCallExecutor(String pluginId,
                              ExecutorService executor,
                              int bulkheadPermits,
                              int timeoutMs,
                              int acquireTimeoutMs) {
        this.pluginId = pluginId;
        this.executor = executor;
        this.bulkhead = new Semaphore(bulkheadPermits);
        this.timeoutMs = timeoutMs;
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    /**
     * 在舱壁内执行动作
     *
     * @throws PluginInvocationException 舱壁已满、超时或动作本身失败
     */
    public <T> T execute(String action, Callable<T> task) {
        try {
            if (!bulkhead.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new PluginInvocationException(pluginId, action, "bulkhead full", false, true, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginInvocationException(pluginId, action, "interrupted", false, false, e);
        }

        try {
            return submitAndWait(action, task, Duration.ofMillis(timeoutMs));
        } finally {
            bulkhead.release();
        }
    }

    /**
     * 不占用舱壁，按给定期限执行（用于加载、卸载、健康检查）
     */
    public <T> T executeWithDeadline(String action, Callable<T> task, Duration deadline) throws Exception {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new PluginInvocationException(pluginId, action, "executor saturated", false, true, e);
        }
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("[{}] {} timed out after {} ms", pluginId, action, deadline.toMillis());
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw new PluginInvocationException(pluginId, action, "execution failed", false, false, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private <T> T submitAndWait(String action, Callable<T> task, Duration timeout) {
        try {
            return executeWithDeadline(action, task, timeout);
        } catch (PluginInvocationException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new PluginInvocationException(pluginId, action, "timeout after " + timeout.toMillis() + " ms",
                    true, false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginInvocationException(pluginId, action, "interrupted", false, false, e);
        } catch (Exception e) {
            throw new PluginInvocationException(pluginId, action, String.valueOf(e.getMessage()), false, false, e);
        }
    }

    public int getAvailablePermits() {
        return bulkhead.availablePermits();
    }

    public ExecutorStats getStats() {
        return new ExecutorStats(bulkhead.availablePermits(), bulkhead.getQueueLength(), timeoutMs, acquireTimeoutMs);
    }

    /**
     * 执行器统计信息
     */
    public record ExecutorStats(
            int availablePermits,
            int queueLength,
            int timeoutMs,
            int acquireTimeoutMs) {
        @Override
        @NonNull
        public String toString() {
            return String.format(
                    "ExecutorStats{available=%d, queued=%d, timeout=%dms}",
                    availablePermits, queueLength, timeoutMs);
        }
    }
}

package com.hubframe.core.supervisor;

import com.hubframe.api.auth.TokenService;
import com.hubframe.api.cache.KeyValueCache;
import com.hubframe.api.exception.DependencyCycleException;
import com.hubframe.api.exception.DependencyException;
import com.hubframe.api.exception.HubException;
import com.hubframe.api.exception.PluginBusyException;
import com.hubframe.api.exception.PluginDisabledException;
import com.hubframe.api.exception.PluginInvocationException;
import com.hubframe.api.exception.PluginLoadException;
import com.hubframe.api.exception.PluginNotLoadedException;
import com.hubframe.api.exception.SwitchFailedException;
import com.hubframe.api.exception.UnsupportedModeException;
import com.hubframe.api.model.RuntimeMode;
import com.hubframe.core.concurrent.NamedThreadFactory;
import com.hubframe.core.concurrent.PluginLocks;
import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.context.CorePluginContext;
import com.hubframe.core.dependency.PluginDependencyResolver;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.event.SystemTopics;
import com.hubframe.core.event.TopicEventBus;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.registry.PluginRegistry;
import com.hubframe.core.registry.RegistryListener;
import com.hubframe.core.rpc.RpcRequest;
import com.hubframe.core.rpc.RpcResponse;
import com.hubframe.core.spi.ContainerFactory;
import com.hubframe.core.spi.InboundRpcHandler;
import com.hubframe.core.spi.PluginContainer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 运行时监管器
 * <p>
 * 职责：
 * 1. 按记录中的运行模式创建容器并在期限内加载
 * 2. 卸载时停止容器并回收订阅、绑定和缓存
 * 3. 周期性健康检查，连续失败后标记为 ERRORED
 * 4. 模式切换：先卸载再以新模式加载，失败则回滚到原模式
 * 5. 加载前检查插件依赖与冲突，批量加载时依赖优先
 * <p>
 * 同一插件的加载、卸载、切换通过 {@link PluginLocks} 串行；
 * 加载完成回调只持有句柄的状态锁，不会与这些操作互相等待。
 */
@Slf4j
public class RuntimeSupervisor implements RegistryListener, AutoCloseable {

    private final HubFrameConfig config;
    private final PluginRegistry registry;
    private final ContainerFactory containerFactory;
    private final TopicEventBus eventBus;
    private final BindingRegistry bindings;
    private final PluginLocks locks;
    private final KeyValueCache cache;
    private final TokenService tokenService;
    private final PluginDependencyResolver dependencyResolver;

    private final Map<String, PluginHandle> handles = new ConcurrentHashMap<>();
    private final ExecutorService lifecycleExecutor;
    private final ScheduledThreadPoolExecutor scheduler;

    public RuntimeSupervisor(HubFrameConfig config,
                             PluginRegistry registry,
                             ContainerFactory containerFactory,
                             TopicEventBus eventBus,
                             BindingRegistry bindings,
                             PluginLocks locks,
                             KeyValueCache cache,
                             TokenService tokenService) {
        this.config = config;
        this.registry = registry;
        this.containerFactory = containerFactory;
        this.eventBus = eventBus;
        this.bindings = bindings;
        this.locks = locks;
        this.cache = cache;
        this.tokenService = tokenService;
        this.dependencyResolver = new PluginDependencyResolver(registry);
        this.lifecycleExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("hubframe-lifecycle"));
        this.scheduler = new ScheduledThreadPoolExecutor(2, new NamedThreadFactory("hubframe-health"));
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    // ==================== 加载 ====================

    /**
     * 同步加载，等待容器启动完成
     *
     * @throws PluginDisabledException 插件已禁用
     * @throws DependencyException     必需依赖未加载、版本不匹配或与已加载插件冲突
     * @throws PluginLoadException     启动失败或超时
     */
    public void load(String pluginId) {
        CompletableFuture<Void> future = loadAsync(pluginId);
        try {
            future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED,
                    String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HubException("Interrupted while loading plugin [" + pluginId + "]", e);
        }
    }

    /**
     * 发起加载；已加载则立即完成，加载中则返回同一个 future
     */
    public CompletableFuture<Void> loadAsync(String pluginId) {
        return locks.withLock(pluginId, () -> beginLoad(pluginId));
    }

    private CompletableFuture<Void> beginLoad(String pluginId) {
        PluginRecord record = registry.require(pluginId);
        if (!record.isEnabled()) {
            throw new PluginDisabledException(pluginId);
        }
        PluginHandle handle = handles.computeIfAbsent(pluginId, PluginHandle::new);
        RuntimeMode mode = record.effectiveMode();

        ReentrantLock stateLock = handle.getStateLock();
        PluginContainer leftover = null;
        CorePluginContext leftoverContext = null;
        stateLock.lock();
        try {
            switch (handle.getState()) {
                case LOADED:
                    return CompletableFuture.completedFuture(null);
                case LOADING:
                    return handle.getLoadFuture();
                case UNLOADING:
                    throw new PluginBusyException(pluginId, "unload in progress");
                case ERRORED:
                    // 健康检查失败后容器仍在运行，重新加载前先回收
                    leftover = handle.getContainer();
                    leftoverContext = handle.getContext();
                    handle.detach();
                    break;
                default:
                    break;
            }
        } finally {
            stateLock.unlock();
        }
        if (leftover != null) {
            stopQuietly(pluginId, leftover);
        }
        if (leftoverContext != null) {
            leftoverContext.release();
        }

        List<String> problems = dependencyResolver.checkLoadable(pluginId);
        if (!problems.isEmpty()) {
            markLoadedQuietly(pluginId, false);
            log.warn("[{}] Load blocked by dependencies: {}", pluginId, problems);
            throw new DependencyException(pluginId, problems);
        }

        CorePluginContext context = new CorePluginContext(pluginId, mode, record.getConfig(),
                eventBus, bindings, cache, tokenService);
        PluginContainer container;
        try {
            container = containerFactory.create(record, mode);
        } catch (RuntimeException e) {
            PluginLoadException failure = toLoadException(pluginId, e);
            stateLock.lock();
            try {
                handle.markErrored(failure.getMessage());
                markLoadedQuietly(pluginId, false);
            } finally {
                stateLock.unlock();
            }
            context.release();
            log.error("[{}] Cannot create {} container: {}", pluginId, mode, e.getMessage());
            emitLoadFailed(pluginId, mode, failure);
            return CompletableFuture.failedFuture(failure);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        Duration deadline = Duration.ofSeconds(config.getLoadTimeoutSeconds());
        stateLock.lock();
        try {
            long attempt = handle.beginLoading(mode, container, context, future);
            log.info("[{}] Loading in {} mode (attempt {}, deadline {}s)", pluginId, mode, attempt, deadline.toSeconds());
            Future<?> startTask = lifecycleExecutor.submit(() -> runStart(handle, attempt, container, context, deadline));
            // 容器自身未遵守期限时由看门狗强制超时
            Future<?> watchdog = scheduler.schedule(() -> onLoadDeadline(handle, attempt, deadline),
                    deadline.toMillis() + 1000, TimeUnit.MILLISECONDS);
            handle.attachStartTask(startTask, watchdog);
        } finally {
            stateLock.unlock();
        }
        return future;
    }

    private void runStart(PluginHandle handle, long attempt, PluginContainer container,
                          CorePluginContext context, Duration deadline) {
        Throwable failure = null;
        try {
            container.start(context, deadline);
        } catch (Throwable t) {
            failure = t;
        }
        completeLoad(handle, attempt, container, failure);
    }

    private void onLoadDeadline(PluginHandle handle, long attempt, Duration deadline) {
        PluginContainer container;
        ReentrantLock stateLock = handle.getStateLock();
        stateLock.lock();
        try {
            if (!handle.isCurrent(attempt, PluginState.LOADING)) {
                return;
            }
            container = handle.getContainer();
            if (handle.getStartTask() != null) {
                handle.getStartTask().cancel(true);
            }
        } finally {
            stateLock.unlock();
        }
        completeLoad(handle, attempt, container, new PluginLoadException(handle.getPluginId(),
                PluginLoadException.Reason.TIMEOUT, "not ready within " + deadline.toMillis() + " ms"));
    }

    /**
     * 加载完成回调，只持有状态锁
     */
    private void completeLoad(PluginHandle handle, long attempt, PluginContainer container, Throwable failure) {
        String pluginId = handle.getPluginId();
        CompletableFuture<Void> future;
        CorePluginContext context;
        RuntimeMode mode;
        ReentrantLock stateLock = handle.getStateLock();
        stateLock.lock();
        try {
            if (!handle.isCurrent(attempt, PluginState.LOADING)) {
                future = null;
                context = null;
                mode = null;
            } else {
                future = handle.getLoadFuture();
                context = handle.getContext();
                mode = handle.getMode();
                if (failure == null) {
                    handle.markLoaded();
                    markLoadedQuietly(pluginId, true);
                    scheduleHealth(handle, attempt);
                } else {
                    handle.markErrored(String.valueOf(failure.getMessage()));
                    handle.detach();
                    markLoadedQuietly(pluginId, false);
                }
            }
        } finally {
            stateLock.unlock();
        }

        if (future == null) {
            // 已被卸载或超时接管；启动若在此之后才成功，容器需要再停一次
            if (failure == null) {
                log.info("[{}] Discarding late load completion (attempt {})", pluginId, attempt);
                stopQuietly(pluginId, container);
            }
            return;
        }

        if (failure == null) {
            log.info("[{}] Loaded in {} mode", pluginId, mode);
            eventBus.emit(SystemTopics.PLUGIN_LOADED, payload(pluginId, "mode", mode.wireName()), SystemTopics.SOURCE);
            future.complete(null);
            return;
        }

        PluginLoadException loadFailure = toLoadException(pluginId, failure);
        log.error("[{}] Load failed ({}): {}", pluginId, loadFailure.getReason(), loadFailure.getMessage());
        stopQuietly(pluginId, container);
        if (context != null) {
            context.release();
        }
        emitLoadFailed(pluginId, mode, loadFailure);
        future.completeExceptionally(loadFailure);
    }

    // ==================== 卸载 ====================

    /**
     * 卸载插件：取消进行中的加载，停止容器，回收订阅、绑定和缓存
     */
    public void unload(String pluginId) {
        locks.withLock(pluginId, () -> doUnload(pluginId));
    }

    private void doUnload(String pluginId) {
        PluginHandle handle = handles.get(pluginId);
        if (handle == null) {
            markLoadedQuietly(pluginId, false);
            return;
        }
        PluginContainer container;
        CorePluginContext context;
        CompletableFuture<Void> pendingLoad = null;
        RuntimeMode mode;
        ReentrantLock stateLock = handle.getStateLock();
        stateLock.lock();
        try {
            PluginState state = handle.getState();
            if (state == PluginState.UNLOADED) {
                return;
            }
            if (state == PluginState.LOADING) {
                pendingLoad = handle.getLoadFuture();
            }
            container = handle.getContainer();
            context = handle.getContext();
            mode = handle.getMode();
            handle.markUnloading();
            handle.detach();
        } finally {
            stateLock.unlock();
        }

        List<String> dependents = dependencyResolver.loadedDependents(pluginId);
        if (!dependents.isEmpty()) {
            log.warn("[{}] Unloading while loaded plugins depend on it: {}", pluginId, dependents);
        }
        log.info("[{}] Unloading", pluginId);
        if (pendingLoad != null) {
            pendingLoad.completeExceptionally(new PluginLoadException(pluginId,
                    PluginLoadException.Reason.START_FAILED, "cancelled by unload"));
        }
        if (container != null) {
            stopQuietly(pluginId, container);
        }
        if (context != null) {
            context.release();
        }

        stateLock.lock();
        try {
            handle.markUnloaded();
            markLoadedQuietly(pluginId, false);
        } finally {
            stateLock.unlock();
        }
        if (container != null) {
            eventBus.emit(SystemTopics.PLUGIN_UNLOADED,
                    payload(pluginId, "mode", mode == null ? null : mode.wireName()), SystemTopics.SOURCE);
        }
        log.info("[{}] Unloaded", pluginId);
    }

    public void reload(String pluginId) {
        locks.withLock(pluginId, () -> {
            doUnload(pluginId);
            load(pluginId);
        });
    }

    /**
     * 在生命周期线程上重载，供安装流水线在升级提交后调用
     */
    public CompletableFuture<Void> reloadAsync(String pluginId) {
        return CompletableFuture.runAsync(() -> reload(pluginId), lifecycleExecutor);
    }

    // ==================== 模式切换 ====================

    /**
     * 切换运行模式
     * <p>
     * 未运行的插件只更新记录；运行中的插件卸载后以新模式加载，
     * 失败则回滚到原模式并抛出 {@link SwitchFailedException}。
     *
     * @throws UnsupportedModeException 插件不支持切换或不支持目标模式，记录保持不变
     */
    public void switchMode(String pluginId, RuntimeMode target) {
        locks.withLock(pluginId, () -> doSwitch(pluginId, target));
    }

    private void doSwitch(String pluginId, RuntimeMode target) {
        PluginRecord record = registry.require(pluginId);
        if (!record.isModeSwitchSupported()) {
            throw new UnsupportedModeException(pluginId, target, "mode switching is not supported");
        }
        if (!record.supports(target)) {
            throw new UnsupportedModeException(pluginId, target, "supported modes are " + record.getSupportedModes());
        }
        RuntimeMode from = record.effectiveMode();
        if (from == target && record.getRuntimeMode() != null) {
            return;
        }

        if (!hasLiveContainer(pluginId)) {
            registry.setRuntimeMode(pluginId, target);
            log.info("[{}] Runtime mode set {} -> {} (not running)", pluginId, from, target);
            return;
        }

        log.info("[{}] Switching {} -> {}", pluginId, from, target);
        doUnload(pluginId);
        registry.setRuntimeMode(pluginId, target);
        try {
            load(pluginId);
        } catch (RuntimeException failure) {
            log.warn("[{}] Switch to {} failed, rolling back to {}: {}", pluginId, target, from, failure.getMessage());
            registry.setRuntimeMode(pluginId, from);
            try {
                load(pluginId);
            } catch (RuntimeException rollbackFailure) {
                failure.addSuppressed(rollbackFailure);
                log.error("[{}] Rollback to {} failed: {}", pluginId, from, rollbackFailure.getMessage());
                throw new SwitchFailedException(pluginId, from, target, false, failure);
            }
            throw new SwitchFailedException(pluginId, from, target, true, failure);
        }

        Map<String, Object> payload = payload(pluginId, "from", from.wireName());
        payload.put("to", target.wireName());
        eventBus.emit(SystemTopics.PLUGIN_MODE_SWITCHED, payload, SystemTopics.SOURCE);
        log.info("[{}] Switched {} -> {}", pluginId, from, target);
    }

    // ==================== 调用 ====================

    /**
     * 在已加载的插件上执行动作
     *
     * @throws PluginNotLoadedException 插件未处于 LOADED
     */
    public Object invoke(String pluginId, String action, Map<String, Object> params) {
        PluginContainer container = loadedContainer(pluginId);
        try {
            return container.invoke(action, params);
        } catch (HubException e) {
            throw e;
        } catch (Exception e) {
            throw new PluginInvocationException(pluginId, action, String.valueOf(e.getMessage()), false, false, e);
        }
    }

    /**
     * 远端插件发回宿主的调用（emitEvent / subscribeEvent 等）
     * 加载过程中也可以调用，远端常在 onLoad 中订阅
     */
    public RpcResponse dispatchInbound(String pluginId, RpcRequest request) {
        PluginHandle handle = handles.get(pluginId);
        PluginContainer container = null;
        if (handle != null) {
            handle.getStateLock().lock();
            try {
                if (handle.getState().isRunning()) {
                    container = handle.getContainer();
                }
            } finally {
                handle.getStateLock().unlock();
            }
        }
        if (container instanceof InboundRpcHandler inbound) {
            return inbound.handleInbound(request);
        }
        return RpcResponse.failure("Plugin [" + pluginId + "] has no active remote connection");
    }

    /**
     * 加载中、已加载，或健康检查失败后容器仍在运行
     */
    private boolean hasLiveContainer(String pluginId) {
        PluginHandle handle = handles.get(pluginId);
        if (handle == null) {
            return false;
        }
        handle.getStateLock().lock();
        try {
            PluginState state = handle.getState();
            return state.isRunning() || (state == PluginState.ERRORED && handle.getContainer() != null);
        } finally {
            handle.getStateLock().unlock();
        }
    }

    private PluginContainer loadedContainer(String pluginId) {
        PluginHandle handle = handles.get(pluginId);
        if (handle == null) {
            throw new PluginNotLoadedException(pluginId, PluginState.UNLOADED.name());
        }
        handle.getStateLock().lock();
        try {
            if (handle.getState() != PluginState.LOADED || handle.getContainer() == null) {
                throw new PluginNotLoadedException(pluginId, handle.getState().name());
            }
            return handle.getContainer();
        } finally {
            handle.getStateLock().unlock();
        }
    }

    // ==================== 健康检查 ====================

    private void scheduleHealth(PluginHandle handle, long attempt) {
        long interval = config.getHealthCheckIntervalSeconds();
        if (interval <= 0) {
            return;
        }
        handle.scheduleHealth(scheduler.scheduleWithFixedDelay(
                () -> runHealthCheck(handle, attempt), interval, interval, TimeUnit.SECONDS));
    }

    /**
     * 立即执行一次健康检查
     *
     * @return 本次检查是否健康；未加载时返回 false
     */
    public boolean checkHealth(String pluginId) {
        PluginHandle handle = handles.get(pluginId);
        if (handle == null) {
            return false;
        }
        long attempt;
        handle.getStateLock().lock();
        try {
            if (handle.getState() != PluginState.LOADED) {
                return false;
            }
            attempt = handle.getAttempt();
        } finally {
            handle.getStateLock().unlock();
        }
        return runHealthCheck(handle, attempt);
    }

    private boolean runHealthCheck(PluginHandle handle, long attempt) {
        String pluginId = handle.getPluginId();
        PluginContainer container;
        RuntimeMode mode;
        ReentrantLock stateLock = handle.getStateLock();
        stateLock.lock();
        try {
            if (!handle.isCurrent(attempt, PluginState.LOADED)) {
                return false;
            }
            container = handle.getContainer();
            mode = handle.getMode();
        } finally {
            stateLock.unlock();
        }

        boolean healthy;
        try {
            healthy = container.checkHealth();
        } catch (Exception e) {
            log.debug("[{}] Health check threw: {}", pluginId, e.getMessage());
            healthy = false;
        }

        int failures;
        boolean tripped = false;
        stateLock.lock();
        try {
            if (!handle.isCurrent(attempt, PluginState.LOADED)) {
                return healthy;
            }
            if (healthy) {
                handle.resetHealthFailures();
                return true;
            }
            failures = handle.recordHealthFailure();
            if (failures >= config.getHealthFailureThreshold()) {
                handle.markErrored("health check failed " + failures + " times");
                tripped = true;
            }
        } finally {
            stateLock.unlock();
        }

        log.warn("[{}] Health check failed ({}/{})", pluginId, failures, config.getHealthFailureThreshold());
        if (tripped) {
            log.error("[{}] Marked ERRORED after {} consecutive health failures", pluginId, failures);
            Map<String, Object> payload = payload(pluginId, "failures", failures);
            payload.put("mode", mode.wireName());
            eventBus.emit(SystemTopics.PLUGIN_HEALTH_FAILED, payload, SystemTopics.SOURCE);
        }
        return false;
    }

    // ==================== 批量与查询 ====================

    /**
     * 加载所有已启用且配置了运行模式的插件，单个失败不影响其他插件
     * <p>
     * 互不依赖的插件并行加载；有依赖的插件等其依赖完成（成功或失败）后再加载，
     * 依赖成环的插件跳过。
     *
     * @return 加载成功的插件ID
     */
    public List<String> loadEnabled() {
        List<String> candidates = new ArrayList<>();
        for (PluginRecord record : registry.list()) {
            if (record.isEnabled() && record.getRuntimeMode() != null) {
                candidates.add(record.getId());
            }
        }

        Map<String, CompletableFuture<Void>> pending = new LinkedHashMap<>();
        for (String pluginId : startupOrder(candidates)) {
            CompletableFuture<?>[] prerequisites = dependencyResolver.dependenciesOf(pluginId).stream()
                    .map(pending::get)
                    .filter(Objects::nonNull)
                    .map(f -> f.exceptionally(e -> null))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture<Void> future = prerequisites.length == 0
                    ? startupLoad(pluginId)
                    : CompletableFuture.allOf(prerequisites)
                    .thenComposeAsync(v -> startupLoad(pluginId), lifecycleExecutor);
            pending.put(pluginId, future);
        }

        List<String> loaded = new ArrayList<>();
        pending.forEach((id, future) -> {
            try {
                future.join();
                loaded.add(id);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[{}] Startup load failed: {}", id, cause.getMessage());
            } catch (RuntimeException e) {
                log.error("[{}] Startup load failed: {}", id, e.getMessage());
            }
        });
        log.info("Loaded {}/{} enabled plugins", loaded.size(), candidates.size());
        return loaded;
    }

    private List<String> startupOrder(List<String> candidates) {
        List<String> remaining = new ArrayList<>(candidates);
        while (true) {
            try {
                return dependencyResolver.loadOrder(remaining);
            } catch (DependencyCycleException e) {
                log.error("Skipping plugins at startup: {}", e.getMessage());
                remaining.removeAll(e.getCycle());
            }
        }
    }

    private CompletableFuture<Void> startupLoad(String pluginId) {
        try {
            return loadAsync(pluginId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public PluginDependencyResolver getDependencyResolver() {
        return dependencyResolver;
    }

    public PluginState state(String pluginId) {
        PluginHandle handle = handles.get(pluginId);
        if (handle == null) {
            return PluginState.UNLOADED;
        }
        handle.getStateLock().lock();
        try {
            return handle.getState();
        } finally {
            handle.getStateLock().unlock();
        }
    }

    public PluginStatus status(String pluginId) {
        PluginHandle handle = handles.get(pluginId);
        if (handle == null) {
            return new PluginStatus(pluginId, PluginState.UNLOADED, null, 0, null);
        }
        handle.getStateLock().lock();
        try {
            return new PluginStatus(pluginId, handle.getState(), handle.getMode(),
                    handle.getHealthFailures(), handle.getLastError());
        } finally {
            handle.getStateLock().unlock();
        }
    }

    // ==================== 注册表回调 ====================

    @Override
    public void onRegistered(PluginRecord record) {
        eventBus.emit(SystemTopics.PLUGIN_REGISTERED,
                payload(record.getId(), "version", record.getLatestVersion()), SystemTopics.SOURCE);
    }

    @Override
    public void onEnabledChanged(PluginRecord record) {
        if (!record.isEnabled() && state(record.getId()) != PluginState.UNLOADED) {
            log.info("[{}] Disabled while running, unloading", record.getId());
            unload(record.getId());
        }
    }

    @Override
    public void onRemoved(PluginRecord record) {
        handles.remove(record.getId());
        locks.release(record.getId());
        eventBus.emit(SystemTopics.PLUGIN_REMOVED,
                payload(record.getId(), "version", record.getLatestVersion()), SystemTopics.SOURCE);
    }

    // ==================== 关闭 ====================

    public void shutdown() {
        log.info("Shutting down runtime supervisor, {} plugin handles", handles.size());
        for (String pluginId : new ArrayList<>(handles.keySet())) {
            try {
                unload(pluginId);
            } catch (RuntimeException e) {
                log.error("[{}] Unload during shutdown failed: {}", pluginId, e.getMessage(), e);
            }
        }
        scheduler.shutdownNow();
        lifecycleExecutor.shutdownNow();
    }

    @Override
    public void close() {
        shutdown();
    }

    // ==================== 内部方法 ====================

    private void stopQuietly(String pluginId, PluginContainer container) {
        if (container == null) {
            return;
        }
        try {
            container.stop(Duration.ofSeconds(config.getUnloadTimeoutSeconds()));
        } catch (RuntimeException e) {
            log.warn("[{}] Container stop failed: {}", pluginId, e.getMessage(), e);
        }
    }

    private void markLoadedQuietly(String pluginId, boolean loaded) {
        if (!registry.contains(pluginId)) {
            return;
        }
        try {
            registry.markLoaded(pluginId, loaded);
        } catch (HubException e) {
            log.warn("[{}] Cannot record loaded={}: {}", pluginId, loaded, e.getMessage());
        }
    }

    private void emitLoadFailed(String pluginId, RuntimeMode mode, PluginLoadException failure) {
        Map<String, Object> payload = payload(pluginId, "mode", mode == null ? null : mode.wireName());
        payload.put("reason", failure.getReason().name());
        payload.put("error", String.valueOf(failure.getMessage()));
        eventBus.emit(SystemTopics.PLUGIN_LOAD_FAILED, payload, SystemTopics.SOURCE);
    }

    private static PluginLoadException toLoadException(String pluginId, Throwable failure) {
        if (failure instanceof PluginLoadException ple) {
            return ple;
        }
        return new PluginLoadException(pluginId, PluginLoadException.Reason.START_FAILED,
                String.valueOf(failure.getMessage()), failure);
    }

    private static Map<String, Object> payload(String pluginId, String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pluginId", pluginId);
        payload.put(key, value);
        return payload;
    }
}

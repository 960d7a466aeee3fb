package com.hubframe.core.install;

import com.hubframe.api.exception.ConflictingJobException;
import com.hubframe.api.exception.HubException;
import com.hubframe.api.model.InstallType;
import com.hubframe.api.model.JobStatus;
import com.hubframe.core.concurrent.NamedThreadFactory;
import com.hubframe.core.concurrent.PluginLocks;
import com.hubframe.core.config.HubFrameConfig;
import com.hubframe.core.device.BindingRegistry;
import com.hubframe.core.event.SystemTopics;
import com.hubframe.core.event.TopicEventBus;
import com.hubframe.core.loader.PluginManifest;
import com.hubframe.core.registry.PluginRecord;
import com.hubframe.core.registry.PluginRegistry;
import com.hubframe.core.supervisor.RuntimeSupervisor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 安装任务流水线
 * <p>
 * 职责：
 * 1. 受理安装、升级、卸载任务，同一插件同时只允许一个未结束的任务
 * 2. 有界队列 + 固定工作线程把任务交给安装后端
 * 3. 看门狗将超过期限的任务强制置为 failed(TIMEOUT)，迟到的结果被忽略
 * 4. 成功后原子地提交到注册表，已加载的插件安排重载
 * <p>
 * 不做自动重试。
 */
@Slf4j
public class InstallPipeline implements AutoCloseable {

    private final HubFrameConfig config;
    private final PluginRegistry registry;
    private final RuntimeSupervisor supervisor;
    private final BindingRegistry bindings;
    private final InstallerBackend backend;
    private final TopicEventBus eventBus;
    private final PluginLocks locks;
    private final Clock clock;

    private final Map<String, InstallJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, InstallJob> activeJobs = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> runningTasks = new ConcurrentHashMap<>();

    private final ThreadPoolExecutor workers;
    private final ScheduledExecutorService watchdog;

    public InstallPipeline(HubFrameConfig config,
                           PluginRegistry registry,
                           RuntimeSupervisor supervisor,
                           BindingRegistry bindings,
                           InstallerBackend backend,
                           TopicEventBus eventBus,
                           PluginLocks locks) {
        this(config, registry, supervisor, bindings, backend, eventBus, locks, Clock.systemUTC());
    }

    public InstallPipeline(HubFrameConfig config,
                           PluginRegistry registry,
                           RuntimeSupervisor supervisor,
                           BindingRegistry bindings,
                           InstallerBackend backend,
                           TopicEventBus eventBus,
                           PluginLocks locks,
                           Clock clock) {
        this.config = config;
        this.registry = registry;
        this.supervisor = supervisor;
        this.bindings = bindings;
        this.backend = backend;
        this.eventBus = eventBus;
        this.locks = locks;
        this.clock = clock;

        int threads = Math.max(1, config.getInstallWorkers());
        this.workers = new ThreadPoolExecutor(threads, threads,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, config.getInstallQueueCapacity())),
                new NamedThreadFactory("hubframe-install"),
                new ThreadPoolExecutor.AbortPolicy());

        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1,
                new NamedThreadFactory("hubframe-install-watchdog"));
        long interval = Math.max(10, config.getInstallWatchdogIntervalMs());
        scheduler.scheduleWithFixedDelay(this::expireStaleJobs, interval, interval, TimeUnit.MILLISECONDS);
        this.watchdog = scheduler;
    }

    // ==================== 受理 ====================

    /**
     * 安装或升级（插件已存在时为升级）
     *
     * @param pluginRef   目标插件ID，必须与安装得到的清单一致
     * @param installType 安装来源
     * @param payload     来源参数，如 url / sha256 / git_url / path
     * @return 任务ID
     * @throws ConflictingJobException 该插件已有未结束的任务
     */
    public String enqueue(String pluginRef, InstallType installType, Map<String, Object> payload) {
        JobOperation operation = registry.contains(pluginRef) ? JobOperation.UPGRADE : JobOperation.INSTALL;
        return submit(pluginRef, operation, installType, payload);
    }

    /**
     * 卸载：停止插件、释放绑定、清理文件、删除记录
     */
    public String enqueueUninstall(String pluginId) {
        registry.require(pluginId);
        return submit(pluginId, JobOperation.UNINSTALL, null, Map.of());
    }

    private String submit(String pluginId, JobOperation operation, InstallType installType, Map<String, Object> payload) {
        InstallJob job = new InstallJob(UUID.randomUUID().toString(), pluginId, operation, installType,
                payload, clock.instant());
        locks.withLock(pluginId, () -> {
            InstallJob existing = activeJobs.get(pluginId);
            if (existing != null && !existing.isTerminal()) {
                throw new ConflictingJobException(pluginId, existing.getId());
            }
            activeJobs.put(pluginId, job);
            jobs.put(job.getId(), job);
        });
        log.info("[{}] Job {} queued: {} {}", pluginId, job.getId(), operation, installType == null ? "" : installType);
        publish(job, JobStatus.PENDING);

        try {
            Future<?> task = workers.submit(() -> run(job));
            runningTasks.put(job.getId(), task);
            if (job.isTerminal()) {
                runningTasks.remove(job.getId());
            }
        } catch (RejectedExecutionException e) {
            fail(job, InstallFailureReason.BACKEND_ERROR, "install queue is full");
            throw new HubException("Install queue is full (" + config.getInstallQueueCapacity() + ")", e);
        }
        return job.getId();
    }

    // ==================== 执行 ====================

    private void run(InstallJob job) {
        if (job.isTerminal() || !advance(job, JobStatus.SENT)) {
            return;
        }
        InstallRequest request = new InstallRequest(job.getId(), job.getPluginId(), job.getOperation(),
                job.getInstallType(), job.getPayload(), pluginHome());
        try {
            if (job.getOperation() == JobOperation.UNINSTALL) {
                advance(job, JobStatus.RUNNING);
                uninstall(job);
            } else {
                InstallResult result = backend.install(request, callbackFor(job));
                // 后端未显式确认时补上 running，保证状态序列完整
                advance(job, JobStatus.RUNNING);
                commit(job, result);
            }
        } catch (IntegrityMismatchException e) {
            fail(job, InstallFailureReason.INTEGRITY_MISMATCH, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(job, InstallFailureReason.CANCELLED, "interrupted");
        } catch (Exception e) {
            log.error("[{}] Job {} backend error: {}", job.getPluginId(), job.getId(), e.getMessage(), e);
            fail(job, InstallFailureReason.BACKEND_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private InstallCallback callbackFor(InstallJob job) {
        return new InstallCallback() {
            @Override
            public void acknowledge() {
                advance(job, JobStatus.RUNNING);
            }

            @Override
            public void log(String line) {
                job.appendLog(line);
                log.debug("[{}] {}", job.getPluginId(), line);
            }
        };
    }

    private enum Outcome {
        COMMITTED,
        REJECTED,
        /**
         * 任务已被看门狗或取消终结
         */
        STALE
    }

    /**
     * 在任务监视器和插件锁内提交；任务已终结时结果被丢弃
     */
    private void commit(InstallJob job, InstallResult result) {
        String pluginId = job.getPluginId();
        PluginManifest manifest = result.manifest();
        boolean[] reload = {false};
        Outcome outcome = locks.withLock(pluginId, () -> {
            synchronized (job) {
                if (job.isTerminal()) {
                    return Outcome.STALE;
                }
                if (!pluginId.equals(manifest.getId())) {
                    return rejectLocked(job, "manifest id '" + manifest.getId() + "' does not match '" + pluginId + "'");
                }
                boolean wasLoaded = registry.get(pluginId).map(PluginRecord::isLoaded).orElse(false);
                try {
                    registry.upsertFromManifest(manifest);
                } catch (HubException e) {
                    return rejectLocked(job, e.getMessage());
                }
                job.appendLog("registered " + pluginId + " v" + manifest.getVersion() + " from " + result.location());
                reload[0] = wasLoaded;
                return job.advance(JobStatus.SUCCESS, clock.instant()) ? Outcome.COMMITTED : Outcome.STALE;
            }
        });

        switch (outcome) {
            case STALE -> log.warn("[{}] Ignoring late result of job {} ({})", pluginId, job.getId(), job.getStatus());
            case REJECTED -> publish(job, JobStatus.FAILED);
            case COMMITTED -> {
                log.info("[{}] Job {} succeeded: v{}", pluginId, job.getId(), manifest.getVersion());
                if (reload[0]) {
                    log.info("[{}] Scheduling reload after upgrade", pluginId);
                    supervisor.reloadAsync(pluginId).whenComplete((v, e) -> {
                        if (e != null) {
                            log.error("[{}] Reload after upgrade failed: {}", pluginId, e.getMessage());
                        }
                    });
                }
                publish(job, JobStatus.SUCCESS);
            }
        }
    }

    private Outcome rejectLocked(InstallJob job, String message) {
        log.error("[{}] Job {} rejected by registry: {}", job.getPluginId(), job.getId(), message);
        job.fail(InstallFailureReason.REGISTRY_REJECTED, message, clock.instant());
        return Outcome.REJECTED;
    }

    private void uninstall(InstallJob job) throws Exception {
        String pluginId = job.getPluginId();
        supervisor.unload(pluginId);
        int released = bindings.unbindAll(pluginId);
        job.appendLog("unloaded, released " + released + " bindings");
        backend.remove(pluginId);

        Outcome outcome = locks.withLock(pluginId, () -> {
            synchronized (job) {
                if (job.isTerminal()) {
                    return Outcome.STALE;
                }
                try {
                    registry.remove(pluginId);
                } catch (HubException e) {
                    return rejectLocked(job, e.getMessage());
                }
                return job.advance(JobStatus.SUCCESS, clock.instant()) ? Outcome.COMMITTED : Outcome.STALE;
            }
        });
        switch (outcome) {
            case STALE -> log.warn("[{}] Uninstall job {} already finished ({})", pluginId, job.getId(), job.getStatus());
            case REJECTED -> publish(job, JobStatus.FAILED);
            case COMMITTED -> {
                log.info("[{}] Uninstalled by job {}", pluginId, job.getId());
                publish(job, JobStatus.SUCCESS);
            }
        }
    }

    // ==================== 看门狗与取消 ====================

    private void expireStaleJobs() {
        Instant now = clock.instant();
        Duration timeout = Duration.ofSeconds(config.getInstallTimeoutSeconds());
        for (InstallJob job : activeJobs.values()) {
            if (job.isTerminal() || Duration.between(job.getCreatedAt(), now).compareTo(timeout) <= 0) {
                continue;
            }
            if (fail(job, InstallFailureReason.TIMEOUT, "not finished within " + timeout.toSeconds() + "s")) {
                log.warn("[{}] Job {} timed out", job.getPluginId(), job.getId());
                interrupt(job);
            }
        }
    }

    /**
     * 取消未结束的任务
     *
     * @return 任务原本处于未结束状态
     */
    public boolean cancel(String jobId) {
        InstallJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        if (fail(job, InstallFailureReason.CANCELLED, "cancelled")) {
            interrupt(job);
            return true;
        }
        return false;
    }

    private void interrupt(InstallJob job) {
        Future<?> task = runningTasks.remove(job.getId());
        if (task != null) {
            task.cancel(true);
        }
    }

    // ==================== 查询 ====================

    public Optional<InstallJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * 插件的全部任务，按创建时间排序
     */
    public List<InstallJob> jobsFor(String pluginId) {
        return jobs.values().stream()
                .filter(j -> j.getPluginId().equals(pluginId))
                .sorted(Comparator.comparing(InstallJob::getCreatedAt))
                .toList();
    }

    public Optional<InstallJob> activeJob(String pluginId) {
        InstallJob job = activeJobs.get(pluginId);
        return job == null || job.isTerminal() ? Optional.empty() : Optional.of(job);
    }

    /**
     * 任务进入终态时完成
     */
    public CompletableFuture<InstallJob> awaitTerminal(String jobId) {
        InstallJob job = jobs.get(jobId);
        if (job == null) {
            return CompletableFuture.failedFuture(new HubException("Unknown install job: " + jobId));
        }
        return job.completion();
    }

    // ==================== 内部方法 ====================

    private boolean advance(InstallJob job, JobStatus next) {
        if (!job.advance(next, clock.instant())) {
            return false;
        }
        publish(job, next);
        return true;
    }

    private boolean fail(InstallJob job, InstallFailureReason reason, String message) {
        if (!job.fail(reason, message, clock.instant())) {
            return false;
        }
        publish(job, JobStatus.FAILED);
        return true;
    }

    private void publish(InstallJob job, JobStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getId());
        payload.put("pluginId", job.getPluginId());
        payload.put("operation", job.getOperation().name());
        payload.put("status", status.name().toLowerCase());
        if (status == JobStatus.FAILED) {
            payload.put("reason", String.valueOf(job.getFailureReason()));
            payload.put("error", job.getError());
        }
        eventBus.emit(SystemTopics.jobStatus(status.name().toLowerCase()), payload, SystemTopics.SOURCE);

        if (status.isTerminal()) {
            activeJobs.remove(job.getPluginId(), job);
            runningTasks.remove(job.getId());
            job.complete();
            log.info("[{}] Job {} finished: {}", job.getPluginId(), job.getId(), job);
        }
    }

    private Path pluginHome() {
        return Paths.get(config.getPluginHome());
    }

    public void shutdown() {
        watchdog.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Install workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}

package com.hubframe.core.install;

import com.hubframe.api.model.InstallType;
import com.hubframe.api.model.JobStatus;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 安装任务
 * <p>
 * 状态只能单向推进：pending → sent → running → success，任意非终态可直接 failed。
 * 所有状态变更在任务监视器内完成，非法或迟到的变更返回 false 且不产生任何效果。
 * 终态后保留用于审计，不会复用。
 */
public class InstallJob {

    @Getter
    private final String id;
    @Getter
    private final String pluginId;
    @Getter
    private final JobOperation operation;
    @Getter
    private final InstallType installType;
    @Getter
    private final Map<String, Object> payload;
    @Getter
    private final Instant createdAt;

    private JobStatus status = JobStatus.PENDING;
    private InstallFailureReason failureReason;
    private String error;
    private Instant sentAt;
    private Instant startedAt;
    private Instant finishedAt;
    private final List<JobStatus> statusHistory = new ArrayList<>(List.of(JobStatus.PENDING));
    private final List<String> log = new ArrayList<>();
    private final CompletableFuture<InstallJob> completion = new CompletableFuture<>();

    public InstallJob(String id, String pluginId, JobOperation operation, InstallType installType,
                      Map<String, Object> payload, Instant createdAt) {
        this.id = id;
        this.pluginId = pluginId;
        this.operation = operation;
        this.installType = installType;
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.createdAt = createdAt;
    }

    // ==================== 状态变更 ====================

    synchronized boolean advance(JobStatus next, Instant at) {
        if (next == JobStatus.FAILED || !status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        statusHistory.add(next);
        switch (next) {
            case SENT -> sentAt = at;
            case RUNNING -> startedAt = at;
            case SUCCESS -> finishedAt = at;
            default -> {
            }
        }
        return true;
    }

    synchronized boolean fail(InstallFailureReason reason, String message, Instant at) {
        if (!status.canTransitionTo(JobStatus.FAILED)) {
            return false;
        }
        status = JobStatus.FAILED;
        statusHistory.add(JobStatus.FAILED);
        failureReason = reason;
        error = message;
        finishedAt = at;
        log.add("failed (" + reason + "): " + message);
        return true;
    }

    synchronized void appendLog(String line) {
        log.add(line);
    }

    void complete() {
        completion.complete(this);
    }

    CompletableFuture<InstallJob> completion() {
        return completion;
    }

    // ==================== 读取 ====================

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized InstallFailureReason getFailureReason() {
        return failureReason;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized Instant getSentAt() {
        return sentAt;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized List<JobStatus> getStatusHistory() {
        return List.copyOf(statusHistory);
    }

    public synchronized List<String> getLog() {
        return List.copyOf(log);
    }

    @Override
    public synchronized String toString() {
        return String.format("InstallJob[%s] %s %s status=%s%s",
                id, operation, pluginId, status, failureReason == null ? "" : " reason=" + failureReason);
    }
}

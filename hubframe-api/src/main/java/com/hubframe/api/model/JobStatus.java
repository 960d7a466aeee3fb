package com.hubframe.api.model;

/**
 * 安装任务状态
 * <p>
 * 状态只能前进：PENDING → SENT → RUNNING → {SUCCESS, FAILED}。
 * 任何非终态都可以直接进入 FAILED（超时、取消、后端拒绝）。
 *
 * @author HubFrame
 */
public enum JobStatus {

    PENDING("pending", 0),
    SENT("sent", 1),
    RUNNING("running", 2),
    SUCCESS("success", 3),
    FAILED("failed", 3);

    private final String wireName;
    private final int rank;

    JobStatus(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * 判断从当前状态能否迁移到目标状态
     */
    public boolean canTransitionTo(JobStatus next) {
        if (isTerminal() || next == null) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.rank == rank + 1;
    }

    @Override
    public String toString() {
        return wireName;
    }
}

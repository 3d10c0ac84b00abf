package com.agentcores.domain.task.model.valobj;

import com.agentcores.domain.task.model.entity.AgentTaskEntity;

/**
 * claim 尝试结果。
 *
 * @param status 结果类型
 * @param task CLAIMED 时为已进入 RUNNING 的任务，其余为当前任务快照（NOT_FOUND 为 null）
 */
public record TaskClaimResult(ClaimStatus status, AgentTaskEntity task) {

    public static TaskClaimResult of(ClaimStatus status, AgentTaskEntity task) {
        return new TaskClaimResult(status, task);
    }

    public boolean isClaimed() {
        return status == ClaimStatus.CLAIMED;
    }
}

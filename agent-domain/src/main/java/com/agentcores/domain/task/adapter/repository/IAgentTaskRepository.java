package com.agentcores.domain.task.adapter.repository;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.TaskClaimResult;
import com.agentcores.types.enums.TaskStatusEnum;

import java.util.List;

/**
 * 任务仓储接口
 *
 * @author agentcores
 * @since 2026-03-04
 */
public interface IAgentTaskRepository {

    /**
     * 保存任务
     */
    AgentTaskEntity save(AgentTaskEntity entity);

    /**
     * 根据 ID 查询，跨租户返回 null
     */
    AgentTaskEntity findById(TenantContext context, Long id);

    /**
     * 按条件查询租户内任务，按创建时间倒序
     *
     * @param status 可空
     * @param agentId 可空
     */
    List<AgentTaskEntity> findByTenant(TenantContext context, TaskStatusEnum status, Long agentId, int limit);

    /**
     * 统计 Agent 下 PENDING / RUNNING 任务数
     */
    long countActiveByAgent(TenantContext context, Long agentId);

    /**
     * 统计 Agent 下 RUNNING 任务数
     */
    long countRunningByAgent(TenantContext context, Long agentId);

    /**
     * 原子 claim：租户配额检查与 PENDING -> RUNNING 在同一事务内完成。
     * <p>
     * 先锁租户行并统计近一小时进入 RUNNING 的任务数，未超限时执行带状态条件的更新，
     * 并发竞争同一任务时只有一方返回 CLAIMED。
     * </p>
     *
     * @param claimOwner 执行者标识
     * @param maxTasksPerHour 租户小时配额
     */
    TaskClaimResult claimWithAdmission(TenantContext context, Long taskId, String claimOwner, int maxTasksPerHour);

    /**
     * 执行器内部扫描：跨租户的可调度 PENDING 任务，按 (priority desc, created_at asc) 排序。
     * <p>
     * 只返回 active 且本小时配额未用尽的租户的任务，停用或配额耗尽的租户不占候选名额。
     * </p>
     */
    List<AgentTaskEntity> findDispatchCandidates(int limit);

    /**
     * 执行器内部扫描：租约已过期的 RUNNING 任务。
     */
    List<AgentTaskEntity> findExpiredRunning(int limit);

    /**
     * 按 claim_owner + execution_attempt 条件回写 RUNNING 任务的下一状态，防止旧执行者回写污染。
     * 目标状态不是 CANCELLED 且任务已登记取消请求时同样返回 false。
     */
    boolean updateClaimedTaskState(AgentTaskEntity entity);

    /**
     * 条件取消 PENDING 任务
     */
    boolean cancelPending(TenantContext context, Long taskId);

    /**
     * 条件登记 RUNNING 任务的取消请求
     */
    boolean requestCancel(TenantContext context, Long taskId);
}

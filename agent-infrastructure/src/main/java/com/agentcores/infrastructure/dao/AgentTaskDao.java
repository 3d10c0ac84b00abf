package com.agentcores.infrastructure.dao;

import com.agentcores.infrastructure.dao.po.AgentTaskPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务 DAO
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Mapper
public interface AgentTaskDao {

    /**
     * 插入任务
     */
    int insert(AgentTaskPO po);

    /**
     * 根据 ID + 租户查询
     */
    AgentTaskPO selectByIdAndTenant(@Param("id") Long id, @Param("tenantId") Long tenantId);

    /**
     * 条件查询，按创建时间倒序
     */
    List<AgentTaskPO> selectByTenant(@Param("tenantId") Long tenantId,
                                     @Param("status") String status,
                                     @Param("agentId") Long agentId,
                                     @Param("limit") Integer limit);

    long countByAgentAndStatuses(@Param("tenantId") Long tenantId,
                                 @Param("agentId") Long agentId,
                                 @Param("statuses") List<String> statuses);

    /**
     * 统计租户近一小时进入 RUNNING 的任务数
     */
    long countAdmissionsLastHour(@Param("tenantId") Long tenantId);

    /**
     * 记录一次进入 RUNNING
     */
    int insertAdmission(@Param("tenantId") Long tenantId, @Param("taskId") Long taskId);

    /**
     * 原子 claim 单个 PENDING 任务，返回更新后的行；不满足条件时返回 null。
     */
    AgentTaskPO claimPendingTask(@Param("id") Long id,
                                 @Param("tenantId") Long tenantId,
                                 @Param("claimOwner") String claimOwner);

    /**
     * 可调度 PENDING 任务（跨租户）
     */
    List<AgentTaskPO> selectDispatchCandidates(@Param("limit") Integer limit);

    /**
     * 租约过期的 RUNNING 任务（跨租户）
     */
    List<AgentTaskPO> selectExpiredRunning(@Param("limit") Integer limit);

    /**
     * 按 claim_owner + execution_attempt 条件更新任务状态。
     */
    int updateClaimedTaskState(AgentTaskPO po);

    int cancelPending(@Param("id") Long id, @Param("tenantId") Long tenantId);

    int requestCancel(@Param("id") Long id, @Param("tenantId") Long tenantId);
}

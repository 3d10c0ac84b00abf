package com.agentcores.infrastructure.repository.task;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.ClaimStatus;
import com.agentcores.domain.task.model.valobj.TaskClaimResult;
import com.agentcores.infrastructure.dao.AgentTaskDao;
import com.agentcores.infrastructure.dao.TenantDao;
import com.agentcores.infrastructure.dao.po.AgentTaskPO;
import com.agentcores.infrastructure.util.JsonCodec;
import com.agentcores.types.enums.TaskStatusEnum;
import com.agentcores.types.enums.TaskTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务仓储实现类。
 * <p>
 * 负责任务的持久化操作，包括：
 * <ul>
 *   <li>租户范围内的任务增查</li>
 *   <li>带配额准入的原子 claim</li>
 *   <li>带 claim_owner + execution_attempt 守卫的状态回写</li>
 *   <li>JSONB字段的序列化/反序列化</li>
 * </ul>
 * </p>
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Slf4j
@Repository
public class AgentTaskRepositoryImpl implements IAgentTaskRepository {

    private static final List<String> ACTIVE_STATUSES = List.of(
            TaskStatusEnum.PENDING.getCode(), TaskStatusEnum.RUNNING.getCode());
    private static final List<String> RUNNING_STATUSES = List.of(TaskStatusEnum.RUNNING.getCode());

    private final AgentTaskDao agentTaskDao;
    private final TenantDao tenantDao;
    private final JsonCodec jsonCodec;

    /**
     * 创建 AgentTaskRepositoryImpl。
     */
    public AgentTaskRepositoryImpl(AgentTaskDao agentTaskDao, TenantDao tenantDao, JsonCodec jsonCodec) {
        this.agentTaskDao = agentTaskDao;
        this.tenantDao = tenantDao;
        this.jsonCodec = jsonCodec;
    }

    /**
     * 保存实体。
     */
    @Override
    public AgentTaskEntity save(AgentTaskEntity entity) {
        entity.validate();
        AgentTaskPO po = toPO(entity);
        agentTaskDao.insert(po);
        return toEntity(agentTaskDao.selectByIdAndTenant(po.getId(), po.getTenantId()));
    }

    @Override
    public AgentTaskEntity findById(TenantContext context, Long id) {
        return toEntity(agentTaskDao.selectByIdAndTenant(id, context.tenantId()));
    }

    @Override
    public List<AgentTaskEntity> findByTenant(TenantContext context, TaskStatusEnum status, Long agentId, int limit) {
        return agentTaskDao.selectByTenant(context.tenantId(),
                        status == null ? null : status.getCode(),
                        agentId,
                        limit).stream()
                .map(this::toEntity)
                .toList();
    }

    @Override
    public long countActiveByAgent(TenantContext context, Long agentId) {
        return agentTaskDao.countByAgentAndStatuses(context.tenantId(), agentId, ACTIVE_STATUSES);
    }

    @Override
    public long countRunningByAgent(TenantContext context, Long agentId) {
        return agentTaskDao.countByAgentAndStatuses(context.tenantId(), agentId, RUNNING_STATUSES);
    }

    /**
     * 配额准入 + 条件 claim。
     * <p>
     * 锁住租户行串行化同租户的准入计数，随后以 status=pending 作为条件更新任务；
     * 只有条件更新命中时才写入准入记录，因此失败的 claim 不消耗配额。
     * </p>
     */
    @Override
    @Transactional(rollbackFor = Exception.class)
    public TaskClaimResult claimWithAdmission(TenantContext context,
                                              Long taskId,
                                              String claimOwner,
                                              int maxTasksPerHour) {
        AgentTaskEntity current = toEntity(agentTaskDao.selectByIdAndTenant(taskId, context.tenantId()));
        if (current == null) {
            return TaskClaimResult.of(ClaimStatus.NOT_FOUND, null);
        }
        if (current.getStatus() != TaskStatusEnum.PENDING || current.isCancelRequested()) {
            return TaskClaimResult.of(ClaimStatus.NOT_ELIGIBLE, current);
        }
        if (current.getNextRunAt() != null && current.getNextRunAt().isAfter(LocalDateTime.now())) {
            return TaskClaimResult.of(ClaimStatus.DEFERRED, current);
        }

        tenantDao.lockById(context.tenantId());
        long admitted = agentTaskDao.countAdmissionsLastHour(context.tenantId());
        if (admitted >= maxTasksPerHour) {
            log.info("TASK_QUOTA_EXCEEDED tenantId={}, taskId={}, admittedLastHour={}, limit={}",
                    context.tenantId(), taskId, admitted, maxTasksPerHour);
            return TaskClaimResult.of(ClaimStatus.QUOTA_EXCEEDED, current);
        }

        AgentTaskPO claimed = agentTaskDao.claimPendingTask(taskId, context.tenantId(), claimOwner);
        if (claimed == null) {
            return TaskClaimResult.of(ClaimStatus.NOT_ELIGIBLE,
                    toEntity(agentTaskDao.selectByIdAndTenant(taskId, context.tenantId())));
        }
        agentTaskDao.insertAdmission(context.tenantId(), taskId);
        return TaskClaimResult.of(ClaimStatus.CLAIMED, toEntity(claimed));
    }

    @Override
    public List<AgentTaskEntity> findDispatchCandidates(int limit) {
        return agentTaskDao.selectDispatchCandidates(limit).stream()
                .map(this::toEntity)
                .toList();
    }

    @Override
    public List<AgentTaskEntity> findExpiredRunning(int limit) {
        return agentTaskDao.selectExpiredRunning(limit).stream()
                .map(this::toEntity)
                .toList();
    }

    /**
     * 按 claim_owner + execution_attempt 守卫回写执行结果。
     */
    @Override
    public boolean updateClaimedTaskState(AgentTaskEntity entity) {
        int affected = agentTaskDao.updateClaimedTaskState(toPO(entity));
        if (affected == 0) {
            log.debug("TASK_WRITEBACK_REJECTED taskId={}, owner={}, attempt={}, targetStatus={}",
                    entity.getId(), entity.getClaimOwner(), entity.getExecutionAttempt(),
                    entity.getStatus() == null ? null : entity.getStatus().getCode());
        }
        return affected > 0;
    }

    @Override
    public boolean cancelPending(TenantContext context, Long taskId) {
        return agentTaskDao.cancelPending(taskId, context.tenantId()) > 0;
    }

    @Override
    public boolean requestCancel(TenantContext context, Long taskId) {
        return agentTaskDao.requestCancel(taskId, context.tenantId()) > 0;
    }

    /**
     * PO 转换为 Entity
     */
    private AgentTaskEntity toEntity(AgentTaskPO po) {
        if (po == null) {
            return null;
        }
        AgentTaskEntity entity = new AgentTaskEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setAgentId(po.getAgentId());
        entity.setTaskType(TaskTypeEnum.fromCode(po.getTaskType()));
        entity.setPriority(po.getPriority());
        entity.setStatus(TaskStatusEnum.fromCode(po.getStatus()));

        // JSONB 字段转换
        if (po.getInputData() != null) {
            entity.setInputData(jsonCodec.readMap(po.getInputData()));
        }
        if (po.getOutputData() != null) {
            entity.setOutputData(jsonCodec.readMap(po.getOutputData()));
        }

        entity.setRetryCount(po.getRetryCount());
        entity.setMaxRetries(po.getMaxRetries());
        entity.setTimeoutSeconds(po.getTimeoutSeconds());
        entity.setLastError(po.getLastError());
        entity.setNextRunAt(po.getNextRunAt());
        entity.setCancelRequested(po.getCancelRequested());
        entity.setClaimOwner(po.getClaimOwner());
        entity.setClaimAt(po.getClaimAt());
        entity.setLeaseUntil(po.getLeaseUntil());
        entity.setExecutionAttempt(po.getExecutionAttempt());
        entity.setVersion(po.getVersion());
        entity.setCreatedBy(po.getCreatedBy());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private AgentTaskPO toPO(AgentTaskEntity entity) {
        return AgentTaskPO.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .agentId(entity.getAgentId())
                .taskType(entity.getTaskType() == null ? null : entity.getTaskType().getCode())
                .priority(entity.getPriority())
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .inputData(jsonCodec.writeValue(entity.getInputData()))
                .outputData(jsonCodec.writeValue(entity.getOutputData()))
                .retryCount(entity.getRetryCount())
                .maxRetries(entity.getMaxRetries())
                .timeoutSeconds(entity.getTimeoutSeconds())
                .lastError(entity.getLastError())
                .nextRunAt(entity.getNextRunAt())
                .cancelRequested(entity.getCancelRequested())
                .claimOwner(entity.getClaimOwner())
                .claimAt(entity.getClaimAt())
                .leaseUntil(entity.getLeaseUntil())
                .executionAttempt(entity.getExecutionAttempt())
                .version(entity.getVersion())
                .createdBy(entity.getCreatedBy())
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}

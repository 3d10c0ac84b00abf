package com.agentcores.test.support;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.ClaimStatus;
import com.agentcores.domain.task.model.valobj.TaskClaimResult;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.types.enums.TaskStatusEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 内存任务仓储，按 SQL 条件更新的语义实现 claim 与回写守卫。
 * <p>
 * 读写都复制实体，调用方拿到的是快照。
 * </p>
 */
public class InMemoryAgentTaskRepository implements IAgentTaskRepository {

    private final Map<Long, AgentTaskEntity> store = new LinkedHashMap<>();
    private final Map<Long, List<LocalDateTime>> admissions = new HashMap<>();
    private final Function<Long, TenantEntity> tenantLookup;
    private long nextId = 1;

    public InMemoryAgentTaskRepository(Function<Long, TenantEntity> tenantLookup) {
        this.tenantLookup = tenantLookup;
    }

    @Override
    public synchronized AgentTaskEntity save(AgentTaskEntity entity) {
        entity.validate();
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now());
        }
        if (entity.getCancelRequested() == null) {
            entity.setCancelRequested(false);
        }
        if (entity.getExecutionAttempt() == null) {
            entity.setExecutionAttempt(0);
        }
        store.put(entity.getId(), copy(entity));
        return copy(entity);
    }

    @Override
    public synchronized AgentTaskEntity findById(TenantContext context, Long id) {
        AgentTaskEntity stored = store.get(id);
        if (stored == null || !context.ownsTenant(stored.getTenantId())) {
            return null;
        }
        return copy(stored);
    }

    @Override
    public synchronized List<AgentTaskEntity> findByTenant(TenantContext context, TaskStatusEnum status, Long agentId, int limit) {
        return store.values().stream()
                .filter(task -> context.ownsTenant(task.getTenantId()))
                .filter(task -> status == null || task.getStatus() == status)
                .filter(task -> agentId == null || agentId.equals(task.getAgentId()))
                .sorted(Comparator.comparing(AgentTaskEntity::getId).reversed())
                .limit(limit)
                .map(InMemoryAgentTaskRepository::copy)
                .toList();
    }

    @Override
    public synchronized long countActiveByAgent(TenantContext context, Long agentId) {
        return store.values().stream()
                .filter(task -> context.ownsTenant(task.getTenantId()) && agentId.equals(task.getAgentId()))
                .filter(task -> task.getStatus() == TaskStatusEnum.PENDING || task.getStatus() == TaskStatusEnum.RUNNING)
                .count();
    }

    @Override
    public synchronized long countRunningByAgent(TenantContext context, Long agentId) {
        return store.values().stream()
                .filter(task -> context.ownsTenant(task.getTenantId()) && agentId.equals(task.getAgentId()))
                .filter(task -> task.getStatus() == TaskStatusEnum.RUNNING)
                .count();
    }

    @Override
    public synchronized TaskClaimResult claimWithAdmission(TenantContext context,
                                                           Long taskId,
                                                           String claimOwner,
                                                           int maxTasksPerHour) {
        AgentTaskEntity current = store.get(taskId);
        if (current == null || !context.ownsTenant(current.getTenantId())) {
            return TaskClaimResult.of(ClaimStatus.NOT_FOUND, null);
        }
        LocalDateTime now = LocalDateTime.now();
        if (current.getStatus() != TaskStatusEnum.PENDING || current.isCancelRequested()) {
            return TaskClaimResult.of(ClaimStatus.NOT_ELIGIBLE, copy(current));
        }
        if (!current.isDispatchable(now)) {
            return TaskClaimResult.of(ClaimStatus.DEFERRED, copy(current));
        }
        List<LocalDateTime> tenantAdmissions = admissions.computeIfAbsent(current.getTenantId(), key -> new ArrayList<>());
        long admitted = tenantAdmissions.stream().filter(at -> at.isAfter(now.minusHours(1))).count();
        if (admitted >= maxTasksPerHour) {
            return TaskClaimResult.of(ClaimStatus.QUOTA_EXCEEDED, copy(current));
        }
        current.claim(claimOwner, current.nextExecutionAttempt(), now);
        current.setVersion(current.getVersion() == null ? 1 : current.getVersion() + 1);
        tenantAdmissions.add(now);
        return TaskClaimResult.of(ClaimStatus.CLAIMED, copy(current));
    }

    @Override
    public synchronized List<AgentTaskEntity> findDispatchCandidates(int limit) {
        LocalDateTime now = LocalDateTime.now();
        return store.values().stream()
                .filter(task -> task.isDispatchable(now))
                .filter(task -> hasAdmissionHeadroom(task.getTenantId(), now))
                .sorted(Comparator.comparing(AgentTaskEntity::getPriority).reversed()
                        .thenComparing(AgentTaskEntity::getId))
                .limit(limit)
                .map(InMemoryAgentTaskRepository::copy)
                .toList();
    }

    private boolean hasAdmissionHeadroom(Long tenantId, LocalDateTime now) {
        TenantEntity tenant = tenantLookup.apply(tenantId);
        if (tenant == null || !tenant.isActive()) {
            return false;
        }
        long admitted = admissions.getOrDefault(tenantId, List.of()).stream()
                .filter(at -> at.isAfter(now.minusHours(1)))
                .count();
        return admitted < tenant.hourlyTaskLimit();
    }

    @Override
    public synchronized List<AgentTaskEntity> findExpiredRunning(int limit) {
        LocalDateTime now = LocalDateTime.now();
        return store.values().stream()
                .filter(task -> task.isLeaseExpired(now))
                .limit(limit)
                .map(InMemoryAgentTaskRepository::copy)
                .toList();
    }

    @Override
    public synchronized boolean updateClaimedTaskState(AgentTaskEntity entity) {
        AgentTaskEntity stored = store.get(entity.getId());
        if (stored == null
                || !Objects.equals(stored.getTenantId(), entity.getTenantId())
                || stored.getStatus() != TaskStatusEnum.RUNNING
                || !stored.isClaimOwner(entity.getClaimOwner(), entity.getExecutionAttempt())
                || (stored.isCancelRequested() && entity.getStatus() != TaskStatusEnum.CANCELLED)) {
            return false;
        }
        stored.setStatus(entity.getStatus());
        stored.setOutputData(entity.getOutputData());
        stored.setRetryCount(entity.getRetryCount());
        stored.setLastError(entity.getLastError());
        stored.setNextRunAt(entity.getNextRunAt());
        stored.setCompletedAt(entity.getCompletedAt());
        stored.setLeaseUntil(null);
        stored.setUpdatedAt(LocalDateTime.now());
        return true;
    }

    @Override
    public synchronized boolean cancelPending(TenantContext context, Long taskId) {
        AgentTaskEntity stored = store.get(taskId);
        if (stored == null || !context.ownsTenant(stored.getTenantId()) || stored.getStatus() != TaskStatusEnum.PENDING) {
            return false;
        }
        stored.setStatus(TaskStatusEnum.CANCELLED);
        stored.setCompletedAt(LocalDateTime.now());
        return true;
    }

    @Override
    public synchronized boolean requestCancel(TenantContext context, Long taskId) {
        AgentTaskEntity stored = store.get(taskId);
        if (stored == null || !context.ownsTenant(stored.getTenantId())
                || stored.getStatus() != TaskStatusEnum.RUNNING || stored.isCancelRequested()) {
            return false;
        }
        stored.setCancelRequested(true);
        return true;
    }

    /**
     * 直接改写存储中的任务，模拟其他进程的并发修改或时间流逝。
     */
    public synchronized void mutate(Long taskId, Consumer<AgentTaskEntity> mutation) {
        mutation.accept(store.get(taskId));
    }

    public synchronized AgentTaskEntity peek(Long taskId) {
        AgentTaskEntity stored = store.get(taskId);
        return stored == null ? null : copy(stored);
    }

    private static AgentTaskEntity copy(AgentTaskEntity source) {
        AgentTaskEntity target = new AgentTaskEntity();
        target.setId(source.getId());
        target.setTenantId(source.getTenantId());
        target.setAgentId(source.getAgentId());
        target.setTaskType(source.getTaskType());
        target.setPriority(source.getPriority());
        target.setStatus(source.getStatus());
        target.setInputData(source.getInputData());
        target.setOutputData(source.getOutputData());
        target.setRetryCount(source.getRetryCount());
        target.setMaxRetries(source.getMaxRetries());
        target.setTimeoutSeconds(source.getTimeoutSeconds());
        target.setLastError(source.getLastError());
        target.setNextRunAt(source.getNextRunAt());
        target.setCancelRequested(source.getCancelRequested());
        target.setClaimOwner(source.getClaimOwner());
        target.setClaimAt(source.getClaimAt());
        target.setLeaseUntil(source.getLeaseUntil());
        target.setExecutionAttempt(source.getExecutionAttempt());
        target.setVersion(source.getVersion());
        target.setCreatedBy(source.getCreatedBy());
        target.setCreatedAt(source.getCreatedAt());
        target.setStartedAt(source.getStartedAt());
        target.setCompletedAt(source.getCompletedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}

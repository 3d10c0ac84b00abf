package com.agentcores.trigger.job;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.ClaimStatus;
import com.agentcores.domain.task.model.valobj.TaskClaimResult;
import com.agentcores.domain.tenant.adapter.repository.ITenantRepository;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.trigger.application.command.TaskExecutionApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Task executor: 拉取可调度的 PENDING 任务，claim 后交给工作线程池执行。
 * <p>
 * 候选按 (priority desc, created_at asc) 排序，单轮 claim 数受 claim-batch-size 与线程池空闲容量限制。
 * 仓储只返回仍有配额的 active 租户的任务；同一轮内某租户配额用尽后，其余候选直接跳过。
 * </p>
 */
@Slf4j
@Component
public class TaskExecutor {

    private final IAgentTaskRepository agentTaskRepository;
    private final ITenantRepository tenantRepository;
    private final TaskExecutionApplicationService taskExecutionApplicationService;
    private final int claimBatchSize;

    public TaskExecutor(IAgentTaskRepository agentTaskRepository,
                        ITenantRepository tenantRepository,
                        TaskExecutionApplicationService taskExecutionApplicationService,
                        @Value("${executor.claim-batch-size:16}") int claimBatchSize) {
        this.agentTaskRepository = agentTaskRepository;
        this.tenantRepository = tenantRepository;
        this.taskExecutionApplicationService = taskExecutionApplicationService;
        this.claimBatchSize = claimBatchSize > 0 ? claimBatchSize : 16;
    }

    @Scheduled(fixedDelayString = "${executor.poll-interval-ms:1000}", scheduler = "taskExecutorScheduler")
    public void executePendingTasks() {
        int slots = Math.min(claimBatchSize, taskExecutionApplicationService.availableSlots());
        if (slots <= 0) {
            return;
        }
        List<AgentTaskEntity> candidates = agentTaskRepository.findDispatchCandidates(slots);
        if (candidates == null || candidates.isEmpty()) {
            return;
        }

        Map<Long, TenantEntity> tenants = new HashMap<>();
        Set<Long> saturatedTenants = new HashSet<>();
        int claimed = 0;
        for (AgentTaskEntity candidate : candidates) {
            if (claimed >= slots) {
                break;
            }
            if (saturatedTenants.contains(candidate.getTenantId())) {
                continue;
            }
            TenantEntity tenant = tenants.computeIfAbsent(candidate.getTenantId(), tenantRepository::findById);
            if (tenant == null || !tenant.isActive()) {
                continue;
            }
            try {
                TaskClaimResult result = taskExecutionApplicationService.claim(
                        TenantContext.worker(candidate.getTenantId()), candidate.getId(),
                        tenant.hourlyTaskLimit(), "scheduler");
                if (result.isClaimed()) {
                    taskExecutionApplicationService.launch(result.task());
                    claimed++;
                } else if (result.status() == ClaimStatus.QUOTA_EXCEEDED) {
                    saturatedTenants.add(candidate.getTenantId());
                }
            } catch (Exception ex) {
                log.warn("TASK_CLAIM_FAILED tenantId={}, taskId={}, error={}",
                        candidate.getTenantId(), candidate.getId(), ex.getMessage());
            }
        }
        if (claimed > 0) {
            log.debug("TASK_POLL_ROUND candidates={}, claimed={}, inFlight={}",
                    candidates.size(), claimed, taskExecutionApplicationService.inFlightCount());
        }
    }
}

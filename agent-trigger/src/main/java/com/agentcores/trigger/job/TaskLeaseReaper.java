package com.agentcores.trigger.job;

import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.trigger.application.command.TaskExecutionApplicationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 租约回收守护进程：RUNNING 且 lease_until 已过的任务按租约过期失败处理。
 * <p>
 * 覆盖执行进程崩溃或回写失败的场景，任一实例都可以回收。每轮先放弃本进程在途、
 * 但已被其他实例登记取消的执行。
 * </p>
 */
@Slf4j
@Component
public class TaskLeaseReaper {

    private final IAgentTaskRepository agentTaskRepository;
    private final TaskExecutionApplicationService taskExecutionApplicationService;
    private final int batchSize;
    private final Counter reclaimedCounter;

    public TaskLeaseReaper(IAgentTaskRepository agentTaskRepository,
                           TaskExecutionApplicationService taskExecutionApplicationService,
                           @Value("${executor.reaper.batch-size:100}") int batchSize) {
        this.agentTaskRepository = agentTaskRepository;
        this.taskExecutionApplicationService = taskExecutionApplicationService;
        this.batchSize = batchSize > 0 ? batchSize : 100;
        this.reclaimedCounter = Counter.builder("agentcores.task.lease.reclaimed.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${executor.reaper.poll-interval-ms:5000}", scheduler = "daemonScheduler")
    public void reclaimExpiredLeases() {
        try {
            int abandoned = taskExecutionApplicationService.abandonRemotelyCancelled();
            if (abandoned > 0) {
                log.info("TASK_CANCELLED_EXECUTIONS_ABANDONED instanceId={}, count={}",
                        taskExecutionApplicationService.getInstanceId(), abandoned);
            }
        } catch (Exception ex) {
            log.warn("TASK_CANCEL_SWEEP_FAILED instanceId={}, error={}",
                    taskExecutionApplicationService.getInstanceId(), ex.getMessage());
        }
        List<AgentTaskEntity> expired = agentTaskRepository.findExpiredRunning(batchSize);
        if (expired == null || expired.isEmpty()) {
            return;
        }
        for (AgentTaskEntity task : expired) {
            try {
                if (taskExecutionApplicationService.reclaimExpired(task)) {
                    reclaimedCounter.increment();
                    log.info("TASK_LEASE_RECLAIMED tenantId={}, taskId={}, owner={}, attempt={}, leaseUntil={}",
                            task.getTenantId(), task.getId(), task.getClaimOwner(), task.getExecutionAttempt(),
                            task.getLeaseUntil());
                }
            } catch (Exception ex) {
                log.warn("TASK_LEASE_RECLAIM_FAILED tenantId={}, taskId={}, error={}",
                        task.getTenantId(), task.getId(), ex.getMessage());
            }
        }
    }
}

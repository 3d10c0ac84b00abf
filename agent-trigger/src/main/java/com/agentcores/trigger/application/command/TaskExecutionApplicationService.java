package com.agentcores.trigger.application.command;

import com.agentcores.domain.agent.adapter.repository.IAgentRepository;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.ClaimStatus;
import com.agentcores.domain.task.model.valobj.DispatchError;
import com.agentcores.domain.task.model.valobj.DispatchOutcome;
import com.agentcores.domain.task.model.valobj.TaskClaimResult;
import com.agentcores.domain.task.service.TaskDispatchDomainService;
import com.agentcores.domain.task.service.TaskLifecycleDomainService;
import com.agentcores.domain.task.service.TaskLifecycleDomainService.Decision;
import com.agentcores.types.enums.AgentStatusEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskStatusEnum;
import com.agentcores.types.enums.TaskTypeEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

/**
 * 任务执行应用服务：claim、提交执行、超时看门狗与结果回写。
 * <p>
 * 手动 execute 与后台轮询共用同一条路径。执行结果只通过带 claim_owner + execution_attempt
 * 条件的回写落库，看门狗、执行线程与租约回收三方竞争同一次执行时只有一方生效。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-07
 */
@Slf4j
@Service
public class TaskExecutionApplicationService {

    private static final String ACTOR_SCHEDULER = "scheduler";

    private final IAgentTaskRepository agentTaskRepository;
    private final IAgentRepository agentRepository;
    private final IAuditLogRepository auditLogRepository;
    private final TaskDispatchDomainService taskDispatchDomainService;
    private final TaskLifecycleDomainService taskLifecycleDomainService;
    private final ThreadPoolExecutor taskExecutionWorker;
    private final TaskScheduler watchdogScheduler;
    private final String instanceId;

    private final Map<Long, RunningExecution> inFlight = new ConcurrentHashMap<>();
    private final Map<ClaimStatus, Counter> claimCounters = new EnumMap<>(ClaimStatus.class);
    private final Map<TaskStatusEnum, Counter> transitionCounters = new EnumMap<>(TaskStatusEnum.class);

    public TaskExecutionApplicationService(IAgentTaskRepository agentTaskRepository,
                                           IAgentRepository agentRepository,
                                           IAuditLogRepository auditLogRepository,
                                           TaskDispatchDomainService taskDispatchDomainService,
                                           TaskLifecycleDomainService taskLifecycleDomainService,
                                           @Qualifier("taskExecutionWorker") ThreadPoolExecutor taskExecutionWorker,
                                           @Qualifier("taskWatchdogScheduler") TaskScheduler watchdogScheduler,
                                           @Value("${executor.instance-id:}") String instanceId) {
        this.agentTaskRepository = agentTaskRepository;
        this.agentRepository = agentRepository;
        this.auditLogRepository = auditLogRepository;
        this.taskDispatchDomainService = taskDispatchDomainService;
        this.taskLifecycleDomainService = taskLifecycleDomainService;
        this.taskExecutionWorker = taskExecutionWorker;
        this.watchdogScheduler = watchdogScheduler;
        this.instanceId = StringUtils.isNotBlank(instanceId) ? instanceId.trim() : defaultInstanceId();
        for (ClaimStatus status : ClaimStatus.values()) {
            claimCounters.put(status, Counter.builder("agentcores.task.claims")
                    .tag("outcome", status.name().toLowerCase())
                    .register(Metrics.globalRegistry));
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            transitionCounters.put(status, Counter.builder("agentcores.task.transitions")
                    .tag("to", status.getCode())
                    .register(Metrics.globalRegistry));
        }
        log.info("TASK_EXECUTOR_READY instanceId={}", this.instanceId);
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * 工作线程池的空闲容量，轮询按此限制单次 claim 数量。
     */
    public int availableSlots() {
        int busy = taskExecutionWorker.getActiveCount() + taskExecutionWorker.getQueue().size();
        int capacity = taskExecutionWorker.getMaximumPoolSize() + taskExecutionWorker.getQueue().remainingCapacity();
        return Math.max(capacity - busy, 0);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * 原子 claim；成功时记录 pending -> running 流转并把 Agent 置为 running。
     *
     * @param trigger 触发来源：manual / scheduler
     */
    public TaskClaimResult claim(TenantContext context, Long taskId, int maxTasksPerHour, String trigger) {
        TaskClaimResult result = agentTaskRepository.claimWithAdmission(context, taskId, instanceId, maxTasksPerHour);
        claimCounters.get(result.status()).increment();
        if (!result.isClaimed()) {
            log.debug("TASK_CLAIM_SKIPPED tenantId={}, taskId={}, outcome={}, trigger={}",
                    context.tenantId(), taskId, result.status(), trigger);
            return result;
        }
        AgentTaskEntity task = result.task();
        auditLogRepository.append(AuditLogEntity.transition(task.getTenantId(), context.userId(), task.getId(),
                        TaskStatusEnum.PENDING.getCode(), TaskStatusEnum.RUNNING.getCode(), trigger)
                .with("attempt", task.getExecutionAttempt())
                .with("owner", instanceId));
        transitionCounters.get(TaskStatusEnum.RUNNING).increment();
        agentRepository.transitionStatus(context, task.getAgentId(), AgentStatusEnum.IDLE, AgentStatusEnum.RUNNING);
        log.info("TASK_TRANSITION tenantId={}, taskId={}, from=pending, to=running, attempt={}, owner={}, trigger={}",
                task.getTenantId(), task.getId(), task.getExecutionAttempt(), instanceId, trigger);
        return result;
    }

    /**
     * 把已 claim 的任务交给工作线程执行，并按 timeout_seconds 布置看门狗。
     */
    public void launch(AgentTaskEntity task) {
        RunningExecution execution = new RunningExecution(task);
        inFlight.put(task.getId(), execution);
        // 看门狗先于提交布置，settle 总能看到并取消它
        Instant deadline = Instant.now().plusSeconds(Math.max(execution.timeoutSeconds, 1));
        execution.watchdog = watchdogScheduler.schedule(() -> onDeadline(execution), deadline);
        try {
            execution.future = taskExecutionWorker.submit(() -> run(execution));
        } catch (RejectedExecutionException ex) {
            log.warn("TASK_WORKER_REJECTED tenantId={}, taskId={}, active={}, max={}",
                    task.getTenantId(), task.getId(), taskExecutionWorker.getActiveCount(),
                    taskExecutionWorker.getMaximumPoolSize());
            DispatchError error = DispatchError.of(ResponseCode.EXECUTION_ERROR, "Worker pool saturated");
            settle(execution, (current, now) -> taskLifecycleDomainService.applyFailure(current, error, now),
                    "worker_rejected");
        }
    }

    /**
     * 取消请求已登记后调用：本进程持有该任务时直接收尾为 cancelled 并中断执行线程。
     *
     * @return 本次调用是否完成了取消收尾
     */
    public boolean abandonCancelled(Long taskId) {
        RunningExecution local = inFlight.get(taskId);
        if (local == null) {
            return false;
        }
        log.info("TASK_EXECUTION_ABANDONED tenantId={}, taskId={}, attempt={}",
                local.tenantId, local.taskId, local.attempt);
        if (!settle(local, taskLifecycleDomainService::applyCancelled, "cancel_requested")) {
            return false;
        }
        interrupt(local);
        return true;
    }

    /**
     * 巡检本进程在途执行，放弃已被其他实例登记取消的任务。
     *
     * @return 放弃的执行数
     */
    public int abandonRemotelyCancelled() {
        int abandoned = 0;
        for (RunningExecution execution : List.copyOf(inFlight.values())) {
            if (execution.settled.get()) {
                continue;
            }
            AgentTaskEntity current = agentTaskRepository.findById(TenantContext.worker(execution.tenantId),
                    execution.taskId);
            if (current != null && current.isCancelRequested()
                    && current.isClaimOwner(instanceId, execution.attempt)
                    && abandonCancelled(execution.taskId)) {
                abandoned++;
            }
        }
        return abandoned;
    }

    /**
     * 租约回收：本进程仍在执行的先中断，再按 lease_expired 处理。
     */
    public boolean reclaimExpired(AgentTaskEntity task) {
        RunningExecution local = inFlight.get(task.getId());
        if (local != null && local.attempt.equals(task.getExecutionAttempt())) {
            onDeadline(local);
            return true;
        }
        return finalizeClaimed(TenantContext.worker(task.getTenantId()), task.getId(), task.getClaimOwner(),
                task.getExecutionAttempt(), taskLifecycleDomainService::applyLeaseExpired, "lease_expired");
    }

    private void run(RunningExecution execution) {
        if (execution.settled.get()) {
            // 排队期间已被取消或超时收尾
            return;
        }
        long startedAt = System.currentTimeMillis();
        DispatchOutcome outcome = dispatchSafely(execution);
        log.info("TASK_DISPATCH_DONE tenantId={}, taskId={}, taskType={}, success={}, costMs={}",
                execution.tenantId, execution.taskId, execution.taskType.getCode(), outcome.isSuccess(),
                System.currentTimeMillis() - startedAt);
        settle(execution, (current, now) -> taskLifecycleDomainService.applyOutcome(current, outcome, now), "dispatch");
    }

    private DispatchOutcome dispatchSafely(RunningExecution execution) {
        try {
            return taskDispatchDomainService.dispatch(execution.taskType, execution.inputData,
                    Duration.ofSeconds(execution.timeoutSeconds));
        } catch (RuntimeException ex) {
            log.error("TASK_DISPATCH_CRASHED tenantId={}, taskId={}, error={}",
                    execution.tenantId, execution.taskId, ex.getMessage(), ex);
            return DispatchOutcome.failure(DispatchError.of(ResponseCode.EXECUTION_ERROR,
                    StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName())));
        }
    }

    private void onDeadline(RunningExecution execution) {
        if (execution.settled.get()) {
            return;
        }
        log.warn("TASK_DEADLINE_REACHED tenantId={}, taskId={}, timeoutSeconds={}",
                execution.tenantId, execution.taskId, execution.timeoutSeconds);
        settle(execution, taskLifecycleDomainService::applyTimeout, "timeout");
        interrupt(execution);
    }

    private void interrupt(RunningExecution execution) {
        Future<?> future = execution.future;
        if (future != null) {
            future.cancel(true);
        }
    }

    private boolean settle(RunningExecution execution,
                           BiFunction<AgentTaskEntity, LocalDateTime, Decision> applier,
                           String cause) {
        if (!execution.settled.compareAndSet(false, true)) {
            return false;
        }
        try {
            return finalizeClaimed(TenantContext.worker(execution.tenantId), execution.taskId, instanceId,
                    execution.attempt, applier, cause);
        } catch (RuntimeException ex) {
            // 回写失败时任务保持 running，租约到期后由回收任务处理
            log.error("TASK_SETTLE_FAILED tenantId={}, taskId={}, attempt={}, cause={}, error={}",
                    execution.tenantId, execution.taskId, execution.attempt, cause, ex.getMessage(), ex);
            return false;
        } finally {
            inFlight.remove(execution.taskId, execution);
            ScheduledFuture<?> watchdog = execution.watchdog;
            if (watchdog != null) {
                watchdog.cancel(false);
            }
        }
    }

    /**
     * 重新加载并校验 claim 归属后应用决策。回写因取消请求落空时再尝试一次，
     * 第二轮会走取消收尾。
     */
    private boolean finalizeClaimed(TenantContext context,
                                    Long taskId,
                                    String owner,
                                    Integer attempt,
                                    BiFunction<AgentTaskEntity, LocalDateTime, Decision> applier,
                                    String cause) {
        for (int round = 0; round < 2; round++) {
            AgentTaskEntity task = agentTaskRepository.findById(context, taskId);
            if (task == null || task.getStatus() != TaskStatusEnum.RUNNING || !task.isClaimOwner(owner, attempt)) {
                log.info("TASK_RESULT_DISCARDED tenantId={}, taskId={}, owner={}, attempt={}, cause={}, currentStatus={}",
                        context.tenantId(), taskId, owner, attempt, cause,
                        task == null || task.getStatus() == null ? null : task.getStatus().getCode());
                return false;
            }
            Decision decision = applier.apply(task, LocalDateTime.now());
            if (agentTaskRepository.updateClaimedTaskState(task)) {
                recordTransition(task, decision, cause);
                releaseAgent(context, task.getAgentId());
                return true;
            }
        }
        log.warn("TASK_WRITEBACK_ABANDONED tenantId={}, taskId={}, owner={}, attempt={}, cause={}",
                context.tenantId(), taskId, owner, attempt, cause);
        return false;
    }

    private void recordTransition(AgentTaskEntity task, Decision decision, String cause) {
        String effectiveCause = decision == Decision.CANCELLED ? "cancel_requested" : cause;
        TaskStatusEnum from = TaskStatusEnum.RUNNING;
        for (TaskStatusEnum to : decision.path()) {
            auditLogRepository.append(AuditLogEntity.transition(task.getTenantId(), null, task.getId(),
                            from.getCode(), to.getCode(), effectiveCause)
                    .with("actor", ACTOR_SCHEDULER)
                    .with("retry_count", task.normalizedRetryCount())
                    .with("error", to == TaskStatusEnum.FAILED ? task.getLastError() : null));
            transitionCounters.get(to).increment();
            from = to;
        }
        log.info("TASK_TRANSITION tenantId={}, taskId={}, from=running, to={}, decision={}, retryCount={}, maxRetries={}, nextRunAt={}, cause={}",
                task.getTenantId(), task.getId(), decision.finalStatus().getCode(), decision,
                task.normalizedRetryCount(), task.normalizedMaxRetries(), task.getNextRunAt(), effectiveCause);
    }

    private void releaseAgent(TenantContext context, Long agentId) {
        if (agentTaskRepository.countRunningByAgent(context, agentId) == 0) {
            agentRepository.transitionStatus(context, agentId, AgentStatusEnum.RUNNING, AgentStatusEnum.IDLE);
        }
    }

    private static String defaultInstanceId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            host = "unknown-host";
        }
        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());
        return host + "-" + pid + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * 一次 claim 对应的执行现场。
     */
    private static final class RunningExecution {

        private final Long tenantId;
        private final Long taskId;
        private final Integer attempt;
        private final TaskTypeEnum taskType;
        private final Map<String, Object> inputData;
        private final int timeoutSeconds;
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private volatile Future<?> future;
        private volatile ScheduledFuture<?> watchdog;

        private RunningExecution(AgentTaskEntity task) {
            this.tenantId = task.getTenantId();
            this.taskId = task.getId();
            this.attempt = task.getExecutionAttempt();
            this.taskType = task.getTaskType();
            this.inputData = task.getInputData();
            this.timeoutSeconds = task.getTimeoutSeconds() == null ? 1 : task.getTimeoutSeconds();
        }
    }
}

package com.agentcores.trigger.application.command;

import com.agentcores.api.dto.TaskActionResponseDTO;
import com.agentcores.api.dto.TaskCreateRequestDTO;
import com.agentcores.api.dto.TaskDetailDTO;
import com.agentcores.domain.agent.adapter.repository.IAgentRepository;
import com.agentcores.domain.agent.model.entity.AgentEntity;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.domain.task.model.valobj.TaskClaimResult;
import com.agentcores.domain.task.service.TaskInputDomainService;
import com.agentcores.domain.tenant.adapter.repository.ITenantRepository;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.trigger.application.common.TaskDetailViewAssembler;
import com.agentcores.types.common.Constants;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TaskPriorityEnum;
import com.agentcores.types.enums.TaskStatusEnum;
import com.agentcores.types.enums.TaskTypeEnum;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;

/**
 * Task 写用例：创建、手动执行、取消。
 * <p>
 * execute 只负责 pending -> running 的准入，真正的执行交给 {@link TaskExecutionApplicationService}；
 * 配额用尽或仍在退避期时任务保持 pending，对调用方不是错误。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-07
 */
@Slf4j
@Service
public class TaskLifecycleCommandService {

    public static final String ACTION_EXECUTE = "execute";
    public static final String ACTION_CANCEL = "cancel";

    private final IAgentTaskRepository agentTaskRepository;
    private final IAgentRepository agentRepository;
    private final ITenantRepository tenantRepository;
    private final IAuditLogRepository auditLogRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final TaskInputDomainService taskInputDomainService;
    private final TaskExecutionApplicationService taskExecutionApplicationService;
    private final TaskDetailViewAssembler taskDetailViewAssembler;

    public TaskLifecycleCommandService(IAgentTaskRepository agentTaskRepository,
                                       IAgentRepository agentRepository,
                                       ITenantRepository tenantRepository,
                                       IAuditLogRepository auditLogRepository,
                                       AuthorizationGuardDomainService authorizationGuard,
                                       TaskInputDomainService taskInputDomainService,
                                       TaskExecutionApplicationService taskExecutionApplicationService,
                                       TaskDetailViewAssembler taskDetailViewAssembler) {
        this.agentTaskRepository = agentTaskRepository;
        this.agentRepository = agentRepository;
        this.tenantRepository = tenantRepository;
        this.auditLogRepository = auditLogRepository;
        this.authorizationGuard = authorizationGuard;
        this.taskInputDomainService = taskInputDomainService;
        this.taskExecutionApplicationService = taskExecutionApplicationService;
        this.taskDetailViewAssembler = taskDetailViewAssembler;
    }

    public TaskDetailDTO create(TenantContext context, TaskCreateRequestDTO request) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.CREATE_TASKS, "task");
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        if (request.getAgentId() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "agent_id is required");
        }
        TaskTypeEnum taskType = TaskTypeEnum.fromText(request.getTaskType());
        if (taskType == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "task_type is required");
        }
        int priority = TaskPriorityEnum.resolve(request.getPriority());
        int timeoutSeconds = request.getTimeoutSeconds() == null
                ? Constants.DEFAULT_TIMEOUT_SECONDS : request.getTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "timeout_seconds must be positive");
        }
        int maxRetries = request.getMaxRetries() == null ? Constants.DEFAULT_MAX_RETRIES : request.getMaxRetries();
        if (maxRetries < 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "max_retries must be non-negative");
        }
        // 结构错误在创建时拒绝
        taskInputDomainService.parse(taskType, request.getInputData());

        AgentEntity agent = agentRepository.findById(context, request.getAgentId());
        if (agent == null || agent.isTerminated()) {
            throw new AppException(ResponseCode.RESOURCE_NOT_FOUND, "Agent not found");
        }
        if (!agent.acceptsTasks()) {
            throw new AppException(ResponseCode.INVALID_TRANSITION,
                    "Agent " + agent.getId() + " is " + agent.getStatus().getCode() + " and does not accept tasks");
        }

        AgentTaskEntity task = new AgentTaskEntity();
        task.setTenantId(context.tenantId());
        task.setAgentId(agent.getId());
        task.setTaskType(taskType);
        task.setPriority(priority);
        task.setStatus(TaskStatusEnum.PENDING);
        task.setInputData(request.getInputData() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(request.getInputData()));
        task.setRetryCount(0);
        task.setMaxRetries(maxRetries);
        task.setTimeoutSeconds(timeoutSeconds);
        task.setCancelRequested(false);
        task.setExecutionAttempt(0);
        task.setCreatedBy(context.userId());
        AgentTaskEntity saved = agentTaskRepository.save(task);

        log.info("TASK_CREATED tenantId={}, taskId={}, agentId={}, taskType={}, priority={}, maxRetries={}, timeoutSeconds={}",
                context.tenantId(), saved.getId(), agent.getId(), taskType.getCode(), priority, maxRetries, timeoutSeconds);
        return taskDetailViewAssembler.toTaskDetailDTO(saved);
    }

    /**
     * 手动请求 pending -> running。
     */
    public TaskActionResponseDTO execute(TenantContext context, Long taskId) {
        AgentTaskEntity task = agentTaskRepository.findById(context, taskId);
        authorizationGuard.require(context, CapabilityEnum.EXECUTE_TASKS,
                task == null ? null : task.getTenantId(), "task", taskId);

        TenantEntity tenant = tenantRepository.findCurrent(context);
        int hourlyLimit = tenant == null ? 0 : tenant.hourlyTaskLimit();
        TaskClaimResult result = taskExecutionApplicationService.claim(context, taskId, hourlyLimit, "manual");
        switch (result.status()) {
            case CLAIMED -> {
                taskExecutionApplicationService.launch(result.task());
                return taskDetailViewAssembler.toActionResponse(taskId, ACTION_EXECUTE,
                        TaskStatusEnum.RUNNING.getCode(), true, "Task claimed and dispatched");
            }
            case QUOTA_EXCEEDED -> {
                return taskDetailViewAssembler.toActionResponse(taskId, ACTION_EXECUTE,
                        TaskStatusEnum.PENDING.getCode(), false, "Hourly task quota reached, task stays pending");
            }
            case DEFERRED -> {
                return taskDetailViewAssembler.toActionResponse(taskId, ACTION_EXECUTE,
                        TaskStatusEnum.PENDING.getCode(), false,
                        "Task is backing off until " + result.task().getNextRunAt());
            }
            case NOT_FOUND -> throw new AppException(ResponseCode.RESOURCE_NOT_FOUND);
            default -> {
                AgentTaskEntity current = result.task();
                throw rejectTransition(context, taskId, current, TaskStatusEnum.RUNNING);
            }
        }
    }

    /**
     * pending 直接取消；running 先登记取消请求，本进程持有执行时立即放弃并收尾为 cancelled，
     * 否则由持有租约的实例在下一次巡检时放弃。
     */
    public TaskActionResponseDTO cancel(TenantContext context, Long taskId) {
        AgentTaskEntity task = agentTaskRepository.findById(context, taskId);
        authorizationGuard.require(context, CapabilityEnum.CANCEL_TASKS,
                task == null ? null : task.getTenantId(), "task", taskId);

        try {
            task.cancel(LocalDateTime.now());
        } catch (AppException ex) {
            throw rejectTransition(context, taskId, task, TaskStatusEnum.CANCELLED);
        }

        if (task.getStatus() == TaskStatusEnum.CANCELLED && agentTaskRepository.cancelPending(context, taskId)) {
            auditLogRepository.append(AuditLogEntity.transition(context.tenantId(), context.userId(), taskId,
                    TaskStatusEnum.PENDING.getCode(), TaskStatusEnum.CANCELLED.getCode(), "user_cancel"));
            log.info("TASK_TRANSITION tenantId={}, taskId={}, from=pending, to=cancelled, operator={}",
                    context.tenantId(), taskId, context.userId());
            return taskDetailViewAssembler.toActionResponse(taskId, ACTION_CANCEL,
                    TaskStatusEnum.CANCELLED.getCode(), true, "Task cancelled");
        }
        // pending 在取消前被 claim 时同样走登记路径
        if (agentTaskRepository.requestCancel(context, taskId)) {
            auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                            AuditEventTypeEnum.TASK_TRANSITION, AuditOutcomeEnum.TRANSITION, "task", taskId)
                    .with("from", TaskStatusEnum.RUNNING.getCode())
                    .with("to", TaskStatusEnum.RUNNING.getCode())
                    .with("cause", "cancel_requested"));
            log.info("TASK_CANCEL_REQUESTED tenantId={}, taskId={}, operator={}",
                    context.tenantId(), taskId, context.userId());
            if (taskExecutionApplicationService.abandonCancelled(taskId)) {
                return taskDetailViewAssembler.toActionResponse(taskId, ACTION_CANCEL,
                        TaskStatusEnum.CANCELLED.getCode(), true, "Task cancelled, running execution abandoned");
            }
            // 由其他实例持有：其租约巡检会放弃该执行
            return taskDetailViewAssembler.toActionResponse(taskId, ACTION_CANCEL,
                    TaskStatusEnum.RUNNING.getCode(), true,
                    "Cancellation requested, the holding executor will abandon the execution");
        }
        throw rejectTransition(context, taskId, agentTaskRepository.findById(context, taskId), TaskStatusEnum.CANCELLED);
    }

    private AppException rejectTransition(TenantContext context,
                                          Long taskId,
                                          AgentTaskEntity current,
                                          TaskStatusEnum target) {
        String from = current == null || current.getStatus() == null ? null : current.getStatus().getCode();
        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                        AuditEventTypeEnum.TASK_TRANSITION_REJECTED, AuditOutcomeEnum.DENIED, "task", taskId)
                .with("from", from)
                .with("to", target.getCode())
                .with("cancel_requested", current == null ? null : current.isCancelRequested()));
        log.info("TASK_TRANSITION_REJECTED tenantId={}, taskId={}, from={}, to={}",
                context.tenantId(), taskId, from, target.getCode());
        return new AppException(ResponseCode.INVALID_TRANSITION,
                "Task " + taskId + " cannot transition from " + from + " to " + target.getCode());
    }
}

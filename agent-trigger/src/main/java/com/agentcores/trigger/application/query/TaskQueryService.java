package com.agentcores.trigger.application.query;

import com.agentcores.api.dto.TaskDetailDTO;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.task.adapter.repository.IAgentTaskRepository;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import com.agentcores.trigger.application.common.TaskDetailViewAssembler;
import com.agentcores.types.common.Constants;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.TaskStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Task 查询用例。
 */
@Service
public class TaskQueryService {

    private final IAgentTaskRepository agentTaskRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final TaskDetailViewAssembler taskDetailViewAssembler;

    public TaskQueryService(IAgentTaskRepository agentTaskRepository,
                            AuthorizationGuardDomainService authorizationGuard,
                            TaskDetailViewAssembler taskDetailViewAssembler) {
        this.agentTaskRepository = agentTaskRepository;
        this.authorizationGuard = authorizationGuard;
        this.taskDetailViewAssembler = taskDetailViewAssembler;
    }

    /**
     * @param status 可空，非法值抛 IllegalArgumentException
     * @param agentId 可空
     * @param limit 可空，默认 50，上限 500
     */
    public List<TaskDetailDTO> list(TenantContext context, String status, Long agentId, Integer limit) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.VIEW_TASKS, "task");
        TaskStatusEnum statusFilter = StringUtils.isBlank(status) ? null : TaskStatusEnum.fromCode(status);
        return agentTaskRepository.findByTenant(context, statusFilter, agentId, normalizeLimit(limit)).stream()
                .map(taskDetailViewAssembler::toTaskDetailDTO)
                .toList();
    }

    public TaskDetailDTO get(TenantContext context, Long taskId) {
        AgentTaskEntity task = agentTaskRepository.findById(context, taskId);
        authorizationGuard.require(context, CapabilityEnum.VIEW_TASKS,
                task == null ? null : task.getTenantId(), "task", taskId);
        return taskDetailViewAssembler.toTaskDetailDTO(task);
    }

    static int normalizeLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return Constants.DEFAULT_LIST_LIMIT;
        }
        return Math.min(limit, Constants.MAX_LIST_LIMIT);
    }
}

package com.agentcores.trigger.application.common;

import com.agentcores.api.dto.AuditLogDTO;
import com.agentcores.api.dto.TaskActionResponseDTO;
import com.agentcores.api.dto.TaskDetailDTO;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.task.model.entity.AgentTaskEntity;
import org.springframework.stereotype.Component;

/**
 * Task 详情视图组装器：统一 TaskDetailDTO / AuditLogDTO 映射。
 * <p>
 * 租约字段（claim_owner、lease_until、execution_attempt）属于执行器内部状态，不对外暴露。
 * </p>
 */
@Component
public class TaskDetailViewAssembler {

    public TaskDetailDTO toTaskDetailDTO(AgentTaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskDetailDTO dto = new TaskDetailDTO();
        dto.setId(task.getId());
        dto.setTenantId(task.getTenantId());
        dto.setAgentId(task.getAgentId());
        dto.setTaskType(task.getTaskType() == null ? null : task.getTaskType().getCode());
        dto.setPriority(task.getPriority());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setInputData(task.getInputData());
        dto.setOutputData(task.getOutputData());
        dto.setRetryCount(task.normalizedRetryCount());
        dto.setMaxRetries(task.getMaxRetries());
        dto.setTimeoutSeconds(task.getTimeoutSeconds());
        dto.setLastError(task.getLastError());
        dto.setNextRunAt(task.getNextRunAt());
        dto.setCancelRequested(task.isCancelRequested());
        dto.setCreatedBy(task.getCreatedBy());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setStartedAt(task.getStartedAt());
        dto.setCompletedAt(task.getCompletedAt());
        return dto;
    }

    public TaskActionResponseDTO toActionResponse(Long taskId,
                                                  String action,
                                                  String status,
                                                  boolean accepted,
                                                  String message) {
        TaskActionResponseDTO dto = new TaskActionResponseDTO();
        dto.setTaskId(taskId);
        dto.setAction(action);
        dto.setStatus(status);
        dto.setAccepted(accepted);
        dto.setMessage(message);
        return dto;
    }

    public AuditLogDTO toAuditLogDTO(AuditLogEntity entity) {
        AuditLogDTO dto = new AuditLogDTO();
        dto.setId(entity.getId());
        dto.setTenantId(entity.getTenantId());
        dto.setActorUserId(entity.getActorUserId());
        dto.setEventType(entity.getEventType() == null ? null : entity.getEventType().getCode());
        dto.setTargetType(entity.getTargetType());
        dto.setTargetId(entity.getTargetId());
        dto.setCapability(entity.getCapability() == null ? null : entity.getCapability().name());
        dto.setOutcome(entity.getOutcome() == null ? null : entity.getOutcome().getCode());
        dto.setDetail(entity.getDetail());
        dto.setCreatedAt(entity.getCreatedAt());
        return dto;
    }
}

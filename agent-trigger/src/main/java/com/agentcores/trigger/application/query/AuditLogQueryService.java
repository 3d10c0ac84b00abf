package com.agentcores.trigger.application.query;

import com.agentcores.api.dto.AuditLogDTO;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.trigger.application.common.TaskDetailViewAssembler;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 审计日志查询用例，按时间倒序。
 */
@Service
public class AuditLogQueryService {

    private final IAuditLogRepository auditLogRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final TaskDetailViewAssembler taskDetailViewAssembler;

    public AuditLogQueryService(IAuditLogRepository auditLogRepository,
                                AuthorizationGuardDomainService authorizationGuard,
                                TaskDetailViewAssembler taskDetailViewAssembler) {
        this.auditLogRepository = auditLogRepository;
        this.authorizationGuard = authorizationGuard;
        this.taskDetailViewAssembler = taskDetailViewAssembler;
    }

    public List<AuditLogDTO> list(TenantContext context, String eventType, String outcome, Integer limit) {
        authorizationGuard.requireInTenant(context, CapabilityEnum.VIEW_AUDIT_LOGS, "audit_log");
        AuditEventTypeEnum typeFilter = StringUtils.isBlank(eventType) ? null : AuditEventTypeEnum.fromCode(eventType);
        AuditOutcomeEnum outcomeFilter = StringUtils.isBlank(outcome) ? null : AuditOutcomeEnum.fromCode(outcome);
        return auditLogRepository.findRecent(context, typeFilter, outcomeFilter, TaskQueryService.normalizeLimit(limit))
                .stream()
                .map(taskDetailViewAssembler::toAuditLogDTO)
                .toList();
    }
}

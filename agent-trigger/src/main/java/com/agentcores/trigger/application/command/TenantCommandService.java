package com.agentcores.trigger.application.command;

import com.agentcores.api.dto.TenantDTO;
import com.agentcores.api.dto.TenantUpdateRequestDTO;
import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.tenant.adapter.repository.ITenantRepository;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.trigger.application.common.AccountViewAssembler;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 当前租户的查看与改名。等级与配额在注册时按等级默认值确定。
 */
@Slf4j
@Service
public class TenantCommandService {

    private final ITenantRepository tenantRepository;
    private final IAuditLogRepository auditLogRepository;
    private final AuthorizationGuardDomainService authorizationGuard;
    private final AccountViewAssembler accountViewAssembler;

    public TenantCommandService(ITenantRepository tenantRepository,
                                IAuditLogRepository auditLogRepository,
                                AuthorizationGuardDomainService authorizationGuard,
                                AccountViewAssembler accountViewAssembler) {
        this.tenantRepository = tenantRepository;
        this.auditLogRepository = auditLogRepository;
        this.authorizationGuard = authorizationGuard;
        this.accountViewAssembler = accountViewAssembler;
    }

    public TenantDTO current(TenantContext context) {
        TenantEntity tenant = tenantRepository.findCurrent(context);
        authorizationGuard.require(context, CapabilityEnum.VIEW_ORG_SETTINGS,
                tenant == null ? null : tenant.getId(), "tenant", context.tenantId());
        return accountViewAssembler.toTenant(tenant);
    }

    public TenantDTO rename(TenantContext context, TenantUpdateRequestDTO request) {
        TenantEntity tenant = tenantRepository.findCurrent(context);
        authorizationGuard.require(context, CapabilityEnum.MANAGE_ORG_SETTINGS,
                tenant == null ? null : tenant.getId(), "tenant", context.tenantId());
        String name = request == null ? null : StringUtils.trimToNull(request.getName());
        if (name == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "name is required");
        }
        if (StringUtils.equals(name, tenant.getName())) {
            return accountViewAssembler.toTenant(tenant);
        }
        if (!StringUtils.equalsIgnoreCase(name, tenant.getName())
                && tenantRepository.existsByNameOrSlug(name, null)) {
            throw new AppException(ResponseCode.DUPLICATE_TENANT);
        }
        String previous = tenant.getName();
        tenant.rename(name);
        TenantEntity updated = tenantRepository.update(context, tenant);
        auditLogRepository.append(AuditLogEntity.event(context.tenantId(), context.userId(),
                        AuditEventTypeEnum.TENANT_UPDATED, AuditOutcomeEnum.ALLOWED, "tenant", context.tenantId())
                .with("from", previous)
                .with("to", name));
        log.info("TENANT_RENAMED tenantId={}, operator={}", context.tenantId(), context.userId());
        return accountViewAssembler.toTenant(updated);
    }
}

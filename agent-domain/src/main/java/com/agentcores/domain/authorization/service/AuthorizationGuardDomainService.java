package com.agentcores.domain.authorization.service;

import com.agentcores.domain.audit.adapter.repository.IAuditLogRepository;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.model.valobj.AuthorizationDecision;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 授权守卫领域服务。
 * <p>
 * 判定顺序：
 * <ol>
 *   <li>资源租户与上下文租户不一致（或资源不存在）时拒绝为 TENANT_MISMATCH，与角色无关</li>
 *   <li>否则当且仅当角色持有该能力时允许</li>
 * </ol>
 * 每次判定（允许与拒绝）都写入审计日志。
 * </p>
 *
 * @author agentcores
 * @since 2026-03-03
 */
@Slf4j
@Service
public class AuthorizationGuardDomainService {

    private final IAuditLogRepository auditLogRepository;

    public AuthorizationGuardDomainService(IAuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    /**
     * 判定并记录审计。
     *
     * @param context 请求租户上下文
     * @param capability 所需能力
     * @param resourceTenantId 目标资源所属租户；按租户过滤后查不到的资源传 null
     * @param targetType 目标类型
     * @param targetId 目标 ID，集合操作传 null
     */
    public AuthorizationDecision check(TenantContext context,
                                       CapabilityEnum capability,
                                       Long resourceTenantId,
                                       String targetType,
                                       Object targetId) {
        AuthorizationDecision decision;
        if (!context.ownsTenant(resourceTenantId)) {
            decision = AuthorizationDecision.deny(capability, ResponseCode.TENANT_MISMATCH);
        } else if (PermissionTable.holds(context.role(), capability)) {
            decision = AuthorizationDecision.allow(capability);
        } else {
            decision = AuthorizationDecision.deny(capability, ResponseCode.PERMISSION_DENIED);
        }
        auditLogRepository.append(AuditLogEntity.authorization(context.tenantId(), context.userId(), capability,
                decision.allowed(), targetType, targetId, decision.reason()));
        if (!decision.allowed()) {
            log.info("AUTHZ_DENIED tenantId={}, userId={}, role={}, capability={}, targetType={}, targetId={}, reason={}",
                    context.tenantId(), context.userId(), context.role(), capability, targetType, targetId,
                    decision.reason());
        }
        return decision;
    }

    /**
     * 判定并在拒绝时抛出异常。
     */
    public void require(TenantContext context,
                        CapabilityEnum capability,
                        Long resourceTenantId,
                        String targetType,
                        Object targetId) {
        AuthorizationDecision decision = check(context, capability, resourceTenantId, targetType, targetId);
        if (!decision.allowed()) {
            throw decision.toException();
        }
    }

    /**
     * 租户集合级操作（列表、创建）的判定。
     */
    public void requireInTenant(TenantContext context, CapabilityEnum capability, String targetType) {
        require(context, capability, context.tenantId(), targetType, null);
    }
}

package com.agentcores.test.domain;

import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.model.valobj.AuthorizationDecision;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.test.support.InMemoryAuditLogRepository;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AuthorizationGuardDomainServiceTest {

    private InMemoryAuditLogRepository auditLogRepository;
    private AuthorizationGuardDomainService guard;

    @BeforeEach
    public void setUp() {
        this.auditLogRepository = new InMemoryAuditLogRepository();
        this.guard = new AuthorizationGuardDomainService(auditLogRepository);
    }

    @Test
    public void shouldDenyCrossTenantAccessEvenForOwner() {
        TenantContext owner = new TenantContext(1L, 100L, UserRoleEnum.OWNER, null);

        AuthorizationDecision decision = guard.check(owner, CapabilityEnum.VIEW_TASKS, 2L, "task", 55L);

        Assertions.assertFalse(decision.allowed());
        Assertions.assertEquals(ResponseCode.TENANT_MISMATCH, decision.denialCode());
        Assertions.assertEquals("tenant_mismatch", decision.reason());
    }

    @Test
    public void shouldTreatMissingResourceAsTenantMismatch() {
        TenantContext owner = new TenantContext(1L, 100L, UserRoleEnum.OWNER, null);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> guard.require(owner, CapabilityEnum.EXECUTE_TASKS, null, "task", 404L));

        Assertions.assertEquals(ResponseCode.TENANT_MISMATCH, ex.responseCode());
        Assertions.assertEquals(ResponseCode.RESOURCE_NOT_FOUND, ex.responseCode().exposed());
    }

    @Test
    public void shouldDenyMissingCapabilityInOwnTenant() {
        TenantContext viewer = new TenantContext(1L, 101L, UserRoleEnum.VIEWER, null);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> guard.requireInTenant(viewer, CapabilityEnum.CREATE_AGENTS, "agent"));

        Assertions.assertEquals(ResponseCode.PERMISSION_DENIED, ex.responseCode());
    }

    @Test
    public void shouldAuditEveryDecision() {
        TenantContext operator = new TenantContext(1L, 102L, UserRoleEnum.OPERATOR, null);

        guard.check(operator, CapabilityEnum.EXECUTE_TASKS, 1L, "task", 7L);
        guard.check(operator, CapabilityEnum.DELETE_AGENTS, 1L, "agent", 8L);
        guard.check(operator, CapabilityEnum.VIEW_TASKS, 9L, "task", 9L);

        List<AuditLogEntity> entries = auditLogRepository.all();
        Assertions.assertEquals(3, entries.size());
        Assertions.assertEquals(AuditOutcomeEnum.ALLOWED, entries.get(0).getOutcome());
        Assertions.assertEquals(CapabilityEnum.EXECUTE_TASKS, entries.get(0).getCapability());
        Assertions.assertEquals("7", entries.get(0).getTargetId());
        Assertions.assertEquals(AuditOutcomeEnum.DENIED, entries.get(1).getOutcome());
        Assertions.assertEquals("missing_capability", entries.get(1).getDetail().get("reason"));
        Assertions.assertEquals(AuditOutcomeEnum.DENIED, entries.get(2).getOutcome());
        Assertions.assertEquals("tenant_mismatch", entries.get(2).getDetail().get("reason"));
        // 跨租户拒绝记在请求方租户
        Assertions.assertEquals(1L, entries.get(2).getTenantId());
        Assertions.assertEquals(102L, entries.get(2).getActorUserId());
    }
}

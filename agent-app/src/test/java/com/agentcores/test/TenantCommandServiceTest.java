package com.agentcores.test;

import com.agentcores.api.dto.TenantDTO;
import com.agentcores.api.dto.TenantUpdateRequestDTO;
import com.agentcores.domain.audit.model.entity.AuditLogEntity;
import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.test.support.TenantWorld;
import com.agentcores.trigger.application.command.TenantCommandService;
import com.agentcores.types.enums.AuditEventTypeEnum;
import com.agentcores.types.enums.AuditOutcomeEnum;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TenantTierEnum;
import com.agentcores.types.enums.UserRoleEnum;
import com.agentcores.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TenantCommandServiceTest {

    private TenantWorld world;
    private TenantEntity tenant;
    private TenantCommandService service;

    @BeforeEach
    public void setUp() {
        this.world = new TenantWorld();
        this.tenant = world.createTenant("acme", TenantTierEnum.PROFESSIONAL);
        this.service = new TenantCommandService(world.tenantRepository, world.auditLogRepository, world.guard,
                world.accountViewAssembler);
    }

    @Test
    public void shouldShowCurrentTenantToRolesThatViewSettings() {
        TenantContext developer = world.member(tenant, UserRoleEnum.DEVELOPER);
        TenantContext analyst = world.member(tenant, UserRoleEnum.ANALYST);

        TenantDTO current = service.current(developer);

        Assertions.assertEquals(tenant.getId(), current.getId());
        Assertions.assertEquals("acme", current.getSlug());
        Assertions.assertEquals("professional", current.getTier());
        Assertions.assertEquals(5000, current.getMaxTasksPerHour());
        assertCode(ResponseCode.PERMISSION_DENIED, () -> service.current(analyst));
    }

    @Test
    public void shouldRequireManageOrgSettingsToRename() {
        TenantContext admin = world.member(tenant, UserRoleEnum.ADMIN);
        TenantContext owner = world.member(tenant, UserRoleEnum.OWNER);

        assertCode(ResponseCode.PERMISSION_DENIED, () -> service.rename(admin, renameRequest("Acme Holdings")));
        Assertions.assertEquals("acme", world.tenantRepository.findById(tenant.getId()).getName());
        Assertions.assertTrue(world.auditLogRepository.ofType(AuditEventTypeEnum.AUTHORIZATION).stream()
                .anyMatch(entry -> entry.getCapability() == CapabilityEnum.MANAGE_ORG_SETTINGS
                        && entry.getOutcome() == AuditOutcomeEnum.DENIED
                        && admin.userId().equals(entry.getActorUserId())));

        TenantDTO renamed = service.rename(owner, renameRequest("  Acme Holdings "));

        Assertions.assertEquals("Acme Holdings", renamed.getName());
        Assertions.assertEquals("acme", renamed.getSlug());
        List<AuditLogEntity> updates = world.auditLogRepository.ofType(AuditEventTypeEnum.TENANT_UPDATED);
        Assertions.assertEquals(1, updates.size());
        Assertions.assertEquals("acme", updates.get(0).getDetail().get("from"));
        Assertions.assertEquals("Acme Holdings", updates.get(0).getDetail().get("to"));
    }

    @Test
    public void shouldRejectBlankOrTakenNames() {
        world.createTenant("globex", TenantTierEnum.FREE);
        TenantContext owner = world.member(tenant, UserRoleEnum.OWNER);

        assertCode(ResponseCode.ILLEGAL_PARAMETER, () -> service.rename(owner, renameRequest("   ")));
        assertCode(ResponseCode.ILLEGAL_PARAMETER, () -> service.rename(owner, null));
        assertCode(ResponseCode.DUPLICATE_TENANT, () -> service.rename(owner, renameRequest("globex")));

        Assertions.assertEquals("ACME", service.rename(owner, renameRequest("ACME")).getName());
        Assertions.assertEquals("ACME", service.rename(owner, renameRequest("ACME")).getName());
        Assertions.assertEquals(1, world.auditLogRepository.ofType(AuditEventTypeEnum.TENANT_UPDATED).size());
    }

    private TenantUpdateRequestDTO renameRequest(String name) {
        TenantUpdateRequestDTO request = new TenantUpdateRequestDTO();
        request.setName(name);
        return request;
    }

    private void assertCode(ResponseCode expected, Runnable action) {
        AppException ex = Assertions.assertThrows(AppException.class, action::run);
        Assertions.assertEquals(expected, ex.responseCode());
    }
}

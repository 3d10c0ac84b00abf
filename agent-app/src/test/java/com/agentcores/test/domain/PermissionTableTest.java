package com.agentcores.test.domain;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.authorization.service.AuthorizationGuardDomainService;
import com.agentcores.domain.authorization.service.PermissionTable;
import com.agentcores.test.support.InMemoryAuditLogRepository;
import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.UserRoleEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

public class PermissionTableTest {

    @Test
    public void shouldGrantOwnerEveryCapabilityAndGuestNone() {
        Assertions.assertEquals(EnumSet.allOf(CapabilityEnum.class), PermissionTable.capabilitiesOf(UserRoleEnum.OWNER));
        Assertions.assertTrue(PermissionTable.capabilitiesOf(UserRoleEnum.GUEST).isEmpty());
        Assertions.assertTrue(PermissionTable.capabilitiesOf(null).isEmpty());
    }

    @Test
    public void shouldKeepOrgSettingsManagementForOwnerOnly() {
        for (UserRoleEnum role : UserRoleEnum.values()) {
            boolean holds = PermissionTable.holds(role, CapabilityEnum.MANAGE_ORG_SETTINGS);
            Assertions.assertEquals(role == UserRoleEnum.OWNER, holds, "role=" + role);
        }
    }

    @Test
    public void shouldAllowEverythingForSupersetRoleThatSubsetRoleIsAllowed() {
        AuthorizationGuardDomainService guard = new AuthorizationGuardDomainService(new InMemoryAuditLogRepository());
        for (UserRoleEnum weaker : UserRoleEnum.values()) {
            for (UserRoleEnum stronger : UserRoleEnum.values()) {
                Set<CapabilityEnum> weakerCaps = PermissionTable.capabilitiesOf(weaker);
                if (!PermissionTable.capabilitiesOf(stronger).containsAll(weakerCaps)) {
                    continue;
                }
                TenantContext weakerContext = new TenantContext(1L, 10L, weaker, null);
                TenantContext strongerContext = new TenantContext(1L, 11L, stronger, null);
                for (CapabilityEnum capability : CapabilityEnum.values()) {
                    if (guard.check(weakerContext, capability, 1L, "task", 1L).allowed()) {
                        Assertions.assertTrue(guard.check(strongerContext, capability, 1L, "task", 1L).allowed(),
                                weaker + " -> " + stronger + " on " + capability);
                    }
                }
            }
        }
    }

    @Test
    public void shouldExposeReadOnlyTable() {
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> PermissionTable.asMap().get(UserRoleEnum.VIEWER).add(CapabilityEnum.CREATE_AGENTS));
        Assertions.assertFalse(PermissionTable.holds(UserRoleEnum.VIEWER, CapabilityEnum.CREATE_AGENTS));
    }
}

package com.agentcores.test;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.domain.tenant.service.TenantQuotaDomainService;
import com.agentcores.infrastructure.dao.TenantDao;
import com.agentcores.infrastructure.repository.tenant.TenantRepositoryImpl;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TenantTierEnum;
import com.agentcores.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TenantRepositoryImplTest {

    private TenantDao tenantDao;
    private TenantRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        this.tenantDao = mock(TenantDao.class);
        this.repository = new TenantRepositoryImpl(tenantDao);
    }

    @Test
    public void shouldReportUniqueIndexConflictAsDuplicateTenant() {
        when(tenantDao.insert(any())).thenThrow(new DuplicateKeyException("uk_tenants_slug"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> repository.save(newTenant("acme")));

        Assertions.assertEquals(ResponseCode.DUPLICATE_TENANT, ex.responseCode());
    }

    @Test
    public void shouldReportRenameConflictAsDuplicateTenant() {
        when(tenantDao.updateWithVersion(any())).thenThrow(new DuplicateKeyException("uk_tenants_name"));
        TenantEntity tenant = newTenant("acme");
        tenant.setId(3L);
        tenant.setVersion(0);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> repository.update(new TenantContext(3L, 1L, null, null), tenant));

        Assertions.assertEquals(ResponseCode.DUPLICATE_TENANT, ex.responseCode());
    }

    @Test
    public void shouldLockTenantRowOfContext() {
        when(tenantDao.lockById(3L)).thenReturn(3L);

        repository.lockCurrent(TenantContext.worker(3L));

        verify(tenantDao).lockById(3L);
        AppException missing = Assertions.assertThrows(AppException.class,
                () -> repository.lockCurrent(TenantContext.worker(4L)));
        Assertions.assertEquals(ResponseCode.RESOURCE_NOT_FOUND, missing.responseCode());
    }

    private TenantEntity newTenant(String slug) {
        TenantEntity tenant = new TenantEntity();
        tenant.setName(slug);
        tenant.setSlug(slug);
        tenant.setTier(TenantTierEnum.FREE);
        tenant.applyQuota(TenantQuotaDomainService.defaultQuotaOf(TenantTierEnum.FREE));
        tenant.setActive(true);
        return tenant;
    }
}

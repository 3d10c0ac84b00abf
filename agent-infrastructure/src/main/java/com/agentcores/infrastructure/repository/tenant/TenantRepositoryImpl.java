package com.agentcores.infrastructure.repository.tenant;

import com.agentcores.domain.auth.model.valobj.TenantContext;
import com.agentcores.domain.tenant.adapter.repository.ITenantRepository;
import com.agentcores.domain.tenant.model.entity.TenantEntity;
import com.agentcores.infrastructure.dao.TenantDao;
import com.agentcores.infrastructure.dao.po.TenantPO;
import com.agentcores.types.enums.ResponseCode;
import com.agentcores.types.enums.TenantTierEnum;
import com.agentcores.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

/**
 * 租户仓储实现类。
 *
 * @author agentcores
 * @since 2026-03-05
 */
@Slf4j
@Repository
public class TenantRepositoryImpl implements ITenantRepository {

    private final TenantDao tenantDao;

    public TenantRepositoryImpl(TenantDao tenantDao) {
        this.tenantDao = tenantDao;
    }

    @Override
    public TenantEntity save(TenantEntity entity) {
        entity.validate();
        TenantPO po = toPO(entity);
        try {
            tenantDao.insert(po);
        } catch (DuplicateKeyException ex) {
            throw new AppException(ResponseCode.DUPLICATE_TENANT);
        }
        return toEntity(tenantDao.selectById(po.getId()));
    }

    @Override
    public TenantEntity update(TenantContext context, TenantEntity entity) {
        if (!context.ownsTenant(entity.getId())) {
            throw new AppException(ResponseCode.TENANT_MISMATCH);
        }
        entity.validate();
        try {
            if (tenantDao.updateWithVersion(toPO(entity)) == 0) {
                log.warn("TENANT_UPDATE_CONFLICT tenantId={}, version={}", entity.getId(), entity.getVersion());
                throw new AppException(ResponseCode.RESOURCE_BUSY, "Tenant was modified concurrently");
            }
        } catch (DuplicateKeyException ex) {
            throw new AppException(ResponseCode.DUPLICATE_TENANT);
        }
        return toEntity(tenantDao.selectById(entity.getId()));
    }

    @Override
    public TenantEntity findCurrent(TenantContext context) {
        return toEntity(tenantDao.selectById(context.tenantId()));
    }

    @Override
    public TenantEntity findById(Long id) {
        return id == null ? null : toEntity(tenantDao.selectById(id));
    }

    @Override
    public TenantEntity findBySlug(String slug) {
        return toEntity(tenantDao.selectBySlug(slug));
    }

    @Override
    public boolean existsByNameOrSlug(String name, String slug) {
        return tenantDao.countByNameOrSlug(name, slug) > 0;
    }

    @Override
    public void lockCurrent(TenantContext context) {
        if (tenantDao.lockById(context.tenantId()) == null) {
            throw new AppException(ResponseCode.RESOURCE_NOT_FOUND, "Tenant not found");
        }
    }

    private TenantEntity toEntity(TenantPO po) {
        if (po == null) {
            return null;
        }
        TenantEntity entity = new TenantEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setSlug(po.getSlug());
        entity.setTier(TenantTierEnum.fromCode(po.getTier()));
        entity.setMaxAgents(po.getMaxAgents());
        entity.setMaxTasksPerHour(po.getMaxTasksPerHour());
        entity.setActive(po.getActive());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private TenantPO toPO(TenantEntity entity) {
        return TenantPO.builder()
                .id(entity.getId())
                .name(entity.getName())
                .slug(entity.getSlug())
                .tier(entity.getTier() == null ? null : entity.getTier().getCode())
                .maxAgents(entity.getMaxAgents())
                .maxTasksPerHour(entity.getMaxTasksPerHour())
                .active(entity.getActive())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
